package com.tcgptracker.common.exception;

/**
 * Thrown when a card is not found.
 */
public class CardNotFoundException extends TrackerException {

    public CardNotFoundException(Long cardId) {
        super("Card not found: " + cardId);
    }

    public CardNotFoundException(Long cardId, String setNumber) {
        super(String.format("Card %s not found in set %s", cardId, setNumber));
    }
}

package com.tcgptracker.api.dto;

import lombok.Value;

/**
 * Collection status of a card after a collect or uncollect request.
 * The set-detail script reads {@code collected} to update the row icon.
 */
@Value
public class CollectionStatusResponse {
    String status;
    Long cardId;
    boolean collected;

    public static CollectionStatusResponse success(Long cardId, boolean collected) {
        return new CollectionStatusResponse("success", cardId, collected);
    }
}

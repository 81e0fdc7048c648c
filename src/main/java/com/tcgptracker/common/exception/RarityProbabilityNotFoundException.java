package com.tcgptracker.common.exception;

public class RarityProbabilityNotFoundException extends TrackerException {

    public RarityProbabilityNotFoundException(Long id) {
        super("Rarity probability not found: " + id);
    }
}

package com.tcgptracker.common.exception;

/**
 * Thrown when a slot probability lies outside [0, 1].
 */
public class InvalidProbabilityException extends TrackerException {

    public InvalidProbabilityException(int slot, double value) {
        super(String.format("Slot %d probability must be between 0 and 1, got %s", slot, value));
    }
}

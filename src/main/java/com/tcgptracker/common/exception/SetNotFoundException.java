package com.tcgptracker.common.exception;

/**
 * Thrown when a set is not found by its set number.
 */
public class SetNotFoundException extends TrackerException {

    public SetNotFoundException(String setNumber) {
        super("Set not found: " + setNumber);
    }
}

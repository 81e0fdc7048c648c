package com.tcgptracker.common.exception;

/**
 * Thrown when a collection request carries an action other than collect or uncollect.
 */
public class InvalidCollectionActionException extends TrackerException {

    private final String action;

    public InvalidCollectionActionException(String action) {
        super("Unsupported collection action: " + action);
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}

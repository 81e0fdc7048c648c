package com.tcgptracker.common.exception;

/**
 * Thrown when registering a username that is already taken.
 */
public class DuplicateUsernameException extends TrackerException {

    public DuplicateUsernameException(String username) {
        super("Username already taken: " + username);
    }
}

package com.tcgptracker.common.exception;

/**
 * Thrown when a user or a (public) profile is not found.
 */
public class UserNotFoundException extends TrackerException {

    public UserNotFoundException(String username) {
        super("User not found: " + username);
    }

    public UserNotFoundException(Long profileId) {
        super("Profile not found: " + profileId);
    }
}

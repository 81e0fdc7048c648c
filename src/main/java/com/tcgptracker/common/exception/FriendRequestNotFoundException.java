package com.tcgptracker.common.exception;

/**
 * Thrown when a pending friend request addressed to the current user does not exist.
 */
public class FriendRequestNotFoundException extends TrackerException {

    public FriendRequestNotFoundException(Long requestId) {
        super("Pending friend request not found: " + requestId);
    }
}

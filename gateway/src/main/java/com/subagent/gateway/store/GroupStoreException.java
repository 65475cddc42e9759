package com.subagent.gateway.store;

/** Persisted groups are missing, unreadable or malformed, or could not be written. */
public class GroupStoreException extends RuntimeException {

    public GroupStoreException(String message) {
        super(message);
    }

    public GroupStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.subagent.gateway.build;

/** The discovered tool catalog is missing, malformed or empty. */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}

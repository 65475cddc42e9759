package com.subagent.gateway.agent;

/** The loaded groups cannot form a registry: none at all, or two sharing an id. */
public class RegistryException extends RuntimeException {

    public RegistryException(String message) {
        super(message);
    }
}

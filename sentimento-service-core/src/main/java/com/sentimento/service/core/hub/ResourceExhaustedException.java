package com.sentimento.service.core.hub;

/** Raised when the registry cannot accept another connection. Existing connections are unaffected. */
public class ResourceExhaustedException extends RuntimeException {

    public ResourceExhaustedException(String message) {
        super(message);
    }
}

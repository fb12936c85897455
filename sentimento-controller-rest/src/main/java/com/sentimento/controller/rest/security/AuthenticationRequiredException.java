package com.sentimento.controller.rest.security;

/** No verified principal accompanied the request. Mapped to HTTP 401. */
public class AuthenticationRequiredException extends RuntimeException {

    public AuthenticationRequiredException(String message) {
        super(message);
    }
}

package com.sentimento.service.core.spi;

public class TokenVerificationException extends Exception {

    public TokenVerificationException(String message) {
        super(message);
    }

    public TokenVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

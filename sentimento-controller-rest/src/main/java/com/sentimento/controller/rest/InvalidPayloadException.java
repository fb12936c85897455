package com.sentimento.controller.rest;

import com.sentimento.service.core.ingest.ValidationError;

public class InvalidPayloadException extends RuntimeException {

    private final transient ValidationError error;

    public InvalidPayloadException(ValidationError error) {
        super(error.message());
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}

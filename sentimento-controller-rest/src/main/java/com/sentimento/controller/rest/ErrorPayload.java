package com.sentimento.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Error body returned by every REST endpoint: {@code {"error":"...","message":"..."}}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String error, String message) {

    public static ErrorPayload of(String error) {
        return new ErrorPayload(error, null);
    }
}

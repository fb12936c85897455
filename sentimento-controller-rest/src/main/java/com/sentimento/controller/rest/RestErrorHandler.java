package com.sentimento.controller.rest;

import com.sentimento.controller.rest.security.AccessDeniedException;
import com.sentimento.controller.rest.security.AuthenticationRequiredException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/** Global REST exception mapper. Produces the {@code {"error":..,"message":..}} bodies clients rely on. */
@RestControllerAdvice
@Slf4j
public class RestErrorHandler {

    static final String INVALID_PAYLOAD = "Invalid payload";

    @ExceptionHandler(InvalidPayloadException.class)
    public ResponseEntity<ErrorPayload> handleInvalidPayload(InvalidPayloadException ex) {
        return build(HttpStatus.BAD_REQUEST, new ErrorPayload(INVALID_PAYLOAD, ex.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorPayload> handleUnreadable(Exception ex) {
        log.info("Unreadable ingest body: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, new ErrorPayload(INVALID_PAYLOAD, "request body must be a JSON object"));
    }

    @ExceptionHandler(AuthenticationRequiredException.class)
    public ResponseEntity<ErrorPayload> handleUnauthenticated(AuthenticationRequiredException ex) {
        return build(HttpStatus.UNAUTHORIZED, ErrorPayload.of("Authentication required"));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorPayload> handleForbidden(AccessDeniedException ex) {
        return build(HttpStatus.FORBIDDEN, ErrorPayload.of(ex.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorPayload> handleBadRequest(Exception ex) {
        String message = ex instanceof MethodArgumentTypeMismatchException mismatch
                ? mismatch.getName() + " must be a positive integer"
                : ex.getMessage();
        return build(HttpStatus.BAD_REQUEST, new ErrorPayload("Invalid request", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorPayload> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework) {
            HttpStatusCode status = framework.getStatusCode();
            HttpStatus known = HttpStatus.resolve(status.value());
            String error = known != null ? known.getReasonPhrase() : "Request failed";
            return ResponseEntity.status(status).body(ErrorPayload.of(error));
        }
        log.error("Unhandled request failure", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, ErrorPayload.of("Internal server error"));
    }

    private static ResponseEntity<ErrorPayload> build(HttpStatus status, ErrorPayload body) {
        return ResponseEntity.status(status).body(body);
    }
}

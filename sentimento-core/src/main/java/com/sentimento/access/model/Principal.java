package com.sentimento.access.model;

import java.util.Objects;

/**
 * Caller identity produced by the external token verifier. Only the verified email and subject id are
 * carried; everything else the identity provider returns stays outside the hub.
 */
public record Principal(String email, String sub) {

    public Principal {
        Objects.requireNonNull(email, "email");
        if (email.isBlank()) {
            throw new IllegalArgumentException("principal email must not be blank");
        }
    }
}

package com.sentimento.controller.rest.security;

import com.sentimento.access.model.Role;

/** The caller is authenticated but its role is insufficient. Mapped to HTTP 403. */
public class AccessDeniedException extends RuntimeException {

    private final Role role;

    public AccessDeniedException(String message, Role role) {
        super(message);
        this.role = role;
    }

    public Role role() {
        return role;
    }
}

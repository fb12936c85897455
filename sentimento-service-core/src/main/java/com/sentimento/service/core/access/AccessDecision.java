package com.sentimento.service.core.access;

import com.sentimento.access.model.Principal;
import com.sentimento.access.model.Role;

public sealed interface AccessDecision permits AccessDecision.Allow, AccessDecision.Deny {

    record Allow(Principal principal, Role role) implements AccessDecision {}

    /**
     * @param role the caller's resolved role, {@code null} when there is no principal
     */
    record Deny(DenyReason reason, String message, Role role) implements AccessDecision {}

    default boolean allowed() {
        return this instanceof Allow;
    }
}

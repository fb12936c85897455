package com.sentimento.service.core.access;

import com.sentimento.access.model.Principal;
import com.sentimento.access.model.Role;
import com.sentimento.service.core.config.SentimentoProperties;
import java.util.Comparator;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Role-gated authorization for read endpoints. Works on an already verified {@link Principal}; token
 * verification happens elsewhere.
 */
@Component
@Slf4j
public class AccessGate {

    private final RoleResolver roles;

    @Autowired
    public AccessGate(SentimentoProperties properties) {
        this(new RoleResolver(
                properties.getAccess().getSeedbringerEmails(),
                properties.getAccess().getCouncilEmails()));
    }

    public AccessGate(RoleResolver roles) {
        this.roles = roles;
    }

    public Role resolveRole(String email) {
        return roles.resolveRole(email);
    }

    public AccessDecision authorize(Principal principal, Set<Role> requiredRoles) {
        if (requiredRoles == null || requiredRoles.isEmpty()) {
            throw new IllegalArgumentException("requiredRoles must not be empty");
        }
        if (principal == null) {
            return new AccessDecision.Deny(DenyReason.NO_PRINCIPAL, "Authentication required", null);
        }
        Role role = roles.resolveRole(principal.email());
        if (role != Role.UNAUTHORIZED && requiredRoles.contains(role)) {
            return new AccessDecision.Allow(principal, role);
        }
        log.info("Access denied principal={} role={} required={}", principal.email(), role, requiredRoles);
        return new AccessDecision.Deny(DenyReason.INSUFFICIENT_ROLE, deniedMessage(requiredRoles), role);
    }

    /** Names the least privileged role that would have been accepted, e.g. {@code "Council access required"}. */
    static String deniedMessage(Set<Role> requiredRoles) {
        Role weakest = requiredRoles.stream()
                .filter(r -> r != Role.UNAUTHORIZED)
                .min(Comparator.comparingInt(Role::rank))
                .orElse(Role.SEEDBRINGER);
        return weakest.displayName() + " access required";
    }
}

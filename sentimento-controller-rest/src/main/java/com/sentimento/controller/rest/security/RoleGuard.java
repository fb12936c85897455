package com.sentimento.controller.rest.security;

import com.sentimento.access.model.Principal;
import com.sentimento.access.model.Role;
import com.sentimento.service.core.access.AccessDecision;
import com.sentimento.service.core.access.AccessGate;
import com.sentimento.service.core.access.DenyReason;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Turns an {@link AccessGate} denial into the exception the error handler maps to 401 or 403. */
@Component
@RequiredArgsConstructor
public class RoleGuard {

    public static final Set<Role> SEEDBRINGER = Collections.unmodifiableSet(EnumSet.of(Role.SEEDBRINGER));
    public static final Set<Role> COUNCIL_OR_SEEDBRINGER =
            Collections.unmodifiableSet(EnumSet.of(Role.COUNCIL, Role.SEEDBRINGER));

    private final AccessGate accessGate;

    public AccessDecision.Allow require(HttpServletRequest request, Set<Role> roles) {
        Principal principal = PrincipalFilter.principalOf(request);
        AccessDecision decision = accessGate.authorize(principal, roles);
        if (decision instanceof AccessDecision.Allow allow) {
            return allow;
        }
        AccessDecision.Deny deny = (AccessDecision.Deny) decision;
        if (deny.reason() == DenyReason.NO_PRINCIPAL) {
            throw new AuthenticationRequiredException(deny.message());
        }
        throw new AccessDeniedException(deny.message(), deny.role());
    }
}

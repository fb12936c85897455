package com.sentimento.controller.rest.security;

import com.sentimento.access.model.Principal;
import com.sentimento.service.core.access.PrincipalResolver;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.MDC;

/**
 * Resolves the caller's {@link Principal} once per request and exposes it as the
 * {@link #PRINCIPAL_ATTRIBUTE} request attribute and the {@code principal} MDC key. Requests without
 * credentials pass through untouched; authorization is decided by the endpoint.
 */
public final class PrincipalFilter implements Filter {

    public static final String PRINCIPAL_ATTRIBUTE = PrincipalFilter.class.getName() + ".principal";
    static final String MDC_KEY = "principal";

    private final PrincipalResolver resolver;

    public PrincipalFilter(PrincipalResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        String prevPrincipal = MDC.get(MDC_KEY);
        try {
            if (request instanceof HttpServletRequest req) {
                Optional<Principal> principal =
                        resolver.resolve(req.getHeader("Authorization"), req.getHeader("X-User-Email"));
                if (principal.isPresent()) {
                    req.setAttribute(PRINCIPAL_ATTRIBUTE, principal.get());
                    MDC.put(MDC_KEY, principal.get().email());
                }
            }
            chain.doFilter(request, response);
        } finally {
            if (prevPrincipal == null) MDC.remove(MDC_KEY);
            else MDC.put(MDC_KEY, prevPrincipal);
        }
    }

    public static Principal principalOf(HttpServletRequest request) {
        Object value = request.getAttribute(PRINCIPAL_ATTRIBUTE);
        return value instanceof Principal p ? p : null;
    }
}

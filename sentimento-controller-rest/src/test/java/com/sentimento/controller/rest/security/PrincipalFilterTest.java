package com.sentimento.controller.rest.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.sentimento.access.model.Principal;
import com.sentimento.service.core.access.PrincipalResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class PrincipalFilterTest {

    private final PrincipalFilter filter =
            new PrincipalFilter(new PrincipalResolver(null, List.of("accounts.google.com"), true));

    @AfterEach
    void clear() {
        MDC.clear();
    }

    @Test
    void exposesPrincipalForTheRequestAndRestoresMdc() throws Exception {
        MDC.put("principal", "outer@example.org");
        MockHttpServletRequest req = new MockHttpServletRequest();
        req.addHeader("X-User-Email", "member@example.org");
        AtomicReference<String> mdcInside = new AtomicReference<>();
        AtomicReference<Principal> principalInside = new AtomicReference<>();

        filter.doFilter(req, new MockHttpServletResponse(), (FilterChain) (ServletRequest r, ServletResponse s) -> {
            mdcInside.set(MDC.get("principal"));
            principalInside.set(PrincipalFilter.principalOf((HttpServletRequest) r));
        });

        assertThat(mdcInside.get()).isEqualTo("member@example.org");
        assertThat(principalInside.get()).isEqualTo(new Principal("member@example.org", "member@example.org"));
        assertThat(MDC.get("principal")).isEqualTo("outer@example.org");
    }

    @Test
    void anonymousRequestsPassThrough() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest();
        AtomicReference<Principal> principalInside = new AtomicReference<>();

        filter.doFilter(req, new MockHttpServletResponse(), (FilterChain) (ServletRequest r, ServletResponse s) ->
                principalInside.set(PrincipalFilter.principalOf((HttpServletRequest) r)));

        assertThat(principalInside.get()).isNull();
        assertThat(MDC.get("principal")).isNull();
    }
}

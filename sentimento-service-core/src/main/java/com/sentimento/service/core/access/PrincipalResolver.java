package com.sentimento.service.core.access;

import com.sentimento.access.model.Principal;
import com.sentimento.service.core.config.SentimentoProperties;
import com.sentimento.service.core.spi.TokenVerificationException;
import com.sentimento.service.core.spi.TokenVerifier;
import com.sentimento.service.core.spi.VerifiedToken;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns request credentials into a {@link Principal}.
 *
 * <p>Bearer tokens go to the configured {@link TokenVerifier}; tokens from an issuer outside the
 * allowlist, or without an email claim, yield no principal. The trusted {@code X-User-Email} header is
 * honoured only when explicitly enabled for development.
 */
@Component
@Slf4j
public class PrincipalResolver {

    private final TokenVerifier verifier;
    private final Set<String> allowedIssuers;
    private final boolean headerPrincipalEnabled;

    @Autowired
    public PrincipalResolver(SentimentoProperties properties, ObjectProvider<TokenVerifier> verifier) {
        this(
                verifier.getIfAvailable(),
                properties.getAccess().getAllowedIssuers(),
                properties.getAccess().isHeaderPrincipalEnabled());
    }

    public PrincipalResolver(TokenVerifier verifier, List<String> allowedIssuers, boolean headerPrincipalEnabled) {
        this.verifier = verifier;
        this.allowedIssuers = allowedIssuers == null ? Set.of() : Set.copyOf(allowedIssuers);
        this.headerPrincipalEnabled = headerPrincipalEnabled;
        if (verifier == null) {
            log.warn("No TokenVerifier configured; bearer tokens will not authenticate");
        }
        if (headerPrincipalEnabled) {
            log.warn("Trusted X-User-Email header principal is enabled; do not use outside development");
        }
    }

    /**
     * @param authorizationHeader raw {@code Authorization} header value, may be {@code null}
     * @param userEmailHeader raw {@code X-User-Email} header value, may be {@code null}
     */
    public Optional<Principal> resolve(String authorizationHeader, String userEmailHeader) {
        String token = bearerToken(authorizationHeader);
        if (token != null) {
            return fromToken(token);
        }
        if (headerPrincipalEnabled && userEmailHeader != null && !userEmailHeader.isBlank()) {
            String email = userEmailHeader.trim();
            return Optional.of(new Principal(email, email));
        }
        return Optional.empty();
    }

    private Optional<Principal> fromToken(String token) {
        if (verifier == null) {
            return Optional.empty();
        }
        VerifiedToken verified;
        try {
            verified = verifier.verify(token);
        } catch (TokenVerificationException e) {
            log.info("Token verification failed: {}", e.getMessage());
            return Optional.empty();
        }
        if (verified == null || verified.email() == null || verified.email().isBlank()) {
            log.info("Verified token carries no email claim");
            return Optional.empty();
        }
        if (verified.issuer() != null && !allowedIssuers.contains(verified.issuer())) {
            log.warn("Token rejected for issuer={}", verified.issuer());
            return Optional.empty();
        }
        return Optional.of(new Principal(verified.email(), verified.sub()));
    }

    static String bearerToken(String authorizationHeader) {
        if (authorizationHeader == null) {
            return null;
        }
        String value = authorizationHeader.trim();
        if (value.length() <= 7 || !value.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        String token = value.substring(7).trim();
        return token.isEmpty() ? null : token;
    }
}

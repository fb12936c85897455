package com.sentimento.service.core.access;

import com.sentimento.access.model.Role;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps an email to its {@link Role} using the Seedbringer and Council allowlists. Matching is
 * case-insensitive and ignores surrounding whitespace. Seedbringer is checked first; an address listed
 * in both is a configuration error that is logged once when the resolver is built.
 */
@Slf4j
public final class RoleResolver {

    private final Set<String> seedbringers;
    private final Set<String> council;
    private final Set<String> overlap;

    public RoleResolver(Collection<String> seedbringerEmails, Collection<String> councilEmails) {
        this.seedbringers = normalize(seedbringerEmails);
        this.council = normalize(councilEmails);
        Set<String> both = new LinkedHashSet<>(seedbringers);
        both.retainAll(council);
        this.overlap = Set.copyOf(both);
        if (!overlap.isEmpty()) {
            log.error(
                    "Role allowlist misconfiguration: {} address(es) appear in both Seedbringer and Council lists {};"
                            + " they resolve to Seedbringer",
                    overlap.size(),
                    overlap);
        }
        log.info("Role allowlists loaded seedbringers={} council={}", seedbringers.size(), council.size());
    }

    public Role resolveRole(String email) {
        if (email == null || email.isBlank()) {
            return Role.UNAUTHORIZED;
        }
        String key = key(email);
        if (seedbringers.contains(key)) {
            return Role.SEEDBRINGER;
        }
        if (council.contains(key)) {
            return Role.COUNCIL;
        }
        return Role.UNAUTHORIZED;
    }

    public Set<String> overlappingEmails() {
        return overlap;
    }

    private static Set<String> normalize(Collection<String> emails) {
        if (emails == null) {
            return Set.of();
        }
        return emails.stream()
                .filter(e -> e != null && !e.isBlank())
                .map(RoleResolver::key)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String key(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}

package com.sentimento.service.core.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sentimento.access.model.Principal;
import com.sentimento.access.model.Role;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class AccessGateTest {

    private static final Set<Role> SEEDBRINGER_ONLY = EnumSet.of(Role.SEEDBRINGER);
    private static final Set<Role> COUNCIL_OR_SEEDBRINGER = EnumSet.of(Role.COUNCIL, Role.SEEDBRINGER);

    private final AccessGate gate = new AccessGate(
            new RoleResolver(List.of("seed@example.org"), List.of(" Member@Example.org ", "")));

    @Test
    void resolvesRolesCaseInsensitively() {
        assertThat(gate.resolveRole("SEED@example.org")).isEqualTo(Role.SEEDBRINGER);
        assertThat(gate.resolveRole("member@example.ORG")).isEqualTo(Role.COUNCIL);
        assertThat(gate.resolveRole("stranger@example.org")).isEqualTo(Role.UNAUTHORIZED);
        assertThat(gate.resolveRole("")).isEqualTo(Role.UNAUTHORIZED);
        assertThat(gate.resolveRole(null)).isEqualTo(Role.UNAUTHORIZED);
    }

    @Test
    void councilMemberIsDeniedSeedbringerRouteButAllowedSharedRoute() {
        Principal member = new Principal("member@example.org", "sub-1");

        AccessDecision seedOnly = gate.authorize(member, SEEDBRINGER_ONLY);
        assertThat(seedOnly).isInstanceOf(AccessDecision.Deny.class);
        AccessDecision.Deny deny = (AccessDecision.Deny) seedOnly;
        assertThat(deny.reason()).isEqualTo(DenyReason.INSUFFICIENT_ROLE);
        assertThat(deny.message()).isEqualTo("Seedbringer access required");
        assertThat(deny.role()).isEqualTo(Role.COUNCIL);

        AccessDecision shared = gate.authorize(member, COUNCIL_OR_SEEDBRINGER);
        assertThat(shared.allowed()).isTrue();
        assertThat(((AccessDecision.Allow) shared).role()).isEqualTo(Role.COUNCIL);
    }

    @Test
    void seedbringerPassesBothRoutes() {
        Principal seed = new Principal("Seed@Example.org", "sub-0");

        assertThat(gate.authorize(seed, SEEDBRINGER_ONLY).allowed()).isTrue();
        assertThat(gate.authorize(seed, COUNCIL_OR_SEEDBRINGER).allowed()).isTrue();
    }

    @Test
    void unlistedEmailIsDeniedOnBothRoutes() {
        Principal stranger = new Principal("stranger@example.org", "sub-2");

        AccessDecision.Deny seedOnly = (AccessDecision.Deny) gate.authorize(stranger, SEEDBRINGER_ONLY);
        AccessDecision.Deny shared = (AccessDecision.Deny) gate.authorize(stranger, COUNCIL_OR_SEEDBRINGER);

        assertThat(seedOnly.reason()).isEqualTo(DenyReason.INSUFFICIENT_ROLE);
        assertThat(shared.reason()).isEqualTo(DenyReason.INSUFFICIENT_ROLE);
        assertThat(shared.message()).isEqualTo("Council access required");
        assertThat(shared.role()).isEqualTo(Role.UNAUTHORIZED);
    }

    @Test
    void missingPrincipalIsDistinguishedFromWrongRole() {
        AccessDecision.Deny seedOnly = (AccessDecision.Deny) gate.authorize(null, SEEDBRINGER_ONLY);
        AccessDecision.Deny shared = (AccessDecision.Deny) gate.authorize(null, COUNCIL_OR_SEEDBRINGER);

        assertThat(seedOnly.reason()).isEqualTo(DenyReason.NO_PRINCIPAL);
        assertThat(shared.reason()).isEqualTo(DenyReason.NO_PRINCIPAL);
        assertThat(shared.message()).isEqualTo("Authentication required");
        assertThat(shared.role()).isNull();
    }

    @Test
    void emptyRequirementIsAProgrammingError() {
        assertThatThrownBy(() -> gate.authorize(new Principal("seed@example.org", "s"), Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void overlappingAllowlistsResolveToSeedbringerAndAreReported() {
        RoleResolver resolver = new RoleResolver(List.of("both@example.org"), List.of("BOTH@example.org"));

        assertThat(resolver.overlappingEmails()).containsExactly("both@example.org");
        assertThat(resolver.resolveRole("both@example.org")).isEqualTo(Role.SEEDBRINGER);
    }
}

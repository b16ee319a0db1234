package com.storefront.authservice.SecurityConfig;

import com.storefront.authservice.entity.UserRole;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleAuthorizationTest {

    private final RoleAuthorization roles = new RoleAuthorization();
    private final RequestAuthorizationContext context =
            new RequestAuthorizationContext(new MockHttpServletRequest("GET", "/api/admin/users"));

    private static Authentication as(UserRole role) {
        UUID id = UUID.randomUUID();
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        TokenClaims claims = new TokenClaims(id, role, now, now.plusSeconds(60), "jti", Map.of());
        return new IdentityAuthentication(
                new AuthenticatedIdentity(id, role.wireName() + "@storefront.test", role, true), claims, "raw");
    }

    private boolean granted(AuthorizationManager<RequestAuthorizationContext> manager, Authentication auth) {
        return manager.check(() -> auth, context).isGranted();
    }

    @Test
    void adminGateAcceptsAdminAndSuperAdmin() {
        AuthorizationManager<RequestAuthorizationContext> admin = roles.requireAdmin();

        assertThat(granted(admin, as(UserRole.ADMIN))).isTrue();
        assertThat(granted(admin, as(UserRole.SUPERADMIN))).isTrue();
        assertThat(granted(admin, as(UserRole.USER))).isFalse();
    }

    @Test
    void superAdminGateRejectsAdmin() {
        AuthorizationManager<RequestAuthorizationContext> superAdmin = roles.requireSuperAdmin();

        assertThat(granted(superAdmin, as(UserRole.SUPERADMIN))).isTrue();
        assertThat(granted(superAdmin, as(UserRole.ADMIN))).isFalse();
        assertThat(granted(superAdmin, as(UserRole.USER))).isFalse();
    }

    @Test
    void userGateDoesNotImplyHigherRoles() {
        AuthorizationManager<RequestAuthorizationContext> user = roles.requireRole(UserRole.USER);

        assertThat(granted(user, as(UserRole.USER))).isTrue();
        assertThat(granted(user, as(UserRole.ADMIN))).isFalse();
    }

    @Test
    void anonymousAndMissingAuthenticationAreDenied() {
        Authentication anonymous = new AnonymousAuthenticationToken(
                "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS"));

        assertThat(granted(roles.requireRole(UserRole.USER), anonymous)).isFalse();
        assertThat(granted(roles.requireRole(UserRole.USER), null)).isFalse();
    }

    @Test
    void expandAddsSuperAdminOnlyForAdmin() {
        assertThat(RoleAuthorization.expand(UserRole.ADMIN))
                .containsExactlyInAnyOrder(UserRole.ADMIN, UserRole.SUPERADMIN);
        assertThat(RoleAuthorization.expand(UserRole.USER)).containsExactly(UserRole.USER);
        assertThatThrownBy(RoleAuthorization::expand).isInstanceOf(IllegalArgumentException.class);
    }
}

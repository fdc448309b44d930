package com.oilresource.oil.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class RoleAuthorizerTest {

  private final RoleAuthorizer authorizer = new RoleAuthorizer();

  @Test
  void requireRoleReturnsClaimsWhenRolePresent() {
    final AccessTokenClaims claims = TestTokens.accessClaims(List.of("ROLE_USER"));

    assertThat(authorizer.requireRole(claims, "ROLE_USER")).isSameAs(claims);
  }

  @Test
  void requireRoleDeniesMissingRole() {
    final AccessTokenClaims claims = TestTokens.accessClaims(List.of("ROLE_USER"));

    assertThatThrownBy(() -> authorizer.requireRole(claims, "ROLE_ADMIN"))
        .isInstanceOfSatisfying(AuthException.class, ex -> assertThat(ex.isForbidden()).isTrue())
        .hasMessage("Access denied");
  }

  @Test
  void requireAnyRoleGrantsOnIntersection() {
    final AccessTokenClaims claims = TestTokens.accessClaims(List.of("ROLE_USER"));

    assertThat(authorizer.requireAnyRole(claims, List.of("ROLE_ADMIN", "ROLE_USER")))
        .isSameAs(claims);
    assertThatThrownBy(() -> authorizer.requireAnyRole(claims, List.of("ROLE_ADMIN")))
        .isInstanceOf(AuthException.class);
  }
}

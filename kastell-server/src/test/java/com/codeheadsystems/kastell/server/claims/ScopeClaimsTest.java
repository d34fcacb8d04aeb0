package com.codeheadsystems.kastell.server.claims;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ScopeClaimsTest {

  @Test
  void claimsFor_standardScopes() {
    ScopeClaims scopeClaims = new ScopeClaims();

    assertThat(scopeClaims.claimsFor(List.of("openid", "email")))
        .containsExactly("sub", "email", "email_verified");
    assertThat(scopeClaims.claimsFor("unknown")).isEmpty();
  }

  @Test
  void customScope_replacesAndExtends() {
    ScopeClaims scopeClaims = new ScopeClaims(Map.of(
        "email", List.of("email"),
        "research_and_scholarship", List.of("eduperson_scoped_affiliation")));

    assertThat(scopeClaims.claimsFor("email")).containsExactly("email");
    assertThat(scopeClaims.scopes()).contains("research_and_scholarship");
    assertThat(scopeClaims.allClaims()).contains("eduperson_scoped_affiliation", "address");
  }
}

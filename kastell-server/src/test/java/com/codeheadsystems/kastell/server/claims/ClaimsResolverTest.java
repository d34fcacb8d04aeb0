package com.codeheadsystems.kastell.server.claims;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.kastell.server.model.ClaimSpec;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClaimsResolverTest {

  @Test
  void claimsMatch_missingValue_neverMatches() {
    assertThat(ClaimsResolver.claimsMatch(null, null)).isFalse();
    assertThat(ClaimsResolver.claimsMatch(null, ClaimSpec.essentialClaim())).isFalse();
  }

  @Test
  void claimsMatch_nullSpec_matchesAnything() {
    assertThat(ClaimsResolver.claimsMatch("anything", null)).isTrue();
  }

  @Test
  void claimsMatch_essentialOnly_matchesAnything() {
    assertThat(ClaimsResolver.claimsMatch(42, ClaimSpec.essentialClaim())).isTrue();
  }

  @Test
  void claimsMatch_value() {
    assertThat(ClaimsResolver.claimsMatch("urn:mace:incommon:iap:silver",
        ClaimSpec.value("urn:mace:incommon:iap:silver"))).isTrue();
    assertThat(ClaimsResolver.claimsMatch("bronze", ClaimSpec.value("silver"))).isFalse();
  }

  @Test
  void claimsMatch_values() {
    ClaimSpec spec = ClaimSpec.values(List.<Object>of("silver", "gold"));

    assertThat(ClaimsResolver.claimsMatch("gold", spec)).isTrue();
    assertThat(ClaimsResolver.claimsMatch("bronze", spec)).isFalse();
  }

  @Test
  void claimsMatch_valueAndValues_eitherOneMatches() {
    ClaimSpec spec = new ClaimSpec(true, "red", List.<Object>of("blue"));

    assertThat(ClaimsResolver.claimsMatch("blue", spec)).isTrue();
    assertThat(ClaimsResolver.claimsMatch("red", spec)).isTrue();
    assertThat(ClaimsResolver.claimsMatch("green", spec)).isFalse();
  }

  @Test
  void claimsMatch_emptySpec_doesNotMatch() {
    assertThat(ClaimsResolver.claimsMatch("red", new ClaimSpec(null, null, null))).isFalse();
  }

  @Test
  void claimsMatch_numbersCompareByValue() {
    assertThat(ClaimsResolver.claimsMatch(42, ClaimSpec.value(42L))).isTrue();
    assertThat(ClaimsResolver.claimsMatch(1.0d, ClaimSpec.value(1))).isTrue();
    assertThat(ClaimsResolver.claimsMatch(2, ClaimSpec.values(List.<Object>of(1, 3)))).isFalse();
  }
}

package com.codeheadsystems.kastell.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class UsageRulesTest {

  @Test
  void fromMap_coercesStrings() {
    UsageRules rules = UsageRules.fromMap(Map.of(
        "expires_in", "120",
        "max_usage", "3",
        "supports_minting", List.of("access_token", "refresh_token")));

    assertThat(rules.expiresIn()).isEqualTo(120L);
    assertThat(rules.maxUsage()).isEqualTo(3);
    assertThat(rules.supportsMinting(TokenType.ACCESS_TOKEN)).isTrue();
    assertThat(rules.supportsMinting(TokenType.ID_TOKEN)).isFalse();
  }

  @Test
  void fromMap_empty_isUnbounded() {
    UsageRules rules = UsageRules.fromMap(Map.of());

    assertThat(rules.expiresIn()).isNull();
    assertThat(rules.maxUsage()).isNull();
    assertThat(rules.supportsMinting()).isEmpty();
  }

  @Test
  void fromMap_garbage_throws() {
    assertThatThrownBy(() -> UsageRules.fromMap(Map.of("max_usage", "lots")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> UsageRules.fromMap(Map.of("supports_minting", "access_token")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void defaults_codeIsSingleUseAndMintsEverything() {
    UsageRules code = UsageRules.defaults().get(TokenType.AUTHORIZATION_CODE);

    assertThat(code.maxUsage()).isEqualTo(1);
    assertThat(code.supportsMinting()).containsExactlyInAnyOrder(TokenType.ACCESS_TOKEN,
        TokenType.REFRESH_TOKEN, TokenType.ID_TOKEN);
    assertThat(UsageRules.defaults().get(TokenType.ACCESS_TOKEN).supportsMinting()).isEmpty();
  }
}

package com.codeheadsystems.kastell.server.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.exception.InvalidTokenException;
import org.junit.jupiter.api.Test;

class UserInfoEndpointTest {

  @Test
  void bearerToken_extractsToken() {
    assertThat(UserInfoEndpoint.bearerToken("Bearer abc.def")).isEqualTo("abc.def");
    assertThat(UserInfoEndpoint.bearerToken("bearer   abc ")).isEqualTo("abc");
  }

  @Test
  void bearerToken_missing_throws() {
    assertThatThrownBy(() -> UserInfoEndpoint.bearerToken(null))
        .isInstanceOf(InvalidTokenException.class);
    assertThatThrownBy(() -> UserInfoEndpoint.bearerToken("Basic abc"))
        .isInstanceOf(InvalidTokenException.class);
    assertThatThrownBy(() -> UserInfoEndpoint.bearerToken("Bearer "))
        .isInstanceOf(InvalidTokenException.class);
  }
}

package com.codeheadsystems.kastell.server.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TokenRequestTest {

  @Test
  void from_authorizationCode() {
    TokenRequest request = TokenRequest.from(Map.of("grant_type", "authorization_code",
        "code", "c", "redirect_uri", "https://cb"));

    assertThat(request.grantType()).isEqualTo(TokenRequest.AUTHORIZATION_CODE);
    assertThat(request.code()).isEqualTo("c");
  }

  @Test
  void from_missingPieces_throw() {
    assertThatThrownBy(() -> TokenRequest.from(Map.of()))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> TokenRequest.from(Map.of("grant_type", "authorization_code")))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> TokenRequest.from(Map.of("grant_type", "refresh_token")))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void from_tokenExchange_readsSubjectAndScope() {
    TokenRequest request = TokenRequest.from(Map.of("grant_type", TokenRequest.TOKEN_EXCHANGE,
        "subject_token", "at", "subject_token_type", TokenRequest.ACCESS_TOKEN_TYPE,
        "resource", "https://backend.example.com/api", "scope", "api  read"));

    assertThat(request.subjectToken()).isEqualTo("at");
    assertThat(request.resource()).isEqualTo("https://backend.example.com/api");
    assertThat(request.scope()).containsExactly("api", "read");
  }

  @Test
  void from_tokenExchange_rejectsOtherSubjectTypes() {
    assertThatThrownBy(() -> TokenRequest.from(Map.of("grant_type", TokenRequest.TOKEN_EXCHANGE,
        "subject_token", "it",
        "subject_token_type", "urn:ietf:params:oauth:token-type:id_token")))
        .isInstanceOf(InvalidRequestException.class)
        .hasMessageContaining("subject_token_type");
    assertThatThrownBy(() -> TokenRequest.from(Map.of("grant_type", TokenRequest.TOKEN_EXCHANGE,
        "subject_token_type", TokenRequest.ACCESS_TOKEN_TYPE)))
        .isInstanceOf(InvalidRequestException.class);
  }
}

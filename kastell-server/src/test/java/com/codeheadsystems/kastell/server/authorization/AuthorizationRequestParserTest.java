package com.codeheadsystems.kastell.server.authorization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.model.ClaimSpec;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthorizationRequestParserTest {

  private final AuthorizationRequestParser parser =
      new AuthorizationRequestParser(new ObjectMapper());

  @Test
  void parse_splitsSpaceSeparatedValues() {
    AuthorizationRequest request = parser.parse(Map.of(
        "client_id", "client_1",
        "response_type", "code  id_token",
        "scope", "openid email",
        "prompt", "login consent",
        "max_age", "300"));

    assertThat(request.responseType()).containsExactly("code", "id_token");
    assertThat(request.scope()).containsExactly("openid", "email");
    assertThat(request.hasPrompt("consent")).isTrue();
    assertThat(request.maxAge()).isEqualTo(300L);
  }

  @Test
  void parse_withoutClientId_throws() {
    assertThatThrownBy(() -> parser.parse(Map.of("response_type", "code")))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void parse_badMaxAgeOrClaims_throws() {
    assertThatThrownBy(() -> parser.parse(Map.of("client_id", "c", "max_age", "soon")))
        .isInstanceOf(InvalidRequestException.class);
    assertThatThrownBy(() -> parser.parse(Map.of("client_id", "c", "claims", "{not json")))
        .isInstanceOf(InvalidRequestException.class);
  }

  @Test
  void toQuery_fromQuery_preservesClaimsAndDropsReferences() {
    AuthorizationRequest request = AuthorizationRequest.builder()
        .clientId("client_1")
        .responseType("code")
        .redirectUri("https://rp.example.org/cb?x=1")
        .scope("openid", "profile")
        .state("a&b=c")
        .claims(Map.of("userinfo", Map.of("email", ClaimSpec.essentialClaim())))
        .request("ignored.jwt")
        .build();

    String query = parser.toQuery(request);
    AuthorizationRequest restored = parser.fromQuery(query);

    assertThat(query).doesNotContain("request=");
    assertThat(restored.state()).isEqualTo("a&b=c");
    assertThat(restored.redirectUri()).isEqualTo("https://rp.example.org/cb?x=1");
    assertThat(restored.claims().get("userinfo").get("email").essential()).isTrue();
    assertThat(restored.request()).isNull();
  }

  @Test
  void merge_requestObjectOverridesParameters() {
    AuthorizationRequest plain = AuthorizationRequest.builder()
        .clientId("client_1")
        .responseType("code")
        .scope("openid")
        .state("plain")
        .request("the.jwt")
        .build();

    AuthorizationRequest merged = parser.merge(plain, Map.of(
        "state", "signed",
        "scope", "openid email",
        "max_age", 60,
        "iss", "client_1"));

    assertThat(merged.state()).isEqualTo("signed");
    assertThat(merged.scope()).containsExactly("openid", "email");
    assertThat(merged.maxAge()).isEqualTo(60L);
    assertThat(merged.request()).isNull();
    assertThat(merged.responseType()).isEqualTo(List.of("code"));
  }
}

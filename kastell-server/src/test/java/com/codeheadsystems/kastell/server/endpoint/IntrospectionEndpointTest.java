package com.codeheadsystems.kastell.server.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.model.token.IntrospectionResponse;
import com.codeheadsystems.kastell.model.token.TokenResponse;
import com.codeheadsystems.kastell.server.MutableClock;
import com.codeheadsystems.kastell.server.TestProviders;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.manager.OidcProvider;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IntrospectionEndpointTest {

  private MutableClock clock;
  private OidcProvider provider;
  private IntrospectionEndpoint endpoint;
  private ClientInfo client;
  private ClientInfo backend;
  private String sessionId;
  private Token code;
  private TokenResponse tokens;

  @BeforeEach
  void setUp() {
    clock = MutableClock.now();
    client = TestProviders.client();
    backend = TokenEndpointTest.backendClient();
    provider = TestProviders.builder(TestProviders.settings(), clock, client, backend).build();
    endpoint = provider.introspectionEndpoint();
    sessionId = TokenEndpointTest.newSession(provider);
    code = provider.tokenEngine().mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null, null);
    tokens = provider.tokenEndpoint().process(client, Map.of(
        "grant_type", TokenRequest.AUTHORIZATION_CODE,
        "code", code.value(),
        "redirect_uri", TestProviders.REDIRECT_URI));
  }

  private IntrospectionResponse introspect(ClientInfo caller, String token) {
    return endpoint.introspect(caller, Map.of("token", token));
  }

  @Test
  void activeAccessToken_describedToItsClient() {
    IntrospectionResponse response = introspect(client, tokens.accessToken());

    assertThat(response.active()).isTrue();
    assertThat(response.clientId()).isEqualTo(TestProviders.CLIENT_ID);
    assertThat(response.tokenType()).isEqualTo(TokenResponse.BEARER);
    assertThat(response.iss()).isEqualTo(TestProviders.ISSUER);
    assertThat(response.sub()).isNotBlank();
    assertThat(response.exp()).isGreaterThan(response.iat());
  }

  @Test
  void refreshToken_isActive() {
    IntrospectionResponse response = introspect(client, tokens.refreshToken());

    assertThat(response.active()).isTrue();
    assertThat(response.tokenType()).isEqualTo(TokenType.REFRESH_TOKEN.value());
  }

  @Test
  void unknownToken_isInactive() {
    assertThat(introspect(client, "not-a-token").active()).isFalse();
  }

  @Test
  void authorizationCode_isInactive() {
    assertThat(introspect(client, code.value()).active()).isFalse();
  }

  @Test
  void expiredAccessToken_isInactive() {
    clock.advance(Duration.ofSeconds(601));

    assertThat(introspect(client, tokens.accessToken()).active()).isFalse();
  }

  @Test
  void revokedGrant_tokenIsInactive() {
    provider.sessionManager().revokeGrant(sessionId);

    assertThat(introspect(client, tokens.accessToken())).isEqualTo(
        IntrospectionResponse.inactive());
  }

  @Test
  void otherClient_learnsNothing() {
    assertThat(introspect(backend, tokens.accessToken()).active()).isFalse();
  }

  @Test
  void exchangeUser_mayIntrospectExchangedToken() {
    provider.sessionManager().createExchangeGrant(sessionId, List.of("read"),
        List.of(TokenEndpointTest.BACKEND_URL), List.of(TokenEndpointTest.BACKEND), null);
    TokenResponse exchanged = provider.tokenEndpoint().process(backend, Map.of(
        "grant_type", TokenRequest.TOKEN_EXCHANGE,
        "subject_token", tokens.accessToken(),
        "subject_token_type", TokenRequest.ACCESS_TOKEN_TYPE));

    IntrospectionResponse response = introspect(backend, exchanged.accessToken());

    assertThat(response.active()).isTrue();
    assertThat(response.scope()).isEqualTo("read");
    assertThat(response.aud()).containsExactly(TokenEndpointTest.BACKEND_URL);
  }

  @Test
  void missingToken_isInvalidRequest() {
    assertThatThrownBy(() -> endpoint.introspect(client, Map.of()))
        .isInstanceOf(InvalidRequestException.class);
  }
}

package com.codeheadsystems.kastell.server.endpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.model.token.TokenResponse;
import com.codeheadsystems.kastell.server.MutableClock;
import com.codeheadsystems.kastell.server.TestProviders;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.InvalidTargetException;
import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.exception.MintingNotAllowedException;
import com.codeheadsystems.kastell.server.exception.RevokedException;
import com.codeheadsystems.kastell.server.exception.UnAuthorizedClientScopeException;
import com.codeheadsystems.kastell.server.manager.OidcProvider;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.session.AuthenticationEvent;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.SubjectIdentifiers;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TokenEndpointTest {

  static final String BACKEND = "backend_1";
  static final String BACKEND_URL = "https://backend.example.com";

  private MutableClock clock;
  private OidcProvider provider;
  private SessionManager sessionManager;
  private TokenEndpoint tokenEndpoint;
  private ClientInfo client;
  private ClientInfo backend;
  private String sessionId;

  @BeforeEach
  void setUp() {
    clock = MutableClock.now();
    client = TestProviders.client();
    backend = backendClient();
    provider = TestProviders.builder(TestProviders.settings(), clock, client, backend).build();
    sessionManager = provider.sessionManager();
    tokenEndpoint = provider.tokenEndpoint();
    sessionId = newSession(provider);
  }

  static ClientInfo backendClient() {
    return ClientInfo.builder(BACKEND)
        .clientSecret("backend-secret-that-is-long-enough")
        .redirectUris("https://backend.example.com/cb")
        .build();
  }

  static String newSession(OidcProvider provider) {
    AuthorizationRequest request = AuthorizationRequest.builder()
        .clientId(TestProviders.CLIENT_ID)
        .responseType("code")
        .redirectUri(TestProviders.REDIRECT_URI)
        .scope("read", "write")
        .build();
    AuthenticationEvent event = AuthenticationEvent.create(TestProviders.USER, "acr",
        provider.context().clock().instant(), Duration.ofHours(1));
    return provider.sessionManager().createSession(event, request, TestProviders.USER,
        TestProviders.CLIENT_ID, SubjectIdentifiers.PUBLIC, null);
  }

  private Map<String, String> codeParams(String code) {
    Map<String, String> params = new HashMap<>();
    params.put("grant_type", TokenRequest.AUTHORIZATION_CODE);
    params.put("code", code);
    params.put("redirect_uri", TestProviders.REDIRECT_URI);
    return params;
  }

  private String accessToken() {
    Token code = provider.tokenEngine().mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null,
        null);
    return tokenEndpoint.process(client, codeParams(code.value())).accessToken();
  }

  private static Map<String, String> exchangeParams(String subjectToken, String resource) {
    Map<String, String> params = new HashMap<>();
    params.put("grant_type", TokenRequest.TOKEN_EXCHANGE);
    params.put("subject_token", subjectToken);
    params.put("subject_token_type", TokenRequest.ACCESS_TOKEN_TYPE);
    if (resource != null) {
      params.put("resource", resource);
    }
    return params;
  }

  private String exchangeGrant() {
    return sessionManager.createExchangeGrant(sessionId, List.of("read"), List.of(BACKEND_URL),
        List.of(BACKEND), null);
  }

  @Test
  void authorizationCode_issuesAccessAndRefreshTokens() {
    Token code = provider.tokenEngine().mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null,
        null);

    TokenResponse response = tokenEndpoint.process(client, codeParams(code.value()));

    assertThat(response.accessToken()).isNotBlank();
    assertThat(response.refreshToken()).isNotBlank();
    assertThat(response.tokenType()).isEqualTo(TokenResponse.BEARER);
    assertThat(sessionManager.findToken(sessionId, code.value()).usageCount()).isEqualTo(1);
  }

  @Test
  void authorizationCode_replayed_isRejectedAndMintsNothing() {
    Token code = provider.tokenEngine().mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null,
        null);
    tokenEndpoint.process(client, codeParams(code.value()));
    int issued = sessionManager.getGrant(sessionId).tokens().size();

    assertThatThrownBy(() -> tokenEndpoint.process(client, codeParams(code.value())))
        .isInstanceOf(RevokedException.class)
        .satisfies(e -> assertThat(((KastellException) e).error()).isEqualTo("invalid_grant"));
    assertThat(sessionManager.getGrant(sessionId).tokens()).hasSize(issued);
    assertThat(sessionManager.findToken(sessionId, code.value()).usageCount()).isEqualTo(1);
  }

  @Test
  void authorizationCode_otherClient_isRejected() {
    Token code = provider.tokenEngine().mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null,
        null);

    assertThatThrownBy(() -> tokenEndpoint.process(backend, codeParams(code.value())))
        .isInstanceOf(InvalidRequestException.class);
    assertThat(sessionManager.findToken(sessionId, code.value()).usageCount()).isZero();
  }

  @Test
  void authorizationCode_revokedGrant_isRejected() {
    Token code = provider.tokenEngine().mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null,
        null);
    sessionManager.revokeGrant(sessionId);

    assertThatThrownBy(() -> tokenEndpoint.process(client, codeParams(code.value())))
        .isInstanceOf(RevokedException.class);
  }

  @Test
  void tokenExchange_allowedClient_getsTokenForResource() {
    String subject = accessToken();
    String exchangeSessionId = exchangeGrant();

    TokenResponse response = tokenEndpoint.process(backend,
        exchangeParams(subject, BACKEND_URL + "/api"));

    assertThat(response.issuedTokenType()).isEqualTo(TokenRequest.ACCESS_TOKEN_TYPE);
    assertThat(response.scope()).isEqualTo("read");
    assertThat(response.refreshToken()).isNull();
    SessionInfo info = sessionManager.getSessionInfoByToken(response.accessToken());
    assertThat(info.sessionId()).isEqualTo(exchangeSessionId);
    assertThat(info.token().type()).isEqualTo(TokenType.ACCESS_TOKEN);
  }

  @Test
  void tokenExchange_clientWithoutExchangeGrant_isRejected() {
    String subject = accessToken();
    exchangeGrant();

    assertThatThrownBy(() -> tokenEndpoint.process(client, exchangeParams(subject, null)))
        .isInstanceOf(MintingNotAllowedException.class);
  }

  @Test
  void tokenExchange_resourceNotCovered_isInvalidTarget() {
    String subject = accessToken();
    exchangeGrant();

    assertThatThrownBy(() -> tokenEndpoint.process(backend,
        exchangeParams(subject, "https://backend.example.com.evil.org/api")))
        .isInstanceOf(InvalidTargetException.class)
        .satisfies(e -> assertThat(((KastellException) e).error()).isEqualTo("invalid_target"));
  }

  @Test
  void tokenExchange_scopeBeyondExchangeGrant_isRejected() {
    String subject = accessToken();
    exchangeGrant();
    Map<String, String> params = exchangeParams(subject, BACKEND_URL);
    params.put("scope", "read write");

    assertThatThrownBy(() -> tokenEndpoint.process(backend, params))
        .isInstanceOf(UnAuthorizedClientScopeException.class);
  }

  @Test
  void tokenExchange_revokedSubject_isRejected() {
    String subject = accessToken();
    exchangeGrant();
    sessionManager.revokeGrant(sessionId);

    assertThatThrownBy(() -> tokenEndpoint.process(backend, exchangeParams(subject, BACKEND_URL)))
        .isInstanceOf(RevokedException.class);
  }
}

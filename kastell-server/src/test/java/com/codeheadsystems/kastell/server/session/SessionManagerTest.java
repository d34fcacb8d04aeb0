package com.codeheadsystems.kastell.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.MutableClock;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.store.InMemorySessionStore;
import com.codeheadsystems.kastell.server.token.JwtTokenCodec;
import com.codeheadsystems.kastell.server.token.TokenCodec;
import com.codeheadsystems.kastell.server.token.TokenHandler;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

  private static final byte[] SECRET =
      "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8);

  private MutableClock clock;
  private SessionManager sessionManager;
  private TokenEngine tokenEngine;

  @BeforeEach
  void setUp() {
    clock = MutableClock.now();
    sessionManager = newSessionManager(clock);
    tokenEngine = new TokenEngine(sessionManager);
  }

  static SessionManager newSessionManager(MutableClock clock) {
    JwtTokenCodec codec = new JwtTokenCodec(SECRET, "https://op.example.org", clock);
    Map<TokenType, TokenCodec> codecs = new EnumMap<>(TokenType.class);
    for (TokenType type : TokenType.values()) {
      codecs.put(type, codec);
    }
    return new SessionManager(new InMemorySessionStore(), new TokenHandler(codecs),
        new SubjectIdentifiers("pepper"), UsageRules.defaults(), clock);
  }

  static AuthorizationRequest request(String clientId) {
    return AuthorizationRequest.builder()
        .clientId(clientId)
        .responseType("code")
        .redirectUri("https://rp.example.org/cb")
        .scope("openid")
        .state("STATE")
        .build();
  }

  private String createSession(String clientId) {
    AuthenticationEvent event = AuthenticationEvent.create("diana", "acr", clock.instant(),
        Duration.ofHours(1));
    return sessionManager.createSession(event, request(clientId), "diana", clientId,
        SubjectIdentifiers.PUBLIC, null);
  }

  @Test
  void createSession_buildsTheTree() {
    String sessionId = createSession("client_1");

    SessionInfo info = sessionManager.getSessionInfo(sessionId, true, true, true);
    assertThat(info.userId()).isEqualTo("diana");
    assertThat(info.clientId()).isEqualTo("client_1");
    assertThat(info.userSession().clientIds()).containsExactly("client_1");
    assertThat(info.clientSession().grantIds()).containsExactly(info.grantId());
    assertThat(info.grant().scope()).containsExactly("openid");
    assertThat(sessionManager.get(List.of("diana"))).isInstanceOf(UserSession.class);
  }

  @Test
  void createSession_secondClientSharesUserSession() {
    createSession("client_1");
    String second = createSession("client_2");

    assertThat(sessionManager.getUserSession(second).clientIds())
        .containsExactlyInAnyOrder("client_1", "client_2");
  }

  @Test
  void createSession_sameClientAddsGrantAndKeepsSub() {
    String first = createSession("client_1");
    String second = createSession("client_1");

    assertThat(second).isNotEqualTo(first);
    assertThat(sessionManager.grants(first)).hasSize(2);
    assertThat(sessionManager.getClientSession(second).sub())
        .isEqualTo(sessionManager.getClientSession(first).sub());
  }

  @Test
  void pairwiseSubjects_differPerSector() {
    AuthenticationEvent event = AuthenticationEvent.create("diana", "acr", clock.instant(),
        Duration.ofHours(1));
    String a = sessionManager.createSession(event, request("a"), "diana", "a",
        SubjectIdentifiers.PAIRWISE, "https://a.example.org");
    String b = sessionManager.createSession(event, request("b"), "diana", "b",
        SubjectIdentifiers.PAIRWISE, "https://b.example.org");

    assertThat(sessionManager.getClientSession(a).sub())
        .isNotEqualTo(sessionManager.getClientSession(b).sub());
  }

  @Test
  void getSessionInfoByToken_resolvesToken() {
    String sessionId = createSession("client_1");
    Token code = tokenEngine.mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null, null);

    SessionInfo info = sessionManager.getSessionInfoByToken(code.value());

    assertThat(info.sessionId()).isEqualTo(sessionId);
    assertThat(info.token().type()).isEqualTo(TokenType.AUTHORIZATION_CODE);
  }

  @Test
  void getSessionInfoByToken_garbage_throwsUnknownToken() {
    assertThatThrownBy(() -> sessionManager.getSessionInfoByToken("not-a-token"))
        .isInstanceOf(UnknownTokenException.class);
  }

  @Test
  void getSessionInfoByToken_fromAnotherProvider_throwsUnknownToken() {
    SessionManager other = newSessionManager(clock);
    AuthenticationEvent event = AuthenticationEvent.create("diana", "acr", clock.instant(),
        Duration.ofHours(1));
    String sessionId = other.createSession(event, request("client_1"), "diana", "client_1",
        SubjectIdentifiers.PUBLIC, null);
    Token code = new TokenEngine(other).mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null,
        null);

    // same secret, different store: the grant is unknown here
    assertThatThrownBy(() -> sessionManager.getSessionInfoByToken(code.value()))
        .isInstanceOf(UnknownTokenException.class);
  }

  @Test
  void revokeClientSession_revokesEveryGrantAndToken() {
    String first = createSession("client_1");
    String second = createSession("client_1");
    Token code = tokenEngine.mintToken(first, TokenType.AUTHORIZATION_CODE, null, null);

    sessionManager.revokeClientSession(second);

    assertThat(sessionManager.getClientSession(first).isRevoked()).isTrue();
    assertThat(sessionManager.getGrant(first).isRevoked()).isTrue();
    assertThat(sessionManager.getGrant(second).isRevoked()).isTrue();
    assertThat(sessionManager.findToken(first, code.value()).isRevoked()).isTrue();
  }

  @Test
  void revokeClientSession_leavesOtherClientsAlone() {
    String mine = createSession("client_1");
    String theirs = createSession("client_2");

    sessionManager.revokeClientSession(mine);

    assertThat(sessionManager.getClientSession(theirs).isRevoked()).isFalse();
    assertThat(sessionManager.getGrant(theirs).isActive(clock.instant())).isTrue();
  }

  @Test
  void revokeToken_revokesOnlyThatToken() {
    String sessionId = createSession("client_1");
    Token code = tokenEngine.mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null, null);
    Token access = tokenEngine.mintToken(sessionId, TokenType.ACCESS_TOKEN, code, null);

    sessionManager.revokeToken(sessionId, code.value());

    assertThat(sessionManager.findToken(sessionId, code.value()).isRevoked()).isTrue();
    assertThat(sessionManager.findToken(sessionId, access.value()).isRevoked()).isFalse();
    assertThat(sessionManager.getGrant(sessionId).isRevoked()).isFalse();
  }

  @Test
  void revokeGrant_revokesItsTokens() {
    String sessionId = createSession("client_1");
    Token code = tokenEngine.mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null, null);

    sessionManager.revokeGrant(sessionId);

    assertThat(sessionManager.findToken(sessionId, code.value()).isActive(clock.instant()))
        .isFalse();
  }

  @Test
  void createGrant_onRevokedClientSession_throws() {
    String sessionId = createSession("client_1");
    sessionManager.revokeClientSession(sessionId);

    assertThatThrownBy(() -> sessionManager.createGrant(sessionId,
        sessionManager.getAuthenticationEvent(sessionId), request("client_1")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void set_wrongRecordForDepth_throws() {
    assertThatThrownBy(() -> sessionManager.set(List.of("diana", "client_1"),
        new UserSession("diana")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getGrant_userLevelSessionId_throws() {
    assertThatThrownBy(() -> sessionManager.getGrant(SessionKey.of("diana").serialize()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

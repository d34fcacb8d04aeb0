package com.codeheadsystems.kastell.dropwizard.auth;

import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.TokenType;
import io.dropwizard.auth.AuthenticationException;
import io.dropwizard.auth.Authenticator;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that accepts active access tokens issued by the provider.
 */
public class KastellAuthenticator implements Authenticator<String, KastellPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(KastellAuthenticator.class);

  private final SessionManager sessionManager;

  /**
   * Instantiates a new Kastell authenticator.
   *
   * @param sessionManager the session manager holding issued tokens
   */
  public KastellAuthenticator(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  public Optional<KastellPrincipal> authenticate(String token) throws AuthenticationException {
    SessionInfo info;
    try {
      info = sessionManager.getSessionInfoByToken(token);
    } catch (KastellException e) {
      log.debug("Bearer token rejected: {}", e.getMessage());
      return Optional.empty();
    }
    Instant now = sessionManager.now();
    if (info.token().type() != TokenType.ACCESS_TOKEN
        || !info.token().isActive(now)
        || !info.grant().isActive(now)) {
      return Optional.empty();
    }
    return Optional.of(new KastellPrincipal(info.userId(), info.clientId(), info.grant().scope()));
  }
}

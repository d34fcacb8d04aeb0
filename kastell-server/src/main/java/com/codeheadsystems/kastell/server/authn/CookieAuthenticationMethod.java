package com.codeheadsystems.kastell.server.authn;

import com.codeheadsystems.kastell.server.cookie.CookieDealer;
import com.codeheadsystems.kastell.server.cookie.SessionCookie;
import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for methods that remember a login in the provider's session cookie.
 */
public abstract class CookieAuthenticationMethod implements AuthenticationMethod {

  private static final Logger log = LoggerFactory.getLogger(CookieAuthenticationMethod.class);

  private final String acr;
  private final MethodEnvironment environment;

  protected CookieAuthenticationMethod(String acr, MethodEnvironment environment) {
    this.acr = acr;
    this.environment = environment;
  }

  @Override
  public String acr() {
    return acr;
  }

  @Override
  public Optional<AuthenticatedIdentity> authenticatedAs(String cookieHeader, Long maxAgeSeconds) {
    CookieDealer dealer = environment.cookieDealer();
    Optional<List<String>> parts = dealer.getCookieValue(cookieHeader, environment.cookieName());
    if (parts.isEmpty()) {
      return Optional.empty();
    }
    SessionCookie cookie = SessionCookie.fromJson(environment.objectMapper(), parts.get().get(0));
    Instant authTime;
    try {
      authTime = Instant.ofEpochSecond(Long.parseLong(parts.get().get(1)));
    } catch (NumberFormatException e) {
      throw new SecurityException("Session cookie timestamp is malformed", e);
    }
    if (maxAgeSeconds != null) {
      Instant now = environment.clock().instant();
      if (!now.isBefore(authTime.plusSeconds(maxAgeSeconds))) {
        log.debug("Authentication at {} is older than max_age {}", authTime, maxAgeSeconds);
        throw new TooOldException("Authentication is older than max_age");
      }
    }
    return Optional.of(new AuthenticatedIdentity(cookie.uid(), cookie.sid(), cookie.state(), authTime));
  }

  protected MethodEnvironment environment() {
    return environment;
  }

  protected Clock clock() {
    return environment.clock();
  }

  protected ObjectMapper objectMapper() {
    return environment.objectMapper();
  }
}

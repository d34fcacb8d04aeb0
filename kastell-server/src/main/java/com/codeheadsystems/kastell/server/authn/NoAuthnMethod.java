package com.codeheadsystems.kastell.server.authn;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates everybody as one fixed user. For development and tests only.
 */
public class NoAuthnMethod extends CookieAuthenticationMethod {

  private static final Logger log = LoggerFactory.getLogger(NoAuthnMethod.class);

  private final String user;

  public NoAuthnMethod(String acr, String user, MethodEnvironment environment) {
    super(acr, environment);
    this.user = user;
    log.warn("NoAuthnMethod is configured: every login succeeds as '{}'", user);
  }

  @Override
  public Optional<String> verify(Map<String, String> parameters) {
    return Optional.of(user);
  }
}

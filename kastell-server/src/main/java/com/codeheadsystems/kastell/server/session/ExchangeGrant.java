package com.codeheadsystems.kastell.server.session;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A grant that lets other parties trade a user's access token for a new one (RFC 8693).
 * <p>
 * It lives next to the ordinary grants of a user+client pair. {@link #users()} names the
 * clients allowed to exchange, {@link #resources()} the targets the new tokens are meant for.
 */
public class ExchangeGrant extends Grant {

  private final List<String> users;

  public ExchangeGrant(AuthenticationEvent authenticationEvent, List<String> scope,
                       List<String> resources, List<String> users,
                       Map<TokenType, UsageRules> usageRules, Instant issuedAt) {
    super(null, authenticationEvent, usageRules, issuedAt);
    this.users = List.copyOf(users);
    setScope(scope);
    setResources(resources);
    markAuthorized();
  }

  public List<String> users() {
    return users;
  }

  public boolean allows(String clientId) {
    return users.contains(clientId);
  }

  /**
   * Whether a requested resource is one of the targets or lies below one of them.
   *
   * @param resource the requested resource, null for any
   * @return true if the grant covers it
   */
  public boolean covers(String resource) {
    if (resource == null) {
      return true;
    }
    for (String target : resources()) {
      String prefix = target.endsWith("/") ? target : target + "/";
      if (resource.equals(target) || resource.startsWith(prefix)) {
        return true;
      }
    }
    return false;
  }
}

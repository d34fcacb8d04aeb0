package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.exception.UnAuthorizedClientScopeException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Which scopes a client may ask for: its registered {@code allowed_scopes}, or the
 * provider's supported scopes when it registered none.
 */
public class ScopePolicy {

  private static final Logger log = LoggerFactory.getLogger(ScopePolicy.class);

  private final ClientRegistry clients;
  private final List<String> scopesSupported;
  private final boolean denyUnknownScopes;

  public ScopePolicy(ClientRegistry clients, List<String> scopesSupported, boolean denyUnknownScopes) {
    this.clients = clients;
    this.scopesSupported = List.copyOf(scopesSupported);
    this.denyUnknownScopes = denyUnknownScopes;
  }

  public List<String> allowedScopes(ClientInfo client) {
    if (client != null && !client.allowedScopes().isEmpty()) {
      return client.allowedScopes();
    }
    return scopesSupported;
  }

  /**
   * The requested scopes the client may use, in request order.
   *
   * @param clientId the client
   * @param scopes   requested scopes
   * @return the permitted subset
   */
  public List<String> filterScopes(String clientId, List<String> scopes) {
    List<String> allowed = allowedScopes(clients.get(clientId).orElse(null));
    return scopes.stream().filter(allowed::contains).toList();
  }

  /**
   * When unknown scopes are denied, rejects a request naming any scope outside the
   * allowed set.
   *
   * @param client the client
   * @param scopes requested scopes
   * @throws UnAuthorizedClientScopeException on the first disallowed scope
   */
  public void checkUnknownScopes(ClientInfo client, List<String> scopes) {
    if (!denyUnknownScopes) {
      return;
    }
    List<String> allowed = allowedScopes(client);
    for (String scope : scopes) {
      if (!allowed.contains(scope)) {
        log.warn("Client {} asked for scope it may not use: {}", client.clientId(), scope);
        throw new UnAuthorizedClientScopeException("Scope not allowed: " + scope);
      }
    }
  }
}

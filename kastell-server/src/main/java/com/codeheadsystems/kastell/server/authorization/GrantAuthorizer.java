package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.claims.ClaimsResolver;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.exception.RevokedException;
import com.codeheadsystems.kastell.server.session.Grant;
import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.TokenType;
import com.codeheadsystems.kastell.server.session.UsageRules;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fills in what a freshly authenticated grant allows: scope, resources, claims, usage rules
 * and expiry.
 */
public class GrantAuthorizer {

  private static final Logger log = LoggerFactory.getLogger(GrantAuthorizer.class);

  private final SessionManager sessionManager;
  private final ClientRegistry clients;
  private final ScopePolicy scopePolicy;
  private final ClaimsResolver claimsResolver;
  private final ProviderSettings settings;

  public GrantAuthorizer(SessionManager sessionManager, ClientRegistry clients,
                         ScopePolicy scopePolicy, ClaimsResolver claimsResolver,
                         ProviderSettings settings) {
    this.sessionManager = sessionManager;
    this.clients = clients;
    this.scopePolicy = scopePolicy;
    this.claimsResolver = claimsResolver;
    this.settings = settings;
  }

  /**
   * Authorizes the grant named by the session id and stores it. A grant that was authorized
   * before is returned as it is, so answering the same request again from the session never
   * extends its lifetime or resets its usage rules.
   *
   * @param sessionId the grant's session id
   * @return the authorized grant
   * @throws RevokedException if the grant is revoked or expired
   */
  public Grant authorize(String sessionId) {
    SessionKey key = SessionKey.parse(sessionId);
    return sessionManager.withLock(key, () -> {
      Grant grant = sessionManager.getGrant(sessionId);
      if (!grant.isActive(sessionManager.now())) {
        throw new RevokedException("Grant is no longer active");
      }
      if (grant.isAuthorized()) {
        log.debug("authorize(clientId={}) reusing grant {}", key.clientId(), grant.id());
        return grant;
      }
      List<String> requested = grant.authorizationRequest() == null
          ? List.of() : grant.authorizationRequest().scope();
      List<String> scope = scopePolicy.filterScopes(key.clientId(), requested);

      grant.setScope(scope);
      grant.setResources(List.of(key.clientId()));
      grant.setUsageRules(usageRules(key.clientId()));
      grant.setExpiresAt(sessionManager.now().plus(settings.grantLifetime()));
      grant.setClaims(claimsResolver.getClaimsAllUsage(sessionId, scope));
      grant.markAuthorized();
      sessionManager.set(key.toPath(), grant);
      log.debug("authorize(clientId={}, scope={})", key.clientId(), scope);
      return grant;
    });
  }

  /**
   * The provider's usage rules with the client's registered overrides applied.
   *
   * @param clientId the client
   * @return rules per token type
   */
  public Map<TokenType, UsageRules> usageRules(String clientId) {
    Map<TokenType, UsageRules> rules = new EnumMap<>(TokenType.class);
    rules.putAll(settings.usageRules());
    clients.get(clientId).map(ClientInfo::tokenUsageRules).ifPresent(overrides ->
        overrides.forEach((type, rule) -> rules.put(TokenType.fromValue(type), rule)));
    return rules;
  }
}

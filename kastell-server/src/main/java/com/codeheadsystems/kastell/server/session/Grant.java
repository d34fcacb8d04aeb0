package com.codeheadsystems.kastell.server.session;

import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.model.ClaimSpec;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * What a user granted one client in one authorization, and every token issued under it.
 * <p>
 * The grant is the unit of persistence: minting a token appends to {@link #tokens()} and the
 * whole grant is written back to the store.
 */
public class Grant implements SessionRecord {

  private final String id;
  private final AuthorizationRequest authorizationRequest;
  private final AuthenticationEvent authenticationEvent;
  private final Instant issuedAt;
  private final List<Token> tokens = new ArrayList<>();
  private final Map<TokenType, UsageRules> usageRules = new EnumMap<>(TokenType.class);
  private final Map<ClaimsUsage, Map<String, ClaimSpec>> claims = new EnumMap<>(ClaimsUsage.class);
  private List<String> scope = List.of();
  private List<String> resources = List.of();
  private Instant expiresAt;
  private boolean authorized;
  private boolean revoked;

  /**
   * Instantiates a new Grant with a random id.
   *
   * @param authorizationRequest the request the grant answers
   * @param authenticationEvent  the authentication it is bound to
   * @param usageRules           initial usage rules per token type
   * @param issuedAt             creation time
   */
  public Grant(AuthorizationRequest authorizationRequest, AuthenticationEvent authenticationEvent,
               Map<TokenType, UsageRules> usageRules, Instant issuedAt) {
    this(UUID.randomUUID().toString().replace("-", ""), authorizationRequest, authenticationEvent,
        usageRules, issuedAt);
  }

  public Grant(String id, AuthorizationRequest authorizationRequest,
               AuthenticationEvent authenticationEvent, Map<TokenType, UsageRules> usageRules,
               Instant issuedAt) {
    this.id = id;
    this.authorizationRequest = authorizationRequest;
    this.authenticationEvent = authenticationEvent;
    this.issuedAt = issuedAt;
    if (usageRules != null) {
      this.usageRules.putAll(usageRules);
    }
    if (authorizationRequest != null && authorizationRequest.scope() != null) {
      this.scope = List.copyOf(authorizationRequest.scope());
    }
  }

  public String id() {
    return id;
  }

  public AuthorizationRequest authorizationRequest() {
    return authorizationRequest;
  }

  public AuthenticationEvent authenticationEvent() {
    return authenticationEvent;
  }

  public Instant issuedAt() {
    return issuedAt;
  }

  public List<String> scope() {
    return scope;
  }

  public void setScope(List<String> scope) {
    this.scope = scope == null ? List.of() : List.copyOf(scope);
  }

  public List<String> resources() {
    return resources;
  }

  public void setResources(List<String> resources) {
    this.resources = resources == null ? List.of() : List.copyOf(resources);
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public void setExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  /**
   * Whether the authorization policy already filled in scope, rules and expiry. A grant
   * answered again from the same session keeps what it was given the first time.
   *
   * @return true once authorized
   */
  public boolean isAuthorized() {
    return authorized;
  }

  public void markAuthorized() {
    authorized = true;
  }

  public Map<TokenType, UsageRules> usageRules() {
    return Collections.unmodifiableMap(usageRules);
  }

  public void setUsageRules(Map<TokenType, UsageRules> rules) {
    usageRules.clear();
    usageRules.putAll(rules);
  }

  /**
   * Rules for one token type, {@link UsageRules#NONE} when none are configured.
   *
   * @param type the token type
   * @return the rules
   */
  public UsageRules rulesFor(TokenType type) {
    return usageRules.getOrDefault(type, UsageRules.NONE);
  }

  public Map<ClaimsUsage, Map<String, ClaimSpec>> claims() {
    return Collections.unmodifiableMap(claims);
  }

  /**
   * Claim restriction for one usage, empty when none was resolved.
   *
   * @param usage where the claims are released
   * @return claim name to match spec, null specs allowed
   */
  public Map<String, ClaimSpec> claimsFor(ClaimsUsage usage) {
    return claims.getOrDefault(usage, Map.of());
  }

  public void setClaims(Map<ClaimsUsage, Map<String, ClaimSpec>> resolved) {
    claims.clear();
    resolved.forEach((usage, specs) -> claims.put(usage, new LinkedHashMap<>(specs)));
  }

  public List<Token> tokens() {
    return Collections.unmodifiableList(tokens);
  }

  public Token token(int index) {
    return tokens.get(index);
  }

  public Optional<Token> findToken(String value) {
    return tokens.stream().filter(t -> t.value().equals(value)).findFirst();
  }

  /**
   * Whether the token was issued under this grant.
   *
   * @param token a token
   * @return true if this grant holds a token with the same value at the same index
   */
  public boolean owns(Token token) {
    return token.index() >= 0 && token.index() < tokens.size()
        && tokens.get(token.index()).value().equals(token.value());
  }

  int nextTokenIndex() {
    return tokens.size();
  }

  void append(Token token) {
    if (token.index() != tokens.size()) {
      throw new IllegalStateException("Token index " + token.index() + " out of sequence");
    }
    tokens.add(token);
  }

  void discard(Token token) {
    if (!tokens.isEmpty() && tokens.get(tokens.size() - 1) == token) {
      tokens.remove(tokens.size() - 1);
    }
  }

  public boolean isRevoked() {
    return revoked;
  }

  /**
   * Revokes the grant and every token issued under it.
   */
  public void revoke() {
    revoked = true;
    tokens.forEach(Token::revoke);
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  public boolean isActive(Instant now) {
    return !revoked && !isExpired(now);
  }
}

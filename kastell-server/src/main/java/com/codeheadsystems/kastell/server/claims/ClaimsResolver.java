package com.codeheadsystems.kastell.server.claims;

import com.codeheadsystems.kastell.server.authorization.ScopePolicy;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.model.ClaimSpec;
import com.codeheadsystems.kastell.server.session.ClaimsUsage;
import com.codeheadsystems.kastell.server.session.Grant;
import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionManager;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Works out which claims may be released where, and filters user attributes against it.
 * <p>
 * The restriction for one usage is assembled from four sources, each later one overwriting
 * the {@link ClaimSpec} of a claim an earlier one already named but never dropping a claim:
 * <ol>
 *   <li>the usage's base claims,</li>
 *   <li>the client's registered claims for the usage (when enabled),</li>
 *   <li>the claims of the granted scopes the client may use (when enabled),</li>
 *   <li>the {@code claims} member of the authorization request (ID token and userinfo only).</li>
 * </ol>
 */
public class ClaimsResolver {

  private static final Logger log = LoggerFactory.getLogger(ClaimsResolver.class);

  private final SessionManager sessionManager;
  private final ClientRegistry clients;
  private final ScopePolicy scopePolicy;
  private final ScopeClaims scopeClaims;
  private final ProviderSettings settings;
  private final UserInfoSource userInfoSource;

  public ClaimsResolver(SessionManager sessionManager, ClientRegistry clients,
                        ScopePolicy scopePolicy, ScopeClaims scopeClaims,
                        ProviderSettings settings, UserInfoSource userInfoSource) {
    this.sessionManager = sessionManager;
    this.clients = clients;
    this.scopePolicy = scopePolicy;
    this.scopeClaims = scopeClaims;
    this.settings = settings;
    this.userInfoSource = userInfoSource;
  }

  /**
   * The claim restriction for one usage.
   *
   * @param sessionId the grant's session id
   * @param scopes    the granted scopes
   * @param usage     where the claims go
   * @return claim name to spec, null specs meaning unconstrained
   */
  public Map<String, ClaimSpec> getClaims(String sessionId, List<String> scopes, ClaimsUsage usage) {
    SessionKey key = SessionKey.parse(sessionId);
    ClaimsUsageConfig config = settings.claimsUsageFor(usage);
    Map<String, ClaimSpec> claims = new LinkedHashMap<>(config.baseClaims());

    if (config.enableClaimsPerClient()) {
      ClientInfo client = clients.get(key.clientId()).orElse(null);
      if (client != null) {
        client.addClaims().getOrDefault(usage.value(), List.of())
            .forEach(claim -> claims.put(claim, null));
      }
    }

    if (config.addClaimsByScope() && scopes != null && !scopes.isEmpty()) {
      List<String> permitted = scopePolicy.filterScopes(key.clientId(), scopes);
      scopeClaims.claimsFor(permitted).forEach(claim -> claims.put(claim, null));
    }

    claims.putAll(authorizationRequestClaims(sessionId, usage));
    log.debug("getClaims(usage={}) -> {}", usage.value(), claims.keySet());
    return claims;
  }

  /**
   * {@link #getClaims} for every usage.
   *
   * @param sessionId the grant's session id
   * @param scopes    the granted scopes
   * @return restriction per usage
   */
  public Map<ClaimsUsage, Map<String, ClaimSpec>> getClaimsAllUsage(String sessionId,
                                                                    List<String> scopes) {
    Map<ClaimsUsage, Map<String, ClaimSpec>> all = new EnumMap<>(ClaimsUsage.class);
    for (ClaimsUsage usage : ClaimsUsage.values()) {
      all.put(usage, getClaims(sessionId, scopes, usage));
    }
    return all;
  }

  /**
   * The user's attributes that satisfy the restriction.
   *
   * @param userId      the user
   * @param restriction claim name to spec; empty releases nothing
   * @return claim name to value
   */
  public Map<String, Object> getUserClaims(String userId, Map<String, ClaimSpec> restriction) {
    if (restriction == null || restriction.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> userInfo = userInfoSource.userInfo(userId, null);
    Map<String, Object> released = new LinkedHashMap<>();
    restriction.forEach((claim, spec) -> {
      Object value = userInfo.get(claim);
      if (claimsMatch(value, spec)) {
        released.put(claim, value);
      }
    });
    return released;
  }

  /**
   * Whether a value satisfies a claim spec (OpenID Connect Core §5.5.1).
   * <p>
   * A missing value never matches. A null spec matches anything. A value equal to
   * {@code value} or contained in {@code values} matches, either one is enough when a spec
   * sets both. A spec carrying only {@code essential} matches anything.
   *
   * @param value the user's value, may be null
   * @param spec  the requested constraint, may be null
   * @return true if the value may be released
   */
  public static boolean claimsMatch(Object value, ClaimSpec spec) {
    if (value == null) {
      return false;
    }
    if (spec == null) {
      return true;
    }
    if (spec.value() == null && spec.values() == null) {
      return spec.essential() != null;
    }
    if (spec.value() != null && sameValue(value, spec.value())) {
      return true;
    }
    return spec.values() != null
        && spec.values().stream().anyMatch(candidate -> sameValue(value, candidate));
  }

  private Map<String, ClaimSpec> authorizationRequestClaims(String sessionId, ClaimsUsage usage) {
    if (usage != ClaimsUsage.ID_TOKEN && usage != ClaimsUsage.USERINFO) {
      return Map.of();
    }
    Grant grant = sessionManager.getGrant(sessionId);
    if (grant.authorizationRequest() == null) {
      return Map.of();
    }
    return grant.authorizationRequest().claims().getOrDefault(usage.value(), Map.of());
  }

  // JSON numbers arrive as Integer, Long or Double depending on size
  private static boolean sameValue(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
    }
    return Objects.equals(a, b);
  }
}

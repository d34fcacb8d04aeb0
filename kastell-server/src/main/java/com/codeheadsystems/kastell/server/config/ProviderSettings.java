package com.codeheadsystems.kastell.server.config;

import com.codeheadsystems.kastell.server.claims.ClaimsUsageConfig;
import com.codeheadsystems.kastell.server.session.ClaimsUsage;
import com.codeheadsystems.kastell.server.session.TokenType;
import com.codeheadsystems.kastell.server.session.UsageRules;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider-wide settings. Framework adapters build one from their own configuration.
 *
 * @param issuer                                 the issuer identifier, an https URL without trailing slash
 * @param scopesSupported                        scopes any client may request unless it registered its own list
 * @param denyUnknownScopes                      reject requests asking for scopes outside the allowed set
 * @param responseTypesSupported                 response types the provider handles
 * @param idTokenSigningAlg                      default JWS algorithm for ID tokens and logout tokens
 * @param requestObjectSigningAlgValuesSupported algorithms accepted on request objects
 * @param usageRules                             default usage rules per token type
 * @param grantLifetime                          lifetime of a grant
 * @param authenticationLifetime                 how long an authentication event stays valid
 * @param sessionCookieName                      name of the session cookie
 * @param sessionManagementCookieName            name of the browser-state (opbs) cookie
 * @param checkSessionIframe                     URL of the check-session iframe, null disables session_state
 * @param endpoints                              endpoint paths
 * @param parLifetime                            lifetime of a pushed authorization request
 * @param logoutTokenLifetime                    lifetime of back-channel logout tokens
 * @param logoutConfirmationLifetime             lifetime of end-session confirmation tokens
 * @param claimsUsage                            claim gathering per usage
 * @param customScopes                           extra scope to claims mappings
 * @param upmAnswerForcesReauthentication        treat {@code upm_answer=true} as {@code max_age=0}
 * @param remoteTimeout                          connect and request timeout of request_uri fetches and back-channel calls
 */
public record ProviderSettings(
    String issuer,
    List<String> scopesSupported,
    boolean denyUnknownScopes,
    List<String> responseTypesSupported,
    String idTokenSigningAlg,
    List<String> requestObjectSigningAlgValuesSupported,
    Map<TokenType, UsageRules> usageRules,
    Duration grantLifetime,
    Duration authenticationLifetime,
    String sessionCookieName,
    String sessionManagementCookieName,
    String checkSessionIframe,
    Endpoints endpoints,
    Duration parLifetime,
    Duration logoutTokenLifetime,
    Duration logoutConfirmationLifetime,
    Map<ClaimsUsage, ClaimsUsageConfig> claimsUsage,
    Map<String, List<String>> customScopes,
    boolean upmAnswerForcesReauthentication,
    Duration remoteTimeout) {

  public ProviderSettings {
    if (issuer == null || issuer.isBlank()) {
      throw new IllegalArgumentException("issuer is required");
    }
    if (issuer.endsWith("/")) {
      issuer = issuer.substring(0, issuer.length() - 1);
    }
    scopesSupported = List.copyOf(scopesSupported);
    responseTypesSupported = List.copyOf(responseTypesSupported);
    requestObjectSigningAlgValuesSupported = List.copyOf(requestObjectSigningAlgValuesSupported);
    usageRules = Map.copyOf(usageRules);
    claimsUsage = Map.copyOf(claimsUsage);
    customScopes = Map.copyOf(customScopes);
  }

  public static Builder builder(String issuer) {
    return new Builder(issuer);
  }

  public ClaimsUsageConfig claimsUsageFor(ClaimsUsage usage) {
    return claimsUsage.getOrDefault(usage, ClaimsUsageConfig.NONE);
  }

  /**
   * Absolute URL of an endpoint path.
   *
   * @param path a path starting with {@code /}
   * @return issuer + path
   */
  public String url(String path) {
    return issuer + path;
  }

  /**
   * Paths of the provider's endpoints, relative to the issuer.
   *
   * @param authorization      authorization endpoint
   * @param token              token endpoint
   * @param userinfo           userinfo endpoint
   * @param endSession         end-session endpoint
   * @param logoutVerify       where the end-session confirmation is verified
   * @param postLogout         default post-logout landing page
   * @param pushedAuthorization PAR endpoint
   * @param authentication     where the authentication method is handed off to
   * @param jwks               JWK set
   * @param introspection      token introspection endpoint
   */
  public record Endpoints(String authorization, String token, String userinfo, String endSession,
                          String logoutVerify, String postLogout, String pushedAuthorization,
                          String authentication, String jwks, String introspection) {

    public static Endpoints defaults() {
      return new Endpoints("/authorization", "/token", "/userinfo", "/end_session",
          "/verify_logout", "/post_logout", "/par", "/authn", "/jwks", "/introspection");
    }
  }

  /**
   * Builder with the provider defaults.
   */
  public static class Builder {
    private final String issuer;
    private List<String> scopesSupported = List.of("openid", "profile", "email", "address",
        "phone", "offline_access");
    private boolean denyUnknownScopes;
    private List<String> responseTypesSupported = List.of("code", "token", "id_token",
        "code token", "code id_token", "id_token token", "code id_token token", "none");
    private String idTokenSigningAlg = "RS256";
    private List<String> requestObjectSigningAlgValuesSupported = List.of("HS256", "HS384", "HS512");
    private Map<TokenType, UsageRules> usageRules = UsageRules.defaults();
    private Duration grantLifetime = Duration.ofSeconds(43200);
    private Duration authenticationLifetime = Duration.ofHours(1);
    private String sessionCookieName = "kastell_session";
    private String sessionManagementCookieName = "kastell_session_management";
    private String checkSessionIframe;
    private Endpoints endpoints = Endpoints.defaults();
    private Duration parLifetime = Duration.ofSeconds(3600);
    private Duration logoutTokenLifetime = Duration.ofSeconds(86400);
    private Duration logoutConfirmationLifetime = Duration.ofSeconds(300);
    private final Map<ClaimsUsage, ClaimsUsageConfig> claimsUsage = defaultClaimsUsage();
    private Map<String, List<String>> customScopes = new LinkedHashMap<>();
    private boolean upmAnswerForcesReauthentication = true;
    private Duration remoteTimeout = Duration.ofSeconds(5);

    private Builder(String issuer) {
      this.issuer = issuer;
    }

    public Builder scopesSupported(List<String> scopes) {
      this.scopesSupported = scopes;
      return this;
    }

    public Builder denyUnknownScopes(boolean deny) {
      this.denyUnknownScopes = deny;
      return this;
    }

    public Builder responseTypesSupported(List<String> types) {
      this.responseTypesSupported = types;
      return this;
    }

    public Builder idTokenSigningAlg(String alg) {
      this.idTokenSigningAlg = alg;
      return this;
    }

    public Builder requestObjectSigningAlgValuesSupported(List<String> algs) {
      this.requestObjectSigningAlgValuesSupported = algs;
      return this;
    }

    public Builder usageRules(Map<TokenType, UsageRules> rules) {
      this.usageRules = rules;
      return this;
    }

    public Builder usageRules(TokenType type, UsageRules rules) {
      Map<TokenType, UsageRules> copy = new EnumMap<>(TokenType.class);
      copy.putAll(this.usageRules);
      copy.put(type, rules);
      this.usageRules = copy;
      return this;
    }

    public Builder grantLifetime(Duration lifetime) {
      this.grantLifetime = lifetime;
      return this;
    }

    public Builder authenticationLifetime(Duration lifetime) {
      this.authenticationLifetime = lifetime;
      return this;
    }

    public Builder sessionCookieName(String name) {
      this.sessionCookieName = name;
      return this;
    }

    public Builder sessionManagementCookieName(String name) {
      this.sessionManagementCookieName = name;
      return this;
    }

    public Builder checkSessionIframe(String url) {
      this.checkSessionIframe = url;
      return this;
    }

    public Builder endpoints(Endpoints endpoints) {
      this.endpoints = endpoints;
      return this;
    }

    public Builder parLifetime(Duration lifetime) {
      this.parLifetime = lifetime;
      return this;
    }

    public Builder logoutTokenLifetime(Duration lifetime) {
      this.logoutTokenLifetime = lifetime;
      return this;
    }

    public Builder logoutConfirmationLifetime(Duration lifetime) {
      this.logoutConfirmationLifetime = lifetime;
      return this;
    }

    public Builder claimsUsage(ClaimsUsage usage, ClaimsUsageConfig config) {
      this.claimsUsage.put(usage, config);
      return this;
    }

    public Builder customScopes(Map<String, List<String>> scopes) {
      this.customScopes = scopes;
      return this;
    }

    public Builder upmAnswerForcesReauthentication(boolean forces) {
      this.upmAnswerForcesReauthentication = forces;
      return this;
    }

    public Builder remoteTimeout(Duration timeout) {
      this.remoteTimeout = timeout;
      return this;
    }

    public ProviderSettings build() {
      return new ProviderSettings(issuer, scopesSupported, denyUnknownScopes,
          responseTypesSupported, idTokenSigningAlg, requestObjectSigningAlgValuesSupported,
          usageRules, grantLifetime, authenticationLifetime, sessionCookieName,
          sessionManagementCookieName, checkSessionIframe, endpoints, parLifetime,
          logoutTokenLifetime, logoutConfirmationLifetime, claimsUsage, customScopes,
          upmAnswerForcesReauthentication, remoteTimeout);
    }

    private static Map<ClaimsUsage, ClaimsUsageConfig> defaultClaimsUsage() {
      Map<ClaimsUsage, ClaimsUsageConfig> map = new EnumMap<>(ClaimsUsage.class);
      map.put(ClaimsUsage.USERINFO, new ClaimsUsageConfig(Map.of(), true, true));
      map.put(ClaimsUsage.ID_TOKEN, new ClaimsUsageConfig(Map.of(), true, false));
      map.put(ClaimsUsage.INTROSPECTION, ClaimsUsageConfig.NONE);
      map.put(ClaimsUsage.ACCESS_TOKEN, ClaimsUsageConfig.NONE);
      return map;
    }
  }
}

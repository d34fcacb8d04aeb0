package com.codeheadsystems.kastell.dropwizard;

import com.codeheadsystems.kastell.server.authn.AuthenticationMethodRegistry.MethodConfig;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dropwizard configuration for the Kastell OpenID Provider.
 * <p>
 * For production, supply all four key values ({@code tokenSecretHex}, {@code cookieSecretHex},
 * {@code sidSecretHex}, {@code rsaPrivateKeyBase64}) so that tokens, cookies and logout
 * confirmations survive restarts. Omitting all of them causes random key generation on each
 * startup (dev/test only).
 * <p>
 * Generate secrets with: {@code openssl rand -hex 32}
 */
public class KastellConfiguration extends Configuration {

  /**
   * Issuer identifier. Every endpoint URL in the discovery document is built from it, so it
   * must be the externally visible base URL of this application.
   */
  @NotEmpty
  private String issuer = "http://localhost:8080";

  /**
   * Hex-encoded HMAC secret of the token codec (at least 32 bytes).
   */
  private String tokenSecretHex = "";

  /**
   * Hex-encoded HMAC secret of the session cookie dealer (at least 32 bytes).
   */
  private String cookieSecretHex = "";

  /**
   * Hex-encoded secret of the sid cipher used by logout confirmation (at least 32 bytes).
   */
  private String sidSecretHex = "";

  /**
   * Base64 PKCS#8 DER RSA private key used to sign ID Tokens and logout tokens.
   */
  private String rsaPrivateKeyBase64 = "";

  /**
   * Registered relying parties, in registration metadata form ({@code client_id},
   * {@code redirect_uris}, ...).
   */
  private List<ClientInfo> clients = new ArrayList<>();

  /**
   * Authentication methods offered to end users. Empty means a single no-op method logging
   * everyone in as a fixed user.
   */
  private List<MethodConfig> authenticationMethods = new ArrayList<>();

  /**
   * Claims of each known user, keyed by user id.
   */
  private Map<String, Map<String, Object>> users = new LinkedHashMap<>();

  /**
   * Extra scopes and the claims they release.
   */
  private Map<String, List<String>> customScopes = new LinkedHashMap<>();

  /**
   * Reject authorization requests naming scopes the provider does not know instead of
   * dropping those scopes.
   */
  private boolean denyUnknownScopes = false;

  /**
   * Lifetime in seconds of pushed authorization requests.
   */
  @Min(1)
  private long parLifetimeSeconds = 3600;

  /**
   * Lifetime in seconds of a grant.
   */
  @Min(1)
  private long grantLifetimeSeconds = 43200;

  /**
   * URL of the session management check_session_iframe, advertised in discovery when set.
   */
  private String checkSessionIframe = "";

  /**
   * Mark provider cookies Secure. Turn off only for plain-HTTP development.
   */
  private boolean secureCookies = true;

  /**
   * Salt for pairwise subject identifiers. Leave empty to derive one from the sid secret.
   */
  private String subjectSalt = "";

  @JsonProperty
  public String getIssuer() {
    return issuer;
  }

  @JsonProperty
  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  @JsonProperty
  public String getTokenSecretHex() {
    return tokenSecretHex;
  }

  @JsonProperty
  public void setTokenSecretHex(String tokenSecretHex) {
    this.tokenSecretHex = tokenSecretHex;
  }

  @JsonProperty
  public String getCookieSecretHex() {
    return cookieSecretHex;
  }

  @JsonProperty
  public void setCookieSecretHex(String cookieSecretHex) {
    this.cookieSecretHex = cookieSecretHex;
  }

  @JsonProperty
  public String getSidSecretHex() {
    return sidSecretHex;
  }

  @JsonProperty
  public void setSidSecretHex(String sidSecretHex) {
    this.sidSecretHex = sidSecretHex;
  }

  @JsonProperty
  public String getRsaPrivateKeyBase64() {
    return rsaPrivateKeyBase64;
  }

  @JsonProperty
  public void setRsaPrivateKeyBase64(String rsaPrivateKeyBase64) {
    this.rsaPrivateKeyBase64 = rsaPrivateKeyBase64;
  }

  @JsonProperty
  public List<ClientInfo> getClients() {
    return clients;
  }

  @JsonProperty
  public void setClients(List<ClientInfo> clients) {
    this.clients = clients;
  }

  @JsonProperty
  public List<MethodConfig> getAuthenticationMethods() {
    return authenticationMethods;
  }

  @JsonProperty
  public void setAuthenticationMethods(List<MethodConfig> authenticationMethods) {
    this.authenticationMethods = authenticationMethods;
  }

  @JsonProperty
  public Map<String, Map<String, Object>> getUsers() {
    return users;
  }

  @JsonProperty
  public void setUsers(Map<String, Map<String, Object>> users) {
    this.users = users;
  }

  @JsonProperty
  public Map<String, List<String>> getCustomScopes() {
    return customScopes;
  }

  @JsonProperty
  public void setCustomScopes(Map<String, List<String>> customScopes) {
    this.customScopes = customScopes;
  }

  @JsonProperty
  public boolean isDenyUnknownScopes() {
    return denyUnknownScopes;
  }

  @JsonProperty
  public void setDenyUnknownScopes(boolean denyUnknownScopes) {
    this.denyUnknownScopes = denyUnknownScopes;
  }

  @JsonProperty
  public long getParLifetimeSeconds() {
    return parLifetimeSeconds;
  }

  @JsonProperty
  public void setParLifetimeSeconds(long parLifetimeSeconds) {
    this.parLifetimeSeconds = parLifetimeSeconds;
  }

  @JsonProperty
  public long getGrantLifetimeSeconds() {
    return grantLifetimeSeconds;
  }

  @JsonProperty
  public void setGrantLifetimeSeconds(long grantLifetimeSeconds) {
    this.grantLifetimeSeconds = grantLifetimeSeconds;
  }

  @JsonProperty
  public String getCheckSessionIframe() {
    return checkSessionIframe;
  }

  @JsonProperty
  public void setCheckSessionIframe(String checkSessionIframe) {
    this.checkSessionIframe = checkSessionIframe;
  }

  @JsonProperty
  public boolean isSecureCookies() {
    return secureCookies;
  }

  @JsonProperty
  public void setSecureCookies(boolean secureCookies) {
    this.secureCookies = secureCookies;
  }

  @JsonProperty
  public String getSubjectSalt() {
    return subjectSalt;
  }

  @JsonProperty
  public void setSubjectSalt(String subjectSalt) {
    this.subjectSalt = subjectSalt;
  }
}

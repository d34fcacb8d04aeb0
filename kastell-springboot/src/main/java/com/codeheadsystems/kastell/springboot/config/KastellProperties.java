package com.codeheadsystems.kastell.springboot.config;

import com.codeheadsystems.kastell.server.authn.AuthenticationMethodRegistry.MethodConfig;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "kastell")
public class KastellProperties {

  private String issuer = "http://localhost:8080";
  private String tokenSecretHex = "";
  private String cookieSecretHex = "";
  private String sidSecretHex = "";
  private String rsaPrivateKeyBase64 = "";
  private List<Client> clients = new ArrayList<>();
  private List<Method> authenticationMethods = new ArrayList<>();
  private Map<String, Map<String, Object>> users = new LinkedHashMap<>();
  private Map<String, List<String>> customScopes = new LinkedHashMap<>();
  private boolean denyUnknownScopes = false;
  private long parLifetimeSeconds = 3600;
  private long grantLifetimeSeconds = 43200;
  private String checkSessionIframe = "";
  private boolean secureCookies = true;
  private String subjectSalt = "";

  public String getIssuer() {
    return issuer;
  }

  public void setIssuer(String issuer) {
    this.issuer = issuer;
  }

  public String getTokenSecretHex() {
    return tokenSecretHex;
  }

  public void setTokenSecretHex(String tokenSecretHex) {
    this.tokenSecretHex = tokenSecretHex;
  }

  public String getCookieSecretHex() {
    return cookieSecretHex;
  }

  public void setCookieSecretHex(String cookieSecretHex) {
    this.cookieSecretHex = cookieSecretHex;
  }

  public String getSidSecretHex() {
    return sidSecretHex;
  }

  public void setSidSecretHex(String sidSecretHex) {
    this.sidSecretHex = sidSecretHex;
  }

  public String getRsaPrivateKeyBase64() {
    return rsaPrivateKeyBase64;
  }

  public void setRsaPrivateKeyBase64(String rsaPrivateKeyBase64) {
    this.rsaPrivateKeyBase64 = rsaPrivateKeyBase64;
  }

  public List<Client> getClients() {
    return clients;
  }

  public void setClients(List<Client> clients) {
    this.clients = clients;
  }

  public List<Method> getAuthenticationMethods() {
    return authenticationMethods;
  }

  public void setAuthenticationMethods(List<Method> authenticationMethods) {
    this.authenticationMethods = authenticationMethods;
  }

  public Map<String, Map<String, Object>> getUsers() {
    return users;
  }

  public void setUsers(Map<String, Map<String, Object>> users) {
    this.users = users;
  }

  public Map<String, List<String>> getCustomScopes() {
    return customScopes;
  }

  public void setCustomScopes(Map<String, List<String>> customScopes) {
    this.customScopes = customScopes;
  }

  public boolean isDenyUnknownScopes() {
    return denyUnknownScopes;
  }

  public void setDenyUnknownScopes(boolean denyUnknownScopes) {
    this.denyUnknownScopes = denyUnknownScopes;
  }

  public long getParLifetimeSeconds() {
    return parLifetimeSeconds;
  }

  public void setParLifetimeSeconds(long parLifetimeSeconds) {
    this.parLifetimeSeconds = parLifetimeSeconds;
  }

  public long getGrantLifetimeSeconds() {
    return grantLifetimeSeconds;
  }

  public void setGrantLifetimeSeconds(long grantLifetimeSeconds) {
    this.grantLifetimeSeconds = grantLifetimeSeconds;
  }

  public String getCheckSessionIframe() {
    return checkSessionIframe;
  }

  public void setCheckSessionIframe(String checkSessionIframe) {
    this.checkSessionIframe = checkSessionIframe;
  }

  public boolean isSecureCookies() {
    return secureCookies;
  }

  public void setSecureCookies(boolean secureCookies) {
    this.secureCookies = secureCookies;
  }

  public String getSubjectSalt() {
    return subjectSalt;
  }

  public void setSubjectSalt(String subjectSalt) {
    this.subjectSalt = subjectSalt;
  }

  /**
   * One registered relying party. Property names follow Spring's relaxed binding
   * ({@code client-id}, {@code redirect-uris}, ...).
   */
  public static class Client {

    private String clientId;
    private String clientSecret;
    private List<String> redirectUris = new ArrayList<>();
    private List<String> postLogoutRedirectUris = new ArrayList<>();
    private List<String> responseTypes = new ArrayList<>();
    private List<String> allowedScopes = new ArrayList<>();
    private String backchannelLogoutUri;
    private String frontchannelLogoutUri;
    private boolean frontchannelLogoutSessionRequired;
    private String sectorIdentifier;

    public ClientInfo toClientInfo() {
      ClientInfo.Builder builder = ClientInfo.builder(clientId)
          .clientSecret(clientSecret)
          .redirectUris(redirectUris.toArray(String[]::new))
          .postLogoutRedirectUris(postLogoutRedirectUris.toArray(String[]::new))
          .responseTypes(responseTypes.toArray(String[]::new))
          .allowedScopes(allowedScopes.toArray(String[]::new))
          .backchannelLogoutUri(backchannelLogoutUri);
      if (frontchannelLogoutUri != null) {
        builder.frontchannelLogoutUri(frontchannelLogoutUri, frontchannelLogoutSessionRequired);
      }
      if (sectorIdentifier != null) {
        builder.pairwise(sectorIdentifier);
      }
      return builder.build();
    }

    public String getClientId() {
      return clientId;
    }

    public void setClientId(String clientId) {
      this.clientId = clientId;
    }

    public String getClientSecret() {
      return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
    }

    public List<String> getRedirectUris() {
      return redirectUris;
    }

    public void setRedirectUris(List<String> redirectUris) {
      this.redirectUris = redirectUris;
    }

    public List<String> getPostLogoutRedirectUris() {
      return postLogoutRedirectUris;
    }

    public void setPostLogoutRedirectUris(List<String> postLogoutRedirectUris) {
      this.postLogoutRedirectUris = postLogoutRedirectUris;
    }

    public List<String> getResponseTypes() {
      return responseTypes;
    }

    public void setResponseTypes(List<String> responseTypes) {
      this.responseTypes = responseTypes;
    }

    public List<String> getAllowedScopes() {
      return allowedScopes;
    }

    public void setAllowedScopes(List<String> allowedScopes) {
      this.allowedScopes = allowedScopes;
    }

    public String getBackchannelLogoutUri() {
      return backchannelLogoutUri;
    }

    public void setBackchannelLogoutUri(String backchannelLogoutUri) {
      this.backchannelLogoutUri = backchannelLogoutUri;
    }

    public String getFrontchannelLogoutUri() {
      return frontchannelLogoutUri;
    }

    public void setFrontchannelLogoutUri(String frontchannelLogoutUri) {
      this.frontchannelLogoutUri = frontchannelLogoutUri;
    }

    public boolean isFrontchannelLogoutSessionRequired() {
      return frontchannelLogoutSessionRequired;
    }

    public void setFrontchannelLogoutSessionRequired(boolean frontchannelLogoutSessionRequired) {
      this.frontchannelLogoutSessionRequired = frontchannelLogoutSessionRequired;
    }

    public String getSectorIdentifier() {
      return sectorIdentifier;
    }

    public void setSectorIdentifier(String sectorIdentifier) {
      this.sectorIdentifier = sectorIdentifier;
    }
  }

  /**
   * One end-user authentication method.
   */
  public static class Method {

    private String id;
    private String type;
    private String acr;
    private Map<String, String> arguments = new LinkedHashMap<>();

    public MethodConfig toMethodConfig() {
      return new MethodConfig(id, type, acr, arguments);
    }

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public String getAcr() {
      return acr;
    }

    public void setAcr(String acr) {
      this.acr = acr;
    }

    public Map<String, String> getArguments() {
      return arguments;
    }

    public void setArguments(Map<String, String> arguments) {
      this.arguments = arguments;
    }
  }
}

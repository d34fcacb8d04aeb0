package com.codeheadsystems.kastell.server.client;

import com.codeheadsystems.kastell.server.session.UsageRules;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registered metadata of one relying party, named as in OpenID Connect Dynamic Client
 * Registration §2 and the logout specifications.
 *
 * @param clientId                          client_id
 * @param clientSecret                      client_secret, null for public clients
 * @param redirectUris                      redirect_uris
 * @param postLogoutRedirectUris            post_logout_redirect_uris
 * @param responseTypes                     response_types, each a space separated set
 * @param allowedScopes                     scopes this client may request, empty for the provider's
 * @param requestUris                       request_uris the client may reference
 * @param backchannelLogoutUri              backchannel_logout_uri
 * @param frontchannelLogoutUri             frontchannel_logout_uri
 * @param frontchannelLogoutSessionRequired frontchannel_logout_session_required
 * @param idTokenSignedResponseAlg          id_token_signed_response_alg
 * @param requestObjectSigningAlg           request_object_signing_alg
 * @param subjectType                       subject_type, {@code public} or {@code pairwise}
 * @param sectorIdentifier                  sector identifier for pairwise subjects
 * @param addClaims                         per-client claims by usage ({@code userinfo}, {@code id_token}, ...)
 * @param tokenUsageRules                   per-client usage rules by token type, overriding the provider's
 * @param policyUri                         policy_uri
 * @param logoUri                           logo_uri
 * @param tosUri                            tos_uri
 */
public record ClientInfo(
    @JsonProperty("client_id") String clientId,
    @JsonProperty("client_secret") String clientSecret,
    @JsonProperty("redirect_uris") List<String> redirectUris,
    @JsonProperty("post_logout_redirect_uris") List<String> postLogoutRedirectUris,
    @JsonProperty("response_types") List<String> responseTypes,
    @JsonProperty("allowed_scopes") List<String> allowedScopes,
    @JsonProperty("request_uris") List<String> requestUris,
    @JsonProperty("backchannel_logout_uri") String backchannelLogoutUri,
    @JsonProperty("frontchannel_logout_uri") String frontchannelLogoutUri,
    @JsonProperty("frontchannel_logout_session_required") boolean frontchannelLogoutSessionRequired,
    @JsonProperty("id_token_signed_response_alg") String idTokenSignedResponseAlg,
    @JsonProperty("request_object_signing_alg") String requestObjectSigningAlg,
    @JsonProperty("subject_type") String subjectType,
    @JsonProperty("sector_identifier") String sectorIdentifier,
    @JsonProperty("add_claims") Map<String, List<String>> addClaims,
    @JsonProperty("token_usage_rules") Map<String, UsageRules> tokenUsageRules,
    @JsonProperty("policy_uri") String policyUri,
    @JsonProperty("logo_uri") String logoUri,
    @JsonProperty("tos_uri") String tosUri) {

  public ClientInfo {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("client_id is required");
    }
    redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
    postLogoutRedirectUris = postLogoutRedirectUris == null ? List.of() : List.copyOf(postLogoutRedirectUris);
    responseTypes = responseTypes == null ? List.of() : List.copyOf(responseTypes);
    allowedScopes = allowedScopes == null ? List.of() : List.copyOf(allowedScopes);
    requestUris = requestUris == null ? List.of() : List.copyOf(requestUris);
    addClaims = addClaims == null ? Map.of() : Map.copyOf(addClaims);
    tokenUsageRules = tokenUsageRules == null ? Map.of() : Map.copyOf(tokenUsageRules);
  }

  public static Builder builder(String clientId) {
    return new Builder(clientId);
  }

  /**
   * Registered response types as sets. A client that registered none may use {@code code}.
   *
   * @return the allowed response type sets
   */
  @JsonIgnore
  public List<Set<String>> responseTypeSets() {
    if (responseTypes.isEmpty()) {
      return List.of(Set.of("code"));
    }
    List<Set<String>> sets = new ArrayList<>();
    for (String type : responseTypes) {
      sets.add(new LinkedHashSet<>(Arrays.asList(type.trim().split("\\s+"))));
    }
    return sets;
  }

  @JsonIgnore
  public boolean isPairwise() {
    return "pairwise".equals(subjectType);
  }

  /**
   * Builder for {@link ClientInfo}.
   */
  public static class Builder {
    private final String clientId;
    private String clientSecret;
    private List<String> redirectUris = List.of();
    private List<String> postLogoutRedirectUris = List.of();
    private List<String> responseTypes = List.of();
    private List<String> allowedScopes = List.of();
    private List<String> requestUris = List.of();
    private String backchannelLogoutUri;
    private String frontchannelLogoutUri;
    private boolean frontchannelLogoutSessionRequired;
    private String idTokenSignedResponseAlg;
    private String requestObjectSigningAlg;
    private String subjectType;
    private String sectorIdentifier;
    private final Map<String, List<String>> addClaims = new LinkedHashMap<>();
    private final Map<String, UsageRules> tokenUsageRules = new LinkedHashMap<>();
    private String policyUri;
    private String logoUri;
    private String tosUri;

    private Builder(String clientId) {
      this.clientId = clientId;
    }

    public Builder clientSecret(String clientSecret) {
      this.clientSecret = clientSecret;
      return this;
    }

    public Builder redirectUris(String... uris) {
      this.redirectUris = List.of(uris);
      return this;
    }

    public Builder postLogoutRedirectUris(String... uris) {
      this.postLogoutRedirectUris = List.of(uris);
      return this;
    }

    public Builder responseTypes(String... types) {
      this.responseTypes = List.of(types);
      return this;
    }

    public Builder allowedScopes(String... scopes) {
      this.allowedScopes = List.of(scopes);
      return this;
    }

    public Builder requestUris(String... uris) {
      this.requestUris = List.of(uris);
      return this;
    }

    public Builder backchannelLogoutUri(String uri) {
      this.backchannelLogoutUri = uri;
      return this;
    }

    public Builder frontchannelLogoutUri(String uri, boolean sessionRequired) {
      this.frontchannelLogoutUri = uri;
      this.frontchannelLogoutSessionRequired = sessionRequired;
      return this;
    }

    public Builder idTokenSignedResponseAlg(String alg) {
      this.idTokenSignedResponseAlg = alg;
      return this;
    }

    public Builder requestObjectSigningAlg(String alg) {
      this.requestObjectSigningAlg = alg;
      return this;
    }

    public Builder pairwise(String sectorIdentifier) {
      this.subjectType = "pairwise";
      this.sectorIdentifier = sectorIdentifier;
      return this;
    }

    public Builder addClaims(String usage, List<String> claims) {
      this.addClaims.put(usage, List.copyOf(claims));
      return this;
    }

    public Builder tokenUsageRules(String tokenType, UsageRules rules) {
      this.tokenUsageRules.put(tokenType, rules);
      return this;
    }

    public Builder policyUri(String uri) {
      this.policyUri = uri;
      return this;
    }

    public Builder logoUri(String uri) {
      this.logoUri = uri;
      return this;
    }

    public Builder tosUri(String uri) {
      this.tosUri = uri;
      return this;
    }

    public ClientInfo build() {
      return new ClientInfo(clientId, clientSecret, redirectUris, postLogoutRedirectUris,
          responseTypes, allowedScopes, requestUris, backchannelLogoutUri, frontchannelLogoutUri,
          frontchannelLogoutSessionRequired, idTokenSignedResponseAlg, requestObjectSigningAlg,
          subjectType, sectorIdentifier, addClaims, tokenUsageRules, policyUri, logoUri, tosUri);
    }
  }
}

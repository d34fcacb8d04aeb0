package com.codeheadsystems.kastell.server.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A parsed OAuth2 / OpenID Connect authorization request.
 * <p>
 * Grants keep the request they answer; two requests are "the same" when the records are
 * equal, which decides whether an existing grant can be reused.
 *
 * @param clientId     client_id
 * @param responseType response_type, split on spaces
 * @param redirectUri  redirect_uri, may be null
 * @param scope        scope, split on spaces
 * @param state        state
 * @param nonce        nonce
 * @param responseMode response_mode
 * @param prompt       prompt, split on spaces
 * @param maxAge       max_age in seconds
 * @param acrValues    acr_values, split on spaces
 * @param loginHint    login_hint
 * @param uiLocales    ui_locales
 * @param claims       the claims parameter, keyed by {@code id_token} / {@code userinfo}
 * @param request      request object (JWT)
 * @param requestUri   request_uri
 * @param upmAnswer    upm_answer
 */
public record AuthorizationRequest(
    String clientId,
    List<String> responseType,
    String redirectUri,
    List<String> scope,
    String state,
    String nonce,
    String responseMode,
    List<String> prompt,
    Long maxAge,
    List<String> acrValues,
    String loginHint,
    String uiLocales,
    Map<String, Map<String, ClaimSpec>> claims,
    String request,
    String requestUri,
    String upmAnswer) {

  public AuthorizationRequest {
    responseType = responseType == null ? List.of() : List.copyOf(responseType);
    scope = scope == null ? List.of() : List.copyOf(scope);
    prompt = prompt == null ? List.of() : List.copyOf(prompt);
    acrValues = acrValues == null ? List.of() : List.copyOf(acrValues);
    claims = claims == null ? Map.of() : Map.copyOf(claims);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .clientId(clientId).responseType(responseType).redirectUri(redirectUri).scope(scope)
        .state(state).nonce(nonce).responseMode(responseMode).prompt(prompt).maxAge(maxAge)
        .acrValues(acrValues).loginHint(loginHint).uiLocales(uiLocales).claims(claims)
        .request(request).requestUri(requestUri).upmAnswer(upmAnswer);
  }

  /**
   * The response types as a set, so that {@code "code id_token"} equals {@code "id_token code"}.
   *
   * @return the set
   */
  public Set<String> responseTypeSet() {
    return new LinkedHashSet<>(responseType);
  }

  public boolean hasPrompt(String value) {
    return prompt.contains(value);
  }

  public boolean hasScope(String value) {
    return scope.contains(value);
  }

  public AuthorizationRequest withRedirectUri(String uri) {
    return toBuilder().redirectUri(uri).build();
  }

  public AuthorizationRequest withMaxAge(Long seconds) {
    return toBuilder().maxAge(seconds).build();
  }

  /**
   * Wire form of the request, multi-valued members joined by spaces. The claims member
   * is left out, callers that need it serialize it themselves.
   *
   * @return parameter name to value, absent members omitted
   */
  public Map<String, String> toParameters() {
    Map<String, String> params = new LinkedHashMap<>();
    put(params, "client_id", clientId);
    put(params, "response_type", join(responseType));
    put(params, "redirect_uri", redirectUri);
    put(params, "scope", join(scope));
    put(params, "state", state);
    put(params, "nonce", nonce);
    put(params, "response_mode", responseMode);
    put(params, "prompt", join(prompt));
    put(params, "max_age", maxAge == null ? null : maxAge.toString());
    put(params, "acr_values", join(acrValues));
    put(params, "login_hint", loginHint);
    put(params, "ui_locales", uiLocales);
    put(params, "request", request);
    put(params, "request_uri", requestUri);
    put(params, "upm_answer", upmAnswer);
    return params;
  }

  private static void put(Map<String, String> params, String name, String value) {
    if (value != null && !value.isEmpty()) {
      params.put(name, value);
    }
  }

  private static String join(List<String> values) {
    return String.join(" ", values);
  }

  /**
   * Builder for {@link AuthorizationRequest}.
   */
  public static class Builder {
    private String clientId;
    private List<String> responseType = new ArrayList<>();
    private String redirectUri;
    private List<String> scope = new ArrayList<>();
    private String state;
    private String nonce;
    private String responseMode;
    private List<String> prompt = new ArrayList<>();
    private Long maxAge;
    private List<String> acrValues = new ArrayList<>();
    private String loginHint;
    private String uiLocales;
    private Map<String, Map<String, ClaimSpec>> claims = Map.of();
    private String request;
    private String requestUri;
    private String upmAnswer;

    public Builder clientId(String clientId) {
      this.clientId = clientId;
      return this;
    }

    public Builder responseType(List<String> responseType) {
      this.responseType = responseType;
      return this;
    }

    public Builder responseType(String... responseType) {
      return responseType(List.of(responseType));
    }

    public Builder redirectUri(String redirectUri) {
      this.redirectUri = redirectUri;
      return this;
    }

    public Builder scope(List<String> scope) {
      this.scope = scope;
      return this;
    }

    public Builder scope(String... scope) {
      return scope(List.of(scope));
    }

    public Builder state(String state) {
      this.state = state;
      return this;
    }

    public Builder nonce(String nonce) {
      this.nonce = nonce;
      return this;
    }

    public Builder responseMode(String responseMode) {
      this.responseMode = responseMode;
      return this;
    }

    public Builder prompt(List<String> prompt) {
      this.prompt = prompt;
      return this;
    }

    public Builder prompt(String... prompt) {
      return prompt(List.of(prompt));
    }

    public Builder maxAge(Long maxAge) {
      this.maxAge = maxAge;
      return this;
    }

    public Builder acrValues(List<String> acrValues) {
      this.acrValues = acrValues;
      return this;
    }

    public Builder loginHint(String loginHint) {
      this.loginHint = loginHint;
      return this;
    }

    public Builder uiLocales(String uiLocales) {
      this.uiLocales = uiLocales;
      return this;
    }

    public Builder claims(Map<String, Map<String, ClaimSpec>> claims) {
      this.claims = claims;
      return this;
    }

    public Builder request(String request) {
      this.request = request;
      return this;
    }

    public Builder requestUri(String requestUri) {
      this.requestUri = requestUri;
      return this;
    }

    public Builder upmAnswer(String upmAnswer) {
      this.upmAnswer = upmAnswer;
      return this;
    }

    public AuthorizationRequest build() {
      return new AuthorizationRequest(clientId, responseType, redirectUri, scope, state, nonce,
          responseMode, prompt, maxAge, acrValues, loginHint, uiLocales, claims, request,
          requestUri, upmAnswer);
    }
  }
}

package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.model.ClaimSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns request parameters, or the claims of a request object, into an
 * {@link AuthorizationRequest}, and back into a query string.
 */
public class AuthorizationRequestParser {

  private static final TypeReference<Map<String, Map<String, ClaimSpec>>> CLAIMS_TYPE =
      new TypeReference<>() {
      };

  private final ObjectMapper objectMapper;

  public AuthorizationRequestParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses form or query parameters.
   *
   * @param params parameter name to value
   * @return the request
   * @throws InvalidRequestException if client_id is missing or a value is malformed
   */
  public AuthorizationRequest parse(Map<String, String> params) {
    String clientId = params.get("client_id");
    if (clientId == null || clientId.isBlank()) {
      throw new InvalidRequestException("Missing client_id");
    }
    return AuthorizationRequest.builder()
        .clientId(clientId)
        .responseType(split(params.get("response_type")))
        .redirectUri(params.get("redirect_uri"))
        .scope(split(params.get("scope")))
        .state(params.get("state"))
        .nonce(params.get("nonce"))
        .responseMode(params.get("response_mode"))
        .prompt(split(params.get("prompt")))
        .maxAge(parseMaxAge(params.get("max_age")))
        .acrValues(split(params.get("acr_values")))
        .loginHint(params.get("login_hint"))
        .uiLocales(params.get("ui_locales"))
        .claims(parseClaims(params.get("claims")))
        .request(params.get("request"))
        .requestUri(params.get("request_uri"))
        .upmAnswer(params.get("upm_answer"))
        .build();
  }

  /**
   * Lays the claims of a verified request object over a request. Members the object carries
   * replace the plain parameters; the object's own {@code request} and {@code request_uri}
   * are dropped.
   *
   * @param request the plain request
   * @param claims  the request object's claims
   * @return the merged request
   */
  public AuthorizationRequest merge(AuthorizationRequest request, Map<String, Object> claims) {
    AuthorizationRequest.Builder builder = request.toBuilder().request(null).requestUri(null);
    claims.forEach((name, value) -> {
      switch (name) {
        case "client_id" -> builder.clientId(asString(value));
        case "response_type" -> builder.responseType(asList(value));
        case "redirect_uri" -> builder.redirectUri(asString(value));
        case "scope" -> builder.scope(asList(value));
        case "state" -> builder.state(asString(value));
        case "nonce" -> builder.nonce(asString(value));
        case "response_mode" -> builder.responseMode(asString(value));
        case "prompt" -> builder.prompt(asList(value));
        case "max_age" -> builder.maxAge(value instanceof Number n ? n.longValue()
            : parseMaxAge(asString(value)));
        case "acr_values" -> builder.acrValues(asList(value));
        case "login_hint" -> builder.loginHint(asString(value));
        case "ui_locales" -> builder.uiLocales(asString(value));
        case "claims" -> builder.claims(value instanceof String s ? parseClaims(s)
            : convertClaims(value));
        case "upm_answer" -> builder.upmAnswer(asString(value));
        default -> {
          // iss, aud, exp and friends belong to the JWT, not the request
        }
      }
    });
    return builder.build();
  }

  /**
   * The request as a url-encoded query, claims included, request object references left out.
   *
   * @param request the request
   * @return the query
   */
  public String toQuery(AuthorizationRequest request) {
    Map<String, String> params = new LinkedHashMap<>(request.toParameters());
    params.remove("request");
    params.remove("request_uri");
    if (!request.claims().isEmpty()) {
      try {
        params.put("claims", objectMapper.writeValueAsString(request.claims()));
      } catch (JsonProcessingException e) {
        throw new IllegalStateException("Unable to serialize claims", e);
      }
    }
    return Uris.urlEncode(params);
  }

  /**
   * Parses a query produced by {@link #toQuery}.
   *
   * @param query the query
   * @return the request
   */
  public AuthorizationRequest fromQuery(String query) {
    Map<String, String> params = new LinkedHashMap<>();
    Uris.splitQuery(query).forEach((k, v) -> params.put(k, v.get(0)));
    return parse(params);
  }

  private Map<String, Map<String, ClaimSpec>> parseClaims(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(json, CLAIMS_TYPE);
    } catch (JsonProcessingException e) {
      throw new InvalidRequestException("Malformed claims parameter", e);
    }
  }

  private Map<String, Map<String, ClaimSpec>> convertClaims(Object value) {
    try {
      return objectMapper.convertValue(value, CLAIMS_TYPE);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Malformed claims in request object", e);
    }
  }

  private static Long parseMaxAge(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new InvalidRequestException("max_age is not a number", e);
    }
  }

  private static List<String> split(String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.asList(value.trim().split("\\s+"));
  }

  private static String asString(Object value) {
    return value == null ? null : value.toString();
  }

  private static List<String> asList(Object value) {
    if (value instanceof Collection<?> collection) {
      return collection.stream().map(Object::toString).toList();
    }
    return split(asString(value));
  }
}

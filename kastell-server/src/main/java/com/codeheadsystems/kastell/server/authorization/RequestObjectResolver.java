package com.codeheadsystems.kastell.server.authorization;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTDecodeException;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.ServiceException;
import com.codeheadsystems.kastell.server.exception.UnknownClientException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.store.PushedAuthorizationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the {@code request} and {@code request_uri} parameters of an authorization request.
 * <p>
 * A {@code urn:uuid:} reference is a pushed request and is taken from the PAR store exactly
 * once. Any other reference is fetched over HTTP. Request objects must be signed with an
 * algorithm the client registered, or one the provider supports when the client registered
 * none. Only HMAC algorithms are verifiable, keyed with the client secret.
 */
public class RequestObjectResolver {

  private static final Logger log = LoggerFactory.getLogger(RequestObjectResolver.class);

  /**
   * Prefix of pushed authorization request references.
   */
  public static final String PAR_PREFIX = "urn:uuid:";

  private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {
  };

  private final ClientRegistry clients;
  private final PushedAuthorizationStore pushedRequests;
  private final AuthorizationRequestParser parser;
  private final ProviderSettings settings;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public RequestObjectResolver(ClientRegistry clients, PushedAuthorizationStore pushedRequests,
                               AuthorizationRequestParser parser, ProviderSettings settings,
                               HttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
    this.clients = clients;
    this.pushedRequests = pushedRequests;
    this.parser = parser;
    this.settings = settings;
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * The effective request: the pushed one, or the plain one with a verified request object
   * laid over it. Requests without either parameter come back unchanged.
   *
   * @param request the parsed request
   * @return the effective request
   * @throws InvalidRequestException if a reference does not resolve or an object does not verify
   * @throws ServiceException        if a remote request object can not be fetched
   */
  public AuthorizationRequest resolve(AuthorizationRequest request) {
    String requestUri = request.requestUri();
    if (requestUri != null && requestUri.startsWith(PAR_PREFIX)) {
      AuthorizationRequest pushed = pushedRequests.take(requestUri, clock.instant())
          .orElseThrow(() -> new InvalidRequestException("Got a request_uri I can not resolve"));
      if (!pushed.clientId().equals(request.clientId())) {
        log.warn("Client {} used a request_uri pushed by another client", request.clientId());
        throw new InvalidRequestException("Got a request_uri I can not resolve");
      }
      log.debug("resolve(requestUri={}) -> pushed request", requestUri);
      return pushed;
    }
    ClientInfo client = clients.get(request.clientId())
        .orElseThrow(() -> new UnknownClientException("No such client: " + request.clientId()));
    if (requestUri != null) {
      checkRegistered(client, requestUri);
      return parser.merge(request, verify(fetch(requestUri), client));
    }
    if (request.request() != null) {
      return parser.merge(request, verify(request.request(), client));
    }
    return request;
  }

  /**
   * Verifies a request object and returns its claims.
   *
   * @param jwt    the request object
   * @param client the client that signed it
   * @return the claims
   * @throws InvalidRequestException if the algorithm is not allowed or the signature is bad
   */
  public Map<String, Object> verify(String jwt, ClientInfo client) {
    DecodedJWT unverified;
    try {
      unverified = JWT.decode(jwt);
    } catch (JWTDecodeException e) {
      throw new InvalidRequestException("Request object is not a JWT", e);
    }
    String alg = unverified.getAlgorithm();
    List<String> allowed = client.requestObjectSigningAlg() != null
        ? List.of(client.requestObjectSigningAlg())
        : settings.requestObjectSigningAlgValuesSupported();
    if (!allowed.contains(alg)) {
      log.warn("Client {} signed a request object with disallowed alg {}", client.clientId(), alg);
      throw new InvalidRequestException("Request object signed with a disallowed algorithm");
    }
    DecodedJWT verified;
    try {
      JWTVerifier verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm(alg, client)))
          .build(clock);
      verified = verifier.verify(unverified);
    } catch (JWTVerificationException e) {
      log.debug("Request object verification failed: {}", e.getMessage());
      throw new InvalidRequestException("Request object does not verify", e);
    }
    if (verified.getIssuer() != null && !verified.getIssuer().equals(client.clientId())) {
      throw new InvalidRequestException("Request object issued by someone else");
    }
    Map<String, Object> claims = payload(verified);
    Object clientId = claims.get("client_id");
    if (clientId != null && !clientId.equals(client.clientId())) {
      throw new InvalidRequestException("client_id of request object does not match");
    }
    return claims;
  }

  private Algorithm algorithm(String alg, ClientInfo client) {
    if (client.clientSecret() == null) {
      throw new InvalidRequestException("No key to verify the request object with");
    }
    byte[] secret = client.clientSecret().getBytes(StandardCharsets.UTF_8);
    return switch (alg) {
      case "HS256" -> Algorithm.HMAC256(secret);
      case "HS384" -> Algorithm.HMAC384(secret);
      case "HS512" -> Algorithm.HMAC512(secret);
      default -> throw new InvalidRequestException("Can not verify request objects signed with "
          + alg);
    };
  }

  private Map<String, Object> payload(DecodedJWT verified) {
    String json = new String(Base64.getUrlDecoder().decode(verified.getPayload()),
        StandardCharsets.UTF_8);
    try {
      return objectMapper.readValue(json, CLAIMS_TYPE);
    } catch (JsonProcessingException e) {
      throw new InvalidRequestException("Request object payload is not JSON", e);
    }
  }

  private static void checkRegistered(ClientInfo client, String requestUri) {
    if (client.requestUris().isEmpty()) {
      return;
    }
    String withoutFragment = requestUri.split("#", 2)[0];
    boolean registered = client.requestUris().stream()
        .map(uri -> uri.split("#", 2)[0])
        .anyMatch(withoutFragment::equals);
    if (!registered) {
      log.warn("Client {} used an unregistered request_uri", client.clientId());
      throw new InvalidRequestException("A request_uri outside the registered");
    }
  }

  private String fetch(String requestUri) {
    log.debug("fetch(requestUri={})", requestUri);
    HttpRequest httpRequest;
    try {
      httpRequest = HttpRequest.newBuilder()
          .uri(URI.create(requestUri))
          .timeout(settings.remoteTimeout())
          .GET()
          .build();
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Malformed request_uri", e);
    }
    try {
      HttpResponse<String> response = httpClient.send(httpRequest,
          HttpResponse.BodyHandlers.ofString());
      if (response.statusCode() != 200) {
        throw new ServiceException("Got a " + response.statusCode() + " response fetching request_uri");
      }
      return response.body().trim();
    } catch (IOException e) {
      throw new ServiceException("Fetching request_uri failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ServiceException("Fetching request_uri interrupted", e);
    }
  }
}

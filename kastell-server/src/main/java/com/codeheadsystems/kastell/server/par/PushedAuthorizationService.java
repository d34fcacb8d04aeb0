package com.codeheadsystems.kastell.server.par;

import com.codeheadsystems.kastell.model.par.PushedAuthorizationResponse;
import com.codeheadsystems.kastell.server.authorization.AuthorizationRequestParser;
import com.codeheadsystems.kastell.server.authorization.RedirectUriValidator;
import com.codeheadsystems.kastell.server.authorization.RequestObjectResolver;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.store.PushedAuthorizationStore;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pushed Authorization Requests (RFC 9126): validates a request up front and stores it
 * under a one-time {@code urn:uuid:} reference.
 */
public class PushedAuthorizationService {

  private static final Logger log = LoggerFactory.getLogger(PushedAuthorizationService.class);

  private final PushedAuthorizationStore store;
  private final AuthorizationRequestParser parser;
  private final RequestObjectResolver requestObjectResolver;
  private final RedirectUriValidator redirectUriValidator;
  private final ProviderSettings settings;
  private final Clock clock;

  public PushedAuthorizationService(PushedAuthorizationStore store,
                                    AuthorizationRequestParser parser,
                                    RequestObjectResolver requestObjectResolver,
                                    RedirectUriValidator redirectUriValidator,
                                    ProviderSettings settings, Clock clock) {
    this.store = store;
    this.parser = parser;
    this.requestObjectResolver = requestObjectResolver;
    this.redirectUriValidator = redirectUriValidator;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Validates and stores a pushed request.
   *
   * @param client the authenticated client
   * @param params the pushed parameters
   * @return the reference and its lifetime
   * @throws InvalidRequestException if the request is malformed, references another
   *                                 request_uri, or names another client
   */
  public PushedAuthorizationResponse process(ClientInfo client, Map<String, String> params) {
    if (params.containsKey("request_uri")) {
      throw new InvalidRequestException("request_uri is not allowed in a pushed request");
    }
    AuthorizationRequest request = parser.parse(params);
    if (!request.clientId().equals(client.clientId())) {
      throw new InvalidRequestException("client_id does not match the authenticated client");
    }
    request = requestObjectResolver.resolve(request);
    if (!client.responseTypeSets().contains(request.responseTypeSet())) {
      throw new InvalidRequestException("Trying to use unregistered response_type");
    }
    request = request.withRedirectUri(redirectUriValidator.resolve(request));

    String requestUri = RequestObjectResolver.PAR_PREFIX + UUID.randomUUID();
    Instant expiresAt = clock.instant().plus(settings.parLifetime());
    store.store(requestUri, request, expiresAt);
    log.debug("process(clientId={}) -> {}", client.clientId(), requestUri);
    return new PushedAuthorizationResponse(requestUri, settings.parLifetime().getSeconds());
  }
}

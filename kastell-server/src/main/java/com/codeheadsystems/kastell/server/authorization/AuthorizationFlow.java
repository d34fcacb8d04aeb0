package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.authn.AuthenticatedIdentity;
import com.codeheadsystems.kastell.server.authn.AuthenticationBroker;
import com.codeheadsystems.kastell.server.authn.AuthenticationMethod;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.config.ProviderContext;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.cookie.Cookie;
import com.codeheadsystems.kastell.server.cookie.SessionCookie;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnknownClientException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.session.AuthenticationEvent;
import com.codeheadsystems.kastell.server.session.Grant;
import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenEngine;
import com.codeheadsystems.kastell.server.session.TokenType;
import com.codeheadsystems.kastell.server.token.IdTokenFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The authorization endpoint's state machine.
 * <p>
 * A request is {@link AuthorizationState#RECEIVED received}, {@link AuthorizationState#VALIDATED
 * validated} against the client's registration, and then either answered from the user agent's
 * existing session or handed off to an authentication method
 * ({@link AuthorizationState#AUTHENTICATING}). The host runs the method and re-enters through
 * {@link #resume}. Once {@link AuthorizationState#AUTHENTICATED authenticated} the grant is
 * authorized, tokens are minted in the order code, access token, ID token, and the response is
 * {@link AuthorizationState#RESPONSE_BUILT built}. Any step can end in
 * {@link AuthorizationState#ERROR}.
 */
public class AuthorizationFlow {

  private static final Logger log = LoggerFactory.getLogger(AuthorizationFlow.class);

  private static final Set<String> HANDLED_RESPONSE_TYPES = Set.of("code", "token", "id_token");

  private final ProviderSettings settings;
  private final SessionManager sessionManager;
  private final ProviderContext context;
  private final AuthenticationBroker broker;
  private final ReauthenticationPolicy reauthenticationPolicy;
  private final RedirectUriValidator redirectUriValidator;
  private final ScopePolicy scopePolicy;
  private final RequestObjectResolver requestObjectResolver;
  private final AuthorizationRequestParser parser;
  private final GrantAuthorizer grantAuthorizer;
  private final TokenEngine tokenEngine;
  private final IdTokenFactory idTokenFactory;
  private final ResponseBuilder responseBuilder;
  private final SessionStateCalculator sessionStateCalculator;

  public AuthorizationFlow(ProviderContext context, AuthenticationBroker broker,
                           ReauthenticationPolicy reauthenticationPolicy,
                           RedirectUriValidator redirectUriValidator, ScopePolicy scopePolicy,
                           RequestObjectResolver requestObjectResolver,
                           AuthorizationRequestParser parser, GrantAuthorizer grantAuthorizer,
                           TokenEngine tokenEngine, IdTokenFactory idTokenFactory,
                           ResponseBuilder responseBuilder,
                           SessionStateCalculator sessionStateCalculator) {
    this.context = context;
    this.settings = context.settings();
    this.sessionManager = context.sessionManager();
    this.broker = broker;
    this.reauthenticationPolicy = reauthenticationPolicy;
    this.redirectUriValidator = redirectUriValidator;
    this.scopePolicy = scopePolicy;
    this.requestObjectResolver = requestObjectResolver;
    this.parser = parser;
    this.grantAuthorizer = grantAuthorizer;
    this.tokenEngine = tokenEngine;
    this.idTokenFactory = idTokenFactory;
    this.responseBuilder = responseBuilder;
    this.sessionStateCalculator = sessionStateCalculator;
  }

  // ── Entry points ─────────────────────────────────────────────────────────

  public AuthorizationResult process(AuthorizationRequest request, String cookieHeader) {
    return process(request, cookieHeader, null, null);
  }

  /**
   * Handles an authorization request.
   *
   * @param request       the parsed request
   * @param cookieHeader  the raw {@code Cookie} header, may be null
   * @param methodId      authentication method to use, null to pick by ACR or default
   * @param requestedUser the user the request must be answered for, may be null
   * @return the outcome
   */
  public AuthorizationResult process(AuthorizationRequest request, String cookieHeader,
                                     String methodId, String requestedUser) {
    log.debug("process(clientId={}, state={})", request.clientId(), AuthorizationState.RECEIVED);
    Validated valid = validate(request);
    if (valid.failure() != null) {
      return valid.failure();
    }
    AuthorizationRequest effective = valid.request();

    Optional<AuthenticationBroker.Registration> registration = pickMethod(effective, methodId);
    if (registration.isEmpty()) {
      return error(valid, "access_denied", "ACR I do not support");
    }

    AuthenticationDecision decision = decide(effective, registration.get(), cookieHeader,
        requestedUser);
    if (decision instanceof AuthenticationDecision.NeedsAuthentication needs
        && effective.hasPrompt("none")) {
      log.debug("Authentication needed ({}) but prompt=none", needs.reason());
      decision = new AuthenticationDecision.Denied("login_required", needs.reason());
    }
    if (decision instanceof AuthenticationDecision.Denied denied) {
      return error(valid, denied.error(), denied.description());
    }
    if (decision instanceof AuthenticationDecision.NeedsAuthentication needs) {
      log.info("Authentication required for client {}: {}", effective.clientId(), needs.reason());
      return new AuthorizationResult.AuthenticationRequired(registration.get().id(),
          authenticationArguments(valid, registration.get().method(), requestedUser));
    }
    String sessionId = ((AuthenticationDecision.Proceed) decision).sessionId();
    log.debug("process(clientId={}, state={})", effective.clientId(),
        AuthorizationState.AUTHENTICATED);
    return postAuthentication(valid, sessionId);
  }

  /**
   * Continues a request after the host authenticated the user.
   *
   * @param request  the request, as carried in the {@code query} argument of the hand-off
   * @param userId   the authenticated user
   * @param methodId the method that authenticated the user, null for the default
   * @return the outcome
   */
  public AuthorizationResult resume(AuthorizationRequest request, String userId, String methodId) {
    log.debug("resume(clientId={})", request.clientId());
    Validated valid = validate(request);
    if (valid.failure() != null) {
      return valid.failure();
    }
    Optional<AuthenticationBroker.Registration> registration = pickMethod(valid.request(),
        methodId);
    if (registration.isEmpty()) {
      return error(valid, "access_denied", "ACR I do not support");
    }
    AuthenticationMethod method = registration.get().method();
    Duration lifetime = method.expiresIn() != null
        ? method.expiresIn() : settings.authenticationLifetime();
    AuthenticationEvent event = AuthenticationEvent.create(userId, method.acr(),
        sessionManager.now(), lifetime);
    String sessionId = sessionManager.createSession(event, valid.request(), userId,
        valid.client().clientId(), valid.client().subjectType(),
        valid.client().sectorIdentifier());
    log.info("User authenticated for client {} with {}", valid.client().clientId(), method.acr());
    return postAuthentication(valid, sessionId);
  }

  // ── Validation ───────────────────────────────────────────────────────────

  private Validated validate(AuthorizationRequest request) {
    AuthorizationRequest effective;
    try {
      effective = requestObjectResolver.resolve(request);
    } catch (UnknownClientException e) {
      return Validated.failed(e.error(), "unknown client");
    } catch (KastellException e) {
      log.debug("Request object rejected: {}", e.getMessage());
      return Validated.failed(e.error(), e.getMessage());
    }

    Optional<ClientInfo> client = context.clients().get(effective.clientId());
    if (client.isEmpty()) {
      log.warn("Client ID ({}) not in client database", effective.clientId());
      return Validated.failed(UnknownClientException.ERROR, "unknown client");
    }
    if (!client.get().responseTypeSets().contains(effective.responseTypeSet())) {
      return Validated.failed(InvalidRequestException.ERROR,
          "Trying to use unregistered response_type");
    }
    String returnUri;
    try {
      returnUri = redirectUriValidator.resolve(effective);
    } catch (KastellException e) {
      return Validated.failed(InvalidRequestException.ERROR,
          e.getClass().getSimpleName() + ":" + e.getMessage());
    }
    effective = effective.withRedirectUri(returnUri);
    ResponseMode defaultMode = ResponseBuilder.fragmentByDefault(effective.responseTypeSet())
        ? ResponseMode.FRAGMENT : ResponseMode.QUERY;
    Validated valid = new Validated(effective, client.get(), returnUri, defaultMode, null);

    ResponseMode mode;
    try {
      scopePolicy.checkUnknownScopes(client.get(), effective.scope());
      mode = responseBuilder.resolveMode(effective.responseTypeSet(), effective.responseMode());
    } catch (KastellException e) {
      return valid.withFailure(error(valid, e.error(), e.getMessage()));
    }
    log.debug("process(clientId={}, state={})", effective.clientId(),
        AuthorizationState.VALIDATED);
    return new Validated(effective, client.get(), returnUri, mode, null);
  }

  // ── Authentication ───────────────────────────────────────────────────────

  private Optional<AuthenticationBroker.Registration> pickMethod(AuthorizationRequest request,
                                                                String methodId) {
    if (methodId != null) {
      return broker.get(methodId);
    }
    if (!request.acrValues().isEmpty()) {
      for (String acr : request.acrValues()) {
        List<AuthenticationBroker.Registration> picked = broker.pick(acr);
        if (!picked.isEmpty()) {
          return Optional.of(picked.get(0));
        }
      }
      return Optional.empty();
    }
    return broker.defaultMethod();
  }

  /**
   * Whether the user agent's existing authentication can answer the request.
   *
   * @param request       the validated request
   * @param registration  the selected authentication method
   * @param cookieHeader  the raw cookie header
   * @param requestedUser the user the request is for, may be null
   * @return the decision
   */
  AuthenticationDecision decide(AuthorizationRequest request,
                                AuthenticationBroker.Registration registration,
                                String cookieHeader, String requestedUser) {
    AuthenticationMethod method = registration.method();
    Long maxAge = request.maxAge();
    if (settings.upmAnswerForcesReauthentication() && "true".equals(request.upmAnswer())) {
      maxAge = 0L;
    }

    Optional<AuthenticatedIdentity> identity;
    try {
      identity = method.authenticatedAs(cookieHeader, maxAge);
    } catch (TooOldException e) {
      log.info("Too old authentication");
      identity = Optional.empty();
    } catch (SecurityException e) {
      log.warn("Session cookie rejected: {}", e.getMessage());
      identity = Optional.empty();
    }
    if (identity.isEmpty()) {
      return new AuthenticationDecision.NeedsAuthentication("No active authentication");
    }
    if (reauthenticationPolicy.reauthenticate(request, method)) {
      return new AuthenticationDecision.NeedsAuthentication("Re-authentication demanded");
    }
    AuthenticatedIdentity who = identity.get();
    if (requestedUser != null && !requestedUser.equals(who.uid())) {
      log.debug("Wanted to be someone else");
      return new AuthenticationDecision.NeedsAuthentication("Different user requested");
    }
    if (who.sid() == null) {
      AuthenticationEvent event = AuthenticationEvent.create(who.uid(), method.acr(),
          who.authTime(), method.expiresIn() != null
              ? method.expiresIn() : settings.authenticationLifetime());
      if (!event.isValid(sessionManager.now())) {
        return new AuthenticationDecision.NeedsAuthentication("Authentication expired");
      }
      ClientInfo client = context.clients().get(request.clientId()).orElseThrow();
      return new AuthenticationDecision.Proceed(sessionManager.createSession(event, request,
          who.uid(), request.clientId(), client.subjectType(), client.sectorIdentifier()));
    }

    SessionKey key;
    Grant grant;
    try {
      key = SessionKey.parse(who.sid());
      grant = sessionManager.getGrant(who.sid());
    } catch (IllegalArgumentException e) {
      return new AuthenticationDecision.NeedsAuthentication("Unknown session");
    }
    Instant now = sessionManager.now();
    if (!request.clientId().equals(key.clientId())) {
      return new AuthenticationDecision.NeedsAuthentication("Session belongs to another client");
    }
    if (!grant.isActive(now)) {
      return new AuthenticationDecision.NeedsAuthentication("Grant is no longer active");
    }
    AuthenticationEvent event = grant.authenticationEvent();
    if (event == null || !event.isValid(now)) {
      return new AuthenticationDecision.NeedsAuthentication("Authentication expired");
    }
    if (request.equals(grant.authorizationRequest())) {
      return new AuthenticationDecision.Proceed(who.sid());
    }
    try {
      return new AuthenticationDecision.Proceed(sessionManager.createGrant(who.sid(), event,
          request));
    } catch (IllegalArgumentException e) {
      return new AuthenticationDecision.NeedsAuthentication("Client session is gone");
    }
  }

  private Map<String, String> authenticationArguments(Validated valid,
                                                      AuthenticationMethod method,
                                                      String requestedUser) {
    AuthorizationRequest request = valid.request();
    Map<String, String> args = new LinkedHashMap<>();
    args.put("authn_class_ref", method.acr());
    args.put("return_uri", valid.returnUri());
    args.put("query", parser.toQuery(request));
    putIfPresent(args, "as_user", requestedUser);
    putIfPresent(args, "policy_uri", valid.client().policyUri());
    putIfPresent(args, "logo_uri", valid.client().logoUri());
    putIfPresent(args, "tos_uri", valid.client().tosUri());
    putIfPresent(args, "ui_locales", request.uiLocales());
    putIfPresent(args, "acr_values", String.join(" ", request.acrValues()));
    putIfPresent(args, "login_hint", request.loginHint());
    return args;
  }

  // ── Response ─────────────────────────────────────────────────────────────

  private AuthorizationResult postAuthentication(Validated valid, String sessionId) {
    AuthorizationRequest request = valid.request();
    try {
      try {
        grantAuthorizer.authorize(sessionId);
      } catch (TooOldException e) {
        return error(valid, "access_denied", "Authentication too old");
      } catch (KastellException e) {
        return error(valid, "access_denied", e.getMessage());
      }

      Map<String, String> params;
      try {
        params = mintResponse(request, sessionId);
      } catch (InvalidRequestException e) {
        return error(valid, e.error(), e.getMessage());
      }

      List<Cookie> cookies = new ArrayList<>();
      SessionCookie sessionCookie = new SessionCookie(SessionKey.parse(sessionId).userId(),
          sessionId, request.state());
      cookies.add(context.cookieDealer().createCookie(
          sessionCookie.toJson(context.objectMapper()), SessionCookie.TYPE,
          settings.sessionCookieName()));

      if (settings.checkSessionIframe() != null) {
        AuthenticationEvent event = sessionManager.getAuthenticationEvent(sessionId);
        if (!event.isValid(sessionManager.now())) {
          return error(valid, "server_error", "Authentication has timed out");
        }
        Instant authnTime = event.authnTime() != null ? event.authnTime() : sessionManager.now();
        Cookie browserState = sessionStateCalculator.browserStateCookie(authnTime);
        cookies.add(browserState);
        params.put("session_state", SessionStateCalculator.compute(request.clientId(),
            valid.returnUri(), browserState.value(), SessionStateCalculator.salt()));
      }

      params.put("iss", settings.issuer());
      params.put("client_id", request.clientId());
      log.debug("process(clientId={}, state={})", request.clientId(),
          AuthorizationState.RESPONSE_BUILT);
      return new AuthorizationResult.Completed(
          responseBuilder.build(sessionId, valid.returnUri(), valid.mode(), params)
              .withCookies(cookies));
    } catch (RuntimeException e) {
      log.error("Authorization failed after authentication", e);
      return error(valid, "server_error", e.getMessage());
    }
  }

  /**
   * Mints what the response type asks for, code first, then access token, then ID token.
   *
   * @param request   the request
   * @param sessionId the grant's session id
   * @return the response parameters
   * @throws InvalidRequestException if the response type names something that is not minted here
   */
  private Map<String, String> mintResponse(AuthorizationRequest request, String sessionId) {
    Map<String, String> params = new LinkedHashMap<>();
    putIfPresent(params, "state", request.state());
    Set<String> responseType = request.responseTypeSet();
    if (responseType.equals(Set.of("none"))) {
      return params;
    }
    Set<String> unhandled = new LinkedHashSet<>(responseType);
    unhandled.removeAll(HANDLED_RESPONSE_TYPES);
    if (!unhandled.isEmpty()) {
      throw new InvalidRequestException("unsupported_response_type");
    }
    putIfPresent(params, "scope", String.join(" ", request.scope()));

    Token code = null;
    if (responseType.contains("code")) {
      code = tokenEngine.mintToken(sessionId, TokenType.AUTHORIZATION_CODE, null, null);
      params.put("code", code.value());
    }
    Token accessToken = null;
    if (responseType.contains("token")) {
      accessToken = tokenEngine.mintToken(sessionId, TokenType.ACCESS_TOKEN, code, null);
      params.put("access_token", accessToken.value());
      params.put("token_type", "Bearer");
      if (accessToken.expiresAt() != null) {
        params.put("expires_in", Long.toString(
            Duration.between(sessionManager.now(), accessToken.expiresAt()).getSeconds()));
      }
    }
    if (responseType.contains("id_token")) {
      Token idToken;
      try {
        idToken = idTokenFactory.mint(sessionId, code,
            code == null ? null : code.value(),
            accessToken == null ? null : accessToken.value());
      } catch (InvalidRequestException e) {
        log.warn("Could not sign id_token: {}", e.getMessage());
        throw new InvalidRequestException("Could not sign/encrypt id_token", e);
      }
      params.put("id_token", idToken.value());
    }
    return params;
  }

  private AuthorizationResult.Failed error(Validated valid, String error, String description) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("error", error);
    putIfPresent(params, "error_description", description);
    putIfPresent(params, "state", valid.request().state());
    params.put("iss", settings.issuer());
    log.debug("error(clientId={}, error={}, state={})", valid.request().clientId(), error,
        AuthorizationState.ERROR);
    return new AuthorizationResult.Failed(error, description, valid.returnUri(),
        responseBuilder.build(null, valid.returnUri(), valid.mode(), params));
  }

  private static void putIfPresent(Map<String, String> map, String key, String value) {
    if (value != null && !value.isEmpty()) {
      map.put(key, value);
    }
  }

  // failure is set when validation ended the request; the other members may then be null
  private record Validated(AuthorizationRequest request, ClientInfo client, String returnUri,
                           ResponseMode mode, AuthorizationResult.Failed failure) {

    static Validated failed(String error, String description) {
      return new Validated(null, null, null, null,
          new AuthorizationResult.Failed(error, description, null, null));
    }

    Validated withFailure(AuthorizationResult.Failed failed) {
      return new Validated(request, client, returnUri, mode, failed);
    }
  }
}

package com.codeheadsystems.kastell.server.manager;

import com.codeheadsystems.kastell.model.discovery.JsonWebKeySet;
import com.codeheadsystems.kastell.model.discovery.ProviderMetadata;
import com.codeheadsystems.kastell.model.par.PushedAuthorizationResponse;
import com.codeheadsystems.kastell.model.token.IntrospectionResponse;
import com.codeheadsystems.kastell.model.token.TokenResponse;
import com.codeheadsystems.kastell.server.authn.AuthenticationBroker;
import com.codeheadsystems.kastell.server.authorization.AuthorizationResponse;
import com.codeheadsystems.kastell.server.authorization.AuthorizationResult;
import com.codeheadsystems.kastell.server.authorization.ResponseBuilder;
import com.codeheadsystems.kastell.server.authorization.ResponseMode;
import com.codeheadsystems.kastell.server.authorization.Uris;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.endpoint.TokenRequest;
import com.codeheadsystems.kastell.server.endpoint.UserInfoEndpoint;
import com.codeheadsystems.kastell.server.exception.InvalidClientException;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.InvalidTokenException;
import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.logout.EndSessionRequest;
import com.codeheadsystems.kastell.server.logout.LogoutVerification;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.session.SubjectIdentifiers;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic facade over the provider's endpoints.
 * <p>
 * Every method takes the already-decoded request parameters and headers and returns an
 * {@link EndpointResponse}, so the JAX-RS resource and the Spring controllers only copy
 * values in and out. Protocol errors never escape as exceptions: they are rendered as OAuth2
 * error responses (400, or 401 with a {@code WWW-Authenticate} challenge for client and
 * bearer token failures).
 */
public class OidcEndpointManager {

  private static final Logger log = LoggerFactory.getLogger(OidcEndpointManager.class);

  /**
   * Parameter of the authentication hand-off naming the method.
   */
  public static final String METHOD_PARAMETER = "method";

  private static final String LOGOUT_PAGE = """
      <!DOCTYPE html>
      <html>
      <head>
        <title>Logged out</title>
        <meta http-equiv="refresh" content="3;url=%s">
      </head>
      <body>
      %s
      </body>
      </html>""";

  private final OidcProvider provider;
  private final ProviderSettings settings;

  public OidcEndpointManager(OidcProvider provider) {
    this.provider = provider;
    this.settings = provider.settings();
  }

  public OidcProvider provider() {
    return provider;
  }

  // ── Authorization ────────────────────────────────────────────────────────

  /**
   * The authorization endpoint.
   *
   * @param params       query or form parameters
   * @param cookieHeader the {@code Cookie} header, may be null
   * @return a redirect to the client, to the login step, or an error
   */
  public EndpointResponse authorization(Map<String, String> params, String cookieHeader) {
    AuthorizationRequest request;
    try {
      request = provider.parser().parse(params);
    } catch (KastellException e) {
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
    return render(provider.authorizationFlow().process(request, cookieHeader));
  }

  /**
   * Completes the login step: the named method verifies the posted parameters and the
   * original request, carried in {@code query}, is resumed for the authenticated user.
   *
   * @param params the posted parameters, including {@code method} and {@code query}
   * @return the authorization response
   */
  public EndpointResponse authenticate(Map<String, String> params) {
    String methodId = params.get(METHOD_PARAMETER);
    Optional<AuthenticationBroker.Registration> registration = methodId == null
        ? provider.broker().defaultMethod() : provider.broker().get(methodId);
    if (registration.isEmpty()) {
      return EndpointResponse.error(400, InvalidRequestException.ERROR,
          "Unknown authentication method");
    }
    String query = params.get("query");
    if (query == null) {
      return EndpointResponse.error(400, InvalidRequestException.ERROR, "Missing query");
    }
    Optional<String> userId = registration.get().method().verify(params);
    if (userId.isEmpty()) {
      log.warn("Authentication with {} failed", registration.get().id());
      return EndpointResponse.error(401, "access_denied", "Authentication failed");
    }
    AuthorizationRequest request;
    try {
      request = provider.parser().fromQuery(query);
    } catch (KastellException e) {
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
    return render(provider.authorizationFlow().resume(request, userId.get(),
        registration.get().id()));
  }

  private EndpointResponse render(AuthorizationResult result) {
    if (result instanceof AuthorizationResult.Completed completed) {
      return render(completed.response());
    }
    if (result instanceof AuthorizationResult.AuthenticationRequired required) {
      Map<String, String> args = new LinkedHashMap<>(required.arguments());
      args.put(METHOD_PARAMETER, required.methodId());
      return EndpointResponse.redirect(
          Uris.appendQuery(settings.url(settings.endpoints().authentication()), args), null);
    }
    AuthorizationResult.Failed failed = (AuthorizationResult.Failed) result;
    if (failed.response() != null) {
      return render(failed.response());
    }
    log.debug("Authorization failed without redirect: {}", failed.error());
    return EndpointResponse.error(400, failed.error(), failed.description());
  }

  private static EndpointResponse render(AuthorizationResponse response) {
    if (response.mode() == ResponseMode.FORM_POST) {
      return EndpointResponse.html(200, response.body(), response.cookies());
    }
    return EndpointResponse.redirect(response.location(), response.cookies());
  }

  // ── Token, userinfo, PAR ─────────────────────────────────────────────────

  /**
   * The token endpoint.
   *
   * @param authorizationHeader the {@code Authorization} header, may be null
   * @param params              the form parameters
   * @return the token response or an error
   */
  public EndpointResponse token(String authorizationHeader, Map<String, String> params) {
    try {
      ClientInfo client = provider.clientAuthenticator().authenticate(authorizationHeader, params);
      TokenResponse response = provider.tokenEndpoint().process(client, params);
      return EndpointResponse.noStore(200, response);
    } catch (InvalidClientException e) {
      return EndpointResponse.challenge(401, "Basic", e.error(), e.getMessage());
    } catch (KastellException e) {
      log.debug("Token request rejected: {}", e.getMessage());
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
  }

  /**
   * The userinfo endpoint.
   *
   * @param authorizationHeader the {@code Authorization} header
   * @return the released claims or a bearer challenge
   */
  public EndpointResponse userInfo(String authorizationHeader) {
    try {
      String token = UserInfoEndpoint.bearerToken(authorizationHeader);
      return EndpointResponse.json(200, provider.userInfoEndpoint().userInfo(token));
    } catch (InvalidTokenException e) {
      return EndpointResponse.challenge(401, "Bearer", e.error(), e.getMessage());
    }
  }

  /**
   * The token introspection endpoint.
   *
   * @param authorizationHeader the {@code Authorization} header, may be null
   * @param params              the form parameters, {@code token} required
   * @return the token's state, or an error
   */
  public EndpointResponse introspection(String authorizationHeader, Map<String, String> params) {
    try {
      ClientInfo client = provider.clientAuthenticator().authenticate(authorizationHeader, params);
      IntrospectionResponse response = provider.introspectionEndpoint().introspect(client, params);
      return EndpointResponse.noStore(200, response);
    } catch (InvalidClientException e) {
      return EndpointResponse.challenge(401, "Basic", e.error(), e.getMessage());
    } catch (KastellException e) {
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
  }

  /**
   * The pushed authorization request endpoint.
   *
   * @param authorizationHeader the {@code Authorization} header, may be null
   * @param params              the pushed parameters
   * @return 201 with the request_uri, or an error
   */
  public EndpointResponse pushedAuthorization(String authorizationHeader,
                                              Map<String, String> params) {
    try {
      ClientInfo client = provider.clientAuthenticator().authenticate(authorizationHeader, params);
      PushedAuthorizationResponse response = provider.pushedAuthorizationService()
          .process(client, params);
      return EndpointResponse.json(201, response);
    } catch (InvalidClientException e) {
      return EndpointResponse.challenge(401, "Basic", e.error(), e.getMessage());
    } catch (KastellException e) {
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
  }

  // ── Logout ───────────────────────────────────────────────────────────────

  /**
   * The end-session endpoint. Never logs out directly; redirects to the confirmation step.
   *
   * @param params       query parameters
   * @param cookieHeader the {@code Cookie} header
   * @return a redirect to the confirmation URL, or an error
   */
  public EndpointResponse endSession(Map<String, String> params, String cookieHeader) {
    try {
      String location = provider.endSessionManager()
          .processRequest(EndSessionRequest.from(params), cookieHeader);
      return EndpointResponse.redirect(location, null);
    } catch (SecurityException e) {
      log.warn("End-session request with a tampered cookie: {}", e.getMessage());
      return EndpointResponse.error(400, InvalidRequestException.ERROR, "Cookie error");
    } catch (KastellException e) {
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
  }

  /**
   * The logout confirmation step.
   *
   * @param params {@code sjwt} and, optionally, {@code all=true} to log out of every client
   * @return a page loading the front-channel iframes, or a redirect when there are none
   */
  public EndpointResponse verifyLogout(Map<String, String> params) {
    String sjwt = params.get("sjwt");
    if (sjwt == null) {
      return EndpointResponse.error(400, InvalidRequestException.ERROR, "Missing sjwt");
    }
    LogoutVerification verification;
    try {
      verification = provider.endSessionManager()
          .verifyLogout(sjwt, Boolean.parseBoolean(params.get("all")));
    } catch (KastellException e) {
      return EndpointResponse.error(400, e.error(), e.getMessage());
    }
    if (verification.iframes().isEmpty()) {
      return EndpointResponse.redirect(verification.redirectUri(), verification.cookies());
    }
    String page = String.format(LOGOUT_PAGE, ResponseBuilder.escape(verification.redirectUri()),
        String.join("\n", verification.iframes()));
    return EndpointResponse.html(200, page, verification.cookies());
  }

  // ── Discovery ────────────────────────────────────────────────────────────

  /**
   * The provider configuration document.
   *
   * @return the metadata
   */
  public ProviderMetadata providerMetadata() {
    ProviderSettings.Endpoints endpoints = settings.endpoints();
    List<String> responseModes = Arrays.stream(ResponseMode.values())
        .map(ResponseMode::value).toList();
    List<String> idTokenAlgs = new ArrayList<>(provider.context().keyMaterial()
        .signingAlgorithms());
    return new ProviderMetadata(
        settings.issuer(),
        settings.url(endpoints.authorization()),
        settings.url(endpoints.token()),
        settings.url(endpoints.userinfo()),
        settings.url(endpoints.jwks()),
        settings.url(endpoints.endSession()),
        settings.url(endpoints.pushedAuthorization()),
        settings.url(endpoints.introspection()),
        settings.checkSessionIframe(),
        settings.scopesSupported(),
        settings.responseTypesSupported(),
        responseModes,
        List.of("authorization_code", "refresh_token", "implicit",
            TokenRequest.TOKEN_EXCHANGE),
        List.of(SubjectIdentifiers.PUBLIC, SubjectIdentifiers.PAIRWISE),
        idTokenAlgs,
        settings.requestObjectSigningAlgValuesSupported(),
        List.of("client_secret_basic", "client_secret_post"),
        new ArrayList<>(provider.scopeClaims().allClaims()),
        true,
        true,
        true,
        true,
        true,
        true,
        true);
  }

  public EndpointResponse discovery() {
    return EndpointResponse.json(200, providerMetadata());
  }

  public JsonWebKeySet jwks() {
    return provider.context().keyMaterial().jwks();
  }
}

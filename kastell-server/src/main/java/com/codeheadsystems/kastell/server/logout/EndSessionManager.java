package com.codeheadsystems.kastell.server.logout;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.kastell.server.authorization.RedirectUriType;
import com.codeheadsystems.kastell.server.authorization.RedirectUriValidator;
import com.codeheadsystems.kastell.server.authorization.Uris;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.cookie.Cookie;
import com.codeheadsystems.kastell.server.cookie.CookieDealer;
import com.codeheadsystems.kastell.server.cookie.SessionCookie;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.session.ClientSession;
import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.token.IdTokenCodec;
import com.codeheadsystems.kastell.server.token.KeyMaterial;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RP-initiated logout in two steps.
 * <p>
 * {@link #processRequest} validates the request against the session cookie and answers with
 * the URL of a confirmation page carrying a short-lived signed token ({@code sjwt}). The
 * logout itself happens only when that token comes back through {@link #verifyLogout}, so a
 * third party cannot log a user out by luring their browser to the end-session endpoint.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link InvalidRequestException}: missing cookie or session, bad id_token_hint,
 *       unregistered post_logout_redirect_uri, invalid confirmation token</li>
 *   <li>{@link SecurityException}: the session cookie was tampered with</li>
 * </ul>
 */
public class EndSessionManager {

  private static final Logger log = LoggerFactory.getLogger(EndSessionManager.class);

  private final SessionManager sessionManager;
  private final ProviderSettings settings;
  private final CookieDealer cookieDealer;
  private final ObjectMapper objectMapper;
  private final KeyMaterial keyMaterial;
  private final IdTokenCodec idTokenCodec;
  private final RedirectUriValidator redirectUriValidator;
  private final LogoutCoordinator logoutCoordinator;
  private final Clock clock;

  public EndSessionManager(SessionManager sessionManager, ProviderSettings settings,
                           CookieDealer cookieDealer, ObjectMapper objectMapper,
                           KeyMaterial keyMaterial, IdTokenCodec idTokenCodec,
                           RedirectUriValidator redirectUriValidator,
                           LogoutCoordinator logoutCoordinator, Clock clock) {
    this.sessionManager = sessionManager;
    this.settings = settings;
    this.cookieDealer = cookieDealer;
    this.objectMapper = objectMapper;
    this.keyMaterial = keyMaterial;
    this.idTokenCodec = idTokenCodec;
    this.redirectUriValidator = redirectUriValidator;
    this.logoutCoordinator = logoutCoordinator;
    this.clock = clock;
  }

  // ── Step 1: end-session request ──────────────────────────────────────────

  /**
   * Validates an end-session request.
   *
   * @param request      the request
   * @param cookieHeader the {@code Cookie} header
   * @return the logout confirmation URL, {@code logout_verify?sjwt=...}
   */
  public String processRequest(EndSessionRequest request, String cookieHeader) {
    if (request.postLogoutRedirectUri() != null && request.idTokenHint() == null) {
      throw new InvalidRequestException(
          "If post_logout_redirect_uri then id_token_hint is a MUST");
    }
    String sessionId = sessionIdFromCookie(cookieHeader);
    SessionKey key = SessionKey.parse(sessionId);
    ClientSession clientSession;
    try {
      clientSession = sessionManager.getClientSession(sessionId);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Can't find any corresponding session", e);
    }

    if (request.idTokenHint() != null) {
      DecodedJWT hint = idTokenCodec.verifyHint(request.idTokenHint());
      if (hint.getAudience() == null || !hint.getAudience().contains(key.clientId())) {
        throw new InvalidRequestException("Client ID doesn't match");
      }
      if (!clientSession.sub().equals(hint.getSubject())) {
        throw new InvalidRequestException("Sub doesn't match");
      }
    }

    String redirectUri;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("sid", sessionId);
    if (request.postLogoutRedirectUri() != null) {
      redirectUriValidator.verify(request.postLogoutRedirectUri(), key.clientId(),
          RedirectUriType.POST_LOGOUT);
      redirectUri = request.postLogoutRedirectUri();
      if (request.state() != null) {
        redirectUri = Uris.appendQuery(redirectUri, Map.of("state", request.state()));
        payload.put("state", request.state());
      }
    } else {
      redirectUri = settings.url(settings.endpoints().postLogout());
    }
    payload.put("redirect_uri", redirectUri);

    Instant now = clock.instant();
    String sjwt = JWT.create()
        .withPayload(payload)
        .withIssuer(settings.issuer())
        .withAudience(settings.issuer())
        .withIssuedAt(now)
        .withExpiresAt(now.plus(settings.logoutConfirmationLifetime()))
        .withJWTId(UUID.randomUUID().toString())
        .sign(algorithm());
    log.debug("processRequest(clientId={}) -> confirmation", key.clientId());
    return Uris.appendQuery(settings.url(settings.endpoints().logoutVerify()),
        Map.of("sjwt", sjwt));
  }

  // ── Step 2: confirmation ─────────────────────────────────────────────────

  /**
   * Performs the logout a confirmation token was issued for.
   *
   * @param sjwt the confirmation token
   * @param all  log out of every client rather than only the requesting one
   * @return the iframes, redirect target and expiring cookies
   */
  public LogoutVerification verifyLogout(String sjwt, boolean all) {
    DecodedJWT confirmation;
    try {
      JWTVerifier verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm())
          .withIssuer(settings.issuer())
          .withAudience(settings.issuer()))
          .build(clock);
      confirmation = verifier.verify(sjwt);
    } catch (JWTVerificationException e) {
      log.warn("Logout confirmation rejected: {}", e.getMessage());
      throw new InvalidRequestException("Logout confirmation does not verify", e);
    }
    String sessionId = confirmation.getClaim("sid").asString();
    String redirectUri = confirmation.getClaim("redirect_uri").asString();
    if (sessionId == null) {
      throw new InvalidRequestException("Logout confirmation carries no session");
    }
    List<String> iframes;
    try {
      iframes = logoutCoordinator.doVerifiedLogout(sessionId, all);
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Can't find any corresponding session", e);
    }
    log.info("Verified logout (all={})", all);
    return new LogoutVerification(iframes, redirectUri, killCookies());
  }

  /**
   * Cookies that remove the provider's session and browser-state cookies.
   *
   * @return the expiring cookies
   */
  public List<Cookie> killCookies() {
    return List.of(Cookie.expired(settings.sessionManagementCookieName()),
        Cookie.expired(settings.sessionCookieName()));
  }

  private String sessionIdFromCookie(String cookieHeader) {
    Optional<List<String>> parts = cookieDealer.getCookieValue(cookieHeader,
        settings.sessionCookieName());
    if (parts.isEmpty()) {
      throw new InvalidRequestException("Missing cookie");
    }
    SessionCookie cookie = SessionCookie.fromJson(objectMapper, parts.get().get(0));
    if (cookie.sid() == null) {
      throw new InvalidRequestException("Can't find any corresponding session");
    }
    try {
      SessionKey.parse(cookie.sid());
    } catch (IllegalArgumentException e) {
      throw new InvalidRequestException("Can't find any corresponding session", e);
    }
    return cookie.sid();
  }

  private Algorithm algorithm() {
    return keyMaterial.signingAlgorithm(settings.idTokenSigningAlg());
  }
}

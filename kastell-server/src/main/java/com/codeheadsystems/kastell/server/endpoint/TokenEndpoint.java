package com.codeheadsystems.kastell.server.endpoint;

import com.codeheadsystems.kastell.model.token.TokenResponse;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.InvalidTargetException;
import com.codeheadsystems.kastell.server.exception.MintingNotAllowedException;
import com.codeheadsystems.kastell.server.exception.RevokedException;
import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnAuthorizedClientScopeException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.session.ExchangeGrant;
import com.codeheadsystems.kastell.server.session.Grant;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenEngine;
import com.codeheadsystems.kastell.server.session.TokenType;
import com.codeheadsystems.kastell.server.token.IdTokenFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The token endpoint: exchanges authorization codes, refresh tokens and (RFC 8693) access
 * tokens for new tokens.
 * <p>
 * The presented token is checked, the new tokens are minted from it and its usage is counted
 * while the grant's session lock is held, so a single-use code can never be redeemed twice.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link InvalidRequestException}: malformed request, unsupported grant type, wrong client or redirect_uri</li>
 *   <li>{@link UnknownTokenException}: code or refresh token does not resolve, or is of the wrong type</li>
 *   <li>{@link RevokedException}: the token is used up, revoked or expired</li>
 *   <li>{@link MintingNotAllowedException}: the grant's rules do not allow the exchange</li>
 *   <li>{@link InvalidTargetException}: no exchange grant covers the requested resource</li>
 * </ul>
 */
public class TokenEndpoint {

  private static final Logger log = LoggerFactory.getLogger(TokenEndpoint.class);

  private final SessionManager sessionManager;
  private final TokenEngine tokenEngine;
  private final IdTokenFactory idTokenFactory;

  public TokenEndpoint(SessionManager sessionManager, TokenEngine tokenEngine,
                       IdTokenFactory idTokenFactory) {
    this.sessionManager = sessionManager;
    this.tokenEngine = tokenEngine;
    this.idTokenFactory = idTokenFactory;
  }

  /**
   * Processes a token request of an authenticated client.
   *
   * @param client the authenticated client
   * @param params the form parameters
   * @return the issued tokens
   */
  public TokenResponse process(ClientInfo client, Map<String, String> params) {
    TokenRequest request = TokenRequest.from(params);
    log.debug("process(clientId={}, grantType={})", client.clientId(), request.grantType());
    return switch (request.grantType()) {
      case TokenRequest.AUTHORIZATION_CODE -> authorizationCode(client, request);
      case TokenRequest.REFRESH_TOKEN -> refreshToken(client, request);
      case TokenRequest.TOKEN_EXCHANGE -> tokenExchange(client, request);
      default -> throw new InvalidRequestException("Unsupported grant_type: "
          + request.grantType());
    };
  }

  // ── authorization_code ───────────────────────────────────────────────────

  private TokenResponse authorizationCode(ClientInfo client, TokenRequest request) {
    SessionInfo info = lookup(request.code(), TokenType.AUTHORIZATION_CODE);
    requireClient(info, client);

    String expected = info.grant().authorizationRequest() == null
        ? null : info.grant().authorizationRequest().redirectUri();
    if (expected != null && !expected.equals(request.redirectUri())) {
      throw new InvalidRequestException("redirect_uri does not match the authorization request");
    }
    return redeem(info, TokenType.AUTHORIZATION_CODE);
  }

  // ── refresh_token ────────────────────────────────────────────────────────

  private TokenResponse refreshToken(ClientInfo client, TokenRequest request) {
    SessionInfo info = lookup(request.refreshToken(), TokenType.REFRESH_TOKEN);
    requireClient(info, client);
    return redeem(info, TokenType.REFRESH_TOKEN);
  }

  // ── token exchange ───────────────────────────────────────────────────────

  private TokenResponse tokenExchange(ClientInfo client, TokenRequest request) {
    SessionInfo info = lookup(request.subjectToken(), TokenType.ACCESS_TOKEN);
    return sessionManager.withLock(info.key(), () -> {
      Instant now = sessionManager.now();
      Grant subjectGrant = sessionManager.getGrant(info.sessionId());
      Token subject = subjectGrant.findToken(request.subjectToken())
          .orElseThrow(() -> new UnknownTokenException("Unknown subject_token"));
      if (!subject.isActive(now) || !subjectGrant.isActive(now)) {
        throw new RevokedException("subject_token is no longer active");
      }

      ExchangeGrant exchange = null;
      boolean clientAllowed = false;
      for (Grant candidate : sessionManager.grants(info.sessionId())) {
        if (candidate instanceof ExchangeGrant eg && eg.isActive(now)
            && eg.allows(client.clientId())) {
          clientAllowed = true;
          if (eg.covers(request.resource())) {
            exchange = eg;
            break;
          }
        }
      }
      if (!clientAllowed) {
        log.warn("Client {} has no exchange grant for tokens of {}", client.clientId(),
            info.clientId());
        throw new MintingNotAllowedException("Client may not exchange this token");
      }
      if (exchange == null) {
        throw new InvalidTargetException("Resource not covered: " + request.resource());
      }
      // the issued token carries the exchange grant's scope, which the response reports
      if (!exchange.scope().containsAll(request.scope())) {
        throw new UnAuthorizedClientScopeException("Scope exceeds what may be exchanged");
      }

      String exchangeSessionId = info.key().clientKey().withGrant(exchange.id()).serialize();
      Token accessToken = tokenEngine.mintToken(exchangeSessionId, TokenType.ACCESS_TOKEN, null,
          null);
      log.info("Exchanged an access token of client {} for client {} (grant {})",
          info.clientId(), client.clientId(), exchange.id());
      return new TokenResponse(accessToken.value(), TokenResponse.BEARER,
          expiresIn(accessToken, now), null, null, String.join(" ", exchange.scope()),
          TokenRequest.ACCESS_TOKEN_TYPE);
    });
  }

  // ── shared ───────────────────────────────────────────────────────────────

  private SessionInfo lookup(String value, TokenType expectedType) {
    SessionInfo info;
    try {
      info = sessionManager.getSessionInfoByToken(value);
    } catch (TooOldException e) {
      throw new RevokedException(expectedType.value() + " has expired", e);
    }
    if (info.token().type() != expectedType) {
      throw new UnknownTokenException("Not a " + expectedType.value());
    }
    return info;
  }

  private static void requireClient(SessionInfo info, ClientInfo client) {
    if (!Objects.equals(info.clientId(), client.clientId())) {
      log.warn("Client {} presented a token issued to {}", client.clientId(), info.clientId());
      throw new InvalidRequestException("Wrong client");
    }
  }

  /**
   * Checks the presented token, mints from it and counts its use as one step under the
   * grant's lock.
   */
  private TokenResponse redeem(SessionInfo info, TokenType type) {
    return sessionManager.withLock(info.key(), () -> {
      Instant now = sessionManager.now();
      Grant grant = sessionManager.getGrant(info.sessionId());
      Token presented = grant.findToken(info.token().value())
          .orElseThrow(() -> new UnknownTokenException("Unknown " + type.value()));
      if (!presented.isActive(now)) {
        throw new RevokedException(type.value() + " is no longer active");
      }
      if (!grant.isActive(now)) {
        throw new RevokedException("Grant is no longer active");
      }
      TokenResponse response = issue(info.sessionId(), grant, presented);
      tokenEngine.registerUsage(info.sessionId(), presented);
      return response;
    });
  }

  private TokenResponse issue(String sessionId, Grant grant, Token basedOn) {
    Token accessToken = tokenEngine.mintToken(sessionId, TokenType.ACCESS_TOKEN, basedOn, null);

    String refreshToken = null;
    if (mints(grant, basedOn, TokenType.REFRESH_TOKEN)) {
      refreshToken = tokenEngine.mintToken(sessionId, TokenType.REFRESH_TOKEN, basedOn, null)
          .value();
    }
    String idToken = null;
    if (grant.scope().contains("openid") && mints(grant, basedOn, TokenType.ID_TOKEN)) {
      idToken = idTokenFactory.mint(sessionId, basedOn, null, accessToken.value()).value();
    }
    log.info("Issued tokens under grant {} from {}", grant.id(), basedOn.type().value());
    return new TokenResponse(accessToken.value(), TokenResponse.BEARER,
        expiresIn(accessToken, sessionManager.now()), refreshToken, idToken,
        String.join(" ", grant.scope()));
  }

  private static Long expiresIn(Token token, Instant now) {
    if (token.expiresAt() == null) {
      return null;
    }
    return Math.max(0L, Duration.between(now, token.expiresAt()).getSeconds());
  }

  private static boolean mints(Grant grant, Token basedOn, TokenType type) {
    return grant.rulesFor(basedOn.type()).supportsMinting(type);
  }
}

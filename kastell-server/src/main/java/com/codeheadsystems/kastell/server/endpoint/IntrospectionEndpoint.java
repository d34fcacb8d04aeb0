package com.codeheadsystems.kastell.server.endpoint;

import com.codeheadsystems.kastell.model.token.IntrospectionResponse;
import com.codeheadsystems.kastell.model.token.TokenResponse;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.session.ExchangeGrant;
import com.codeheadsystems.kastell.server.session.Grant;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The introspection endpoint (RFC 7662): tells an authenticated client whether an access or
 * refresh token is active, and what it grants.
 * <p>
 * Only the client the token was issued to, a client named among the grant's resources, or a
 * client allowed by an exchange grant learns anything. Everyone else, and every unknown,
 * expired or revoked token, gets {@code {"active": false}}.
 */
public class IntrospectionEndpoint {

  private static final Logger log = LoggerFactory.getLogger(IntrospectionEndpoint.class);

  private final SessionManager sessionManager;
  private final String issuer;

  public IntrospectionEndpoint(SessionManager sessionManager, String issuer) {
    this.sessionManager = sessionManager;
    this.issuer = issuer;
  }

  /**
   * Introspects the {@code token} parameter.
   *
   * @param client the authenticated client asking
   * @param params the form parameters
   * @return the token's state
   * @throws InvalidRequestException if no token was sent
   */
  public IntrospectionResponse introspect(ClientInfo client, Map<String, String> params) {
    String value = params.get("token");
    if (value == null || value.isBlank()) {
      throw new InvalidRequestException("Missing token");
    }
    SessionInfo info;
    try {
      info = sessionManager.getSessionInfoByToken(value);
    } catch (KastellException e) {
      log.debug("Introspected token does not resolve: {}", e.getMessage());
      return IntrospectionResponse.inactive();
    }
    Token token = info.token();
    Grant grant = info.grant();
    Instant now = sessionManager.now();
    if (token.type() != TokenType.ACCESS_TOKEN && token.type() != TokenType.REFRESH_TOKEN) {
      return IntrospectionResponse.inactive();
    }
    if (!token.isActive(now) || !grant.isActive(now)) {
      return IntrospectionResponse.inactive();
    }
    if (!mayIntrospect(client.clientId(), info)) {
      log.warn("Client {} introspected a token of {}", client.clientId(), info.clientId());
      return IntrospectionResponse.inactive();
    }
    return new IntrospectionResponse(true,
        String.join(" ", grant.scope()),
        info.clientId(),
        token.type() == TokenType.ACCESS_TOKEN ? TokenResponse.BEARER : token.type().value(),
        token.expiresAt() == null ? null : token.expiresAt().getEpochSecond(),
        token.issuedAt().getEpochSecond(),
        info.clientSession() == null ? null : info.clientSession().sub(),
        grant.resources(),
        issuer);
  }

  private static boolean mayIntrospect(String clientId, SessionInfo info) {
    if (clientId.equals(info.clientId()) || info.grant().resources().contains(clientId)) {
      return true;
    }
    return info.grant() instanceof ExchangeGrant exchange && exchange.allows(clientId);
  }
}

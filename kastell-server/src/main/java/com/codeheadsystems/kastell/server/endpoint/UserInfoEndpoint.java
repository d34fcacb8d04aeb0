package com.codeheadsystems.kastell.server.endpoint;

import com.codeheadsystems.kastell.server.claims.ClaimsResolver;
import com.codeheadsystems.kastell.server.exception.InvalidTokenException;
import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.session.ClaimsUsage;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The userinfo endpoint: releases the claims a grant allows for {@code userinfo} to the
 * holder of an access token issued under it.
 */
public class UserInfoEndpoint {

  private static final Logger log = LoggerFactory.getLogger(UserInfoEndpoint.class);
  private static final String BEARER_PREFIX = "Bearer ";

  private final SessionManager sessionManager;
  private final ClaimsResolver claimsResolver;

  public UserInfoEndpoint(SessionManager sessionManager, ClaimsResolver claimsResolver) {
    this.sessionManager = sessionManager;
    this.claimsResolver = claimsResolver;
  }

  /**
   * Extracts the bearer token of an {@code Authorization} header.
   *
   * @param authorizationHeader the header, may be null
   * @return the token
   * @throws InvalidTokenException if the header carries no bearer token
   */
  public static String bearerToken(String authorizationHeader) {
    if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX,
        0, BEARER_PREFIX.length())) {
      throw new InvalidTokenException("No bearer token");
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw new InvalidTokenException("No bearer token");
    }
    return token;
  }

  /**
   * The claims released to an access token.
   *
   * @param accessToken the access token value
   * @return claims including {@code sub}
   * @throws InvalidTokenException if the token is unknown, of another type, or inactive
   */
  public Map<String, Object> userInfo(String accessToken) {
    SessionInfo info;
    try {
      info = sessionManager.getSessionInfoByToken(accessToken);
    } catch (KastellException e) {
      throw new InvalidTokenException("Invalid access token", e);
    }
    Token token = info.token();
    if (token.type() != TokenType.ACCESS_TOKEN) {
      throw new InvalidTokenException("Not an access token");
    }
    if (!token.isActive(sessionManager.now()) || !info.grant().isActive(sessionManager.now())) {
      throw new InvalidTokenException("Access token is no longer active");
    }
    Map<String, Object> claims = new LinkedHashMap<>(claimsResolver.getUserClaims(info.userId(),
        info.grant().claimsFor(ClaimsUsage.USERINFO)));
    claims.put("sub", info.clientSession().sub());
    log.debug("userInfo(clientId={}, claims={})", info.clientId(), claims.keySet());
    return claims;
  }
}

package com.codeheadsystems.kastell.server.token;

import com.codeheadsystems.kastell.server.claims.ClaimsResolver;
import com.codeheadsystems.kastell.server.session.AuthenticationEvent;
import com.codeheadsystems.kastell.server.session.ClaimsUsage;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.Token;
import com.codeheadsystems.kastell.server.session.TokenEngine;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assembles the claims of an ID token and mints it through the {@link TokenEngine}.
 */
public class IdTokenFactory {

  private static final Logger log = LoggerFactory.getLogger(IdTokenFactory.class);

  private final SessionManager sessionManager;
  private final TokenEngine tokenEngine;
  private final ClaimsResolver claimsResolver;
  private final IdTokenCodec idTokenCodec;

  public IdTokenFactory(SessionManager sessionManager, TokenEngine tokenEngine,
                        ClaimsResolver claimsResolver, IdTokenCodec idTokenCodec) {
    this.sessionManager = sessionManager;
    this.tokenEngine = tokenEngine;
    this.claimsResolver = claimsResolver;
    this.idTokenCodec = idTokenCodec;
  }

  /**
   * Mints an ID token.
   *
   * @param sessionId   the grant's session id
   * @param basedOn     the token it is minted from, may be null
   * @param code        code issued in the same response, hashed into {@code c_hash}, may be null
   * @param accessToken access token issued in the same response, hashed into {@code at_hash}, may be null
   * @return the stored ID token
   */
  public Token mint(String sessionId, Token basedOn, String code, String accessToken) {
    SessionInfo info = sessionManager.getSessionInfo(sessionId, false, true, true);
    Map<String, Object> claims = new LinkedHashMap<>(
        claimsResolver.getUserClaims(info.userId(), info.grant().claimsFor(ClaimsUsage.ID_TOKEN)));

    claims.put("sub", info.clientSession().sub());
    AuthenticationEvent event = info.grant().authenticationEvent();
    if (event != null) {
      if (event.authnTime() != null) {
        claims.put("auth_time", event.authnTime().getEpochSecond());
      }
      if (event.authnInfo() != null) {
        claims.put("acr", event.authnInfo());
      }
    }
    String nonce = info.grant().authorizationRequest() == null
        ? null : info.grant().authorizationRequest().nonce();
    if (nonce != null) {
      claims.put("nonce", nonce);
    }
    String alg = idTokenCodec.algorithmFor(info.clientId());
    if (code != null) {
      claims.put("c_hash", Hashing.leftHalfHash(code, alg));
    }
    if (accessToken != null) {
      claims.put("at_hash", Hashing.leftHalfHash(accessToken, alg));
    }
    log.debug("mint(claims={})", claims.keySet());
    return tokenEngine.mintToken(sessionId, TokenType.ID_TOKEN, basedOn, claims);
  }
}

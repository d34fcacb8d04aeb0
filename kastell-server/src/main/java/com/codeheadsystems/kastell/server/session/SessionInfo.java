package com.codeheadsystems.kastell.server.session;

/**
 * The nodes of the session tree along one session id. Parts that were not requested
 * are null.
 *
 * @param sessionId     the serialized session key
 * @param key           the parsed key
 * @param userSession   the user session
 * @param clientSession the client session
 * @param grant         the grant
 * @param token         the token the lookup started from, when looked up by token value
 */
public record SessionInfo(String sessionId, SessionKey key, UserSession userSession,
                          ClientSession clientSession, Grant grant, Token token) {

  public String userId() {
    return key.userId();
  }

  public String clientId() {
    return key.clientId();
  }

  public String grantId() {
    return key.grantId();
  }
}

package com.codeheadsystems.kastell.server.token;

import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Instant;
import java.util.Map;

/**
 * Turns (session id, type, claims) into an opaque token value and back.
 * <p>
 * Every value must carry at least the session id and the type tag, so that a token
 * presented at an endpoint can be traced to its grant without a store scan.
 */
public interface TokenCodec {

  /**
   * Encodes a new token value.
   *
   * @param sessionId   the full (user, client, grant) session id
   * @param type        the token type
   * @param expiresAt   expiry to embed, null for none
   * @param extraClaims additional claims to embed, may be empty
   * @return the token value
   */
  String encode(String sessionId, TokenType type, Instant expiresAt, Map<String, Object> extraClaims);

  /**
   * Decodes and authenticates a token value.
   *
   * @param value the token value
   * @return what the value carries
   * @throws UnknownTokenException if the value was not produced by this codec or was altered
   * @throws TooOldException       if the value is past its embedded expiry
   */
  TokenInfo decode(String value);
}

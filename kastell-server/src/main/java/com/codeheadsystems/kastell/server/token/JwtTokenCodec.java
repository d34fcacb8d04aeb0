package com.codeheadsystems.kastell.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenCodec} issuing HMAC-SHA256 signed JWTs.
 * <p>
 * The session id travels in the {@code sid} claim and the type tag in {@code ttype}. Used for
 * authorization codes, access tokens and refresh tokens.
 */
public class JwtTokenCodec implements TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(JwtTokenCodec.class);

  static final String SESSION_ID_CLAIM = "sid";
  static final String TYPE_CLAIM = "ttype";

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Clock clock;

  /**
   * Creates a new JwtTokenCodec.
   *
   * @param secret HMAC-SHA256 signing secret
   * @param issuer JWT issuer claim
   * @param clock  time source for iat and expiry checks
   */
  public JwtTokenCodec(byte[] secret, String issuer, Clock clock) {
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer))
        .build(clock);
    this.issuer = issuer;
    this.clock = clock;
  }

  @Override
  public String encode(String sessionId, TokenType type, Instant expiresAt,
                       Map<String, Object> extraClaims) {
    JWTCreator.Builder builder = JWT.create();
    if (extraClaims != null && !extraClaims.isEmpty()) {
      builder.withPayload(extraClaims);
    }
    builder.withIssuer(issuer)
        .withJWTId(UUID.randomUUID().toString())
        .withIssuedAt(clock.instant())
        .withClaim(SESSION_ID_CLAIM, sessionId)
        .withClaim(TYPE_CLAIM, type.typeTag());
    if (expiresAt != null) {
      builder.withExpiresAt(expiresAt);
    }
    return builder.sign(algorithm);
  }

  @Override
  public TokenInfo decode(String value) {
    DecodedJWT decoded;
    try {
      decoded = verifier.verify(value);
    } catch (TokenExpiredException e) {
      throw new TooOldException("Token has expired", e);
    } catch (JWTVerificationException e) {
      log.debug("JWT verification failed: {}", e.getMessage());
      throw new UnknownTokenException("Unknown token", e);
    }
    String sessionId = decoded.getClaim(SESSION_ID_CLAIM).asString();
    String tag = decoded.getClaim(TYPE_CLAIM).asString();
    if (sessionId == null || tag == null) {
      throw new UnknownTokenException("Token lacks session id or type");
    }
    try {
      return new TokenInfo(sessionId, TokenType.fromTypeTag(tag), decoded.getIssuedAtAsInstant(),
          decoded.getExpiresAtAsInstant(), decoded.getId());
    } catch (IllegalArgumentException e) {
      throw new UnknownTokenException("Unknown token type", e);
    }
  }
}

package com.codeheadsystems.kastell.server.token;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.exceptions.TokenExpiredException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TokenCodec} for ID tokens: asymmetrically signed JWTs whose {@code sid} claim is the
 * encrypted session id.
 * <p>
 * The audience and the signing algorithm come from the client named in the session id; the
 * client's {@code id_token_signed_response_alg} wins over the provider default.
 */
public class IdTokenCodec implements TokenCodec {

  private static final Logger log = LoggerFactory.getLogger(IdTokenCodec.class);

  /**
   * Expired ID tokens are still accepted as {@code id_token_hint} for this long.
   */
  static final Duration HINT_LEEWAY = Duration.ofDays(365);

  private final KeyMaterial keyMaterial;
  private final ClientRegistry clients;
  private final SidCipher sidCipher;
  private final String issuer;
  private final String defaultAlg;
  private final Clock clock;

  public IdTokenCodec(KeyMaterial keyMaterial, ClientRegistry clients, SidCipher sidCipher,
                      String issuer, String defaultAlg, Clock clock) {
    this.keyMaterial = keyMaterial;
    this.clients = clients;
    this.sidCipher = sidCipher;
    this.issuer = issuer;
    this.defaultAlg = defaultAlg;
    this.clock = clock;
  }

  /**
   * The JWS algorithm used for a client's ID tokens and logout tokens.
   *
   * @param clientId the client
   * @return the algorithm name
   */
  public String algorithmFor(String clientId) {
    return clients.get(clientId)
        .map(ClientInfo::idTokenSignedResponseAlg)
        .filter(alg -> alg != null && !alg.isBlank())
        .orElse(defaultAlg);
  }

  @Override
  public String encode(String sessionId, TokenType type, Instant expiresAt,
                       Map<String, Object> extraClaims) {
    String clientId = SessionKey.parse(sessionId).clientId();
    String alg = algorithmFor(clientId);
    JWTCreator.Builder builder = JWT.create();
    if (extraClaims != null && !extraClaims.isEmpty()) {
      builder.withPayload(extraClaims);
    }
    keyMaterial.keyId(alg).ifPresent(builder::withKeyId);
    builder.withIssuer(issuer)
        .withAudience(clientId)
        .withJWTId(UUID.randomUUID().toString())
        .withIssuedAt(clock.instant())
        .withClaim("sid", sidCipher.encrypt(sessionId));
    if (expiresAt != null) {
      builder.withExpiresAt(expiresAt);
    }
    return builder.sign(keyMaterial.signingAlgorithm(alg));
  }

  @Override
  public TokenInfo decode(String value) {
    DecodedJWT verified;
    try {
      verified = verifier(value, 0).verify(value);
    } catch (TokenExpiredException e) {
      throw new TooOldException("ID token has expired", e);
    } catch (JWTVerificationException | InvalidRequestException e) {
      log.debug("ID token verification failed: {}", e.getMessage());
      throw new UnknownTokenException("Unknown token", e);
    }
    return new TokenInfo(sessionId(verified), TokenType.ID_TOKEN, verified.getIssuedAtAsInstant(),
        verified.getExpiresAtAsInstant(), verified.getId());
  }

  /**
   * Verifies an {@code id_token_hint}: signature and issuer are checked, expiry only loosely.
   *
   * @param value the hint
   * @return the verified token
   * @throws InvalidRequestException if the hint does not verify
   */
  public DecodedJWT verifyHint(String value) {
    try {
      return verifier(value, HINT_LEEWAY.getSeconds()).verify(value);
    } catch (JWTVerificationException e) {
      log.debug("id_token_hint rejected: {}", e.getMessage());
      throw new InvalidRequestException("id_token_hint does not verify", e);
    }
  }

  /**
   * The session id a verified ID token was issued under.
   *
   * @param verified the token
   * @return the session id
   * @throws UnknownTokenException if the sid claim is missing or does not decrypt
   */
  public String sessionId(DecodedJWT verified) {
    String sid = verified.getClaim("sid").asString();
    if (sid == null) {
      throw new UnknownTokenException("ID token carries no sid");
    }
    try {
      return sidCipher.decrypt(sid);
    } catch (IllegalArgumentException e) {
      throw new UnknownTokenException("ID token sid does not decrypt", e);
    }
  }

  private JWTVerifier verifier(String value, long expiryLeeway) {
    String alg = JWT.decode(value).getAlgorithm();
    if (!keyMaterial.signingAlgorithms().contains(alg)) {
      throw new InvalidRequestException("Unsupported ID token algorithm: " + alg);
    }
    Algorithm algorithm = keyMaterial.signingAlgorithm(alg);
    return ((JWTVerifier.BaseVerification) JWT.require(algorithm)
        .withIssuer(issuer)
        .acceptExpiresAt(expiryLeeway))
        .build(clock);
  }
}

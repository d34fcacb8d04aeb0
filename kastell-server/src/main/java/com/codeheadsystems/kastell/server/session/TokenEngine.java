package com.codeheadsystems.kastell.server.session;

import com.codeheadsystems.kastell.server.exception.MintingNotAllowedException;
import com.codeheadsystems.kastell.server.exception.RevokedException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.token.TokenCodec;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mints tokens under a grant and records their usage.
 * <p>
 * A minted token is appended to its grant and the grant is written back while the session
 * lock is held. If the write fails the token is taken off the grant again and the failure
 * propagates, so a value is never handed out that the store does not know.
 */
public class TokenEngine {

  private static final Logger log = LoggerFactory.getLogger(TokenEngine.class);

  private final SessionManager sessionManager;

  public TokenEngine(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  /**
   * Mints a token with the codec configured for its type.
   *
   * @see #mintToken(String, TokenType, TokenCodec, Token, UsageRules, Instant, Map)
   */
  public Token mintToken(String sessionId, TokenType type, Token basedOn,
                         Map<String, Object> extraClaims) {
    return mintToken(sessionId, type, sessionManager.tokenHandler().codecFor(type), basedOn, null,
        null, extraClaims);
  }

  /**
   * Mints a token.
   *
   * @param sessionId   the grant's session id
   * @param type        the token type
   * @param codec       the codec producing the value
   * @param basedOn     the token this one is minted from, null to mint from the grant itself
   * @param usageRules  rules overriding the grant's rules for this type, may be null
   * @param expiresAt   expiry overriding the rules' {@code expires_in}, may be null
   * @param extraClaims claims handed to the codec, may be null
   * @return the stored token
   * @throws RevokedException            if the grant is revoked or expired
   * @throws UnknownTokenException       if {@code basedOn} was not issued under this grant
   * @throws MintingNotAllowedException  if the base token is no longer active or its rules
   *                                     do not allow this type
   */
  public Token mintToken(String sessionId, TokenType type, TokenCodec codec, Token basedOn,
                         UsageRules usageRules, Instant expiresAt, Map<String, Object> extraClaims) {
    SessionKey key = SessionManager.requireGrantKey(sessionId);
    return sessionManager.withLock(key, () -> {
      Grant grant = sessionManager.getGrant(key);
      Instant now = sessionManager.now();
      if (!grant.isActive(now)) {
        throw new RevokedException("Grant is not active");
      }
      Integer basedOnIndex = null;
      if (basedOn != null) {
        if (!grant.owns(basedOn)) {
          throw new UnknownTokenException("Base token was not issued under this grant");
        }
        if (!grant.token(basedOn.index()).isActive(now)) {
          throw new MintingNotAllowedException("Base " + basedOn.type().value()
              + " is no longer active");
        }
        if (!grant.rulesFor(basedOn.type()).supportsMinting(type)) {
          throw new MintingNotAllowedException("Can not mint " + type.value() + " from "
              + basedOn.type().value());
        }
        basedOnIndex = basedOn.index();
      }

      UsageRules rules = usageRules != null ? usageRules : grant.rulesFor(type);
      Instant expiry = expiresAt;
      if (expiry == null && rules.expiresIn() != null) {
        expiry = now.plusSeconds(rules.expiresIn());
      }
      Integer maxUsage = rules.maxUsage();
      if (maxUsage == null && type == TokenType.AUTHORIZATION_CODE) {
        maxUsage = 1;
      }

      String value = codec.encode(sessionId, type, expiry, extraClaims);
      Token token = new Token(grant.nextTokenIndex(), value, type, basedOnIndex, now, expiry,
          maxUsage);
      grant.append(token);
      try {
        sessionManager.persist(key, grant);
      } catch (RuntimeException e) {
        grant.discard(token);
        throw e;
      }
      log.debug("mintToken(type={}, basedOn={}, index={})", type.value(), basedOnIndex,
          token.index());
      return token;
    });
  }

  /**
   * Counts one use of a token and persists the grant.
   *
   * @param sessionId the grant's session id
   * @param token     the token
   * @return the stored token with its updated usage count
   * @throws RevokedException if the token already reached its usage limit
   */
  public Token registerUsage(String sessionId, Token token) {
    SessionKey key = SessionManager.requireGrantKey(sessionId);
    return sessionManager.withLock(key, () -> {
      Grant grant = sessionManager.getGrant(key);
      if (!grant.owns(token)) {
        throw new UnknownTokenException("Token was not issued under this grant");
      }
      Token stored = grant.token(token.index());
      if (stored.maxUsageReached()) {
        throw new RevokedException(stored.type().value() + " has been used "
            + stored.usageCount() + " times already");
      }
      stored.registerUsage();
      sessionManager.persist(key, grant);
      return stored;
    });
  }
}

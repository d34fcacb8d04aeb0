package com.codeheadsystems.kastell.server.session;

import java.time.Instant;

/**
 * A credential issued under a {@link Grant}.
 * <p>
 * Tokens live in their grant's token list; {@link #basedOn()} is the index of the token in
 * that same list this one was minted from. Instances are mutated only while the owning
 * session is locked by the {@link SessionManager}.
 */
public class Token {

  private final int index;
  private final String value;
  private final TokenType type;
  private final Integer basedOn;
  private final Instant issuedAt;
  private final Instant expiresAt;
  private final Integer maxUsage;
  private int usageCount;
  private boolean revoked;

  /**
   * Instantiates a new Token.
   *
   * @param index     position in the owning grant's token list
   * @param value     the encoded token value
   * @param type      the token type
   * @param basedOn   index of the base token, null when minted directly from the grant
   * @param issuedAt  when the token was minted
   * @param expiresAt when the token expires, null for never
   * @param maxUsage  usage limit, null for unbounded
   */
  public Token(int index, String value, TokenType type, Integer basedOn, Instant issuedAt,
               Instant expiresAt, Integer maxUsage) {
    this.index = index;
    this.value = value;
    this.type = type;
    this.basedOn = basedOn;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
    this.maxUsage = maxUsage;
  }

  public int index() {
    return index;
  }

  public String value() {
    return value;
  }

  public TokenType type() {
    return type;
  }

  public Integer basedOn() {
    return basedOn;
  }

  public Instant issuedAt() {
    return issuedAt;
  }

  public Instant expiresAt() {
    return expiresAt;
  }

  public Integer maxUsage() {
    return maxUsage;
  }

  public int usageCount() {
    return usageCount;
  }

  public boolean isRevoked() {
    return revoked;
  }

  /**
   * Records one use of this token.
   */
  public void registerUsage() {
    usageCount++;
  }

  public void revoke() {
    revoked = true;
  }

  public boolean maxUsageReached() {
    return maxUsage != null && usageCount >= maxUsage;
  }

  public boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  /**
   * Not revoked, not expired and below its usage limit.
   *
   * @param now the current time
   * @return true if the token may still be used
   */
  public boolean isActive(Instant now) {
    return !revoked && !isExpired(now) && !maxUsageReached();
  }

  @Override
  public String toString() {
    return "Token{index=" + index + ", type=" + type + ", basedOn=" + basedOn
        + ", usageCount=" + usageCount + ", revoked=" + revoked + "}";
  }
}

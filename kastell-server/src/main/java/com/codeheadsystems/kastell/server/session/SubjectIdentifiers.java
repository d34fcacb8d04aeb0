package com.codeheadsystems.kastell.server.session;

import com.codeheadsystems.kastell.server.token.Hashing;

/**
 * Derives the {@code sub} a client sees for a user (OpenID Connect Core §8).
 * <p>
 * Public subjects are the same for every client; pairwise subjects differ per sector.
 */
public class SubjectIdentifiers {

  public static final String PUBLIC = "public";
  public static final String PAIRWISE = "pairwise";

  private final String salt;

  public SubjectIdentifiers(String salt) {
    this.salt = salt;
  }

  /**
   * The subject identifier.
   *
   * @param userId           the local user id
   * @param subjectType      {@code public} or {@code pairwise}, null means public
   * @param sectorIdentifier the client's sector, required for pairwise
   * @return hex encoded SHA-256
   */
  public String sub(String userId, String subjectType, String sectorIdentifier) {
    if (PAIRWISE.equals(subjectType)) {
      if (sectorIdentifier == null || sectorIdentifier.isBlank()) {
        throw new IllegalArgumentException("Pairwise subjects need a sector identifier");
      }
      return Hashing.sha256Hex(sectorIdentifier + userId + salt);
    }
    if (subjectType != null && !PUBLIC.equals(subjectType)) {
      throw new IllegalArgumentException("Unknown subject type: " + subjectType);
    }
    return Hashing.sha256Hex(userId + salt);
  }
}

package com.codeheadsystems.kastell.server.session;

import java.security.SecureRandom;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Record of one successful user authentication.
 *
 * @param uid        the authenticated user id
 * @param salt       random value bound to this authentication (session_state input)
 * @param validUntil the event stops vouching for the user at this instant
 * @param authnInfo  the authentication context class reference (ACR) of the method used
 * @param authnTime  when the user authenticated, may be null
 */
public record AuthenticationEvent(String uid, String salt, Instant validUntil, String authnInfo,
                                  Instant authnTime) {

  private static final SecureRandom RANDOM = new SecureRandom();

  public AuthenticationEvent {
    if (validUntil == null) {
      throw new IllegalArgumentException("validUntil is required");
    }
  }

  /**
   * Creates an event for an authentication that happened at {@code authnTime}.
   *
   * @param uid       the user id
   * @param authnInfo the ACR
   * @param authnTime when the authentication happened
   * @param validFor  how long the event stays valid after {@code authnTime}
   * @return a new event with a random salt
   */
  public static AuthenticationEvent create(String uid, String authnInfo, Instant authnTime,
                                           Duration validFor) {
    byte[] salt = new byte[16];
    RANDOM.nextBytes(salt);
    return new AuthenticationEvent(uid, HexFormat.of().formatHex(salt), authnTime.plus(validFor),
        authnInfo, authnTime);
  }

  /**
   * Valid while {@code now < validUntil}.
   *
   * @param now the current time
   * @return true if the event still vouches for the user
   */
  public boolean isValid(Instant now) {
    return now.isBefore(validUntil);
  }
}

package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.cookie.Cookie;
import com.codeheadsystems.kastell.server.cookie.CookieDealer;
import com.codeheadsystems.kastell.server.token.Hashing;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Map;

/**
 * OpenID Connect Session Management: the browser-state cookie and the {@code session_state}
 * response parameter derived from it.
 */
public class SessionStateCalculator {

  /**
   * Type label of the browser-state cookie.
   */
  public static final String COOKIE_TYPE = "session";

  private static final SecureRandom RANDOM = new SecureRandom();

  private final CookieDealer cookieDealer;
  private final String cookieName;
  private final ObjectMapper objectMapper;

  public SessionStateCalculator(CookieDealer cookieDealer, String cookieName,
                                ObjectMapper objectMapper) {
    this.cookieDealer = cookieDealer;
    this.cookieName = cookieName;
    this.objectMapper = objectMapper;
  }

  /**
   * The browser-state ({@code opbs}) cookie. Readable by scripts, since the relying party's
   * check-session iframe compares it.
   *
   * @param authnTime when the user authenticated
   * @return the cookie
   */
  public Cookie browserStateCookie(Instant authnTime) {
    String json;
    try {
      json = objectMapper.writeValueAsString(Map.of("authn_time", authnTime.getEpochSecond()));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize browser state", e);
    }
    String state = Base64.getUrlEncoder().withoutPadding()
        .encodeToString(json.getBytes(StandardCharsets.UTF_8));
    return cookieDealer.createCookie(state, COOKIE_TYPE, cookieName, null, "None", false);
  }

  /**
   * {@code hex(SHA-256(client_id " " origin " " opbs " " salt)) "." salt}.
   *
   * @param clientId  the client
   * @param returnUri the redirect URI, reduced to its origin
   * @param opbs      the browser-state value
   * @param salt      per-response salt
   * @return the session_state value
   */
  public static String compute(String clientId, String returnUri, String opbs, String salt) {
    String origin = Uris.origin(returnUri);
    return Hashing.sha256Hex(clientId + " " + origin + " " + opbs + " " + salt) + "." + salt;
  }

  public static String salt() {
    byte[] bytes = new byte[8];
    RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}

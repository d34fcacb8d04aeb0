package com.codeheadsystems.kastell.server.cookie;

import com.codeheadsystems.kastell.server.token.Hashing;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CookieDealer} that signs cookie values with HMAC-SHA256.
 * <p>
 * Value layout: {@code b64url(payload) "|" epoch-seconds "|" type "|" b64url(mac)}, the MAC
 * covering everything before the last separator. Payloads are readable by the user agent;
 * only integrity is protected.
 */
public class HmacCookieDealer implements CookieDealer {

  private static final Logger log = LoggerFactory.getLogger(HmacCookieDealer.class);
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64URL_D = Base64.getUrlDecoder();
  private static final String SEPARATOR = "|";

  private final byte[] key;
  private final Clock clock;
  private final String defaultSameSite;
  private final boolean secure;

  /**
   * Instantiates a new Hmac cookie dealer.
   *
   * @param key             HMAC key
   * @param clock           time source for the embedded timestamp
   * @param defaultSameSite SameSite used when a caller passes none
   * @param secure          whether cookies carry the Secure attribute
   */
  public HmacCookieDealer(byte[] key, Clock clock, String defaultSameSite, boolean secure) {
    this.key = key.clone();
    this.clock = clock;
    this.defaultSameSite = defaultSameSite;
    this.secure = secure;
  }

  @Override
  public Optional<List<String>> getCookieValue(String cookieHeader, String name) {
    Optional<String> raw = findCookie(cookieHeader, name);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    String value = raw.get();
    int macStart = value.lastIndexOf(SEPARATOR);
    String[] parts = value.split("\\|", -1);
    if (macStart < 0 || parts.length != 4) {
      log.warn("Malformed cookie {}", name);
      throw new SecurityException("Malformed cookie");
    }
    byte[] expected = mac(value.substring(0, macStart));
    byte[] presented;
    try {
      presented = B64URL_D.decode(parts[3]);
    } catch (IllegalArgumentException e) {
      throw new SecurityException("Malformed cookie signature", e);
    }
    if (!Arrays.constantTimeAreEqual(expected, presented)) {
      log.warn("Cookie {} failed its integrity check", name);
      throw new SecurityException("Cookie tampering detected");
    }
    String payload;
    try {
      payload = new String(B64URL_D.decode(parts[0]), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new SecurityException("Malformed cookie payload", e);
    }
    return Optional.of(List.of(payload, parts[1], parts[2]));
  }

  @Override
  public Cookie createCookie(String payload, String type, String name, Duration ttl,
                             String sameSite, Boolean httpOnly) {
    String signed = B64URL.encodeToString(payload.getBytes(StandardCharsets.UTF_8))
        + SEPARATOR + clock.instant().getEpochSecond()
        + SEPARATOR + type;
    String value = signed + SEPARATOR + B64URL.encodeToString(mac(signed));
    return new Cookie(name, value, ttl, "/", sameSite == null ? defaultSameSite : sameSite,
        httpOnly == null || httpOnly, secure);
  }

  private byte[] mac(String data) {
    return Hashing.hmacSha256(key, data.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Finds one cookie in a {@code Cookie} header ({@code a=1; b=2}).
   *
   * @param cookieHeader the header, may be null
   * @param name         the cookie name
   * @return the raw value
   */
  public static Optional<String> findCookie(String cookieHeader, String name) {
    if (cookieHeader == null || cookieHeader.isBlank()) {
      return Optional.empty();
    }
    for (String pair : cookieHeader.split(";")) {
      int eq = pair.indexOf('=');
      if (eq > 0 && pair.substring(0, eq).trim().equals(name)) {
        return Optional.of(pair.substring(eq + 1).trim());
      }
    }
    return Optional.empty();
  }
}

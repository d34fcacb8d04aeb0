package com.codeheadsystems.kastell.server.cookie;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Creates and reads integrity protected cookies.
 */
public interface CookieDealer {

  /**
   * Reads a cookie out of a {@code Cookie} request header.
   *
   * @param cookieHeader the raw header, may be null
   * @param name         the cookie name
   * @return {@code [payload, timestamp, type]}, or empty if the cookie is absent
   * @throws SecurityException if the cookie is present but was tampered with
   */
  Optional<List<String>> getCookieValue(String cookieHeader, String name);

  /**
   * Creates a cookie.
   *
   * @param payload  the value to protect
   * @param type     a short label stored with the payload
   * @param name     the cookie name
   * @param ttl      lifetime, null for a browser-session cookie
   * @param sameSite SameSite attribute, null for the dealer default
   * @param httpOnly HttpOnly attribute, null for the dealer default
   * @return the cookie
   */
  Cookie createCookie(String payload, String type, String name, Duration ttl, String sameSite,
                      Boolean httpOnly);

  default Cookie createCookie(String payload, String type, String name) {
    return createCookie(payload, type, name, null, null, null);
  }
}

package com.codeheadsystems.kastell.server.cookie;

import java.time.Duration;

/**
 * A cookie to set on the user agent.
 *
 * @param name     cookie name
 * @param value    cookie value
 * @param maxAge   lifetime, null for a browser-session cookie, zero to delete
 * @param path     path attribute
 * @param sameSite SameSite attribute, may be null
 * @param httpOnly whether scripts may not read it
 * @param secure   whether it is only sent over https
 */
public record Cookie(String name, String value, Duration maxAge, String path, String sameSite,
                     boolean httpOnly, boolean secure) {

  /**
   * A cookie that makes the user agent forget {@code name}.
   *
   * @param name the cookie to delete
   * @return the expiring cookie
   */
  public static Cookie expired(String name) {
    return new Cookie(name, "", Duration.ZERO, "/", null, true, true);
  }

  /**
   * Renders the {@code Set-Cookie} header value.
   *
   * @return the header value
   */
  public String toHeaderValue() {
    StringBuilder sb = new StringBuilder(name).append('=').append(value);
    if (path != null) {
      sb.append("; Path=").append(path);
    }
    if (maxAge != null) {
      sb.append("; Max-Age=").append(maxAge.getSeconds());
    }
    if (sameSite != null) {
      sb.append("; SameSite=").append(sameSite);
    }
    if (secure) {
      sb.append("; Secure");
    }
    if (httpOnly) {
      sb.append("; HttpOnly");
    }
    return sb.toString();
  }
}

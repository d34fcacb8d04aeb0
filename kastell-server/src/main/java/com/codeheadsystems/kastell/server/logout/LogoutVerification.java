package com.codeheadsystems.kastell.server.logout;

import com.codeheadsystems.kastell.server.cookie.Cookie;
import java.util.List;

/**
 * Outcome of a confirmed logout.
 *
 * @param iframes     front-channel iframes to render
 * @param redirectUri where to send the user once the iframes have loaded
 * @param cookies     cookies expiring the provider's session and browser-state cookies
 */
public record LogoutVerification(List<String> iframes, String redirectUri, List<Cookie> cookies) {

  public LogoutVerification {
    iframes = List.copyOf(iframes);
    cookies = List.copyOf(cookies);
  }
}

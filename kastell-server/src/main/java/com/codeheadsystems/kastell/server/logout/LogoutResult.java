package com.codeheadsystems.kastell.server.logout;

import java.util.Map;

/**
 * Notifications produced by logging a user out of one or more clients.
 *
 * @param blu back-channel logouts keyed by client id
 * @param flu front-channel iframes keyed by client id
 */
public record LogoutResult(Map<String, BackChannelLogout> blu, Map<String, String> flu) {

  public LogoutResult {
    blu = Map.copyOf(blu);
    flu = Map.copyOf(flu);
  }

  public boolean isEmpty() {
    return blu.isEmpty() && flu.isEmpty();
  }
}

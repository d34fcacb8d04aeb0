package com.codeheadsystems.kastell.server.session;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Root of a user's session tree, created at first login.
 */
public class UserSession implements SessionRecord {

  private final String userId;
  private final Set<String> clientIds = new LinkedHashSet<>();

  public UserSession(String userId) {
    this.userId = userId;
  }

  public String userId() {
    return userId;
  }

  /**
   * Clients the user has a session with, in the order they were first visited.
   *
   * @return the client ids
   */
  public Set<String> clientIds() {
    return Collections.unmodifiableSet(clientIds);
  }

  public void addClient(String clientId) {
    clientIds.add(clientId);
  }
}

package com.codeheadsystems.kastell.server.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A user's session with one client.
 */
public class ClientSession implements SessionRecord {

  private final String clientId;
  private final String sub;
  private final List<String> grantIds = new ArrayList<>();
  private boolean revoked;

  public ClientSession(String clientId, String sub) {
    this.clientId = clientId;
    this.sub = sub;
  }

  public String clientId() {
    return clientId;
  }

  /**
   * The subject identifier the client knows the user by.
   *
   * @return the sub
   */
  public String sub() {
    return sub;
  }

  public List<String> grantIds() {
    return Collections.unmodifiableList(grantIds);
  }

  public void addGrant(String grantId) {
    grantIds.add(grantId);
  }

  public boolean isRevoked() {
    return revoked;
  }

  public void revoke() {
    revoked = true;
  }
}

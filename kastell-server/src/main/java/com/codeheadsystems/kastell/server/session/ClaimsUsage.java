package com.codeheadsystems.kastell.server.session;

import java.util.Arrays;

/**
 * Where a set of released claims ends up.
 */
public enum ClaimsUsage {

  USERINFO("userinfo"),
  ID_TOKEN("id_token"),
  INTROSPECTION("introspection"),
  ACCESS_TOKEN("access_token");

  private final String value;

  ClaimsUsage(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static ClaimsUsage fromValue(String value) {
    return Arrays.stream(values())
        .filter(u -> u.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown claims usage: " + value));
  }
}

package com.codeheadsystems.kastell.server.claims;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link UserInfoSource} over a static map, for development and tests.
 */
public class InMemoryUserInfoSource implements UserInfoSource {

  private final Map<String, Map<String, Object>> users = new ConcurrentHashMap<>();

  public InMemoryUserInfoSource() {
  }

  public InMemoryUserInfoSource(Map<String, Map<String, Object>> users) {
    this.users.putAll(users);
  }

  public void put(String userId, Map<String, Object> claims) {
    users.put(userId, Map.copyOf(claims));
  }

  @Override
  public Map<String, Object> userInfo(String userId, String clientId) {
    return users.getOrDefault(userId, Map.of());
  }
}

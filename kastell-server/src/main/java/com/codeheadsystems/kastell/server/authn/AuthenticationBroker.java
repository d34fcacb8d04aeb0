package com.codeheadsystems.kastell.server.authn;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The configured authentication methods, looked up by id or by ACR.
 * The first registered method is the default.
 */
public class AuthenticationBroker {

  private final Map<String, Registration> methods = new LinkedHashMap<>();

  public AuthenticationBroker register(String id, AuthenticationMethod method) {
    if (methods.putIfAbsent(id, new Registration(id, method)) != null) {
      throw new IllegalArgumentException("Duplicate authentication method id: " + id);
    }
    return this;
  }

  public Optional<Registration> get(String id) {
    return Optional.ofNullable(methods.get(id));
  }

  /**
   * Methods satisfying an ACR, in registration order.
   *
   * @param acr the requested ACR
   * @return the matching methods, possibly empty
   */
  public List<Registration> pick(String acr) {
    List<Registration> picked = new ArrayList<>();
    for (Registration registration : methods.values()) {
      if (registration.method().acr().equals(acr)) {
        picked.add(registration);
      }
    }
    return picked;
  }

  public Optional<Registration> defaultMethod() {
    return methods.values().stream().findFirst();
  }

  public List<Registration> registrations() {
    return List.copyOf(methods.values());
  }

  /**
   * A method under its configuration id.
   *
   * @param id     the id
   * @param method the method
   */
  public record Registration(String id, AuthenticationMethod method) {
  }
}

package com.codeheadsystems.kastell.server.authn;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Authentication method factories keyed by the type name used in configuration.
 * <p>
 * Hosts add their own methods with {@link #register}; there is no class-name lookup.
 */
public class AuthenticationMethodRegistry {

  /**
   * Type name of {@link NoAuthnMethod}. Its {@code user} argument names the fixed user.
   */
  public static final String NO_AUTHN = "no_authn";

  private final Map<String, AuthenticationMethodFactory> factories = new LinkedHashMap<>();

  /**
   * A registry knowing the built-in methods.
   *
   * @return the registry
   */
  public static AuthenticationMethodRegistry standard() {
    AuthenticationMethodRegistry registry = new AuthenticationMethodRegistry();
    registry.register(NO_AUTHN, (acr, arguments, environment) -> {
      String user = arguments.get("user");
      if (user == null || user.isBlank()) {
        throw new IllegalArgumentException("no_authn needs a 'user' argument");
      }
      return new NoAuthnMethod(acr, user, environment);
    });
    return registry;
  }

  public AuthenticationMethodRegistry register(String type, AuthenticationMethodFactory factory) {
    factories.put(type, factory);
    return this;
  }

  public Set<String> types() {
    return factories.keySet();
  }

  /**
   * Builds a broker holding one method per configuration entry.
   *
   * @param configs     the configured methods, the first becomes the default
   * @param environment what methods get from the provider
   * @return the broker
   * @throws IllegalArgumentException if a type is unknown
   */
  public AuthenticationBroker buildBroker(List<MethodConfig> configs, MethodEnvironment environment) {
    AuthenticationBroker broker = new AuthenticationBroker();
    for (MethodConfig config : configs) {
      AuthenticationMethodFactory factory = factories.get(config.type());
      if (factory == null) {
        throw new IllegalArgumentException("Unknown authentication method type: " + config.type());
      }
      broker.register(config.id(), factory.create(config.acr(), config.arguments(), environment));
    }
    return broker;
  }

  /**
   * Creates one kind of authentication method.
   */
  @FunctionalInterface
  public interface AuthenticationMethodFactory {
    AuthenticationMethod create(String acr, Map<String, String> arguments,
                                MethodEnvironment environment);
  }

  /**
   * One configured method.
   *
   * @param id        id the method is addressed by
   * @param type      factory type name
   * @param acr       ACR the method satisfies
   * @param arguments factory specific arguments
   */
  public record MethodConfig(String id, String type, String acr, Map<String, String> arguments) {

    public MethodConfig {
      arguments = arguments == null ? Map.of() : Map.copyOf(arguments);
    }
  }
}

package com.codeheadsystems.kastell.dropwizard;

import com.codeheadsystems.kastell.dropwizard.auth.KastellAuthenticator;
import com.codeheadsystems.kastell.dropwizard.auth.KastellPrincipal;
import com.codeheadsystems.kastell.dropwizard.health.ProviderHealthCheck;
import com.codeheadsystems.kastell.server.claims.InMemoryUserInfoSource;
import com.codeheadsystems.kastell.server.claims.UserInfoSource;
import com.codeheadsystems.kastell.server.client.InMemoryClientRegistry;
import com.codeheadsystems.kastell.server.config.KeyMaterialLoader;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.manager.OidcEndpointManager;
import com.codeheadsystems.kastell.server.manager.OidcProvider;
import com.codeheadsystems.kastell.server.resource.OidcResource;
import com.codeheadsystems.kastell.server.store.InMemoryPushedAuthorizationStore;
import com.codeheadsystems.kastell.server.store.InMemorySessionStore;
import com.codeheadsystems.kastell.server.store.PushedAuthorizationStore;
import com.codeheadsystems.kastell.server.store.SessionStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Kastell OpenID Provider into an existing Dropwizard
 * application.
 * <p>
 * Registers the provider's JAX-RS resource, a health check, and a bearer filter that accepts
 * the provider's own access tokens. Requires a {@link KastellConfiguration} block in the
 * application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new KastellBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores and a real user directory:
 * <pre>{@code
 *   bootstrap.addBundle(new KastellBundle<>(mySessionStore, myParStore, myUserDirectory));
 * }</pre>
 */
@Singleton
public class KastellBundle<C extends KastellConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(KastellBundle.class);

  private final SessionStore sessionStore;
  private final PushedAuthorizationStore pushedAuthorizationStore;
  private final UserInfoSource userInfoSource;
  private OidcProvider provider;

  /**
   * Creates a bundle backed by in-memory stores. Users come from the {@code users} block of
   * the configuration.
   * <p>
   * For dev/test only: all sessions and pushed requests are lost on restart.
   */
  public KastellBundle() {
    this.sessionStore = new InMemorySessionStore();
    this.pushedAuthorizationStore = new InMemoryPushedAuthorizationStore();
    this.userInfoSource = null;
    log.warn("""
        #################################################################
        # WARNING: Using in-memory session and request stores.          #
        # All sessions will be lost on restart.                         #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores and user directory. The {@code users}
   * block of the configuration is ignored.
   */
  @Inject
  public KastellBundle(SessionStore sessionStore,
                       PushedAuthorizationStore pushedAuthorizationStore,
                       UserInfoSource userInfoSource) {
    this.sessionStore = sessionStore;
    this.pushedAuthorizationStore = pushedAuthorizationStore;
    this.userInfoSource = userInfoSource;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    provider = buildProvider(configuration);

    environment.jersey().register(new OidcResource(new OidcEndpointManager(provider)));
    environment.healthChecks().register("kastell-provider", new ProviderHealthCheck(provider));

    // Bearer filter for the host application's own resources
    KastellAuthenticator authenticator = new KastellAuthenticator(provider.sessionManager());
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<KastellPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(KastellPrincipal.class));
  }

  /**
   * The provider built by {@link #run}, for host applications that call it directly.
   *
   * @return the provider, null before the bundle has run
   */
  public OidcProvider provider() {
    return provider;
  }

  private OidcProvider buildProvider(C configuration) {
    ProviderSettings.Builder settings = ProviderSettings.builder(configuration.getIssuer())
        .denyUnknownScopes(configuration.isDenyUnknownScopes())
        .parLifetime(Duration.ofSeconds(configuration.getParLifetimeSeconds()))
        .grantLifetime(Duration.ofSeconds(configuration.getGrantLifetimeSeconds()))
        .customScopes(configuration.getCustomScopes());
    if (!isBlank(configuration.getCheckSessionIframe())) {
      settings.checkSessionIframe(configuration.getCheckSessionIframe());
    }
    if (!configuration.isSecureCookies()) {
      log.warn("Provider cookies are not marked Secure. Do not use in production.");
    }

    OidcProvider.Builder builder = OidcProvider.builder(settings.build())
        .clients(new InMemoryClientRegistry(configuration.getClients()))
        .keyMaterial(KeyMaterialLoader.load(
            configuration.getTokenSecretHex(),
            configuration.getCookieSecretHex(),
            configuration.getSidSecretHex(),
            configuration.getRsaPrivateKeyBase64()))
        .sessionStore(sessionStore)
        .pushedAuthorizationStore(pushedAuthorizationStore)
        .userInfoSource(userInfoSource != null
            ? userInfoSource : new InMemoryUserInfoSource(configuration.getUsers()))
        .authenticationMethods(configuration.getAuthenticationMethods())
        .secureCookies(configuration.isSecureCookies());
    if (!isBlank(configuration.getSubjectSalt())) {
      builder.subjectSalt(configuration.getSubjectSalt());
    }
    log.info("Kastell provider for {} with {} client(s)", configuration.getIssuer(),
        configuration.getClients().size());
    return builder.build();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}

package com.codeheadsystems.kastell.springboot.config;

import com.codeheadsystems.kastell.server.claims.InMemoryUserInfoSource;
import com.codeheadsystems.kastell.server.claims.UserInfoSource;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.client.InMemoryClientRegistry;
import com.codeheadsystems.kastell.server.config.KeyMaterialLoader;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.manager.OidcEndpointManager;
import com.codeheadsystems.kastell.server.manager.OidcProvider;
import com.codeheadsystems.kastell.server.store.InMemoryPushedAuthorizationStore;
import com.codeheadsystems.kastell.server.store.InMemorySessionStore;
import com.codeheadsystems.kastell.server.store.PushedAuthorizationStore;
import com.codeheadsystems.kastell.server.store.SessionStore;
import com.codeheadsystems.kastell.server.token.KeyMaterial;
import java.time.Duration;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(KastellProperties.class)
public class KastellAutoConfiguration {

  private static final Logger log = LoggerFactory.getLogger(KastellAutoConfiguration.class);

  @Bean
  @ConditionalOnMissingBean
  public SessionStore sessionStore() {
    log.warn("Using in-memory session store. All sessions will be lost on restart. Do not use in production.");
    return new InMemorySessionStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public PushedAuthorizationStore pushedAuthorizationStore() {
    return new InMemoryPushedAuthorizationStore();
  }

  /**
   * Users from {@code kastell.users}. Override this bean to plug in a real user directory.
   */
  @Bean
  @ConditionalOnMissingBean
  public UserInfoSource userInfoSource(KastellProperties props) {
    return new InMemoryUserInfoSource(props.getUsers());
  }

  @Bean
  @ConditionalOnMissingBean
  public ClientRegistry clientRegistry(KastellProperties props) {
    return new InMemoryClientRegistry(props.getClients().stream()
        .map(KastellProperties.Client::toClientInfo)
        .collect(Collectors.toList()));
  }

  @Bean
  @ConditionalOnMissingBean
  public KeyMaterial keyMaterial(KastellProperties props) {
    return KeyMaterialLoader.load(
        props.getTokenSecretHex(),
        props.getCookieSecretHex(),
        props.getSidSecretHex(),
        props.getRsaPrivateKeyBase64());
  }

  @Bean
  @ConditionalOnMissingBean
  public ProviderSettings providerSettings(KastellProperties props) {
    ProviderSettings.Builder builder = ProviderSettings.builder(props.getIssuer())
        .denyUnknownScopes(props.isDenyUnknownScopes())
        .parLifetime(Duration.ofSeconds(props.getParLifetimeSeconds()))
        .grantLifetime(Duration.ofSeconds(props.getGrantLifetimeSeconds()))
        .customScopes(props.getCustomScopes());
    if (props.getCheckSessionIframe() != null && !props.getCheckSessionIframe().isBlank()) {
      builder.checkSessionIframe(props.getCheckSessionIframe());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public OidcProvider oidcProvider(KastellProperties props, ProviderSettings settings,
                                   ClientRegistry clientRegistry, KeyMaterial keyMaterial,
                                   SessionStore sessionStore,
                                   PushedAuthorizationStore pushedAuthorizationStore,
                                   UserInfoSource userInfoSource) {
    if (!props.isSecureCookies()) {
      log.warn("Provider cookies are not marked Secure. Do not use in production.");
    }
    OidcProvider.Builder builder = OidcProvider.builder(settings)
        .clients(clientRegistry)
        .keyMaterial(keyMaterial)
        .sessionStore(sessionStore)
        .pushedAuthorizationStore(pushedAuthorizationStore)
        .userInfoSource(userInfoSource)
        .authenticationMethods(props.getAuthenticationMethods().stream()
            .map(KastellProperties.Method::toMethodConfig)
            .collect(Collectors.toList()))
        .secureCookies(props.isSecureCookies());
    if (props.getSubjectSalt() != null && !props.getSubjectSalt().isBlank()) {
      builder.subjectSalt(props.getSubjectSalt());
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public OidcEndpointManager oidcEndpointManager(OidcProvider oidcProvider) {
    return new OidcEndpointManager(oidcProvider);
  }
}

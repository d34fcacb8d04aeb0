package com.codeheadsystems.kastell.springboot.health;

import com.codeheadsystems.kastell.model.discovery.JsonWebKeySet;
import com.codeheadsystems.kastell.server.manager.OidcProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class ProviderHealthIndicator implements HealthIndicator {

  private final OidcProvider provider;

  public ProviderHealthIndicator(OidcProvider provider) {
    this.provider = provider;
  }

  @Override
  public Health health() {
    String alg = provider.settings().idTokenSigningAlg();
    if (!provider.context().keyMaterial().signingAlgorithms().contains(alg)) {
      return Health.down().withDetail("reason", "No key for ID Token algorithm " + alg).build();
    }
    JsonWebKeySet jwks = provider.context().keyMaterial().jwks();
    if (jwks.keys().isEmpty()) {
      return Health.down().withDetail("reason", "The JWKS document is empty").build();
    }
    return Health.up()
        .withDetail("issuer", provider.settings().issuer())
        .withDetail("keys", jwks.keys().size())
        .build();
  }
}

package com.codeheadsystems.kastell.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.kastell.model.discovery.JsonWebKeySet;
import com.codeheadsystems.kastell.server.manager.OidcProvider;

/**
 * Health check that verifies the provider can sign ID Tokens and publishes its keys.
 */
public class ProviderHealthCheck extends HealthCheck {

  private final OidcProvider provider;

  /**
   * Instantiates a new provider health check.
   *
   * @param provider the provider
   */
  public ProviderHealthCheck(OidcProvider provider) {
    this.provider = provider;
  }

  @Override
  protected Result check() {
    String alg = provider.settings().idTokenSigningAlg();
    if (!provider.context().keyMaterial().signingAlgorithms().contains(alg)) {
      return Result.unhealthy("No key for the ID Token signing algorithm %s", alg);
    }
    JsonWebKeySet jwks = provider.context().keyMaterial().jwks();
    if (jwks.keys().isEmpty()) {
      return Result.unhealthy("The JWKS document is empty");
    }
    return Result.healthy("issuer=%s keys=%d", provider.settings().issuer(), jwks.keys().size());
  }
}

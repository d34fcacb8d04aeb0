package com.codeheadsystems.kastell.server;

import com.codeheadsystems.kastell.server.claims.InMemoryUserInfoSource;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.InMemoryClientRegistry;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.logout.BackChannelNotifier;
import com.codeheadsystems.kastell.server.manager.OidcProvider;
import com.codeheadsystems.kastell.server.token.KeyMaterial;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Shared fixtures for provider tests.
 */
public final class TestProviders {

  public static final String ISSUER = "https://op.example.org";
  public static final String CLIENT_ID = "client_1";
  public static final String CLIENT_SECRET = "hemligt-losenord-som-ar-langt-nog";
  public static final String REDIRECT_URI = "https://rp.example.org/cb";
  public static final String POST_LOGOUT_URI = "https://rp.example.org/logged_out";
  public static final String USER = "diana";

  // RSA generation is slow; every test shares one set
  private static final KeyMaterial KEYS = KeyMaterial.generate(new SecureRandom());

  private TestProviders() {
  }

  public static KeyMaterial keys() {
    return KEYS;
  }

  public static ProviderSettings settings() {
    return ProviderSettings.builder(ISSUER).build();
  }

  public static ClientInfo client() {
    return ClientInfo.builder(CLIENT_ID)
        .clientSecret(CLIENT_SECRET)
        .redirectUris(REDIRECT_URI)
        .postLogoutRedirectUris(POST_LOGOUT_URI)
        .responseTypes("code", "code id_token", "id_token token")
        .build();
  }

  public static InMemoryUserInfoSource users() {
    return new InMemoryUserInfoSource(Map.of(USER, Map.of(
        "name", "Diana Krall",
        "given_name", "Diana",
        "email", "diana@example.org",
        "email_verified", true,
        "phone_number", "+46 90 7865000")));
  }

  public static OidcProvider.Builder builder(ProviderSettings settings, Clock clock,
                                             ClientInfo... clients) {
    return OidcProvider.builder(settings)
        .clients(new InMemoryClientRegistry(List.of(clients)))
        .keyMaterial(KEYS)
        .userInfoSource(users())
        .backChannelNotifier(noopNotifier())
        .clock(clock);
  }

  public static OidcProvider provider(Clock clock) {
    return builder(settings(), clock, client()).build();
  }

  public static BackChannelNotifier noopNotifier() {
    return (clientId, notification) -> true;
  }

  public static String basic(String clientId, String secret) {
    return "Basic " + Base64.getEncoder()
        .encodeToString((clientId + ":" + secret).getBytes(StandardCharsets.UTF_8));
  }
}

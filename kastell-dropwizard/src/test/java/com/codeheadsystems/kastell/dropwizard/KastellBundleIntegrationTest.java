package com.codeheadsystems.kastell.dropwizard;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dropwizard.testing.ResourceHelpers;
import io.dropwizard.testing.junit5.DropwizardAppExtension;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Dropwizard integration tests for {@link KastellBundle}.
 * <p>
 * Starts a real embedded Jetty server using the test configuration (ephemeral keys, one
 * client, a no-op login method) and walks the authorization code flow over HTTP. The HTTP
 * client never follows redirects, so every hop is asserted.
 */
@ExtendWith(DropwizardExtensionsSupport.class)
class KastellBundleIntegrationTest {

  static final DropwizardAppExtension<KastellConfiguration> APP =
      new DropwizardAppExtension<>(
          KastellApplication.class,
          ResourceHelpers.resourceFilePath("test-config.yml"));

  private static final String ISSUER = "https://op.example.org";
  private static final String CLIENT_ID = "client_1";
  private static final String CLIENT_SECRET = "hemligt-losenord-som-ar-langt-nog";
  private static final String REDIRECT_URI = "https://rp.example.org/cb";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private HttpClient httpClient;

  @BeforeEach
  void setUp() {
    httpClient = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NEVER)
        .build();
  }

  // ── Code flow ────────────────────────────────────────────────────────────

  @Test
  void codeFlow_tokensGrantAccessToProtectedResource() throws Exception {
    JsonNode tokens = loginAndExchange();

    assertThat(tokens.path("token_type").asText()).isEqualTo("Bearer");
    assertThat(tokens.path("id_token").asText()).isNotBlank();
    String accessToken = tokens.path("access_token").asText();

    HttpResponse<String> userInfo = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/userinfo"))
        .header("Authorization", "Bearer " + accessToken)
        .GET());
    assertThat(userInfo.statusCode()).isEqualTo(200);
    JsonNode claims = objectMapper.readTree(userInfo.body());
    assertThat(claims.path("sub").asText()).isNotBlank();
    assertThat(claims.path("email").asText()).isEqualTo("diana@example.org");

    HttpResponse<String> whoAmI = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/whoami"))
        .header("Authorization", "Bearer " + accessToken)
        .GET());
    assertThat(whoAmI.statusCode()).isEqualTo(200);
    JsonNode principal = objectMapper.readTree(whoAmI.body());
    assertThat(principal.path("user").asText()).isEqualTo("diana");
    assertThat(principal.path("client").asText()).isEqualTo(CLIENT_ID);
  }

  @Test
  void token_wrongSecret_returns401Challenge() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/token"))
        .header("Authorization", basic(CLIENT_ID, "wrong"))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form(Map.of(
            "grant_type", "authorization_code",
            "code", "bogus",
            "redirect_uri", REDIRECT_URI)))));

    assertThat(response.statusCode()).isEqualTo(401);
    assertThat(response.headers().firstValue("WWW-Authenticate")).isPresent();
    assertThat(objectMapper.readTree(response.body()).path("error").asText())
        .isEqualTo("invalid_client");
  }

  @Test
  void protectedResource_noToken_returns401() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/whoami"))
        .GET());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  @Test
  void protectedResource_refreshTokenAsBearer_returns401() throws Exception {
    JsonNode tokens = loginAndExchange();

    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/api/whoami"))
        .header("Authorization", "Bearer " + tokens.path("refresh_token").asText())
        .GET());

    assertThat(response.statusCode()).isEqualTo(401);
  }

  // ── Discovery and operations ─────────────────────────────────────────────

  @Test
  void discovery_advertisesConfiguredIssuer() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/.well-known/openid-configuration"))
        .GET());

    assertThat(response.statusCode()).isEqualTo(200);
    JsonNode metadata = objectMapper.readTree(response.body());
    assertThat(metadata.path("issuer").asText()).isEqualTo(ISSUER);
    assertThat(metadata.path("token_endpoint").asText()).isEqualTo(ISSUER + "/token");
  }

  @Test
  void jwks_publishesSigningKey() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/jwks"))
        .GET());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(objectMapper.readTree(response.body()).path("keys").size()).isPositive();
  }

  @Test
  void healthCheck_reportsProvider() throws Exception {
    HttpResponse<String> response = send(HttpRequest.newBuilder()
        .uri(URI.create(String.format("http://localhost:%d/healthcheck", APP.getAdminPort())))
        .GET());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).contains("kastell-provider");
  }

  // ── Helpers ──────────────────────────────────────────────────────────────

  private JsonNode loginAndExchange() throws Exception {
    Map<String, String> authorization = new LinkedHashMap<>();
    authorization.put("response_type", "code");
    authorization.put("client_id", CLIENT_ID);
    authorization.put("redirect_uri", REDIRECT_URI);
    authorization.put("scope", "openid email");
    authorization.put("state", "af0ifjsldkj");
    authorization.put("nonce", "n-0S6_WzA2Mj");

    HttpResponse<String> toLogin = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/authorization?" + form(authorization)))
        .GET());
    assertThat(toLogin.statusCode()).isEqualTo(303);
    String loginLocation = toLogin.headers().firstValue("Location").orElseThrow();
    assertThat(loginLocation).startsWith(ISSUER + "/authn?");
    Map<String, String> loginArgs = queryOf(loginLocation);

    HttpResponse<String> callback = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/authn"))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form(Map.of(
            "method", loginArgs.get("method"),
            "query", loginArgs.get("query"))))));
    assertThat(callback.statusCode()).isEqualTo(303);
    String callbackLocation = callback.headers().firstValue("Location").orElseThrow();
    assertThat(callbackLocation).startsWith(REDIRECT_URI + "?");
    assertThat(callback.headers().allValues("Set-Cookie"))
        .anySatisfy(c -> assertThat(c).startsWith("kastell_session="));
    Map<String, String> result = queryOf(callbackLocation);
    assertThat(result).containsEntry("state", "af0ifjsldkj");

    HttpResponse<String> tokens = send(HttpRequest.newBuilder()
        .uri(URI.create(baseUrl() + "/token"))
        .header("Authorization", basic(CLIENT_ID, CLIENT_SECRET))
        .header("Content-Type", "application/x-www-form-urlencoded")
        .POST(HttpRequest.BodyPublishers.ofString(form(Map.of(
            "grant_type", "authorization_code",
            "code", result.get("code"),
            "redirect_uri", REDIRECT_URI)))));
    assertThat(tokens.statusCode()).isEqualTo(200);
    assertThat(tokens.headers().firstValue("Cache-Control")).hasValue("no-store");
    return objectMapper.readTree(tokens.body());
  }

  private HttpResponse<String> send(HttpRequest.Builder request) throws Exception {
    return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
  }

  private static String form(Map<String, String> params) {
    return params.entrySet().stream()
        .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
            + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
        .collect(Collectors.joining("&"));
  }

  private static Map<String, String> queryOf(String location) {
    Map<String, String> result = new LinkedHashMap<>();
    String query = URI.create(location).getRawQuery();
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      result.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
          URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
    }
    return result;
  }

  private static String basic(String clientId, String secret) {
    return "Basic " + Base64.getEncoder().encodeToString(
        (URLEncoder.encode(clientId, StandardCharsets.UTF_8) + ":"
            + URLEncoder.encode(secret, StandardCharsets.UTF_8)).getBytes(StandardCharsets.UTF_8));
  }

  private String baseUrl() {
    return String.format("http://localhost:%d", APP.getLocalPort());
  }
}

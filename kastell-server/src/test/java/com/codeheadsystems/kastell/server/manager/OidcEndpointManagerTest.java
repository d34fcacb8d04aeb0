package com.codeheadsystems.kastell.server.manager;

import static com.codeheadsystems.kastell.server.TestProviders.CLIENT_ID;
import static com.codeheadsystems.kastell.server.TestProviders.CLIENT_SECRET;
import static com.codeheadsystems.kastell.server.TestProviders.ISSUER;
import static com.codeheadsystems.kastell.server.TestProviders.POST_LOGOUT_URI;
import static com.codeheadsystems.kastell.server.TestProviders.REDIRECT_URI;
import static com.codeheadsystems.kastell.server.TestProviders.basic;
import static org.assertj.core.api.Assertions.assertThat;

import com.auth0.jwt.JWT;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.kastell.model.discovery.ProviderMetadata;
import com.codeheadsystems.kastell.model.error.ErrorResponse;
import com.codeheadsystems.kastell.model.par.PushedAuthorizationResponse;
import com.codeheadsystems.kastell.model.token.IntrospectionResponse;
import com.codeheadsystems.kastell.model.token.TokenResponse;
import com.codeheadsystems.kastell.server.MutableClock;
import com.codeheadsystems.kastell.server.TestProviders;
import com.codeheadsystems.kastell.server.authorization.Uris;
import com.codeheadsystems.kastell.server.cookie.Cookie;
import com.codeheadsystems.kastell.server.token.Hashing;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OidcEndpointManagerTest {

  private MutableClock clock;
  private OidcEndpointManager manager;

  @BeforeEach
  void setUp() {
    clock = MutableClock.now();
    manager = new OidcEndpointManager(TestProviders.provider(clock));
  }

  // ── Authorization code flow ──────────────────────────────────────────────

  @Test
  void authorization_withoutSession_redirectsToLogin() {
    EndpointResponse response = manager.authorization(authorizationParams("openid email"), null);

    assertThat(response.status()).isEqualTo(303);
    assertThat(response.location()).startsWith(ISSUER + "/authn?");
    Map<String, String> args = params(response.location());
    assertThat(args).containsEntry("method", "anon")
        .containsEntry("return_uri", REDIRECT_URI)
        .containsKeys("authn_class_ref", "query");
  }

  @Test
  void authorization_unknownClient_isNotRedirected() {
    Map<String, String> params = authorizationParams("openid");
    params.put("client_id", "nobody");

    EndpointResponse response = manager.authorization(params, null);

    assertThat(response.status()).isEqualTo(400);
    assertThat(((ErrorResponse) response.body()).error()).isEqualTo("unauthorized_client");
  }

  @Test
  void authorization_unregisteredRedirectUri_isNotRedirected() {
    Map<String, String> params = authorizationParams("openid");
    params.put("redirect_uri", "https://evil.example.com/cb");

    EndpointResponse response = manager.authorization(params, null);

    assertThat(response.status()).isEqualTo(400);
    assertThat(response.location()).isNull();
  }

  @Test
  void codeFlow_issuesTokensOnce() {
    EndpointResponse redirect = login(authorizationParams("openid email"));
    Map<String, String> callback = params(redirect.location());
    assertThat(redirect.location()).startsWith(REDIRECT_URI + "?");
    assertThat(callback).containsEntry("state", "af0ifjsldkj")
        .containsEntry("iss", ISSUER)
        .containsEntry("client_id", CLIENT_ID)
        .containsKey("code");
    assertThat(redirect.cookies()).extracting(Cookie::name).contains("kastell_session");

    EndpointResponse tokens = exchange(callback.get("code"));
    assertThat(tokens.status()).isEqualTo(200);
    assertThat(tokens.headers()).containsEntry("Cache-Control", "no-store");
    TokenResponse body = (TokenResponse) tokens.body();
    assertThat(body.accessToken()).isNotBlank();
    assertThat(body.tokenType()).isEqualTo("Bearer");
    assertThat(body.refreshToken()).isNotBlank();
    assertThat(body.scope()).isEqualTo("openid email");

    DecodedJWT idToken = JWT.decode(body.idToken());
    assertThat(idToken.getIssuer()).isEqualTo(ISSUER);
    assertThat(idToken.getAudience()).containsExactly(CLIENT_ID);
    assertThat(idToken.getClaim("nonce").asString()).isEqualTo("n-0S6_WzA2Mj");
    assertThat(idToken.getClaim("sid").isMissing()).isFalse();
    assertThat(idToken.getClaim("at_hash").asString())
        .isEqualTo(Hashing.leftHalfHash(body.accessToken(), idToken.getAlgorithm()));

    EndpointResponse replay = exchange(callback.get("code"));
    assertThat(replay.status()).isEqualTo(400);
    assertThat(((ErrorResponse) replay.body()).error()).isEqualTo("invalid_grant");
  }

  @Test
  void token_wrongRedirectUri_rejected() {
    String code = params(login(authorizationParams("openid")).location()).get("code");

    EndpointResponse response = manager.token(basic(CLIENT_ID, CLIENT_SECRET), Map.of(
        "grant_type", "authorization_code", "code", code,
        "redirect_uri", "https://rp.example.org/other"));

    assertThat(response.status()).isEqualTo(400);
  }

  @Test
  void token_badClient_challenges() {
    EndpointResponse response = manager.token(basic(CLIENT_ID, "wrong"), Map.of(
        "grant_type", "authorization_code", "code", "x", "redirect_uri", REDIRECT_URI));

    assertThat(response.status()).isEqualTo(401);
    assertThat(response.headers()).containsEntry("WWW-Authenticate",
        "Basic error=\"invalid_client\"");
  }

  @Test
  void refreshFlow_issuesNewAccessToken() {
    String code = params(login(authorizationParams("openid")).location()).get("code");
    TokenResponse first = (TokenResponse) exchange(code).body();

    EndpointResponse refreshed = manager.token(basic(CLIENT_ID, CLIENT_SECRET), Map.of(
        "grant_type", "refresh_token", "refresh_token", first.refreshToken()));

    assertThat(refreshed.status()).isEqualTo(200);
    TokenResponse second = (TokenResponse) refreshed.body();
    assertThat(second.accessToken()).isNotBlank().isNotEqualTo(first.accessToken());
  }

  @Test
  void codeFlow_expiredCode_rejected() {
    String code = params(login(authorizationParams("openid")).location()).get("code");
    clock.advance(Duration.ofHours(1));

    assertThat(exchange(code).status()).isEqualTo(400);
  }

  @Test
  void implicitHybrid_returnsFragment() {
    Map<String, String> params = authorizationParams("openid");
    params.put("response_type", "code id_token");

    EndpointResponse redirect = login(params);

    assertThat(redirect.location()).startsWith(REDIRECT_URI + "#");
    String fragment = redirect.location().substring(redirect.location().indexOf('#') + 1);
    assertThat(Uris.splitQuery(fragment)).containsKeys("code", "id_token", "state");
  }

  @Test
  void formPost_rendersAutoSubmittingForm() {
    Map<String, String> params = authorizationParams("openid");
    params.put("response_mode", "form_post");

    EndpointResponse response = login(params);

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.contentType()).isEqualTo(EndpointResponse.HTML);
    assertThat((String) response.body())
        .contains("action=\"" + REDIRECT_URI + "\"")
        .contains("name=\"code\"")
        .contains("name=\"state\" value=\"af0ifjsldkj\"");
  }

  @Test
  void existingSession_skipsLogin() {
    EndpointResponse first = login(authorizationParams("openid"));
    Map<String, String> again = authorizationParams("openid");
    again.put("state", "second");

    EndpointResponse response = manager.authorization(again, cookieHeader(first.cookies()));

    assertThat(response.status()).isEqualTo(303);
    assertThat(response.location()).startsWith(REDIRECT_URI);
    assertThat(params(response.location())).containsEntry("state", "second").containsKey("code");
  }

  @Test
  void promptNone_withoutSession_returnsLoginRequired() {
    Map<String, String> params = authorizationParams("openid");
    params.put("prompt", "none");

    EndpointResponse response = manager.authorization(params, null);

    assertThat(response.location()).startsWith(REDIRECT_URI);
    assertThat(params(response.location())).containsEntry("error", "login_required");
  }

  // ── Userinfo ─────────────────────────────────────────────────────────────

  @Test
  void userInfo_releasesScopedClaims() {
    String code = params(login(authorizationParams("openid email")).location()).get("code");
    TokenResponse tokens = (TokenResponse) exchange(code).body();

    EndpointResponse response = manager.userInfo("Bearer " + tokens.accessToken());

    assertThat(response.status()).isEqualTo(200);
    @SuppressWarnings("unchecked")
    Map<String, Object> claims = (Map<String, Object>) response.body();
    assertThat(claims).containsEntry("email", "diana@example.org")
        .containsKey("sub")
        .doesNotContainKey("name");
  }

  @Test
  void userInfo_withoutBearer_challenges() {
    EndpointResponse response = manager.userInfo(null);

    assertThat(response.status()).isEqualTo(401);
    assertThat(response.headers().get("WWW-Authenticate")).startsWith("Bearer");
  }

  // ── Introspection ────────────────────────────────────────────────────────

  @Test
  void introspection_describesOwnAccessToken() {
    String code = params(login(authorizationParams("openid email")).location()).get("code");
    TokenResponse tokens = (TokenResponse) exchange(code).body();

    EndpointResponse response = manager.introspection(basic(CLIENT_ID, CLIENT_SECRET),
        Map.of("token", tokens.accessToken()));

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.headers()).containsEntry("Cache-Control", "no-store");
    IntrospectionResponse body = (IntrospectionResponse) response.body();
    assertThat(body.active()).isTrue();
    assertThat(body.scope()).isEqualTo("openid email");
    assertThat(body.clientId()).isEqualTo(CLIENT_ID);
  }

  @Test
  void introspection_unauthenticated_challenges() {
    EndpointResponse response = manager.introspection(null, Map.of("token", "x"));

    assertThat(response.status()).isEqualTo(401);
    assertThat(response.headers()).containsKey("WWW-Authenticate");
  }

  @Test
  void introspection_withoutToken_isInvalidRequest() {
    EndpointResponse response = manager.introspection(basic(CLIENT_ID, CLIENT_SECRET), Map.of());

    assertThat(response.status()).isEqualTo(400);
    assertThat(((ErrorResponse) response.body()).error()).isEqualTo("invalid_request");
  }

  // ── PAR ──────────────────────────────────────────────────────────────────

  @Test
  void pushedAuthorization_requestUriIsSingleUse() {
    EndpointResponse pushed = manager.pushedAuthorization(basic(CLIENT_ID, CLIENT_SECRET),
        authorizationParams("openid"));
    assertThat(pushed.status()).isEqualTo(201);
    PushedAuthorizationResponse par = (PushedAuthorizationResponse) pushed.body();
    assertThat(par.requestUri()).startsWith("urn:uuid:");

    Map<String, String> byReference = Map.of("client_id", CLIENT_ID,
        "request_uri", par.requestUri());
    EndpointResponse first = manager.authorization(byReference, null);
    assertThat(first.location()).startsWith(ISSUER + "/authn?");

    EndpointResponse second = manager.authorization(byReference, null);
    assertThat(second.status()).isEqualTo(400);
  }

  @Test
  void pushedAuthorization_unauthenticated_challenges() {
    EndpointResponse pushed = manager.pushedAuthorization(null, authorizationParams("openid"));

    assertThat(pushed.status()).isEqualTo(401);
  }

  // ── Logout ───────────────────────────────────────────────────────────────

  @Test
  void endSession_withoutCookie_rejected() {
    EndpointResponse response = manager.endSession(Map.of(), null);

    assertThat(response.status()).isEqualTo(400);
    assertThat(((ErrorResponse) response.body()).errorDescription()).isEqualTo("Missing cookie");
  }

  @Test
  void endSession_postLogoutWithoutHint_rejected() {
    EndpointResponse login = login(authorizationParams("openid"));

    EndpointResponse response = manager.endSession(
        Map.of("post_logout_redirect_uri", POST_LOGOUT_URI), cookieHeader(login.cookies()));

    assertThat(response.status()).isEqualTo(400);
  }

  @Test
  void endSession_tamperedCookie_rejected() {
    EndpointResponse response = manager.endSession(Map.of(),
        "kastell_session=eyJzaWQiOiJ4In0|1700000000|sso|AAAA");

    assertThat(response.status()).isEqualTo(400);
    assertThat(((ErrorResponse) response.body()).errorDescription()).isEqualTo("Cookie error");
  }

  @Test
  void endSession_confirmedLogout_revokesAndRedirects() {
    EndpointResponse login = login(authorizationParams("openid"));
    String code = params(login.location()).get("code");
    TokenResponse tokens = (TokenResponse) exchange(code).body();

    EndpointResponse confirm = manager.endSession(Map.of(
        "id_token_hint", tokens.idToken(),
        "post_logout_redirect_uri", POST_LOGOUT_URI,
        "state", "bye"), cookieHeader(login.cookies()));
    assertThat(confirm.status()).isEqualTo(303);
    assertThat(confirm.location()).startsWith(ISSUER + "/verify_logout?");
    String sjwt = params(confirm.location()).get("sjwt");

    EndpointResponse done = manager.verifyLogout(Map.of("sjwt", sjwt));

    assertThat(done.status()).isEqualTo(303);
    assertThat(done.location()).isEqualTo(POST_LOGOUT_URI + "?state=bye");
    assertThat(done.cookies()).extracting(Cookie::maxAge).containsOnly(Duration.ZERO);
    assertThat(manager.userInfo("Bearer " + tokens.accessToken()).status()).isEqualTo(401);
  }

  @Test
  void verifyLogout_forgedToken_rejected() {
    assertThat(manager.verifyLogout(Map.of("sjwt", "a.b.c")).status()).isEqualTo(400);
    assertThat(manager.verifyLogout(Map.of()).status()).isEqualTo(400);
  }

  // ── Discovery ────────────────────────────────────────────────────────────

  @Test
  void discovery_describesEndpoints() {
    EndpointResponse response = manager.discovery();

    ProviderMetadata metadata = (ProviderMetadata) response.body();
    assertThat(metadata.issuer()).isEqualTo(ISSUER);
    assertThat(metadata.tokenEndpoint()).isEqualTo(ISSUER + "/token");
    assertThat(metadata.jwksUri()).isEqualTo(ISSUER + "/jwks");
    assertThat(metadata.responseModesSupported()).contains("query", "fragment", "form_post");
    assertThat(metadata.introspectionEndpoint()).isEqualTo(ISSUER + "/introspection");
    assertThat(metadata.grantTypesSupported())
        .contains("authorization_code", "urn:ietf:params:oauth:grant-type:token-exchange");
    assertThat(manager.jwks().keys()).isNotEmpty();
  }

  // ── helpers ──────────────────────────────────────────────────────────────

  private EndpointResponse login(Map<String, String> authorizationParams) {
    EndpointResponse toLogin = manager.authorization(authorizationParams, null);
    assertThat(toLogin.status()).isEqualTo(303);
    Map<String, String> args = params(toLogin.location());
    Map<String, String> form = new HashMap<>();
    form.put("method", args.get("method"));
    form.put("query", args.get("query"));
    return manager.authenticate(form);
  }

  private EndpointResponse exchange(String code) {
    return manager.token(basic(CLIENT_ID, CLIENT_SECRET), Map.of(
        "grant_type", "authorization_code", "code", code, "redirect_uri", REDIRECT_URI));
  }

  private static Map<String, String> authorizationParams(String scope) {
    Map<String, String> params = new LinkedHashMap<>();
    params.put("response_type", "code");
    params.put("client_id", CLIENT_ID);
    params.put("redirect_uri", REDIRECT_URI);
    params.put("scope", scope);
    params.put("state", "af0ifjsldkj");
    params.put("nonce", "n-0S6_WzA2Mj");
    return params;
  }

  private static Map<String, String> params(String location) {
    Map<String, String> result = new LinkedHashMap<>();
    Uris.splitQuery(Uris.query(location)).forEach((k, v) -> result.put(k, v.get(0)));
    return result;
  }

  private static String cookieHeader(List<Cookie> cookies) {
    return cookies.stream()
        .map(c -> c.name() + "=" + c.value())
        .collect(Collectors.joining("; "));
  }
}

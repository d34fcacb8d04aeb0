package com.codeheadsystems.kastell.springboot.controller;

import com.codeheadsystems.kastell.model.discovery.JsonWebKeySet;
import com.codeheadsystems.kastell.model.discovery.ProviderMetadata;
import com.codeheadsystems.kastell.server.cookie.Cookie;
import com.codeheadsystems.kastell.server.manager.EndpointResponse;
import com.codeheadsystems.kastell.server.manager.OidcEndpointManager;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Spring MVC front of the provider's endpoints. Query and form parameters arrive merged in one
 * {@link MultiValueMap}; the first value of a repeated parameter wins.
 */
@RestController
public class OidcController {

  private static final Logger log = LoggerFactory.getLogger(OidcController.class);

  private final OidcEndpointManager manager;

  public OidcController(OidcEndpointManager manager) {
    this.manager = manager;
    log.info("OidcController({})", manager.provider().settings().issuer());
  }

  // ── Authorization ────────────────────────────────────────────────────────

  @RequestMapping(path = "/authorization", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Object> authorize(
      @RequestParam MultiValueMap<String, String> params,
      @RequestHeader(value = HttpHeaders.COOKIE, required = false) String cookieHeader) {
    return toResponse(manager.authorization(flatten(params), cookieHeader));
  }

  @RequestMapping(path = "/authn", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Object> authenticate(@RequestParam MultiValueMap<String, String> params) {
    return toResponse(manager.authenticate(flatten(params)));
  }

  // ── Token, userinfo, introspection, PAR ──────────────────────────────────

  @PostMapping("/token")
  public ResponseEntity<Object> token(
      @RequestParam MultiValueMap<String, String> params,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return toResponse(manager.token(authorization, flatten(params)));
  }

  @RequestMapping(path = "/userinfo", method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<Object> userInfo(
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return toResponse(manager.userInfo(authorization));
  }

  @PostMapping("/introspection")
  public ResponseEntity<Object> introspection(
      @RequestParam MultiValueMap<String, String> params,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return toResponse(manager.introspection(authorization, flatten(params)));
  }

  @PostMapping("/par")
  public ResponseEntity<Object> pushedAuthorization(
      @RequestParam MultiValueMap<String, String> params,
      @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
    return toResponse(manager.pushedAuthorization(authorization, flatten(params)));
  }

  // ── Logout ───────────────────────────────────────────────────────────────

  @GetMapping("/end_session")
  public ResponseEntity<Object> endSession(
      @RequestParam MultiValueMap<String, String> params,
      @RequestHeader(value = HttpHeaders.COOKIE, required = false) String cookieHeader) {
    return toResponse(manager.endSession(flatten(params), cookieHeader));
  }

  @GetMapping("/verify_logout")
  public ResponseEntity<Object> verifyLogout(@RequestParam MultiValueMap<String, String> params) {
    return toResponse(manager.verifyLogout(flatten(params)));
  }

  @GetMapping(path = "/post_logout", produces = MediaType.TEXT_HTML_VALUE)
  public String postLogout() {
    return "<!DOCTYPE html><html><head><title>Logged out</title></head>"
        + "<body><p>You have been logged out.</p></body></html>";
  }

  // ── Discovery ────────────────────────────────────────────────────────────

  @GetMapping(path = "/.well-known/openid-configuration", produces = MediaType.APPLICATION_JSON_VALUE)
  public ProviderMetadata providerConfiguration() {
    return manager.providerMetadata();
  }

  @GetMapping(path = "/jwks", produces = MediaType.APPLICATION_JSON_VALUE)
  public JsonWebKeySet jwks() {
    return manager.jwks();
  }

  // ── Translation ──────────────────────────────────────────────────────────

  static Map<String, String> flatten(MultiValueMap<String, String> params) {
    Map<String, String> flat = new LinkedHashMap<>();
    if (params != null) {
      params.forEach((name, values) -> {
        if (values != null && !values.isEmpty()) {
          flat.put(name, values.get(0));
        }
      });
    }
    return flat;
  }

  static ResponseEntity<Object> toResponse(EndpointResponse response) {
    ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.status());
    if (response.contentType() != null) {
      builder.contentType(MediaType.parseMediaType(response.contentType()));
    }
    if (response.location() != null) {
      builder.header(HttpHeaders.LOCATION, response.location());
    }
    for (Cookie cookie : response.cookies()) {
      builder.header(HttpHeaders.SET_COOKIE, cookie.toHeaderValue());
    }
    response.headers().forEach(builder::header);
    return builder.body(response.body());
  }
}

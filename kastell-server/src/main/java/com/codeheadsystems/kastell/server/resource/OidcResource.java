package com.codeheadsystems.kastell.server.resource;

import com.codeheadsystems.kastell.model.discovery.JsonWebKeySet;
import com.codeheadsystems.kastell.model.discovery.ProviderMetadata;
import com.codeheadsystems.kastell.server.cookie.Cookie;
import com.codeheadsystems.kastell.server.manager.EndpointResponse;
import com.codeheadsystems.kastell.server.manager.OidcEndpointManager;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.MultivaluedMap;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource exposing the OpenID Provider endpoints.
 * <p>
 * Endpoints (paths match {@code ProviderSettings.Endpoints.defaults()}):
 * <ul>
 *   <li>{@code GET|POST /authorization}: authorization endpoint</li>
 *   <li>{@code GET|POST /authn}: completes the login step</li>
 *   <li>{@code POST /token}: token endpoint</li>
 *   <li>{@code GET|POST /userinfo}: userinfo endpoint</li>
 *   <li>{@code POST /par}: pushed authorization requests</li>
 *   <li>{@code GET /end_session}: RP-initiated logout</li>
 *   <li>{@code GET /verify_logout}: logout confirmation</li>
 *   <li>{@code GET /post_logout}: default post-logout page</li>
 *   <li>{@code GET /.well-known/openid-configuration}: provider metadata</li>
 *   <li>{@code GET /jwks}: public signing keys</li>
 * </ul>
 * All protocol logic lives in {@link OidcEndpointManager}; this class only translates.
 */
@Singleton
@Path("/")
public class OidcResource {

  private static final Logger log = LoggerFactory.getLogger(OidcResource.class);

  private final OidcEndpointManager manager;

  @Inject
  public OidcResource(OidcEndpointManager manager) {
    this.manager = manager;
    log.info("OidcResource({})", manager.provider().settings().issuer());
  }

  // ── Authorization ────────────────────────────────────────────────────────

  @GET
  @Path("authorization")
  public Response authorize(@Context UriInfo uriInfo,
                            @HeaderParam(HttpHeaders.COOKIE) String cookieHeader) {
    return toResponse(manager.authorization(flatten(uriInfo.getQueryParameters()),
        cookieHeader));
  }

  @POST
  @Path("authorization")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  public Response authorizePost(MultivaluedMap<String, String> form,
                                @HeaderParam(HttpHeaders.COOKIE) String cookieHeader) {
    return toResponse(manager.authorization(flatten(form), cookieHeader));
  }

  @GET
  @Path("authn")
  public Response authenticate(@Context UriInfo uriInfo) {
    return toResponse(manager.authenticate(flatten(uriInfo.getQueryParameters())));
  }

  @POST
  @Path("authn")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  public Response authenticatePost(MultivaluedMap<String, String> form) {
    return toResponse(manager.authenticate(flatten(form)));
  }

  // ── Token, userinfo, introspection, PAR ──────────────────────────────────

  @POST
  @Path("token")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  @Produces(MediaType.APPLICATION_JSON)
  public Response token(MultivaluedMap<String, String> form,
                        @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return toResponse(manager.token(authorization, flatten(form)));
  }

  @GET
  @Path("userinfo")
  @Produces(MediaType.APPLICATION_JSON)
  public Response userInfo(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return toResponse(manager.userInfo(authorization));
  }

  @POST
  @Path("userinfo")
  @Produces(MediaType.APPLICATION_JSON)
  public Response userInfoPost(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return toResponse(manager.userInfo(authorization));
  }

  @POST
  @Path("introspection")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  @Produces(MediaType.APPLICATION_JSON)
  public Response introspection(MultivaluedMap<String, String> form,
                                @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return toResponse(manager.introspection(authorization, flatten(form)));
  }

  @POST
  @Path("par")
  @Consumes(MediaType.APPLICATION_FORM_URLENCODED)
  @Produces(MediaType.APPLICATION_JSON)
  public Response pushedAuthorization(MultivaluedMap<String, String> form,
                                      @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    return toResponse(manager.pushedAuthorization(authorization, flatten(form)));
  }

  // ── Logout ───────────────────────────────────────────────────────────────

  @GET
  @Path("end_session")
  public Response endSession(@Context UriInfo uriInfo,
                             @HeaderParam(HttpHeaders.COOKIE) String cookieHeader) {
    return toResponse(manager.endSession(flatten(uriInfo.getQueryParameters()), cookieHeader));
  }

  @GET
  @Path("verify_logout")
  public Response verifyLogout(@Context UriInfo uriInfo) {
    return toResponse(manager.verifyLogout(flatten(uriInfo.getQueryParameters())));
  }

  @GET
  @Path("post_logout")
  @Produces(MediaType.TEXT_HTML)
  public String postLogout() {
    return "<!DOCTYPE html><html><head><title>Logged out</title></head>"
        + "<body><p>You have been logged out.</p></body></html>";
  }

  // ── Discovery ────────────────────────────────────────────────────────────

  @GET
  @Path(".well-known/openid-configuration")
  @Produces(MediaType.APPLICATION_JSON)
  public ProviderMetadata providerConfiguration() {
    return manager.providerMetadata();
  }

  @GET
  @Path("jwks")
  @Produces(MediaType.APPLICATION_JSON)
  public JsonWebKeySet jwks() {
    return manager.jwks();
  }

  // ── Translation ──────────────────────────────────────────────────────────

  static Map<String, String> flatten(MultivaluedMap<String, String> params) {
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

  static Response toResponse(EndpointResponse response) {
    Response.ResponseBuilder builder = Response.status(response.status());
    if (response.body() != null) {
      builder.entity(response.body());
    }
    if (response.contentType() != null) {
      builder.type(response.contentType());
    }
    if (response.location() != null) {
      builder.header(HttpHeaders.LOCATION, response.location());
    }
    for (Cookie cookie : response.cookies()) {
      builder.header(HttpHeaders.SET_COOKIE, cookie.toHeaderValue());
    }
    response.headers().forEach(builder::header);
    return builder.build();
  }
}

package com.codeheadsystems.kastell.server.manager;

import com.codeheadsystems.kastell.model.error.ErrorResponse;
import com.codeheadsystems.kastell.server.cookie.Cookie;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A transport-neutral HTTP response. Adapters copy it onto their framework's response type;
 * a {@code body} that is not a {@link String} is serialized as JSON.
 *
 * @param status      HTTP status
 * @param contentType media type of the body, null when there is none
 * @param body        the body, may be null
 * @param location    {@code Location} header, may be null
 * @param cookies     cookies to set
 * @param headers     extra headers
 */
public record EndpointResponse(int status, String contentType, Object body, String location,
                               List<Cookie> cookies, Map<String, String> headers) {

  public static final String JSON = "application/json";
  public static final String HTML = "text/html;charset=utf-8";

  public EndpointResponse {
    cookies = cookies == null ? List.of() : List.copyOf(cookies);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public static EndpointResponse json(int status, Object body) {
    return new EndpointResponse(status, JSON, body, null, null, null);
  }

  /**
   * A JSON response that must not be cached, as required for responses carrying tokens.
   */
  public static EndpointResponse noStore(int status, Object body) {
    return new EndpointResponse(status, JSON, body, null, null,
        Map.of("Cache-Control", "no-store", "Pragma", "no-cache"));
  }

  public static EndpointResponse html(int status, String body, List<Cookie> cookies) {
    return new EndpointResponse(status, HTML, body, null, cookies, null);
  }

  public static EndpointResponse redirect(String location, List<Cookie> cookies) {
    return new EndpointResponse(303, null, null, location, cookies, null);
  }

  public static EndpointResponse error(int status, String error, String description) {
    return json(status, new ErrorResponse(error, description));
  }

  /**
   * An error response with a {@code WWW-Authenticate} challenge.
   */
  public static EndpointResponse challenge(int status, String scheme, String error,
                                           String description) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("WWW-Authenticate", scheme + " error=\"" + error + "\"");
    return new EndpointResponse(status, JSON, new ErrorResponse(error, description), null, null,
        headers);
  }
}

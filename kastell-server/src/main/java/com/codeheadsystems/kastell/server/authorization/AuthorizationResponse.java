package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.cookie.Cookie;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A finished authorization response, ready for the transport.
 * <p>
 * For {@link ResponseMode#QUERY} and {@link ResponseMode#FRAGMENT} the user agent is redirected
 * to {@code location}; for {@link ResponseMode#FORM_POST} {@code body} is served as HTML.
 *
 * @param sessionId  the grant's session id, null for error responses
 * @param returnUri  the verified redirect URI
 * @param mode       how the parameters are delivered
 * @param parameters the response parameters
 * @param location   redirect target, null for form_post
 * @param body       HTML document, null unless form_post
 * @param cookies    cookies to set
 */
public record AuthorizationResponse(String sessionId, String returnUri, ResponseMode mode,
                                    Map<String, String> parameters, String location, String body,
                                    List<Cookie> cookies) {

  public AuthorizationResponse {
    parameters = Map.copyOf(parameters);
    cookies = cookies == null ? List.of() : List.copyOf(cookies);
  }

  public boolean isRedirect() {
    return location != null;
  }

  public AuthorizationResponse withCookies(List<Cookie> additional) {
    List<Cookie> all = new ArrayList<>(cookies);
    all.addAll(additional);
    return new AuthorizationResponse(sessionId, returnUri, mode, parameters, location, body, all);
  }
}

package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes authorization response parameters into a query, a fragment or an auto-submitting
 * HTML form.
 * <p>
 * Responses carrying only a code (or nothing, for {@code response_type=none}) default to the
 * query; every other response type defaults to the fragment, and asking for the other one is
 * an error.
 */
public class ResponseBuilder {

  private static final Logger log = LoggerFactory.getLogger(ResponseBuilder.class);

  private static final String FORM_POST = """
      <html>
        <head>
          <title>Submit This Form</title>
        </head>
        <body onload="javascript:document.forms[0].submit()">
          <form method="post" action="%s">
              %s
          </form>
        </body>
      </html>""";

  private static final String HIDDEN_INPUT = "<input type=\"hidden\" name=\"%s\" value=\"%s\"/>";

  /**
   * Whether a response type delivers its parameters in the fragment by default.
   *
   * @param responseType the response type set
   * @return false for {@code code} and {@code none}, true otherwise
   */
  public static boolean fragmentByDefault(Set<String> responseType) {
    return !(responseType.equals(Set.of("code")) || responseType.equals(Set.of("none"))
        || responseType.isEmpty());
  }

  /**
   * The mode a response is delivered in.
   *
   * @param responseType  the requested response type set
   * @param requestedMode the {@code response_mode} parameter, may be null
   * @return the mode
   * @throws InvalidRequestException if the mode is unknown or conflicts with the response type
   */
  public ResponseMode resolveMode(Set<String> responseType, String requestedMode) {
    boolean fragment = fragmentByDefault(responseType);
    if (requestedMode == null || requestedMode.isBlank()) {
      return fragment ? ResponseMode.FRAGMENT : ResponseMode.QUERY;
    }
    ResponseMode mode = ResponseMode.fromValue(requestedMode);
    if (mode == ResponseMode.FRAGMENT && !fragment) {
      throw new InvalidRequestException("wrong response_mode: fragment with response_type "
          + String.join(" ", responseType));
    }
    if (mode == ResponseMode.QUERY && fragment) {
      throw new InvalidRequestException("wrong response_mode: query with response_type "
          + String.join(" ", responseType));
    }
    return mode;
  }

  /**
   * Builds the response.
   *
   * @param sessionId  the grant's session id, may be null
   * @param returnUri  the verified redirect URI
   * @param mode       the delivery mode
   * @param parameters response parameters in order
   * @return the response, without cookies
   */
  public AuthorizationResponse build(String sessionId, String returnUri, ResponseMode mode,
                                     Map<String, String> parameters) {
    Map<String, String> params = new LinkedHashMap<>();
    parameters.forEach((k, v) -> {
      if (v != null) {
        params.put(k, v);
      }
    });
    log.debug("build(mode={}, parameters={})", mode.value(), params.keySet());
    return switch (mode) {
      case QUERY -> new AuthorizationResponse(sessionId, returnUri, mode, params,
          Uris.appendQuery(returnUri, params), null, null);
      case FRAGMENT -> new AuthorizationResponse(sessionId, returnUri, mode, params,
          returnUri + "#" + Uris.urlEncode(params), null, null);
      case FORM_POST -> new AuthorizationResponse(sessionId, returnUri, mode, params, null,
          formPost(returnUri, params), null);
    };
  }

  /**
   * The auto-submitting form posting {@code parameters} to {@code action}.
   *
   * @param action     the form action
   * @param parameters one hidden input each
   * @return the HTML document
   */
  public static String formPost(String action, Map<String, String> parameters) {
    StringBuilder inputs = new StringBuilder();
    parameters.forEach((name, value) -> {
      if (inputs.length() > 0) {
        inputs.append('\n');
      }
      inputs.append(String.format(HIDDEN_INPUT, escape(name), escape(value)));
    });
    return String.format(FORM_POST, escape(action), inputs);
  }

  public static String escape(String value) {
    StringBuilder sb = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '&' -> sb.append("&amp;");
        case '<' -> sb.append("&lt;");
        case '>' -> sb.append("&gt;");
        case '"' -> sb.append("&quot;");
        case '\'' -> sb.append("&#39;");
        default -> sb.append(c);
      }
    }
    return sb.toString();
  }
}

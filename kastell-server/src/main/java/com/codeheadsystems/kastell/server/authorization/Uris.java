package com.codeheadsystems.kastell.server.authorization;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Query string and URL helpers.
 */
public final class Uris {

  private Uris() {
  }

  /**
   * Parses {@code a=1&a=2&b=3}. Keys without {@code =} get an empty value.
   *
   * @param query the raw query, may be null
   * @return key to values, in order of appearance
   */
  public static Map<String, List<String>> splitQuery(String query) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    if (query == null || query.isEmpty()) {
      return result;
    }
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = decode(eq < 0 ? pair : pair.substring(0, eq));
      String value = eq < 0 ? "" : decode(pair.substring(eq + 1));
      result.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
    }
    return result;
  }

  /**
   * Everything before the first {@code ?}.
   *
   * @param uri the uri
   * @return the base
   */
  public static String base(String uri) {
    int q = uri.indexOf('?');
    return q < 0 ? uri : uri.substring(0, q);
  }

  /**
   * Everything after the first {@code ?}, null when there is none.
   *
   * @param uri the uri
   * @return the query
   */
  public static String query(String uri) {
    int q = uri.indexOf('?');
    return q < 0 ? null : uri.substring(q + 1);
  }

  /**
   * Form-urlencodes parameters, skipping null values.
   *
   * @param params the parameters
   * @return {@code k=v&k2=v2}
   */
  public static String urlEncode(Map<String, String> params) {
    StringJoiner joiner = new StringJoiner("&");
    params.forEach((key, value) -> {
      if (value != null) {
        joiner.add(encode(key) + "=" + encode(value));
      }
    });
    return joiner.toString();
  }

  /**
   * Adds parameters to a URI's query, keeping what is already there.
   *
   * @param uri    the uri
   * @param params parameters to add
   * @return the new uri
   */
  public static String appendQuery(String uri, Map<String, String> params) {
    String encoded = urlEncode(params);
    if (encoded.isEmpty()) {
      return uri;
    }
    String query = query(uri);
    if (query == null) {
      return uri + "?" + encoded;
    }
    return query.isEmpty() ? uri + encoded : uri + "&" + encoded;
  }

  /**
   * {@code scheme://host[:port]} of an absolute URI.
   *
   * @param uri the uri
   * @return the origin
   * @throws IllegalArgumentException if the uri is not absolute
   */
  public static String origin(String uri) {
    try {
      URI parsed = new URI(uri);
      if (parsed.getScheme() == null || parsed.getHost() == null) {
        throw new IllegalArgumentException("Not an absolute URI: " + uri);
      }
      String origin = parsed.getScheme() + "://" + parsed.getHost();
      return parsed.getPort() < 0 ? origin : origin + ":" + parsed.getPort();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Malformed URI: " + uri, e);
    }
  }

  public static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }

  public static String decode(String value) {
    return URLDecoder.decode(value, StandardCharsets.UTF_8);
  }
}

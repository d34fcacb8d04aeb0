package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import java.util.Arrays;

/**
 * How authorization response parameters travel back to the client.
 */
public enum ResponseMode {

  QUERY("query"),
  FRAGMENT("fragment"),
  FORM_POST("form_post");

  private final String value;

  ResponseMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Resolves a {@code response_mode} parameter.
   *
   * @param value the parameter
   * @return the mode
   * @throws InvalidRequestException if the mode is unknown
   */
  public static ResponseMode fromValue(String value) {
    return Arrays.stream(values())
        .filter(m -> m.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new InvalidRequestException("Unknown response_mode: " + value));
  }
}

package com.codeheadsystems.kastell.server.session;

import java.util.Arrays;

/**
 * The credential kinds a grant can issue.
 * <p>
 * The type tag is the short marker the token codec embeds in every token so that
 * a value can be recognized without a store lookup.
 */
public enum TokenType {

  AUTHORIZATION_CODE("authorization_code", "A"),
  ACCESS_TOKEN("access_token", "T"),
  REFRESH_TOKEN("refresh_token", "R"),
  ID_TOKEN("id_token", "I");

  private final String value;
  private final String typeTag;

  TokenType(String value, String typeTag) {
    this.value = value;
    this.typeTag = typeTag;
  }

  /**
   * Protocol name, e.g. {@code authorization_code}.
   *
   * @return the value
   */
  public String value() {
    return value;
  }

  /**
   * Short tag embedded in encoded tokens.
   *
   * @return the type tag
   */
  public String typeTag() {
    return typeTag;
  }

  /**
   * Resolves a protocol name.
   *
   * @param value the protocol name
   * @return the token type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static TokenType fromValue(String value) {
    return Arrays.stream(values())
        .filter(t -> t.value.equals(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown token type: " + value));
  }

  /**
   * Resolves an embedded type tag.
   *
   * @param typeTag the tag
   * @return the token type
   * @throws IllegalArgumentException if the tag is unknown
   */
  public static TokenType fromTypeTag(String typeTag) {
    return Arrays.stream(values())
        .filter(t -> t.typeTag.equals(typeTag))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown token type tag: " + typeTag));
  }
}

package com.codeheadsystems.kastell.server.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per token-type rules stored on a grant.
 *
 * @param expiresIn       lifetime in seconds of tokens of this type, null for unbounded
 * @param maxUsage        how many times a token of this type may be used, null for unbounded
 * @param supportsMinting token types that may be minted based on a token of this type
 */
public record UsageRules(
    @JsonProperty("expires_in") Long expiresIn,
    @JsonProperty("max_usage") Integer maxUsage,
    @JsonProperty("supports_minting") List<TokenType> supportsMinting) {

  /**
   * No expiry, no usage limit, mints nothing.
   */
  public static final UsageRules NONE = new UsageRules(null, null, List.of());

  public UsageRules {
    supportsMinting = supportsMinting == null ? List.of() : List.copyOf(supportsMinting);
  }

  /**
   * Whether a token governed by these rules may be the base of a token of the given type.
   *
   * @param type the token type to mint
   * @return true if allowed
   */
  public boolean supportsMinting(TokenType type) {
    return supportsMinting.contains(type);
  }

  /**
   * Builds rules from a loosely typed configuration map. {@code expires_in} and
   * {@code max_usage} may be given as strings and are coerced to integers.
   *
   * @param config map with optional keys {@code expires_in}, {@code max_usage}, {@code supports_minting}
   * @return the rules
   * @throws IllegalArgumentException if a value cannot be coerced
   */
  public static UsageRules fromMap(Map<String, ?> config) {
    Long expiresIn = toLong(config.get("expires_in"), "expires_in");
    Long maxUsage = toLong(config.get("max_usage"), "max_usage");
    Object minting = config.get("supports_minting");
    List<TokenType> supports = List.of();
    if (minting instanceof Collection<?> collection) {
      supports = collection.stream().map(o -> TokenType.fromValue(String.valueOf(o))).toList();
    } else if (minting != null) {
      throw new IllegalArgumentException("supports_minting must be a list");
    }
    return new UsageRules(expiresIn, maxUsage == null ? null : maxUsage.intValue(), supports);
  }

  /**
   * Default rules: a single-use five minute code that can mint every other type, ten minute
   * access tokens, day long refresh tokens that can mint access and refresh tokens.
   *
   * @return a fresh mutable map of the default rules
   */
  public static Map<TokenType, UsageRules> defaults() {
    Map<TokenType, UsageRules> rules = new EnumMap<>(TokenType.class);
    rules.put(TokenType.AUTHORIZATION_CODE, new UsageRules(300L, 1,
        List.of(TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN, TokenType.ID_TOKEN)));
    rules.put(TokenType.ACCESS_TOKEN, new UsageRules(600L, null, List.of()));
    rules.put(TokenType.REFRESH_TOKEN, new UsageRules(86400L, null,
        List.of(TokenType.ACCESS_TOKEN, TokenType.REFRESH_TOKEN)));
    rules.put(TokenType.ID_TOKEN, new UsageRules(3600L, null, List.of()));
    return rules;
  }

  private static Long toLong(Object value, String name) {
    if (value == null) {
      return null;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
    }
  }
}

package com.codeheadsystems.kastell.server.claims;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scope to claim-name mapping. Starts from the standard OpenID Connect scopes
 * (Core §5.4) and may be extended with custom scopes.
 */
public class ScopeClaims {

  private static final Map<String, List<String>> STANDARD = standard();

  private final Map<String, List<String>> mapping;

  public ScopeClaims() {
    this(Map.of());
  }

  /**
   * Standard scopes plus custom ones. A custom entry replaces a standard one of the same name.
   *
   * @param custom scope to claim names
   */
  public ScopeClaims(Map<String, List<String>> custom) {
    this.mapping = new LinkedHashMap<>(STANDARD);
    custom.forEach((scope, claims) -> mapping.put(scope, List.copyOf(claims)));
  }

  public List<String> claimsFor(String scope) {
    return mapping.getOrDefault(scope, List.of());
  }

  /**
   * Union of the claims of every given scope, in first-seen order.
   *
   * @param scopes the scopes
   * @return the claim names
   */
  public Set<String> claimsFor(Collection<String> scopes) {
    Set<String> claims = new LinkedHashSet<>();
    scopes.forEach(scope -> claims.addAll(claimsFor(scope)));
    return claims;
  }

  public Set<String> scopes() {
    return mapping.keySet();
  }

  /**
   * Every claim name some scope maps to.
   *
   * @return the claim names
   */
  public Set<String> allClaims() {
    Set<String> claims = new LinkedHashSet<>();
    mapping.values().forEach(claims::addAll);
    return claims;
  }

  private static Map<String, List<String>> standard() {
    Map<String, List<String>> map = new LinkedHashMap<>();
    map.put("openid", List.of("sub"));
    map.put("profile", List.of("name", "given_name", "family_name", "middle_name", "nickname",
        "profile", "picture", "website", "gender", "birthdate", "zoneinfo", "locale",
        "updated_at", "preferred_username"));
    map.put("email", List.of("email", "email_verified"));
    map.put("address", List.of("address"));
    map.put("phone", List.of("phone_number", "phone_number_verified"));
    map.put("offline_access", List.of());
    return Map.copyOf(map);
  }
}

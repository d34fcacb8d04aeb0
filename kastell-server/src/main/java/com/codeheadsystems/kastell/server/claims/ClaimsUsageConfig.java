package com.codeheadsystems.kastell.server.claims;

import com.codeheadsystems.kastell.server.model.ClaimSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How claims are gathered for one usage.
 *
 * @param baseClaims            claims always released for this usage
 * @param enableClaimsPerClient whether the client's registered claims for this usage apply
 * @param addClaimsByScope      whether granted scopes expand into claims
 */
public record ClaimsUsageConfig(Map<String, ClaimSpec> baseClaims, boolean enableClaimsPerClient,
                                boolean addClaimsByScope) {

  /**
   * Nothing released.
   */
  public static final ClaimsUsageConfig NONE = new ClaimsUsageConfig(Map.of(), false, false);

  public ClaimsUsageConfig {
    // base claim specs may be null (unconstrained), so Map.copyOf is not an option
    baseClaims = baseClaims == null ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(baseClaims));
  }
}

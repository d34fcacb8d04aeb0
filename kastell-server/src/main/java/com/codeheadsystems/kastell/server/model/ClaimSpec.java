package com.codeheadsystems.kastell.server.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Restriction on one claim, as found in the {@code claims} request parameter
 * (OpenID Connect Core §5.5.1). A missing spec (null) means "release unconstrained".
 *
 * @param essential whether the client marked the claim essential
 * @param value     the single value the claim must have
 * @param values    the allowed values
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimSpec(
    @JsonProperty("essential") Boolean essential,
    @JsonProperty("value") Object value,
    @JsonProperty("values") List<Object> values) {

  public static ClaimSpec essentialClaim() {
    return new ClaimSpec(true, null, null);
  }

  public static ClaimSpec value(Object value) {
    return new ClaimSpec(null, value, null);
  }

  public static ClaimSpec values(List<Object> values) {
    return new ClaimSpec(null, null, values);
  }
}

package com.codeheadsystems.kastell.model.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth2 error response body (RFC 6749 §5.2).
 *
 * @param error            the error code, e.g. {@code invalid_request}
 * @param errorDescription human readable detail, optional
 * @param state            the client state echoed back on authorization errors, optional
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("error_description") String errorDescription,
    @JsonProperty("state") String state) {

  public ErrorResponse(String error, String errorDescription) {
    this(error, errorDescription, null);
  }
}

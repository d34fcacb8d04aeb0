package com.codeheadsystems.kastell.model.discovery;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * The provider's public signing keys.
 * <p>
 * Used by: {@code GET /jwks} response
 *
 * @param keys the keys
 */
public record JsonWebKeySet(@JsonProperty("keys") List<JsonWebKey> keys) {
}

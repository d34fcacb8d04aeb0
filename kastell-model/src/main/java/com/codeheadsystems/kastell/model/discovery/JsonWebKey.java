package com.codeheadsystems.kastell.model.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public JSON Web Key (RFC 7517). Only the members needed for RSA and EC signing keys.
 *
 * @param kty key type, {@code RSA} or {@code EC}
 * @param kid key id
 * @param use always {@code sig}
 * @param alg JWS algorithm the key is used with
 * @param n   RSA modulus, base64url
 * @param e   RSA public exponent, base64url
 * @param crv EC curve name
 * @param x   EC x coordinate, base64url
 * @param y   EC y coordinate, base64url
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonWebKey(
    @JsonProperty("kty") String kty,
    @JsonProperty("kid") String kid,
    @JsonProperty("use") String use,
    @JsonProperty("alg") String alg,
    @JsonProperty("n") String n,
    @JsonProperty("e") String e,
    @JsonProperty("crv") String crv,
    @JsonProperty("x") String x,
    @JsonProperty("y") String y) {
}

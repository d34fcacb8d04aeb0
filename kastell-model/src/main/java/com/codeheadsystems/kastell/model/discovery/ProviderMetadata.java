package com.codeheadsystems.kastell.model.discovery;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * OpenID Provider metadata (OpenID Connect Discovery 1.0 §3).
 * <p>
 * Used by: {@code GET /.well-known/openid-configuration} response
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ProviderMetadata(
    @JsonProperty("issuer") String issuer,
    @JsonProperty("authorization_endpoint") String authorizationEndpoint,
    @JsonProperty("token_endpoint") String tokenEndpoint,
    @JsonProperty("userinfo_endpoint") String userinfoEndpoint,
    @JsonProperty("jwks_uri") String jwksUri,
    @JsonProperty("end_session_endpoint") String endSessionEndpoint,
    @JsonProperty("pushed_authorization_request_endpoint") String pushedAuthorizationRequestEndpoint,
    @JsonProperty("introspection_endpoint") String introspectionEndpoint,
    @JsonProperty("check_session_iframe") String checkSessionIframe,
    @JsonProperty("scopes_supported") List<String> scopesSupported,
    @JsonProperty("response_types_supported") List<String> responseTypesSupported,
    @JsonProperty("response_modes_supported") List<String> responseModesSupported,
    @JsonProperty("grant_types_supported") List<String> grantTypesSupported,
    @JsonProperty("subject_types_supported") List<String> subjectTypesSupported,
    @JsonProperty("id_token_signing_alg_values_supported") List<String> idTokenSigningAlgValuesSupported,
    @JsonProperty("request_object_signing_alg_values_supported") List<String> requestObjectSigningAlgValuesSupported,
    @JsonProperty("token_endpoint_auth_methods_supported") List<String> tokenEndpointAuthMethodsSupported,
    @JsonProperty("claims_supported") List<String> claimsSupported,
    @JsonProperty("claims_parameter_supported") boolean claimsParameterSupported,
    @JsonProperty("request_parameter_supported") boolean requestParameterSupported,
    @JsonProperty("request_uri_parameter_supported") boolean requestUriParameterSupported,
    @JsonProperty("frontchannel_logout_supported") boolean frontchannelLogoutSupported,
    @JsonProperty("frontchannel_logout_session_supported") boolean frontchannelLogoutSessionSupported,
    @JsonProperty("backchannel_logout_supported") boolean backchannelLogoutSupported,
    @JsonProperty("backchannel_logout_session_supported") boolean backchannelLogoutSessionSupported) {
}

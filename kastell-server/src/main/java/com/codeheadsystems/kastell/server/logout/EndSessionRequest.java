package com.codeheadsystems.kastell.server.logout;

import java.util.Map;

/**
 * An RP-initiated logout request.
 *
 * @param idTokenHint           a previously issued ID token, may be null
 * @param postLogoutRedirectUri where to send the user afterwards, may be null
 * @param state                 passed back on the post-logout redirect, may be null
 */
public record EndSessionRequest(String idTokenHint, String postLogoutRedirectUri, String state) {

  public static EndSessionRequest from(Map<String, String> params) {
    return new EndSessionRequest(params.get("id_token_hint"),
        params.get("post_logout_redirect_uri"), params.get("state"));
  }
}

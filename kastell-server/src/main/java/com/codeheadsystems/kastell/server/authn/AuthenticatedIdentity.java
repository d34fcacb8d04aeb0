package com.codeheadsystems.kastell.server.authn;

import java.time.Instant;

/**
 * Who an authentication method says the user agent belongs to.
 *
 * @param uid      the user id
 * @param sid      the session id remembered in the session cookie, may be null
 * @param state    the state of the request the user logged in with, may be null
 * @param authTime when the user authenticated
 */
public record AuthenticatedIdentity(String uid, String sid, String state, Instant authTime) {
}

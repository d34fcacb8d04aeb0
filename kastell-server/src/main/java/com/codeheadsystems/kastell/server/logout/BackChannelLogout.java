package com.codeheadsystems.kastell.server.logout;

/**
 * A queued back-channel notification.
 *
 * @param uri         the client's backchannel_logout_uri
 * @param logoutToken the signed logout token to POST
 */
public record BackChannelLogout(String uri, String logoutToken) {
}

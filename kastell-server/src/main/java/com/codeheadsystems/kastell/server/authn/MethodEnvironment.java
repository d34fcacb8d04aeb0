package com.codeheadsystems.kastell.server.authn;

import com.codeheadsystems.kastell.server.cookie.CookieDealer;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;

/**
 * What authentication methods get from the provider when they are created.
 *
 * @param cookieDealer reads the session cookie
 * @param cookieName   name of the session cookie
 * @param objectMapper parses cookie payloads
 * @param clock        time source
 */
public record MethodEnvironment(CookieDealer cookieDealer, String cookieName,
                                ObjectMapper objectMapper, Clock clock) {
}

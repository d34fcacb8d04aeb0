package com.codeheadsystems.kastell.server.config;

import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.cookie.CookieDealer;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.token.KeyMaterial;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;

/**
 * What every protocol component shares. Built once by {@code OidcProvider}.
 *
 * @param settings       provider settings
 * @param sessionManager the session tree
 * @param clients        registered clients
 * @param keyMaterial    signing keys and secrets
 * @param cookieDealer   signs and reads cookies
 * @param objectMapper   JSON for cookie payloads and request parameters
 * @param clock          time source
 */
public record ProviderContext(ProviderSettings settings, SessionManager sessionManager,
                              ClientRegistry clients, KeyMaterial keyMaterial,
                              CookieDealer cookieDealer, ObjectMapper objectMapper, Clock clock) {
}

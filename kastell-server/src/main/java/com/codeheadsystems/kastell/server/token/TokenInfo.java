package com.codeheadsystems.kastell.server.token;

import com.codeheadsystems.kastell.server.session.TokenType;
import java.time.Instant;

/**
 * What a token codec recovers from a token value.
 *
 * @param sessionId the session id the token was minted under
 * @param type      the embedded token type
 * @param issuedAt  when the token was minted
 * @param expiresAt when the token expires, null for never
 * @param jti       the unique token id
 */
public record TokenInfo(String sessionId, TokenType type, Instant issuedAt, Instant expiresAt,
                        String jti) {
}

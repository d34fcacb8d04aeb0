package com.codeheadsystems.kastell.server.endpoint;

import com.codeheadsystems.kastell.server.authorization.Uris;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.exception.InvalidClientException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates clients at the token and PAR endpoints with {@code client_secret_basic} or
 * {@code client_secret_post}. Clients registered without a secret are public and are
 * identified by {@code client_id} alone.
 */
public class ClientAuthenticator {

  private static final Logger log = LoggerFactory.getLogger(ClientAuthenticator.class);
  private static final String BASIC_PREFIX = "Basic ";

  private final ClientRegistry clients;

  public ClientAuthenticator(ClientRegistry clients) {
    this.clients = clients;
  }

  /**
   * Authenticates the client of a request.
   *
   * @param authorizationHeader the {@code Authorization} header, may be null
   * @param params              the form parameters
   * @return the authenticated client
   * @throws InvalidClientException if the client is unknown or its credentials are wrong
   */
  public ClientInfo authenticate(String authorizationHeader, Map<String, String> params) {
    String clientId;
    String secret;
    if (authorizationHeader != null && authorizationHeader.startsWith(BASIC_PREFIX)) {
      String decoded;
      try {
        decoded = new String(Base64.getDecoder().decode(
            authorizationHeader.substring(BASIC_PREFIX.length()).trim()), StandardCharsets.UTF_8);
      } catch (IllegalArgumentException e) {
        throw new InvalidClientException("Malformed basic credentials");
      }
      int colon = decoded.indexOf(':');
      if (colon < 0) {
        throw new InvalidClientException("Malformed basic credentials");
      }
      clientId = Uris.decode(decoded.substring(0, colon));
      secret = Uris.decode(decoded.substring(colon + 1));
    } else {
      clientId = params.get("client_id");
      secret = params.get("client_secret");
    }
    if (clientId == null || clientId.isBlank()) {
      throw new InvalidClientException("No client credentials");
    }
    String paramClientId = params.get("client_id");
    if (paramClientId != null && !paramClientId.equals(clientId)) {
      throw new InvalidClientException("client_id does not match the credentials");
    }
    ClientInfo client = clients.get(clientId)
        .orElseThrow(() -> new InvalidClientException("Unknown client"));
    if (client.clientSecret() == null) {
      return client;
    }
    if (secret == null || !Arrays.constantTimeAreEqual(
        client.clientSecret().getBytes(StandardCharsets.UTF_8),
        secret.getBytes(StandardCharsets.UTF_8))) {
      log.warn("Client {} failed authentication", clientId);
      throw new InvalidClientException("Client authentication failed");
    }
    return client;
  }
}

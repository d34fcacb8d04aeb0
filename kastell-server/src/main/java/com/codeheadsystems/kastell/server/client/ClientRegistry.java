package com.codeheadsystems.kastell.server.client;

import java.util.Optional;

/**
 * Read access to registered client metadata. How clients get registered is up to the host.
 */
public interface ClientRegistry {

  /**
   * Looks up a client.
   *
   * @param clientId the client id
   * @return the metadata, or empty if the client is unknown
   */
  Optional<ClientInfo> get(String clientId);
}

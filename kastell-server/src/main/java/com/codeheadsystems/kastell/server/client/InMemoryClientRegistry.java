package com.codeheadsystems.kastell.server.client;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ClientRegistry} over a {@link ConcurrentHashMap}, filled from configuration.
 */
public class InMemoryClientRegistry implements ClientRegistry {

  private static final Logger log = LoggerFactory.getLogger(InMemoryClientRegistry.class);

  private final ConcurrentHashMap<String, ClientInfo> clients = new ConcurrentHashMap<>();

  public InMemoryClientRegistry() {
  }

  public InMemoryClientRegistry(Collection<ClientInfo> initial) {
    initial.forEach(this::register);
  }

  public void register(ClientInfo client) {
    clients.put(client.clientId(), client);
    log.info("Registered client {}", client.clientId());
  }

  public void remove(String clientId) {
    clients.remove(clientId);
  }

  @Override
  public Optional<ClientInfo> get(String clientId) {
    if (clientId == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(clients.get(clientId));
  }

  public int size() {
    return clients.size();
  }
}

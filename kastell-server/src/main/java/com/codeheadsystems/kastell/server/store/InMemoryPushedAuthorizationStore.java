package com.codeheadsystems.kastell.server.store;

import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory {@link PushedAuthorizationStore}. Expired entries are evicted lazily whenever a
 * new request is stored.
 */
public class InMemoryPushedAuthorizationStore implements PushedAuthorizationStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPushedAuthorizationStore.class);

  /**
   * Upper bound on outstanding pushed requests.
   */
  private static final int MAX_PENDING_REQUESTS = 10_000;

  private final ConcurrentHashMap<String, PendingRequest> pending = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryPushedAuthorizationStore() {
    this(Clock.systemUTC());
  }

  /**
   * @param clock judges expiry when full stores are evicted
   */
  public InMemoryPushedAuthorizationStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public void store(String requestUri, AuthorizationRequest request, Instant expiresAt) {
    if (pending.size() >= MAX_PENDING_REQUESTS) {
      Instant now = clock.instant();
      pending.entrySet().removeIf(e -> !now.isBefore(e.getValue().expiresAt()));
      if (pending.size() >= MAX_PENDING_REQUESTS) {
        throw new IllegalStateException("Too many pending pushed authorization requests");
      }
    }
    pending.put(requestUri, new PendingRequest(request, expiresAt));
    log.debug("Stored pushed request {}", requestUri);
  }

  @Override
  public Optional<AuthorizationRequest> take(String requestUri, Instant now) {
    PendingRequest entry = pending.remove(requestUri);
    if (entry == null) {
      return Optional.empty();
    }
    if (!now.isBefore(entry.expiresAt())) {
      log.debug("Pushed request {} expired", requestUri);
      return Optional.empty();
    }
    return Optional.of(entry.request());
  }

  private record PendingRequest(AuthorizationRequest request, Instant expiresAt) {
  }
}

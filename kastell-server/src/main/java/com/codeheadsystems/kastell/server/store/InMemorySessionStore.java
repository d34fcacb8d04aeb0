package com.codeheadsystems.kastell.server.store;

import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionRecord;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * All sessions are lost on server restart. Suitable for development and integration
 * testing only.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  private final ConcurrentHashMap<SessionKey, SessionRecord> store = new ConcurrentHashMap<>();

  public InMemorySessionStore() {
    log.warn("Using InMemorySessionStore: sessions and grants will NOT survive restarts. "
        + "Replace with a persistent SessionStore for production.");
  }

  @Override
  public Optional<SessionRecord> get(SessionKey key) {
    return Optional.ofNullable(store.get(key));
  }

  @Override
  public void put(SessionKey key, SessionRecord record) {
    store.put(key, record);
    log.trace("Stored {} at depth {}", record.getClass().getSimpleName(), key.depth());
  }

  @Override
  public int size() {
    return store.size();
  }
}

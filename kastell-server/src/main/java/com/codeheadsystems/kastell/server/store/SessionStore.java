package com.codeheadsystems.kastell.server.store;

import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionRecord;
import java.util.Optional;

/**
 * Storage abstraction for the session tree.
 * <p>
 * Keys of depth 1 hold a {@code UserSession}, depth 2 a {@code ClientSession}, depth 3 a
 * {@code Grant}. Implementations must be thread-safe; the {@code SessionManager} serializes
 * mutations of one user+client pair, so implementations need no cross-key transactions.
 * <p>
 * A {@link #put} that throws must leave the previously stored value in place: the session
 * manager treats the failure as "nothing was written".
 */
public interface SessionStore {

  /**
   * Loads the record stored under a key.
   *
   * @param key the session key
   * @return the record, or empty if none is stored
   */
  Optional<SessionRecord> get(SessionKey key);

  /**
   * Stores (or replaces) the record under a key.
   *
   * @param key    the session key
   * @param record the record
   */
  void put(SessionKey key, SessionRecord record);

  /**
   * Number of stored records.
   *
   * @return the size
   */
  int size();
}

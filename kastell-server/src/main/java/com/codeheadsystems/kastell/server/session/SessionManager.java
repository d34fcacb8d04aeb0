package com.codeheadsystems.kastell.server.session;

import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import com.codeheadsystems.kastell.server.store.SessionStore;
import com.codeheadsystems.kastell.server.token.TokenHandler;
import com.codeheadsystems.kastell.server.token.TokenInfo;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the user → client → grant session tree and every read or write of it.
 * <p>
 * Mutations of one user's tree are serialized with lock striping keyed by the user id, so
 * two requests racing on the same session never lose a write. Different users never contend
 * beyond a shared stripe.
 * <p>
 * <strong>Exception contract</strong>:
 * <ul>
 *   <li>{@link IllegalArgumentException}: malformed session id, or no record at the path</li>
 *   <li>{@link UnknownTokenException}: a token value that resolves to no grant or token</li>
 * </ul>
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

  private static final int LOCK_STRIPES = 64;

  private final SessionStore store;
  private final TokenHandler tokenHandler;
  private final SubjectIdentifiers subjectIdentifiers;
  private final Map<TokenType, UsageRules> defaultUsageRules;
  private final Clock clock;
  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

  /**
   * Instantiates a new Session manager.
   *
   * @param store              where the session tree lives
   * @param tokenHandler       codecs used to resolve token values
   * @param subjectIdentifiers derives the sub of new client sessions
   * @param defaultUsageRules  usage rules every new grant starts with
   * @param clock              time source
   */
  public SessionManager(SessionStore store, TokenHandler tokenHandler,
                        SubjectIdentifiers subjectIdentifiers,
                        Map<TokenType, UsageRules> defaultUsageRules, Clock clock) {
    this.store = store;
    this.tokenHandler = tokenHandler;
    this.subjectIdentifiers = subjectIdentifiers;
    this.defaultUsageRules = Map.copyOf(defaultUsageRules);
    this.clock = clock;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  public TokenHandler tokenHandler() {
    return tokenHandler;
  }

  public Instant now() {
    return clock.instant();
  }

  // ── Creation ─────────────────────────────────────────────────────────────

  /**
   * Creates (or extends) the session tree for a freshly authenticated user and adds a new
   * grant for the client.
   *
   * @param authenticationEvent the authentication
   * @param request             the authorization request being answered
   * @param userId              the local user id
   * @param clientId            the client
   * @param subjectType         {@code public} or {@code pairwise}
   * @param sectorIdentifier    sector for pairwise subjects, may be null
   * @return the session id of the new grant
   */
  public String createSession(AuthenticationEvent authenticationEvent, AuthorizationRequest request,
                              String userId, String clientId, String subjectType,
                              String sectorIdentifier) {
    log.debug("createSession(clientId={})", clientId);
    SessionKey clientKey = SessionKey.of(userId, clientId);
    return withLock(clientKey, () -> {
      UserSession userSession = find(clientKey.userKey(), UserSession.class)
          .orElseGet(() -> new UserSession(userId));
      userSession.addClient(clientId);

      ClientSession clientSession = find(clientKey, ClientSession.class)
          .filter(cs -> !cs.isRevoked())
          .orElseGet(() -> new ClientSession(clientId,
              subjectIdentifiers.sub(userId, subjectType, sectorIdentifier)));

      Grant grant = new Grant(request, authenticationEvent, defaultUsageRules, now());
      SessionKey grantKey = clientKey.withGrant(grant.id());
      clientSession.addGrant(grant.id());

      store.put(grantKey, grant);
      store.put(clientKey, clientSession);
      store.put(clientKey.userKey(), userSession);
      log.info("Created session for client {} (grant {})", clientId, grant.id());
      return grantKey.serialize();
    });
  }

  /**
   * Adds a new grant under an existing, unrevoked client session.
   *
   * @param sessionId           any session id of the user+client pair
   * @param authenticationEvent the authentication the grant is bound to
   * @param request             the authorization request being answered
   * @return the session id of the new grant
   */
  public String createGrant(String sessionId, AuthenticationEvent authenticationEvent,
                            AuthorizationRequest request) {
    SessionKey clientKey = SessionKey.parse(sessionId).clientKey();
    return withLock(clientKey, () -> {
      ClientSession clientSession = require(clientKey, ClientSession.class);
      if (clientSession.isRevoked()) {
        throw new IllegalArgumentException("Client session is revoked");
      }
      Grant grant = new Grant(request, authenticationEvent, defaultUsageRules, now());
      SessionKey grantKey = clientKey.withGrant(grant.id());
      clientSession.addGrant(grant.id());
      store.put(grantKey, grant);
      store.put(clientKey, clientSession);
      log.debug("Created grant {} for client {}", grant.id(), clientKey.clientId());
      return grantKey.serialize();
    });
  }

  /**
   * Adds a token exchange grant under the client session of an existing grant. It inherits
   * that grant's authentication and may only mint access tokens.
   *
   * @param sessionId a session id of depth 3 naming the grant the user authorized
   * @param scope     scope the exchanged tokens carry at most
   * @param resources targets the exchanged tokens are meant for
   * @param users     clients allowed to exchange
   * @param expiresAt when the exchange grant ends, null for never
   * @return the session id of the exchange grant
   */
  public String createExchangeGrant(String sessionId, List<String> scope, List<String> resources,
                                    List<String> users, Instant expiresAt) {
    SessionKey key = requireGrantKey(sessionId);
    SessionKey clientKey = key.clientKey();
    return withLock(clientKey, () -> {
      ClientSession clientSession = require(clientKey, ClientSession.class);
      if (clientSession.isRevoked()) {
        throw new IllegalArgumentException("Client session is revoked");
      }
      Map<TokenType, UsageRules> rules = new EnumMap<>(TokenType.class);
      UsageRules accessRules = defaultUsageRules.getOrDefault(TokenType.ACCESS_TOKEN,
          UsageRules.NONE);
      rules.put(TokenType.ACCESS_TOKEN, new UsageRules(accessRules.expiresIn(),
          accessRules.maxUsage(), List.of()));
      ExchangeGrant grant = new ExchangeGrant(getGrant(key).authenticationEvent(), scope,
          resources, users, rules, now());
      grant.setExpiresAt(expiresAt);
      SessionKey grantKey = clientKey.withGrant(grant.id());
      clientSession.addGrant(grant.id());
      store.put(grantKey, grant);
      store.put(clientKey, clientSession);
      log.info("Created exchange grant {} for client {} (users={})", grant.id(),
          clientKey.clientId(), users);
      return grantKey.serialize();
    });
  }

  // ── Generic path access ──────────────────────────────────────────────────

  /**
   * Reads the record at a one to three element path.
   *
   * @param path user id, optionally client id, optionally grant id
   * @return the record
   * @throws IllegalArgumentException if nothing is stored at the path
   */
  public SessionRecord get(List<String> path) {
    SessionKey key = SessionKey.fromPath(path);
    return store.get(key).orElseThrow(() -> new IllegalArgumentException("No session at " + path));
  }

  /**
   * Writes the record at a one to three element path.
   *
   * @param path   user id, optionally client id, optionally grant id
   * @param record a record matching the path depth
   */
  public void set(List<String> path, SessionRecord record) {
    SessionKey key = SessionKey.fromPath(path);
    Class<? extends SessionRecord> expected = switch (key.depth()) {
      case 1 -> UserSession.class;
      case 2 -> ClientSession.class;
      default -> Grant.class;
    };
    if (!expected.isInstance(record)) {
      throw new IllegalArgumentException("A path of depth " + key.depth() + " holds a "
          + expected.getSimpleName());
    }
    withLock(key, () -> {
      store.put(key, record);
      return null;
    });
  }

  public UserSession getUserSession(String sessionId) {
    return require(SessionKey.parse(sessionId).userKey(), UserSession.class);
  }

  public ClientSession getClientSession(String sessionId) {
    return require(SessionKey.parse(sessionId).clientKey(), ClientSession.class);
  }

  public Grant getGrant(String sessionId) {
    return getGrant(requireGrantKey(sessionId));
  }

  public AuthenticationEvent getAuthenticationEvent(String sessionId) {
    return getGrant(sessionId).authenticationEvent();
  }

  /**
   * The nodes along a session id.
   *
   * @param sessionId  a session id of depth 3
   * @param userInfo   include the user session
   * @param clientInfo include the client session
   * @param grant      include the grant
   * @return the info, unrequested parts null
   */
  public SessionInfo getSessionInfo(String sessionId, boolean userInfo, boolean clientInfo,
                                    boolean grant) {
    SessionKey key = requireGrantKey(sessionId);
    return new SessionInfo(sessionId, key,
        userInfo ? require(key.userKey(), UserSession.class) : null,
        clientInfo ? require(key.clientKey(), ClientSession.class) : null,
        grant ? getGrant(key) : null,
        null);
  }

  /**
   * Resolves a token value to its session, grant and token.
   *
   * @param tokenValue any token value minted by this provider
   * @return the full session info including the token
   * @throws UnknownTokenException if the value does not resolve
   */
  public SessionInfo getSessionInfoByToken(String tokenValue) {
    TokenInfo info = tokenHandler.info(tokenValue);
    SessionKey key;
    try {
      key = requireGrantKey(info.sessionId());
    } catch (IllegalArgumentException e) {
      throw new UnknownTokenException("Token carries no usable session id", e);
    }
    Grant grant = find(key, Grant.class)
        .orElseThrow(() -> new UnknownTokenException("No grant for token"));
    Token token = grant.findToken(tokenValue)
        .orElseThrow(() -> new UnknownTokenException("Token not issued under its grant"));
    return new SessionInfo(info.sessionId(), key,
        find(key.userKey(), UserSession.class).orElse(null),
        find(key.clientKey(), ClientSession.class).orElse(null),
        grant, token);
  }

  /**
   * Finds a token of a grant by value.
   *
   * @param sessionId  the grant's session id
   * @param tokenValue the value
   * @return the token
   * @throws UnknownTokenException if the grant holds no such token
   */
  public Token findToken(String sessionId, String tokenValue) {
    return getGrant(sessionId).findToken(tokenValue)
        .orElseThrow(() -> new UnknownTokenException("Unknown token"));
  }

  /**
   * Every grant of the session's user+client pair, oldest first.
   *
   * @param sessionId a session id of depth 2 or 3
   * @return the grants
   */
  public List<Grant> grants(String sessionId) {
    SessionKey clientKey = SessionKey.parse(sessionId).clientKey();
    ClientSession clientSession = require(clientKey, ClientSession.class);
    List<Grant> grants = new ArrayList<>();
    for (String grantId : clientSession.grantIds()) {
      find(clientKey.withGrant(grantId), Grant.class).ifPresent(grants::add);
    }
    return grants;
  }

  // ── Revocation ───────────────────────────────────────────────────────────

  /**
   * Revokes a client session together with all of its grants and their tokens.
   *
   * @param sessionId a session id of depth 2 or 3
   */
  public void revokeClientSession(String sessionId) {
    SessionKey clientKey = SessionKey.parse(sessionId).clientKey();
    withLock(clientKey, () -> {
      ClientSession clientSession = require(clientKey, ClientSession.class);
      clientSession.revoke();
      for (String grantId : clientSession.grantIds()) {
        SessionKey grantKey = clientKey.withGrant(grantId);
        find(grantKey, Grant.class).ifPresent(grant -> {
          grant.revoke();
          store.put(grantKey, grant);
        });
      }
      store.put(clientKey, clientSession);
      return null;
    });
    log.info("Revoked client session for client {}", clientKey.clientId());
  }

  /**
   * Revokes a grant and every token issued under it.
   *
   * @param sessionId the grant's session id
   */
  public void revokeGrant(String sessionId) {
    SessionKey key = requireGrantKey(sessionId);
    withLock(key, () -> {
      Grant grant = getGrant(key);
      grant.revoke();
      store.put(key, grant);
      return null;
    });
    log.debug("Revoked grant {}", key.grantId());
  }

  /**
   * Revokes one token. Its base token and tokens minted from it stay as they are.
   *
   * @param sessionId  the grant's session id
   * @param tokenValue the token value
   */
  public void revokeToken(String sessionId, String tokenValue) {
    SessionKey key = requireGrantKey(sessionId);
    withLock(key, () -> {
      Grant grant = getGrant(key);
      Token token = grant.findToken(tokenValue)
          .orElseThrow(() -> new UnknownTokenException("Unknown token"));
      token.revoke();
      store.put(key, grant);
      return null;
    });
  }

  // ── Internals shared with TokenEngine ────────────────────────────────────

  /**
   * Runs an action holding the lock of the key's user.
   *
   * @param key    any key of the user
   * @param action the action
   * @param <T>    result type
   * @return the action's result
   */
  public <T> T withLock(SessionKey key, Supplier<T> action) {
    ReentrantLock lock = locks[Math.floorMod(key.userId().hashCode(), LOCK_STRIPES)];
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }

  Grant getGrant(SessionKey key) {
    return require(key, Grant.class);
  }

  void persist(SessionKey key, SessionRecord record) {
    store.put(key, record);
  }

  static SessionKey requireGrantKey(String sessionId) {
    SessionKey key = SessionKey.parse(sessionId);
    if (key.depth() != 3) {
      throw new IllegalArgumentException("Session id does not name a grant");
    }
    return key;
  }

  private <T extends SessionRecord> Optional<T> find(SessionKey key, Class<T> type) {
    return store.get(key).filter(type::isInstance).map(type::cast);
  }

  private <T extends SessionRecord> T require(SessionKey key, Class<T> type) {
    return find(key, type).orElseThrow(() ->
        new IllegalArgumentException("No " + type.getSimpleName() + " for session"));
  }
}

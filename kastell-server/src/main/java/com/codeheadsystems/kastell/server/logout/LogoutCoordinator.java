package com.codeheadsystems.kastell.server.logout;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTCreator;
import com.codeheadsystems.kastell.server.authorization.Uris;
import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.config.ProviderSettings;
import com.codeheadsystems.kastell.server.session.ClientSession;
import com.codeheadsystems.kastell.server.session.Grant;
import com.codeheadsystems.kastell.server.session.SessionKey;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.UserSession;
import com.codeheadsystems.kastell.server.token.IdTokenCodec;
import com.codeheadsystems.kastell.server.token.KeyMaterial;
import com.codeheadsystems.kastell.server.token.SidCipher;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tears down client sessions and builds the front- and back-channel notifications that tell
 * relying parties about it.
 * <p>
 * A client registered for both channels is notified through the back channel. Client
 * sessions are revoked whether or not a notification can be built or delivered.
 */
public class LogoutCoordinator {

  private static final Logger log = LoggerFactory.getLogger(LogoutCoordinator.class);

  /**
   * The {@code events} member identifying a back-channel logout token.
   */
  public static final String BACK_CHANNEL_LOGOUT_EVENT =
      "http://schemas.openid.net/event/backchannel-logout";

  private final SessionManager sessionManager;
  private final ClientRegistry clients;
  private final ProviderSettings settings;
  private final KeyMaterial keyMaterial;
  private final IdTokenCodec idTokenCodec;
  private final SidCipher sidCipher;
  private final BackChannelNotifier notifier;
  private final Clock clock;

  public LogoutCoordinator(SessionManager sessionManager, ClientRegistry clients,
                           ProviderSettings settings, KeyMaterial keyMaterial,
                           IdTokenCodec idTokenCodec, SidCipher sidCipher,
                           BackChannelNotifier notifier, Clock clock) {
    this.sessionManager = sessionManager;
    this.clients = clients;
    this.settings = settings;
    this.keyMaterial = keyMaterial;
    this.idTokenCodec = idTokenCodec;
    this.sidCipher = sidCipher;
    this.notifier = notifier;
    this.clock = clock;
  }

  /**
   * Logs the user out of the client the session id belongs to.
   *
   * @param sessionId a session id naming a client session or one of its grants
   * @return the notification for that client, if it registered a logout URI
   */
  public LogoutResult logoutFromClient(String sessionId) {
    SessionKey clientKey = SessionKey.parse(sessionId).clientKey();
    ClientSession clientSession = sessionManager.getClientSession(sessionId);
    Map<String, BackChannelLogout> blu = new LinkedHashMap<>();
    Map<String, String> flu = new LinkedHashMap<>();
    sessionManager.revokeClientSession(sessionId);
    notification(clientKey.clientId(), clientSession.sub(), sessionId, blu, flu);
    log.info("Logged user out of client {}", clientKey.clientId());
    return new LogoutResult(blu, flu);
  }

  /**
   * Logs the user out of every client they have a session with.
   *
   * @param sessionId any session id of the user
   * @return the notifications, partitioned by channel
   */
  public LogoutResult logoutAllClients(String sessionId) {
    UserSession userSession = sessionManager.getUserSession(sessionId);
    Map<String, BackChannelLogout> blu = new LinkedHashMap<>();
    Map<String, String> flu = new LinkedHashMap<>();
    for (String clientId : userSession.clientIds()) {
      SessionKey clientKey = SessionKey.of(userSession.userId(), clientId);
      ClientSession clientSession;
      try {
        clientSession = sessionManager.getClientSession(clientKey.serialize());
      } catch (IllegalArgumentException e) {
        log.debug("No client session for {}: {}", clientId, e.getMessage());
        continue;
      }
      boolean wasRevoked = clientSession.isRevoked();
      String notifiedSessionId = notificationSessionId(clientKey);
      sessionManager.revokeClientSession(clientKey.serialize());
      if (!wasRevoked) {
        notification(clientId, clientSession.sub(), notifiedSessionId, blu, flu);
      }
    }
    log.info("Logged user out of {} client(s)", userSession.clientIds().size());
    return new LogoutResult(blu, flu);
  }

  /**
   * Performs a confirmed logout: revokes the session(s), delivers the back-channel
   * notifications and hands back the front-channel iframes.
   *
   * @param sessionId the session being logged out
   * @param all       log out of every client instead of just the session's own
   * @return the iframes the caller should render
   */
  public List<String> doVerifiedLogout(String sessionId, boolean all) {
    LogoutResult result = all ? logoutAllClients(sessionId) : logoutFromClient(sessionId);
    result.blu().forEach(notifier::deliver);
    return new ArrayList<>(result.flu().values());
  }

  // ── Notifications ────────────────────────────────────────────────────────

  /**
   * Builds the back-channel notification for a client.
   *
   * @param client    the client
   * @param sub       the user's subject at that client
   * @param sessionId the session id carried, encrypted, in {@code sid}
   * @return the notification, empty if the client registered no backchannel_logout_uri
   */
  public Optional<BackChannelLogout> backChannelLogout(ClientInfo client, String sub,
                                                       String sessionId) {
    if (client.backchannelLogoutUri() == null) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    String alg = idTokenCodec.algorithmFor(client.clientId());
    JWTCreator.Builder builder = JWT.create()
        .withIssuer(settings.issuer())
        .withSubject(sub)
        .withAudience(client.clientId())
        .withIssuedAt(now)
        .withExpiresAt(now.plus(settings.logoutTokenLifetime()))
        .withJWTId(UUID.randomUUID().toString())
        .withClaim("events", Map.of(BACK_CHANNEL_LOGOUT_EVENT, Map.of()))
        .withClaim("sid", sidCipher.encrypt(sessionId));
    keyMaterial.keyId(alg).ifPresent(builder::withKeyId);
    String token = builder.sign(keyMaterial.signingAlgorithm(alg));
    return Optional.of(new BackChannelLogout(client.backchannelLogoutUri(), token));
  }

  /**
   * Builds the front-channel iframe for a client. When the client requires session
   * information, {@code iss} and {@code sid} are merged into the registered URI's query.
   *
   * @param client    the client
   * @param issuer    the issuer
   * @param sessionId the session id carried, encrypted, in {@code sid}
   * @return the iframe, empty if the client registered no frontchannel_logout_uri
   */
  public Optional<String> frontChannelIframe(ClientInfo client, String issuer, String sessionId) {
    String uri = client.frontchannelLogoutUri();
    if (uri == null) {
      return Optional.empty();
    }
    if (!client.frontchannelLogoutSessionRequired()) {
      return Optional.of("<iframe src=\"" + uri + "\">");
    }
    Map<String, List<String>> query = Uris.splitQuery(Uris.query(uri));
    query.put("iss", List.of(issuer));
    query.put("sid", List.of(sidCipher.encrypt(sessionId)));
    StringBuilder sb = new StringBuilder();
    query.forEach((name, values) -> values.forEach(value -> {
      if (sb.length() > 0) {
        sb.append('&');
      }
      sb.append(Uris.encode(name)).append('=').append(Uris.encode(value));
    }));
    return Optional.of("<iframe src=\"" + Uris.base(uri) + "?" + sb + "\">");
  }

  // called after the client session is revoked; a notification that can not be built is logged
  // and left out, the logout itself stands
  private void notification(String clientId, String sub, String sessionId,
                            Map<String, BackChannelLogout> blu, Map<String, String> flu) {
    Optional<ClientInfo> client = clients.get(clientId);
    if (client.isEmpty()) {
      log.warn("Client {} is no longer registered, not notifying it", clientId);
      return;
    }
    try {
      Optional<BackChannelLogout> backChannel = backChannelLogout(client.get(), sub, sessionId);
      if (backChannel.isPresent()) {
        blu.put(clientId, backChannel.get());
        return;
      }
      frontChannelIframe(client.get(), settings.issuer(), sessionId)
          .ifPresent(iframe -> flu.put(clientId, iframe));
    } catch (RuntimeException e) {
      log.error("Could not build the logout notification for client {}", clientId, e);
    }
  }

  /**
   * The newest grant's session id, which is the sid the client last saw in an ID token.
   */
  private String notificationSessionId(SessionKey clientKey) {
    List<Grant> grants = sessionManager.grants(clientKey.serialize());
    if (grants.isEmpty()) {
      return clientKey.serialize();
    }
    return clientKey.withGrant(grants.get(grants.size() - 1).id()).serialize();
  }
}

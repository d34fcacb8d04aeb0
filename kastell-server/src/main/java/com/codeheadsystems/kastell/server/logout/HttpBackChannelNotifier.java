package com.codeheadsystems.kastell.server.logout;

import com.codeheadsystems.kastell.server.authorization.Uris;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BackChannelNotifier} POSTing {@code logout_token=<jwt>} with {@link HttpClient}.
 * <p>
 * 2xx is success; 501 and 504 are tolerated. Other statuses and transport failures are
 * logged. There are no retries.
 */
public class HttpBackChannelNotifier implements BackChannelNotifier {

  private static final Logger log = LoggerFactory.getLogger(HttpBackChannelNotifier.class);

  static final Set<Integer> TOLERATED_STATUSES = Set.of(501, 504);

  private final HttpClient httpClient;
  private final Duration timeout;

  public HttpBackChannelNotifier(HttpClient httpClient, Duration timeout) {
    this.httpClient = httpClient;
    this.timeout = timeout;
  }

  @Override
  public boolean deliver(String clientId, BackChannelLogout notification) {
    log.info("Logging out from {} at {}", clientId, notification.uri());
    HttpRequest request;
    try {
      request = HttpRequest.newBuilder(URI.create(notification.uri()))
          .timeout(timeout)
          .header("Content-Type", "application/x-www-form-urlencoded")
          .POST(HttpRequest.BodyPublishers.ofString(
              "logout_token=" + Uris.encode(notification.logoutToken())))
          .build();
    } catch (IllegalArgumentException e) {
      log.warn("Invalid backchannel_logout_uri for {}: {}", clientId, e.getMessage());
      return false;
    }
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      log.warn("Back-channel logout to {} failed: {}", clientId, e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Back-channel logout to {} interrupted", clientId);
      return false;
    }
    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      log.info("Logged out from {}", clientId);
      return true;
    }
    if (TOLERATED_STATUSES.contains(status)) {
      log.info("Got a {} from {} which is acceptable", status, clientId);
      return true;
    }
    log.warn("Failed to log out from {}: HTTP {}", clientId, status);
    return false;
  }
}

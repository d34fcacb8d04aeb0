package com.codeheadsystems.kastell.server.authorization;

import com.codeheadsystems.kastell.server.client.ClientInfo;
import com.codeheadsystems.kastell.server.client.ClientRegistry;
import com.codeheadsystems.kastell.server.exception.RedirectUriException;
import com.codeheadsystems.kastell.server.exception.UnknownClientException;
import com.codeheadsystems.kastell.server.model.AuthorizationRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks redirect and post-logout redirect URIs against what the client registered.
 * <p>
 * A URI matches a registration when its part before {@code ?} is identical and the query
 * parts agree both ways: every registered key/value is present in the URI and every key/value
 * of the URI was registered. Fragments are never allowed.
 */
public class RedirectUriValidator {

  private static final Logger log = LoggerFactory.getLogger(RedirectUriValidator.class);

  private final ClientRegistry clients;

  public RedirectUriValidator(ClientRegistry clients) {
    this.clients = clients;
  }

  /**
   * Verifies a URI.
   *
   * @param uri      the (possibly percent-encoded) URI
   * @param clientId the client
   * @param type     which registered list to use
   * @throws UnknownClientException if the client is not registered
   * @throws RedirectUriException   if the URI does not match
   */
  public void verify(String uri, String clientId, RedirectUriType type) {
    if (clientId == null || clientId.isBlank()) {
      throw new UnknownClientException("No client_id provided");
    }
    ClientInfo client = clients.get(clientId)
        .orElseThrow(() -> new UnknownClientException("No such client: " + clientId));
    if (uri == null || uri.isBlank()) {
      throw new RedirectUriException("Missing " + type.parameter());
    }
    String decoded = Uris.decode(uri);
    try {
      if (new URI(decoded).getRawFragment() != null) {
        throw new RedirectUriException(type.parameter() + " contains fragment");
      }
    } catch (URISyntaxException e) {
      throw new RedirectUriException("Malformed " + type.parameter(), e);
    }

    List<String> registered = type == RedirectUriType.REDIRECT
        ? client.redirectUris() : client.postLogoutRedirectUris();
    if (registered.isEmpty()) {
      throw new RedirectUriException("No registered " + type.parameter());
    }

    String base = Uris.base(decoded);
    Map<String, List<String>> query = Uris.splitQuery(Uris.query(decoded));
    for (String candidate : registered) {
      if (!Uris.base(candidate).equals(base)) {
        continue;
      }
      Map<String, List<String>> registeredQuery = Uris.splitQuery(Uris.query(candidate));
      checkRegisteredQueryPresent(registeredQuery, query);
      checkNoExtraQuery(registeredQuery, query);
      log.debug("verify(clientId={}, {}) matched", clientId, type.parameter());
      return;
    }
    log.warn("Client {} used an unregistered {}", clientId, type.parameter());
    throw new RedirectUriException("Doesn't match any registered " + type.parameter());
  }

  /**
   * The redirect URI to answer a request on: the requested one once verified, or the
   * client's only registered one when the request names none.
   *
   * @param request the authorization request
   * @return the redirect URI
   * @throws RedirectUriException if none is given and the client registered zero or several
   */
  public String resolve(AuthorizationRequest request) {
    if (request.redirectUri() != null) {
      verify(request.redirectUri(), request.clientId(), RedirectUriType.REDIRECT);
      return request.redirectUri();
    }
    ClientInfo client = clients.get(request.clientId())
        .orElseThrow(() -> new UnknownClientException("No such client: " + request.clientId()));
    if (client.redirectUris().size() != 1) {
      throw new RedirectUriException("Missing redirect_uri and the client has "
          + client.redirectUris().size() + " registered");
    }
    return client.redirectUris().get(0);
  }

  private static void checkRegisteredQueryPresent(Map<String, List<String>> registered,
                                                  Map<String, List<String>> query) {
    if (registered.isEmpty()) {
      return;
    }
    if (query.isEmpty()) {
      throw new RedirectUriException("Missing query part");
    }
    registered.forEach((key, values) -> {
      List<String> present = query.get(key);
      if (present == null) {
        throw new RedirectUriException("\"" + key + "\" not in query part");
      }
      for (String value : values) {
        if (!present.contains(value)) {
          throw new RedirectUriException(key + "=" + value + " value not in query part");
        }
      }
    });
  }

  private static void checkNoExtraQuery(Map<String, List<String>> registered,
                                        Map<String, List<String>> query) {
    if (query.isEmpty()) {
      return;
    }
    if (registered.isEmpty()) {
      throw new RedirectUriException("No registered query part");
    }
    query.forEach((key, values) -> {
      List<String> allowed = registered.get(key);
      if (allowed == null) {
        throw new RedirectUriException("\"" + key + "\" extra in query part");
      }
      for (String value : values) {
        if (!allowed.contains(value)) {
          throw new RedirectUriException("Extra value " + key + "=" + value + " in query part");
        }
      }
    });
  }
}

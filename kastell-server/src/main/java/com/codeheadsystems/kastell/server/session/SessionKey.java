package com.codeheadsystems.kastell.server.session;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Path to a node of the session tree: {@code (userId)}, {@code (userId, clientId)} or
 * {@code (userId, clientId, grantId)}.
 * <p>
 * The serialized form base64url-encodes every part and joins them with {@code '.'}, which
 * never occurs in the base64url alphabet, so {@link #parse(String)} inverts
 * {@link #serialize()} for any ids.
 */
public record SessionKey(String userId, String clientId, String grantId) {

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();
  private static final String SEPARATOR = ".";

  public SessionKey {
    if (userId == null) {
      throw new IllegalArgumentException("userId is required");
    }
    if (clientId == null && grantId != null) {
      throw new IllegalArgumentException("grantId requires clientId");
    }
  }

  public static SessionKey of(String userId) {
    return new SessionKey(userId, null, null);
  }

  public static SessionKey of(String userId, String clientId) {
    return new SessionKey(userId, clientId, null);
  }

  public static SessionKey of(String userId, String clientId, String grantId) {
    return new SessionKey(userId, clientId, grantId);
  }

  /**
   * Builds a key from a one to three element path.
   *
   * @param path the path
   * @return the key
   */
  public static SessionKey fromPath(List<String> path) {
    return switch (path.size()) {
      case 1 -> of(path.get(0));
      case 2 -> of(path.get(0), path.get(1));
      case 3 -> of(path.get(0), path.get(1), path.get(2));
      default -> throw new IllegalArgumentException("Session path must have 1 to 3 elements: " + path);
    };
  }

  /**
   * Inverse of {@link #serialize()}.
   *
   * @param sessionId a serialized key
   * @return the key
   * @throws IllegalArgumentException if the value is not a serialized key, or not the one
   *                                  {@link #serialize()} would produce
   */
  public static SessionKey parse(String sessionId) {
    if (sessionId == null) {
      throw new IllegalArgumentException("Session id is required");
    }
    String[] parts = sessionId.split("\\.", -1);
    if (parts.length > 3) {
      throw new IllegalArgumentException("Not a session id");
    }
    List<String> path = new ArrayList<>(parts.length);
    for (String part : parts) {
      String decoded = new String(DECODER.decode(part), StandardCharsets.UTF_8);
      // padding, stray bits and invalid UTF-8 would give one key several session ids
      if (!encode(decoded).equals(part)) {
        throw new IllegalArgumentException("Not a canonical session id");
      }
      path.add(decoded);
    }
    return fromPath(path);
  }

  public String serialize() {
    StringBuilder sb = new StringBuilder(encode(userId));
    if (clientId != null) {
      sb.append(SEPARATOR).append(encode(clientId));
    }
    if (grantId != null) {
      sb.append(SEPARATOR).append(encode(grantId));
    }
    return sb.toString();
  }

  public List<String> toPath() {
    List<String> path = new ArrayList<>(3);
    path.add(userId);
    if (clientId != null) {
      path.add(clientId);
    }
    if (grantId != null) {
      path.add(grantId);
    }
    return path;
  }

  /**
   * Number of path elements, 1 to 3.
   *
   * @return the depth
   */
  public int depth() {
    return grantId != null ? 3 : clientId != null ? 2 : 1;
  }

  public SessionKey userKey() {
    return of(userId);
  }

  public SessionKey clientKey() {
    if (clientId == null) {
      throw new IllegalArgumentException("Session key has no client part");
    }
    return of(userId, clientId);
  }

  public SessionKey withGrant(String grantId) {
    return of(userId, clientId, grantId);
  }

  private static String encode(String part) {
    return ENCODER.encodeToString(part.getBytes(StandardCharsets.UTF_8));
  }
}

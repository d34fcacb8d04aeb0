package com.codeheadsystems.kastell.server.cookie;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Payload of the session cookie: who is logged in, under which session, and the state of the
 * request that logged them in.
 *
 * @param uid   the user id
 * @param sid   the session id of the grant created at login
 * @param state the state parameter of that request, may be null
 */
public record SessionCookie(@JsonProperty("uid") String uid,
                            @JsonProperty("sid") String sid,
                            @JsonProperty("state") String state) {

  /**
   * Cookie type label.
   */
  public static final String TYPE = "sso";

  public String toJson(ObjectMapper mapper) {
    try {
      return mapper.writeValueAsString(this);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize session cookie", e);
    }
  }

  /**
   * Parses a cookie payload.
   *
   * @param mapper the object mapper
   * @param json   the payload
   * @return the session cookie
   * @throws SecurityException if the payload is not a session cookie
   */
  public static SessionCookie fromJson(ObjectMapper mapper, String json) {
    try {
      return mapper.readValue(json, SessionCookie.class);
    } catch (JsonProcessingException e) {
      throw new SecurityException("Session cookie payload is malformed", e);
    }
  }
}

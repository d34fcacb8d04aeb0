package com.codeheadsystems.kastell.server.claims;

import java.util.Map;

/**
 * Where user attributes come from.
 */
public interface UserInfoSource {

  /**
   * Every attribute known about a user.
   *
   * @param userId   the local user id
   * @param clientId the client the claims are for, may be null
   * @return claim name to value, empty for an unknown user
   */
  Map<String, Object> userInfo(String userId, String clientId);
}

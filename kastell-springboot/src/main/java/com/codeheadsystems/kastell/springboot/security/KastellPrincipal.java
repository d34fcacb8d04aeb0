package com.codeheadsystems.kastell.springboot.security;

import java.security.Principal;
import java.util.List;

public record KastellPrincipal(String userId, String clientId, List<String> scope)
    implements Principal {

  @Override
  public String getName() {
    return userId;
  }
}

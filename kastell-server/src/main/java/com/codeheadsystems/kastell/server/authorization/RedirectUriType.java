package com.codeheadsystems.kastell.server.authorization;

/**
 * Which of a client's registered URI lists a URI is checked against.
 */
public enum RedirectUriType {
  REDIRECT("redirect_uri"),
  POST_LOGOUT("post_logout_redirect_uri");

  private final String parameter;

  RedirectUriType(String parameter) {
    this.parameter = parameter;
  }

  public String parameter() {
    return parameter;
  }
}

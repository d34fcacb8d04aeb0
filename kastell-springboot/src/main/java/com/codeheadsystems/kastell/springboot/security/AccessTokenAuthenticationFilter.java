package com.codeheadsystems.kastell.springboot.security;

import com.codeheadsystems.kastell.server.exception.KastellException;
import com.codeheadsystems.kastell.server.session.SessionInfo;
import com.codeheadsystems.kastell.server.session.SessionManager;
import com.codeheadsystems.kastell.server.session.TokenType;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying an active access token issued by the provider. Each granted
 * scope becomes a {@code SCOPE_} authority.
 */
public class AccessTokenAuthenticationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(AccessTokenAuthenticationFilter.class);

  private final SessionManager sessionManager;

  /**
   * Instantiates a new access token authentication filter.
   *
   * @param sessionManager the session manager holding issued tokens
   */
  public AccessTokenAuthenticationFilter(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String authHeader = request.getHeader("Authorization");
    if (authHeader != null && authHeader.startsWith("Bearer ")) {
      principal(authHeader.substring(7).trim()).ifPresent(principal -> {
        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
            principal, null,
            principal.scope().stream().map(s -> new SimpleGrantedAuthority("SCOPE_" + s)).toList());
        SecurityContextHolder.getContext().setAuthentication(auth);
      });
    }
    filterChain.doFilter(request, response);
  }

  Optional<KastellPrincipal> principal(String token) {
    SessionInfo info;
    try {
      info = sessionManager.getSessionInfoByToken(token);
    } catch (KastellException e) {
      log.debug("Bearer token rejected: {}", e.getMessage());
      return Optional.empty();
    }
    Instant now = sessionManager.now();
    if (info.token().type() != TokenType.ACCESS_TOKEN
        || !info.token().isActive(now)
        || !info.grant().isActive(now)) {
      return Optional.empty();
    }
    return Optional.of(new KastellPrincipal(info.userId(), info.clientId(),
        List.copyOf(info.grant().scope())));
  }
}

package com.codeheadsystems.kastell.springboot.security;

import com.codeheadsystems.kastell.server.manager.OidcProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class KastellSecurityConfig {

  @Bean
  public AccessTokenAuthenticationFilter accessTokenAuthenticationFilter(OidcProvider oidcProvider) {
    return new AccessTokenAuthenticationFilter(oidcProvider.sessionManager());
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                 AccessTokenAuthenticationFilter tokenFilter)
      throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/authorization", "/authn", "/token", "/userinfo", "/introspection",
                "/par", "/end_session", "/verify_logout", "/post_logout",
                "/.well-known/openid-configuration", "/jwks", "/actuator/health/**").permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(tokenFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}

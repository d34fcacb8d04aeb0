package com.codeheadsystems.kastell.springboot;

import com.codeheadsystems.kastell.springboot.security.KastellPrincipal;
import java.util.Map;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/whoami")
public class WhoAmIController {

  @GetMapping
  public Map<String, Object> whoAmI(@AuthenticationPrincipal KastellPrincipal principal) {
    return Map.of(
        "user", principal.userId(),
        "client", principal.clientId(),
        "scope", principal.scope());
  }
}

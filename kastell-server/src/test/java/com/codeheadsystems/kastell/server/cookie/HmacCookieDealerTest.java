package com.codeheadsystems.kastell.server.cookie;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.MutableClock;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HmacCookieDealerTest {

  private static final byte[] KEY = "cookie key, 32 bytes or so......".getBytes(
      StandardCharsets.UTF_8);

  private MutableClock clock;
  private HmacCookieDealer dealer;

  @BeforeEach
  void setUp() {
    clock = MutableClock.now();
    dealer = new HmacCookieDealer(KEY, clock, "Lax", true);
  }

  @Test
  void createCookie_getCookieValue_roundTrip() {
    Cookie cookie = dealer.createCookie("{\"uid\":\"diana\"}", "sso", "kastell_session");

    Optional<List<String>> value = dealer.getCookieValue(
        "other=1; kastell_session=" + cookie.value(), "kastell_session");

    assertThat(value).isPresent();
    assertThat(value.get()).containsExactly("{\"uid\":\"diana\"}",
        Long.toString(clock.instant().getEpochSecond()), "sso");
  }

  @Test
  void createCookie_attributes() {
    Cookie cookie = dealer.createCookie("x", "sso", "name", Duration.ofMinutes(5), null, null);

    assertThat(cookie.toHeaderValue())
        .startsWith("name=")
        .contains("; Path=/")
        .contains("; Max-Age=300")
        .contains("; SameSite=Lax")
        .contains("; Secure")
        .endsWith("; HttpOnly");
  }

  @Test
  void getCookieValue_absent_returnsEmpty() {
    assertThat(dealer.getCookieValue(null, "kastell_session")).isEmpty();
    assertThat(dealer.getCookieValue("a=b", "kastell_session")).isEmpty();
  }

  @Test
  void getCookieValue_tamperedPayload_throws() {
    Cookie cookie = dealer.createCookie("{\"uid\":\"diana\"}", "sso", "s");
    String[] parts = cookie.value().split("\\|");
    String forged = "eyJ1aWQiOiJldmUifQ" + "|" + parts[1] + "|" + parts[2] + "|" + parts[3];

    assertThatThrownBy(() -> dealer.getCookieValue("s=" + forged, "s"))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void getCookieValue_otherKey_throws() {
    Cookie cookie = new HmacCookieDealer("a completely different cookie key"
        .getBytes(StandardCharsets.UTF_8), clock, "Lax", true).createCookie("x", "sso", "s");

    assertThatThrownBy(() -> dealer.getCookieValue("s=" + cookie.value(), "s"))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void getCookieValue_malformed_throws() {
    assertThatThrownBy(() -> dealer.getCookieValue("s=just-a-value", "s"))
        .isInstanceOf(SecurityException.class);
  }

  @Test
  void expired_cookieDeletesName() {
    assertThat(Cookie.expired("s").toHeaderValue()).startsWith("s=; Path=/; Max-Age=0");
  }
}

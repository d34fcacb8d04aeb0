package com.codeheadsystems.kastell.server.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class SessionKeyTest {

  @Test
  void serialize_parse_roundTripsIdsContainingSeparators() {
    SessionKey key = SessionKey.of("diana.prince;x", "client|1", "grant=2");

    SessionKey parsed = SessionKey.parse(key.serialize());

    assertThat(parsed).isEqualTo(key);
    assertThat(parsed.toPath()).containsExactly("diana.prince;x", "client|1", "grant=2");
  }

  @Test
  void serialize_userOnly_hasNoSeparator() {
    String sessionId = SessionKey.of("diana").serialize();

    assertThat(sessionId).doesNotContain(".");
    assertThat(SessionKey.parse(sessionId).depth()).isEqualTo(1);
  }

  @Test
  void fromPath_depths() {
    assertThat(SessionKey.fromPath(List.of("u")).depth()).isEqualTo(1);
    assertThat(SessionKey.fromPath(List.of("u", "c")).depth()).isEqualTo(2);
    assertThat(SessionKey.fromPath(List.of("u", "c", "g")).depth()).isEqualTo(3);
  }

  @Test
  void fromPath_tooLong_throws() {
    assertThatThrownBy(() -> SessionKey.fromPath(List.of("a", "b", "c", "d")))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_tooManyParts_throws() {
    assertThatThrownBy(() -> SessionKey.parse("YQ.Yg.Yw.ZA"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_notBase64_throws() {
    assertThatThrownBy(() -> SessionKey.parse("not base64!"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parse_nonCanonicalEncodings_throw() {
    assertThat(SessionKey.parse("YQ.Yg")).isEqualTo(SessionKey.of("a", "b"));
    // padded, stray trailing bits, bytes that are not UTF-8
    for (String alias : List.of("YQ==.Yg", "YR.Yg", "_w.Yg")) {
      assertThatThrownBy(() -> SessionKey.parse(alias))
          .as(alias)
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Test
  void grantWithoutClient_rejected() {
    assertThatThrownBy(() -> new SessionKey("u", null, "g"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void clientKey_ofUserKey_throws() {
    assertThatThrownBy(() -> SessionKey.of("u").clientKey())
        .isInstanceOf(IllegalArgumentException.class);
  }
}

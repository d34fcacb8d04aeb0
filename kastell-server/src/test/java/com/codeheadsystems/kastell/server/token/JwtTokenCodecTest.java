package com.codeheadsystems.kastell.server.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.kastell.server.MutableClock;
import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JwtTokenCodecTest {

  private static final byte[] SECRET =
      "test-secret-must-be-at-least-32-bytes!".getBytes(StandardCharsets.UTF_8);
  private static final byte[] WRONG_SECRET =
      "wrong-secret-must-be-at-least-32-bytes".getBytes(StandardCharsets.UTF_8);
  private static final String ISSUER = "https://op.example.org";
  private static final String SESSION_ID = "ZGlhbmE;Y2xpZW50XzE;Z3JhbnQ";

  private MutableClock clock;
  private JwtTokenCodec codec;

  @BeforeEach
  void setUp() {
    clock = MutableClock.now();
    codec = new JwtTokenCodec(SECRET, ISSUER, clock);
  }

  @Test
  void encodeAndDecode_recoversSessionAndType() {
    String value = codec.encode(SESSION_ID, TokenType.AUTHORIZATION_CODE, null, Map.of());

    TokenInfo info = codec.decode(value);

    assertThat(info.sessionId()).isEqualTo(SESSION_ID);
    assertThat(info.type()).isEqualTo(TokenType.AUTHORIZATION_CODE);
    assertThat(info.expiresAt()).isNull();
    assertThat(info.jti()).isNotBlank();
  }

  @Test
  void encode_sameInputs_yieldDistinctValues() {
    String first = codec.encode(SESSION_ID, TokenType.ACCESS_TOKEN, null, Map.of());
    String second = codec.encode(SESSION_ID, TokenType.ACCESS_TOKEN, null, Map.of());

    assertThat(first).isNotEqualTo(second);
  }

  @Test
  void encode_extraClaimsAreEmbedded() {
    String value = codec.encode(SESSION_ID, TokenType.ACCESS_TOKEN, null,
        Map.of("scope", "openid email"));

    assertThat(JWT.decode(value).getClaim("scope").asString()).isEqualTo("openid email");
  }

  @Test
  void decode_pastExpiry_isTooOld() {
    String value = codec.encode(SESSION_ID, TokenType.ACCESS_TOKEN,
        clock.instant().plusSeconds(60), Map.of());
    clock.advance(Duration.ofMinutes(2));

    assertThatThrownBy(() -> codec.decode(value)).isInstanceOf(TooOldException.class);
  }

  @Test
  void decode_wrongSecret_isUnknown() {
    String value = new JwtTokenCodec(WRONG_SECRET, ISSUER, clock)
        .encode(SESSION_ID, TokenType.ACCESS_TOKEN, null, Map.of());

    assertThatThrownBy(() -> codec.decode(value)).isInstanceOf(UnknownTokenException.class);
  }

  @Test
  void decode_otherIssuer_isUnknown() {
    String value = new JwtTokenCodec(SECRET, "https://other.example.org", clock)
        .encode(SESSION_ID, TokenType.ACCESS_TOKEN, null, Map.of());

    assertThatThrownBy(() -> codec.decode(value)).isInstanceOf(UnknownTokenException.class);
  }

  @Test
  void decode_tamperedSignature_isUnknown() {
    String value = codec.encode(SESSION_ID, TokenType.REFRESH_TOKEN, null, Map.of());
    int at = value.lastIndexOf('.') + 5;
    char flipped = value.charAt(at) == 'A' ? 'B' : 'A';
    String tampered = value.substring(0, at) + flipped + value.substring(at + 1);

    assertThatThrownBy(() -> codec.decode(tampered)).isInstanceOf(UnknownTokenException.class);
  }

  @Test
  void decode_withoutSessionId_isUnknown() {
    String value = JWT.create()
        .withIssuer(ISSUER)
        .withClaim(JwtTokenCodec.TYPE_CLAIM, TokenType.ACCESS_TOKEN.typeTag())
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> codec.decode(value)).isInstanceOf(UnknownTokenException.class);
  }

  @Test
  void decode_unknownTypeTag_isUnknown() {
    String value = JWT.create()
        .withIssuer(ISSUER)
        .withClaim(JwtTokenCodec.SESSION_ID_CLAIM, SESSION_ID)
        .withClaim(JwtTokenCodec.TYPE_CLAIM, "Q")
        .sign(Algorithm.HMAC256(SECRET));

    assertThatThrownBy(() -> codec.decode(value)).isInstanceOf(UnknownTokenException.class);
  }
}

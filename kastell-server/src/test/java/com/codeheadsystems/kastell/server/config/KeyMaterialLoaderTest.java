package com.codeheadsystems.kastell.server.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.kastell.server.token.KeyMaterial;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.util.Base64;
import org.junit.jupiter.api.Test;

class KeyMaterialLoaderTest {

  private static final String SECRET = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";

  @Test
  void load_nothingConfigured_generates() {
    KeyMaterial keys = KeyMaterialLoader.load(null, "", " ", null);

    assertThat(keys.signingAlgorithms()).contains("RS256", "ES256");
  }

  @Test
  void load_everythingConfigured_isStable() throws Exception {
    KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
    generator.initialize(2048);
    KeyPair pair = generator.generateKeyPair();
    String pkcs8 = Base64.getEncoder().encodeToString(pair.getPrivate().getEncoded());

    KeyMaterial first = KeyMaterialLoader.load(SECRET, SECRET, SECRET, pkcs8);
    KeyMaterial second = KeyMaterialLoader.load(SECRET, SECRET, SECRET, pkcs8);

    assertThat(first.signingAlgorithms()).containsExactly("RS256");
    assertThat(first.jwks()).isEqualTo(second.jwks());
    assertThat(first.tokenSecret()).hasSize(32);
  }

  @Test
  void load_partialConfiguration_throws() {
    assertThatThrownBy(() -> KeyMaterialLoader.load(SECRET, null, null, null))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("together");
  }

  @Test
  void load_malformedValues_throw() {
    assertThatThrownBy(() -> KeyMaterialLoader.load(SECRET, SECRET, "abcd", "AAAA"))
        .isInstanceOf(IllegalStateException.class);
    assertThatThrownBy(() -> KeyMaterialLoader.load(SECRET, SECRET, SECRET, "AAAA"))
        .isInstanceOf(IllegalStateException.class);
  }
}

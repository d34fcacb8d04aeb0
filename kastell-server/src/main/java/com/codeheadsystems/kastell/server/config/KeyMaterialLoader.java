package com.codeheadsystems.kastell.server.config;

import com.codeheadsystems.kastell.server.token.KeyMaterial;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link KeyMaterial} from the string forms the framework adapters read from their
 * configuration: hex-encoded symmetric secrets and a base64 PKCS#8 RSA private key.
 * <p>
 * Either everything is configured or nothing is. With nothing configured the keys are
 * generated at random (development only); a partial configuration is an error.
 * Generate values with {@code openssl rand -hex 32} and
 * {@code openssl genpkey -algorithm RSA -pkeyopt rsa_keygen_bits:2048 -outform DER | base64}.
 */
public final class KeyMaterialLoader {

  private static final Logger log = LoggerFactory.getLogger(KeyMaterialLoader.class);

  private KeyMaterialLoader() {
  }

  /**
   * Loads or generates the provider keys.
   *
   * @param tokenSecretHex      HMAC secret of the token codec
   * @param cookieSecretHex     HMAC secret of the cookie dealer
   * @param sidSecretHex        secret of the sid cipher
   * @param rsaPrivateKeyBase64 PKCS#8 DER RSA private key, base64
   * @return the key material
   * @throws IllegalStateException if only some of the values are set, or a value is malformed
   */
  public static KeyMaterial load(String tokenSecretHex, String cookieSecretHex,
                                 String sidSecretHex, String rsaPrivateKeyBase64) {
    int present = count(tokenSecretHex) + count(cookieSecretHex) + count(sidSecretHex)
        + count(rsaPrivateKeyBase64);
    if (present == 0) {
      log.warn("No provider keys configured: generating randomly. "
          + "Tokens and sessions will be invalidated on restart. Do not use in production.");
      return KeyMaterial.generate(new SecureRandom());
    }
    if (present < 4) {
      throw new IllegalStateException("tokenSecretHex, cookieSecretHex, sidSecretHex and "
          + "rsaPrivateKeyBase64 must be configured together (or all omitted for dev mode).");
    }
    HexFormat hex = HexFormat.of();
    try {
      return new KeyMaterial(hex.parseHex(tokenSecretHex), hex.parseHex(cookieSecretHex),
          hex.parseHex(sidSecretHex), rsaKeyPair(Base64.getMimeDecoder().decode(rsaPrivateKeyBase64)),
          null);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid provider key configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Reconstructs an RSA key pair from a PKCS#8 encoded CRT private key.
   *
   * @param pkcs8 the DER bytes
   * @return the key pair
   * @throws IllegalArgumentException if the bytes are not an RSA CRT private key
   */
  public static KeyPair rsaKeyPair(byte[] pkcs8) {
    try {
      KeyFactory factory = KeyFactory.getInstance("RSA");
      PrivateKey privateKey = factory.generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
      if (!(privateKey instanceof RSAPrivateCrtKey crt)) {
        throw new IllegalArgumentException("RSA private key lacks CRT parameters");
      }
      PublicKey publicKey = factory.generatePublic(
          new RSAPublicKeySpec(crt.getModulus(), crt.getPublicExponent()));
      return new KeyPair(publicKey, privateKey);
    } catch (GeneralSecurityException e) {
      throw new IllegalArgumentException("Not a PKCS#8 RSA private key", e);
    }
  }

  private static int count(String value) {
    return value == null || value.isBlank() ? 0 : 1;
  }
}

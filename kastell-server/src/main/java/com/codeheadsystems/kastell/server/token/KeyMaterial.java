package com.codeheadsystems.kastell.server.token;

import com.auth0.jwt.algorithms.Algorithm;
import com.codeheadsystems.kastell.model.discovery.JsonWebKey;
import com.codeheadsystems.kastell.model.discovery.JsonWebKeySet;
import com.codeheadsystems.kastell.server.exception.InvalidRequestException;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The provider's keys: asymmetric JWS keys for ID tokens, logout tokens and logout
 * confirmations, plus the symmetric secrets of the token codec, the cookie dealer and the
 * sid cipher.
 */
public class KeyMaterial {

  /**
   * Minimum length of every symmetric secret.
   */
  public static final int MIN_SECRET_LENGTH = 32;

  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();

  private final byte[] tokenSecret;
  private final byte[] cookieSecret;
  private final byte[] sidSecret;
  private final Map<String, SigningKey> signingKeys = new LinkedHashMap<>();

  /**
   * Creates key material from existing keys.
   *
   * @param tokenSecret  HMAC secret of the access/refresh/code token codec
   * @param cookieSecret HMAC secret of the cookie dealer
   * @param sidSecret    secret the sid cipher derives its keys from
   * @param rsaKeyPair   RSA key pair for RS256, may be null
   * @param ecKeyPair    P-256 key pair for ES256, may be null
   */
  public KeyMaterial(byte[] tokenSecret, byte[] cookieSecret, byte[] sidSecret, KeyPair rsaKeyPair,
                     KeyPair ecKeyPair) {
    this.tokenSecret = requireSecret(tokenSecret, "tokenSecret");
    this.cookieSecret = requireSecret(cookieSecret, "cookieSecret");
    this.sidSecret = requireSecret(sidSecret, "sidSecret");
    if (rsaKeyPair != null) {
      RSAPublicKey pub = (RSAPublicKey) rsaKeyPair.getPublic();
      addKey("RS256", Algorithm.RSA256(pub, (RSAPrivateKey) rsaKeyPair.getPrivate()), pub);
    }
    if (ecKeyPair != null) {
      ECPublicKey pub = (ECPublicKey) ecKeyPair.getPublic();
      addKey("ES256", Algorithm.ECDSA256(pub, (ECPrivateKey) ecKeyPair.getPrivate()), pub);
    }
    if (signingKeys.isEmpty()) {
      throw new IllegalArgumentException("At least one signing key pair is required");
    }
  }

  /**
   * Generates fresh random keys. Tokens signed with them do not survive a restart.
   *
   * @param random the randomness source
   * @return new key material
   */
  public static KeyMaterial generate(SecureRandom random) {
    try {
      KeyPairGenerator rsa = KeyPairGenerator.getInstance("RSA");
      rsa.initialize(2048, random);
      KeyPairGenerator ec = KeyPairGenerator.getInstance("EC");
      ec.initialize(new ECGenParameterSpec("secp256r1"), random);
      return new KeyMaterial(randomBytes(random), randomBytes(random), randomBytes(random),
          rsa.generateKeyPair(), ec.generateKeyPair());
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Unable to generate signing keys", e);
    }
  }

  public byte[] tokenSecret() {
    return tokenSecret.clone();
  }

  public byte[] cookieSecret() {
    return cookieSecret.clone();
  }

  public byte[] sidSecret() {
    return sidSecret.clone();
  }

  /**
   * The JWS algorithm for a JOSE {@code alg} name.
   *
   * @param alg e.g. {@code RS256}
   * @return the signing / verifying algorithm
   * @throws InvalidRequestException if no key is configured for the algorithm
   */
  public Algorithm signingAlgorithm(String alg) {
    SigningKey key = signingKeys.get(alg);
    if (key == null) {
      throw new InvalidRequestException("Unsupported signing algorithm: " + alg);
    }
    return key.algorithm();
  }

  public Optional<String> keyId(String alg) {
    return Optional.ofNullable(signingKeys.get(alg)).map(SigningKey::kid);
  }

  public Set<String> signingAlgorithms() {
    return signingKeys.keySet();
  }

  /**
   * Public half of every signing key.
   *
   * @return the JWK set
   */
  public JsonWebKeySet jwks() {
    List<JsonWebKey> keys = new ArrayList<>();
    for (SigningKey key : signingKeys.values()) {
      if (key.publicKey() instanceof RSAPublicKey rsa) {
        keys.add(new JsonWebKey("RSA", key.kid(), "sig", key.alg(),
            unsigned(rsa.getModulus(), 0), unsigned(rsa.getPublicExponent(), 0), null, null, null));
      } else if (key.publicKey() instanceof ECPublicKey ec) {
        keys.add(new JsonWebKey("EC", key.kid(), "sig", key.alg(), null, null, "P-256",
            unsigned(ec.getW().getAffineX(), 32), unsigned(ec.getW().getAffineY(), 32)));
      }
    }
    return new JsonWebKeySet(keys);
  }

  private void addKey(String alg, Algorithm algorithm, PublicKey publicKey) {
    byte[] thumb = Hashing.sha256(publicKey.getEncoded());
    String kid = B64URL.encodeToString(Arrays.copyOf(thumb, 12));
    signingKeys.put(alg, new SigningKey(alg, kid, algorithm, publicKey));
  }

  private static String unsigned(BigInteger value, int length) {
    byte[] bytes = value.toByteArray();
    if (bytes.length > 1 && bytes[0] == 0) {
      bytes = Arrays.copyOfRange(bytes, 1, bytes.length);
    }
    if (length > bytes.length) {
      byte[] padded = new byte[length];
      System.arraycopy(bytes, 0, padded, length - bytes.length, bytes.length);
      bytes = padded;
    }
    return B64URL.encodeToString(bytes);
  }

  private static byte[] randomBytes(SecureRandom random) {
    byte[] bytes = new byte[MIN_SECRET_LENGTH];
    random.nextBytes(bytes);
    return bytes;
  }

  private static byte[] requireSecret(byte[] secret, String name) {
    if (secret == null || secret.length < MIN_SECRET_LENGTH) {
      throw new IllegalArgumentException(name + " must be at least " + MIN_SECRET_LENGTH + " bytes");
    }
    return secret.clone();
  }

  private record SigningKey(String alg, String kid, Algorithm algorithm, PublicKey publicKey) {
  }
}

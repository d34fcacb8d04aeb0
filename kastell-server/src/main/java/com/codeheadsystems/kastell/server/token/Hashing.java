package com.codeheadsystems.kastell.server.token;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;
import org.bouncycastle.crypto.Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA384Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * SHA-2 and HMAC-SHA256 helpers shared by the token, cookie and session code.
 */
public final class Hashing {

  private Hashing() {
  }

  public static byte[] sha256(byte[] input) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  public static String sha256Hex(String input) {
    return HexFormat.of().formatHex(sha256(input.getBytes(StandardCharsets.UTF_8)));
  }

  public static byte[] hmacSha256(byte[] key, byte[] data) {
    HMac mac = new HMac(new SHA256Digest());
    mac.init(new KeyParameter(key));
    mac.update(data, 0, data.length);
    byte[] out = new byte[mac.getMacSize()];
    mac.doFinal(out, 0);
    return out;
  }

  /**
   * The {@code at_hash} / {@code c_hash} value of OpenID Connect Core §3.3.2.11: base64url of
   * the left half of the hash over the ASCII token value. The hash is the one of the ID
   * token's JWS algorithm: SHA-384 for {@code *384}, SHA-512 for {@code *512}, otherwise
   * SHA-256.
   *
   * @param tokenValue the access token or code
   * @param alg        the ID token's {@code alg}, e.g. {@code RS256}
   * @return the hash claim value
   */
  public static String leftHalfHash(String tokenValue, String alg) {
    Digest digest = digestFor(alg);
    byte[] input = tokenValue.getBytes(StandardCharsets.US_ASCII);
    digest.update(input, 0, input.length);
    byte[] hash = new byte[digest.getDigestSize()];
    digest.doFinal(hash, 0);
    return Base64.getUrlEncoder().withoutPadding()
        .encodeToString(Arrays.copyOf(hash, hash.length / 2));
  }

  private static Digest digestFor(String alg) {
    if (alg != null && alg.endsWith("384")) {
      return new SHA384Digest();
    }
    if (alg != null && alg.endsWith("512")) {
      return new SHA512Digest();
    }
    return new SHA256Digest();
  }
}

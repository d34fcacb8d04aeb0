package com.codeheadsystems.kastell.server.token;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

/**
 * Encrypts session ids before they leave the provider as the {@code sid} claim.
 * <p>
 * AES-256-GCM with a synthetic nonce: the nonce is the first 12 bytes of an HMAC over the
 * session id, so one session id always encrypts to the same value. Relying parties can then
 * match the {@code sid} of an ID token against the {@code sid} of a later logout token or
 * front-channel logout request. Output is base64url of {@code nonce || ciphertext || tag}.
 */
public class SidCipher {

  private static final int NONCE_LENGTH = 12;
  private static final int TAG_BITS = 128;
  private static final Base64.Encoder B64URL = Base64.getUrlEncoder().withoutPadding();
  private static final Base64.Decoder B64URL_D = Base64.getUrlDecoder();

  private final byte[] encryptionKey;
  private final byte[] nonceKey;

  public SidCipher(byte[] secret) {
    if (secret == null || secret.length < 16) {
      throw new IllegalArgumentException("sid secret must be at least 16 bytes");
    }
    this.encryptionKey = Hashing.hmacSha256(secret, "kastell-sid-enc".getBytes(StandardCharsets.US_ASCII));
    this.nonceKey = Hashing.hmacSha256(secret, "kastell-sid-nonce".getBytes(StandardCharsets.US_ASCII));
  }

  public String encrypt(String sessionId) {
    byte[] plain = sessionId.getBytes(StandardCharsets.UTF_8);
    byte[] nonce = Arrays.copyOf(Hashing.hmacSha256(nonceKey, plain), NONCE_LENGTH);
    try {
      byte[] sealed = process(true, nonce, plain, 0, plain.length);
      byte[] out = new byte[NONCE_LENGTH + sealed.length];
      System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
      System.arraycopy(sealed, 0, out, NONCE_LENGTH, sealed.length);
      return B64URL.encodeToString(out);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("sid encryption failed", e);
    }
  }

  /**
   * Reverses {@link #encrypt(String)}.
   *
   * @param encrypted the sid claim value
   * @return the session id
   * @throws IllegalArgumentException if the value is malformed or fails authentication
   */
  public String decrypt(String encrypted) {
    byte[] in;
    try {
      in = B64URL_D.decode(encrypted);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("sid is not base64url", e);
    }
    if (in.length <= NONCE_LENGTH + TAG_BITS / 8) {
      throw new IllegalArgumentException("sid is too short");
    }
    byte[] nonce = Arrays.copyOf(in, NONCE_LENGTH);
    try {
      byte[] plain = process(false, nonce, in, NONCE_LENGTH, in.length - NONCE_LENGTH);
      return new String(plain, StandardCharsets.UTF_8);
    } catch (InvalidCipherTextException e) {
      throw new IllegalArgumentException("sid failed authentication", e);
    }
  }

  private byte[] process(boolean encrypt, byte[] nonce, byte[] input, int offset, int length)
      throws InvalidCipherTextException {
    GCMModeCipher cipher = GCMBlockCipher.newInstance(AESEngine.newInstance());
    cipher.init(encrypt, new AEADParameters(new KeyParameter(encryptionKey), TAG_BITS, nonce));
    byte[] out = new byte[cipher.getOutputSize(length)];
    int written = cipher.processBytes(input, offset, length, out, 0);
    written += cipher.doFinal(out, written);
    return written == out.length ? out : Arrays.copyOf(out, written);
  }
}

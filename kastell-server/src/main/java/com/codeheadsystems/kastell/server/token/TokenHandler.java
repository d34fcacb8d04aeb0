package com.codeheadsystems.kastell.server.token;

import com.codeheadsystems.kastell.server.exception.TooOldException;
import com.codeheadsystems.kastell.server.exception.UnknownTokenException;
import com.codeheadsystems.kastell.server.session.TokenType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The codec per token type, and lookup of an arbitrary token value across all of them.
 */
public class TokenHandler {

  private static final Logger log = LoggerFactory.getLogger(TokenHandler.class);

  private final Map<TokenType, TokenCodec> codecs;

  public TokenHandler(Map<TokenType, TokenCodec> codecs) {
    this.codecs = new EnumMap<>(codecs);
  }

  /**
   * The codec minting tokens of the given type.
   *
   * @param type the token type
   * @return the codec
   * @throws IllegalArgumentException if no codec is configured for the type
   */
  public TokenCodec codecFor(TokenType type) {
    TokenCodec codec = codecs.get(type);
    if (codec == null) {
      throw new IllegalArgumentException("No codec for token type " + type.value());
    }
    return codec;
  }

  /**
   * Decodes a token value of unknown type by trying every configured codec.
   *
   * @param value the token value
   * @return the decoded info
   * @throws TooOldException       if a codec recognized the value but it has expired
   * @throws UnknownTokenException if no codec recognized the value
   */
  public TokenInfo info(String value) {
    if (value == null || value.isBlank()) {
      throw new UnknownTokenException("No token value");
    }
    Set<TokenCodec> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
    distinct.addAll(codecs.values());
    TooOldException expired = null;
    for (TokenCodec codec : distinct) {
      try {
        return codec.decode(value);
      } catch (TooOldException e) {
        expired = e;
      } catch (UnknownTokenException e) {
        log.trace("{} does not recognize the token: {}", codec.getClass().getSimpleName(),
            e.getMessage());
      }
    }
    if (expired != null) {
      throw expired;
    }
    throw new UnknownTokenException("Unknown token");
  }
}

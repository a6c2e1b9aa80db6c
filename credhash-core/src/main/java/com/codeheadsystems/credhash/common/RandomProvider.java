package com.codeheadsystems.credhash.common;

import com.codeheadsystems.credhash.exception.CryptoFailureException;
import java.security.SecureRandom;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable salt generation.
 * {@link SecureRandom} is thread-safe, so one provider is shared by every encode call.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   * @throws CryptoFailureException if the underlying source fails
   */
  public byte[] randomBytes(int len) {
    if (len < 0) {
      throw new IllegalArgumentException("Random byte count must not be negative: " + len);
    }
    byte[] out = new byte[len];
    try {
      random.nextBytes(out);
    } catch (RuntimeException e) {
      throw new CryptoFailureException("Secure random source failed", e);
    }
    return out;
  }
}

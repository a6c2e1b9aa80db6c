package com.codeheadsystems.credhash;

import com.codeheadsystems.credhash.algorithm.AlgorithmRegistry;
import com.codeheadsystems.credhash.algorithm.PasswordAlgorithm;
import com.codeheadsystems.credhash.exception.FormatException;
import com.codeheadsystems.credhash.exception.IncompatibilityException;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import com.codeheadsystems.credhash.format.EncodedFields;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks passwords against encoded hashes.
 * <p>
 * A wrong password is a {@code false} result. Exceptions are reserved for input that is not a
 * valid encoded hash, so a corrupted stored hash is never mistaken for a failed login.
 */
public class HashVerifier {

  private static final Logger log = LoggerFactory.getLogger(HashVerifier.class);

  private final AlgorithmRegistry registry;

  public HashVerifier(AlgorithmRegistry registry) {
    this.registry = registry;
  }

  /**
   * Verifies a password.
   *
   * @param password    the password bytes
   * @param encodedHash the stored encoded hash
   * @return true if the password matches
   * @throws UnsupportedAlgorithmException if the hash's tag is not registered
   * @throws FormatException               if the hash is malformed
   * @throws IncompatibilityException      if the hash's algorithm version is not supported
   */
  public boolean verify(byte[] password, String encodedHash) {
    Objects.requireNonNull(password, "password");
    Objects.requireNonNull(encodedHash, "encodedHash");
    EncodedFields fields = EncodedFields.split(encodedHash);
    PasswordAlgorithm algorithm = registry.lookup(fields.algorithm());
    DecodedHash decoded = algorithm.format().parse(fields).orThrow();
    boolean match = algorithm.matches(password, decoded);
    log.debug("verify({}) -> {}", algorithm.name(), match);
    return match;
  }
}

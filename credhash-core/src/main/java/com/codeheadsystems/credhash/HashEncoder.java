package com.codeheadsystems.credhash;

import com.codeheadsystems.credhash.algorithm.AlgorithmRegistry;
import com.codeheadsystems.credhash.exception.ConfigurationException;
import com.codeheadsystems.credhash.exception.CryptoFailureException;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces encoded hashes. Output differs on every call because each call draws a fresh salt.
 */
public class HashEncoder {

  private static final Logger log = LoggerFactory.getLogger(HashEncoder.class);

  private final AlgorithmRegistry registry;

  public HashEncoder(AlgorithmRegistry registry) {
    this.registry = registry;
  }

  /**
   * Hashes a password with the named algorithm under its current configuration.
   *
   * @param algorithm the algorithm name
   * @param password  the password bytes
   * @return the encoded hash
   * @throws UnsupportedAlgorithmException if the algorithm is not registered
   * @throws ConfigurationException        if the algorithm's parameters are missing or invalid
   * @throws CryptoFailureException        if the random source or the primitive fails
   */
  public String encode(String algorithm, byte[] password) {
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(password, "password");
    log.debug("encode({})", algorithm);
    return registry.lookup(algorithm).encode(password);
  }
}

package com.codeheadsystems.credhash.config;

import com.codeheadsystems.credhash.exception.ConfigurationException;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import com.codeheadsystems.credhash.model.AlgorithmParameters;
import com.codeheadsystems.credhash.model.Argon2idParameters;
import com.codeheadsystems.credhash.model.BcryptParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the configured parameters of an algorithm.
 * <p>
 * Every call reads the {@link ParameterSource} again; nothing is cached, so a configuration
 * change is picked up by the next hashing call. All values are required. A missing, non-numeric
 * or out-of-range value raises {@link ConfigurationException} naming the key.
 */
public class ParameterStore {

  public static final String ARGON2ID_MEMORY = "argon2id.memory";
  public static final String ARGON2ID_ITERATIONS = "argon2id.iterations";
  public static final String ARGON2ID_PARALLELISM = "argon2id.parallelism";
  public static final String ARGON2ID_SALT_LENGTH = "argon2id.salt-length";
  public static final String ARGON2ID_KEY_LENGTH = "argon2id.key-length";
  public static final String BCRYPT_COST = "bcrypt.cost";

  private static final Logger log = LoggerFactory.getLogger(ParameterStore.class);

  private final ParameterSource source;

  public ParameterStore(ParameterSource source) {
    this.source = source;
  }

  /**
   * Resolves parameters by algorithm name.
   *
   * @param algorithm the algorithm name
   * @return the parameters
   * @throws ConfigurationException        if a value is missing or invalid
   * @throws UnsupportedAlgorithmException if no parameters are known for the algorithm
   */
  public AlgorithmParameters resolve(String algorithm) {
    return switch (algorithm) {
      case Argon2idParameters.ALGORITHM -> argon2id();
      case BcryptParameters.ALGORITHM -> bcrypt();
      default -> throw new UnsupportedAlgorithmException(algorithm);
    };
  }

  /**
   * Resolves the Argon2id parameters.
   *
   * @return the parameters
   * @throws ConfigurationException if a value is missing or invalid
   */
  public Argon2idParameters argon2id() {
    int parallelism = requireInt(ARGON2ID_PARALLELISM,
        Argon2idParameters.MIN_PARALLELISM, Argon2idParameters.MAX_PARALLELISM);
    int memory = requireInt(ARGON2ID_MEMORY,
        Argon2idParameters.minimumMemoryKiB(parallelism), Argon2idParameters.MAX_MEMORY_KIB);
    int iterations = requireInt(ARGON2ID_ITERATIONS,
        Argon2idParameters.MIN_ITERATIONS, Argon2idParameters.MAX_ITERATIONS);
    int saltLength = requireInt(ARGON2ID_SALT_LENGTH, Argon2idParameters.MIN_SALT_LENGTH, Integer.MAX_VALUE);
    int keyLength = requireInt(ARGON2ID_KEY_LENGTH, Argon2idParameters.MIN_KEY_LENGTH, Integer.MAX_VALUE);
    return new Argon2idParameters(memory, iterations, parallelism, saltLength, keyLength);
  }

  /**
   * Resolves the bcrypt parameters.
   *
   * @return the parameters
   * @throws ConfigurationException if the cost is missing or outside [4, 31]
   */
  public BcryptParameters bcrypt() {
    return new BcryptParameters(requireInt(BCRYPT_COST, BcryptParameters.MIN_COST, BcryptParameters.MAX_COST));
  }

  /**
   * Reads a required integer within an inclusive range.
   *
   * @param key the key
   * @param min the smallest legal value
   * @param max the largest legal value
   * @return the value
   * @throws ConfigurationException if the value is missing, not a decimal integer, or out of range
   */
  public int requireInt(String key, int min, int max) {
    String raw = source.get(key)
        .map(String::strip)
        .filter(s -> !s.isEmpty())
        .orElseThrow(() -> fail(key, "Missing required parameter " + key, null));
    int value;
    try {
      value = Integer.parseInt(raw);
    } catch (NumberFormatException e) {
      throw fail(key, "Parameter " + key + " is not an integer", e);
    }
    if (value < min || value > max) {
      throw fail(key, "Parameter " + key + "=" + value + " is outside [" + min + ", " + max + "]", null);
    }
    return value;
  }

  private static ConfigurationException fail(String key, String message, Throwable cause) {
    log.warn("Invalid hashing configuration: {}", message);
    return new ConfigurationException(key, message, cause);
  }
}

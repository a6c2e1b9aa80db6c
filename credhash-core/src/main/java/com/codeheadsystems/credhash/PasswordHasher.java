package com.codeheadsystems.credhash;

import com.codeheadsystems.credhash.algorithm.AlgorithmRegistry;
import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.config.EnvironmentParameterSource;
import com.codeheadsystems.credhash.config.ParameterSource;
import com.codeheadsystems.credhash.config.ParameterStore;
import com.codeheadsystems.credhash.model.Argon2idParameters;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Entry point combining {@link HashEncoder}, {@link HashDecoder} and {@link HashVerifier} over one
 * {@link AlgorithmRegistry}, with a default algorithm for new hashes.
 * <p>
 * Typical login flow:
 * <pre>{@code
 *   if (hasher.verify(password, stored)) {
 *     if (hasher.needsRehash(stored)) {
 *       credentials.update(user, hasher.encode(password));
 *     }
 *   }
 * }</pre>
 * String passwords are hashed as their UTF-8 bytes.
 */
public class PasswordHasher {

  private final String defaultAlgorithm;
  private final AlgorithmRegistry registry;
  private final HashEncoder encoder;
  private final HashDecoder decoder;
  private final HashVerifier verifier;

  /**
   * Instantiates a new Password hasher.
   *
   * @param registry         the registry
   * @param defaultAlgorithm the algorithm used by {@link #encode(byte[])}
   * @throws com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException if the default is not registered
   */
  public PasswordHasher(AlgorithmRegistry registry, String defaultAlgorithm) {
    this.defaultAlgorithm = registry.lookup(defaultAlgorithm).name();
    this.registry = registry;
    this.encoder = new HashEncoder(registry);
    this.decoder = HashDecoder.forRegistry(registry);
    this.verifier = new HashVerifier(registry);
  }

  /**
   * Standard algorithms reading their parameters from the given source, defaulting to Argon2id.
   *
   * @param source the parameter source
   * @return the password hasher
   */
  public static PasswordHasher standard(ParameterSource source) {
    return new PasswordHasher(
        AlgorithmRegistry.standard(new ParameterStore(source), new RandomProvider()),
        Argon2idParameters.ALGORITHM);
  }

  /**
   * Standard algorithms reading their parameters from the process environment
   * ({@code ARGON2ID_MEMORY}, {@code BCRYPT_COST}, ...), defaulting to Argon2id.
   *
   * @return the password hasher
   */
  public static PasswordHasher fromEnvironment() {
    return standard(new EnvironmentParameterSource());
  }

  public String defaultAlgorithm() {
    return defaultAlgorithm;
  }

  public AlgorithmRegistry registry() {
    return registry;
  }

  public String encode(byte[] password) {
    return encoder.encode(defaultAlgorithm, password);
  }

  public String encode(String password) {
    return encode(utf8(password));
  }

  public String encode(String algorithm, byte[] password) {
    return encoder.encode(algorithm, password);
  }

  public String encode(String algorithm, String password) {
    return encoder.encode(algorithm, utf8(password));
  }

  public boolean verify(byte[] password, String encodedHash) {
    return verifier.verify(password, encodedHash);
  }

  public boolean verify(String password, String encodedHash) {
    return verifier.verify(utf8(password), encodedHash);
  }

  public DecodedHash decode(String encodedHash) {
    return decoder.decode(encodedHash);
  }

  /**
   * Whether a stored hash should be replaced after the next successful verification: it uses an
   * algorithm other than the default, or parameters other than the configured ones.
   *
   * @param encodedHash the stored encoded hash
   * @return true if the hash is outdated
   * @throws com.codeheadsystems.credhash.exception.FormatException          if the hash is malformed
   * @throws com.codeheadsystems.credhash.exception.IncompatibilityException if its version is not supported
   */
  public boolean needsRehash(String encodedHash) {
    DecodedHash decoded = decoder.decode(encodedHash);
    if (!defaultAlgorithm.equals(decoded.algorithm())) {
      return true;
    }
    return registry.lookup(decoded.algorithm()).needsRehash(decoded);
  }

  private static byte[] utf8(String password) {
    return Objects.requireNonNull(password, "password").getBytes(StandardCharsets.UTF_8);
  }
}

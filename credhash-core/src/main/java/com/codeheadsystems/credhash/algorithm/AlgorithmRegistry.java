package com.codeheadsystems.credhash.algorithm;

import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.config.ParameterStore;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable map of algorithm name to {@link PasswordAlgorithm}. This is the single extension
 * point for new algorithms: build a registry with an extra entry and hand it to the encoder and
 * verifier; call sites do not change.
 * <pre>{@code
 *   AlgorithmRegistry registry = AlgorithmRegistry.standard(parameterStore, new RandomProvider())
 *       .toBuilder()
 *       .register(new MyScryptAlgorithm(parameterStore))
 *       .build();
 * }</pre>
 */
public final class AlgorithmRegistry {

  private static final Logger log = LoggerFactory.getLogger(AlgorithmRegistry.class);

  private final Map<String, PasswordAlgorithm> algorithms;

  private AlgorithmRegistry(Map<String, PasswordAlgorithm> algorithms) {
    this.algorithms = Collections.unmodifiableMap(new LinkedHashMap<>(algorithms));
  }

  /**
   * Registry holding {@code argon2id} and {@code bcrypt}.
   *
   * @param parameterStore the parameter store both algorithms resolve against
   * @param randomProvider the salt source
   * @return the registry
   */
  public static AlgorithmRegistry standard(ParameterStore parameterStore, RandomProvider randomProvider) {
    return builder()
        .register(new Argon2idAlgorithm(parameterStore, randomProvider))
        .register(new BcryptAlgorithm(parameterStore, randomProvider))
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Looks up an algorithm by name.
   *
   * @param name the name
   * @return the algorithm
   * @throws UnsupportedAlgorithmException if the name is not registered
   */
  public PasswordAlgorithm lookup(String name) {
    PasswordAlgorithm algorithm = algorithms.get(name);
    if (algorithm == null) {
      throw new UnsupportedAlgorithmException(name);
    }
    return algorithm;
  }

  public boolean supports(String name) {
    return algorithms.containsKey(name);
  }

  /**
   * Registered names in registration order.
   *
   * @return the names
   */
  public Set<String> names() {
    return algorithms.keySet();
  }

  public Collection<PasswordAlgorithm> algorithms() {
    return algorithms.values();
  }

  /**
   * A builder pre-populated with this registry's entries, for deriving an extended registry.
   *
   * @return the builder
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    algorithms.values().forEach(builder::register);
    return builder;
  }

  /**
   * Collects algorithms; names must be unique.
   */
  public static final class Builder {

    private final Map<String, PasswordAlgorithm> algorithms = new LinkedHashMap<>();

    private Builder() {
    }

    /**
     * Adds an algorithm.
     *
     * @param algorithm the algorithm
     * @return this builder
     * @throws IllegalArgumentException if the name is already registered
     */
    public Builder register(PasswordAlgorithm algorithm) {
      if (algorithms.putIfAbsent(algorithm.name(), algorithm) != null) {
        throw new IllegalArgumentException("Algorithm already registered: " + algorithm.name());
      }
      return this;
    }

    public AlgorithmRegistry build() {
      AlgorithmRegistry registry = new AlgorithmRegistry(algorithms);
      log.info("Password hashing algorithms registered: {}", registry.names());
      return registry;
    }
  }
}

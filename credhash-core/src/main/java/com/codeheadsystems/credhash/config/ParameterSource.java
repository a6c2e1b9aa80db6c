package com.codeheadsystems.credhash.config;

import java.util.Optional;

/**
 * Supplies raw configuration values by key. Keys are dotted, lower case names such as
 * {@code argon2id.memory} or {@code bcrypt.cost}.
 * <p>
 * Implementations must be safe for concurrent use and should read their backing store on each
 * call so configuration changes become visible to the next hashing call.
 */
@FunctionalInterface
public interface ParameterSource {

  /**
   * Looks up a raw value.
   *
   * @param key the key
   * @return the value, or empty if the key is not configured
   */
  Optional<String> get(String key);
}

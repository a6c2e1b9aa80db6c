package com.codeheadsystems.credhash.config;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads parameters from environment-style variables: {@code argon2id.salt-length} is looked up as
 * {@code ARGON2ID_SALT_LENGTH}. The lookup function is consulted on every call.
 */
public class EnvironmentParameterSource implements ParameterSource {

  private final Function<String, String> lookup;

  /**
   * Reads the process environment.
   */
  public EnvironmentParameterSource() {
    this(System::getenv);
  }

  /**
   * Reads variables through the given lookup, for example a loaded {@code .env} file.
   *
   * @param lookup returns the value of a variable, or null when unset
   */
  public EnvironmentParameterSource(Function<String, String> lookup) {
    this.lookup = lookup;
  }

  /**
   * Maps a parameter key to its environment variable name.
   *
   * @param key the key
   * @return the variable name
   */
  public static String variableName(String key) {
    return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(lookup.apply(variableName(key)));
  }
}

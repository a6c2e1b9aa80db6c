package com.codeheadsystems.credhash.springboot.config;

import com.codeheadsystems.credhash.config.ParameterSource;
import java.util.Optional;
import org.springframework.core.env.Environment;

/**
 * Looks parameters up as {@code credhash.<key>} in the Spring {@link Environment} at call time.
 * Relaxed binding applies, so {@code CREDHASH_BCRYPT_COST} satisfies {@code bcrypt.cost}.
 */
public class SpringEnvironmentParameterSource implements ParameterSource {

  public static final String PREFIX = "credhash.";

  private final Environment environment;

  public SpringEnvironmentParameterSource(Environment environment) {
    this.environment = environment;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(environment.getProperty(PREFIX + key));
  }
}

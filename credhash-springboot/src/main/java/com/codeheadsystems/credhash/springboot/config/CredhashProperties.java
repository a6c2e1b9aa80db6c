package com.codeheadsystems.credhash.springboot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code credhash.*}. Only the default algorithm is bound here; algorithm parameters such as
 * {@code credhash.argon2id.memory} are read from the environment on every hashing call by
 * {@link SpringEnvironmentParameterSource}.
 */
@ConfigurationProperties(prefix = "credhash")
public class CredhashProperties {

  private String defaultAlgorithm = "argon2id";

  public String getDefaultAlgorithm() {
    return defaultAlgorithm;
  }

  public void setDefaultAlgorithm(String defaultAlgorithm) {
    this.defaultAlgorithm = defaultAlgorithm;
  }
}

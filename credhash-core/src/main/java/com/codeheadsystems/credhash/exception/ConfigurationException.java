package com.codeheadsystems.credhash.exception;

/**
 * A required algorithm parameter is missing, not numeric, or outside the algorithm's legal range.
 * Fatal to the call that triggered it; never retried.
 */
public class ConfigurationException extends CredentialHashException {

  private final String key;

  /**
   * Instantiates a new Configuration exception.
   *
   * @param key     the configuration key at fault
   * @param message the message
   */
  public ConfigurationException(final String key, final String message) {
    super(message);
    this.key = key;
  }

  /**
   * Instantiates a new Configuration exception.
   *
   * @param key     the configuration key at fault
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(final String key, final String message, final Throwable cause) {
    super(message, cause);
    this.key = key;
  }

  /**
   * The configuration key at fault.
   *
   * @return the key
   */
  public String key() {
    return key;
  }
}

package com.codeheadsystems.credhash.exception;

/**
 * Root of every error raised while encoding, decoding or verifying a password hash.
 * <p>
 * A password that simply does not match is never reported through this hierarchy; verification
 * returns {@code false} for that case. Messages carry the kind of failure and the offending
 * field name only. They never contain the password, the salt or the hash bytes.
 */
public class CredentialHashException extends RuntimeException {

  /**
   * Instantiates a new Credential hash exception.
   *
   * @param message the message
   */
  public CredentialHashException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Credential hash exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CredentialHashException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

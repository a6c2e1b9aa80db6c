package com.codeheadsystems.credhash.exception;

/**
 * The random source or the derivation primitive failed. Not retried automatically.
 */
public class CryptoFailureException extends CredentialHashException {

  /**
   * Instantiates a new Crypto failure exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CryptoFailureException(final String message, final Throwable cause) {
    super(message, cause);
  }
}

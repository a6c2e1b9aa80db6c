package com.codeheadsystems.credhash.exception;

/**
 * The algorithm name is not present in the registry.
 */
public class UnsupportedAlgorithmException extends CredentialHashException {

  private final String algorithm;

  /**
   * Instantiates a new Unsupported algorithm exception.
   *
   * @param algorithm the algorithm name that was requested
   */
  public UnsupportedAlgorithmException(final String algorithm) {
    super("Unsupported password hashing algorithm: " + algorithm);
    this.algorithm = algorithm;
  }

  /**
   * The requested algorithm name.
   *
   * @return the algorithm
   */
  public String algorithm() {
    return algorithm;
  }
}

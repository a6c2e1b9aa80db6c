package com.codeheadsystems.credhash.exception;

/**
 * The encoded hash is well formed but was produced by an algorithm version this implementation
 * does not support. Callers can use this to drive a migration instead of rejecting the user.
 */
public class IncompatibilityException extends CredentialHashException {

  private final String algorithm;
  private final int version;
  private final int supportedVersion;

  /**
   * Instantiates a new Incompatibility exception.
   *
   * @param algorithm        the algorithm tag
   * @param version          the version found in the encoded hash
   * @param supportedVersion the version this implementation supports
   */
  public IncompatibilityException(final String algorithm, final int version, final int supportedVersion) {
    super("Incompatible " + algorithm + " version " + version + ", supported version is " + supportedVersion);
    this.algorithm = algorithm;
    this.version = version;
    this.supportedVersion = supportedVersion;
  }

  public String algorithm() {
    return algorithm;
  }

  public int version() {
    return version;
  }

  public int supportedVersion() {
    return supportedVersion;
  }
}

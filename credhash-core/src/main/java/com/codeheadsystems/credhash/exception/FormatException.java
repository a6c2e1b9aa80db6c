package com.codeheadsystems.credhash.exception;

/**
 * The encoded hash is structurally invalid: wrong field count, malformed parameter grammar,
 * invalid base64, or internally inconsistent content.
 */
public class FormatException extends CredentialHashException {

  private final String field;

  /**
   * Instantiates a new Format exception.
   *
   * @param field  the name of the field that failed to parse
   * @param reason why it failed
   */
  public FormatException(final String field, final String reason) {
    super("Malformed encoded hash (" + field + "): " + reason);
    this.field = field;
  }

  /**
   * Instantiates a new Format exception.
   *
   * @param field  the name of the field that failed to parse
   * @param reason why it failed
   * @param cause  the cause
   */
  public FormatException(final String field, final String reason, final Throwable cause) {
    super("Malformed encoded hash (" + field + "): " + reason, cause);
    this.field = field;
  }

  /**
   * The field that failed to parse.
   *
   * @return the field
   */
  public String field() {
    return field;
  }
}

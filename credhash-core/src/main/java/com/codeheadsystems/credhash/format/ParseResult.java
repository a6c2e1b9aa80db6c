package com.codeheadsystems.credhash.format;

import com.codeheadsystems.credhash.exception.FormatException;
import com.codeheadsystems.credhash.exception.IncompatibilityException;
import com.codeheadsystems.credhash.model.DecodedHash;

/**
 * Outcome of running one algorithm's grammar over an encoded hash: {@link Parsed},
 * {@link Malformed} or {@link Incompatible}.
 */
public interface ParseResult {

  /**
   * Returns the decoded hash or throws the exception matching this outcome.
   *
   * @return the decoded hash
   * @throws FormatException          if the input was malformed
   * @throws IncompatibilityException if the input has an unsupported version
   */
  DecodedHash orThrow();

  static ParseResult parsed(DecodedHash hash) {
    return new Parsed(hash);
  }

  static ParseResult malformed(String field, String reason) {
    return new Malformed(field, reason);
  }

  static ParseResult incompatible(String algorithm, int version, int supportedVersion) {
    return new Incompatible(algorithm, version, supportedVersion);
  }

  /**
   * The string matched the grammar.
   *
   * @param hash the decoded content
   */
  record Parsed(DecodedHash hash) implements ParseResult {
    @Override
    public DecodedHash orThrow() {
      return hash;
    }
  }

  /**
   * The string violates the grammar.
   *
   * @param field  the field at fault
   * @param reason what is wrong with it
   */
  record Malformed(String field, String reason) implements ParseResult {
    @Override
    public DecodedHash orThrow() {
      throw new FormatException(field, reason);
    }
  }

  /**
   * The string is well formed but declares an unsupported algorithm version.
   *
   * @param algorithm        the algorithm tag
   * @param version          the declared version
   * @param supportedVersion the supported version
   */
  record Incompatible(String algorithm, int version, int supportedVersion) implements ParseResult {
    @Override
    public DecodedHash orThrow() {
      throw new IncompatibilityException(algorithm, version, supportedVersion);
    }
  }
}

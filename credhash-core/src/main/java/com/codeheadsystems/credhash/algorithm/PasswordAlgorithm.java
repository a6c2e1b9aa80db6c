package com.codeheadsystems.credhash.algorithm;

import com.codeheadsystems.credhash.format.HashFormat;
import com.codeheadsystems.credhash.model.DecodedHash;

/**
 * One registered hashing algorithm: how to produce an encoded hash, how to parse one, and how to
 * check a password against a parsed one. Implementations are stateless and thread-safe.
 */
public interface PasswordAlgorithm {

  /**
   * The registry key, also used as the tag in encoded hashes.
   *
   * @return the name
   */
  String name();

  /**
   * The grammar of this algorithm's encoded hashes.
   *
   * @return the format
   */
  HashFormat format();

  /**
   * Hashes a password under the currently configured parameters with a fresh salt.
   *
   * @param password the password bytes
   * @return the encoded hash
   */
  String encode(byte[] password);

  /**
   * Checks a password against a decoded hash of this algorithm.
   *
   * @param password the password bytes
   * @param decoded  the decoded hash
   * @return true on match, false otherwise
   */
  boolean matches(byte[] password, DecodedHash decoded);

  /**
   * Whether a decoded hash was produced under parameters other than the currently configured ones.
   *
   * @param decoded the decoded hash
   * @return true if the hash should be recomputed on the next successful login
   */
  boolean needsRehash(DecodedHash decoded);
}

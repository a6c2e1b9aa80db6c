package com.codeheadsystems.credhash.format;

/**
 * The textual grammar of one algorithm's encoded hashes.
 */
public interface HashFormat {

  /**
   * The algorithm tag this grammar handles.
   *
   * @return the tag
   */
  String algorithm();

  /**
   * Parses a string already split on its delimiter and known to carry this grammar's tag.
   * Never throws on bad input; the problem is described by the returned result.
   *
   * @param fields the fields
   * @return the outcome
   */
  ParseResult parse(EncodedFields fields);
}

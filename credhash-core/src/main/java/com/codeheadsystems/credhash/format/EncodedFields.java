package com.codeheadsystems.credhash.format;

import com.codeheadsystems.credhash.exception.FormatException;
import java.util.Arrays;
import java.util.List;

/**
 * An encoded hash split on its {@code $} delimiter.
 * <p>
 * A well formed string starts with the delimiter, so field 0 is always empty and field 1 is the
 * algorithm tag. Accessors never index past the end of the field list.
 *
 * @param fields every field, including the leading empty one
 */
public record EncodedFields(List<String> fields) {

  public static final char DELIMITER = '$';

  /**
   * The smallest shape any algorithm uses: empty prefix, tag, and one more field.
   */
  private static final int MIN_FIELDS = 3;

  public EncodedFields {
    fields = List.copyOf(fields);
  }

  /**
   * Splits and checks the common prefix shared by every algorithm.
   *
   * @param encodedHash the encoded hash
   * @return the fields
   * @throws FormatException if the string does not start with the delimiter, has too few fields,
   *                         or has an empty algorithm tag
   */
  public static EncodedFields split(String encodedHash) {
    if (encodedHash.isEmpty() || encodedHash.charAt(0) != DELIMITER) {
      throw new FormatException("prefix", "encoded hash must start with '" + DELIMITER + "'");
    }
    List<String> fields = Arrays.asList(encodedHash.split("\\" + DELIMITER, -1));
    if (fields.size() < MIN_FIELDS) {
      throw new FormatException("fields", "expected at least " + MIN_FIELDS + " fields, found " + fields.size());
    }
    if (fields.get(1).isEmpty()) {
      throw new FormatException("algorithm", "algorithm tag is empty");
    }
    return new EncodedFields(fields);
  }

  /**
   * The algorithm tag.
   *
   * @return the tag
   */
  public String algorithm() {
    return fields.get(1);
  }

  public int size() {
    return fields.size();
  }

  public String get(int index) {
    return fields.get(index);
  }
}

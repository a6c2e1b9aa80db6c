package com.codeheadsystems.credhash.format;

import java.util.List;

/**
 * Parses a parameter field of the form {@code k1=v1,k2=v2,...} where the keys must appear exactly
 * once each, in the given order, with canonical decimal values in the unsigned 32-bit range.
 * Tighter limits are left to the caller so its messages can name them.
 */
final class KeyValueGrammar {

  private static final int MAX_DIGITS = 10;
  private static final long MAX_UINT32 = 0xFFFFFFFFL;

  private KeyValueGrammar() {
  }

  /**
   * Parse outcome. Exactly one of {@code values} and {@code error} is set.
   *
   * @param values the values in key order
   * @param error  the reason the text does not match
   */
  record Values(long[] values, String error) {

    boolean valid() {
      return error == null;
    }

    long get(int index) {
      return values[index];
    }
  }

  static Values parse(String text, List<String> keys) {
    String[] pairs = text.split(",", -1);
    if (pairs.length != keys.size()) {
      return failure("expected " + keys.size() + " parameters " + keys + ", found " + pairs.length);
    }
    long[] values = new long[keys.size()];
    for (int i = 0; i < pairs.length; i++) {
      String expected = keys.get(i);
      String pair = pairs[i];
      int eq = pair.indexOf('=');
      if (eq < 0) {
        return failure("parameter " + (i + 1) + " is not key=value");
      }
      if (!pair.substring(0, eq).equals(expected)) {
        return failure("expected key '" + expected + "' at position " + (i + 1));
      }
      String digits = pair.substring(eq + 1);
      if (!isCanonicalDecimal(digits)) {
        return failure("value of '" + expected + "' is not a canonical decimal");
      }
      long value = Long.parseLong(digits);
      if (value > MAX_UINT32) {
        return failure("value of '" + expected + "' exceeds " + MAX_UINT32);
      }
      values[i] = value;
    }
    return new Values(values, null);
  }

  private static boolean isCanonicalDecimal(String digits) {
    if (digits.isEmpty() || digits.length() > MAX_DIGITS) {
      return false;
    }
    if (digits.length() > 1 && digits.charAt(0) == '0') {
      return false;
    }
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c < '0' || c > '9') {
        return false;
      }
    }
    return true;
  }

  private static Values failure(String reason) {
    return new Values(null, reason);
  }
}

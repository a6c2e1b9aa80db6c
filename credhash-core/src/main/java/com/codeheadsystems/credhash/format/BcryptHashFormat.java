package com.codeheadsystems.credhash.format;

import static com.codeheadsystems.credhash.format.ParseResult.malformed;

import com.codeheadsystems.credhash.common.StrictBase64;
import com.codeheadsystems.credhash.model.BcryptParameters;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Grammar of bcrypt hashes:
 * <pre>
 *   $bcrypt$c=&lt;cost&gt;$&lt;base64 of the 60 character bcrypt string&gt;
 * </pre>
 * The bcrypt string embeds its own salt, so the decoded salt is empty and the hash bytes are the
 * ASCII bytes of the bcrypt string. The cost in the parameter field must agree with the cost
 * embedded in the bcrypt string.
 */
public class BcryptHashFormat implements HashFormat {

  public static final int FIELD_COUNT = 4;

  /**
   * Length of {@code $2a$NN$} followed by 22 salt and 31 hash characters.
   */
  public static final int BCRYPT_STRING_LENGTH = 60;

  /**
   * The only bcrypt revision written or accepted.
   */
  public static final String VERSION = "2a";

  private static final int HEADER_LENGTH = 7;
  private static final List<String> KEYS = List.of("c");

  @Override
  public String algorithm() {
    return BcryptParameters.ALGORITHM;
  }

  @Override
  public ParseResult parse(EncodedFields fields) {
    if (fields.size() != FIELD_COUNT) {
      return malformed("fields", "bcrypt expects " + FIELD_COUNT + " fields, found " + fields.size());
    }
    KeyValueGrammar.Values values = KeyValueGrammar.parse(fields.get(2), KEYS);
    if (!values.valid()) {
      return malformed("parameters", values.error());
    }
    long cost = values.get(0);
    if (cost < BcryptParameters.MIN_COST || cost > BcryptParameters.MAX_COST) {
      return malformed("parameters", "c must be between " + BcryptParameters.MIN_COST + " and " + BcryptParameters.MAX_COST);
    }

    byte[] bcrypt;
    try {
      bcrypt = StrictBase64.decode(fields.get(3));
    } catch (IllegalArgumentException e) {
      return malformed("hash", e.getMessage());
    }
    String problem = checkBcryptString(new String(bcrypt, StandardCharsets.US_ASCII), (int) cost);
    if (problem != null) {
      return malformed("hash", problem);
    }
    return ParseResult.parsed(new DecodedHash(algorithm(), new BcryptParameters((int) cost), new byte[0], bcrypt));
  }

  /**
   * Serializes a bcrypt string into the canonical encoded hash.
   *
   * @param parameters   the parameters used for derivation
   * @param bcryptString the {@code $2a$...} string produced by the bcrypt primitive
   * @return the encoded hash
   */
  public String format(BcryptParameters parameters, String bcryptString) {
    return "$" + algorithm()
        + "$c=" + parameters.cost()
        + "$" + StrictBase64.encode(bcryptString.getBytes(StandardCharsets.US_ASCII));
  }

  private static String checkBcryptString(String s, int cost) {
    if (s.length() != BCRYPT_STRING_LENGTH) {
      return "bcrypt string must be " + BCRYPT_STRING_LENGTH + " characters";
    }
    if (s.charAt(0) != '$' || s.charAt(3) != '$' || s.charAt(6) != '$') {
      return "bcrypt string header is malformed";
    }
    if (!VERSION.equals(s.substring(1, 3))) {
      return "bcrypt version must be " + VERSION;
    }
    char tens = s.charAt(4);
    char ones = s.charAt(5);
    if (tens < '0' || tens > '9' || ones < '0' || ones > '9') {
      return "bcrypt cost is not numeric";
    }
    if ((tens - '0') * 10 + (ones - '0') != cost) {
      return "cost parameter does not match the bcrypt string";
    }
    for (int i = HEADER_LENGTH; i < s.length(); i++) {
      if (!isBcryptAlphabet(s.charAt(i))) {
        return "invalid bcrypt character at offset " + i;
      }
    }
    return null;
  }

  private static boolean isBcryptAlphabet(char c) {
    return (c >= 'A' && c <= 'Z')
        || (c >= 'a' && c <= 'z')
        || (c >= '0' && c <= '9')
        || c == '.'
        || c == '/';
  }
}

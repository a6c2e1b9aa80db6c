package com.codeheadsystems.credhash.common;

import java.util.Base64;

/**
 * Standard-alphabet base64 without padding, decoded strictly.
 * <p>
 * {@link Base64.Decoder} accepts missing padding and ignores non-zero trailing bits, so a string
 * only decodes here if it re-encodes to exactly itself. That rejects padding characters,
 * foreign characters, impossible lengths and non-canonical final characters.
 */
public class StrictBase64 {

  private static final Base64.Encoder ENCODER = Base64.getEncoder().withoutPadding();
  private static final Base64.Decoder DECODER = Base64.getDecoder();

  private StrictBase64() {
  }

  /**
   * Encodes bytes as unpadded standard base64.
   *
   * @param bytes the bytes
   * @return the encoded string
   */
  public static String encode(byte[] bytes) {
    return ENCODER.encodeToString(bytes);
  }

  /**
   * Decodes unpadded standard base64, rejecting anything that is not the canonical encoding.
   *
   * @param text the text
   * @return the decoded bytes
   * @throws IllegalArgumentException if the text is not canonical unpadded base64
   */
  public static byte[] decode(String text) {
    for (int i = 0; i < text.length(); i++) {
      if (!isAlphabet(text.charAt(i))) {
        throw new IllegalArgumentException("invalid base64 character at offset " + i);
      }
    }
    if (text.length() % 4 == 1) {
      throw new IllegalArgumentException("invalid base64 length " + text.length());
    }
    byte[] decoded = DECODER.decode(text);
    if (!ENCODER.encodeToString(decoded).equals(text)) {
      throw new IllegalArgumentException("non-canonical base64 trailing bits");
    }
    return decoded;
  }

  private static boolean isAlphabet(char c) {
    return (c >= 'A' && c <= 'Z')
        || (c >= 'a' && c <= 'z')
        || (c >= '0' && c <= '9')
        || c == '+'
        || c == '/';
  }
}

package com.codeheadsystems.credhash;

import com.codeheadsystems.credhash.algorithm.AlgorithmRegistry;
import com.codeheadsystems.credhash.algorithm.PasswordAlgorithm;
import com.codeheadsystems.credhash.exception.FormatException;
import com.codeheadsystems.credhash.exception.IncompatibilityException;
import com.codeheadsystems.credhash.exception.UnsupportedAlgorithmException;
import com.codeheadsystems.credhash.format.Argon2idHashFormat;
import com.codeheadsystems.credhash.format.BcryptHashFormat;
import com.codeheadsystems.credhash.format.EncodedFields;
import com.codeheadsystems.credhash.format.HashFormat;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Parses encoded hashes into {@link DecodedHash} values. Pure: no configuration, no randomness.
 */
public class HashDecoder {

  private final Map<String, HashFormat> formats;

  public HashDecoder(Collection<HashFormat> formats) {
    this.formats = formats.stream()
        .collect(Collectors.toUnmodifiableMap(HashFormat::algorithm, Function.identity()));
  }

  /**
   * Decoder for the grammars of every algorithm in the registry.
   *
   * @param registry the registry
   * @return the decoder
   */
  public static HashDecoder forRegistry(AlgorithmRegistry registry) {
    return new HashDecoder(registry.algorithms().stream().map(PasswordAlgorithm::format).toList());
  }

  /**
   * Decoder for the built-in Argon2id and bcrypt grammars.
   *
   * @return the decoder
   */
  public static HashDecoder standard() {
    return new HashDecoder(List.of(new Argon2idHashFormat(), new BcryptHashFormat()));
  }

  /**
   * Decodes an encoded hash.
   *
   * @param encodedHash the encoded hash
   * @return the decoded hash
   * @throws FormatException               if the string is malformed
   * @throws IncompatibilityException      if the algorithm version is not supported
   * @throws UnsupportedAlgorithmException if the tag names no known grammar
   */
  public DecodedHash decode(String encodedHash) {
    Objects.requireNonNull(encodedHash, "encodedHash");
    EncodedFields fields = EncodedFields.split(encodedHash);
    HashFormat format = formats.get(fields.algorithm());
    if (format == null) {
      throw new UnsupportedAlgorithmException(fields.algorithm());
    }
    return format.parse(fields).orThrow();
  }
}

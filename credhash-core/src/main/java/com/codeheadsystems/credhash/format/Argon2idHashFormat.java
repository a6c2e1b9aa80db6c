package com.codeheadsystems.credhash.format;

import static com.codeheadsystems.credhash.format.ParseResult.malformed;

import com.codeheadsystems.credhash.common.StrictBase64;
import com.codeheadsystems.credhash.model.Argon2idParameters;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.util.List;

/**
 * Grammar of Argon2id hashes:
 * <pre>
 *   $argon2id$v=19,m=&lt;KiB&gt;,t=&lt;iterations&gt;,p=&lt;parallelism&gt;$&lt;base64 salt&gt;$&lt;base64 hash&gt;
 * </pre>
 * Salt and key lengths are taken from the decoded bytes, never from the parameter field.
 */
public class Argon2idHashFormat implements HashFormat {

  public static final int FIELD_COUNT = 5;

  private static final List<String> KEYS = List.of("v", "m", "t", "p");

  @Override
  public String algorithm() {
    return Argon2idParameters.ALGORITHM;
  }

  @Override
  public ParseResult parse(EncodedFields fields) {
    if (fields.size() != FIELD_COUNT) {
      return malformed("fields", "argon2id expects " + FIELD_COUNT + " fields, found " + fields.size());
    }
    KeyValueGrammar.Values values = KeyValueGrammar.parse(fields.get(2), KEYS);
    if (!values.valid()) {
      return malformed("parameters", values.error());
    }
    long version = values.get(0);
    long memory = values.get(1);
    long iterations = values.get(2);
    long parallelism = values.get(3);
    if (version != Argon2idParameters.VERSION) {
      if (version > Integer.MAX_VALUE) {
        return malformed("parameters", "v is not an Argon2 version");
      }
      return ParseResult.incompatible(algorithm(), (int) version, Argon2idParameters.VERSION);
    }
    if (parallelism < Argon2idParameters.MIN_PARALLELISM || parallelism > Argon2idParameters.MAX_PARALLELISM) {
      return malformed("parameters", "p must be between "
          + Argon2idParameters.MIN_PARALLELISM + " and " + Argon2idParameters.MAX_PARALLELISM);
    }
    if (iterations < Argon2idParameters.MIN_ITERATIONS || iterations > Argon2idParameters.MAX_ITERATIONS) {
      return malformed("parameters", "t must be between "
          + Argon2idParameters.MIN_ITERATIONS + " and " + Argon2idParameters.MAX_ITERATIONS);
    }
    int minimumMemory = Argon2idParameters.minimumMemoryKiB((int) parallelism);
    if (memory < minimumMemory || memory > Argon2idParameters.MAX_MEMORY_KIB) {
      return malformed("parameters", "m must be between "
          + minimumMemory + " and " + Argon2idParameters.MAX_MEMORY_KIB + " KiB");
    }

    byte[] salt;
    byte[] hash;
    try {
      salt = StrictBase64.decode(fields.get(3));
    } catch (IllegalArgumentException e) {
      return malformed("salt", e.getMessage());
    }
    try {
      hash = StrictBase64.decode(fields.get(4));
    } catch (IllegalArgumentException e) {
      return malformed("hash", e.getMessage());
    }
    if (salt.length < Argon2idParameters.MIN_SALT_LENGTH) {
      return malformed("salt", "salt is empty");
    }
    if (hash.length < Argon2idParameters.MIN_KEY_LENGTH) {
      return malformed("hash", "hash is shorter than " + Argon2idParameters.MIN_KEY_LENGTH + " bytes");
    }

    Argon2idParameters parameters = new Argon2idParameters(
        (int) memory, (int) iterations, (int) parallelism, salt.length, hash.length);
    return ParseResult.parsed(new DecodedHash(algorithm(), parameters, salt, hash));
  }

  /**
   * Serializes an Argon2id hash into its canonical string.
   *
   * @param parameters the parameters used for derivation
   * @param salt       the salt
   * @param hash       the derived key
   * @return the encoded hash
   */
  public String format(Argon2idParameters parameters, byte[] salt, byte[] hash) {
    return String.format("$%s$v=%d,m=%d,t=%d,p=%d$%s$%s",
        algorithm(),
        Argon2idParameters.VERSION,
        parameters.memoryCostKiB(),
        parameters.iterations(),
        parameters.parallelism(),
        StrictBase64.encode(salt),
        StrictBase64.encode(hash));
  }
}

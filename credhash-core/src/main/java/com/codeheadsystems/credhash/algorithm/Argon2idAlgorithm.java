package com.codeheadsystems.credhash.algorithm;

import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.config.ParameterStore;
import com.codeheadsystems.credhash.exception.CryptoFailureException;
import com.codeheadsystems.credhash.format.Argon2idHashFormat;
import com.codeheadsystems.credhash.format.HashFormat;
import com.codeheadsystems.credhash.model.Argon2idParameters;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.security.MessageDigest;
import java.util.Arrays;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;

/**
 * Argon2id (version 1.3) over BouncyCastle's {@link Argon2BytesGenerator}.
 * <p>
 * Each call allocates the generator's memory blocks ({@code memoryCostKiB} KiB) and releases them
 * on return.
 */
public class Argon2idAlgorithm implements PasswordAlgorithm {

  private final ParameterStore parameterStore;
  private final RandomProvider randomProvider;
  private final Argon2idHashFormat format = new Argon2idHashFormat();

  public Argon2idAlgorithm(ParameterStore parameterStore, RandomProvider randomProvider) {
    this.parameterStore = parameterStore;
    this.randomProvider = randomProvider;
  }

  @Override
  public String name() {
    return Argon2idParameters.ALGORITHM;
  }

  @Override
  public HashFormat format() {
    return format;
  }

  @Override
  public String encode(byte[] password) {
    Argon2idParameters parameters = parameterStore.argon2id();
    byte[] salt = randomProvider.randomBytes(parameters.saltLength());
    byte[] hash = derive(password, salt, parameters);
    return format.format(parameters, salt, hash);
  }

  @Override
  public boolean matches(byte[] password, DecodedHash decoded) {
    Argon2idParameters parameters = parametersOf(decoded);
    byte[] expected = decoded.hash();
    byte[] actual = derive(password, decoded.salt(), parameters);
    try {
      // Security: constant-time comparison, runtime depends only on the derived key length
      return MessageDigest.isEqual(actual, expected);
    } finally {
      Arrays.fill(actual, (byte) 0);
    }
  }

  @Override
  public boolean needsRehash(DecodedHash decoded) {
    Argon2idParameters stored = parametersOf(decoded);
    Argon2idParameters current = parameterStore.argon2id();
    return !current.sameCost(stored) || stored.saltLength() < current.saltLength();
  }

  /**
   * Runs Argon2id over the password. The output length is {@code parameters.keyLength()}.
   *
   * @param password   the password
   * @param salt       the salt
   * @param parameters the cost parameters
   * @return the derived key
   * @throws CryptoFailureException if the generator rejects the parameters or memory runs out
   */
  static byte[] derive(byte[] password, byte[] salt, Argon2idParameters parameters) {
    Argon2Parameters argon2Parameters =
        new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
            .withVersion(Argon2Parameters.ARGON2_VERSION_13)
            .withSalt(salt)
            .withMemoryAsKB(parameters.memoryCostKiB())
            .withIterations(parameters.iterations())
            .withParallelism(parameters.parallelism())
            .build();
    Argon2BytesGenerator gen = new Argon2BytesGenerator();
    byte[] output = new byte[parameters.keyLength()];
    try {
      gen.init(argon2Parameters);
      gen.generateBytes(password, output, 0, output.length);
    } catch (IllegalStateException | IllegalArgumentException e) {
      throw new CryptoFailureException("Argon2id derivation failed", e);
    } catch (OutOfMemoryError e) {
      throw new CryptoFailureException(
          "Not enough memory for Argon2id with m=" + parameters.memoryCostKiB() + " KiB", e);
    }
    return output;
  }

  private Argon2idParameters parametersOf(DecodedHash decoded) {
    if (!name().equals(decoded.algorithm()) || !(decoded.parameters() instanceof Argon2idParameters parameters)) {
      throw new IllegalArgumentException("Not an " + name() + " hash: " + decoded.algorithm());
    }
    return parameters;
  }
}

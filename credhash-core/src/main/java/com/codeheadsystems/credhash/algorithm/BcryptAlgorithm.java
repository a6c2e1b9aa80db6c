package com.codeheadsystems.credhash.algorithm;

import com.codeheadsystems.credhash.common.RandomProvider;
import com.codeheadsystems.credhash.config.ParameterStore;
import com.codeheadsystems.credhash.exception.FormatException;
import com.codeheadsystems.credhash.format.BcryptHashFormat;
import com.codeheadsystems.credhash.format.HashFormat;
import com.codeheadsystems.credhash.model.BcryptParameters;
import com.codeheadsystems.credhash.model.DecodedHash;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.generators.OpenBSDBCrypt;

/**
 * bcrypt over BouncyCastle's {@link OpenBSDBCrypt}. The primitive embeds salt and cost in its own
 * string, so verification is delegated to its check, which compares in constant time.
 */
public class BcryptAlgorithm implements PasswordAlgorithm {

  /**
   * Version written into new bcrypt strings.
   */
  public static final String BCRYPT_VERSION = BcryptHashFormat.VERSION;

  public static final int SALT_LENGTH = 16;

  /**
   * bcrypt only reads the first 72 bytes of a password.
   */
  public static final int MAX_PASSWORD_BYTES = 72;

  private final ParameterStore parameterStore;
  private final RandomProvider randomProvider;
  private final BcryptHashFormat format = new BcryptHashFormat();

  public BcryptAlgorithm(ParameterStore parameterStore, RandomProvider randomProvider) {
    this.parameterStore = parameterStore;
    this.randomProvider = randomProvider;
  }

  @Override
  public String name() {
    return BcryptParameters.ALGORITHM;
  }

  @Override
  public HashFormat format() {
    return format;
  }

  /**
   * {@inheritDoc}
   *
   * @throws IllegalArgumentException if the password is longer than {@value #MAX_PASSWORD_BYTES} bytes
   */
  @Override
  public String encode(byte[] password) {
    if (password.length > MAX_PASSWORD_BYTES) {
      throw new IllegalArgumentException("bcrypt passwords are limited to " + MAX_PASSWORD_BYTES + " bytes");
    }
    BcryptParameters parameters = parameterStore.bcrypt();
    byte[] salt = randomProvider.randomBytes(SALT_LENGTH);
    String bcryptString = OpenBSDBCrypt.generate(BCRYPT_VERSION, password, salt, parameters.cost());
    return format.format(parameters, bcryptString);
  }

  @Override
  public boolean matches(byte[] password, DecodedHash decoded) {
    parametersOf(decoded);
    String bcryptString = new String(decoded.hash(), StandardCharsets.US_ASCII);
    try {
      return OpenBSDBCrypt.checkPassword(bcryptString, password);
    } catch (IllegalArgumentException e) {
      throw new FormatException("hash", "bcrypt string rejected by the bcrypt primitive", e);
    }
  }

  @Override
  public boolean needsRehash(DecodedHash decoded) {
    return parametersOf(decoded).cost() != parameterStore.bcrypt().cost();
  }

  private BcryptParameters parametersOf(DecodedHash decoded) {
    if (!name().equals(decoded.algorithm()) || !(decoded.parameters() instanceof BcryptParameters parameters)) {
      throw new IllegalArgumentException("Not a " + name() + " hash: " + decoded.algorithm());
    }
    return parameters;
  }
}

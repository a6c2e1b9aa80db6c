package com.codeheadsystems.credhash.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * The parsed content of an encoded hash. Built only by the decoder and consumed immediately by
 * the verifier; never persisted.
 * <p>
 * Equality compares array contents, so decoding the same string twice yields equal values.
 * {@link #toString()} reports sizes only.
 *
 * @param algorithm  the algorithm tag
 * @param parameters the parameters embedded in the string
 * @param salt       the salt, empty for algorithms that embed their own salt in the hash
 * @param hash       the hash bytes
 */
public record DecodedHash(String algorithm, AlgorithmParameters parameters, byte[] salt, byte[] hash) {

  public DecodedHash {
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(parameters, "parameters");
    salt = salt == null ? new byte[0] : salt.clone();
    hash = Objects.requireNonNull(hash, "hash").clone();
  }

  @Override
  public byte[] salt() {
    return salt.clone();
  }

  @Override
  public byte[] hash() {
    return hash.clone();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DecodedHash other
        && algorithm.equals(other.algorithm)
        && parameters.equals(other.parameters)
        && Arrays.equals(salt, other.salt)
        && Arrays.equals(hash, other.hash);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(algorithm, parameters);
    result = 31 * result + Arrays.hashCode(salt);
    result = 31 * result + Arrays.hashCode(hash);
    return result;
  }

  @Override
  public String toString() {
    return "DecodedHash[algorithm=" + algorithm
        + ", parameters=" + parameters
        + ", salt=" + salt.length + " bytes"
        + ", hash=" + hash.length + " bytes]";
  }
}

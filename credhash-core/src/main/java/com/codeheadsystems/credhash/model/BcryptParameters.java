package com.codeheadsystems.credhash.model;

/**
 * bcrypt work factor.
 *
 * @param cost log2 of the number of key expansion rounds
 */
public record BcryptParameters(int cost) implements AlgorithmParameters {

  public static final String ALGORITHM = "bcrypt";

  public static final int MIN_COST = 4;
  public static final int MAX_COST = 31;

  public BcryptParameters {
    if (cost < MIN_COST || cost > MAX_COST) {
      throw new IllegalArgumentException("cost must be between " + MIN_COST + " and " + MAX_COST);
    }
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }
}

package com.codeheadsystems.credhash.model;

/**
 * Argon2id cost and size parameters.
 *
 * @param memoryCostKiB memory cost in KiB, at least {@code 8 * parallelism}, at most 1 GiB
 * @param iterations    number of passes over memory, 1 to 256
 * @param parallelism   number of lanes, 1 to 255
 * @param saltLength    salt size in bytes
 * @param keyLength     derived hash size in bytes, at least 4
 */
public record Argon2idParameters(int memoryCostKiB,
                                 int iterations,
                                 int parallelism,
                                 int saltLength,
                                 int keyLength) implements AlgorithmParameters {

  public static final String ALGORITHM = "argon2id";

  /**
   * Argon2 version 1.3, the only version this implementation produces or accepts.
   */
  public static final int VERSION = 0x13;

  public static final int RECOMMENDED_SALT_LENGTH = 16;
  public static final int RECOMMENDED_KEY_LENGTH = 32;

  public static final int MIN_ITERATIONS = 1;
  public static final int MAX_ITERATIONS = 256;
  public static final int MIN_PARALLELISM = 1;
  public static final int MAX_PARALLELISM = 255;
  public static final int MIN_SALT_LENGTH = 1;
  public static final int MIN_KEY_LENGTH = 4;
  public static final int MEMORY_BLOCKS_PER_LANE = 8;

  /**
   * 1 GiB. Verification allocates the memory cost named in a stored hash, so it is capped.
   */
  public static final int MAX_MEMORY_KIB = 1024 * 1024;

  public Argon2idParameters {
    if (iterations < MIN_ITERATIONS || iterations > MAX_ITERATIONS) {
      throw new IllegalArgumentException(
          "iterations must be between " + MIN_ITERATIONS + " and " + MAX_ITERATIONS);
    }
    if (parallelism < MIN_PARALLELISM || parallelism > MAX_PARALLELISM) {
      throw new IllegalArgumentException(
          "parallelism must be between " + MIN_PARALLELISM + " and " + MAX_PARALLELISM);
    }
    if (memoryCostKiB < minimumMemoryKiB(parallelism) || memoryCostKiB > MAX_MEMORY_KIB) {
      throw new IllegalArgumentException(
          "memory must be between " + minimumMemoryKiB(parallelism) + " and " + MAX_MEMORY_KIB + " KiB");
    }
    if (saltLength < MIN_SALT_LENGTH) {
      throw new IllegalArgumentException("salt length must be >= " + MIN_SALT_LENGTH);
    }
    if (keyLength < MIN_KEY_LENGTH) {
      throw new IllegalArgumentException("key length must be >= " + MIN_KEY_LENGTH);
    }
  }

  /**
   * Argon2 requires at least eight 1 KiB blocks per lane.
   *
   * @param parallelism the lane count
   * @return the smallest legal memory cost in KiB
   */
  public static int minimumMemoryKiB(int parallelism) {
    return MEMORY_BLOCKS_PER_LANE * parallelism;
  }

  @Override
  public String algorithm() {
    return ALGORITHM;
  }

  /**
   * True when both describe the same work factor, ignoring salt length.
   * Used to decide whether a stored hash should be recomputed under the current configuration.
   *
   * @param other the other parameters
   * @return whether cost and output size match
   */
  public boolean sameCost(Argon2idParameters other) {
    return memoryCostKiB == other.memoryCostKiB
        && iterations == other.iterations
        && parallelism == other.parallelism
        && keyLength == other.keyLength;
  }
}

package com.codeheadsystems.credhash.model;

/**
 * Tunable parameters of one hashing algorithm. Implementations are immutable values, resolved
 * freshly for every encode call and decoded freshly for every verify call.
 */
public interface AlgorithmParameters {

  /**
   * The registry name of the algorithm these parameters belong to.
   *
   * @return the algorithm name
   */
  String algorithm();
}

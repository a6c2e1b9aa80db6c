package com.codeheadsystems.credhash.config;

import java.util.Map;
import java.util.Optional;

/**
 * Fixed, in-memory parameters keyed by their dotted names.
 */
public class MapParameterSource implements ParameterSource {

  private final Map<String, String> values;

  public MapParameterSource(Map<String, String> values) {
    this.values = Map.copyOf(values);
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(values.get(key));
  }
}

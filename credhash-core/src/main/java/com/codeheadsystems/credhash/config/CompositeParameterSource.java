package com.codeheadsystems.credhash.config;

import java.util.List;
import java.util.Optional;

/**
 * Layers several sources; the first one that has a key wins.
 */
public class CompositeParameterSource implements ParameterSource {

  private final List<ParameterSource> sources;

  public CompositeParameterSource(List<ParameterSource> sources) {
    this.sources = List.copyOf(sources);
  }

  public static CompositeParameterSource of(ParameterSource... sources) {
    return new CompositeParameterSource(List.of(sources));
  }

  @Override
  public Optional<String> get(String key) {
    for (ParameterSource source : sources) {
      Optional<String> value = source.get(key);
      if (value.isPresent()) {
        return value;
      }
    }
    return Optional.empty();
  }
}

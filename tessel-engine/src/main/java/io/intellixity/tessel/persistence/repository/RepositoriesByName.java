package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.metadata.ConfigurationException;

import java.util.*;

/** Repositories keyed by lowercase model name. Read-only once built. */
public final class RepositoriesByName {
  private final Map<String, Repository> byName;

  RepositoriesByName(Map<String, Repository> byName) {
    this.byName = Collections.unmodifiableMap(new LinkedHashMap<>(byName));
  }

  public Optional<Repository> find(String modelName) {
    if (modelName == null) return Optional.empty();
    return Optional.ofNullable(byName.get(modelName.toLowerCase(Locale.ROOT)));
  }

  public Repository get(String modelName) {
    return find(modelName).orElseThrow(() -> new ConfigurationException("No repository for model: " + modelName));
  }

  public Collection<Repository> all() { return byName.values(); }

  public int size() { return byName.size(); }
}

package io.intellixity.tessel.persistence.mapping;

import io.intellixity.tessel.persistence.metadata.ModelBehaviors;

import java.util.*;

/**
 * Materialized row: property name to value, in projection order.
 * <p>
 * Equality and hashing cover the data only. The model's behaviors are reachable through {@link #invoke} via a
 * reference to the single {@link ModelBehaviors} instance of the model, never copied per row.
 */
public final class ResultRow extends AbstractMap<String, Object> {
  private final Map<String, Object> data;
  private final ModelBehaviors behaviors;

  public ResultRow(Map<String, ?> data, ModelBehaviors behaviors) {
    this.data = new LinkedHashMap<>(Objects.requireNonNull(data, "data"));
    this.behaviors = (behaviors == null) ? ModelBehaviors.none() : behaviors;
  }

  @Override public Set<Entry<String, Object>> entrySet() { return data.entrySet(); }
  @Override public Object get(Object key) { return data.get(key); }
  @Override public boolean containsKey(Object key) { return data.containsKey(key); }
  @Override public Object put(String key, Object value) { return data.put(key, value); }
  @Override public Object remove(Object key) { return data.remove(key); }
  @Override public int size() { return data.size(); }

  public ModelBehaviors behaviors() { return behaviors; }

  public Object invoke(String behavior, Object... args) {
    return behaviors.invoke(behavior, this, args);
  }
}

package io.intellixity.tessel.persistence.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable capability set of a model. One instance per model, referenced (never copied) by every row
 * materialized for that model.
 */
public final class ModelBehaviors {
  private static final ModelBehaviors NONE = new ModelBehaviors(Map.of());

  private final Map<String, RowBehavior> byName;

  private ModelBehaviors(Map<String, RowBehavior> byName) {
    this.byName = byName;
  }

  public static ModelBehaviors none() { return NONE; }

  public static ModelBehaviors of(Map<String, RowBehavior> behaviors) {
    if (behaviors == null || behaviors.isEmpty()) return NONE;
    Map<String, RowBehavior> copy = new LinkedHashMap<>();
    for (var e : behaviors.entrySet()) {
      copy.put(Objects.requireNonNull(e.getKey(), "behavior name"), Objects.requireNonNull(e.getValue(), e.getKey()));
    }
    return new ModelBehaviors(Collections.unmodifiableMap(copy));
  }

  public boolean isEmpty() { return byName.isEmpty(); }
  public boolean has(String name) { return byName.containsKey(name); }
  public Set<String> names() { return byName.keySet(); }

  public Object invoke(String name, Map<String, Object> row, Object... args) {
    RowBehavior b = byName.get(name);
    if (b == null) throw new IllegalArgumentException("Unknown behavior: " + name);
    return b.invoke(row, args);
  }
}

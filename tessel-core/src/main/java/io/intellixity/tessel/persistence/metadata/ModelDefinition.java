package io.intellixity.tessel.persistence.metadata;

import java.util.*;

/** Registration input for one model. Turned into {@link ModelMetadata} by {@link ModelRegistry}. */
public final class ModelDefinition {
  private final String name;
  private final String tableName;
  private final List<ColumnMetadata> columns;
  private final Map<String, RowBehavior> behaviors;
  private final ValuesHook beforeCreate;
  private final ValuesHook beforeUpdate;

  private ModelDefinition(Builder b) {
    this.name = b.name;
    this.tableName = (b.tableName == null || b.tableName.isBlank()) ? b.name.toLowerCase(Locale.ROOT) : b.tableName;
    this.columns = List.copyOf(b.columns);
    this.behaviors = Collections.unmodifiableMap(new LinkedHashMap<>(b.behaviors));
    this.beforeCreate = b.beforeCreate;
    this.beforeUpdate = b.beforeUpdate;
  }

  public String name() { return name; }
  public String tableName() { return tableName; }
  public List<ColumnMetadata> columns() { return columns; }
  public Map<String, RowBehavior> behaviors() { return behaviors; }
  public ValuesHook beforeCreate() { return beforeCreate; }
  public ValuesHook beforeUpdate() { return beforeUpdate; }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /** Used to attach behaviors and hooks to definitions loaded from model files. */
  public Builder toBuilder() {
    Builder b = new Builder(name).tableName(tableName);
    columns.forEach(b::column);
    behaviors.forEach(b::behavior);
    return b.beforeCreate(beforeCreate).beforeUpdate(beforeUpdate);
  }

  public static final class Builder {
    private final String name;
    private String tableName;
    private final List<ColumnMetadata> columns = new ArrayList<>();
    private final Map<String, RowBehavior> behaviors = new LinkedHashMap<>();
    private ValuesHook beforeCreate;
    private ValuesHook beforeUpdate;

    private Builder(String name) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("model name is blank");
      this.name = name;
    }

    public Builder tableName(String tableName) { this.tableName = tableName; return this; }
    public Builder column(ColumnMetadata column) { this.columns.add(Objects.requireNonNull(column, "column")); return this; }
    public Builder behavior(String name, RowBehavior behavior) { this.behaviors.put(name, behavior); return this; }
    public Builder beforeCreate(ValuesHook hook) { this.beforeCreate = hook; return this; }
    public Builder beforeUpdate(ValuesHook hook) { this.beforeUpdate = hook; return this; }

    public ModelDefinition build() {
      return new ModelDefinition(this);
    }
  }
}

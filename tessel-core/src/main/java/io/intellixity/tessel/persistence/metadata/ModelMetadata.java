package io.intellixity.tessel.persistence.metadata;

import java.util.*;

/** Immutable description of a registered model, shared by reference across repositories. */
public final class ModelMetadata {
  private final String name;
  private final String tableName;
  private final List<ColumnMetadata> columns;
  private final Map<String, ColumnMetadata> columnsByProperty;
  private final ScalarColumn primaryKey;
  private final List<ScalarColumn> createDateColumns;
  private final List<ScalarColumn> updateDateColumns;
  private final List<ScalarColumn> versionColumns;
  private final ModelBehaviors behaviors;
  private final ValuesHook beforeCreate;
  private final ValuesHook beforeUpdate;

  ModelMetadata(ModelDefinition def) {
    this.name = def.name();
    this.tableName = def.tableName();

    List<ColumnMetadata> cols = new ArrayList<>(def.columns());
    ScalarColumn pk = null;
    for (ColumnMetadata c : cols) {
      if (c instanceof ScalarColumn s && s.primaryKey()) {
        if (pk != null) {
          throw new ConfigurationException("Model " + name + " declares more than one primary key: "
              + pk.propertyName() + ", " + s.propertyName());
        }
        pk = s;
      }
    }
    if (pk == null) {
      int idIndex = -1;
      for (int i = 0; i < cols.size(); i++) {
        if ("id".equals(cols.get(i).propertyName())) idIndex = i;
      }
      if (idIndex < 0) {
        pk = ScalarColumn.of("id", ColumnType.INTEGER).primary();
        cols.add(0, pk);
      } else if (cols.get(idIndex) instanceof ScalarColumn s) {
        pk = s.primary();
        cols.set(idIndex, pk);
      } else {
        throw new ConfigurationException("Model " + name + " has no primary key and its 'id' property is a relation");
      }
    }
    this.primaryKey = pk;

    Map<String, ColumnMetadata> byProp = new LinkedHashMap<>();
    List<ScalarColumn> created = new ArrayList<>();
    List<ScalarColumn> updated = new ArrayList<>();
    List<ScalarColumn> versions = new ArrayList<>();
    for (ColumnMetadata c : cols) {
      if (byProp.putIfAbsent(c.propertyName(), c) != null) {
        throw new ConfigurationException("Model " + name + " declares property '" + c.propertyName() + "' twice");
      }
      if (c instanceof ScalarColumn s) {
        if (s.createDate()) created.add(s);
        if (s.updateDate()) updated.add(s);
        if (s.version()) versions.add(s);
      }
    }

    this.columns = List.copyOf(cols);
    this.columnsByProperty = Collections.unmodifiableMap(byProp);
    this.createDateColumns = List.copyOf(created);
    this.updateDateColumns = List.copyOf(updated);
    this.versionColumns = List.copyOf(versions);
    this.behaviors = ModelBehaviors.of(def.behaviors());
    this.beforeCreate = def.beforeCreate();
    this.beforeUpdate = def.beforeUpdate();
  }

  public String name() { return name; }
  public String tableName() { return tableName; }
  public List<ColumnMetadata> columns() { return columns; }
  public ScalarColumn primaryKey() { return primaryKey; }
  public List<ScalarColumn> createDateColumns() { return createDateColumns; }
  public List<ScalarColumn> updateDateColumns() { return updateDateColumns; }
  public List<ScalarColumn> versionColumns() { return versionColumns; }
  public ModelBehaviors behaviors() { return behaviors; }
  public ValuesHook beforeCreate() { return beforeCreate; }
  public ValuesHook beforeUpdate() { return beforeUpdate; }

  /** Column for a property, or null. */
  public ColumnMetadata column(String propertyName) {
    return columnsByProperty.get(propertyName);
  }

  public boolean hasColumn(String propertyName) {
    return columnsByProperty.containsKey(propertyName);
  }

  @Override
  public String toString() {
    return "ModelMetadata[" + name + " -> " + tableName + "]";
  }
}

package io.intellixity.tessel.persistence.metadata;

import java.util.Objects;
import java.util.function.Supplier;

public record ScalarColumn(String propertyName,
                           String columnName,
                           ColumnType type,
                           boolean primaryKey,
                           boolean required,
                           Supplier<?> defaultsTo,
                           boolean createDate,
                           boolean updateDate,
                           boolean version) implements ColumnMetadata {
  public ScalarColumn {
    Objects.requireNonNull(propertyName, "propertyName");
    Objects.requireNonNull(type, "type");
    columnName = (columnName == null || columnName.isBlank()) ? propertyName : columnName;
  }

  public static ScalarColumn of(String propertyName, ColumnType type) {
    return new ScalarColumn(propertyName, null, type, false, false, null, false, false, false);
  }

  public ScalarColumn named(String columnName) {
    return new ScalarColumn(propertyName, columnName, type, primaryKey, required, defaultsTo, createDate, updateDate, version);
  }

  public ScalarColumn primary() {
    return new ScalarColumn(propertyName, columnName, type, true, required, defaultsTo, createDate, updateDate, version);
  }

  public ScalarColumn asRequired() {
    return new ScalarColumn(propertyName, columnName, type, primaryKey, true, defaultsTo, createDate, updateDate, version);
  }

  public ScalarColumn defaultsTo(Object value) {
    return defaultsTo(() -> value);
  }

  /** Default computed per inserted row. */
  public ScalarColumn defaultsTo(Supplier<?> supplier) {
    return new ScalarColumn(propertyName, columnName, type, primaryKey, required, supplier, createDate, updateDate, version);
  }

  public ScalarColumn asCreateDate() {
    return new ScalarColumn(propertyName, columnName, type, primaryKey, required, defaultsTo, true, updateDate, version);
  }

  public ScalarColumn asUpdateDate() {
    return new ScalarColumn(propertyName, columnName, type, primaryKey, required, defaultsTo, createDate, true, version);
  }

  public ScalarColumn asVersion() {
    return new ScalarColumn(propertyName, columnName, type, primaryKey, required, defaultsTo, createDate, updateDate, true);
  }
}

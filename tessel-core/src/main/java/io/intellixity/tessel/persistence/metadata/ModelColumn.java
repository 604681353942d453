package io.intellixity.tessel.persistence.metadata;

import java.util.Objects;

/** Belongs-to relation: a foreign key holding the target model's primary key. */
public record ModelColumn(String propertyName, String columnName, String target, boolean required)
    implements ColumnMetadata {
  public ModelColumn {
    Objects.requireNonNull(propertyName, "propertyName");
    Objects.requireNonNull(target, "target");
    columnName = (columnName == null || columnName.isBlank()) ? propertyName : columnName;
  }

  public static ModelColumn of(String propertyName, String target) {
    return new ModelColumn(propertyName, null, target, false);
  }

  public ModelColumn named(String columnName) {
    return new ModelColumn(propertyName, columnName, target, required);
  }

  public ModelColumn asRequired() {
    return new ModelColumn(propertyName, columnName, target, true);
  }
}

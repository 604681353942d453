package io.intellixity.tessel.persistence.metadata;

/**
 * Column of a model: a scalar value, a foreign key to another model (belongs-to),
 * or a virtual collection resolved through another model.
 */
public sealed interface ColumnMetadata permits ScalarColumn, ModelColumn, CollectionColumn {
  String propertyName();

  /** Physical column name; null for collections, which have no column of their own. */
  String columnName();
}

package io.intellixity.tessel.persistence.metadata;

import java.util.Objects;

/**
 * One-to-many (no {@code through}) or many-to-many (with {@code through}) relation.
 * {@code via} is the property correlating rows back to the owner: on the target for one-to-many,
 * on the through model for many-to-many.
 */
public record CollectionColumn(String propertyName, String target, String via, String through)
    implements ColumnMetadata {
  public CollectionColumn {
    Objects.requireNonNull(propertyName, "propertyName");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(via, "via");
    through = (through == null || through.isBlank()) ? null : through;
  }

  public static CollectionColumn of(String propertyName, String target, String via) {
    return new CollectionColumn(propertyName, target, via, null);
  }

  public CollectionColumn through(String throughModel) {
    return new CollectionColumn(propertyName, target, via, throughModel);
  }

  public boolean manyToMany() { return through != null; }

  @Override public String columnName() { return null; }
}

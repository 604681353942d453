package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.CollectionColumn;
import io.intellixity.tessel.persistence.metadata.ColumnMetadata;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.query.SortTerm;
import io.intellixity.tessel.persistence.query.ValidationException;

import java.util.*;

import static io.intellixity.tessel.persistence.compile.Sql.quote;

/** Column projection and ORDER BY rendering shared by every statement kind. */
public final class Projection {
  private Projection() {}

  /**
   * {@code "col"} when column and property names match, otherwise {@code "col" AS "prop"}.
   * With an explicit select the primary key is always included; without one every non-collection column is.
   */
  public static String columns(ModelMetadata model, List<String> select) {
    Set<String> props = new LinkedHashSet<>();
    if (select != null) {
      props.addAll(select);
      props.add(model.primaryKey().propertyName());
    } else {
      for (ColumnMetadata c : model.columns()) {
        if (!(c instanceof CollectionColumn)) props.add(c.propertyName());
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String prop : props) {
      ColumnMetadata c = model.column(prop);
      if (c == null || c instanceof CollectionColumn) {
        throw new ValidationException("Unable to find column for property: " + prop + " on " + model.tableName());
      }
      if (sb.length() > 0) sb.append(',');
      if (c.columnName().equals(prop)) {
        sb.append(quote(prop));
      } else {
        sb.append(quote(c.columnName())).append(" AS ").append(quote(prop));
      }
    }
    return sb.toString();
  }

  /** {@code ORDER BY "a" DESC,"b"} or an empty string. */
  public static String orderBy(ModelMetadata model, List<SortTerm> sorts) {
    if (sorts == null || sorts.isEmpty()) return "";
    StringBuilder sb = new StringBuilder("ORDER BY ");
    for (int i = 0; i < sorts.size(); i++) {
      SortTerm s = sorts.get(i);
      ColumnMetadata c = model.column(s.property());
      if (c == null || c instanceof CollectionColumn) {
        throw new ValidationException("Property (" + s.property() + ") not found in model (" + model.name() + ").");
      }
      if (i > 0) sb.append(',');
      sb.append(quote(c.columnName()));
      if (s.descending()) sb.append(" DESC");
    }
    return sb.toString();
  }
}

package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.*;
import io.intellixity.tessel.persistence.query.ValidationException;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;

import static io.intellixity.tessel.persistence.compile.Sql.quote;

/**
 * {@code UPDATE "t" SET .. [WHERE ..] [RETURNING ..]}. SET parameters are numbered before WHERE parameters.
 * Update-date columns default to now. Every version column is incremented in place on every update, whether or not
 * {@code values} names it; a caller-supplied version value is ignored.
 */
public final class UpdateBuilder {
  private final WhereCompiler where;
  private final ValueEncoder encoder;
  private final Clock clock;

  UpdateBuilder(WhereCompiler where, ValueEncoder encoder, Clock clock) {
    this.where = where;
    this.encoder = encoder;
    this.clock = clock;
  }

  public SqlStatement update(ModelMetadata model, Map<String, ?> predicate, Map<String, ?> values,
                             boolean returnRecords, List<String> returnSelect) {
    Map<String, Object> set = new LinkedHashMap<>(Objects.requireNonNull(values, "values"));
    for (ScalarColumn c : model.updateDateColumns()) {
      if (!set.containsKey(c.propertyName())) set.put(c.propertyName(), OffsetDateTime.now(clock));
    }

    ParamList params = new ParamList();
    List<String> assignments = new ArrayList<>();
    for (var e : set.entrySet()) {
      ColumnMetadata column = model.column(e.getKey());
      if (column == null || column instanceof CollectionColumn) continue;
      if (column instanceof ScalarColumn s && s.version()) continue;
      assignments.add(quote(column.columnName()) + "=" + encoder.render(model, column, e.getValue(), params));
    }
    for (ScalarColumn v : model.versionColumns()) {
      String col = quote(v.columnName());
      assignments.add(col + "=" + col + "+1");
    }
    if (assignments.isEmpty()) {
      throw new ValidationException("Update statement for \"" + model.name() + "\" has no values to set");
    }

    StringBuilder sql = new StringBuilder("UPDATE ").append(quote(model.tableName()))
        .append(" SET ").append(String.join(",", assignments))
        .append(where.whereClause(model, predicate, params));
    if (returnRecords) sql.append(" RETURNING ").append(Projection.columns(model, returnSelect));
    return new SqlStatement(sql.toString(), params.values());
  }
}

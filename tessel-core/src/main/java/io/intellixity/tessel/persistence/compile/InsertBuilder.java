package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.*;
import io.intellixity.tessel.persistence.query.OnConflict;
import io.intellixity.tessel.persistence.query.ValidationException;
import io.intellixity.tessel.persistence.query.WriteOptions;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.function.Supplier;

import static io.intellixity.tessel.persistence.compile.Sql.quote;

/**
 * Multi-row INSERT.
 * <p>
 * The column list is every non-collection column (model order) that at least one row defines. Parameters are
 * column-major: all rows' values of the first column, then all rows' values of the second, and so on, so two rows
 * over two columns render {@code VALUES ($1,$3),($2,$4)}. Null values render as {@code NULL} and bind nothing.
 */
public final class InsertBuilder {
  private final WhereCompiler where;
  private final ValueEncoder encoder;
  private final Clock clock;

  InsertBuilder(WhereCompiler where, ValueEncoder encoder, Clock clock) {
    this.where = where;
    this.encoder = encoder;
    this.clock = clock;
  }

  /**
   * @param rows          values per row; not modified, defaults are applied to copies
   * @param returnRecords whether to append {@code RETURNING}
   */
  public SqlStatement insert(ModelMetadata model, List<? extends Map<String, ?>> rows, boolean returnRecords,
                             WriteOptions options) {
    if (rows == null || rows.isEmpty()) throw new IllegalArgumentException("rows is empty");
    WriteOptions opts = (options == null) ? WriteOptions.defaults() : options;
    OnConflict onConflict = opts.onConflict();

    List<Map<String, Object>> entities = new ArrayList<>(rows.size());
    for (Map<String, ?> r : rows) entities.add(new LinkedHashMap<>(Objects.requireNonNull(r, "row")));

    List<ColumnMetadata> insertColumns = new ArrayList<>();
    for (ColumnMetadata column : model.columns()) {
      if (column instanceof CollectionColumn) continue;
      String prop = column.propertyName();

      Supplier<?> defaults = defaultFor(column);
      Object defaultValue = null;
      boolean defaultResolved = false;
      boolean include = false;
      for (Map<String, Object> entity : entities) {
        if (!entity.containsKey(prop) && defaults != null) {
          if (!defaultResolved) {
            defaultValue = defaults.get();
            defaultResolved = true;
          }
          entity.put(prop, defaultValue);
        }
        if (entity.containsKey(prop)) {
          include = true;
        } else if (isRequired(column)) {
          throw new ValidationException("Create statement for \"" + model.name()
              + "\" is missing value for required field: " + prop);
        }
      }
      if (include) insertColumns.add(column);
    }
    if (insertColumns.isEmpty()) {
      throw new ValidationException("Create statement for \"" + model.name() + "\" has no values to insert");
    }

    ParamList params = new ParamList();
    List<List<String>> tuples = new ArrayList<>(entities.size());
    for (int i = 0; i < entities.size(); i++) tuples.add(new ArrayList<>(insertColumns.size()));

    StringBuilder sql = new StringBuilder("INSERT INTO ").append(quote(model.tableName())).append(" (");
    for (int ci = 0; ci < insertColumns.size(); ci++) {
      ColumnMetadata column = insertColumns.get(ci);
      if (ci > 0) sql.append(',');
      sql.append(quote(column.columnName()));
      for (int ei = 0; ei < entities.size(); ei++) {
        tuples.get(ei).add(encoder.render(model, column, entities.get(ei).get(column.propertyName()), params));
      }
    }
    sql.append(") VALUES ");
    for (int ei = 0; ei < tuples.size(); ei++) {
      if (ei > 0) sql.append(',');
      sql.append('(').append(String.join(",", tuples.get(ei))).append(')');
    }

    if (onConflict != null) appendOnConflict(sql, model, onConflict, params);
    if (returnRecords) sql.append(" RETURNING ").append(Projection.columns(model, opts.returnSelect()));
    return new SqlStatement(sql.toString(), params.values());
  }

  private void appendOnConflict(StringBuilder sql, ModelMetadata model, OnConflict onConflict, ParamList params) {
    for (String t : onConflict.targets()) requireColumn(model, t);
    if (onConflict.merge() != null) for (String m : onConflict.merge()) requireColumn(model, m);

    List<ColumnMetadata> targets = new ArrayList<>();
    List<ColumnMetadata> merge = new ArrayList<>();
    for (ColumnMetadata column : model.columns()) {
      if (column instanceof CollectionColumn) continue;
      if (onConflict.targets().contains(column.propertyName())) targets.add(column);
      if (onConflict.action() == OnConflict.Action.MERGE) {
        if (onConflict.merge() != null) {
          if (onConflict.merge().contains(column.propertyName())) merge.add(column);
        } else if (!(column instanceof ScalarColumn s && (s.createDate() || s.primaryKey()))) {
          merge.add(column);
        }
      }
    }

    sql.append(" ON CONFLICT (");
    for (int i = 0; i < targets.size(); i++) {
      if (i > 0) sql.append(',');
      sql.append(quote(targets.get(i).columnName()));
    }
    sql.append(')');
    sql.append(where.whereClause(model, onConflict.targetWhere(), params));

    if (onConflict.action() == OnConflict.Action.IGNORE || merge.isEmpty()) {
      sql.append(" DO NOTHING");
      return;
    }
    sql.append(" DO UPDATE SET ");
    for (int i = 0; i < merge.size(); i++) {
      ColumnMetadata column = merge.get(i);
      String col = quote(column.columnName());
      if (i > 0) sql.append(',');
      if (column instanceof ScalarColumn s && s.version()) {
        sql.append(col).append('=').append(col).append("+1");
      } else {
        sql.append(col).append("=EXCLUDED.").append(col);
      }
    }
    sql.append(where.whereClause(model, onConflict.mergeWhere(), params));
  }

  private static void requireColumn(ModelMetadata model, String property) {
    ColumnMetadata c = model.column(property);
    if (c == null || c instanceof CollectionColumn) {
      throw new ValidationException("Unable to find column for property: " + property + " on " + model.tableName());
    }
  }

  private Supplier<?> defaultFor(ColumnMetadata column) {
    if (!(column instanceof ScalarColumn s)) return null;
    if (s.defaultsTo() != null) return s.defaultsTo();
    if (s.createDate() || s.updateDate()) return () -> OffsetDateTime.now(clock);
    if (s.version()) return () -> 1;
    return null;
  }

  private static boolean isRequired(ColumnMetadata column) {
    if (column instanceof ScalarColumn s) return s.required();
    if (column instanceof ModelColumn mc) return mc.required();
    return false;
  }
}

package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.ModelMetadata;

import java.util.List;
import java.util.Map;

import static io.intellixity.tessel.persistence.compile.Sql.quote;

/** {@code DELETE FROM "t" [WHERE ..] [RETURNING ..]}; no predicate deletes every row. */
public final class DeleteBuilder {
  private final WhereCompiler where;

  DeleteBuilder(WhereCompiler where) {
    this.where = where;
  }

  public SqlStatement delete(ModelMetadata model, Map<String, ?> predicate, boolean returnRecords,
                             List<String> returnSelect) {
    ParamList params = new ParamList();
    StringBuilder sql = new StringBuilder("DELETE FROM ").append(quote(model.tableName()))
        .append(where.whereClause(model, predicate, params));
    if (returnRecords) sql.append(" RETURNING ").append(Projection.columns(model, returnSelect));
    return new SqlStatement(sql.toString(), params.values());
  }
}

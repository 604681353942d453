package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.query.Criteria;

import java.util.Map;
import java.util.Objects;

import static io.intellixity.tessel.persistence.compile.Sql.quote;

/** SELECT and COUNT statements. */
public final class SelectBuilder {
  private final WhereCompiler where;

  public SelectBuilder(WhereCompiler where) {
    this.where = Objects.requireNonNull(where, "where");
  }

  public SqlStatement select(ModelMetadata model, Criteria criteria) {
    Criteria c = (criteria == null) ? Criteria.empty() : criteria;
    ParamList params = new ParamList();
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(Projection.columns(model, c.select()))
        .append(" FROM ").append(quote(model.tableName()))
        .append(where.whereClause(model, c.where(), params));

    String order = Projection.orderBy(model, c.sorts());
    if (!order.isEmpty()) sql.append(' ').append(order);
    if (c.limit() != null && c.limit() > 0) sql.append(" LIMIT ").append(c.limit());
    if (c.skip() != null && c.skip() > 0) sql.append(" OFFSET ").append(c.skip());
    return new SqlStatement(sql.toString(), params.values());
  }

  public SqlStatement count(ModelMetadata model, Map<String, ?> predicate) {
    ParamList params = new ParamList();
    String sql = "SELECT count(*) AS \"count\" FROM " + quote(model.tableName())
        + where.whereClause(model, predicate, params);
    return new SqlStatement(sql, params.values());
  }
}

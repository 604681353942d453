package io.intellixity.tessel.persistence.exec;

import java.util.List;
import java.util.Map;

/** Rows keyed by result column label, and the affected row count reported by the driver. */
public record QueryResult(List<Map<String, Object>> rows, long rowCount) {
  public QueryResult {
    rows = (rows == null) ? List.of() : rows;
  }

  public static QueryResult of(List<Map<String, Object>> rows) {
    return new QueryResult(rows, rows == null ? 0 : rows.size());
  }
}

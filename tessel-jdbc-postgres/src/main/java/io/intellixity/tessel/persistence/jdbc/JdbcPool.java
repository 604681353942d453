package io.intellixity.tessel.persistence.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessel.persistence.exec.Pool;
import io.intellixity.tessel.persistence.exec.QueryResult;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link Pool} over a JDBC {@link DataSource}. Each statement borrows a connection on {@code executor}, so callers
 * never block on JDBC.
 * <p>
 * bigint and numeric columns are read as text; the row materializer decides whether they convert to numbers
 * without loss.
 */
public final class JdbcPool implements Pool {
  private static final Logger log = LoggerFactory.getLogger(JdbcPool.class);

  private static final Set<String> TEXT_NUMERIC_TYPES = Set.of("int8", "bigint", "bigserial", "numeric", "decimal");
  private static final Map<String, String> PG_ELEM_TYPES = Map.of(
      "integer", "int4",
      "int", "int4",
      "bigint", "int8",
      "numeric", "numeric",
      "boolean", "bool",
      "text", "text",
      "uuid", "uuid"
  );

  private final String id;
  private final DataSource dataSource;
  private final Executor executor;
  private final ObjectMapper json;

  public JdbcPool(String id, DataSource dataSource, Executor executor, ObjectMapper json) {
    this.id = Objects.requireNonNull(id, "id");
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.json = Objects.requireNonNull(json, "json");
  }

  public String id() { return id; }

  @Override
  public CompletableFuture<QueryResult> execute(String text, List<Object> params) {
    return CompletableFuture.supplyAsync(() -> run(text, params == null ? List.of() : params), executor);
  }

  private QueryResult run(String text, List<Object> params) {
    PlaceholderRewriter.Rewritten rewritten = PlaceholderRewriter.rewrite(text);
    debugSql(rewritten, params);
    try (Connection c = dataSource.getConnection();
         PreparedStatement ps = c.prepareStatement(rewritten.sql())) {
      List<Integer> indexes = rewritten.paramIndexes();
      for (int i = 0; i < indexes.size(); i++) {
        int index = indexes.get(i);
        if (index >= params.size()) {
          throw new IllegalArgumentException("Placeholder $" + (index + 1) + " has no parameter; got " + params.size());
        }
        bind(c, ps, i + 1, params.get(index), rewritten.arrayTypes().get(index));
      }

      if (!ps.execute()) return new QueryResult(List.of(), ps.getUpdateCount());
      try (ResultSet rs = ps.getResultSet()) {
        List<Map<String, Object>> rows = readAll(rs);
        return new QueryResult(rows, rows.size());
      }
    } catch (SQLException e) {
      log.debug("tessel.jdbc op=execute poolId={} failed sqlState={}", id, e.getSQLState());
      throw new JdbcExecutionException("Statement failed on pool " + id + ": " + e.getMessage(), e);
    }
  }

  private void bind(Connection c, PreparedStatement ps, int pos, Object value, String castElementType) throws SQLException {
    if (value == null) {
      ps.setNull(pos, Types.OTHER);
      return;
    }
    if (value instanceof Collection<?> || value instanceof Object[]) {
      Object[] elements = (value instanceof Collection<?> col) ? col.toArray() : (Object[]) value;
      String elementType = (castElementType != null)
          ? PG_ELEM_TYPES.getOrDefault(castElementType, castElementType)
          : inferElementType(elements);
      Array array = c.createArrayOf(elementType, elements);
      ps.setArray(pos, array);
      return;
    }
    if (value instanceof Map<?, ?> m) {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      try {
        obj.setValue(json.writeValueAsString(m));
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Failed to encode jsonb parameter at position " + pos, e);
      }
      ps.setObject(pos, obj);
      return;
    }
    ps.setObject(pos, value);
  }

  /** Postgres element type for an untyped list: the narrowest type every non-null element fits, else text. */
  static String inferElementType(Object[] elements) {
    String type = null;
    for (Object e : elements) {
      if (e == null) continue;
      String t;
      if (e instanceof Integer || e instanceof Short) t = "int4";
      else if (e instanceof Long) t = "int8";
      else if (e instanceof Number) t = "numeric";
      else if (e instanceof Boolean) t = "bool";
      else if (e instanceof UUID) t = "uuid";
      else t = "text";

      if (type == null) {
        type = t;
      } else if (!type.equals(t)) {
        boolean bothNumeric = isNumeric(type) && isNumeric(t);
        if (!bothNumeric) return "text";
        type = widen(type, t);
      }
    }
    return (type == null) ? "text" : type;
  }

  private static boolean isNumeric(String t) {
    return t.equals("int4") || t.equals("int8") || t.equals("numeric");
  }

  private static String widen(String a, String b) {
    if (a.equals("numeric") || b.equals("numeric")) return "numeric";
    return "int8";
  }

  private List<Map<String, Object>> readAll(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int n = md.getColumnCount();
    String[] labels = new String[n];
    String[] typeNames = new String[n];
    for (int i = 1; i <= n; i++) {
      labels[i - 1] = md.getColumnLabel(i);
      typeNames[i - 1] = md.getColumnTypeName(i) == null ? "" : md.getColumnTypeName(i).toLowerCase(Locale.ROOT);
    }

    List<Map<String, Object>> rows = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> row = new LinkedHashMap<>();
      for (int i = 1; i <= n; i++) row.put(labels[i - 1], read(rs, i, typeNames[i - 1], labels[i - 1]));
      rows.add(row);
    }
    return rows;
  }

  private Object read(ResultSet rs, int i, String typeName, String label) throws SQLException {
    if (readsAsText(typeName)) return rs.getString(i);
    if (typeName.equals("json") || typeName.equals("jsonb")) {
      String raw = rs.getString(i);
      if (raw == null) return null;
      try {
        return json.readValue(raw, Object.class);
      } catch (JsonProcessingException e) {
        throw new IllegalArgumentException("Failed to decode JSON column '" + label + "'", e);
      }
    }
    Object v = rs.getObject(i);
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] oa) return new ArrayList<>(Arrays.asList(oa));
      throw new IllegalArgumentException("Unsupported array value for column '" + label + "': " + arr.getClass());
    }
    return v;
  }

  static boolean readsAsText(String typeName) {
    return typeName != null && TEXT_NUMERIC_TYPES.contains(typeName.toLowerCase(Locale.ROOT));
  }

  private void debugSql(PlaceholderRewriter.Rewritten rewritten, List<Object> params) {
    if (!log.isDebugEnabled()) return;
    log.debug("tessel.jdbc op=execute poolId={} bindCount={} sql={}", id, rewritten.paramIndexes().size(), rewritten.sql());

    // bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int pos = 1;
      for (int index : rewritten.paramIndexes()) {
        Object v = (index < params.size()) ? params.get(index) : null;
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : (v instanceof Collection<?> col) ? col.size() : -1;
        log.trace("tessel.jdbc bind index={} param=${} valueType={} valueLen={}", pos++, index + 1, vType, vLen);
      }
    }
  }
}

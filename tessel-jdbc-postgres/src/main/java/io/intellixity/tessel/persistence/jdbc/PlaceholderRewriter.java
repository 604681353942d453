package io.intellixity.tessel.persistence.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Rewrites Postgres positional placeholders ({@code $1}, {@code $2}) into JDBC {@code ?} binds.
 *
 * Rules:
 * - Placeholders inside single-quoted literals and double-quoted identifiers are left alone.
 * - {@code ::} is a cast and is copied through.
 * - A placeholder may repeat; each occurrence becomes its own {@code ?}.
 * - A following {@code ::TYPE[]} cast records TYPE as the array element type of that parameter.
 */
public final class PlaceholderRewriter {
  private PlaceholderRewriter() {}

  /**
   * @param sql          JDBC SQL
   * @param paramIndexes 0-based index into the original params, one per {@code ?} in order
   * @param arrayTypes   lowercase element type per 0-based param index, for params cast to an array
   */
  public record Rewritten(String sql, List<Integer> paramIndexes, Map<Integer, String> arrayTypes) {
    public Rewritten {
      paramIndexes = List.copyOf(paramIndexes);
      arrayTypes = Collections.unmodifiableMap(new HashMap<>(arrayTypes));
    }
  }

  public static Rewritten rewrite(String sql) {
    if (sql == null) return new Rewritten("", List.of(), Map.of());
    StringBuilder out = new StringBuilder(sql.length());
    List<Integer> indexes = new ArrayList<>();
    Map<Integer, String> arrayTypes = new HashMap<>();
    boolean inSingleQuote = false;
    boolean inDoubleQuote = false;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' && !inDoubleQuote) {
        // '' inside a literal is an escaped quote
        if (inSingleQuote && i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
          out.append("''");
          i++;
          continue;
        }
        inSingleQuote = !inSingleQuote;
        out.append(ch);
        continue;
      }
      if (ch == '"' && !inSingleQuote) {
        inDoubleQuote = !inDoubleQuote;
        out.append(ch);
        continue;
      }
      if (inSingleQuote || inDoubleQuote) {
        out.append(ch);
        continue;
      }

      if (ch == ':' && i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
        out.append("::");
        i++;
        continue;
      }

      if (ch == '$' && i + 1 < sql.length() && isDigit(sql.charAt(i + 1))) {
        int end = i + 1;
        while (end < sql.length() && isDigit(sql.charAt(end))) end++;
        int index = Integer.parseInt(sql.substring(i + 1, end)) - 1;
        if (index < 0) throw new IllegalArgumentException("Invalid placeholder $0 at offset " + i);
        indexes.add(index);
        out.append('?');

        String elementType = arrayCast(sql, end);
        if (elementType != null) arrayTypes.putIfAbsent(index, elementType);
        i = end - 1;
        continue;
      }

      out.append(ch);
    }

    if (inSingleQuote) throw new IllegalArgumentException("Unterminated string literal in SQL");
    return new Rewritten(out.toString(), indexes, arrayTypes);
  }

  /** Element type of a {@code ::TYPE[]} cast starting at {@code from}, or null. */
  private static String arrayCast(String sql, int from) {
    if (!sql.startsWith("::", from)) return null;
    int start = from + 2;
    int end = start;
    while (end < sql.length() && (Character.isLetterOrDigit(sql.charAt(end)) || sql.charAt(end) == '_')) end++;
    if (end == start || !sql.startsWith("[]", end)) return null;
    return sql.substring(start, end).toLowerCase(Locale.ROOT);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}

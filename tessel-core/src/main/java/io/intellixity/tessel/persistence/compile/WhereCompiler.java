package io.intellixity.tessel.persistence.compile;

import io.intellixity.tessel.persistence.metadata.*;
import io.intellixity.tessel.persistence.query.ValidationException;

import java.util.*;

import static io.intellixity.tessel.persistence.compile.Sql.quote;

/**
 * Compiles a predicate map into a SQL boolean expression, appending bound values to a running {@link ParamList}.
 * <p>
 * Grammar:
 * <ul>
 *   <li>{@code prop: scalar} equality, {@code prop: null} IS NULL</li>
 *   <li>{@code prop: [..]} membership, {@code "c"=ANY($n::TYPE[])} with the list bound as one parameter</li>
 *   <li>{@code prop: {op: v}} with op one of {@code ! not < <= > >= like contains startsWith endsWith}</li>
 *   <li>{@code or: [p1, p2]} and {@code and: [p1, p2]}, each branch an AND-ed predicate, nestable</li>
 * </ul>
 * Top-level keys are AND-ed in map order; placeholders are numbered in emission order.
 */
public final class WhereCompiler {
  private static final Set<String> COMPARERS = Set.of(
      "!", "not", "or", "and", "contains", "startsWith", "endsWith", "like", "<", "<=", ">", ">=");

  private final ModelRegistry registry;

  public WhereCompiler(ModelRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /** Returns the boolean expression without the WHERE keyword, or an empty string for an empty predicate. */
  public String compile(ModelMetadata model, Map<String, ?> where, ParamList params) {
    if (where == null || where.isEmpty()) return "";
    return build(model, null, null, false, where, params);
  }

  /** {@code " WHERE <expr>"} or an empty string. */
  String whereClause(ModelMetadata model, Map<String, ?> where, ParamList params) {
    String expr = compile(model, where, params);
    return expr.isEmpty() ? "" : " WHERE " + expr;
  }

  private String build(ModelMetadata model, String property, String comparer, boolean negated,
                       Object value, ParamList params) {
    String op = (comparer != null) ? comparer : property;
    if (op != null) {
      switch (op) {
        case "!", "not" -> {
          return build(model, property, null, true, value, params);
        }
        case "or" -> {
          return group(model, negated, value, params, true);
        }
        case "and" -> {
          if (asList(value) != null) return group(model, negated, value, params, false);
        }
        case "contains" -> {
          return like(model, property, negated, pattern(model, property, op, value, "%", "%"), params);
        }
        case "startsWith" -> {
          return like(model, property, negated, pattern(model, property, op, value, "", "%"), params);
        }
        case "endsWith" -> {
          return like(model, property, negated, pattern(model, property, op, value, "%", ""), params);
        }
        case "like" -> {
          return like(model, property, negated, value, params);
        }
        default -> {
        }
      }
    }

    if (property != null && value instanceof Map<?, ?> m) {
      Object collapsed = collapseHydrated(model, property, m);
      if (collapsed != null) return build(model, property, comparer, negated, collapsed, params);
    }

    List<?> list = asList(value);
    if (list != null) return membership(model, property, negated, list, params);

    if (value instanceof Map<?, ?> m) {
      List<String> terms = new ArrayList<>();
      for (var e : m.entrySet()) {
        String key = String.valueOf(e.getKey());
        String term = COMPARERS.contains(key)
            ? build(model, property, key, negated, e.getValue(), params)
            : build(model, key, null, negated, e.getValue(), params);
        if (!term.isEmpty()) terms.add(term);
      }
      return String.join(" AND ", terms);
    }

    return comparison(model, property, comparer, negated, value, params);
  }

  private String group(ModelMetadata model, boolean negated, Object value, ParamList params, boolean or) {
    List<?> branches = asList(value);
    if (branches == null) {
      throw new ValidationException("Expected an array of predicates for \"" + (or ? "or" : "and") + "\" on " + model.name());
    }
    if (branches.isEmpty()) return (or == negated) ? "1=1" : "1<>1";

    List<String> clauses = new ArrayList<>(branches.size());
    for (Object b : branches) {
      if (!(b instanceof Map<?, ?>)) {
        throw new ValidationException("Each \"" + (or ? "or" : "and") + "\" branch must be an object on " + model.name());
      }
      clauses.add("(" + build(model, null, null, negated, b, params) + ")");
    }
    if (clauses.size() == 1) return clauses.get(0);
    // negation is pushed to the leaves, so the connective flips
    boolean joinWithOr = or != negated;
    return "(" + String.join(joinWithOr ? " OR " : " AND ", clauses) + ")";
  }

  private Object collapseHydrated(ModelMetadata model, String property, Map<?, ?> value) {
    ColumnMetadata column = model.column(property);
    if (column instanceof ScalarColumn s && s.primaryKey()) {
      return value.get(s.propertyName());
    }
    if (column instanceof ModelColumn mc) {
      return value.get(registry.target(mc).primaryKey().propertyName());
    }
    return null;
  }

  private String membership(ModelMetadata model, String property, boolean negated, List<?> values, ParamList params) {
    ColumnMetadata column = filterable(model, property);
    ColumnType type = typeOf(column);

    if (values.isEmpty()) {
      if (type != null && type.isArray()) {
        return quote(column.columnName()) + (negated ? "<>" : "=") + "'{}'";
      }
      return negated ? "1=1" : "1<>1";
    }

    List<String> terms = new ArrayList<>();
    List<Object> remaining = new ArrayList<>();
    for (Object item : values) {
      if (item == null || "".equals(item)) {
        terms.add(comparison(model, property, null, negated, item, params));
      } else {
        remaining.add(item);
      }
    }

    if (!remaining.isEmpty()) {
      if (type != null && type.isArray()) {
        for (Object item : remaining) terms.add(comparison(model, property, null, negated, item, params));
      } else {
        String cast = (type == null) ? "::TEXT[]" : type.arrayCast();
        String ph = params.add(remaining);
        terms.add(quote(column.columnName()) + (negated ? "<>ALL(" : "=ANY(") + ph + cast + ")");
      }
    }

    if (terms.size() == 1) return terms.get(0);
    if (negated) return String.join(" AND ", terms);
    return "(" + String.join(" OR ", terms) + ")";
  }

  private String like(ModelMetadata model, String property, boolean negated, Object value, ParamList params) {
    List<?> list = asList(value);
    if (list != null) {
      if (list.isEmpty()) return negated ? "1=1" : "1<>1";
      if (list.size() > 1) {
        List<String> terms = new ArrayList<>(list.size());
        for (Object item : list) terms.add(like(model, property, negated, item, params));
        if (negated) return String.join(" AND ", terms);
        return "(" + String.join(" OR ", terms) + ")";
      }
      value = list.get(0);
    }

    ColumnMetadata column = filterable(model, property);
    String col = quote(column.columnName());
    if (value == null) return col + (negated ? " IS NOT NULL" : " IS NULL");
    if (!(value instanceof String s)) {
      throw new ValidationException("Expected value to be a string for \"like\" constraint. Property ("
          + property + ") in model (" + model.name() + ").");
    }
    if (s.isEmpty()) return col + (negated ? " != ''" : " = ''");

    String ph = params.add(s);
    ColumnType type = typeOf(column);
    if (type == ColumnType.ARRAY || type == ColumnType.STRING_ARRAY) {
      String unnested = quote("unnested_" + column.columnName());
      return (negated ? "NOT " : "") + "EXISTS(SELECT 1 FROM (SELECT unnest(" + col + ") AS " + unnested
          + ") __unnested WHERE " + unnested + " ILIKE " + ph + ")";
    }
    return col + (negated ? " NOT ILIKE " : " ILIKE ") + ph;
  }

  private static Object pattern(ModelMetadata model, String property, String op, Object value, String prefix, String suffix) {
    List<?> list = asList(value);
    if (list != null) {
      List<String> out = new ArrayList<>(list.size());
      for (Object item : list) {
        if (!(item instanceof String s)) {
          throw new ValidationException("Expected all array values to be strings for \"" + op + "\" constraint. Property ("
              + property + ") in model (" + model.name() + ").");
        }
        out.add(prefix + s + suffix);
      }
      return out;
    }
    if (value instanceof String s) return prefix + s + suffix;
    throw new ValidationException("Expected value to be a string for \"" + op + "\" constraint. Property ("
        + property + ") in model (" + model.name() + ").");
  }

  private String comparison(ModelMetadata model, String property, String comparer, boolean negated,
                            Object value, ParamList params) {
    ColumnMetadata column = filterable(model, property);
    String col = quote(column.columnName());
    if (value == null) return col + (negated ? " IS NOT NULL" : " IS NULL");

    ColumnType type = typeOf(column);
    if (comparer != null && (type == ColumnType.ARRAY || type == ColumnType.JSON)) {
      throw new ValidationException(comparer + " operator is not supported for " + type.id() + " type. "
          + property + " on " + model.name());
    }

    String ph = params.add(value);
    if (comparer == null) {
      if (type != null && type.isArray()) return ph + (negated ? "<>ALL(" : "=ANY(") + col + ")";
      return col + (negated ? "<>" : "=") + ph;
    }
    return switch (comparer) {
      case "<" -> col + (negated ? ">=" : "<") + ph;
      case "<=" -> col + (negated ? ">" : "<=") + ph;
      case ">" -> col + (negated ? "<=" : ">") + ph;
      case ">=" -> col + (negated ? "<" : ">=") + ph;
      default -> throw new ValidationException("Unsupported comparer '" + comparer + "' for " + property + " on " + model.name());
    };
  }

  private static ColumnMetadata filterable(ModelMetadata model, String property) {
    if (property == null) throw new ValidationException("Predicate value without a property on " + model.name());
    ColumnMetadata column = model.column(property);
    if (column == null) {
      throw new ValidationException("Unable to find property " + property + " on model " + model.name());
    }
    if (column instanceof CollectionColumn) {
      throw new ValidationException("Cannot filter on collection property " + property + " of model " + model.name());
    }
    return column;
  }

  /** Scalar type of a column; belongs-to columns take the target's primary-key type. */
  private ColumnType typeOf(ColumnMetadata column) {
    if (column instanceof ScalarColumn s) return s.type();
    if (column instanceof ModelColumn mc) return registry.target(mc).primaryKey().type();
    return null;
  }

  static List<?> asList(Object value) {
    if (value instanceof List<?> l) return l;
    if (value instanceof Collection<?> c) return new ArrayList<>(c);
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
      int n = java.lang.reflect.Array.getLength(value);
      List<Object> out = new ArrayList<>(n);
      for (int i = 0; i < n; i++) out.add(java.lang.reflect.Array.get(value, i));
      return out;
    }
    return null;
  }
}

package io.intellixity.tessel.persistence.query;

import java.util.*;

/**
 * Turns caller input into {@link Criteria}.
 * <p>
 * Input is either structured args ({@code select/where/sort/skip/limit}) or a bare predicate. A map whose keys are
 * all arg names is structured args; any other map is the predicate itself. Typed callers should prefer
 * {@link #fromArgs(Map)} and {@link #fromWhere(Map)}; {@link #normalize(Object)} exists for the polymorphic
 * outer boundary.
 */
public final class CriteriaNormalizer {
  public static final Set<String> ARG_KEYS = Set.of("select", "where", "sort", "skip", "limit");

  static final String STRING_PREDICATE = "The query cannot be a string, it must be an object";

  public Criteria normalize(Object input) {
    if (input == null) return Criteria.empty();
    if (input instanceof Criteria c) return c;
    if (input instanceof CharSequence) throw new ValidationException(STRING_PREDICATE);
    if (!(input instanceof Map<?, ?> m)) {
      throw new ValidationException("Expected criteria map but got: " + input.getClass().getName());
    }
    Map<String, Object> map = stringKeys(m);
    return isArgs(map) ? fromArgs(map) : fromWhere(map);
  }

  public static boolean isArgs(Map<String, ?> input) {
    return ARG_KEYS.containsAll(input.keySet());
  }

  public Criteria fromArgs(Map<String, ?> args) {
    if (args == null) return Criteria.empty();
    for (String k : args.keySet()) {
      if (!ARG_KEYS.contains(k)) throw new ValidationException("Unknown criteria argument: " + k);
    }
    return new Criteria(
        select(args.get("select")),
        where(args.get("where")),
        parseSort(args.get("sort")),
        nonNegative("skip", args.get("skip")),
        nonNegative("limit", args.get("limit")));
  }

  public Criteria fromWhere(Map<String, ?> where) {
    return new Criteria(null, where(where), null, null, null);
  }

  /** Validates a predicate value and returns an ordered copy; null becomes an empty predicate. */
  public Map<String, Object> where(Object where) {
    if (where == null) return new LinkedHashMap<>();
    if (where instanceof CharSequence) throw new ValidationException(STRING_PREDICATE);
    if (!(where instanceof Map<?, ?> m)) {
      throw new ValidationException("The query must be an object but got: " + where.getClass().getName());
    }
    return stringKeys(m);
  }

  public List<String> select(Object select) {
    if (select == null) return null;
    List<String> out = new ArrayList<>();
    if (select instanceof String[] arr) {
      out.addAll(Arrays.asList(arr));
    } else if (select instanceof Collection<?> c) {
      for (Object o : c) {
        if (!(o instanceof String s)) throw new ValidationException("select must contain property names, got: " + o);
        out.add(s);
      }
    } else {
      throw new ValidationException("select must be a list of property names");
    }
    return out;
  }

  /**
   * Accepts {@code "name"}, {@code "name desc"}, {@code "name asc, id desc"}, a map of property to direction
   * ({@code 1}, {@code -1}, {@code "asc"}, {@code "desc"}), a {@link SortTerm}, or a list of any of these.
   */
  public List<SortTerm> parseSort(Object sort) {
    List<SortTerm> out = new ArrayList<>();
    appendSort(sort, out);
    return out;
  }

  private void appendSort(Object sort, List<SortTerm> out) {
    if (sort == null) return;
    if (sort instanceof SortTerm st) {
      out.add(st);
    } else if (sort instanceof CharSequence cs) {
      for (String part : cs.toString().split(",")) {
        String p = part.trim();
        if (p.isEmpty()) continue;
        String[] tokens = p.split("\\s+");
        if (tokens.length > 2) throw new ValidationException("Invalid sort: " + p);
        SortTerm.Direction dir = tokens.length == 2 ? direction(tokens[1], p) : SortTerm.Direction.ASC;
        out.add(new SortTerm(tokens[0], dir));
      }
    } else if (sort instanceof Map<?, ?> m) {
      for (var e : m.entrySet()) {
        out.add(new SortTerm(String.valueOf(e.getKey()), direction(e.getValue(), String.valueOf(e.getKey()))));
      }
    } else if (sort instanceof Collection<?> c) {
      for (Object o : c) appendSort(o, out);
    } else if (sort instanceof Object[] arr) {
      for (Object o : arr) appendSort(o, out);
    } else {
      throw new ValidationException("Unsupported sort value: " + sort);
    }
  }

  private static SortTerm.Direction direction(Object v, String context) {
    if (v == null) return SortTerm.Direction.ASC;
    if (v instanceof Number n) return n.doubleValue() < 0 ? SortTerm.Direction.DESC : SortTerm.Direction.ASC;
    String s = v.toString().trim().toLowerCase(Locale.ROOT);
    if (s.contains("desc")) return SortTerm.Direction.DESC;
    if (s.isEmpty() || s.contains("asc")) return SortTerm.Direction.ASC;
    throw new ValidationException("Invalid sort direction '" + v + "' for " + context);
  }

  static Integer nonNegative(String name, Object v) {
    if (v == null) return null;
    if (!(v instanceof Number n)) throw new ValidationException(name + " must be a number, got: " + v);
    double d = n.doubleValue();
    if (d != Math.rint(d) || Double.isInfinite(d)) throw new ValidationException(name + " must be an integer, got: " + v);
    if (d < 0) throw new ValidationException(name + " must not be negative, got: " + v);
    if (d > Integer.MAX_VALUE) throw new ValidationException(name + " is too large: " + v);
    return (int) d;
  }

  private static Map<String, Object> stringKeys(Map<?, ?> m) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      if (!(e.getKey() instanceof String k)) throw new ValidationException("Predicate keys must be strings, got: " + e.getKey());
      out.put(k, e.getValue());
    }
    return out;
  }
}

package io.intellixity.tessel.persistence.query;

import java.util.*;

/**
 * Helpers for building ordered predicate maps.
 *
 * <pre>
 * Where.of("name", Where.startsWith("foo"),
 *          "or", Where.anyOf(Where.of("sku", "a"), Where.of("store", 3)))
 * </pre>
 */
public final class Where {
  private Where() {}

  /** Ordered map from alternating keys and values. Values may be null (IS NULL). */
  public static Map<String, Object> of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) throw new IllegalArgumentException("Expected key/value pairs");
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      if (!(keysAndValues[i] instanceof String k)) throw new IllegalArgumentException("Key must be a string: " + keysAndValues[i]);
      out.put(k, keysAndValues[i + 1]);
    }
    return out;
  }

  /** Value for an {@code or} or {@code and} key. */
  @SafeVarargs
  public static List<Map<String, ?>> anyOf(Map<String, ?>... branches) {
    return List.of(branches);
  }

  public static Map<String, Object> not(Object value) { return single("!", value); }
  public static Map<String, Object> lt(Object value) { return single("<", value); }
  public static Map<String, Object> le(Object value) { return single("<=", value); }
  public static Map<String, Object> gt(Object value) { return single(">", value); }
  public static Map<String, Object> ge(Object value) { return single(">=", value); }

  public static Map<String, Object> like(Object value) { return single("like", value); }
  public static Map<String, Object> contains(Object value) { return single("contains", value); }
  public static Map<String, Object> startsWith(Object value) { return single("startsWith", value); }
  public static Map<String, Object> endsWith(Object value) { return single("endsWith", value); }

  private static Map<String, Object> single(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(key, value);
    return m;
  }
}

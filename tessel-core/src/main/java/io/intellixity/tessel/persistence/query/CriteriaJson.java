package io.intellixity.tessel.persistence.query;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.*;

/**
 * Reads criteria from JSON, e.g. {@code {"where":{"name":{"startsWith":"a"}},"sort":"name desc","limit":10}}
 * or a bare predicate. Object key order is preserved so parameter numbering matches the document.
 */
public final class CriteriaJson {
  private final ObjectMapper mapper;
  private final CriteriaNormalizer normalizer;

  public CriteriaJson() {
    this(new ObjectMapper(), new CriteriaNormalizer());
  }

  public CriteriaJson(ObjectMapper mapper, CriteriaNormalizer normalizer) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  public Criteria read(String json) {
    JsonNode root;
    try {
      root = mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Invalid criteria JSON: " + e.getOriginalMessage(), e);
    }
    return normalizer.normalize(toJava(root));
  }

  private static Object toJava(JsonNode n) {
    if (n == null || n.isNull() || n.isMissingNode()) return null;
    if (n.isObject()) {
      Map<String, Object> m = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> it = n.fields();
      while (it.hasNext()) {
        var e = it.next();
        m.put(e.getKey(), toJava(e.getValue()));
      }
      return m;
    }
    if (n.isArray()) {
      List<Object> l = new ArrayList<>(n.size());
      for (JsonNode x : n) l.add(toJava(x));
      return l;
    }
    if (n.isIntegralNumber()) return n.canConvertToLong() ? (Object) n.longValue() : n.bigIntegerValue();
    if (n.isNumber()) return n.doubleValue();
    if (n.isBoolean()) return n.booleanValue();
    return n.asText();
  }
}

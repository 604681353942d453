package io.intellixity.tessel.persistence.metadata.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessel.persistence.metadata.*;

/** Turns one entry of a model file's {@code columns} map into column metadata. */
final class ColumnSpecParser {
  private ColumnSpecParser() {}

  static ColumnMetadata parse(String modelName, String property, JsonNode spec, ObjectMapper mapper) {
    if (spec == null || spec.isNull()) {
      throw new IllegalArgumentException(modelName + "." + property + ": column spec is empty");
    }
    // shorthand: `name: string`
    if (spec.isTextual()) {
      return ScalarColumn.of(property, ColumnType.parse(spec.asText()));
    }
    if (!spec.isObject()) {
      throw new IllegalArgumentException(modelName + "." + property + ": column spec must be a map or a type name");
    }

    String collection = text(spec, "collection");
    if (collection != null) {
      String via = text(spec, "via");
      if (via == null) throw new IllegalArgumentException(modelName + "." + property + ": collection requires 'via'");
      return CollectionColumn.of(property, collection, via).through(text(spec, "through"));
    }

    String columnName = text(spec, "columnName");
    String target = text(spec, "model");
    if (target != null) {
      ModelColumn mc = ModelColumn.of(property, target).named(columnName);
      return bool(spec, "required") ? mc.asRequired() : mc;
    }

    String type = text(spec, "type");
    if (type == null) throw new IllegalArgumentException(modelName + "." + property + ": missing 'type'");
    ScalarColumn sc;
    try {
      sc = ScalarColumn.of(property, ColumnType.parse(type)).named(columnName);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(modelName + "." + property + ": " + e.getMessage(), e);
    }
    if (bool(spec, "primaryKey")) sc = sc.primary();
    if (bool(spec, "required")) sc = sc.asRequired();
    if (bool(spec, "createDate")) sc = sc.asCreateDate();
    if (bool(spec, "updateDate")) sc = sc.asUpdateDate();
    if (bool(spec, "version")) sc = sc.asVersion();

    JsonNode d = spec.get("defaultsTo");
    if (d != null) {
      Object value = d.isNull() ? null : mapper.convertValue(d, Object.class);
      sc = sc.defaultsTo(value);
    }
    return sc;
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n.get(field);
    if (v == null || v.isNull()) return null;
    String s = v.asText();
    return s.isBlank() ? null : s.trim();
  }

  private static boolean bool(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return v != null && v.asBoolean(false);
  }
}

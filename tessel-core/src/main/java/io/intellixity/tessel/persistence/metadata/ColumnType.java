package io.intellixity.tessel.persistence.metadata;

import java.util.Locale;

/** Declared type of a scalar column. */
public enum ColumnType {
  STRING("string"),
  INTEGER("integer"),
  FLOAT("float"),
  BOOLEAN("boolean"),
  DATE("date"),
  DATETIME("datetime"),
  UUID("uuid"),
  JSON("json"),
  BINARY("binary"),
  ARRAY("array"),
  STRING_ARRAY("string[]"),
  INTEGER_ARRAY("integer[]"),
  FLOAT_ARRAY("float[]"),
  BOOLEAN_ARRAY("boolean[]");

  private final String id;

  ColumnType(String id) {
    this.id = id;
  }

  public String id() { return id; }

  public boolean isArray() {
    return this == ARRAY || id.endsWith("[]");
  }

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  /** Postgres array cast used when a predicate binds a list against a column of this type. */
  public String arrayCast() {
    return switch (this) {
      case INTEGER, INTEGER_ARRAY -> "::INTEGER[]";
      case FLOAT, FLOAT_ARRAY -> "::NUMERIC[]";
      case BOOLEAN, BOOLEAN_ARRAY -> "::BOOLEAN[]";
      case UUID -> "::UUID[]";
      default -> "::TEXT[]";
    };
  }

  public static ColumnType parse(String s) {
    if (s == null || s.isBlank()) throw new IllegalArgumentException("type is blank");
    String t = s.trim().toLowerCase(Locale.ROOT);
    return switch (t) {
      case "string", "text" -> STRING;
      case "int", "integer" -> INTEGER;
      case "float", "number", "decimal" -> FLOAT;
      case "bool", "boolean" -> BOOLEAN;
      case "date" -> DATE;
      case "datetime", "timestamp" -> DATETIME;
      case "uuid" -> UUID;
      case "json", "jsonb" -> JSON;
      case "binary", "bytea" -> BINARY;
      case "array" -> ARRAY;
      case "string[]" -> STRING_ARRAY;
      case "int[]", "integer[]" -> INTEGER_ARRAY;
      case "float[]" -> FLOAT_ARRAY;
      case "boolean[]" -> BOOLEAN_ARRAY;
      default -> throw new IllegalArgumentException("Unknown column type: " + s);
    };
  }
}

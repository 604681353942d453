package io.intellixity.tessel.persistence.compile;

final class Sql {
  private Sql() {}

  static String quote(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}

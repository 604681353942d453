package io.intellixity.tessel.persistence.compile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Compiled statement: SQL text with {@code $n} placeholders and the positionally matching parameters. */
public record SqlStatement(String text, List<Object> params) {
  public SqlStatement {
    Objects.requireNonNull(text, "text");
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public SqlStatement(String text) {
    this(text, List.of());
  }
}

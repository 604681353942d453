package io.intellixity.tessel.persistence.compile;

import java.util.ArrayList;
import java.util.List;

/** Running parameter list shared by every fragment of one statement. */
public final class ParamList {
  private final List<Object> values = new ArrayList<>();

  /** Appends a value and returns its placeholder, {@code $} followed by the 1-based position. */
  public String add(Object value) {
    values.add(value);
    return "$" + values.size();
  }

  public int size() { return values.size(); }

  public List<Object> values() { return values; }
}

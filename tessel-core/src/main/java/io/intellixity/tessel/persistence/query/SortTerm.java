package io.intellixity.tessel.persistence.query;

import java.util.Objects;

public record SortTerm(String property, Direction direction) {
  public SortTerm {
    Objects.requireNonNull(property, "property");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortTerm asc(String property) { return new SortTerm(property, Direction.ASC); }
  public static SortTerm desc(String property) { return new SortTerm(property, Direction.DESC); }

  public boolean descending() { return direction == Direction.DESC; }

  public enum Direction { ASC, DESC }
}

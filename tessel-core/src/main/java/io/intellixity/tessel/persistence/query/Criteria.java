package io.intellixity.tessel.persistence.query;

import java.util.*;

/**
 * Normalized find criteria. {@code where} is an ordered predicate map; its key order drives parameter numbering.
 * {@code select}, {@code skip} and {@code limit} are null when not given.
 */
public record Criteria(List<String> select,
                       Map<String, Object> where,
                       List<SortTerm> sorts,
                       Integer skip,
                       Integer limit) {
  private static final Criteria EMPTY = new Criteria(null, null, null, null, null);

  public Criteria {
    select = (select == null) ? null : List.copyOf(select);
    where = (where == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(where));
    sorts = (sorts == null) ? List.of() : List.copyOf(sorts);
  }

  public static Criteria empty() { return EMPTY; }

  public static Criteria where(Map<String, ?> where) {
    return new Criteria(null, castWhere(where), null, null, null);
  }

  public Criteria withSelect(List<String> select) { return new Criteria(select, where, sorts, skip, limit); }
  public Criteria withWhere(Map<String, ?> where) { return new Criteria(select, castWhere(where), sorts, skip, limit); }
  public Criteria withSorts(List<SortTerm> sorts) { return new Criteria(select, where, sorts, skip, limit); }

  /** Appends after the existing sort terms. */
  public Criteria thenSortBy(List<SortTerm> more) {
    List<SortTerm> merged = new ArrayList<>(sorts);
    merged.addAll(more);
    return withSorts(merged);
  }

  public Criteria withSkip(Integer skip) { return new Criteria(select, where, sorts, skip, limit); }
  public Criteria withLimit(Integer limit) { return new Criteria(select, where, sorts, skip, limit); }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> castWhere(Map<String, ?> where) {
    return (Map<String, Object>) where;
  }
}

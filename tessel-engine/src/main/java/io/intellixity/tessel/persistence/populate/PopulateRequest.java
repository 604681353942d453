package io.intellixity.tessel.persistence.populate;

import io.intellixity.tessel.persistence.query.SortTerm;

import java.util.*;

/**
 * One relation to populate, with optional constraints on the related rows and nested requests applied to them.
 *
 * <pre>
 * PopulateRequest.of("store")
 * PopulateRequest.of("categories").withSorts(List.of(SortTerm.asc("name"))).populate(PopulateRequest.of("products"))
 * </pre>
 */
public record PopulateRequest(String propertyName,
                              List<String> select,
                              Map<String, Object> where,
                              List<SortTerm> sorts,
                              Integer skip,
                              Integer limit,
                              List<PopulateRequest> nested) {
  public PopulateRequest {
    Objects.requireNonNull(propertyName, "propertyName");
    select = (select == null) ? null : List.copyOf(select);
    where = (where == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(where));
    sorts = (sorts == null) ? List.of() : List.copyOf(sorts);
    nested = (nested == null) ? List.of() : List.copyOf(nested);
  }

  public static PopulateRequest of(String propertyName) {
    return new PopulateRequest(propertyName, null, null, null, null, null, null);
  }

  public PopulateRequest withSelect(List<String> select) {
    return new PopulateRequest(propertyName, select, where, sorts, skip, limit, nested);
  }

  @SuppressWarnings("unchecked")
  public PopulateRequest withWhere(Map<String, ?> where) {
    return new PopulateRequest(propertyName, select, (Map<String, Object>) where, sorts, skip, limit, nested);
  }

  public PopulateRequest withSorts(List<SortTerm> sorts) {
    return new PopulateRequest(propertyName, select, where, sorts, skip, limit, nested);
  }

  public PopulateRequest withSkip(Integer skip) {
    return new PopulateRequest(propertyName, select, where, sorts, skip, limit, nested);
  }

  public PopulateRequest withLimit(Integer limit) {
    return new PopulateRequest(propertyName, select, where, sorts, skip, limit, nested);
  }

  /** Appends a nested request for the populated rows. */
  public PopulateRequest populate(PopulateRequest child) {
    List<PopulateRequest> next = new ArrayList<>(nested);
    next.add(Objects.requireNonNull(child, "child"));
    return new PopulateRequest(propertyName, select, where, sorts, skip, limit, next);
  }
}

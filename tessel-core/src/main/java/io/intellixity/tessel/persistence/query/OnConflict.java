package io.intellixity.tessel.persistence.query;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code ON CONFLICT} handling for inserts.
 *
 * @param targets     conflict target properties
 * @param targetWhere optional predicate for partial unique indexes ({@code ON CONFLICT (..) WHERE ..})
 * @param merge       properties to overwrite on MERGE; null merges every column except create-date columns and
 *                    the primary key, an empty list degrades to DO NOTHING
 * @param mergeWhere  optional predicate on the DO UPDATE
 */
public record OnConflict(Action action,
                         List<String> targets,
                         Map<String, Object> targetWhere,
                         List<String> merge,
                         Map<String, Object> mergeWhere) {
  public enum Action { IGNORE, MERGE }

  public OnConflict {
    Objects.requireNonNull(action, "action");
    targets = List.copyOf(Objects.requireNonNull(targets, "targets"));
    merge = (merge == null) ? null : List.copyOf(merge);
  }

  public static OnConflict ignore(List<String> targets) {
    return new OnConflict(Action.IGNORE, targets, null, null, null);
  }

  public static OnConflict merge(List<String> targets) {
    return new OnConflict(Action.MERGE, targets, null, null, null);
  }

  public static OnConflict merge(List<String> targets, List<String> mergeProperties) {
    return new OnConflict(Action.MERGE, targets, null, mergeProperties, null);
  }

  public OnConflict withTargetWhere(Map<String, Object> where) {
    return new OnConflict(action, targets, where, merge, mergeWhere);
  }

  public OnConflict withMergeWhere(Map<String, Object> where) {
    return new OnConflict(action, targets, targetWhere, merge, where);
  }
}

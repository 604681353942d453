package io.intellixity.tessel.persistence.metadata;

import java.util.Map;

/** Named operation declared on a model and callable on any of its materialized rows. */
@FunctionalInterface
public interface RowBehavior {
  Object invoke(Map<String, Object> row, Object... args);
}

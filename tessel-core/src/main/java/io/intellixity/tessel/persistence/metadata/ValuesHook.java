package io.intellixity.tessel.persistence.metadata;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/** Lifecycle hook run on each values map before a create or update is compiled. */
@FunctionalInterface
public interface ValuesHook {
  CompletionStage<Map<String, Object>> apply(Map<String, Object> values);
}

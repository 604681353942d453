package io.intellixity.tessel.persistence.exec;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executes one parameterized statement. {@code text} uses {@code $1..$n} placeholders and {@code params} is
 * positional. Implementations must not block the calling thread.
 */
public interface Pool {
  CompletableFuture<QueryResult> execute(String text, List<Object> params);
}

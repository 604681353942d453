package io.intellixity.tessel.persistence.exec;

import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** Dispatches compiled statements to a pool with uniform debug logging. */
public final class StatementExecutor {
  private static final Logger log = LoggerFactory.getLogger(StatementExecutor.class);

  public CompletableFuture<QueryResult> execute(Pool pool, String op, ModelMetadata model, SqlStatement statement) {
    if (log.isDebugEnabled()) {
      log.debug("tessel.query op={} model={} paramCount={} sql={}", op, model.name(), statement.params().size(), statement.text());
    }
    long start = System.nanoTime();
    CompletableFuture<QueryResult> f;
    try {
      f = pool.execute(statement.text(), statement.params());
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    if (f == null) return CompletableFuture.failedFuture(new IllegalStateException("Pool returned no result for " + op));
    return f.whenComplete((result, failure) -> {
      if (failure == null && log.isDebugEnabled()) {
        log.debug("tessel.query_done op={} model={} durationMs={} rows={}",
            op, model.name(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start), result.rows().size());
      }
    });
  }
}

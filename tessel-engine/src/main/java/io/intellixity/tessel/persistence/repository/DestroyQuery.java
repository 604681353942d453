package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.exec.QueryResult;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * {@code destroy} and {@code destroyWithoutRecords}. Without a predicate every row of the table is deleted.
 *
 * @param <R> deleted rows, or {@code Boolean.TRUE} when records are not returned
 */
public final class DestroyQuery<R> extends DeferredQuery<R> {
  private final boolean returnRecords;
  private final Function<QueryResult, R> result;
  private Map<String, Object> where = Map.of();
  private List<String> returnSelect;

  DestroyQuery(RepositoryContext context, ModelMetadata model, Object input, boolean returnRecords,
               Function<QueryResult, R> result) {
    super(context, model, returnRecords ? "destroy" : "destroyWithoutRecords");
    this.returnRecords = returnRecords;
    this.result = result;
    guard(() -> where = context.normalizer().normalize(input).where());
  }

  public DestroyQuery<R> where(Map<String, ?> where) {
    guard(() -> this.where = context.normalizer().where(where));
    return this;
  }

  /** Limits the RETURNING projection; ignored without records. */
  public DestroyQuery<R> returnSelect(List<String> select) {
    this.returnSelect = select;
    return this;
  }

  @Override
  CompletableFuture<R> run() {
    SqlStatement st = context.compiler().delete().delete(model, where, returnRecords, returnSelect);
    return context.executor().execute(context.pool(), returnRecords ? "destroy" : "destroyWithoutRecords", model, st)
        .thenApply(result);
  }
}

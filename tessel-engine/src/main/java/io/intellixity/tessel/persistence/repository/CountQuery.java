package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** {@code count}: runs on the primary pool. */
public final class CountQuery extends DeferredQuery<Count> {
  private Map<String, Object> where = Map.of();

  CountQuery(RepositoryContext context, ModelMetadata model, Object input) {
    super(context, model, "count");
    guard(() -> where = context.normalizer().normalize(input).where());
  }

  public CountQuery where(Map<String, ?> where) {
    guard(() -> this.where = context.normalizer().where(where));
    return this;
  }

  @Override
  CompletableFuture<Count> run() {
    SqlStatement st = context.compiler().select().count(model, where);
    return context.executor().execute(context.pool(), "count", model, st).thenApply(r -> {
      Object raw = r.rows().isEmpty() ? null : r.rows().get(0).get("count");
      return Count.of(raw);
    });
  }
}

package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.exec.Futures;
import io.intellixity.tessel.persistence.exec.OperationTrace;
import io.intellixity.tessel.persistence.exec.QueryResult;
import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.metadata.ValuesHook;
import io.intellixity.tessel.persistence.query.WriteOptions;

import java.util.*;
import java.util.concurrent.CompletableFuture;

/**
 * Read and write operations for one model. Writes run on the primary pool; {@code beforeCreate} and
 * {@code beforeUpdate} hooks see a copy of each values map before it is compiled.
 */
public final class Repository extends ReadonlyRepository {
  Repository(RepositoryContext context, ModelMetadata model) {
    super(context, model);
  }

  /** Inserts one row and resolves to it, or to null when an ON CONFLICT clause skipped it. */
  public CompletableFuture<ResultRow> create(Map<String, ?> values) {
    return create(values, WriteOptions.defaults());
  }

  public CompletableFuture<ResultRow> create(Map<String, ?> values, WriteOptions options) {
    return trace("create").around(() -> insert("create", Collections.singletonList(values), true, options)
        .thenApply(rows -> rows.isEmpty() ? null : rows.get(0)));
  }

  /** Inserts every row in one statement. An empty list resolves to an empty list without a round trip. */
  public CompletableFuture<List<ResultRow>> createMany(List<? extends Map<String, ?>> values) {
    return createMany(values, WriteOptions.defaults());
  }

  public CompletableFuture<List<ResultRow>> createMany(List<? extends Map<String, ?>> values, WriteOptions options) {
    return trace("createMany").around(() -> insert("createMany", values, true, options));
  }

  public CompletableFuture<Boolean> createWithoutRecords(List<? extends Map<String, ?>> values) {
    return createWithoutRecords(values, WriteOptions.defaults());
  }

  public CompletableFuture<Boolean> createWithoutRecords(List<? extends Map<String, ?>> values, WriteOptions options) {
    return trace("createWithoutRecords").around(() -> insert("createWithoutRecords", values, false, options)
        .thenApply(rows -> Boolean.TRUE));
  }

  public CompletableFuture<List<ResultRow>> update(Map<String, ?> where, Map<String, ?> values) {
    return update(where, values, WriteOptions.defaults());
  }

  /** Resolves to every updated row. */
  public CompletableFuture<List<ResultRow>> update(Map<String, ?> where, Map<String, ?> values, WriteOptions options) {
    return trace("update").around(() -> update("update", where, values, true, options));
  }

  public CompletableFuture<Boolean> updateWithoutRecords(Map<String, ?> where, Map<String, ?> values) {
    return trace("updateWithoutRecords").around(() -> update("updateWithoutRecords", where, values, false, WriteOptions.defaults())
        .thenApply(rows -> Boolean.TRUE));
  }

  public DestroyQuery<List<ResultRow>> destroy() {
    return destroy(null);
  }

  public DestroyQuery<List<ResultRow>> destroy(Object criteria) {
    return new DestroyQuery<>(context, model, criteria, true, this::materialize);
  }

  public DestroyQuery<Boolean> destroyWithoutRecords() {
    return destroyWithoutRecords(null);
  }

  public DestroyQuery<Boolean> destroyWithoutRecords(Object criteria) {
    return new DestroyQuery<>(context, model, criteria, false, r -> Boolean.TRUE);
  }

  private CompletableFuture<List<ResultRow>> insert(String op, List<? extends Map<String, ?>> values, boolean returnRecords,
                                                    WriteOptions options) {
    Objects.requireNonNull(values, "values");
    if (values.isEmpty()) return CompletableFuture.completedFuture(new ArrayList<>());
    return prepare(model.beforeCreate(), values)
        .thenCompose(rows -> {
          SqlStatement st = context.compiler().insert().insert(model, rows, returnRecords, options);
          return context.executor().execute(context.pool(), op, model, st);
        })
        .thenApply(r -> returnRecords ? materialize(r) : List.<ResultRow>of());
  }

  private CompletableFuture<List<ResultRow>> update(String op, Map<String, ?> where, Map<String, ?> values,
                                                    boolean returnRecords, WriteOptions options) {
    Map<String, Object> predicate = context.normalizer().where(where);
    WriteOptions opts = (options == null) ? WriteOptions.defaults() : options;
    return prepare(model.beforeUpdate(), List.of(Objects.requireNonNull(values, "values")))
        .thenCompose(prepared -> {
          SqlStatement st = context.compiler().update().update(model, predicate, prepared.get(0), returnRecords, opts.returnSelect());
          return context.executor().execute(context.pool(), op, model, st);
        })
        .thenApply(r -> returnRecords ? materialize(r) : List.<ResultRow>of());
  }

  private static CompletableFuture<List<Map<String, Object>>> prepare(ValuesHook hook, List<? extends Map<String, ?>> values) {
    List<CompletableFuture<Map<String, Object>>> prepared = new ArrayList<>(values.size());
    for (Map<String, ?> v : values) {
      Map<String, Object> copy = new LinkedHashMap<>(Objects.requireNonNull(v, "values"));
      prepared.add(hook == null ? CompletableFuture.completedFuture(copy) : hook.apply(copy).toCompletableFuture());
    }
    return Futures.allOrFirstFailure(prepared);
  }

  private List<ResultRow> materialize(QueryResult result) {
    return context.materializer().materializeAll(model, result.rows());
  }

  private OperationTrace trace(String operation) {
    return OperationTrace.of(model.name(), operation);
  }
}

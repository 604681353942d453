package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.metadata.ModelColumn;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.populate.PopulateRequest;
import io.intellixity.tessel.persistence.query.Criteria;
import io.intellixity.tessel.persistence.query.CriteriaNormalizer;
import io.intellixity.tessel.persistence.query.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/** {@code find}: every matching row, optionally paged and populated. */
public final class FindQuery extends DeferredQuery<List<ResultRow>> {
  private Criteria criteria;
  private final List<PopulateRequest> populates = new ArrayList<>();

  FindQuery(RepositoryContext context, ModelMetadata model, Object input) {
    super(context, model, "find");
    this.criteria = Criteria.empty();
    guard(() -> criteria = context.normalizer().normalize(input));
  }

  public FindQuery where(Map<String, ?> where) {
    guard(() -> criteria = criteria.withWhere(context.normalizer().where(where)));
    return this;
  }

  /** See {@link io.intellixity.tessel.persistence.query.CriteriaNormalizer#parseSort(Object)} for accepted shapes. */
  public FindQuery sort(Object sort) {
    guard(() -> criteria = criteria.thenSortBy(context.normalizer().parseSort(sort)));
    return this;
  }

  public FindQuery select(List<String> select) {
    criteria = criteria.withSelect(select);
    return this;
  }

  public FindQuery skip(int skip) {
    guard(() -> criteria = criteria.withSkip(nonNegative("skip", skip)));
    return this;
  }

  public FindQuery limit(int limit) {
    guard(() -> criteria = criteria.withLimit(nonNegative("limit", limit)));
    return this;
  }

  /** 1-based page; pages below 1 are treated as the first. */
  public FindQuery paginate(int page, int limit) {
    int safePage = Math.max(page, 1);
    return skip(safePage * limit - limit).limit(limit);
  }

  public FindQuery populate(String propertyName) {
    return populate(PopulateRequest.of(propertyName));
  }

  public FindQuery populate(PopulateRequest request) {
    populates.add(request);
    return this;
  }

  /** Replaces the criteria through one of the normalizer's typed entry points. */
  FindQuery from(Function<CriteriaNormalizer, Criteria> normalize) {
    guard(() -> criteria = normalize.apply(context.normalizer()));
    return this;
  }

  @Override
  CompletableFuture<List<ResultRow>> run() {
    SqlStatement st = context.compiler().select().select(model, withPopulatedColumns(model, criteria, populates));
    return context.executor().execute(context.readonlyPool(), "find", model, st)
        .thenApply(r -> context.materializer().materializeAll(model, r.rows()))
        .thenCompose(rows -> context.populator().populate(model, rows, populates).thenApply(v -> rows));
  }

  /** An explicit select must still carry the foreign keys of populated belongs-to relations. */
  static Criteria withPopulatedColumns(ModelMetadata model, Criteria criteria, List<PopulateRequest> populates) {
    if (criteria.select() == null || populates.isEmpty()) return criteria;
    List<String> select = new ArrayList<>(criteria.select());
    for (PopulateRequest request : populates) {
      String name = request.propertyName();
      if (model.column(name) instanceof ModelColumn && !select.contains(name)) {
        select.add(name);
      }
    }
    return criteria.withSelect(select);
  }

  static int nonNegative(String name, int value) {
    if (value < 0) {
      throw new ValidationException(name + " must not be negative, got: " + value);
    }
    return value;
  }
}

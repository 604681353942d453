package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.populate.PopulateRequest;
import io.intellixity.tessel.persistence.query.Criteria;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/** {@code findOne}: the first matching row or null, always compiled with {@code LIMIT 1}. */
public final class FindOneQuery extends DeferredQuery<ResultRow> {
  private Criteria criteria;
  private final List<PopulateRequest> populates = new ArrayList<>();

  FindOneQuery(RepositoryContext context, ModelMetadata model, Object input) {
    super(context, model, "findOne");
    this.criteria = Criteria.empty();
    guard(() -> criteria = context.normalizer().normalize(input));
  }

  public FindOneQuery where(Map<String, ?> where) {
    guard(() -> criteria = criteria.withWhere(context.normalizer().where(where)));
    return this;
  }

  public FindOneQuery sort(Object sort) {
    guard(() -> criteria = criteria.thenSortBy(context.normalizer().parseSort(sort)));
    return this;
  }

  public FindOneQuery select(List<String> select) {
    criteria = criteria.withSelect(select);
    return this;
  }

  public FindOneQuery skip(int skip) {
    guard(() -> criteria = criteria.withSkip(FindQuery.nonNegative("skip", skip)));
    return this;
  }

  public FindOneQuery populate(String propertyName) {
    return populate(PopulateRequest.of(propertyName));
  }

  public FindOneQuery populate(PopulateRequest request) {
    populates.add(request);
    return this;
  }

  @Override
  CompletableFuture<ResultRow> run() {
    Criteria one = FindQuery.withPopulatedColumns(model, criteria, populates).withLimit(1);
    SqlStatement st = context.compiler().select().select(model, one);
    return context.executor().execute(context.readonlyPool(), "findOne", model, st).thenCompose(r -> {
      if (r.rows().isEmpty()) return CompletableFuture.<ResultRow>completedFuture(null);
      ResultRow row = context.materializer().materialize(model, r.rows().get(0));
      return context.populator().populate(model, List.of(row), populates).thenApply(v -> row);
    });
  }
}

package io.intellixity.tessel.persistence.populate;

import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.query.Criteria;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Runs one find for the populator: compile, execute on the read pool, materialize. */
@FunctionalInterface
public interface RowFinder {
  CompletableFuture<List<ResultRow>> find(ModelMetadata model, Criteria criteria);
}

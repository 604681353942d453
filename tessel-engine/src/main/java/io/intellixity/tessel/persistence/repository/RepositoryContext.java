package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.compile.SqlCompiler;
import io.intellixity.tessel.persistence.compile.SqlStatement;
import io.intellixity.tessel.persistence.exec.Pool;
import io.intellixity.tessel.persistence.exec.StatementExecutor;
import io.intellixity.tessel.persistence.mapping.ResultRow;
import io.intellixity.tessel.persistence.mapping.RowMaterializer;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;
import io.intellixity.tessel.persistence.populate.RelationPopulator;
import io.intellixity.tessel.persistence.query.Criteria;
import io.intellixity.tessel.persistence.query.CriteriaNormalizer;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Collaborators shared by every repository of one {@link Tessel} instance. */
final class RepositoryContext {
  private final ModelRegistry registry;
  private final SqlCompiler compiler;
  private final RowMaterializer materializer = new RowMaterializer();
  private final CriteriaNormalizer normalizer = new CriteriaNormalizer();
  private final StatementExecutor executor = new StatementExecutor();
  private final RelationPopulator populator;
  private final Pool pool;
  private final Pool readonlyPool;

  RepositoryContext(ModelRegistry registry, SqlCompiler compiler, Pool pool, Pool readonlyPool) {
    this.registry = registry;
    this.compiler = compiler;
    this.pool = pool;
    this.readonlyPool = (readonlyPool == null) ? pool : readonlyPool;
    this.populator = new RelationPopulator(registry, this::select);
  }

  ModelRegistry registry() { return registry; }
  SqlCompiler compiler() { return compiler; }
  RowMaterializer materializer() { return materializer; }
  CriteriaNormalizer normalizer() { return normalizer; }
  StatementExecutor executor() { return executor; }
  RelationPopulator populator() { return populator; }
  Pool pool() { return pool; }
  Pool readonlyPool() { return readonlyPool; }

  /** Compiles, runs on the read pool and materializes one SELECT. */
  CompletableFuture<List<ResultRow>> select(ModelMetadata model, Criteria criteria) {
    SqlStatement st = compiler.select().select(model, criteria);
    return executor.execute(readonlyPool, "find", model, st).thenApply(r -> materializer.materializeAll(model, r.rows()));
  }
}

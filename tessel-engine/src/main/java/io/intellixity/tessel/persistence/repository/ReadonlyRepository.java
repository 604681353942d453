package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.metadata.ModelMetadata;

import java.util.Map;

/**
 * Read operations for one model. Finds run on the read pool, counts on the primary pool.
 * <p>
 * Every method that takes {@code criteria} accepts structured args ({@code select, where, sort, skip, limit}), a
 * bare predicate map, or a {@link io.intellixity.tessel.persistence.query.Criteria}. Malformed criteria surface
 * from {@code execute()}.
 */
public class ReadonlyRepository {
  final RepositoryContext context;
  final ModelMetadata model;

  ReadonlyRepository(RepositoryContext context, ModelMetadata model) {
    this.context = context;
    this.model = model;
  }

  public ModelMetadata model() { return model; }

  public FindQuery find() {
    return new FindQuery(context, model, null);
  }

  public FindQuery find(Object criteria) {
    return new FindQuery(context, model, criteria);
  }

  /** Structured args only; any key outside {@code select, where, sort, skip, limit} fails on execute. */
  public FindQuery findWithArgs(Map<String, ?> args) {
    return find().from(n -> n.fromArgs(args));
  }

  /** The whole map is the predicate, even when it uses a key such as {@code limit}. */
  public FindQuery findWhere(Map<String, ?> where) {
    return find().from(n -> n.fromWhere(where));
  }

  public FindOneQuery findOne() {
    return new FindOneQuery(context, model, null);
  }

  public FindOneQuery findOne(Object criteria) {
    return new FindOneQuery(context, model, criteria);
  }

  public CountQuery count() {
    return new CountQuery(context, model, null);
  }

  /** Only the predicate of {@code criteria} is used. */
  public CountQuery count(Object criteria) {
    return new CountQuery(context, model, criteria);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + model.name() + "]";
  }
}

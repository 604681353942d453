package io.intellixity.tessel.persistence.compile;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tessel.persistence.metadata.ModelRegistry;

import java.time.Clock;
import java.util.Objects;

/**
 * The four statement builders over one registry, sharing a single {@link WhereCompiler} so every statement kind
 * renders predicates and projections identically. Stateless and thread-safe.
 */
public final class SqlCompiler {
  private final WhereCompiler where;
  private final SelectBuilder select;
  private final InsertBuilder insert;
  private final UpdateBuilder update;
  private final DeleteBuilder delete;

  public SqlCompiler(ModelRegistry registry) {
    this(registry, new ObjectMapper(), Clock.systemUTC());
  }

  /** {@code clock} supplies create/update date defaults. */
  public SqlCompiler(ModelRegistry registry, ObjectMapper json, Clock clock) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(clock, "clock");
    this.where = new WhereCompiler(registry);
    ValueEncoder encoder = new ValueEncoder(registry, json);
    this.select = new SelectBuilder(where);
    this.insert = new InsertBuilder(where, encoder, clock);
    this.update = new UpdateBuilder(where, encoder, clock);
    this.delete = new DeleteBuilder(where);
  }

  public WhereCompiler where() { return where; }
  public SelectBuilder select() { return select; }
  public InsertBuilder insert() { return insert; }
  public UpdateBuilder update() { return update; }
  public DeleteBuilder delete() { return delete; }
}

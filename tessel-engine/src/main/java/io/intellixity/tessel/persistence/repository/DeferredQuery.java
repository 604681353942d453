package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.exec.OperationTrace;
import io.intellixity.tessel.persistence.metadata.ModelMetadata;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Chainable query that compiles and dispatches only when {@link #execute()} is called, exactly once.
 * <p>
 * Input errors raised while chaining (a string predicate, a malformed sort) are held back and reported by
 * {@code execute()} as a failed future, like every other compile error.
 */
public abstract class DeferredQuery<R> {
  final RepositoryContext context;
  final ModelMetadata model;
  private final OperationTrace trace;
  private final AtomicBoolean executed = new AtomicBoolean();
  private RuntimeException inputError;

  DeferredQuery(RepositoryContext context, ModelMetadata model, String operation) {
    this.context = context;
    this.model = model;
    this.trace = OperationTrace.of(model.name(), operation);
  }

  public final CompletableFuture<R> execute() {
    if (!executed.compareAndSet(false, true)) {
      throw new IllegalStateException(trace.getMessage() + " has already been executed");
    }
    return trace.around(() -> {
      if (inputError != null) throw inputError;
      return run();
    });
  }

  /** Records the first input error instead of throwing it from a chain method. */
  final void guard(Runnable step) {
    try {
      step.run();
    } catch (RuntimeException e) {
      if (inputError == null) inputError = e;
    }
  }

  abstract CompletableFuture<R> run();
}

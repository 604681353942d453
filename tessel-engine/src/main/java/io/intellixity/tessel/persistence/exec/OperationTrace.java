package io.intellixity.tessel.persistence.exec;

import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Call-site marker attached as a suppressed exception to asynchronous failures.
 * <p>
 * Created when an operation is requested, so its stack trace points at the caller rather than at the pool thread
 * that observed the failure. The message names the operation, e.g. {@code Product.find()}.
 */
public final class OperationTrace extends RuntimeException {
  public OperationTrace(String operation) {
    super(operation);
  }

  public static OperationTrace of(String model, String operation) {
    return new OperationTrace(model + "." + operation + "()");
  }

  /**
   * Runs {@code work} and attaches this trace to any failure, whether thrown synchronously by {@code work} or
   * surfaced by the returned stage. The resulting future fails with a {@link CompletionException} around the
   * original cause.
   */
  public <T> CompletableFuture<T> around(Supplier<? extends CompletionStage<T>> work) {
    CompletableFuture<T> f;
    try {
      f = work.get().toCompletableFuture();
    } catch (RuntimeException e) {
      f = CompletableFuture.failedFuture(e);
    }
    return f.handle((value, failure) -> {
      if (failure == null) return value;
      throw new CompletionException(attachTo(failure));
    });
  }

  /** Unwraps completion wrappers and adds this trace to the cause once. */
  public Throwable attachTo(Throwable failure) {
    Throwable cause = unwrap(failure);
    if (cause != this && !Arrays.asList(cause.getSuppressed()).contains(this)) cause.addSuppressed(this);
    return cause;
  }

  public static Throwable unwrap(Throwable t) {
    Throwable cur = t;
    while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
      cur = cur.getCause();
    }
    return cur;
  }
}

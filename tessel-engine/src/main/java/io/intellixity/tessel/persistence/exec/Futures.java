package io.intellixity.tessel.persistence.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

public final class Futures {
  private Futures() {}

  /**
   * Completes with every result, in input order, once all futures succeed; fails as soon as any one fails,
   * without waiting for the rest.
   */
  public static <T> CompletableFuture<List<T>> allOrFirstFailure(List<CompletableFuture<T>> futures) {
    if (futures.isEmpty()) return CompletableFuture.completedFuture(List.of());
    CompletableFuture<List<T>> result = new CompletableFuture<>();
    AtomicInteger remaining = new AtomicInteger(futures.size());
    for (CompletableFuture<T> f : futures) {
      f.whenComplete((value, failure) -> {
        if (failure != null) {
          result.completeExceptionally(OperationTrace.unwrap(failure));
        } else if (remaining.decrementAndGet() == 0) {
          List<T> values = new ArrayList<>(futures.size());
          for (CompletableFuture<T> done : futures) values.add(done.join());
          result.complete(values);
        }
      });
    }
    return result;
  }
}

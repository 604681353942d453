package io.intellixity.tessel.persistence.exec;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

final class FuturesTest {
  @Test
  void keepsInputOrder() {
    CompletableFuture<Integer> slow = new CompletableFuture<>();
    CompletableFuture<List<Integer>> all = Futures.allOrFirstFailure(List.of(slow, CompletableFuture.completedFuture(2)));
    assertFalse(all.isDone());
    slow.complete(1);
    assertEquals(List.of(1, 2), all.join());
  }

  @Test
  void failsOnFirstFailureWithoutWaiting() {
    CompletableFuture<Integer> pending = new CompletableFuture<>();
    IllegalStateException boom = new IllegalStateException("boom");
    CompletableFuture<List<Integer>> all = Futures.allOrFirstFailure(List.of(pending, CompletableFuture.failedFuture(boom)));

    assertTrue(all.isCompletedExceptionally());
    CompletionException ex = assertThrows(CompletionException.class, all::join);
    assertSame(boom, ex.getCause());
  }

  @Test
  void emptyInputCompletesImmediately() {
    assertEquals(List.of(), Futures.<String>allOrFirstFailure(List.of()).join());
  }
}

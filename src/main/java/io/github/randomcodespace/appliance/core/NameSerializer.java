package io.github.randomcodespace.appliance.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks one at a time per key, in submission order. Tasks for different keys
 * are independent. A task starts only after the previous one for the same key has completed,
 * normally or exceptionally.
 */
public class NameSerializer {
  private final ConcurrentMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

  public <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
    CompletableFuture<T> result = new CompletableFuture<>();
    CompletableFuture<Void> done = new CompletableFuture<>();
    CompletableFuture<Void> previous = tails.put(key, done);
    CompletableFuture<Void> start =
        previous == null ? CompletableFuture.completedFuture(null) : previous;
    start.whenComplete(
        (ignored, ignoredEx) -> {
          CompletableFuture<T> running;
          try {
            running = task.get();
          } catch (RuntimeException e) {
            running = CompletableFuture.failedFuture(e);
          }
          running.whenComplete(
              (value, ex) -> {
                tails.remove(key, done);
                done.complete(null);
                if (ex != null) {
                  result.completeExceptionally(ex);
                } else {
                  result.complete(value);
                }
              });
        });
    return result;
  }

  /** Number of keys with a running or queued task. */
  int activeKeys() {
    return tails.size();
  }
}

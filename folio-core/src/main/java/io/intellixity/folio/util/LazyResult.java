package io.intellixity.folio.util;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Single-assignment, demand-driven async result.
 *
 * <p>The supplier runs on the first {@link #get()} only; every later (or concurrent) call gets the
 * same future, including a failed one. Nothing is started until someone asks.</p>
 */
public final class LazyResult<T> {
  private final Supplier<? extends CompletionStage<T>> supplier;
  private CompletableFuture<T> result;

  public LazyResult(Supplier<? extends CompletionStage<T>> supplier) {
    this.supplier = Objects.requireNonNull(supplier, "supplier");
  }

  public static <T> LazyResult<T> of(Supplier<? extends CompletionStage<T>> supplier) {
    return new LazyResult<>(supplier);
  }

  public synchronized CompletableFuture<T> get() {
    if (result != null) return result;
    try {
      result = supplier.get().toCompletableFuture();
    } catch (RuntimeException e) {
      result = CompletableFuture.failedFuture(e);
    }
    return result;
  }

  public synchronized boolean started() {
    return result != null;
  }
}

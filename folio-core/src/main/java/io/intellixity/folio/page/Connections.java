package io.intellixity.folio.page;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

public final class Connections {
  private Connections() {}

  /** A resolved connection with no edges, no neighbours and blank cursors. */
  public static Connection<KeysetPageInfo> empty() {
    return EMPTY;
  }

  private static final KeysetPageInfo EMPTY_INFO = new KeysetPageInfo() {
    @Override public CompletionStage<Boolean> hasNextPage() { return CompletableFuture.completedFuture(false); }
    @Override public CompletionStage<Boolean> hasPreviousPage() { return CompletableFuture.completedFuture(false); }
    @Override public CompletionStage<String> startCursor() { return CompletableFuture.completedFuture(""); }
    @Override public CompletionStage<String> endCursor() { return CompletableFuture.completedFuture(""); }
    @Override public CompletionStage<Long> startingPosition() { return CompletableFuture.completedFuture(0L); }
    @Override public CompletionStage<Long> endingPosition() { return CompletableFuture.completedFuture(0L); }
  };

  private static final Connection<KeysetPageInfo> EMPTY = new Connection<>() {
    @Override public CompletionStage<Long> totalCount() { return CompletableFuture.completedFuture(0L); }
    @Override public CompletionStage<List<Edge>> edges() { return CompletableFuture.completedFuture(List.of()); }
    @Override public KeysetPageInfo pageInfo() { return EMPTY_INFO; }
  };
}

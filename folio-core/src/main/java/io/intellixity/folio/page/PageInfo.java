package io.intellixity.folio.page;

import java.util.concurrent.CompletionStage;

/**
 * Page boundary metadata. Every accessor is lazy and memoized; calling them in any order, or
 * concurrently, resolves against the same underlying page.
 */
public interface PageInfo {
  CompletionStage<Boolean> hasNextPage();

  CompletionStage<Boolean> hasPreviousPage();

  /** Cursor of the first edge, or {@code ""} for an empty page. */
  CompletionStage<String> startCursor();

  /** Cursor of the last edge, or {@code ""} for an empty page. */
  CompletionStage<String> endCursor();
}

package io.intellixity.folio.page;

import java.util.concurrent.CompletionStage;

/** Keyset page metadata with 1-based absolute positions of the first and last edge. */
public interface KeysetPageInfo extends PageInfo {
  CompletionStage<Long> startingPosition();

  CompletionStage<Long> endingPosition();
}

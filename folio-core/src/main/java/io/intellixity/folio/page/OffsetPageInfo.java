package io.intellixity.folio.page;

import java.util.concurrent.CompletionStage;

public interface OffsetPageInfo extends PageInfo {
  int startOffset();

  /** {@code startOffset + edge count}; may complete with {@code null} when nothing matched. */
  CompletionStage<Integer> endOffset();
}

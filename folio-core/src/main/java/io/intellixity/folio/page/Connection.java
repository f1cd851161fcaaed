package io.intellixity.folio.page;

import java.util.List;
import java.util.concurrent.CompletionStage;

/**
 * Result of one pagination call.
 *
 * @param <P> page info flavor ({@link KeysetPageInfo} or {@link OffsetPageInfo})
 */
public interface Connection<P extends PageInfo> {
  /** Number of records matching the caller's filter, ignoring the cursor or offset. */
  CompletionStage<Long> totalCount();

  CompletionStage<List<Edge>> edges();

  P pageInfo();
}

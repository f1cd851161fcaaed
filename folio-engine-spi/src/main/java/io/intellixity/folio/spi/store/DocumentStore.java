package io.intellixity.folio.spi.store;

import org.bson.Document;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * The three read operations paginators need from a document store.
 * <p>
 * Filters, sorts and projections are MongoDB-shaped documents. Implementations report failures by
 * completing the returned stage exceptionally; paginators pass those failures through unchanged.
 */
public interface DocumentStore {
  CompletionStage<List<Document>> find(Document filter, FindOptions options);

  /** First document in {@code options.sort()} order, if any. {@code limit} and {@code skip} are ignored. */
  CompletionStage<Optional<Document>> findOne(Document filter, FindOptions options);

  CompletionStage<Long> countDocuments(Document filter);
}

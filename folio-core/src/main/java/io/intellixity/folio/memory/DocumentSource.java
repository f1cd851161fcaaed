package io.intellixity.folio.memory;

import org.bson.Document;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/** Documents to paginate in memory, either already loaded or produced on demand. */
@FunctionalInterface
public interface DocumentSource {
  CompletionStage<List<Document>> load();

  static DocumentSource of(List<Document> docs) {
    List<Document> snapshot = (docs == null) ? List.of() : docs;
    return () -> CompletableFuture.completedFuture(snapshot);
  }

  /** The supplier runs when the paginator first needs the documents, not when the source is built. */
  static DocumentSource lazy(Supplier<List<Document>> docs) {
    Objects.requireNonNull(docs, "docs");
    return () -> CompletableFuture.supplyAsync(docs, Runnable::run);
  }
}

package io.intellixity.folio.spi.seek;

import io.intellixity.folio.spi.store.DocumentStore;
import io.intellixity.folio.spi.store.FindOptions;
import org.bson.Document;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/** Fetches a single record by identifier, projected to what the caller needs. */
@FunctionalInterface
public interface PointLookup {
  CompletionStage<Optional<Document>> lookup(Object id, Document projection);

  static PointLookup of(DocumentStore store, String idField) {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(idField, "idField");
    return (id, projection) -> store.findOne(new Document(idField, id), FindOptions.none().withProjection(projection));
  }
}

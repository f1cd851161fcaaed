package io.intellixity.folio.mongo;

import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoCollection;
import io.intellixity.folio.spi.store.DocumentStore;
import io.intellixity.folio.spi.store.FindOptions;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} over a sync driver collection.
 * <p>
 * Driver calls are blocking and run on the supplied executor. Driver exceptions
 * ({@code MongoException} and subclasses) fail the returned stage as they are.
 */
public final class MongoDocumentStore implements DocumentStore {
  private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);

  private final MongoCollection<Document> collection;
  private final Executor executor;
  private final String name;

  public MongoDocumentStore(MongoCollection<Document> collection, Executor executor) {
    this.collection = Objects.requireNonNull(collection, "collection");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.name = collection.getNamespace().getFullName();
  }

  @Override
  public CompletionStage<List<Document>> find(Document filter, FindOptions options) {
    FindOptions o = (options == null) ? FindOptions.none() : options;
    return run("find", filter, () -> {
      FindIterable<Document> it = prepare(filter, o);
      if (o.skip() > 0) it = it.skip(o.skip());
      if (o.limit() > 0) it = it.limit(o.limit());
      return it.into(new ArrayList<>());
    });
  }

  @Override
  public CompletionStage<Optional<Document>> findOne(Document filter, FindOptions options) {
    FindOptions o = (options == null) ? FindOptions.none() : options;
    return run("findOne", filter, () -> Optional.ofNullable(prepare(filter, o).first()));
  }

  @Override
  public CompletionStage<Long> countDocuments(Document filter) {
    return run("count", filter, () -> collection.countDocuments(orEmpty(filter)));
  }

  private FindIterable<Document> prepare(Document filter, FindOptions o) {
    FindIterable<Document> it = collection.find(orEmpty(filter));
    if (o.sort() != null && !o.sort().isEmpty()) it = it.sort(o.sort());
    if (o.projection() != null && !o.projection().isEmpty()) it = it.projection(o.projection());
    return it;
  }

  private <T> CompletionStage<T> run(String op, Document filter, Supplier<T> call) {
    return CompletableFuture.supplyAsync(() -> {
      long start = System.nanoTime();
      if (log.isTraceEnabled()) {
        log.trace("folio.mongo op={} collection={} filter={}", op, name, orEmpty(filter).toJson());
      }
      T out = call.get();
      if (log.isDebugEnabled()) {
        log.debug("folio.mongo op={} collection={} durationMs={}", op, name, (System.nanoTime() - start) / 1_000_000L);
      }
      return out;
    }, executor);
  }

  private static Document orEmpty(Document filter) {
    return (filter == null) ? new Document() : filter;
  }
}

package io.intellixity.folio.spi.store;

import org.bson.Document;

/**
 * Options for {@link DocumentStore#find} and {@link DocumentStore#findOne}.
 *
 * @param sort       sort document ({@code {field: 1|-1}}), or {@code null} for store order
 * @param limit      maximum number of documents; {@code 0} means no limit
 * @param skip       number of leading documents to skip
 * @param projection projection document, or {@code null} for full documents
 */
public record FindOptions(Document sort, int limit, int skip, Document projection) {
  private static final FindOptions NONE = new FindOptions(null, 0, 0, null);

  public FindOptions {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (skip < 0) throw new IllegalArgumentException("skip must be >= 0");
  }

  public static FindOptions none() { return NONE; }

  public FindOptions withSort(Document sort) { return new FindOptions(sort, limit, skip, projection); }
  public FindOptions withLimit(int limit) { return new FindOptions(sort, limit, skip, projection); }
  public FindOptions withSkip(int skip) { return new FindOptions(sort, limit, skip, projection); }
  public FindOptions withProjection(Document projection) { return new FindOptions(sort, limit, skip, projection); }
}

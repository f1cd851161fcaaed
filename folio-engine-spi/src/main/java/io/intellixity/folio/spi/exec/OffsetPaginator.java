package io.intellixity.folio.spi.exec;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.cursor.PaginationCursor;
import io.intellixity.folio.match.DocumentPaths;
import io.intellixity.folio.page.Connection;
import io.intellixity.folio.page.Edge;
import io.intellixity.folio.page.EdgeFormatter;
import io.intellixity.folio.page.OffsetPageInfo;
import io.intellixity.folio.query.OffsetPage;
import io.intellixity.folio.query.Page;
import io.intellixity.folio.query.PageQuery;
import io.intellixity.folio.query.QueryFilters;
import io.intellixity.folio.query.SortField;
import io.intellixity.folio.query.SortOrders;
import io.intellixity.folio.spi.store.DocumentStore;
import io.intellixity.folio.spi.store.FindOptions;
import io.intellixity.folio.util.LazyResult;
import io.intellixity.folio.validation.DefaultPageQueryValidationStrategy;
import io.intellixity.folio.validation.PageQueryValidationStrategy;
import io.intellixity.folio.validation.PaginationMode;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;

/**
 * Skip/limit pagination against a {@link DocumentStore}.
 *
 * <p>One query answers both neighbours: it starts one record early (when {@code offset > 0}) and
 * reads one record past the page, so the previous and next sentinels come back with the page.</p>
 */
public final class OffsetPaginator {
  private static final Logger log = LoggerFactory.getLogger(OffsetPaginator.class);

  private final DocumentStore store;
  private final PaginationSettings settings;
  private final PageQueryValidationStrategy validation;
  private final EdgeFormatter formatter;
  private final Consumer<List<Document>> onLoadEdges;

  public OffsetPaginator(DocumentStore store) {
    this(store, PaginationSettings.load());
  }

  public OffsetPaginator(DocumentStore store, PaginationSettings settings) {
    this(store, settings, new DefaultPageQueryValidationStrategy(), EdgeFormatter.identity(), null);
  }

  /**
   * @param onLoadEdges receives the page's nodes once, when {@link Connection#edges()} first resolves
   *                    (e.g. to prime a batch loader); may be {@code null}
   */
  public OffsetPaginator(DocumentStore store,
                         PaginationSettings settings,
                         PageQueryValidationStrategy validation,
                         EdgeFormatter formatter,
                         Consumer<List<Document>> onLoadEdges) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.validation = (validation == null) ? new DefaultPageQueryValidationStrategy() : validation;
    this.formatter = (formatter == null) ? EdgeFormatter.identity() : formatter;
    this.onLoadEdges = (onLoadEdges == null) ? nodes -> { } : onLoadEdges;
  }

  public Connection<OffsetPageInfo> find(PageQuery query) {
    Page effective = (query == null || query.page() == null) ? OffsetPage.of(0, settings.defaultLimit()) : query.page();
    validation.validate(query, effective, PaginationMode.OFFSET, settings);

    OffsetPage page = (OffsetPage) effective;
    String idField = (query.idPath() == null) ? settings.idField() : query.idPath();
    SortField sort = (query.primarySort() == null) ? SortField.asc(idField) : query.primarySort();

    return new OffsetConnection(
        page,
        idField,
        SortOrders.toSortDocument(sort, idField),
        QueryFilters.copy(query.filter()),
        Projections.keepingId(query.projection(), idField));
  }

  private record Window(List<Document> results, boolean hasMoreResults, boolean hasPreviousResults) {}

  private final class OffsetConnection implements Connection<OffsetPageInfo> {
    private final OffsetPage page;
    private final String idField;
    private final Document sort;
    private final Document filter;
    private final Document projection;

    private final LazyResult<Window> window;
    private final LazyResult<List<Edge>> edges;
    private final LazyResult<Long> total;
    private final OffsetPageInfo info = new Info();

    OffsetConnection(OffsetPage page, String idField, Document sort, Document filter, Document projection) {
      this.page = page;
      this.idField = idField;
      this.sort = sort;
      this.filter = filter;
      this.projection = projection;
      this.window = LazyResult.of(this::fetchWindow);
      this.edges = LazyResult.of(() -> window.get().thenApply(w -> {
        onLoadEdges.accept(w.results());
        return toEdges(w.results());
      }));
      this.total = LazyResult.of(() -> store.countDocuments(filter));
    }

    private CompletionStage<Window> fetchWindow() {
      int offset = page.offset();
      int limit = page.limit();
      FindOptions options = FindOptions.none()
          .withSort(sort)
          .withLimit(limit + 1 + (offset > 0 ? 1 : 0))
          .withSkip(Math.max(offset - 1, 0))
          .withProjection(projection);

      return store.find(filter, options).thenApply(raw -> {
        List<Document> results = new ArrayList<>(raw);
        boolean hasPrevious = false;
        if (offset > 0 && !results.isEmpty()) {
          results.remove(0);
          hasPrevious = true;
        }
        boolean hasMore = results.size() > limit;
        if (hasMore) results.remove(results.size() - 1);

        if (log.isDebugEnabled()) {
          log.debug("folio.offset window offset={} limit={} fetched={} returned={} hasPrevious={} hasMore={}",
              offset, limit, raw.size(), results.size(), hasPrevious, hasMore);
        }
        return new Window(Collections.unmodifiableList(results), hasMore, hasPrevious);
      });
    }

    private List<Edge> toEdges(List<Document> results) {
      List<Edge> out = new ArrayList<>(results.size());
      for (Document node : results) {
        out.add(formatter.format(Edge.lazy(node, () -> cursorOf(node))));
      }
      return out;
    }

    private String cursorOf(Document node) {
      Object id = DocumentPaths.get(node, idField);
      if (id == null) throw new IllegalStateException("Store returned a document without '" + idField + "'");
      return PaginationCursor.encode(id);
    }

    @Override
    public CompletionStage<Long> totalCount() {
      return total.get();
    }

    @Override
    public CompletionStage<List<Edge>> edges() {
      return edges.get();
    }

    @Override
    public OffsetPageInfo pageInfo() {
      return info;
    }

    private final class Info implements OffsetPageInfo {
      @Override
      public int startOffset() {
        return page.offset();
      }

      @Override
      public CompletionStage<Integer> endOffset() {
        return window.get().thenApply(w -> page.offset() + w.results().size());
      }

      @Override
      public CompletionStage<Boolean> hasNextPage() {
        return window.get().thenApply(Window::hasMoreResults);
      }

      @Override
      public CompletionStage<Boolean> hasPreviousPage() {
        return window.get().thenApply(Window::hasPreviousResults);
      }

      @Override
      public CompletionStage<String> startCursor() {
        return window.get().thenApply(w -> w.results().isEmpty() ? "" : cursorOf(w.results().get(0)));
      }

      @Override
      public CompletionStage<String> endCursor() {
        return window.get().thenApply(w -> w.results().isEmpty() ? "" : cursorOf(w.results().get(w.results().size() - 1)));
      }
    }
  }
}

package io.intellixity.folio.spi.exec;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.cursor.CursorDecodeException;
import io.intellixity.folio.cursor.PaginationCursor;
import io.intellixity.folio.match.DocumentPaths;
import io.intellixity.folio.page.Connection;
import io.intellixity.folio.page.Edge;
import io.intellixity.folio.page.EdgeFormatter;
import io.intellixity.folio.page.KeysetPageInfo;
import io.intellixity.folio.query.CursorDirection;
import io.intellixity.folio.query.CursorPage;
import io.intellixity.folio.query.Page;
import io.intellixity.folio.query.PageQuery;
import io.intellixity.folio.query.QueryFilters;
import io.intellixity.folio.query.SortField;
import io.intellixity.folio.query.SortOrders;
import io.intellixity.folio.spi.seek.PointLookup;
import io.intellixity.folio.spi.seek.SeekPredicate;
import io.intellixity.folio.spi.seek.SeekPredicates;
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
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Keyset (cursor) pagination against a {@link DocumentStore}.
 *
 * <p>Each {@link #find(PageQuery)} returns a connection that fetches its window on first access:
 * {@code limit + 1} records past the cursor (sort inverted for {@code BEFORE}), the extra record only
 * telling whether more exist on that side. The other side is answered by a single existence check
 * against the cursor's inclusive boundary, and absolute positions by one count.</p>
 *
 * <p>A {@code BEFORE} page with fewer than {@code limit} records left before the cursor is reset to
 * the first page in natural order.</p>
 */
public final class CursorPaginator {
  private static final Logger log = LoggerFactory.getLogger(CursorPaginator.class);

  private final DocumentStore store;
  private final PaginationSettings settings;
  private final PageQueryValidationStrategy validation;
  private final EdgeFormatter formatter;

  public CursorPaginator(DocumentStore store) {
    this(store, PaginationSettings.load());
  }

  public CursorPaginator(DocumentStore store, PaginationSettings settings) {
    this(store, settings, new DefaultPageQueryValidationStrategy(), EdgeFormatter.identity());
  }

  public CursorPaginator(DocumentStore store,
                         PaginationSettings settings,
                         PageQueryValidationStrategy validation,
                         EdgeFormatter formatter) {
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.validation = (validation == null) ? new DefaultPageQueryValidationStrategy() : validation;
    this.formatter = (formatter == null) ? EdgeFormatter.identity() : formatter;
  }

  /**
   * Validates the query and decodes its cursor before returning; nothing touches the store until
   * the connection is read.
   *
   * @throws io.intellixity.folio.query.QueryValidationException if the query is not a valid cursor query
   * @throws CursorDecodeException                               if the cursor is malformed
   */
  public Connection<KeysetPageInfo> find(PageQuery query) {
    Page effective = (query == null || query.page() == null) ? CursorPage.first(settings.defaultLimit()) : query.page();
    validation.validate(query, effective, PaginationMode.CURSOR, settings);

    CursorPage page = (CursorPage) effective;
    Object cursorId = null;
    if (page.hasCursor()) {
      cursorId = PaginationCursor.decode(page.cursor());
      if (cursorId == null) throw new CursorDecodeException("Cursor position is null");
    }
    String idField = (query.idPath() == null) ? settings.idField() : query.idPath();
    SortField sort = (query.primarySort() == null) ? SortField.asc(idField) : query.primarySort();

    return new KeysetConnection(
        page,
        cursorId,
        sort,
        idField,
        QueryFilters.copy(query.filter()),
        Projections.keepingId(query.projection(), idField));
  }

  private record Window(List<Document> results, boolean hasMoreResults, boolean reset) {}

  private record Positions(long start, long end) {}

  private final class KeysetConnection implements Connection<KeysetPageInfo> {
    private final CursorPage page;
    private final Object cursorId;
    private final String idField;
    private final Document filter;
    private final Document projection;
    private final Document naturalSort;
    private final Document querySort;

    private final LazyResult<SeekPredicate> seek;
    private final LazyResult<Window> window;
    private final LazyResult<List<Edge>> edges;
    private final LazyResult<Boolean> otherSide;
    private final LazyResult<Positions> positions;
    private final LazyResult<Long> total;
    private final KeysetPageInfo info = new Info();

    KeysetConnection(CursorPage page, Object cursorId, SortField sort, String idField, Document filter, Document projection) {
      this.page = page;
      this.cursorId = cursorId;
      this.idField = idField;
      this.filter = filter;
      this.projection = projection;
      this.naturalSort = SortOrders.toSortDocument(sort, idField);
      this.querySort = before() ? SortOrders.invert(naturalSort) : naturalSort;

      this.seek = LazyResult.of(() ->
          SeekPredicates.build(cursorId, page.direction(), sort, idField, PointLookup.of(store, idField)));
      this.window = LazyResult.of(this::fetchWindow);
      this.edges = LazyResult.of(() -> window.get().thenApply(w -> toEdges(w.results())));
      this.otherSide = LazyResult.of(this::checkOtherSide);
      this.positions = LazyResult.of(this::countPositions);
      this.total = LazyResult.of(() -> store.countDocuments(filter));
    }

    private boolean before() {
      return page.direction() == CursorDirection.BEFORE;
    }

    private CompletionStage<Window> fetchWindow() {
      int limit = page.limit();
      return seek.get().thenCompose(sp -> {
        Document q = QueryFilters.and(sp == null ? null : sp.toFilter(), filter);
        return store.find(q, options(querySort, limit + 1)).thenCompose(raw -> {
          if (before() && sp != null && raw.size() < limit) {
            return store.find(filter, options(naturalSort, limit + 1))
                .thenApply(first -> logged(trim(first, false, true), raw.size()));
          }
          return CompletableFuture.completedFuture(logged(trim(raw, before(), false), raw.size()));
        });
      });
    }

    private FindOptions options(Document sort, int limit) {
      return FindOptions.none().withSort(sort).withLimit(limit).withProjection(projection);
    }

    private Window trim(List<Document> raw, boolean reverse, boolean reset) {
      List<Document> results = new ArrayList<>(raw);
      if (reverse) Collections.reverse(results);
      boolean hasMore = results.size() > page.limit();
      if (hasMore) {
        // the peek record sits at the far end of the requested side
        if (reverse) results.remove(0);
        else results.remove(results.size() - 1);
      }
      return new Window(Collections.unmodifiableList(results), hasMore, reset);
    }

    private Window logged(Window w, int fetched) {
      if (log.isDebugEnabled()) {
        log.debug("folio.keyset window direction={} limit={} hasCursor={} fetched={} returned={} hasMore={} reset={}",
            page.direction(), page.limit(), cursorId != null, fetched, w.results().size(), w.hasMoreResults(), w.reset());
      }
      return w;
    }

    private CompletionStage<Boolean> checkOtherSide() {
      return seek.get().thenCompose(sp -> {
        if (sp == null) return CompletableFuture.completedFuture(false);
        FindOptions opts = FindOptions.none().withSort(querySort).withProjection(Projections.idOnly(idField));
        return store.findOne(QueryFilters.and(sp.boundary(), filter), opts).thenApply(Optional::isPresent);
      });
    }

    private CompletionStage<Positions> countPositions() {
      return window.get().thenCompose(w -> {
        long n = w.results().size();
        if (n == 0) return CompletableFuture.completedFuture(new Positions(0, 0));
        if (w.reset() || (cursorId == null && !before())) return CompletableFuture.completedFuture(new Positions(1, n));
        return seek.get().thenCompose(sp -> {
          if (sp == null) {
            // BEFORE without a cursor is the tail of the whole result set
            return total.get().thenApply(c -> new Positions(c - n + 1, c));
          }
          if (before()) {
            return store.countDocuments(QueryFilters.and(sp.toFilter(), filter)).thenApply(c -> new Positions(c - n + 1, c));
          }
          return store.countDocuments(QueryFilters.and(sp.boundary(), filter)).thenApply(c -> new Positions(c + 1, c + n));
        });
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
    public KeysetPageInfo pageInfo() {
      return info;
    }

    private final class Info implements KeysetPageInfo {
      @Override
      public CompletionStage<Boolean> hasNextPage() {
        if (!before()) return window.get().thenApply(Window::hasMoreResults);
        return window.get().thenCompose(w -> w.reset() ? CompletableFuture.completedFuture(w.hasMoreResults()) : otherSide.get());
      }

      @Override
      public CompletionStage<Boolean> hasPreviousPage() {
        if (before()) return window.get().thenApply(w -> !w.reset() && w.hasMoreResults());
        return otherSide.get();
      }

      @Override
      public CompletionStage<String> startCursor() {
        return window.get().thenApply(w -> w.results().isEmpty() ? "" : cursorOf(w.results().get(0)));
      }

      @Override
      public CompletionStage<String> endCursor() {
        return window.get().thenApply(w -> w.results().isEmpty() ? "" : cursorOf(w.results().get(w.results().size() - 1)));
      }

      @Override
      public CompletionStage<Long> startingPosition() {
        return positions.get().thenApply(Positions::start);
      }

      @Override
      public CompletionStage<Long> endingPosition() {
        return positions.get().thenApply(Positions::end);
      }
    }
  }
}

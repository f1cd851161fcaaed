package io.intellixity.folio.memory;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.cursor.CursorDecodeException;
import io.intellixity.folio.cursor.PaginationCursor;
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
import io.intellixity.folio.util.LazyResult;
import io.intellixity.folio.validation.DefaultPageQueryValidationStrategy;
import io.intellixity.folio.validation.PageQueryValidationStrategy;
import io.intellixity.folio.validation.PaginationMode;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * Cursor pagination over documents already in memory.
 *
 * <p>Documents are filtered, sorted (string keys folded, identifier appended ascending) and given a
 * cursor each; the page is then cut relay-style: {@code AFTER} drops everything up to and including
 * the cursor's record and keeps the first {@code limit}, {@code BEFORE} keeps what precedes it and
 * takes the last {@code limit}. A cursor whose record is not in the set leaves that side open.</p>
 */
public final class InMemoryCursorPaginator {
  private static final Logger log = LoggerFactory.getLogger(InMemoryCursorPaginator.class);

  private final PaginationSettings settings;
  private final PageQueryValidationStrategy validation;
  private final EdgeFormatter formatter;

  public InMemoryCursorPaginator() {
    this(PaginationSettings.load());
  }

  public InMemoryCursorPaginator(PaginationSettings settings) {
    this(settings, new DefaultPageQueryValidationStrategy(), EdgeFormatter.identity());
  }

  public InMemoryCursorPaginator(PaginationSettings settings,
                                 PageQueryValidationStrategy validation,
                                 EdgeFormatter formatter) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.validation = (validation == null) ? new DefaultPageQueryValidationStrategy() : validation;
    this.formatter = (formatter == null) ? EdgeFormatter.identity() : formatter;
  }

  /**
   * Validates the query and decodes its cursor right away; loading, filtering and sorting happen when
   * the returned connection is first read.
   */
  public Connection<KeysetPageInfo> find(DocumentSource source, PageQuery query) {
    Objects.requireNonNull(source, "source");
    Page effective = (query == null || query.page() == null) ? CursorPage.first(settings.defaultLimit()) : query.page();
    validation.validate(query, effective, PaginationMode.CURSOR_IN_MEMORY, settings);

    CursorPage page = (CursorPage) effective;
    Object cursorId = null;
    if (page.hasCursor()) {
      cursorId = PaginationCursor.decode(page.cursor());
      if (cursorId == null) throw new CursorDecodeException("Cursor position is null");
    }
    String idField = (query.idPath() == null) ? settings.idField() : query.idPath();
    Document filter = QueryFilters.copy(query.filter());
    List<SortField> sort = List.copyOf(query.sort());
    Object decodedId = cursorId;

    LazyResult<Slice> slice = LazyResult.of(() -> source.load().thenApply(docs -> {
      SortedEdges all = SortedEdges.prepare(docs, filter, sort, idField);
      Slice s = cut(all, decodedId, page.direction(), page.limit());
      if (log.isDebugEnabled()) {
        log.debug("folio.memory.cursor slice total={} start={} end={} direction={} hasCursor={}",
            all.size(), s.start(), s.end(), page.direction(), decodedId != null);
      }
      return s;
    }));
    return new MemoryConnection(slice, formatter);
  }

  /** {@code [start, end)} of the returned page within the sorted set. */
  record Slice(SortedEdges all, int start, int end) {
    boolean isEmpty() { return start >= end; }
  }

  static Slice cut(SortedEdges all, Object cursorId, CursorDirection direction, int limit) {
    int lo = 0;
    int hi = all.size();
    if (cursorId != null) {
      int at = all.indexOf(cursorId);
      if (at >= 0) {
        if (direction == CursorDirection.AFTER) lo = at + 1;
        else hi = at;
      }
    }
    int start = lo;
    int end = hi;
    if (direction == CursorDirection.AFTER) end = Math.min(hi, lo + limit);
    else start = Math.max(lo, hi - limit);
    return new Slice(all, start, end);
  }

  private static final class MemoryConnection implements Connection<KeysetPageInfo> {
    private final LazyResult<Slice> slice;
    private final EdgeFormatter formatter;
    private final LazyResult<List<Edge>> edges;
    private final KeysetPageInfo info;

    MemoryConnection(LazyResult<Slice> slice, EdgeFormatter formatter) {
      this.slice = slice;
      this.formatter = formatter;
      this.edges = LazyResult.of(() -> slice.get().thenApply(s -> s.all().edges(s.start(), s.end(), this.formatter)));
      this.info = new Info();
    }

    @Override
    public CompletionStage<Long> totalCount() {
      return slice.get().thenApply(s -> (long) s.all().size());
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
        return slice.get().thenApply(s -> s.end() < s.all().size());
      }

      @Override
      public CompletionStage<Boolean> hasPreviousPage() {
        return slice.get().thenApply(s -> s.start() > 0);
      }

      @Override
      public CompletionStage<String> startCursor() {
        return slice.get().thenApply(s -> s.isEmpty() ? "" : s.all().cursorAt(s.start()));
      }

      @Override
      public CompletionStage<String> endCursor() {
        return slice.get().thenApply(s -> s.isEmpty() ? "" : s.all().cursorAt(s.end() - 1));
      }

      @Override
      public CompletionStage<Long> startingPosition() {
        return slice.get().thenApply(s -> s.isEmpty() ? 0L : s.start() + 1L);
      }

      @Override
      public CompletionStage<Long> endingPosition() {
        return slice.get().thenApply(s -> s.isEmpty() ? 0L : (long) s.end());
      }
    }
  }
}

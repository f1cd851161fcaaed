package io.intellixity.folio.memory;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.page.Connection;
import io.intellixity.folio.page.Edge;
import io.intellixity.folio.page.EdgeFormatter;
import io.intellixity.folio.page.OffsetPageInfo;
import io.intellixity.folio.query.OffsetPage;
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

/** Offset pagination over documents already in memory; the page is {@code [offset, offset + limit)}. */
public final class InMemoryOffsetPaginator {
  private static final Logger log = LoggerFactory.getLogger(InMemoryOffsetPaginator.class);

  private final PaginationSettings settings;
  private final PageQueryValidationStrategy validation;
  private final EdgeFormatter formatter;

  public InMemoryOffsetPaginator() {
    this(PaginationSettings.load());
  }

  public InMemoryOffsetPaginator(PaginationSettings settings) {
    this(settings, new DefaultPageQueryValidationStrategy(), EdgeFormatter.identity());
  }

  public InMemoryOffsetPaginator(PaginationSettings settings,
                                 PageQueryValidationStrategy validation,
                                 EdgeFormatter formatter) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.validation = (validation == null) ? new DefaultPageQueryValidationStrategy() : validation;
    this.formatter = (formatter == null) ? EdgeFormatter.identity() : formatter;
  }

  public Connection<OffsetPageInfo> find(DocumentSource source, PageQuery query) {
    Objects.requireNonNull(source, "source");
    Page effective = (query == null || query.page() == null) ? OffsetPage.of(0, settings.defaultLimit()) : query.page();
    validation.validate(query, effective, PaginationMode.OFFSET_IN_MEMORY, settings);

    OffsetPage page = (OffsetPage) effective;
    String idField = (query.idPath() == null) ? settings.idField() : query.idPath();
    Document filter = QueryFilters.copy(query.filter());
    List<SortField> sort = List.copyOf(query.sort());

    LazyResult<SortedEdges> all = LazyResult.of(() -> source.load().thenApply(docs -> {
      SortedEdges sorted = SortedEdges.prepare(docs, filter, sort, idField);
      if (log.isDebugEnabled()) {
        log.debug("folio.memory.offset loaded total={} offset={} limit={}", sorted.size(), page.offset(), page.limit());
      }
      return sorted;
    }));
    return new MemoryConnection(all, page, formatter);
  }

  private static final class MemoryConnection implements Connection<OffsetPageInfo> {
    private final LazyResult<SortedEdges> all;
    private final OffsetPage page;
    private final LazyResult<List<Edge>> edges;
    private final OffsetPageInfo info;

    MemoryConnection(LazyResult<SortedEdges> all, OffsetPage page, EdgeFormatter formatter) {
      this.all = all;
      this.page = page;
      this.edges = LazyResult.of(() -> all.get().thenApply(s -> s.edges(start(s), end(s), formatter)));
      this.info = new Info();
    }

    private int start(SortedEdges s) {
      return Math.min(page.offset(), s.size());
    }

    private int end(SortedEdges s) {
      return (int) Math.min((long) page.offset() + page.limit(), s.size());
    }

    @Override
    public CompletionStage<Long> totalCount() {
      return all.get().thenApply(s -> (long) s.size());
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
        return all.get().thenApply(s -> s.size() == 0 ? null : page.offset() + Math.max(end(s) - start(s), 0));
      }

      @Override
      public CompletionStage<Boolean> hasNextPage() {
        return all.get().thenApply(s -> s.size() > (long) page.offset() + page.limit());
      }

      @Override
      public CompletionStage<Boolean> hasPreviousPage() {
        return all.get().thenApply(s -> page.offset() > 0 && s.size() > 0);
      }

      @Override
      public CompletionStage<String> startCursor() {
        return all.get().thenApply(s -> start(s) < end(s) ? s.cursorAt(start(s)) : "");
      }

      @Override
      public CompletionStage<String> endCursor() {
        return all.get().thenApply(s -> start(s) < end(s) ? s.cursorAt(end(s) - 1) : "");
      }
    }
  }
}

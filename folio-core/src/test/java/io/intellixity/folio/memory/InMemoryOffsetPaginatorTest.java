package io.intellixity.folio.memory;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.cursor.PaginationCursor;
import io.intellixity.folio.page.Connection;
import io.intellixity.folio.page.OffsetPageInfo;
import io.intellixity.folio.query.CursorPage;
import io.intellixity.folio.query.OffsetPage;
import io.intellixity.folio.query.PageQuery;
import io.intellixity.folio.query.QueryValidationException;
import io.intellixity.folio.query.SortField;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionStage;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryOffsetPaginatorTest {
  private static final List<Document> DOCS = List.of(
      new Document("_id", 1).append("rank", 30),
      new Document("_id", 2).append("rank", 10),
      new Document("_id", 3).append("rank", 50),
      new Document("_id", 4).append("rank", 20),
      new Document("_id", 5).append("rank", 40));

  private final InMemoryOffsetPaginator paginator = new InMemoryOffsetPaginator(PaginationSettings.defaults());

  private static <T> T join(CompletionStage<T> s) {
    return s.toCompletableFuture().join();
  }

  private Connection<OffsetPageInfo> page(int offset, int limit) {
    return paginator.find(DocumentSource.of(DOCS),
        new PageQuery().withSort(SortField.asc("rank")).withPage(OffsetPage.of(offset, limit)));
  }

  private static List<Object> ids(Connection<?> c) {
    return join(c.edges()).stream().map(e -> e.node().get("_id")).toList();
  }

  @Test
  void firstPage() {
    Connection<OffsetPageInfo> c = page(0, 2);

    assertEquals(List.of(2, 4), ids(c));
    assertEquals(5L, join(c.totalCount()));
    assertEquals(0, c.pageInfo().startOffset());
    assertEquals(2, join(c.pageInfo().endOffset()));
    assertTrue(join(c.pageInfo().hasNextPage()));
    assertFalse(join(c.pageInfo().hasPreviousPage()));
    assertEquals(PaginationCursor.encode(2), join(c.pageInfo().startCursor()));
    assertEquals(PaginationCursor.encode(4), join(c.pageInfo().endCursor()));
  }

  @Test
  void middleAndLastPages() {
    Connection<OffsetPageInfo> middle = page(2, 2);
    assertEquals(List.of(1, 5), ids(middle));
    assertTrue(join(middle.pageInfo().hasNextPage()));
    assertTrue(join(middle.pageInfo().hasPreviousPage()));

    Connection<OffsetPageInfo> last = page(4, 2);
    assertEquals(List.of(3), ids(last));
    assertFalse(join(last.pageInfo().hasNextPage()));
    assertEquals(5, join(last.pageInfo().endOffset()));
  }

  @Test
  void offsetPastTheEnd() {
    Connection<OffsetPageInfo> c = page(10, 2);
    assertEquals(List.of(), ids(c));
    assertEquals(10, join(c.pageInfo().endOffset()));
    assertTrue(join(c.pageInfo().hasPreviousPage()));
    assertEquals("", join(c.pageInfo().startCursor()));
    assertEquals("", join(c.pageInfo().endCursor()));
  }

  @Test
  void nothingMatchedHasNullEndOffset() {
    Connection<OffsetPageInfo> c = paginator.find(DocumentSource.of(DOCS),
        PageQuery.of(new Document("rank", new Document("$gt", 100))).withPage(OffsetPage.of(3, 2)));

    assertNull(join(c.pageInfo().endOffset()));
    assertFalse(join(c.pageInfo().hasPreviousPage()));
    assertFalse(join(c.pageInfo().hasNextPage()));
    assertEquals(0L, join(c.totalCount()));
  }

  @Test
  void rejectsCursorPage() {
    assertThrows(QueryValidationException.class,
        () -> paginator.find(DocumentSource.of(DOCS), new PageQuery().withPage(CursorPage.first(2))));
  }

  @Test
  void rejectsLimitAboveConfiguredMaximum() {
    InMemoryOffsetPaginator capped = new InMemoryOffsetPaginator(PaginationSettings.defaults().withMaxLimit(3));
    assertThrows(QueryValidationException.class,
        () -> capped.find(DocumentSource.of(DOCS), new PageQuery().withPage(OffsetPage.of(0, 4))));
  }
}

package io.intellixity.folio.validation;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.query.CursorPage;
import io.intellixity.folio.query.OffsetPage;
import io.intellixity.folio.query.PageQuery;
import io.intellixity.folio.query.QueryValidationException;
import io.intellixity.folio.query.SortField;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultPageQueryValidationStrategyTest {
  private final DefaultPageQueryValidationStrategy v = new DefaultPageQueryValidationStrategy();
  private final PaginationSettings settings = PaginationSettings.defaults().withMaxLimit(100);

  @Test
  void acceptsWellFormedQueries() {
    PageQuery q = new PageQuery().withSort(SortField.desc("createdAt")).withProjection(new Document("name", 1));
    assertDoesNotThrow(() -> v.validate(q, CursorPage.first(10), PaginationMode.CURSOR, settings));
    assertDoesNotThrow(() -> v.validate(q, OffsetPage.of(20, 10), PaginationMode.OFFSET, settings));
  }

  @Test
  void throwsOnPageKindMismatch() {
    PageQuery q = new PageQuery();
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> v.validate(q, OffsetPage.of(0, 10), PaginationMode.CURSOR, settings));
    assertTrue(ex.getMessage().contains("requires a cursor page"));
    assertThrows(QueryValidationException.class,
        () -> v.validate(q, CursorPage.first(10), PaginationMode.OFFSET_IN_MEMORY, settings));
  }

  @Test
  void throwsOnLimitAboveMaximum() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> v.validate(new PageQuery(), CursorPage.first(101), PaginationMode.CURSOR, settings));
    assertTrue(ex.getMessage().contains("exceeds the maximum of 100"));
  }

  @Test
  void throwsWhenUnboundedLimitWouldOverflowTheWindow() {
    PaginationSettings unbounded = PaginationSettings.defaults();
    PageQuery q = new PageQuery();

    assertThrows(QueryValidationException.class,
        () -> v.validate(q, CursorPage.first(Integer.MAX_VALUE), PaginationMode.CURSOR, unbounded));
    assertThrows(QueryValidationException.class,
        () -> v.validate(q, OffsetPage.of(0, Integer.MAX_VALUE), PaginationMode.OFFSET, unbounded));
    assertThrows(QueryValidationException.class,
        () -> v.validate(q, OffsetPage.of(Integer.MAX_VALUE - 5, 10), PaginationMode.OFFSET_IN_MEMORY, unbounded));
    assertDoesNotThrow(() -> v.validate(q, CursorPage.first(Integer.MAX_VALUE - 2), PaginationMode.CURSOR, unbounded));
  }

  @Test
  void storePaginationAcceptsOneSortField() {
    PageQuery q = new PageQuery().withSort(List.of(SortField.asc("a"), SortField.asc("b")));
    assertThrows(QueryValidationException.class,
        () -> v.validate(q, CursorPage.first(10), PaginationMode.CURSOR, settings));
    assertDoesNotThrow(() -> v.validate(q, CursorPage.first(10), PaginationMode.CURSOR_IN_MEMORY, settings));
  }

  @Test
  void throwsOnBlankOrDuplicateSortFields() {
    assertThrows(QueryValidationException.class, () -> v.validate(
        new PageQuery().withSort(SortField.asc(" ")), CursorPage.first(10), PaginationMode.CURSOR, settings));
    assertThrows(QueryValidationException.class, () -> v.validate(
        new PageQuery().withSort(List.of(SortField.asc("a"), SortField.desc("a"))),
        CursorPage.first(10), PaginationMode.CURSOR_IN_MEMORY, settings));
  }

  @Test
  void throwsWhenProjectionExcludesIdentifier() {
    PageQuery q = new PageQuery().withProjection(new Document("_id", 0).append("name", 1));
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> v.validate(q, CursorPage.first(10), PaginationMode.CURSOR, settings));
    assertTrue(ex.getMessage().contains("'_id'"));

    PageQuery custom = new PageQuery().withIdPath("uid").withProjection(new Document("uid", false));
    assertThrows(QueryValidationException.class,
        () -> v.validate(custom, OffsetPage.of(0, 10), PaginationMode.OFFSET, settings));
  }

  @Test
  void throwsOnMissingQuery() {
    assertThrows(QueryValidationException.class,
        () -> v.validate(null, CursorPage.first(10), PaginationMode.CURSOR, settings));
  }
}

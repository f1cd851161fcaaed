package io.intellixity.folio.query;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.folio.config.PaginationSettings;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class PageQueryJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void parsesCursorQuery() throws Exception {
    String s = """
        {
          "filter": { "ownerId": { "$oid": "65a1b2c3d4e5f60718293a4b" }, "status": "open" },
          "sort": [ { "field": "createdAt", "order": -1 } ],
          "page": { "type": "cursor", "limit": 25, "cursor": "abc", "direction": "BEFORE" },
          "projection": { "name": 1 },
          "idPath": "_id"
        }
        """;
    PageQuery q = JSON.readValue(s, PageQuery.class);

    assertEquals(new ObjectId("65a1b2c3d4e5f60718293a4b"), q.filter().get("ownerId"));
    assertEquals("open", q.filter().get("status"));
    assertEquals(List.of(SortField.desc("createdAt")), q.sort());
    assertEquals(new CursorPage(25, "abc", CursorDirection.BEFORE), q.page());
    assertEquals(new Document("name", 1), q.projection());
    assertEquals("_id", q.idPath());
  }

  @Test
  void parsesOffsetPageAndSingleSortObject() throws Exception {
    String s = """
        {
          "sort": { "field": "name", "dir": "DESC" },
          "page": { "type": "offset", "offset": 20, "limit": 10 }
        }
        """;
    PageQuery q = JSON.readValue(s, PageQuery.class);

    assertEquals(OffsetPage.of(20, 10), q.page());
    assertEquals(SortField.desc("name"), q.primarySort());
    assertTrue(q.filter().isEmpty());
    assertNull(q.idPath());
  }

  @Test
  void untypedPageWithOffsetIsOffsetPage() throws Exception {
    PageQuery q = JSON.readValue("{\"page\": {\"offset\": 3}}", PageQuery.class);
    assertEquals(OffsetPage.of(3, PaginationSettings.load().defaultLimit()), q.page());
    assertEquals(5, q.page().limit());
  }

  @Test
  void rejectsLimitsThatAreNotInts() {
    for (String limit : List.of("5.7", "1e20", "3000000000", "\"ten\"")) {
      Exception ex = assertThrows(Exception.class,
          () -> JSON.readValue("{\"page\": {\"limit\": " + limit + "}}", PageQuery.class), limit);
      assertTrue(validationFailure(ex), limit);
    }
  }

  @Test
  void untypedPageDefaultsToFirstCursorPage() throws Exception {
    PageQuery q = JSON.readValue("{\"page\": {\"limit\": 4}}", PageQuery.class);
    assertEquals(CursorPage.first(4), q.page());
  }

  @Test
  void rejectsUnknownPageType() {
    Exception ex = assertThrows(Exception.class,
        () -> JSON.readValue("{\"page\": {\"type\": \"random\"}}", PageQuery.class));
    assertTrue(rootCause(ex) instanceof QueryValidationException);
  }

  @Test
  void writesCanonicalFormThatReadsBack() throws Exception {
    PageQuery q = PageQuery.of(new Document("status", "open"))
        .withSort(SortField.asc("name"))
        .withPage(CursorPage.after("xyz", 15))
        .withProjection(new Document("name", 1))
        .withIdPath("_id");

    String json = JSON.writeValueAsString(q);
    assertTrue(json.contains("\"type\":\"cursor\""));

    PageQuery back = JSON.readValue(json, PageQuery.class);
    assertEquals(q.filter(), back.filter());
    assertEquals(q.sort(), back.sort());
    assertEquals(q.page(), back.page());
    assertEquals(q.projection(), back.projection());
    assertEquals(q.idPath(), back.idPath());
  }

  private static boolean validationFailure(Throwable t) {
    for (Throwable c = t; c != null; c = (c.getCause() == c) ? null : c.getCause()) {
      if (c instanceof QueryValidationException) return true;
    }
    return false;
  }

  private static Throwable rootCause(Throwable t) {
    Throwable c = t;
    while (c.getCause() != null && c.getCause() != c) c = c.getCause();
    return c;
  }
}

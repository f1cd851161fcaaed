package io.intellixity.folio.match;

import io.intellixity.folio.query.QueryValidationException;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentFilterTest {
  private static final List<Document> PEOPLE = List.of(
      new Document("_id", 1).append("name", "Ada").append("age", 36).append("tags", List.of("math", "code"))
          .append("langs", List.of(new Document("name", "en").append("level", 9), new Document("name", "fr").append("level", 4))),
      new Document("_id", 2).append("name", "Grace").append("age", 45.0).append("tags", List.of("navy")),
      new Document("_id", 3).append("name", "alan").append("age", 41L).append("nickname", null),
      new Document("_id", 4).append("name", "Edsger").append("tags", List.of()));

  private static List<Object> ids(Document query) {
    return DocumentFilter.filter(PEOPLE, query).stream().map(d -> d.get("_id")).toList();
  }

  @Test
  void emptyQueryMatchesEverything() {
    assertEquals(List.of(1, 2, 3, 4), ids(new Document()));
    assertEquals(List.of(1, 2, 3, 4), ids(null));
  }

  @Test
  void comparesNumbersAcrossTypes() {
    assertEquals(List.of(2, 3), ids(new Document("age", new Document("$gt", 40))));
    assertEquals(List.of(1), ids(new Document("age", 36L)));
    assertEquals(List.of(2), ids(new Document("age", new Document("$gte", 45).append("$lte", 45.0))));
  }

  @Test
  void rangeOperatorsSkipOtherTypes() {
    assertEquals(List.of(), ids(new Document("name", new Document("$gt", 5))));
  }

  @Test
  void arrayFieldsMatchAnyElement() {
    assertEquals(List.of(1), ids(new Document("tags", "code")));
    assertEquals(List.of(1), ids(new Document("tags", new Document("$all", List.of("math", "code")))));
    assertEquals(List.of(4), ids(new Document("tags", new Document("$size", 0))));
    assertEquals(List.of(1), ids(new Document("tags", List.of("math", "code"))));
  }

  @Test
  void dottedPathsFanOutOverDocumentArrays() {
    assertEquals(List.of(1), ids(new Document("langs.name", "fr")));
    assertEquals(List.of(1), ids(new Document("langs.0.level", 9)));
    assertEquals(List.of(1), ids(new Document("langs", new Document("$elemMatch",
        new Document("name", "fr").append("level", new Document("$lt", 5))))));
    assertEquals(List.of(), ids(new Document("langs", new Document("$elemMatch",
        new Document("name", "fr").append("level", new Document("$gt", 5))))));
  }

  @Test
  void nullMatchesMissingAndExplicitNull() {
    assertEquals(List.of(1, 2, 3, 4), ids(new Document("nickname", null)));
    assertEquals(List.of(3), ids(new Document("nickname", new Document("$exists", true))));
    assertEquals(List.of(1, 2, 4), ids(new Document("nickname", new Document("$exists", false))));
  }

  @Test
  void membershipAndNegation() {
    assertEquals(List.of(1, 3), ids(new Document("_id", new Document("$in", List.of(1, 3, 9)))));
    assertEquals(List.of(2, 4), ids(new Document("_id", new Document("$nin", List.of(1, 3)))));
    assertEquals(List.of(1, 2, 4), ids(new Document("name", new Document("$ne", "alan"))));
    assertEquals(List.of(1, 4), ids(new Document("age", new Document("$not", new Document("$gt", 40)))));
  }

  @Test
  void regexInAllForms() {
    assertEquals(List.of(1, 3), ids(new Document("name", new Document("$regex", "^a").append("$options", "i"))));
    assertEquals(List.of(3), ids(new Document("name", Pattern.compile("^a"))));
    assertEquals(List.of(2, 4), ids(new Document("name", new Document("$not", Pattern.compile("^a", Pattern.CASE_INSENSITIVE)))));
  }

  @Test
  void logicalOperators() {
    Document young = new Document("age", new Document("$lt", 40));
    Document navy = new Document("tags", "navy");
    assertEquals(List.of(1, 2), ids(new Document("$or", List.of(young, navy))));
    assertEquals(List.of(), ids(new Document("$and", List.of(young, navy))));
    assertEquals(List.of(3, 4), ids(new Document("$nor", List.of(young, navy))));
  }

  @Test
  void unsupportedOperatorsAreRejected() {
    assertThrows(QueryValidationException.class, () -> ids(new Document("$where", "this.age > 1")));
    assertThrows(QueryValidationException.class, () -> ids(new Document("age", new Document("$mod", List.of(2, 0)))));
    assertThrows(QueryValidationException.class, () -> ids(new Document("$or", List.of())));
  }
}

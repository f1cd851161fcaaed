package io.intellixity.folio.match;

import io.intellixity.folio.query.SortField;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentComparatorTest {
  private static List<Object> idsSortedBy(List<Document> docs, java.util.Comparator<Document> c) {
    List<Document> copy = new ArrayList<>(docs);
    copy.sort(c);
    return copy.stream().map(d -> d.get("_id")).toList();
  }

  @Test
  void storeOrderingHonoursEveryKey() {
    List<Document> docs = List.of(
        new Document("_id", 1).append("v", 2),
        new Document("_id", 2).append("v", 1),
        new Document("_id", 3).append("v", 2),
        new Document("_id", 4));

    assertEquals(List.of(4, 2, 3, 1), idsSortedBy(docs, DocumentComparator.of(new Document("v", 1).append("_id", -1))));
    assertEquals(List.of(1, 3, 2, 4), idsSortedBy(docs, DocumentComparator.of(new Document("v", -1).append("_id", 1))));
  }

  @Test
  void storeOrderingIsCaseSensitive() {
    List<Document> docs = List.of(
        new Document("_id", 1).append("name", "banana"),
        new Document("_id", 2).append("name", "Cherry"));
    assertEquals(List.of(2, 1), idsSortedBy(docs, DocumentComparator.of(new Document("name", 1))));
  }

  @Test
  void naturalOrderingFoldsStrings() {
    List<Document> docs = List.of(
        new Document("_id", 1).append("name", "banana"),
        new Document("_id", 2).append("name", "Cherry"),
        new Document("_id", 3).append("name", "Éclair"),
        new Document("_id", 4).append("name", "apple"));

    List<SortField> sort = List.of(SortField.asc("name"));
    assertEquals(List.of(4, 1, 2, 3), idsSortedBy(docs, DocumentComparator.natural(sort)));
  }

  @Test
  void naturalOrderingTreatsFoldedDuplicatesAsTies() {
    Document a = new Document("_id", 1).append("name", "Zoë");
    Document b = new Document("_id", 2).append("name", "zoe");
    assertEquals(0, DocumentComparator.natural(List.of(SortField.asc("name"))).compare(a, b));
    assertTrue(DocumentComparator.natural(List.of(SortField.asc("name"), SortField.desc("_id"))).compare(a, b) > 0);
  }

  @Test
  void slugStripsAccentsAndPunctuation() {
    assertEquals("creme-brulee", DocumentComparator.slug("Crème Brûlée!"));
    assertEquals("a-b-c", DocumentComparator.slug("  A__b  C "));
  }

  @Test
  void nestedPathsAreResolved() {
    List<Document> docs = List.of(
        new Document("_id", 1).append("meta", new Document("rank", 5)),
        new Document("_id", 2).append("meta", new Document("rank", 3)));
    assertEquals(List.of(2, 1), idsSortedBy(docs, DocumentComparator.of(new Document("meta.rank", 1))));
  }
}

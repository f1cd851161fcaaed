package io.intellixity.folio.memory;

import io.intellixity.folio.cursor.PaginationCursor;
import io.intellixity.folio.match.DocumentComparator;
import io.intellixity.folio.match.DocumentFilter;
import io.intellixity.folio.match.DocumentPaths;
import io.intellixity.folio.match.ValueComparator;
import io.intellixity.folio.page.Edge;
import io.intellixity.folio.page.EdgeFormatter;
import io.intellixity.folio.query.QueryValidationException;
import io.intellixity.folio.query.SortField;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;

/**
 * Filtered, naturally sorted documents with their cursors attached up front.
 * Shared by both in-memory paginators.
 */
final class SortedEdges {
  record Entry(Document node, Object id, String cursor) {}

  private final List<Entry> entries;

  private SortedEdges(List<Entry> entries) {
    this.entries = entries;
  }

  static SortedEdges prepare(List<Document> docs, Document filter, List<SortField> sort, String idField) {
    List<Document> matched = DocumentFilter.filter(docs, filter);

    List<SortField> keys = new ArrayList<>(sort);
    if (keys.stream().noneMatch(sf -> sf.field().equals(idField))) keys.add(SortField.asc(idField));
    matched.sort(DocumentComparator.natural(keys));

    List<Entry> out = new ArrayList<>(matched.size());
    for (Document d : matched) {
      Object id = DocumentPaths.get(d, idField);
      if (id == null) {
        throw new QueryValidationException("Unable to extract an identifier using path '" + idField + "'");
      }
      out.add(new Entry(d, id, PaginationCursor.encode(id)));
    }
    return new SortedEdges(out);
  }

  int size() { return entries.size(); }

  /** Position of the entry whose identifier equals {@code id}, or {@code -1}. */
  int indexOf(Object id) {
    for (int i = 0; i < entries.size(); i++) {
      Object candidate = entries.get(i).id();
      if (ValueComparator.INSTANCE.comparable(candidate, id) && ValueComparator.INSTANCE.same(candidate, id)) return i;
    }
    return -1;
  }

  List<Edge> edges(int from, int to, EdgeFormatter formatter) {
    List<Edge> out = new ArrayList<>(Math.max(to - from, 0));
    for (int i = from; i < to; i++) {
      Entry e = entries.get(i);
      out.add(formatter.format(Edge.of(e.node(), e.cursor())));
    }
    return out;
  }

  String cursorAt(int index) {
    return entries.get(index).cursor();
  }
}

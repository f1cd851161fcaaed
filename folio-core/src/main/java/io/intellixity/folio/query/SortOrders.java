package io.intellixity.folio.query;

import org.bson.Document;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Sort document construction and inversion. */
public final class SortOrders {
  private SortOrders() {}

  /**
   * Returns a new sort document with every order multiplied by -1, keeping key order.
   * Used to run BEFORE queries with the same store sort machinery as AFTER.
   */
  public static Document invert(Document sort) {
    Document out = new Document();
    if (sort == null) return out;
    for (Map.Entry<String, Object> e : sort.entrySet()) {
      if (!(e.getValue() instanceof Number n)) {
        throw new IllegalArgumentException("Sort order for '" + e.getKey() + "' is not numeric: " + e.getValue());
      }
      out.put(e.getKey(), n.intValue() * -1);
    }
    return out;
  }

  /** {@code {field: order, idField: order}}; the identifier always comes last. */
  public static Document toSortDocument(SortField sort, String idField) {
    Objects.requireNonNull(sort, "sort");
    Objects.requireNonNull(idField, "idField");
    Document d = new Document(sort.field(), sort.order());
    if (!idField.equals(sort.field())) d.put(idField, sort.order());
    return d;
  }

  /** Multi-key variant; the identifier is appended ascending when no sort field names it. */
  public static Document toSortDocument(List<SortField> sort, String idField) {
    Objects.requireNonNull(idField, "idField");
    Document d = new Document();
    if (sort != null) {
      for (SortField sf : sort) d.put(sf.field(), sf.order());
    }
    if (!d.containsKey(idField)) d.put(idField, 1);
    return d;
  }
}

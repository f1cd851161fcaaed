package io.intellixity.folio.query;

import org.bson.Document;

import java.util.*;

/** Small builders for Mongo-style filter documents. */
public final class QueryFilters {
  private QueryFilters() {}

  public static Document eq(String field, Object value) { return new Document(field, new Document("$eq", value)); }

  public static Document compare(String field, Operator op, Object value) {
    return new Document(field, new Document(op.mongo(), value));
  }

  /** Conjunction of the non-empty parts; a single part is returned as is. */
  public static Document and(Document... parts) {
    List<Document> kept = new ArrayList<>();
    for (Document d : parts) {
      if (d != null && !d.isEmpty()) kept.add(d);
    }
    if (kept.isEmpty()) return new Document();
    if (kept.size() == 1) return kept.get(0);
    return new Document("$and", kept);
  }

  public static Document or(Document... parts) {
    return new Document("$or", List.of(parts));
  }

  /** Deep copy so that callers cannot mutate a filter a paginator already captured. */
  public static Document copy(Document source) {
    if (source == null) return new Document();
    return (Document) copyValue(source);
  }

  @SuppressWarnings("unchecked")
  private static Object copyValue(Object v) {
    if (v instanceof Document d) {
      Document out = new Document();
      for (Map.Entry<String, Object> e : d.entrySet()) out.put(e.getKey(), copyValue(e.getValue()));
      return out;
    }
    if (v instanceof Map<?, ?> m) {
      Document out = new Document();
      for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), copyValue(e.getValue()));
      return out;
    }
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object x : (List<Object>) l) out.add(copyValue(x));
      return out;
    }
    return v;
  }
}

package io.intellixity.folio.spi.exec;

import io.intellixity.folio.query.QueryFilters;
import org.bson.Document;

import java.util.Map;

/** Projection handling shared by the store-backed paginators. */
final class Projections {
  private Projections() {}

  /**
   * Copy of {@code projection} that keeps {@code idField}; {@code null} (full documents) when no
   * projection was requested.
   */
  static Document keepingId(Document projection, String idField) {
    if (projection == null || projection.isEmpty()) return null;
    Document out = QueryFilters.copy(projection);
    if (isInclusion(out, idField) && !out.containsKey(idField)) out.put(idField, 1);
    return out;
  }

  /** Identifier only, for existence checks. */
  static Document idOnly(String idField) {
    return new Document(idField, 1);
  }

  private static boolean isInclusion(Document projection, String idField) {
    for (Map.Entry<String, Object> e : projection.entrySet()) {
      if (e.getKey().equals(idField)) continue;
      Object v = e.getValue();
      if (v instanceof Boolean b && b) return true;
      if (v instanceof Number n && n.doubleValue() != 0) return true;
    }
    return false;
  }
}

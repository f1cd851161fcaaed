package io.intellixity.folio.validation;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.query.*;
import org.bson.Document;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Default, backend-agnostic page query validation.
 *
 * Validates:
 * <ul>
 *   <li>page kind against the paginator flavor, the configured maximum limit, and a window that fits an {@code int}</li>
 *   <li>sort fields (store-backed paginators accept a single one)</li>
 *   <li>projection keeps the identifier field, which cursors are minted from</li>
 * </ul>
 *
 * Violations throw {@link QueryValidationException}.
 */
public final class DefaultPageQueryValidationStrategy implements PageQueryValidationStrategy {
  /** Largest {@code offset + limit}; store paginators fetch up to two records past the page. */
  static final int MAX_WINDOW = Integer.MAX_VALUE - 2;

  @Override
  public void validate(PageQuery query, Page effectivePage, PaginationMode mode, PaginationSettings settings) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(settings, "settings");
    if (query == null) throw new QueryValidationException("query is required");

    validatePage(effectivePage, mode, settings);
    validateSort(query.sort(), mode);

    String idField = (query.idPath() == null) ? settings.idField() : query.idPath();
    if (idField.isBlank()) throw new QueryValidationException("idPath must not be blank");
    validateProjection(query.projection(), idField);
  }

  private static void validatePage(Page page, PaginationMode mode, PaginationSettings settings) {
    if (page == null) throw new QueryValidationException("page is required");
    if (mode.cursor() && !(page instanceof CursorPage)) {
      throw new QueryValidationException("Cursor pagination requires a cursor page but got: " + page.getClass().getSimpleName());
    }
    if (!mode.cursor() && !(page instanceof OffsetPage)) {
      throw new QueryValidationException("Offset pagination requires an offset page but got: " + page.getClass().getSimpleName());
    }
    if (settings.exceedsMax(page.limit())) {
      throw new QueryValidationException("limit " + page.limit() + " exceeds the maximum of " + settings.maxLimit());
    }
    long offset = (page instanceof OffsetPage o) ? o.offset() : 0;
    if (offset + page.limit() > MAX_WINDOW) {
      throw new QueryValidationException("offset " + offset + " with limit " + page.limit() + " exceeds the largest window of " + MAX_WINDOW);
    }
  }

  private static void validateSort(List<SortField> sort, PaginationMode mode) {
    if (sort == null || sort.isEmpty()) return;
    if (!mode.inMemory() && sort.size() > 1) {
      throw new QueryValidationException("Store pagination supports a single sort field but got " + sort.size());
    }
    Set<String> seen = new HashSet<>();
    for (SortField sf : sort) {
      if (sf == null) throw new QueryValidationException("sort must not contain null fields");
      if (sf.field().isBlank()) throw new QueryValidationException("Blank sort field");
      if (!seen.add(sf.field())) throw new QueryValidationException("Duplicate sort field '" + sf.field() + "'");
    }
  }

  private static void validateProjection(Document projection, String idField) {
    if (projection == null || projection.isEmpty()) return;
    for (Map.Entry<String, Object> e : projection.entrySet()) {
      if (e.getKey().equals(idField) && isExclusion(e.getValue())) {
        throw new QueryValidationException("Projection must not exclude the identifier field '" + idField + "'");
      }
    }
  }

  static boolean isExclusion(Object v) {
    if (v instanceof Boolean b) return !b;
    if (v instanceof Number n) return n.doubleValue() == 0;
    return false;
  }
}

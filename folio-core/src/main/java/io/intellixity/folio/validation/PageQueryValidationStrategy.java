package io.intellixity.folio.validation;

import io.intellixity.folio.config.PaginationSettings;
import io.intellixity.folio.query.Page;
import io.intellixity.folio.query.PageQuery;

/**
 * Hook to validate a query before any store access or in-memory work.
 * <p>
 * Paginators call this with the page they will actually use (the query's page, or the default
 * page from {@link PaginationSettings}). Applications may plug in stricter rules.
 */
public interface PageQueryValidationStrategy {
  void validate(PageQuery query, Page effectivePage, PaginationMode mode, PaginationSettings settings);
}

package io.intellixity.folio.query;

/** Page window requested by a caller: {@link CursorPage} or {@link OffsetPage}. */
public interface Page {
  int limit();
}

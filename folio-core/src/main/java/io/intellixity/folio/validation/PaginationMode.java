package io.intellixity.folio.validation;

/** The paginator flavor a query is validated for. */
public enum PaginationMode {
  CURSOR(true, false),
  OFFSET(false, false),
  CURSOR_IN_MEMORY(true, true),
  OFFSET_IN_MEMORY(false, true);

  private final boolean cursor;
  private final boolean inMemory;

  PaginationMode(boolean cursor, boolean inMemory) {
    this.cursor = cursor;
    this.inMemory = inMemory;
  }

  public boolean cursor() { return cursor; }
  public boolean inMemory() { return inMemory; }
}

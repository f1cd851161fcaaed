package io.intellixity.folio.query;

/**
 * Keyset (cursor) pagination window.
 *
 * <p>{@code cursor} is the opaque token of the edge to page from; {@code null} starts from the
 * natural beginning ({@link CursorDirection#AFTER}) or end ({@link CursorDirection#BEFORE}).</p>
 */
public record CursorPage(int limit, String cursor, CursorDirection direction) implements Page {
  public CursorPage {
    if (limit <= 0) throw new QueryValidationException("limit must be > 0");
    if (cursor != null && cursor.isBlank()) cursor = null;
    direction = (direction == null) ? CursorDirection.AFTER : direction;
  }

  public static CursorPage first(int limit) {
    return new CursorPage(limit, null, CursorDirection.AFTER);
  }

  public static CursorPage after(String cursor, int limit) {
    return new CursorPage(limit, cursor, CursorDirection.AFTER);
  }

  public static CursorPage before(String cursor, int limit) {
    return new CursorPage(limit, cursor, CursorDirection.BEFORE);
  }

  public boolean hasCursor() {
    return cursor != null;
  }
}

package io.intellixity.folio.query;

/** Which side of a cursor a keyset page is taken from. */
public enum CursorDirection {
  AFTER(1),
  BEFORE(-1);

  private final int sign;

  CursorDirection(int sign) {
    this.sign = sign;
  }

  public int sign() {
    return sign;
  }

  public static CursorDirection parse(String raw) {
    if (raw == null || raw.isBlank()) return AFTER;
    try {
      return CursorDirection.valueOf(raw.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown cursor direction: " + raw, e);
    }
  }
}

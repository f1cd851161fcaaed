package io.intellixity.folio.query;

public record OffsetPage(int offset, int limit) implements Page {
  public OffsetPage {
    if (limit <= 0) throw new QueryValidationException("limit must be > 0");
    if (offset < 0) throw new QueryValidationException("offset must be >= 0");
  }

  public static OffsetPage of(int offset, int limit) {
    return new OffsetPage(offset, limit);
  }
}

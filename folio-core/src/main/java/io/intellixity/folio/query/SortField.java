package io.intellixity.folio.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  /** Mongo-style order: {@code 1} ascending, {@code -1} descending. */
  public static SortField of(String field, int order) {
    return new SortField(field, Direction.fromOrder(order));
  }

  public int order() { return direction.order(); }

  public enum Direction {
    ASC(1),
    DESC(-1);

    private final int order;

    Direction(int order) {
      this.order = order;
    }

    public int order() { return order; }

    public static Direction fromOrder(int order) {
      if (order == 1) return ASC;
      if (order == -1) return DESC;
      throw new QueryValidationException("Sort order must be 1 or -1 but got: " + order);
    }
  }
}

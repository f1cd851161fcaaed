package io.intellixity.folio.query;

/** Range comparison operators used by seek predicates. */
public enum Operator {
  GT("$gt"),
  GE("$gte"),
  LT("$lt"),
  LE("$lte");

  private final String mongo;

  Operator(String mongo) {
    this.mongo = mongo;
  }

  /** Query operator key, e.g. {@code $gt}. */
  public String mongo() {
    return mongo;
  }

  /** Strict operator for {@code order * directionSign}: {@code 1 -> GT}, {@code -1 -> LT}. */
  public static Operator strict(int sign) {
    if (sign == 1) return GT;
    if (sign == -1) return LT;
    throw new IllegalArgumentException("sign must be 1 or -1 but got: " + sign);
  }

  /** Strict operator facing the other way ({@code GT <-> LT}, {@code GE <-> LE}). */
  public Operator opposite() {
    return switch (this) {
      case GT -> LT;
      case GE -> LE;
      case LT -> GT;
      case LE -> GE;
    };
  }

  /** Same direction, boundary included ({@code GT -> GE}, {@code LT -> LE}). */
  public Operator inclusive() {
    return switch (this) {
      case GT, GE -> GE;
      case LT, LE -> LE;
    };
  }
}

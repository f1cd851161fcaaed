package io.intellixity.folio.spi.seek;

import io.intellixity.folio.query.Operator;
import io.intellixity.folio.query.QueryFilters;
import org.bson.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Position of a cursor within a {@code (field, idField)} ordering, with the strict operator that
 * selects the records on the requested side of it.
 *
 * @param field   sort field; equal to {@code idField} for identifier-only ordering
 * @param value   the cursor record's value of {@code field} (unused for identifier-only ordering)
 * @param id      the cursor record's identifier
 * @param op      {@link Operator#GT} or {@link Operator#LT}
 * @param idField identifier field
 */
public record SeekPredicate(String field, Object value, Object id, Operator op, String idField) {
  public SeekPredicate {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(op, "op");
    Objects.requireNonNull(idField, "idField");
    if (op != Operator.GT && op != Operator.LT) throw new IllegalArgumentException("op must be strict but was " + op);
  }

  public static SeekPredicate simple(Object id, Operator op, String idField) {
    return new SeekPredicate(idField, null, id, op, idField);
  }

  public boolean compound() {
    return !field.equals(idField);
  }

  /** Records strictly past the cursor on the requested side. */
  public Document toFilter() {
    if (!compound()) return QueryFilters.compare(idField, op, id);
    return disjunction(op, tie(op));
  }

  /**
   * Records on the other side of the cursor, the cursor's own record included. Together with
   * {@link #toFilter()} it partitions every record.
   */
  public Document boundary() {
    Operator opposite = op.opposite();
    if (!compound()) return QueryFilters.compare(idField, opposite.inclusive(), id);
    return disjunction(opposite, tie(opposite.inclusive()));
  }

  // null and missing values sort below every other value, and range operators never match them
  private Document disjunction(Operator valueOp, Document tie) {
    List<Document> parts = new ArrayList<>(3);
    if (value == null) {
      if (valueOp == Operator.GT) parts.add(new Document(field, new Document("$ne", null)));
    } else {
      parts.add(QueryFilters.compare(field, valueOp, value));
      if (valueOp == Operator.LT) parts.add(QueryFilters.eq(field, null));
    }
    parts.add(tie);
    return (parts.size() == 1) ? tie : new Document("$or", parts);
  }

  private Document tie(Operator idOp) {
    return QueryFilters.eq(field, value).append(idField, new Document(idOp.mongo(), id));
  }
}

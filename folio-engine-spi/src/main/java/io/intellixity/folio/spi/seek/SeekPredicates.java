package io.intellixity.folio.spi.seek;

import io.intellixity.folio.match.DocumentPaths;
import io.intellixity.folio.query.CursorDirection;
import io.intellixity.folio.query.Operator;
import io.intellixity.folio.query.SortField;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the {@link SeekPredicate} for a decoded cursor.
 *
 * <p>Identifier ordering needs nothing but the cursor. Any other sort field needs the cursor
 * record's current value, fetched through a {@link PointLookup} projected to that field. A field
 * addressing an array position ({@code scores.2}) cannot be projected directly, so the lookup asks
 * for a one-element {@code $slice} of the array and takes that element.</p>
 */
public final class SeekPredicates {
  private static final Logger log = LoggerFactory.getLogger(SeekPredicates.class);
  private static final Pattern ARRAY_POSITION = Pattern.compile("^(.+)\\.(\\d{1,9})$");

  private SeekPredicates() {}

  /**
   * @return the predicate, or a stage completed with {@code null} when there is no cursor
   */
  public static CompletionStage<SeekPredicate> build(Object cursorId,
                                                     CursorDirection direction,
                                                     SortField sort,
                                                     String idField,
                                                     PointLookup lookup) {
    if (cursorId == null) return CompletableFuture.completedFuture(null);
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(sort, "sort");
    Objects.requireNonNull(idField, "idField");

    Operator op = Operator.strict(sort.order() * direction.sign());
    if (sort.field().equals(idField)) {
      return CompletableFuture.completedFuture(SeekPredicate.simple(cursorId, op, idField));
    }

    Objects.requireNonNull(lookup, "lookup");
    String field = sort.field();
    Matcher m = ARRAY_POSITION.matcher(field);
    boolean positional = m.matches();
    String arrayPath = positional ? m.group(1) : null;
    Document projection = positional
        ? new Document(arrayPath, new Document("$slice", List.of(Integer.parseInt(m.group(2)), 1)))
        : new Document(field, 1);

    return lookup.lookup(cursorId, projection).thenApply(found -> {
      Document doc = found.orElseThrow(() -> new CursorTargetNotFoundException(
          "No record with " + idField + " matching the cursor; it may have been deleted"));
      Object value = positional ? firstOfSlice(doc, arrayPath) : DocumentPaths.get(doc, field);
      if (log.isDebugEnabled()) {
        log.debug("folio.seek compound field={} op={} positional={}", field, op.mongo(), positional);
      }
      return new SeekPredicate(field, value, cursorId, op, idField);
    });
  }

  private static Object firstOfSlice(Document doc, String arrayPath) {
    Object slice = DocumentPaths.get(doc, arrayPath);
    if (slice instanceof List<?> l) return l.isEmpty() ? null : l.get(0);
    return slice;
  }
}

package io.intellixity.folio.match;

import io.intellixity.folio.query.SortField;
import org.bson.Document;

import java.text.Normalizer;
import java.util.*;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Multi-key document ordering.
 *
 * <p>{@link #of(Document)} orders the way a store does (plain {@link ValueComparator});
 * {@link #natural(List)} first folds string keys (accents stripped, lower-cased, punctuation
 * collapsed) so that "Zoë", "zoe" and "ZOE" sort together.</p>
 */
public final class DocumentComparator implements Comparator<Document> {
  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_WORD = Pattern.compile("[^a-z0-9]+");

  private final List<Key> keys;
  private final UnaryOperator<Object> keyFolding;

  private record Key(String path, int order) {}

  private DocumentComparator(List<Key> keys, UnaryOperator<Object> keyFolding) {
    this.keys = List.copyOf(keys);
    this.keyFolding = keyFolding;
  }

  /** Store-style ordering from a Mongo sort document ({@code {field: 1|-1, ...}}). */
  public static DocumentComparator of(Document sort) {
    List<Key> keys = new ArrayList<>();
    if (sort != null) {
      for (Map.Entry<String, Object> e : sort.entrySet()) {
        int order = (e.getValue() instanceof Number n) ? n.intValue() : 1;
        keys.add(new Key(e.getKey(), order < 0 ? -1 : 1));
      }
    }
    return new DocumentComparator(keys, UnaryOperator.identity());
  }

  /** Natural ordering for in-memory pagination. */
  public static DocumentComparator natural(List<SortField> sort) {
    List<Key> keys = new ArrayList<>();
    for (SortField sf : sort) keys.add(new Key(sf.field(), sf.order()));
    return new DocumentComparator(keys, DocumentComparator::fold);
  }

  @Override
  public int compare(Document a, Document b) {
    for (Key k : keys) {
      Object va = keyFolding.apply(DocumentPaths.get(a, k.path()));
      Object vb = keyFolding.apply(DocumentPaths.get(b, k.path()));
      int c = ValueComparator.INSTANCE.compare(va, vb);
      if (c != 0) return c * k.order();
    }
    return 0;
  }

  static Object fold(Object v) {
    if (!(v instanceof CharSequence cs)) return v;
    return slug(cs.toString());
  }

  /** {@code "Crème Brûlée!"} becomes {@code "creme-brulee"}. */
  static String slug(String s) {
    String stripped = DIACRITICS.matcher(Normalizer.normalize(s, Normalizer.Form.NFD)).replaceAll("");
    String dashed = NON_WORD.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll("-");
    int from = 0;
    int to = dashed.length();
    while (from < to && dashed.charAt(from) == '-') from++;
    while (to > from && dashed.charAt(to - 1) == '-') to--;
    return dashed.substring(from, to);
  }
}

package io.intellixity.folio.match;

import java.util.*;

/** Dotted-path access into documents ({@code a.b}, {@code tags.0}). */
public final class DocumentPaths {
  /** Marker for a path that does not exist, distinct from an explicit {@code null}. */
  static final Object MISSING = new Object() {
    @Override public String toString() { return "<missing>"; }
  };

  private DocumentPaths() {}

  /**
   * Plain lookup: maps are entered by key, lists by numeric segment. Anything else yields
   * {@code null}.
   */
  public static Object get(Object root, String path) {
    if (root == null || path == null || path.isBlank()) return null;
    Object cur = root;
    for (String seg : path.split("\\.")) {
      if (cur instanceof Map<?, ?> m) {
        cur = m.get(seg);
      } else if (cur instanceof List<?> l && isIndex(seg)) {
        int i = Integer.parseInt(seg);
        cur = (i < l.size()) ? l.get(i) : null;
      } else {
        return null;
      }
      if (cur == null) return null;
    }
    return cur;
  }

  /**
   * Query-style lookup: a non-numeric segment applied to a list fans out over its document elements,
   * the way MongoDB resolves {@code items.sku}. Returns every reachable leaf, or {@link #MISSING}
   * alone when nothing is reachable.
   */
  static List<Object> resolve(Object root, String path) {
    List<Object> out = new ArrayList<>();
    collect(root, path.split("\\."), 0, out);
    if (out.isEmpty()) out.add(MISSING);
    return out;
  }

  private static void collect(Object cur, String[] segs, int idx, List<Object> out) {
    if (idx == segs.length) {
      out.add(cur);
      return;
    }
    String seg = segs[idx];
    if (cur instanceof Map<?, ?> m) {
      if (!m.containsKey(seg)) return;
      collect(m.get(seg), segs, idx + 1, out);
      return;
    }
    if (cur instanceof List<?> l) {
      if (isIndex(seg)) {
        int i = Integer.parseInt(seg);
        if (i < l.size()) collect(l.get(i), segs, idx + 1, out);
        return;
      }
      for (Object el : l) {
        if (el instanceof Map<?, ?>) collect(el, segs, idx, out);
      }
    }
  }

  static boolean isIndex(String seg) {
    if (seg.isEmpty() || seg.length() > 9) return false;
    for (int i = 0; i < seg.length(); i++) {
      if (!Character.isDigit(seg.charAt(i))) return false;
    }
    return true;
  }
}

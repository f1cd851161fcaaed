package io.intellixity.folio.match;

import io.intellixity.folio.query.QueryValidationException;
import org.bson.BsonRegularExpression;
import org.bson.Document;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Evaluates MongoDB-style query documents against in-memory documents.
 *
 * <p>Supported: implicit equality, {@code $eq $ne $gt $gte $lt $lte $in $nin $exists $regex
 * $options $all $size $not $elemMatch}, and {@code $and $or $nor}. Paths may be dotted and fan out
 * over arrays of documents; a field holding an array matches when the array itself or any element
 * matches.</p>
 */
public final class DocumentFilter implements Predicate<Document> {
  private static final ValueComparator VALUES = ValueComparator.INSTANCE;

  private final Document query;

  private DocumentFilter(Document query) {
    this.query = (query == null) ? new Document() : query;
  }

  public static DocumentFilter compile(Document query) {
    return new DocumentFilter(query);
  }

  /** Keeps the documents matching {@code query}, in their original order. */
  public static List<Document> filter(Collection<Document> docs, Document query) {
    if (docs == null) return List.of();
    DocumentFilter f = compile(query);
    List<Document> out = new ArrayList<>();
    for (Document d : docs) {
      if (f.test(d)) out.add(d);
    }
    return out;
  }

  @Override
  public boolean test(Document doc) {
    return matches(doc, query);
  }

  private static boolean matches(Object doc, Map<?, ?> q) {
    for (Map.Entry<?, ?> e : q.entrySet()) {
      String key = String.valueOf(e.getKey());
      Object cond = e.getValue();
      boolean ok = switch (key) {
        case "$and" -> allMatch(doc, subQueries(key, cond));
        case "$or" -> anyMatch(doc, subQueries(key, cond));
        case "$nor" -> !anyMatch(doc, subQueries(key, cond));
        default -> {
          if (key.startsWith("$")) throw new QueryValidationException("Unsupported top-level operator: " + key);
          yield matchesField(DocumentPaths.resolve(doc, key), cond);
        }
      };
      if (!ok) return false;
    }
    return true;
  }

  private static boolean allMatch(Object doc, List<Map<?, ?>> parts) {
    for (Map<?, ?> p : parts) {
      if (!matches(doc, p)) return false;
    }
    return true;
  }

  private static boolean anyMatch(Object doc, List<Map<?, ?>> parts) {
    for (Map<?, ?> p : parts) {
      if (matches(doc, p)) return true;
    }
    return false;
  }

  private static List<Map<?, ?>> subQueries(String op, Object cond) {
    if (!(cond instanceof List<?> l) || l.isEmpty()) {
      throw new QueryValidationException(op + " expects a non-empty array");
    }
    List<Map<?, ?>> out = new ArrayList<>(l.size());
    for (Object o : l) {
      if (!(o instanceof Map<?, ?> m)) throw new QueryValidationException(op + " entries must be documents");
      out.add(m);
    }
    return out;
  }

  private static boolean matchesField(List<Object> values, Object cond) {
    if (isOperatorDocument(cond)) {
      Map<?, ?> ops = (Map<?, ?>) cond;
      for (Map.Entry<?, ?> op : ops.entrySet()) {
        String name = String.valueOf(op.getKey());
        if (name.equals("$options")) continue;
        if (!matchesOperator(values, name, op.getValue(), ops)) return false;
      }
      return true;
    }
    if (cond instanceof Pattern || cond instanceof BsonRegularExpression) {
      return anyCandidate(values, v -> regexMatches(toPattern(cond, null), v));
    }
    return equalsAny(values, cond);
  }

  private static boolean matchesOperator(List<Object> values, String op, Object arg, Map<?, ?> ops) {
    switch (op) {
      case "$eq":
        return equalsAny(values, arg);
      case "$ne":
        return !equalsAny(values, arg);
      case "$gt":
        return anyCandidate(values, v -> VALUES.comparable(v, arg) && VALUES.compare(v, arg) > 0);
      case "$gte":
        return anyCandidate(values, v -> VALUES.comparable(v, arg) && VALUES.compare(v, arg) >= 0);
      case "$lt":
        return anyCandidate(values, v -> VALUES.comparable(v, arg) && VALUES.compare(v, arg) < 0);
      case "$lte":
        return anyCandidate(values, v -> VALUES.comparable(v, arg) && VALUES.compare(v, arg) <= 0);
      case "$in":
        for (Object x : asList(op, arg)) {
          if (equalsAny(values, x)) return true;
        }
        return false;
      case "$nin":
        for (Object x : asList(op, arg)) {
          if (equalsAny(values, x)) return false;
        }
        return true;
      case "$exists": {
        boolean present = values.stream().anyMatch(v -> v != DocumentPaths.MISSING);
        return present == truthy(arg);
      }
      case "$regex": {
        Object options = ops.get("$options");
        Pattern p = toPattern(arg, options == null ? null : String.valueOf(options));
        return anyCandidate(values, v -> regexMatches(p, v));
      }
      case "$all":
        for (Object x : asList(op, arg)) {
          if (!equalsAny(values, x)) return false;
        }
        return true;
      case "$size": {
        if (!(arg instanceof Number n)) throw new QueryValidationException("$size expects a number");
        for (Object v : values) {
          if (v instanceof List<?> l && l.size() == n.intValue()) return true;
        }
        return false;
      }
      case "$not":
        if (arg instanceof Pattern || arg instanceof BsonRegularExpression) {
          return !anyCandidate(values, v -> regexMatches(toPattern(arg, null), v));
        }
        if (!isOperatorDocument(arg)) throw new QueryValidationException("$not expects an operator document or regex");
        return !matchesField(values, arg);
      case "$elemMatch": {
        if (!(arg instanceof Map<?, ?> sub)) throw new QueryValidationException("$elemMatch expects a document");
        for (Object v : values) {
          if (!(v instanceof List<?> l)) continue;
          for (Object el : l) {
            if (isOperatorDocument(sub) ? matchesField(List.of(el), sub) : (el instanceof Map<?, ?> && matches(el, sub))) {
              return true;
            }
          }
        }
        return false;
      }
      default:
        throw new QueryValidationException("Unsupported query operator: " + op);
    }
  }

  /** A leaf value that is an array offers both itself and its elements as candidates. */
  private static boolean anyCandidate(List<Object> values, Predicate<Object> p) {
    for (Object v : values) {
      if (v == DocumentPaths.MISSING) continue;
      if (p.test(v)) return true;
      if (v instanceof List<?> l) {
        for (Object el : l) {
          if (p.test(el)) return true;
        }
      }
    }
    return false;
  }

  private static boolean equalsAny(List<Object> values, Object expected) {
    if (expected == null) {
      // null matches explicit nulls and missing fields alike
      for (Object v : values) {
        if (v == null || v == DocumentPaths.MISSING) return true;
        if (v instanceof List<?> l && l.contains(null)) return true;
      }
      return false;
    }
    return anyCandidate(values, v -> VALUES.comparable(v, expected) && VALUES.same(v, expected));
  }

  private static boolean isOperatorDocument(Object cond) {
    if (!(cond instanceof Map<?, ?> m) || m.isEmpty()) return false;
    for (Object k : m.keySet()) {
      if (!String.valueOf(k).startsWith("$")) return false;
    }
    return true;
  }

  private static List<?> asList(String op, Object arg) {
    if (arg instanceof List<?> l) return l;
    if (arg instanceof Collection<?> c) return new ArrayList<>(c);
    throw new QueryValidationException(op + " expects an array");
  }

  private static boolean truthy(Object arg) {
    if (arg instanceof Boolean b) return b;
    if (arg instanceof Number n) return n.doubleValue() != 0;
    return arg != null;
  }

  private static Pattern toPattern(Object arg, String options) {
    if (arg instanceof Pattern p) return p;
    if (arg instanceof BsonRegularExpression re) return Pattern.compile(re.getPattern(), flags(re.getOptions()));
    return Pattern.compile(String.valueOf(arg), flags(options));
  }

  private static int flags(String options) {
    if (options == null) return 0;
    int f = 0;
    if (options.indexOf('i') >= 0) f |= Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    if (options.indexOf('m') >= 0) f |= Pattern.MULTILINE;
    if (options.indexOf('s') >= 0) f |= Pattern.DOTALL;
    if (options.indexOf('x') >= 0) f |= Pattern.COMMENTS;
    return f;
  }

  private static boolean regexMatches(Pattern p, Object v) {
    return (v instanceof CharSequence cs) && p.matcher(cs).find();
  }
}

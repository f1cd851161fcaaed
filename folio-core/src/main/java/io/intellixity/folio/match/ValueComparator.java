package io.intellixity.folio.match;

import org.bson.BsonTimestamp;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.MaxKey;
import org.bson.types.MinKey;
import org.bson.types.ObjectId;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Total order over BSON-like Java values, following MongoDB's type bracketing:
 * MinKey &lt; null &lt; numbers &lt; strings &lt; documents &lt; arrays &lt; binary &lt; ObjectId &lt;
 * booleans &lt; dates &lt; timestamps &lt; regex &lt; MaxKey.
 */
public final class ValueComparator implements Comparator<Object> {
  public static final ValueComparator INSTANCE = new ValueComparator();

  private ValueComparator() {}

  @Override
  public int compare(Object a, Object b) {
    a = normalize(a);
    b = normalize(b);
    int ra = rank(a);
    int rb = rank(b);
    if (ra != rb) return Integer.compare(ra, rb);

    switch (ra) {
      case 0, 1, 13:
        return 0;
      case 2:
        return compareNumbers((Number) a, (Number) b);
      case 3:
        return a.toString().compareTo(b.toString());
      case 4:
        return compareMaps((Map<?, ?>) a, (Map<?, ?>) b);
      case 5:
        return compareLists((List<?>) a, (List<?>) b);
      case 6:
        return compareBinary(a, b);
      case 7:
        return ((ObjectId) a).compareTo((ObjectId) b);
      case 8:
        return Boolean.compare((Boolean) a, (Boolean) b);
      case 9:
        return Long.compare(epochMillis(a), epochMillis(b));
      case 10:
        return ((BsonTimestamp) a).compareTo((BsonTimestamp) b);
      default:
        return a.toString().compareTo(b.toString());
    }
  }

  /** Equality as a query sees it: {@code 1 == 1L == 1.0}, documents and arrays element-wise. */
  public boolean same(Object a, Object b) {
    return compare(a, b) == 0;
  }

  /** Whether an ordering comparison ({@code $gt} etc.) between the two is meaningful. */
  public boolean comparable(Object a, Object b) {
    return rank(normalize(a)) == rank(normalize(b));
  }

  private static Object normalize(Object v) {
    if (v == DocumentPaths.MISSING) return null;
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    if (v instanceof Character c) return String.valueOf(c);
    return v;
  }

  static int rank(Object v) {
    if (v instanceof MinKey) return 0;
    if (v == null) return 1;
    if (v instanceof Number) return 2;
    if (v instanceof CharSequence) return 3;
    if (v instanceof Map<?, ?>) return 4;
    if (v instanceof List<?>) return 5;
    if (v instanceof Binary || v instanceof byte[] || v instanceof UUID) return 6;
    if (v instanceof ObjectId) return 7;
    if (v instanceof Boolean) return 8;
    if (v instanceof Date || v instanceof Instant) return 9;
    if (v instanceof BsonTimestamp) return 10;
    if (v instanceof Pattern) return 11;
    if (v instanceof MaxKey) return 13;
    return 12;
  }

  private static int compareNumbers(Number a, Number b) {
    if (isIntegral(a) && isIntegral(b)) return Long.compare(a.longValue(), b.longValue());
    if (a instanceof Decimal128 || b instanceof Decimal128 || a instanceof BigDecimal || b instanceof BigDecimal) {
      return toBigDecimal(a).compareTo(toBigDecimal(b));
    }
    return Double.compare(a.doubleValue(), b.doubleValue());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof Decimal128 d) return d.bigDecimalValue();
    if (n instanceof BigDecimal bd) return bd;
    if (isIntegral(n)) return BigDecimal.valueOf(n.longValue());
    return BigDecimal.valueOf(n.doubleValue());
  }

  private int compareMaps(Map<?, ?> a, Map<?, ?> b) {
    Iterator<? extends Map.Entry<?, ?>> ia = a.entrySet().iterator();
    Iterator<? extends Map.Entry<?, ?>> ib = b.entrySet().iterator();
    while (ia.hasNext() && ib.hasNext()) {
      Map.Entry<?, ?> ea = ia.next();
      Map.Entry<?, ?> eb = ib.next();
      int c = Integer.compare(rank(normalize(ea.getValue())), rank(normalize(eb.getValue())));
      if (c != 0) return c;
      c = String.valueOf(ea.getKey()).compareTo(String.valueOf(eb.getKey()));
      if (c != 0) return c;
      c = compare(ea.getValue(), eb.getValue());
      if (c != 0) return c;
    }
    return Boolean.compare(ia.hasNext(), ib.hasNext());
  }

  private int compareLists(List<?> a, List<?> b) {
    int n = Math.min(a.size(), b.size());
    for (int i = 0; i < n; i++) {
      int c = compare(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return Integer.compare(a.size(), b.size());
  }

  private static int compareBinary(Object a, Object b) {
    if (a instanceof UUID ua && b instanceof UUID ub) return ua.compareTo(ub);
    byte[] ba = bytes(a);
    byte[] bb = bytes(b);
    if (ba.length != bb.length) return Integer.compare(ba.length, bb.length);
    return Arrays.compareUnsigned(ba, bb);
  }

  private static byte[] bytes(Object v) {
    if (v instanceof Binary bin) return bin.getData();
    if (v instanceof byte[] raw) return raw;
    return v.toString().getBytes(java.nio.charset.StandardCharsets.UTF_8);
  }

  private static long epochMillis(Object v) {
    if (v instanceof Date d) return d.getTime();
    return ((Instant) v).toEpochMilli();
  }
}

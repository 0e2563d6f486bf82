package io.intellixity.pagekit.row;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;
import java.util.Locale;

/**
 * Value normalization and ordering shared by filtering, sorting and cursor keys.
 *
 * <p>Normalized values are {@code String}, {@code Long}, {@code Double}, {@code Boolean} and {@code Instant}.
 */
public final class Values {
  private Values() {}

  /** Normalize a raw attribute value; rejects types a row cannot hold. */
  public static Object normalize(Object v) {
    Object n = normalizeOrNull(v);
    if (v != null && n == null) {
      throw new IllegalArgumentException("Unsupported row value type: " + v.getClass().getName());
    }
    return n;
  }

  /** Like {@link #normalize(Object)} but returns null for unsupported types instead of throwing. */
  public static Object normalizeOrNull(Object v) {
    if (v == null) return null;
    if (v instanceof String || v instanceof Boolean || v instanceof Instant) return v;
    if (v instanceof Long) return v;
    if (v instanceof Integer || v instanceof Short || v instanceof Byte) return ((Number) v).longValue();
    if (v instanceof BigInteger bi) return (bi.bitLength() < 64) ? bi.longValue() : bi.doubleValue();
    if (v instanceof Double) return v;
    if (v instanceof Float || v instanceof BigDecimal) return ((Number) v).doubleValue();
    if (v instanceof OffsetDateTime odt) return odt.toInstant();
    if (v instanceof ZonedDateTime zdt) return zdt.toInstant();
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Character c) return String.valueOf(c);
    if (v instanceof Enum<?> e) return e.name();
    return null;
  }

  public static boolean isNumber(Object v) { return v instanceof Long || v instanceof Double; }

  /**
   * Equality across normalized values: numbers compare numerically regardless of integer/float,
   * everything else by {@link Object#equals(Object)}.
   */
  public static boolean same(Object a, Object b) {
    if (a == null || b == null) return a == b;
    if (isNumber(a) && isNumber(b)) return compareNumbers(a, b) == 0;
    return a.equals(b);
  }

  /**
   * Ordering used by range predicates. Returns null when the pair is not orderable
   * (different kinds, booleans, nulls).
   */
  public static Integer compareOrderable(Object a, Object b) {
    if (a == null || b == null) return null;
    if (isNumber(a) && isNumber(b)) return compareNumbers(a, b);
    if (a instanceof Instant x && b instanceof Instant y) return x.compareTo(y);
    if (a instanceof String x && b instanceof String y) return compareIgnoreCase(x, y);
    return null;
  }

  /**
   * Total ordering over normalized values: null first, then booleans, numbers, timestamps, strings.
   * Strings compare case-insensitively by code point with a case-sensitive secondary pass, so
   * distinct values never compare equal.
   */
  public static int compareTotal(Object a, Object b) {
    if (a == b) return 0;
    if (a == null) return -1;
    if (b == null) return 1;
    int ra = rank(a);
    int rb = rank(b);
    if (ra != rb) return Integer.compare(ra, rb);
    if (a instanceof Boolean x) return Boolean.compare(x, (Boolean) b);
    if (isNumber(a)) {
      int c = compareNumbers(a, b);
      // 1 and 1.0 are numerically equal; keep them distinct for a strict order
      return (c != 0) ? c : Boolean.compare(a instanceof Double, b instanceof Double);
    }
    if (a instanceof Instant x) return x.compareTo((Instant) b);
    String x = (String) a;
    String y = (String) b;
    int c = compareIgnoreCase(x, y);
    return (c != 0) ? c : compareCodePoints(x, y);
  }

  /**
   * Natural order for record ids: all-digit ids first, numerically ({@code "2" < "10"}), then every
   * other id by {@link #compareTotal(Object, Object)}.
   */
  public static int compareIds(String a, String b) {
    boolean da = isDigits(a);
    boolean db = isDigits(b);
    if (da != db) return da ? -1 : 1;
    if (!da) return compareTotal(a, b);
    String x = stripLeadingZeros(a);
    String y = stripLeadingZeros(b);
    if (x.length() != y.length()) return Integer.compare(x.length(), y.length());
    int c = x.compareTo(y);
    // "007" and "7" are the same number but different ids
    return (c != 0) ? c : Integer.compare(a.length(), b.length());
  }

  public static int compareIgnoreCase(String a, String b) {
    return compareCodePoints(a.toLowerCase(Locale.ROOT), b.toLowerCase(Locale.ROOT));
  }

  static int compareCodePoints(String a, String b) {
    int i = 0;
    int j = 0;
    while (i < a.length() && j < b.length()) {
      int ca = a.codePointAt(i);
      int cb = b.codePointAt(j);
      if (ca != cb) return Integer.compare(ca, cb);
      i += Character.charCount(ca);
      j += Character.charCount(cb);
    }
    return Integer.compare(a.length() - i, b.length() - j);
  }

  private static boolean isDigits(String s) {
    if (s.isEmpty()) return false;
    for (int i = 0; i < s.length(); i++) {
      char ch = s.charAt(i);
      if (ch < '0' || ch > '9') return false;
    }
    return true;
  }

  private static String stripLeadingZeros(String s) {
    int i = 0;
    while (i < s.length() - 1 && s.charAt(i) == '0') i++;
    return s.substring(i);
  }

  private static int compareNumbers(Object a, Object b) {
    if (a instanceof Long x && b instanceof Long y) return Long.compare(x, y);
    return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
  }

  private static int rank(Object v) {
    if (v instanceof Boolean) return 1;
    if (isNumber(v)) return 2;
    if (v instanceof Instant) return 3;
    if (v instanceof String) return 4;
    throw new IllegalArgumentException("Not a normalized row value: " + v.getClass().getName());
  }
}

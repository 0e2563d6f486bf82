package io.intellixity.pagekit.query;

import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.row.FieldType;
import io.intellixity.pagekit.row.RowSchema;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Translates flat query-string parameters into a {@link Query}.
 *
 * <p>Reserved parameters: {@code page}, {@code limit}, {@code cursor}, {@code direction},
 * {@code sort} ({@code sort=age,-createdAt}) and {@code totalCount}. Any other parameter is a filter
 * leaf written as {@code field_operator=value} ({@code age_gte=30}, {@code role_in=ADMIN,USER});
 * a bare {@code field=value} means equality. Leaves are combined with AND.</p>
 */
public final class QueryStringTranslator {
  public static final String PAGE = "page";
  public static final String LIMIT = "limit";
  public static final String CURSOR = "cursor";
  public static final String DIRECTION = "direction";
  public static final String SORT = "sort";
  public static final String TOTAL_COUNT = "totalCount";

  private static final Set<String> RESERVED = Set.of(PAGE, LIMIT, CURSOR, DIRECTION, SORT, TOTAL_COUNT);

  // longest wire name first so "not_in" wins over "in"
  private static final List<Operator> BY_SUFFIX_LENGTH;

  static {
    List<Operator> ops = new ArrayList<>(List.of(Operator.values()));
    ops.sort(Comparator.comparingInt((Operator o) -> o.wireName().length()).reversed());
    BY_SUFFIX_LENGTH = List.copyOf(ops);
  }

  public enum Mode { OFFSET, CURSOR }

  private final RowSchema schema;

  public QueryStringTranslator() {
    this(null);
  }

  /** @param schema optional; when present, operands are coerced to the declared field types */
  public QueryStringTranslator(RowSchema schema) {
    this.schema = schema;
  }

  /** Offset mode unless {@code cursor} or {@code direction} is present. */
  public Query translate(Map<String, String> params) {
    boolean cursor = params != null && (params.containsKey(CURSOR) || params.containsKey(DIRECTION));
    return translate(params, cursor ? Mode.CURSOR : Mode.OFFSET);
  }

  /**
   * Translate in a fixed mode. An offset translation refuses {@code cursor} and {@code direction};
   * a cursor translation ignores {@code page}.
   */
  public Query translate(Map<String, String> params, Mode mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> p = (params == null) ? Map.of() : params;
    Query q = new Query();

    boolean cursorMode = mode == Mode.CURSOR;
    if (!cursorMode && (p.containsKey(CURSOR) || p.containsKey(DIRECTION))) {
      throw new QueryValidationException("'" + CURSOR + "' and '" + DIRECTION + "' are not accepted in offset mode");
    }
    Integer limit = parseInt(LIMIT, p.get(LIMIT));
    if (cursorMode) {
      CursorPage.Direction dir = parseDirection(p.get(DIRECTION));
      q.withPage(new CursorPage(dir, p.get(CURSOR), limit));
    } else {
      Integer page = parseInt(PAGE, p.get(PAGE));
      q.withPage(new OffsetPage(page == null ? 1 : page, limit));
    }

    q.withSort(parseSort(p.get(SORT)));
    q.withTotalCount(Boolean.parseBoolean(p.get(TOTAL_COUNT)));

    List<QueryElement> leaves = new ArrayList<>();
    for (var e : p.entrySet()) {
      if (e.getKey() == null || RESERVED.contains(e.getKey())) continue;
      leaves.add(leaf(e.getKey(), e.getValue()));
    }
    if (!leaves.isEmpty()) {
      q.withFilter(leaves.size() == 1 ? leaves.get(0) : new LogicalGroup(Clause.AND, leaves));
    }
    return q;
  }

  /** {@code "age,-createdAt"} → age ASC, createdAt DESC. */
  public static List<SortField> parseSort(String sort) {
    if (sort == null || sort.isBlank()) return List.of();
    List<SortField> out = new ArrayList<>();
    for (String part : sort.split(",")) {
      String s = part.trim();
      if (s.isEmpty()) continue;
      if (s.startsWith("-")) out.add(SortField.desc(s.substring(1).trim()));
      else if (s.startsWith("+")) out.add(SortField.asc(s.substring(1).trim()));
      else out.add(SortField.asc(s));
    }
    return out;
  }

  Condition leaf(String key, String raw) {
    if (schema != null && schema.has(key)) {
      return new Condition(key, Operator.EQ, coerce(key, raw));
    }
    for (Operator op : BY_SUFFIX_LENGTH) {
      String suffix = "_" + op.wireName();
      if (key.length() > suffix.length() && key.endsWith(suffix)) {
        String field = key.substring(0, key.length() - suffix.length());
        return condition(field, op, raw);
      }
    }
    return new Condition(key, Operator.EQ, coerce(key, raw));
  }

  private Condition condition(String field, Operator op, String raw) {
    if (op.presence()) return new Condition(field, op, null);
    if (op.membership()) {
      List<Object> values = new ArrayList<>();
      if (raw != null) {
        for (String part : raw.split(",")) {
          String s = part.trim();
          if (!s.isEmpty()) values.add(coerce(field, s));
        }
      }
      return new Condition(field, op, values);
    }
    // text operators always take the literal string
    return new Condition(field, op, op.text() ? raw : coerce(field, raw));
  }

  /** Parse against the declared type; operands that do not parse stay strings. */
  Object coerce(String field, String raw) {
    if (raw == null) return null;
    FieldType type = (schema == null) ? null : schema.typeOf(field);
    if (type == null) return raw;
    String s = raw.trim();
    try {
      return switch (type) {
        case INTEGER -> Long.parseLong(s);
        case FLOAT -> Double.parseDouble(s);
        case BOOLEAN -> s.equalsIgnoreCase("true") ? Boolean.TRUE : s.equalsIgnoreCase("false") ? Boolean.FALSE : raw;
        case TIMESTAMP -> parseInstant(s);
        case STRING -> raw;
      };
    } catch (NumberFormatException | DateTimeParseException e) {
      return raw;
    }
  }

  private static Instant parseInstant(String s) {
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      return OffsetDateTime.parse(s).toInstant();
    }
  }

  private static CursorPage.Direction parseDirection(String raw) {
    if (raw == null || raw.isBlank()) return CursorPage.Direction.FORWARD;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "forward", "next" -> CursorPage.Direction.FORWARD;
      case "backward", "prev", "previous" -> CursorPage.Direction.BACKWARD;
      default -> throw new QueryValidationException("Unknown direction: " + raw);
    };
  }

  private static Integer parseInt(String name, String raw) {
    if (raw == null || raw.isBlank()) return null;
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException(name + " must be an integer: " + raw, e);
    }
  }
}

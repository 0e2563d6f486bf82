package io.intellixity.pagekit.filter;

import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.error.UnsupportedOperatorException;
import io.intellixity.pagekit.query.*;
import io.intellixity.pagekit.row.FieldType;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Evaluates filter expressions against rows.
 *
 * <p>A null expression matches every row. An empty AND matches every row; an empty OR matches none.
 * Every child of a group is evaluated against the same row. Operator/type mismatches and unknown
 * fields are resolved by {@link FilterOptions#policy()}.</p>
 */
public final class FilterEngine {
  private static final Logger log = LoggerFactory.getLogger(FilterEngine.class);

  private final FilterOptions options;
  private final Validator validator = new Validator();

  public FilterEngine() {
    this(FilterOptions.defaults());
  }

  public FilterEngine(FilterOptions options) {
    this.options = Objects.requireNonNull(options, "options");
  }

  public FilterOptions options() { return options; }

  /** Rows matching {@code expr}, in input order. */
  public List<Row> filter(Collection<Row> rows, QueryElement expr) {
    Objects.requireNonNull(rows, "rows");
    validate(expr);
    if (expr == null) return List.copyOf(rows);
    List<Row> out = new ArrayList<>();
    for (Row r : rows) {
      if (matches(r, expr)) out.add(r);
    }
    return out;
  }

  public boolean matches(Row row, QueryElement expr) {
    Objects.requireNonNull(row, "row");
    if (expr == null) return true;

    if (expr instanceof LogicalGroup g) {
      if (g.clause() == Clause.AND) {
        for (QueryElement c : g.elements()) {
          if (!matches(row, c)) return false;
        }
        return true;
      }
      for (QueryElement c : g.elements()) {
        if (matches(row, c)) return true;
      }
      return false;
    }
    if (expr instanceof NotElement n) {
      return !matches(row, n.element());
    }
    if (expr instanceof Condition c) {
      return evaluate(row, c);
    }

    throw new QueryValidationException("Unsupported QueryElement: " + expr.getClass().getName());
  }

  /**
   * Structural check run before evaluation: blank properties, missing operands and, under the strict
   * policy with a schema, unknown fields.
   */
  public void validate(QueryElement expr) {
    if (expr != null) expr.accept(validator);
  }

  private final class Validator implements QueryVisitor<Void> {
    @Override
    public Void visit(Condition c) {
      if (c.property().isBlank()) throw new QueryValidationException("Blank property in filter");
      Operator op = c.operator();
      if (op.membership() && c.value() == null) {
        throw new QueryValidationException("Operator '" + op.wireName() + "' requires values for field '" + c.property() + "'");
      }
      if ((op.range() || op.text()) && c.value() == null) {
        throw new QueryValidationException("Operator '" + op.wireName() + "' requires a value for field '" + c.property() + "'");
      }
      if (options.strictMode() && options.schema() != null && !options.schema().has(c.property())) {
        throw unknownField(c.property());
      }
      return null;
    }

    @Override
    public Void visit(LogicalGroup g) {
      for (QueryElement c : g.elements()) {
        if (c == null) throw new QueryValidationException("Null element in " + g.clause() + " group");
        c.accept(this);
      }
      return null;
    }

    @Override
    public Void visit(NotElement n) {
      if (n.element() == null) throw new QueryValidationException("not requires an element");
      return n.element().accept(this);
    }
  }

  private boolean evaluate(Row row, Condition c) {
    String field = c.property();
    Operator op = c.operator();

    if (options.schema() != null && !options.schema().has(field)) {
      if (options.strictMode()) throw unknownField(field);
      debugMismatch(field, op, "unknown field");
      return false;
    }

    Object actual = row.get(field);

    if (op == Operator.IS_NULL) return actual == null;
    if (op == Operator.IS_NOT_NULL) return actual != null;

    if (op == Operator.EQ || op == Operator.NEQ) {
      if (c.value() == null) return (op == Operator.EQ) == (actual == null);
      if (actual == null) return op == Operator.NEQ;
      Object expected = operand(field, c.value(), actual, op);
      if (expected == MISMATCH) return false;
      boolean same = Values.same(actual, expected);
      return (op == Operator.EQ) == same;
    }

    if (op.membership()) {
      if (actual == null) return op == Operator.NOT_IN;
      boolean found = false;
      for (Object candidate : asCollection(c.value())) {
        if (candidate == null) continue;
        Object expected = operand(field, candidate, actual, op);
        if (expected == MISMATCH) continue;
        if (Values.same(actual, expected)) {
          found = true;
          break;
        }
      }
      return (op == Operator.IN) == found;
    }

    if (actual == null) return false;

    if (op.range()) {
      Object expected = operand(field, c.value(), actual, op);
      if (expected == MISMATCH) return false;
      Integer cmp = Values.compareOrderable(actual, expected);
      if (cmp == null) return mismatch(field, op, kindOf(actual) + " is not orderable against " + kindOf(expected));
      return switch (op) {
        case GT -> cmp > 0;
        case GTE -> cmp >= 0;
        case LT -> cmp < 0;
        case LTE -> cmp <= 0;
        default -> false;
      };
    }

    if (op.text()) {
      if (!(actual instanceof String s) || !(c.value() instanceof CharSequence cs)) {
        return mismatch(field, op, "text operators need a string field and a string operand");
      }
      String haystack = s;
      String needle = cs.toString();
      if (options.caseInsensitiveText()) {
        haystack = haystack.toLowerCase(Locale.ROOT);
        needle = needle.toLowerCase(Locale.ROOT);
      }
      return switch (op) {
        case CONTAINS -> haystack.contains(needle);
        case STARTS_WITH -> haystack.startsWith(needle);
        case ENDS_WITH -> haystack.endsWith(needle);
        default -> false;
      };
    }

    throw new QueryValidationException("Unsupported operator: " + op);
  }

  // marks an operand that cannot be compared with the field value
  private static final Object MISMATCH = new Object();

  /**
   * Normalize an operand for comparison with {@code actual}. ISO-8601 strings are parsed when the
   * field holds a timestamp. Returns {@link #MISMATCH} (or throws under the strict policy) when the
   * kinds cannot be compared.
   */
  private Object operand(String field, Object raw, Object actual, Operator op) {
    Object v = Values.normalizeOrNull(raw);
    if (v == null) {
      mismatch(field, op, "unsupported operand type " + raw.getClass().getSimpleName());
      return MISMATCH;
    }
    if (actual instanceof Instant && v instanceof String s) {
      Instant parsed = parseInstant(s);
      if (parsed != null) return parsed;
    }
    if (!comparableKinds(actual, v)) {
      mismatch(field, op, kindOf(actual) + " field against " + kindOf(v) + " operand");
      return MISMATCH;
    }
    return v;
  }

  private static boolean comparableKinds(Object a, Object b) {
    if (Values.isNumber(a) && Values.isNumber(b)) return true;
    return a.getClass() == b.getClass();
  }

  private boolean mismatch(String field, Operator op, String detail) {
    if (options.strictMode()) throw new UnsupportedOperatorException(field, op, detail);
    debugMismatch(field, op, detail);
    return false;
  }

  private static void debugMismatch(String field, Operator op, String detail) {
    if (!log.isDebugEnabled()) return;
    log.debug("pagekit.filter mismatch field={} op={} detail={}", field, op.wireName(), detail);
  }

  private QueryValidationException unknownField(String field) {
    return new QueryValidationException("Unknown field '" + field + "' in filter");
  }

  private static Collection<?> asCollection(Object v) {
    if (v instanceof Collection<?> c) return c;
    if (v instanceof Object[] arr) return Arrays.asList(arr);
    return Collections.singletonList(v);
  }

  private static String kindOf(Object v) {
    FieldType t = FieldType.of(v);
    return (t == null) ? v.getClass().getSimpleName() : t.name();
  }

  private static Instant parseInstant(String s) {
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      try {
        return OffsetDateTime.parse(s).toInstant();
      } catch (DateTimeParseException ignored) {
        return null;
      }
    }
  }
}

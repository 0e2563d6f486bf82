package io.intellixity.pagekit.filter;

import io.intellixity.pagekit.TestRows;
import io.intellixity.pagekit.error.QueryValidationException;
import io.intellixity.pagekit.error.UnsupportedOperatorException;
import io.intellixity.pagekit.query.Condition;
import io.intellixity.pagekit.query.Operator;
import io.intellixity.pagekit.query.QueryElement;
import io.intellixity.pagekit.row.Row;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static io.intellixity.pagekit.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class FilterEngineTest {
  private static final Row ALICE = Row.of("1",
      "name", "Alice",
      "status", "ACTIVE",
      "age", 30,
      "score", 4.5,
      "createdAt", Instant.parse("2024-02-01T00:00:00Z"));

  private final FilterEngine lenient = new FilterEngine();
  private final FilterEngine strict = new FilterEngine(FilterOptions.strict());

  @Test
  void emptyExpressionsUseIdentityElements() {
    assertTrue(lenient.matches(ALICE, null));
    assertTrue(lenient.matches(ALICE, and()));
    assertFalse(lenient.matches(ALICE, or()));
    assertTrue(lenient.matches(ALICE, not(or())));
  }

  @Test
  void equalityIsTypeAware() {
    assertTrue(lenient.matches(ALICE, eq("status", "ACTIVE")));
    assertFalse(lenient.matches(ALICE, eq("status", "active")));
    assertTrue(lenient.matches(ALICE, eq("age", 30)));
    assertTrue(lenient.matches(ALICE, eq("age", 30.0)));
    assertTrue(lenient.matches(ALICE, neq("age", 31)));
    assertTrue(lenient.matches(ALICE, eq("createdAt", "2024-02-01T00:00:00Z")));
  }

  @Test
  void missingAttributes() {
    assertFalse(lenient.matches(ALICE, eq("role", "ADMIN")));
    assertTrue(lenient.matches(ALICE, neq("role", "ADMIN")));
    assertFalse(lenient.matches(ALICE, in("role", List.of("ADMIN"))));
    assertTrue(lenient.matches(ALICE, notIn("role", List.of("ADMIN"))));
    assertFalse(lenient.matches(ALICE, gt("role", "A")));
    assertFalse(lenient.matches(ALICE, contains("role", "A")));
    assertTrue(lenient.matches(ALICE, isNull("role")));
    assertTrue(lenient.matches(ALICE, eq("role", null)));
    assertTrue(lenient.matches(ALICE, neq("age", null)));
    assertTrue(lenient.matches(ALICE, isNotNull("age")));
  }

  @Test
  void rangeOperators() {
    assertTrue(lenient.matches(ALICE, gte("age", 30)));
    assertFalse(lenient.matches(ALICE, gt("age", 30)));
    assertTrue(lenient.matches(ALICE, lt("score", 5)));
    assertTrue(lenient.matches(ALICE, lte("score", 4.5)));
    assertTrue(lenient.matches(ALICE, gt("name", "adam")));
    assertTrue(lenient.matches(ALICE, lt("createdAt", "2024-03-01T00:00:00+02:00")));
    assertTrue(lenient.matches(ALICE, gt("createdAt", Instant.parse("2024-01-01T00:00:00Z"))));
  }

  @Test
  void rangeTypeMismatchIsFalseWhenLenientAndFailsWhenStrict() {
    assertFalse(lenient.matches(ALICE, gt("age", "thirty")));
    assertFalse(lenient.matches(ALICE, lt("status", 3)));
    assertFalse(lenient.matches(ALICE, eq("age", "30")));

    UnsupportedOperatorException ex = assertThrows(UnsupportedOperatorException.class,
        () -> strict.matches(ALICE, gt("age", "thirty")));
    assertEquals("age", ex.field());
    assertEquals(UnsupportedOperatorException.CODE, ex.code());
  }

  @Test
  void textOperatorsIgnoreCaseByDefault() {
    assertTrue(lenient.matches(ALICE, contains("name", "LIC")));
    assertTrue(lenient.matches(ALICE, startsWith("name", "al")));
    assertTrue(lenient.matches(ALICE, endsWith("name", "CE")));

    FilterEngine caseSensitive = new FilterEngine(FilterOptions.defaults().withCaseInsensitiveText(false));
    assertFalse(caseSensitive.matches(ALICE, contains("name", "LIC")));
    assertTrue(caseSensitive.matches(ALICE, contains("name", "lic")));
  }

  @Test
  void textOperatorsOnlyApplyToStrings() {
    assertFalse(lenient.matches(ALICE, contains("age", "3")));
    assertThrows(UnsupportedOperatorException.class, () -> strict.matches(ALICE, contains("age", "3")));
  }

  @Test
  void membershipUsesEqualitySemantics() {
    assertTrue(lenient.matches(ALICE, in("age", List.of(29, 30.0))));
    assertTrue(lenient.matches(ALICE, in("status", List.of("PENDING", "ACTIVE"))));
    assertFalse(lenient.matches(ALICE, in("status", List.of())));
    assertTrue(lenient.matches(ALICE, notIn("status", List.of("PENDING"))));
    assertFalse(lenient.matches(ALICE, notIn("status", List.of("ACTIVE"))));
    // a scalar operand is a one-element set
    assertTrue(lenient.matches(ALICE, Condition.of("age", Operator.IN, 30)));
  }

  @Test
  void mismatchedMembersAreSkippedWhenLenient() {
    assertTrue(lenient.matches(ALICE, in("age", List.of("thirty", 30))));
    assertThrows(UnsupportedOperatorException.class, () -> strict.matches(ALICE, in("age", List.of("thirty", 30))));
  }

  @Test
  void everyBranchSeesTheFullRow() {
    QueryElement e = and(
        or(eq("status", "INACTIVE"), gte("age", 30)),
        or(eq("name", "Alice"), eq("name", "Bob")),
        not(eq("score", 1)));
    assertTrue(lenient.matches(ALICE, e));
    assertFalse(lenient.matches(ALICE, and(e, not(eq("status", "ACTIVE")))));
  }

  @Test
  void conjunctionWithItselfIsIdempotent() {
    List<QueryElement> exprs = List.of(
        eq("status", "ACTIVE"),
        gt("age", "x"),
        or(in("role", List.of("ADMIN")), lt("salary", 60000)),
        not(contains("email", "1")));
    for (Row r : TestRows.users(30)) {
      for (QueryElement e : exprs) {
        assertEquals(lenient.matches(r, e), lenient.matches(r, and(e, e)), e + " on " + r.id());
      }
    }
  }

  @Test
  void unknownFieldsWithASchema() {
    FilterOptions opts = FilterOptions.defaults().withSchema(TestRows.SCHEMA);
    Row user = TestRows.users(1).get(0);

    assertFalse(new FilterEngine(opts).matches(user, eq("nickname", "JD")));
    assertTrue(new FilterEngine(opts).matches(user, not(eq("nickname", "JD"))));

    FilterEngine strictWithSchema = new FilterEngine(opts.withPolicy(FilterPolicy.STRICT));
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> strictWithSchema.filter(List.of(user), eq("nickname", "JD")));
    assertTrue(ex.getMessage().contains("nickname"));
    assertTrue(strictWithSchema.matches(user, eq("status", "ACTIVE")));
  }

  @Test
  void filterKeepsInputOrder() {
    List<Row> rows = TestRows.users(12);
    List<Row> active = lenient.filter(rows, eq("status", "ACTIVE"));
    assertEquals(List.of("1", "4", "7", "10"), TestRows.ids(active));
    assertEquals(12, lenient.filter(rows, null).size());
  }

  @Test
  void validateRejectsMissingOperands() {
    assertThrows(QueryValidationException.class,
        () -> lenient.validate(Condition.of("age", Operator.IN, null)));
    assertThrows(QueryValidationException.class, () -> lenient.validate(gt("age", null)));
    assertThrows(QueryValidationException.class, () -> lenient.validate(and(eq(" ", 1))));
    lenient.validate(and(eq("age", null), isNull("role")));
  }

  @Test
  void unsupportedOperandTypesAreMismatches() {
    assertFalse(lenient.matches(ALICE, eq("age", Map.of("x", 1))));
    assertThrows(UnsupportedOperatorException.class, () -> strict.matches(ALICE, eq("age", Map.of("x", 1))));
  }
}

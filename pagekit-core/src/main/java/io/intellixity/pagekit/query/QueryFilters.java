package io.intellixity.pagekit.query;

import java.util.*;

public final class QueryFilters {
  private QueryFilters() {}

  public static Condition eq(String property, Object value) { return Condition.of(property, Operator.EQ, value); }
  public static Condition neq(String property, Object value) { return Condition.of(property, Operator.NEQ, value); }
  public static Condition gt(String property, Object value) { return Condition.of(property, Operator.GT, value); }
  public static Condition gte(String property, Object value) { return Condition.of(property, Operator.GTE, value); }
  public static Condition lt(String property, Object value) { return Condition.of(property, Operator.LT, value); }
  public static Condition lte(String property, Object value) { return Condition.of(property, Operator.LTE, value); }

  public static Condition in(String property, Collection<?> values) { return Condition.of(property, Operator.IN, values); }
  public static Condition notIn(String property, Collection<?> values) { return Condition.of(property, Operator.NOT_IN, values); }

  /** Case-insensitive unless the engine is configured otherwise. */
  public static Condition contains(String property, String value) { return Condition.of(property, Operator.CONTAINS, value); }
  public static Condition startsWith(String property, String value) { return Condition.of(property, Operator.STARTS_WITH, value); }
  public static Condition endsWith(String property, String value) { return Condition.of(property, Operator.ENDS_WITH, value); }

  public static Condition isNull(String property) { return Condition.of(property, Operator.IS_NULL, null); }
  public static Condition isNotNull(String property) { return Condition.of(property, Operator.IS_NOT_NULL, null); }

  public static LogicalGroup and(QueryElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(QueryElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(QueryElement element) {
    return new NotElement(element);
  }
}

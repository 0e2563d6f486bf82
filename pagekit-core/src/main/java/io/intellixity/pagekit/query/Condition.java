package io.intellixity.pagekit.query;

import java.util.Objects;

/** Leaf predicate {@code (property, operator, value)}. */
public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;

  public Condition(String property, Operator operator, Object value) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return property.equals(c.property) && operator == c.operator && Objects.equals(value, c.value);
  }

  @Override
  public int hashCode() { return Objects.hash(property, operator, value); }

  @Override
  public String toString() { return property + " " + operator.wireName() + " " + value; }
}

package io.intellixity.pagekit.query;

import java.util.*;

public final class LogicalGroup implements QueryElement {
  private final Clause clause;
  private final List<QueryElement> elements;

  public LogicalGroup(Clause clause, List<QueryElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<QueryElement> elements() { return elements; }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LogicalGroup g)) return false;
    return clause == g.clause && elements.equals(g.elements);
  }

  @Override
  public int hashCode() { return Objects.hash(clause, elements); }

  @Override
  public String toString() { return clause + elements.toString(); }
}

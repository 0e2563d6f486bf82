package io.intellixity.pagekit.query;

/** Double dispatch over the three {@link QueryElement} kinds. */
public interface QueryVisitor<R> {
  R visit(Condition condition);
  R visit(LogicalGroup group);
  R visit(NotElement not);
}

package io.intellixity.pagekit.query;

/** Node of a filter expression tree. */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}

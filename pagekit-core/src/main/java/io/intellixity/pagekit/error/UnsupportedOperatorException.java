package io.intellixity.pagekit.error;

import io.intellixity.pagekit.query.Operator;

/** Strict-policy failure: the operator cannot apply to the field's value type. */
public final class UnsupportedOperatorException extends PagingException {
  public static final String CODE = "UNSUPPORTED_OPERATOR";

  private final String field;
  private final Operator operator;

  public UnsupportedOperatorException(String field, Operator operator, String detail) {
    super(CODE, "Operator '" + operator.wireName() + "' is not applicable to field '" + field + "': " + detail);
    this.field = field;
    this.operator = operator;
  }

  public String field() { return field; }
  public Operator operator() { return operator; }
}

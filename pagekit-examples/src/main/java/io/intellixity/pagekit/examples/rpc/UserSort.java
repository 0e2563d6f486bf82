package io.intellixity.pagekit.examples.rpc;

import io.intellixity.pagekit.query.SortField;

import java.util.List;

/** A null field keeps the natural id order. */
public record UserSort(Field field, Order order) {

  public enum Field {
    CREATED_AT("createdAt"),
    FIRST_NAME("firstName"),
    LAST_NAME("lastName"),
    EMAIL("email"),
    AGE("age"),
    SALARY("salary");

    private final String rowField;

    Field(String rowField) {
      this.rowField = rowField;
    }

    public String rowField() { return rowField; }
  }

  public enum Order { ASC, DESC }

  public static UserSort by(Field field, Order order) { return new UserSort(field, order); }

  public List<SortField> toSortFields() {
    if (field == null) return List.of();
    return List.of(order == Order.DESC ? SortField.desc(field.rowField()) : SortField.asc(field.rowField()));
  }

  static List<SortField> toSortFields(UserSort sort) {
    return (sort == null) ? List.of() : sort.toSortFields();
  }
}

package io.intellixity.pagekit.query;

import java.util.Locale;
import java.util.Optional;

public enum Operator {
  EQ("eq"),
  NEQ("neq"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),

  IN("in"),
  NOT_IN("not_in"),

  // string fields only
  CONTAINS("contains"),
  STARTS_WITH("starts_with"),
  ENDS_WITH("ends_with"),

  // presence, type independent
  IS_NULL("is_null"),
  IS_NOT_NULL("is_not_null");

  private final String wireName;

  Operator(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  public boolean range() { return this == GT || this == GTE || this == LT || this == LTE; }
  public boolean text() { return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH; }
  public boolean membership() { return this == IN || this == NOT_IN; }
  public boolean presence() { return this == IS_NULL || this == IS_NOT_NULL; }

  /** Accepts wire names ({@code not_in}) and constant names ({@code NOT_IN}), case-insensitively. */
  public static Optional<Operator> fromName(String name) {
    if (name == null) return Optional.empty();
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (Operator op : values()) {
      if (op.wireName.equals(n)) return Optional.of(op);
    }
    return Optional.empty();
  }
}

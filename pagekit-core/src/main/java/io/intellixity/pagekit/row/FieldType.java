package io.intellixity.pagekit.row;

import java.time.Instant;

/** Runtime kinds a {@link Row} attribute can hold. */
public enum FieldType {
  STRING,
  INTEGER,
  FLOAT,
  BOOLEAN,
  TIMESTAMP;

  public boolean numeric() { return this == INTEGER || this == FLOAT; }

  /** Type of an already normalized value, or null for null. */
  public static FieldType of(Object normalized) {
    if (normalized == null) return null;
    if (normalized instanceof String) return STRING;
    if (normalized instanceof Long) return INTEGER;
    if (normalized instanceof Double) return FLOAT;
    if (normalized instanceof Boolean) return BOOLEAN;
    if (normalized instanceof Instant) return TIMESTAMP;
    throw new IllegalArgumentException("Not a normalized row value: " + normalized.getClass().getName());
  }
}

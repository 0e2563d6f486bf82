package io.intellixity.pagekit.row;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/**
 * Immutable record handed to the engine: a unique {@link #ID id} plus typed attributes.
 *
 * <p>Attribute values are normalized on construction (see {@link Values}); a null value is the same
 * as an absent attribute.</p>
 */
public final class Row {
  public static final String ID = "id";

  private final String id;
  private final Map<String, Object> attributes;

  public Row(String id, Map<String, ?> attributes) {
    this.id = Objects.requireNonNull(id, "id");
    Map<String, Object> m = new LinkedHashMap<>();
    if (attributes != null) {
      for (var e : attributes.entrySet()) {
        String k = Objects.requireNonNull(e.getKey(), "attribute name");
        if (ID.equals(k)) continue;
        Object v = Values.normalize(e.getValue());
        if (v != null) m.put(k, v);
      }
    }
    this.attributes = Collections.unmodifiableMap(m);
  }

  /** {@code Row.of("7", "status", "ACTIVE", "age", 31)} */
  public static Row of(String id, Object... keyValues) {
    if (keyValues.length % 2 != 0) throw new IllegalArgumentException("keyValues must be name/value pairs");
    Map<String, Object> m = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      m.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
    }
    return new Row(id, m);
  }

  public String id() { return id; }
  public Map<String, Object> attributes() { return attributes; }

  /** Attribute value, the id for {@link #ID}, or null when absent. */
  public Object get(String field) {
    if (ID.equals(field)) return id;
    return attributes.get(field);
  }

  public boolean has(String field) { return ID.equals(field) || attributes.containsKey(field); }

  /** Derived copy with one attribute replaced (a null value removes it). */
  public Row with(String field, Object value) {
    if (ID.equals(field)) throw new IllegalArgumentException("id cannot be replaced");
    Map<String, Object> m = new LinkedHashMap<>(attributes);
    m.put(field, value);
    return new Row(id, m);
  }

  public Row without(String field) {
    if (!attributes.containsKey(field)) return this;
    Map<String, Object> m = new LinkedHashMap<>(attributes);
    m.remove(field);
    return new Row(id, m);
  }

  /** Flat view with the id first; this is also the JSON form. */
  @JsonValue
  public Map<String, Object> toMap() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(ID, id);
    m.putAll(attributes);
    return m;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row r)) return false;
    return id.equals(r.id) && attributes.equals(r.attributes);
  }

  @Override
  public int hashCode() { return Objects.hash(id, attributes); }

  @Override
  public String toString() { return "Row" + toMap(); }
}

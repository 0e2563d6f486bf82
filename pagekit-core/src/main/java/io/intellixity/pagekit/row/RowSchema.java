package io.intellixity.pagekit.row;

import java.util.*;

/**
 * Declared attribute types of a row collection. The {@link Row#ID id} field is always declared as
 * {@link FieldType#STRING}.
 */
public record RowSchema(Map<String, FieldType> fields) {
  public RowSchema {
    Map<String, FieldType> m = new LinkedHashMap<>();
    m.put(Row.ID, FieldType.STRING);
    if (fields != null) {
      for (var e : fields.entrySet()) {
        if (Row.ID.equals(e.getKey())) continue;
        m.put(Objects.requireNonNull(e.getKey(), "field"), Objects.requireNonNull(e.getValue(), "type"));
      }
    }
    fields = Collections.unmodifiableMap(m);
  }

  public static RowSchema of(Map<String, FieldType> fields) { return new RowSchema(fields); }

  public RowSchema with(String field, FieldType type) {
    Map<String, FieldType> m = new LinkedHashMap<>(fields);
    m.put(field, type);
    return new RowSchema(m);
  }

  public boolean has(String field) { return field != null && fields.containsKey(field); }

  public FieldType typeOf(String field) { return fields.get(field); }
}

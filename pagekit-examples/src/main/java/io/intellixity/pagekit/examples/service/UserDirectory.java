package io.intellixity.pagekit.examples.service;

import io.intellixity.pagekit.row.FieldType;
import io.intellixity.pagekit.row.InMemoryRowSource;
import io.intellixity.pagekit.row.Row;
import io.intellixity.pagekit.row.RowSchema;
import io.intellixity.pagekit.row.RowSource;
import io.intellixity.pagekit.search.SearchField;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generated user collection backing the demo endpoints.
 *
 * <p>User {@code n} (1-based) gets the n-th entry of each cycling attribute and was created {@code n-1}
 * days before the clock's current day.</p>
 */
public final class UserDirectory {
  public static final List<String> FIRST_NAMES = List.of("John", "Jane", "Bob", "Alice", "Charlie");
  public static final List<String> LAST_NAMES = List.of("Doe", "Smith", "Johnson", "Williams", "Brown");
  public static final List<String> DEPARTMENTS = List.of("Engineering", "Sales", "Marketing", "Support");
  public static final List<String> STATUSES = List.of("ACTIVE", "INACTIVE", "PENDING");
  public static final List<String> ROLES = List.of("ADMIN", "USER", "MODERATOR");

  public static final RowSchema SCHEMA = RowSchema.of(Map.of(
      "firstName", FieldType.STRING,
      "lastName", FieldType.STRING,
      "fullName", FieldType.STRING,
      "email", FieldType.STRING,
      "age", FieldType.INTEGER,
      "status", FieldType.STRING,
      "role", FieldType.STRING,
      "department", FieldType.STRING,
      "salary", FieldType.INTEGER,
      "createdAt", FieldType.TIMESTAMP
  ));

  /** email 100/30, full name 80/40, first and last name prefix 20 each. */
  public static final List<SearchField> SEARCH_FIELDS = List.of(
      SearchField.of("email").withWeights(100, 30, 0),
      SearchField.composite("fullName", "firstName", "lastName").withWeights(80, 40, 0),
      SearchField.prefixOnly("firstName", 20),
      SearchField.prefixOnly("lastName", 20)
  );

  private final InMemoryRowSource rows;

  public UserDirectory(int count, Clock clock) {
    if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);
    Objects.requireNonNull(clock, "clock");
    Instant today = clock.instant().truncatedTo(ChronoUnit.DAYS);
    this.rows = new InMemoryRowSource();
    for (int i = 0; i < count; i++) {
      rows.add(user(i, today));
    }
  }

  private static Row user(int i, Instant today) {
    String first = FIRST_NAMES.get(i % FIRST_NAMES.size());
    String last = LAST_NAMES.get(i % LAST_NAMES.size());
    return Row.of(String.valueOf(i + 1),
        "firstName", first,
        "lastName", last,
        "fullName", first + " " + last,
        "email", "user" + (i + 1) + "@example.com",
        "age", 20 + (i % 40),
        "status", STATUSES.get(i % STATUSES.size()),
        "role", ROLES.get(i % ROLES.size()),
        "department", DEPARTMENTS.get(i % DEPARTMENTS.size()),
        "salary", 50000 + i * 1000,
        "createdAt", today.minus(Duration.ofDays(i)));
  }

  public RowSource source() { return rows; }

  public int size() { return rows.size(); }

  public Optional<Row> find(String id) { return rows.get(id); }
}

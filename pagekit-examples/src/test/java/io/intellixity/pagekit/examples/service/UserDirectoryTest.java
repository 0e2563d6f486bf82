package io.intellixity.pagekit.examples.service;

import io.intellixity.pagekit.examples.Fixtures;
import io.intellixity.pagekit.row.Row;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class UserDirectoryTest {

  @Test
  void generatesCyclingAttributes() {
    UserDirectory d = new UserDirectory(150, Fixtures.CLOCK);
    assertEquals(150, d.size());

    Row first = d.find("1").orElseThrow();
    assertEquals("John", first.get("firstName"));
    assertEquals("John Doe", first.get("fullName"));
    assertEquals("user1@example.com", first.get("email"));
    assertEquals(20L, first.get("age"));
    assertEquals("ACTIVE", first.get("status"));
    assertEquals("ADMIN", first.get("role"));
    assertEquals("Engineering", first.get("department"));
    assertEquals(50000L, first.get("salary"));
    assertEquals(Instant.parse("2024-06-01T00:00:00Z"), first.get("createdAt"));

    Row last = d.find("150").orElseThrow();
    assertEquals("PENDING", last.get("status"));
    assertEquals(20L + 149 % 40, last.get("age"));
    assertEquals(Instant.parse("2024-06-01T00:00:00Z").minusSeconds(149L * 86400), last.get("createdAt"));
  }

  @Test
  void snapshotKeepsInsertionOrder() {
    UserDirectory d = new UserDirectory(5, Fixtures.CLOCK);
    assertEquals(List.of("1", "2", "3", "4", "5"), Fixtures.ids(d.source().snapshot()));
    assertTrue(d.find("6").isEmpty());
  }

  @Test
  void rejectsNegativeCount() {
    assertThrows(IllegalArgumentException.class, () -> new UserDirectory(-1, Fixtures.CLOCK));
  }
}

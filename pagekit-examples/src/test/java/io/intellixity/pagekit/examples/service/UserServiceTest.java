package io.intellixity.pagekit.examples.service;

import io.intellixity.pagekit.error.MalformedCursorException;
import io.intellixity.pagekit.examples.Fixtures;
import io.intellixity.pagekit.query.CursorPage;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.query.QueryFilters;
import io.intellixity.pagekit.result.Connection;
import io.intellixity.pagekit.result.CursorListResult;
import io.intellixity.pagekit.result.OffsetPageResult;
import io.intellixity.pagekit.result.RankedList;
import io.intellixity.pagekit.row.Row;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class UserServiceTest {
  private final Fixtures f = new Fixtures();

  @Test
  void offsetListingAlwaysReportsTotals() {
    OffsetPageResult<Row> r = f.users.listOffset(Map.of("page", "2", "limit", "10"));

    assertEquals(List.of("11", "12", "13", "14", "15", "16", "17", "18", "19", "20"), Fixtures.ids(r.items()));
    assertEquals(150L, r.totalCount());
    assertEquals(15, r.totalPages());
    assertTrue(r.hasNext());
    assertTrue(r.hasPrevious());
  }

  @Test
  void offsetListingAppliesTypedFilters() {
    OffsetPageResult<Row> active = f.users.listOffset(Map.of("status", "ACTIVE", "limit", "5"));
    assertEquals(50L, active.totalCount());
    assertEquals(List.of("1", "4", "7", "10", "13"), Fixtures.ids(active.items()));

    // age = 20 + i % 40, so ages 55..59 appear three times each among 150 users
    OffsetPageResult<Row> older = f.users.listOffset(Map.of("age_gte", "55"));
    assertEquals(15L, older.totalCount());
  }

  @Test
  void cursorListingWalksBothWays() {
    CursorListResult<Row> p1 = f.users.listCursor(Map.of("limit", "10"));
    assertEquals(List.of("1", "2", "3", "4", "5", "6", "7", "8", "9", "10"), Fixtures.ids(p1.data()));
    assertTrue(p1.hasMore());
    assertNull(p1.prevCursor());
    assertNotNull(p1.nextCursor());

    CursorListResult<Row> p2 = f.users.listCursor(Map.of("limit", "10", "cursor", p1.nextCursor()));
    assertEquals("11", p2.data().get(0).id());
    assertNotNull(p2.prevCursor());

    Map<String, String> back = new LinkedHashMap<>();
    back.put("limit", "10");
    back.put("cursor", p2.prevCursor());
    back.put("direction", "backward");
    assertEquals(Fixtures.ids(p1.data()), Fixtures.ids(f.users.listCursor(back).data()));
  }

  @Test
  void garbageCursorIsRejected() {
    assertThrows(MalformedCursorException.class,
        () -> f.users.listCursor(Map.of("cursor", "%%%not-a-cursor%%%")));
  }

  @Test
  void searchRanksByScoreThenId() {
    RankedList<Row> r = f.users.search(Map.of("q", "jane", "limit", "3"));

    assertEquals(3, r.results().size());
    assertEquals(List.of("2", "7", "12"), r.results().stream().map(i -> i.node().id()).toList());
    // full name substring (40) plus first name prefix (20)
    assertEquals(60d, r.results().get(0).score());
    assertTrue(r.hasMore());
    assertFalse(r.results().get(0).node().has("_score"));
  }

  @Test
  void exactEmailIsTheOnlyHit() {
    RankedList<Row> r = f.users.search(Map.of("q", "user1@example.com"));
    assertEquals(1, r.results().size());
    assertEquals("1", r.results().get(0).node().id());
    assertEquals(100d, r.results().get(0).score());
    assertFalse(r.hasMore());
  }

  @Test
  void connectionDefaultsToFirstForwardPage() {
    Connection<Row> c = f.users.connection(null);
    assertEquals(20, c.edges().size());
    assertTrue(c.pageInfo().hasNextPage());
    assertFalse(c.pageInfo().hasPreviousPage());
    assertNull(c.totalCount());

    Connection<Row> admins = f.users.connection(Query.of(QueryFilters.eq("role", "ADMIN"))
        .withPage(CursorPage.first(5))
        .withTotalCount(true));
    assertEquals(50L, admins.totalCount());
    assertEquals("1", admins.edges().get(0).node().id());
    assertEquals(admins.edges().get(4).cursor(), admins.pageInfo().endCursor());
  }

  @Test
  void missingUserIsNotFound() {
    assertEquals("7", f.users.get("7").id());
    UserNotFoundException ex = assertThrows(UserNotFoundException.class, () -> f.users.get("999"));
    assertEquals("999", ex.userId());
  }
}

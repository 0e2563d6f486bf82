package io.intellixity.pagekit.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pagekit.TestRows;
import io.intellixity.pagekit.page.PageWindow;
import io.intellixity.pagekit.page.PaginationController;
import io.intellixity.pagekit.query.CursorPage;
import io.intellixity.pagekit.query.OffsetPage;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.row.Row;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ResultAssemblerTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  private final PaginationController controller = new PaginationController();
  private final ResultAssembler assembler = new ResultAssembler();
  private final List<Row> users = TestRows.users(25);

  @Test
  void offsetPageCarriesTotalsOnlyWhenRequested() throws Exception {
    PageWindow w = controller.paginate(users, new Query().withPage(OffsetPage.of(2, 10)).withTotalCount(true));
    OffsetPageResult<Row> page = assembler.offsetPage(w);

    assertEquals(TestRows.range(11, 20), TestRows.ids(page.items()));
    assertEquals(2, page.page());
    assertEquals(10, page.pageSize());
    assertEquals(3, page.totalPages());
    assertEquals(25L, page.totalCount());
    assertTrue(page.hasNext());
    assertTrue(page.hasPrevious());

    JsonNode untotalled = JSON.valueToTree(assembler.offsetPage(
        controller.paginate(users, new Query().withPage(OffsetPage.of(1, 10)))));
    assertFalse(untotalled.has("totalCount"));
    assertFalse(untotalled.has("totalPages"));
    assertEquals("1", untotalled.get("items").get(0).get("id").asText());
  }

  @Test
  void connectionEdgesCarryTheirOwnCursors() {
    PageWindow w = controller.paginate(users, new Query().withPage(CursorPage.first(5)));
    Connection<String> c = assembler.connection(w, Row::id);

    assertEquals(5, c.edges().size());
    assertEquals("1", c.edges().get(0).node());
    assertEquals(w.startCursor(), c.pageInfo().startCursor());
    assertEquals(w.endCursor(), c.pageInfo().endCursor());
    assertEquals(c.edges().get(4).cursor(), c.pageInfo().endCursor());
    assertTrue(c.pageInfo().hasNextPage());
    assertFalse(c.pageInfo().hasPreviousPage());
    assertNull(c.totalCount());

    PageWindow resumed = controller.paginate(users, new Query().withPage(CursorPage.after(c.edges().get(2).cursor(), 1)));
    assertEquals("4", resumed.items().get(0).id());
  }

  @Test
  void emptyConnectionHasNoCursors() {
    PageWindow w = controller.paginate(List.of(), new Query().withPage(CursorPage.first(5)).withTotalCount(true));
    JsonNode json = JSON.valueToTree(assembler.assemble(w, Shape.CONNECTION));

    assertEquals(0, json.get("edges").size());
    assertFalse(json.get("pageInfo").has("startCursor"));
    assertFalse(json.get("pageInfo").has("endCursor"));
    assertEquals(0, json.get("totalCount").asInt());
  }

  @Test
  void cursorListLinksBothDirections() {
    PageWindow first = controller.paginate(users, new Query().withPage(CursorPage.first(10)));
    CursorListResult<Row> list = assembler.cursorList(first);
    assertTrue(list.hasMore());
    assertEquals(first.endCursor(), list.nextCursor());
    assertNull(list.prevCursor());
    assertEquals(10, list.limit());

    CursorListResult<Row> second = assembler.cursorList(
        controller.paginate(users, new Query().withPage(CursorPage.after(list.nextCursor(), 10))));
    assertNotNull(second.prevCursor());

    PageWindow back = controller.paginate(users, new Query().withPage(CursorPage.before(second.prevCursor(), 10)));
    assertEquals(TestRows.ids(first.items()), TestRows.ids(back.items()));
  }

  @Test
  void dispatchesOnShape() {
    PageWindow w = controller.paginate(users, new Query().withPage(OffsetPage.of(1, 5)));
    assertTrue(assembler.assemble(w, Shape.OFFSET_PAGE) instanceof OffsetPageResult<?>);
    assertTrue(assembler.assemble(w, Shape.CONNECTION) instanceof Connection<?>);
    assertTrue(assembler.assemble(w, Shape.CURSOR_LIST) instanceof CursorListResult<?>);
    assertTrue(assembler.assemble(w, Shape.RANKED_LIST) instanceof RankedList<?>);
  }
}

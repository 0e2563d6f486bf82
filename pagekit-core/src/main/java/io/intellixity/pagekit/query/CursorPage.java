package io.intellixity.pagekit.query;

/**
 * Keyset page anchored at an opaque cursor.
 *
 * <p>{@link Direction#FORWARD} returns the records strictly after the cursor ({@code first/after});
 * {@link Direction#BACKWARD} the records strictly before it ({@code last/before}). A null cursor
 * starts at the beginning (forward) or the end (backward).</p>
 */
public record CursorPage(Direction direction, String cursor, Integer pageSize) implements Page {
  public CursorPage {
    direction = (direction == null) ? Direction.FORWARD : direction;
    cursor = (cursor == null || cursor.isBlank()) ? null : cursor;
  }

  public static CursorPage first(Integer pageSize) { return new CursorPage(Direction.FORWARD, null, pageSize); }
  public static CursorPage after(String cursor, Integer pageSize) { return new CursorPage(Direction.FORWARD, cursor, pageSize); }
  public static CursorPage last(Integer pageSize) { return new CursorPage(Direction.BACKWARD, null, pageSize); }
  public static CursorPage before(String cursor, Integer pageSize) { return new CursorPage(Direction.BACKWARD, cursor, pageSize); }

  public enum Direction { FORWARD, BACKWARD }
}

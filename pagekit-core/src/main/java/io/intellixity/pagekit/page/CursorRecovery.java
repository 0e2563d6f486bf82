package io.intellixity.pagekit.page;

/** What a cursor page does when the cursor's record is gone or the cursor was taken under another sort. */
public enum CursorRecovery {
  /** Resume at the first record after the cursor's key; an incompatible cursor is ignored. */
  NEAREST_SUCCESSOR,
  /** Raise {@link io.intellixity.pagekit.error.CursorNotFoundException}. */
  STRICT
}

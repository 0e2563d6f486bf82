package io.intellixity.pagekit.result;

public enum Shape {
  OFFSET_PAGE,
  CONNECTION,
  CURSOR_LIST,
  RANKED_LIST
}

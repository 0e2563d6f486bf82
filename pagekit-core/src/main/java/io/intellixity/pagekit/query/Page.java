package io.intellixity.pagekit.query;

/**
 * Page request. The size is the raw requested value (null = default); bounds are enforced when the
 * request is executed.
 */
public interface Page {
  Integer pageSize();
}

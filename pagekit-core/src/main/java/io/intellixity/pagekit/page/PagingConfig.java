package io.intellixity.pagekit.page;

import io.intellixity.pagekit.filter.FilterOptions;

import java.util.Objects;

public record PagingConfig(int maxPageSize,
                           int defaultPageSize,
                           PageSizePolicy pageSizePolicy,
                           CursorRecovery cursorRecovery,
                           FilterOptions filterOptions) {
  public static final int MAX_PAGE_SIZE = 100;
  public static final int DEFAULT_PAGE_SIZE = 20;

  public PagingConfig {
    if (maxPageSize < 1) throw new IllegalArgumentException("maxPageSize must be >= 1: " + maxPageSize);
    if (defaultPageSize < 1 || defaultPageSize > maxPageSize) {
      throw new IllegalArgumentException("defaultPageSize must be in [1, " + maxPageSize + "]: " + defaultPageSize);
    }
    pageSizePolicy = (pageSizePolicy == null) ? PageSizePolicy.CLAMP : pageSizePolicy;
    cursorRecovery = (cursorRecovery == null) ? CursorRecovery.NEAREST_SUCCESSOR : cursorRecovery;
    filterOptions = Objects.requireNonNullElse(filterOptions, FilterOptions.defaults());
  }

  public static PagingConfig defaults() {
    return new PagingConfig(MAX_PAGE_SIZE, DEFAULT_PAGE_SIZE, PageSizePolicy.CLAMP, CursorRecovery.NEAREST_SUCCESSOR,
        FilterOptions.defaults());
  }

  public PagingConfig withMaxPageSize(int v) {
    return new PagingConfig(v, Math.min(defaultPageSize, v), pageSizePolicy, cursorRecovery, filterOptions);
  }

  public PagingConfig withDefaultPageSize(int v) {
    return new PagingConfig(maxPageSize, v, pageSizePolicy, cursorRecovery, filterOptions);
  }

  public PagingConfig withPageSizePolicy(PageSizePolicy v) {
    return new PagingConfig(maxPageSize, defaultPageSize, v, cursorRecovery, filterOptions);
  }

  public PagingConfig withCursorRecovery(CursorRecovery v) {
    return new PagingConfig(maxPageSize, defaultPageSize, pageSizePolicy, v, filterOptions);
  }

  public PagingConfig withFilterOptions(FilterOptions v) {
    return new PagingConfig(maxPageSize, defaultPageSize, pageSizePolicy, cursorRecovery, v);
  }
}

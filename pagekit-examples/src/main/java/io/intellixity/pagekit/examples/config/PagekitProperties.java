package io.intellixity.pagekit.examples.config;

import io.intellixity.pagekit.filter.FilterOptions;
import io.intellixity.pagekit.filter.FilterPolicy;
import io.intellixity.pagekit.page.CursorRecovery;
import io.intellixity.pagekit.page.PageSizePolicy;
import io.intellixity.pagekit.page.PagingConfig;
import io.intellixity.pagekit.row.RowSchema;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "pagekit")
public class PagekitProperties {
  private int maxPageSize = PagingConfig.MAX_PAGE_SIZE;
  private int defaultPageSize = PagingConfig.DEFAULT_PAGE_SIZE;
  private PageSizePolicy pageSizePolicy = PageSizePolicy.CLAMP;
  private FilterPolicy filterPolicy = FilterPolicy.LENIENT;
  private CursorRecovery cursorRecovery = CursorRecovery.NEAREST_SUCCESSOR;
  private boolean caseInsensitiveText = true;

  /** Number of generated users in the demo directory. */
  private int seedUsers = 150;

  public int getMaxPageSize() { return maxPageSize; }
  public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }
  public int getDefaultPageSize() { return defaultPageSize; }
  public void setDefaultPageSize(int defaultPageSize) { this.defaultPageSize = defaultPageSize; }
  public PageSizePolicy getPageSizePolicy() { return pageSizePolicy; }
  public void setPageSizePolicy(PageSizePolicy pageSizePolicy) { this.pageSizePolicy = pageSizePolicy; }
  public FilterPolicy getFilterPolicy() { return filterPolicy; }
  public void setFilterPolicy(FilterPolicy filterPolicy) { this.filterPolicy = filterPolicy; }
  public CursorRecovery getCursorRecovery() { return cursorRecovery; }
  public void setCursorRecovery(CursorRecovery cursorRecovery) { this.cursorRecovery = cursorRecovery; }
  public boolean isCaseInsensitiveText() { return caseInsensitiveText; }
  public void setCaseInsensitiveText(boolean caseInsensitiveText) { this.caseInsensitiveText = caseInsensitiveText; }
  public int getSeedUsers() { return seedUsers; }
  public void setSeedUsers(int seedUsers) { this.seedUsers = seedUsers; }

  public PagingConfig toPagingConfig(RowSchema schema) {
    FilterOptions filters = new FilterOptions(filterPolicy, caseInsensitiveText, schema);
    return new PagingConfig(maxPageSize, defaultPageSize, pageSizePolicy, cursorRecovery, filters);
  }
}

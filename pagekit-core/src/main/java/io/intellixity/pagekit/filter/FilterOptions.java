package io.intellixity.pagekit.filter;

import io.intellixity.pagekit.row.RowSchema;

/**
 * @param policy              unknown-field and type-mismatch handling
 * @param caseInsensitiveText whether contains/starts_with/ends_with ignore case
 * @param schema              optional declared fields; null disables unknown-field checks
 */
public record FilterOptions(FilterPolicy policy, boolean caseInsensitiveText, RowSchema schema) {
  public FilterOptions {
    policy = (policy == null) ? FilterPolicy.LENIENT : policy;
  }

  public static FilterOptions defaults() { return new FilterOptions(FilterPolicy.LENIENT, true, null); }

  public static FilterOptions strict() { return new FilterOptions(FilterPolicy.STRICT, true, null); }

  public FilterOptions withPolicy(FilterPolicy policy) { return new FilterOptions(policy, caseInsensitiveText, schema); }
  public FilterOptions withCaseInsensitiveText(boolean v) { return new FilterOptions(policy, v, schema); }
  public FilterOptions withSchema(RowSchema schema) { return new FilterOptions(policy, caseInsensitiveText, schema); }

  public boolean strictMode() { return policy == FilterPolicy.STRICT; }
}

package io.intellixity.pagekit.examples.rpc;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.intellixity.pagekit.query.Clause;
import io.intellixity.pagekit.query.LogicalGroup;
import io.intellixity.pagekit.query.QueryElement;
import io.intellixity.pagekit.query.QueryFilters;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerated RPC filter. Every populated field adds one AND-ed constraint; an all-empty filter
 * matches everything.
 *
 * @param search case-insensitive substring of first name, last name or email
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record UserFilter(UserStatus status,
                         List<UserStatus> statuses,
                         UserRole role,
                         String department,
                         List<String> departments,
                         Integer ageMin,
                         Integer ageMax,
                         Integer ageEq,
                         Integer salaryMin,
                         Integer salaryMax,
                         String search,
                         String emailContains,
                         List<String> ids) {

  public static UserFilter none() {
    return new UserFilter(null, null, null, null, null, null, null, null, null, null, null, null, null);
  }

  /** Null when nothing is constrained. */
  public QueryElement toElement() {
    List<QueryElement> and = new ArrayList<>();
    if (status != null) and.add(QueryFilters.eq("status", status.name()));
    if (statuses != null && !statuses.isEmpty()) and.add(QueryFilters.in("status", names(statuses)));
    if (role != null) and.add(QueryFilters.eq("role", role.name()));
    if (department != null && !department.isBlank()) and.add(QueryFilters.eq("department", department));
    if (departments != null && !departments.isEmpty()) and.add(QueryFilters.in("department", departments));
    if (ageMin != null) and.add(QueryFilters.gte("age", ageMin));
    if (ageMax != null) and.add(QueryFilters.lte("age", ageMax));
    if (ageEq != null) and.add(QueryFilters.eq("age", ageEq));
    if (salaryMin != null) and.add(QueryFilters.gte("salary", salaryMin));
    if (salaryMax != null) and.add(QueryFilters.lte("salary", salaryMax));
    if (search != null && !search.isBlank()) {
      and.add(QueryFilters.or(
          QueryFilters.contains("firstName", search),
          QueryFilters.contains("lastName", search),
          QueryFilters.contains("email", search)));
    }
    if (emailContains != null && !emailContains.isBlank()) and.add(QueryFilters.contains("email", emailContains));
    if (ids != null && !ids.isEmpty()) and.add(QueryFilters.in("id", ids));

    if (and.isEmpty()) return null;
    if (and.size() == 1) return and.get(0);
    return new LogicalGroup(Clause.AND, and);
  }

  private static List<String> names(List<? extends Enum<?>> values) {
    List<String> out = new ArrayList<>(values.size());
    for (Enum<?> v : values) {
      if (v != null) out.add(v.name());
    }
    return out;
  }
}

package io.intellixity.pagekit.examples.web;

import io.intellixity.pagekit.examples.service.UserService;
import io.intellixity.pagekit.query.Query;
import io.intellixity.pagekit.result.Connection;
import io.intellixity.pagekit.row.Row;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

/**
 * Typed-schema surface. The body is the canonical query JSON, e.g.
 * {@code {"filter":{"eq":{"field":"status","value":"ACTIVE"}},"page":{"first":10},"totalCount":true}},
 * and the answer a connection with edges and page info.
 */
@RestController
@RequestMapping("/api/v1/graph")
public final class GraphController {
  private final UserService users;

  public GraphController(UserService users) {
    this.users = users;
  }

  @PostMapping(value = "/users", consumes = MediaType.APPLICATION_JSON_VALUE)
  public Connection<Row> users(@RequestBody(required = false) Query query) {
    return users.connection(query);
  }
}

package io.intellixity.pagekit.examples.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.pagekit.examples.rpc.UserRpc;
import io.intellixity.pagekit.examples.rpc.UserRpc.*;
import io.intellixity.pagekit.examples.rpc.UserRpcService;
import io.intellixity.pagekit.row.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicBoolean;

/** JSON transcoding of the user RPCs: {@code POST /rpc/users.v1.UserService/ListUsersCursor}. */
@RestController
@RequestMapping("/rpc/" + UserRpc.SERVICE)
public final class RpcController {
  private static final Logger log = LoggerFactory.getLogger(RpcController.class);

  static final String NDJSON = "application/x-ndjson";

  private final UserRpcService rpc;
  private final ObjectMapper mapper;

  public RpcController(UserRpcService rpc, ObjectMapper mapper) {
    this.rpc = rpc;
    this.mapper = mapper;
  }

  @PostMapping("/GetUser")
  public Row getUser(@RequestBody GetUserRequest req) {
    return rpc.getUser(req);
  }

  @PostMapping("/ListUsersOffset")
  public ListUsersOffsetResponse listUsersOffset(@RequestBody(required = false) ListUsersOffsetRequest req) {
    return rpc.listUsersOffset(req);
  }

  @PostMapping("/ListUsersCursor")
  public ListUsersCursorResponse listUsersCursor(@RequestBody(required = false) ListUsersCursorRequest req) {
    return rpc.listUsersCursor(req);
  }

  @PostMapping("/SearchUsers")
  public SearchUsersResponse searchUsers(@RequestBody(required = false) SearchUsersRequest req) {
    return rpc.searchUsers(req);
  }

  /** One JSON user per line; stops as soon as a write fails (client went away). */
  @PostMapping(value = "/StreamUsers", produces = NDJSON)
  public StreamingResponseBody streamUsers(@RequestBody(required = false) StreamUsersRequest req) {
    return out -> writeStream(req, out);
  }

  void writeStream(StreamUsersRequest req, OutputStream out) {
    AtomicBoolean disconnected = new AtomicBoolean();
    rpc.streamUsers(req, disconnected::get, row -> {
      try {
        out.write(mapper.writeValueAsBytes(row));
        out.write('\n');
        out.flush();
      } catch (IOException e) {
        if (log.isDebugEnabled()) log.debug("StreamUsers write failed after user {}: {}", row.id(), e.toString());
        disconnected.set(true);
      }
    });
  }
}

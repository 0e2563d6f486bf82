package io.intellixity.pagekit.examples.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.pagekit.examples.Fixtures;
import io.intellixity.pagekit.examples.rpc.UserRpc.ListUsersCursorResponse;
import io.intellixity.pagekit.examples.rpc.UserRpc.StreamUsersRequest;
import io.intellixity.pagekit.examples.rpc.UserSort;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class RpcControllerTest {
  private final ObjectMapper mapper = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  private final RpcController controller = new RpcController(new Fixtures().rpc, mapper);

  @Test
  void streamsOneUserPerLine() throws Exception {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    controller.writeStream(new StreamUsersRequest(null, UserSort.by(UserSort.Field.SALARY, UserSort.Order.DESC), 3), out);

    String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
    assertEquals(3, lines.length);
    JsonNode first = mapper.readTree(lines[0]);
    assertEquals("150", first.get("id").asText());
    assertEquals("user150@example.com", first.get("email").asText());
    assertTrue(first.get("createdAt").isTextual());
  }

  @Test
  void stopsAfterTheFirstFailedWrite() {
    int[] attempts = {0};
    OutputStream broken = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        attempts[0]++;
        throw new IOException("Broken pipe");
      }
    };

    controller.writeStream(new StreamUsersRequest(null, null, 0), broken);
    assertEquals(1, attempts[0]);
  }

  @Test
  void cursorResponseUsesSnakeCase() throws Exception {
    ListUsersCursorResponse r = controller.listUsersCursor(null);
    JsonNode json = mapper.readTree(mapper.writeValueAsString(r));

    assertTrue(json.has("next_page_token"));
    assertTrue(json.get("has_more").asBoolean());
    assertEquals(150, json.get("total_count").asInt());
    assertEquals(20, json.get("users").size());
  }
}

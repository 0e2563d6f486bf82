package io.intellixity.pagekit.cursor;

import io.intellixity.pagekit.query.SortField;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonCursorCodecTest {
  private final JsonCursorCodec codec = new JsonCursorCodec();

  private static CursorKey key(Object... fieldDirValue) {
    List<CursorKey.Entry> entries = new ArrayList<>();
    for (int i = 0; i < fieldDirValue.length; i += 3) {
      entries.add(new CursorKey.Entry((String) fieldDirValue[i], (SortField.Direction) fieldDirValue[i + 1], fieldDirValue[i + 2]));
    }
    return new CursorKey(entries);
  }

  private static String b64(String json) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  private static String reasonOf(CursorDecoding d) {
    assertTrue(d instanceof CursorDecoding.Malformed, "expected Malformed but got " + d);
    return ((CursorDecoding.Malformed) d).reason();
  }

  @Test
  void roundTripsEveryValueKind() {
    CursorKey k = key(
        "status", SortField.Direction.ASC, "ACTIVE",
        "age", SortField.Direction.DESC, 31L,
        "score", SortField.Direction.DESC, 87.5d,
        "verified", SortField.Direction.ASC, true,
        "createdAt", SortField.Direction.DESC, Instant.parse("2024-03-01T10:15:30.123Z"),
        "deletedAt", SortField.Direction.ASC, null,
        "id", SortField.Direction.ASC, "42");

    CursorDecoding d = codec.decode(codec.encode(k));

    assertTrue(d instanceof CursorDecoding.Decoded);
    assertEquals(k, ((CursorDecoding.Decoded) d).key());

    for (double nonFinite : new double[] {Double.NaN, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY}) {
      CursorKey f = key("score", SortField.Direction.ASC, nonFinite, "id", SortField.Direction.ASC, "1");
      CursorDecoding fd = codec.decode(codec.encode(f));
      assertTrue(fd instanceof CursorDecoding.Decoded, "not decoded: " + fd);
      assertEquals(f, ((CursorDecoding.Decoded) fd).key());
    }
  }

  @Test
  void floatTagRejectsOtherText() {
    String token = b64("{\"v\":1,\"k\":[{\"f\":\"score\",\"d\":\"A\",\"t\":\"f\",\"v\":\"nan\"},"
        + "{\"f\":\"id\",\"d\":\"A\",\"t\":\"s\",\"v\":\"1\"}]}");
    assertEquals("bad value for score", reasonOf(codec.decode(token)));
  }

  @Test
  void tokensAreUrlSafe() {
    CursorKey k = key("name", SortField.Direction.ASC, "a?b>c~~~ÿ", "id", SortField.Direction.ASC, "1");
    String token = codec.encode(k);
    assertFalse(token.contains("+"));
    assertFalse(token.contains("/"));
    assertFalse(token.contains("="));
  }

  @Test
  void acceptsStandardBase64WithPadding() {
    String json = "{\"v\":1,\"k\":[{\"f\":\"id\",\"d\":\"A\",\"t\":\"s\",\"v\":\"10\"}]}";
    String token = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    CursorDecoding d = codec.decode(token);
    assertTrue(d instanceof CursorDecoding.Decoded);
    assertEquals("10", ((CursorDecoding.Decoded) d).key().get("id"));
  }

  @Test
  void hostileInputIsMalformedNotThrown() {
    assertEquals("not base64", reasonOf(codec.decode("!!!not-base-valid!!!")));
    assertEquals("not json", reasonOf(codec.decode(b64("{\"v\":1,\"k\":["))));
    assertEquals("not an object", reasonOf(codec.decode(b64("[1,2]"))));
    assertEquals("empty cursor", reasonOf(codec.decode("  ")));
    assertEquals("cursor too long", reasonOf(codec.decode("A".repeat(JsonCursorCodec.MAX_TOKEN_LENGTH + 1))));
  }

  @Test
  void wrongShapesAreMalformed() {
    assertEquals("unsupported version",
        reasonOf(codec.decode(b64("{\"v\":2,\"k\":[{\"f\":\"id\",\"d\":\"A\",\"t\":\"s\",\"v\":\"1\"}]}"))));
    assertEquals("missing key", reasonOf(codec.decode(b64("{\"v\":1,\"k\":[]}"))));
    assertEquals("bad direction",
        reasonOf(codec.decode(b64("{\"v\":1,\"k\":[{\"f\":\"id\",\"d\":\"X\",\"t\":\"s\",\"v\":\"1\"}]}"))));
    assertEquals("bad value for age",
        reasonOf(codec.decode(b64("{\"v\":1,\"k\":[{\"f\":\"age\",\"d\":\"A\",\"t\":\"i\",\"v\":\"x\"},"
            + "{\"f\":\"id\",\"d\":\"A\",\"t\":\"s\",\"v\":\"1\"}]}"))));
    assertEquals("bad value for at",
        reasonOf(codec.decode(b64("{\"v\":1,\"k\":[{\"f\":\"at\",\"d\":\"A\",\"t\":\"t\",\"v\":\"yesterday\"},"
            + "{\"f\":\"id\",\"d\":\"A\",\"t\":\"s\",\"v\":\"1\"}]}"))));
    assertEquals("bad value for id",
        reasonOf(codec.decode(b64("{\"v\":1,\"k\":[{\"f\":\"id\",\"d\":\"A\",\"t\":\"q\",\"v\":\"1\"}]}"))));
  }

  @Test
  void tupleMustEndWithTheId() {
    String json = "{\"v\":1,\"k\":[{\"f\":\"age\",\"d\":\"A\",\"t\":\"i\",\"v\":3}]}";
    assertEquals("key must end with the id", reasonOf(codec.decode(b64(json))));
  }

  @Test
  void decodingDoesNotCheckTheActiveSort() {
    CursorKey k = key("age", SortField.Direction.DESC, 30L, "id", SortField.Direction.ASC, "9");
    CursorKey decoded = ((CursorDecoding.Decoded) codec.decode(codec.encode(k))).key();

    assertTrue(decoded.matches(Arrays.asList(SortField.desc("age"), SortField.asc("id"))));
    assertFalse(decoded.matches(List.of(SortField.asc("id"))));
    assertFalse(decoded.matches(Arrays.asList(SortField.asc("age"), SortField.asc("id"))));
  }
}

package io.intellixity.pagekit.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.pagekit.query.SortField;
import io.intellixity.pagekit.row.Row;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Default codec: {@code {"v":1,"k":[{"f":"age","d":"D","t":"i","v":31},{"f":"id","d":"A","t":"s","v":"7"}]}}
 * as URL-safe Base64 without padding.
 *
 * <p>Type tags: {@code s} string, {@code i} integer, {@code f} float, {@code b} boolean,
 * {@code t} ISO-8601 instant, {@code n} null. Standard Base64 ({@code +}, {@code /}, padding) is
 * accepted on decode.</p>
 */
public final class JsonCursorCodec implements CursorCodec {
  public static final int VERSION = 1;
  static final int MAX_TOKEN_LENGTH = 8192;

  // marks a tag/value pair that does not decode; null is a legitimate key value
  private static final Object INVALID = new Object();

  private final ObjectMapper mapper;

  public JsonCursorCodec() {
    this(new ObjectMapper());
  }

  public JsonCursorCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String encode(CursorKey key) {
    Objects.requireNonNull(key, "key");
    ObjectNode root = mapper.createObjectNode();
    root.put("v", VERSION);
    ArrayNode k = root.putArray("k");
    for (CursorKey.Entry e : key.entries()) {
      ObjectNode n = k.addObject();
      n.put("f", e.field());
      n.put("d", e.direction() == SortField.Direction.DESC ? "D" : "A");
      writeValue(n, e.value());
    }
    try {
      byte[] json = mapper.writeValueAsBytes(root);
      return Base64.getUrlEncoder().withoutPadding().encodeToString(json);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode cursor", e);
    }
  }

  private static void writeValue(ObjectNode n, Object v) {
    if (v == null) {
      n.put("t", "n");
      n.putNull("v");
    } else if (v instanceof String s) {
      n.put("t", "s");
      n.put("v", s);
    } else if (v instanceof Long l) {
      n.put("t", "i");
      n.put("v", l);
    } else if (v instanceof Double d) {
      n.put("t", "f");
      // JSON has no literal for NaN or the infinities
      if (d.isNaN() || d.isInfinite()) n.put("v", d.toString());
      else n.put("v", d);
    } else if (v instanceof Boolean b) {
      n.put("t", "b");
      n.put("v", b);
    } else if (v instanceof Instant i) {
      n.put("t", "t");
      n.put("v", i.toString());
    } else {
      throw new IllegalArgumentException("Unsupported cursor value type: " + v.getClass().getName());
    }
  }

  @Override
  public CursorDecoding decode(String token) {
    if (token == null || token.isBlank()) return CursorDecoding.malformed("empty cursor");
    if (token.length() > MAX_TOKEN_LENGTH) return CursorDecoding.malformed("cursor too long");

    byte[] bytes;
    try {
      String t = token.trim();
      Base64.Decoder decoder = (t.indexOf('+') >= 0 || t.indexOf('/') >= 0) ? Base64.getDecoder() : Base64.getUrlDecoder();
      bytes = decoder.decode(t);
    } catch (IllegalArgumentException e) {
      return CursorDecoding.malformed("not base64");
    }

    JsonNode root;
    try {
      root = mapper.readTree(new String(bytes, StandardCharsets.UTF_8));
    } catch (JsonProcessingException e) {
      return CursorDecoding.malformed("not json");
    }
    if (root == null || !root.isObject()) return CursorDecoding.malformed("not an object");

    JsonNode v = root.get("v");
    if (v == null || !v.isInt() || v.intValue() != VERSION) return CursorDecoding.malformed("unsupported version");

    JsonNode k = root.get("k");
    if (k == null || !k.isArray() || k.isEmpty()) return CursorDecoding.malformed("missing key");

    List<CursorKey.Entry> entries = new ArrayList<>(k.size());
    for (JsonNode n : k) {
      if (!n.isObject()) return CursorDecoding.malformed("bad key entry");
      JsonNode f = n.get("f");
      JsonNode d = n.get("d");
      if (f == null || !f.isTextual() || f.asText().isEmpty()) return CursorDecoding.malformed("bad field");
      SortField.Direction dir;
      if (d != null && "A".equals(d.asText())) dir = SortField.Direction.ASC;
      else if (d != null && "D".equals(d.asText())) dir = SortField.Direction.DESC;
      else return CursorDecoding.malformed("bad direction");

      Object value = readValue(n.get("t"), n.get("v"));
      if (value == INVALID) return CursorDecoding.malformed("bad value for " + f.asText());
      entries.add(new CursorKey.Entry(f.asText(), dir, value));
    }

    CursorKey.Entry last = entries.get(entries.size() - 1);
    if (!Row.ID.equals(last.field()) || !(last.value() instanceof String)) {
      return CursorDecoding.malformed("key must end with the id");
    }
    return CursorDecoding.decoded(new CursorKey(entries));
  }

  private static Object readValue(JsonNode t, JsonNode v) {
    if (t == null || !t.isTextual()) return INVALID;
    switch (t.asText()) {
      case "n":
        return (v == null || v.isNull()) ? null : INVALID;
      case "s":
        return (v != null && v.isTextual()) ? v.asText() : INVALID;
      case "i":
        return (v != null && v.isIntegralNumber() && v.canConvertToLong()) ? (Object) v.longValue() : INVALID;
      case "f":
        if (v != null && v.isNumber()) return v.doubleValue();
        return (v != null && v.isTextual()) ? nonFinite(v.asText()) : INVALID;
      case "b":
        return (v != null && v.isBoolean()) ? (Object) v.booleanValue() : INVALID;
      case "t":
        if (v == null || !v.isTextual()) return INVALID;
        try {
          return Instant.parse(v.asText());
        } catch (DateTimeParseException e) {
          return INVALID;
        }
      default:
        return INVALID;
    }
  }

  private static Object nonFinite(String s) {
    return switch (s) {
      case "NaN" -> Double.NaN;
      case "Infinity" -> Double.POSITIVE_INFINITY;
      case "-Infinity" -> Double.NEGATIVE_INFINITY;
      default -> INVALID;
    };
  }
}

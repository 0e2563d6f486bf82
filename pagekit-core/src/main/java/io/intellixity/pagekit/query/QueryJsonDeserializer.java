package io.intellixity.pagekit.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;
import io.intellixity.pagekit.error.QueryValidationException;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link Query}.
 *
 * <p>Filter nodes: {@code {"and":[...]}}, {@code {"or":[...]}}, {@code {"not":<node>}} and
 * {@code {"<op>":{"field":..,"value":..}}} ({@code "values"} for {@code in}/{@code not_in}).
 * Pages: {@code {"type":"offset","page":2,"pageSize":20}}, {@code {"type":"cursor","first":10,"after":".."}}
 * or {@code {"type":"cursor","last":10,"before":".."}}.</p>
 */
public final class QueryJsonDeserializer extends JsonDeserializer<Query> {
  @Override
  public Query deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("Query JSON must be an object");

    Query q = new Query();

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode page = root.get("page");
    if (page != null && page.isObject()) {
      q.withPage(parsePage(page));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        fields.add(new SortField(f, parseDirection(dir)));
      }
      q.withSort(fields);
    }

    q.withTotalCount(boolOrDefault(root.get("totalCount"), false));
    return q;
  }

  private static SortField.Direction parseDirection(String dir) {
    if (dir == null) return SortField.Direction.ASC;
    return switch (dir.trim().toUpperCase(Locale.ROOT)) {
      case "ASC", "ASCENDING" -> SortField.Direction.ASC;
      case "DESC", "DESCENDING" -> SortField.Direction.DESC;
      default -> throw new QueryValidationException("Unknown sort direction: " + dir);
    };
  }

  private static Page parsePage(JsonNode page) {
    String type = textOrNull(page.get("type"));
    if (type == null) type = page.has("page") ? "offset" : "cursor";

    if (type.equalsIgnoreCase("offset")) {
      int number = intOrDefault(page.get("page"), 1);
      return new OffsetPage(number, intOrNull(page.get("pageSize")));
    }
    if (!type.equalsIgnoreCase("cursor")) {
      throw new QueryValidationException("Unknown page type: " + type);
    }

    boolean backward = page.has("last") || page.has("before");
    if (backward && (page.has("first") || page.has("after"))) {
      throw new QueryValidationException("Cursor page cannot combine first/after with last/before");
    }
    String direction = textOrNull(page.get("direction"));
    if (direction != null) backward = direction.equalsIgnoreCase("backward");

    if (backward) {
      Integer size = intOrNull(page.has("last") ? page.get("last") : page.get("pageSize"));
      String cursor = textOrNull(page.has("before") ? page.get("before") : page.get("cursor"));
      return CursorPage.before(cursor, size);
    }
    Integer size = intOrNull(page.has("first") ? page.get("first") : page.get("pageSize"));
    String cursor = textOrNull(page.has("after") ? page.get("after") : page.get("cursor"));
    return CursorPage.after(cursor, size);
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new QueryValidationException("Filter element must be an object: " + n);

    if (n.has("and")) {
      return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    }
    if (n.has("or")) {
      return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));
    }
    if (n.has("not")) {
      QueryElement child = parseElement(n.get("not"), codec);
      if (child == null) throw new QueryValidationException("not requires an element");
      return new NotElement(child);
    }

    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Optional<Operator> op = Operator.fromName(k);
      if (op.isEmpty()) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new QueryValidationException(k + " must be an object");
      return parseCondition(op.get(), body, codec);
    }

    throw new QueryValidationException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw new QueryValidationException("and/or require an array");
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null || field.isBlank()) throw new QueryValidationException(op.wireName() + " requires field");

    if (op.presence()) return new Condition(field, op, null);

    if (op.membership()) {
      JsonNode values = body.has("values") ? body.get("values") : body.get("value");
      Object decoded = decodeValue(values, codec);
      if (decoded != null && !(decoded instanceof Collection<?>)) decoded = List.of(decoded);
      return new Condition(field, op, decoded);
    }

    return new Condition(field, op, decodeValue(body.get("value"), codec));
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static Integer intOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (n.isNumber()) {
      if (!n.isIntegralNumber() || !n.canConvertToInt()) {
        throw new QueryValidationException("Expected a 32-bit integer but got: " + n.asText());
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(n.asText().trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Expected an integer but got: " + n.asText(), e);
    }
  }

  private static int intOrDefault(JsonNode n, int def) {
    Integer v = intOrNull(n);
    return (v == null) ? def : v;
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}

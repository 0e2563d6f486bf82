package io.intellixity.pagekit.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (q.page() != null) {
      g.writeFieldName("page");
      writePage(q.page(), g);
    }

    if (q.sort() != null && !q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.includeTotalCount()) {
      g.writeBooleanField("totalCount", true);
    }

    g.writeEndObject();
  }

  private static void writePage(Page p, JsonGenerator g) throws IOException {
    g.writeStartObject();
    if (p instanceof OffsetPage op) {
      g.writeStringField("type", "offset");
      g.writeNumberField("page", op.page());
      if (op.pageSize() != null) g.writeNumberField("pageSize", op.pageSize());
    } else if (p instanceof CursorPage cp) {
      boolean forward = cp.direction() == CursorPage.Direction.FORWARD;
      g.writeStringField("type", "cursor");
      if (cp.pageSize() != null) g.writeNumberField(forward ? "first" : "last", cp.pageSize());
      if (cp.cursor() != null) g.writeStringField(forward ? "after" : "before", cp.cursor());
    } else if (p.pageSize() != null) {
      g.writeNumberField("pageSize", p.pageSize());
    }
    g.writeEndObject();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().wireName());
      g.writeStringField("field", c.property());
      if (c.operator().membership()) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(c.value(), g);
      } else if (!c.operator().presence()) {
        g.writeFieldName("value");
        serializers.defaultSerializeValue(c.value(), g);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    serializers.defaultSerializeValue(el, g);
  }
}

package io.intellixity.pleco.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link ListQuery}; filters are written in explicit operator form. */
public final class ListQueryJsonSerializer extends JsonSerializer<ListQuery> {
  @Override
  public void serialize(ListQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeNode(q.filter(), g, serializers);
    }

    if (q.sort() != null) {
      g.writeObjectFieldStart("sort");
      g.writeStringField(q.sort().field(), q.sort().direction().name());
      g.writeEndObject();
    }

    LimitOffsetPage page = q.page();
    if (page != null) {
      g.writeObjectFieldStart("page");
      if (page.limit() != null) g.writeNumberField("limit", page.limit());
      if (page.offset() != null) g.writeNumberField("offset", page.offset());
      g.writeEndObject();
    }

    g.writeEndObject();
  }

  private static void writeNode(FilterNode node, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (node instanceof LogicalGroup lg) {
      g.writeStartObject();
      g.writeArrayFieldStart(lg.clause() == Clause.OR ? FilterParser.OR : FilterParser.AND);
      for (FilterNode child : lg.elements()) {
        writeNode(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (node instanceof FieldRef f) {
      g.writeStartObject();
      g.writeFieldName(f.field());
      writeNode(f.subfilter(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (node instanceof Condition c) {
      g.writeStartObject();
      g.writeFieldName(c.operator().key());
      serializers.defaultSerializeValue(c.value(), g);
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported filter node: " + node.getClass().getName());
  }
}

package io.intellixity.folio.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;

import java.io.IOException;

/** Canonical JSON serializer for {@link PageQuery}; the inverse of {@link PageQueryJsonDeserializer}. */
public final class PageQueryJsonSerializer extends JsonSerializer<PageQuery> {
  private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

  @Override
  public void serialize(PageQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.filter() != null && !q.filter().isEmpty()) {
      g.writeFieldName("filter");
      writeDocument(q.filter(), g);
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
        g.writeNumberField("order", sf.order());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.projection() != null && !q.projection().isEmpty()) {
      g.writeFieldName("projection");
      writeDocument(q.projection(), g);
    }

    if (q.idPath() != null) g.writeStringField("idPath", q.idPath());

    g.writeEndObject();
  }

  private static void writePage(Page p, JsonGenerator g) throws IOException {
    g.writeStartObject();
    if (p instanceof OffsetPage op) {
      g.writeStringField("type", "offset");
      g.writeNumberField("offset", op.offset());
      g.writeNumberField("limit", op.limit());
    } else if (p instanceof CursorPage cp) {
      g.writeStringField("type", "cursor");
      g.writeNumberField("limit", cp.limit());
      if (cp.cursor() != null) g.writeStringField("cursor", cp.cursor());
      g.writeStringField("direction", cp.direction().name());
    } else {
      g.writeNumberField("limit", p.limit());
    }
    g.writeEndObject();
  }

  private static void writeDocument(Document d, JsonGenerator g) throws IOException {
    g.writeRawValue(d.toJson(RELAXED));
  }
}

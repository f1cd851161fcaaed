package io.intellixity.folio.cursor;

import org.bson.BSONException;
import org.bson.Document;
import org.bson.UuidRepresentation;
import org.bson.codecs.BsonValueCodecProvider;
import org.bson.codecs.Codec;
import org.bson.codecs.DocumentCodecProvider;
import org.bson.codecs.IterableCodecProvider;
import org.bson.codecs.MapCodecProvider;
import org.bson.codecs.ValueCodecProvider;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.codecs.configuration.CodecRegistries;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.codecs.jsr310.Jsr310CodecProvider;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Opaque, URL-safe cursor codec.
 *
 * <p>A cursor is base64url (no padding) over the MongoDB Extended JSON form of {@code {"v": value}},
 * so identifiers, dates, binary values and nested documents survive the round trip. Cursors carry
 * the value only: no page numbers, no offsets.</p>
 */
public final class PaginationCursor {
  private static final String VALUE_KEY = "v";

  private static final CodecRegistry REGISTRY = CodecRegistries.withUuidRepresentation(
      CodecRegistries.fromProviders(
          new ValueCodecProvider(),
          new BsonValueCodecProvider(),
          new DocumentCodecProvider(),
          new IterableCodecProvider(),
          new MapCodecProvider(),
          new Jsr310CodecProvider()),
      UuidRepresentation.STANDARD);

  private static final Codec<Document> CODEC = REGISTRY.get(Document.class);

  private static final JsonWriterSettings JSON = JsonWriterSettings.builder()
      .outputMode(JsonMode.EXTENDED)
      .build();

  private PaginationCursor() {}

  public static String encode(Object value) {
    String json;
    try {
      json = new Document(VALUE_KEY, value).toJson(JSON, CODEC);
    } catch (CodecConfigurationException e) {
      throw new IllegalArgumentException("Cursor value is not BSON-encodable: " + value.getClass().getName(), e);
    }
    return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
  }

  public static Object decode(String cursor) {
    if (cursor == null || cursor.isBlank()) throw new CursorDecodeException("Cursor is blank");

    byte[] raw;
    try {
      raw = Base64.getUrlDecoder().decode(cursor.trim());
    } catch (IllegalArgumentException e) {
      throw new CursorDecodeException("Cursor is not valid base64url", e);
    }

    Document wrapper;
    try {
      wrapper = Document.parse(new String(raw, StandardCharsets.UTF_8), CODEC);
    } catch (JsonParseException | BSONException | IllegalArgumentException e) {
      throw new CursorDecodeException("Cursor does not contain a valid position", e);
    }
    if (!wrapper.containsKey(VALUE_KEY)) throw new CursorDecodeException("Cursor does not contain a position value");
    return wrapper.get(VALUE_KEY);
  }
}

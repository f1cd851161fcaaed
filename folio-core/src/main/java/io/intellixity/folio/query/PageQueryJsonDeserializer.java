package io.intellixity.folio.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;
import io.intellixity.folio.config.PaginationSettings;
import org.bson.Document;
import org.bson.json.JsonParseException;

import java.io.IOException;
import java.util.*;

/**
 * Canonical JSON deserializer for {@link PageQuery}.
 *
 * <p>{@code filter} and {@code projection} are MongoDB (Extended) JSON objects, so values such as
 * {@code {"$oid": "..."}} or {@code {"$date": "..."}} arrive as their BSON types. A page without a
 * {@code limit} takes {@link PaginationSettings#defaultLimit()} from {@code folio.properties}.</p>
 */
public final class PageQueryJsonDeserializer extends JsonDeserializer<PageQuery> {
  @Override
  public PageQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("PageQuery JSON must be an object");

    PageQuery q = new PageQuery();

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) q.withFilter(toDocument("filter", filter));

    JsonNode projection = root.get("projection");
    if (projection != null && !projection.isNull()) q.withProjection(toDocument("projection", projection));

    JsonNode page = root.get("page");
    if (page != null && page.isObject()) q.withPage(parsePage(page));

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        SortField sf = parseSort(s);
        if (sf != null) fields.add(sf);
      }
      q.withSort(fields);
    } else if (sort != null && sort.isObject()) {
      q.withSort(parseSort(sort));
    }

    String idPath = textOrNull(root.get("idPath"));
    if (idPath != null && !idPath.isBlank()) q.withIdPath(idPath.trim());

    return q;
  }

  private static Page parsePage(JsonNode page) {
    String type = textOrNull(page.get("type"));
    JsonNode limitNode = page.get("limit");
    int limit = (limitNode == null || limitNode.isNull()) ? PaginationSettings.load().defaultLimit() : intOrDefault(limitNode, 0);
    if (type == null || type.equalsIgnoreCase("cursor") || type.equalsIgnoreCase("seek")) {
      if (type == null && page.has("offset")) {
        return new OffsetPage(intOrDefault(page.get("offset"), 0), limit);
      }
      String cursor = textOrNull(page.get("cursor"));
      CursorDirection direction = CursorDirection.parse(textOrNull(page.get("direction")));
      return new CursorPage(limit, cursor, direction);
    }
    if (type.equalsIgnoreCase("offset")) {
      return new OffsetPage(intOrDefault(page.get("offset"), 0), limit);
    }
    throw new QueryValidationException("Unknown page type: " + type);
  }

  private static SortField parseSort(JsonNode s) {
    if (s == null || !s.isObject()) return null;
    String field = textOrNull(s.get("field"));
    if (field == null) return null;
    JsonNode order = s.get("order");
    if (order != null && !order.isNull()) return SortField.of(field, order.asInt());
    String dir = textOrNull(s.get("dir"));
    SortField.Direction d = (dir == null) ? SortField.Direction.ASC : parseDir(dir);
    return new SortField(field, d);
  }

  private static SortField.Direction parseDir(String dir) {
    try {
      return SortField.Direction.valueOf(dir.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new QueryValidationException("Unknown sort direction: " + dir, e);
    }
  }

  private static Document toDocument(String name, JsonNode n) {
    if (!n.isObject()) throw new QueryValidationException(name + " must be an object");
    try {
      return Document.parse(n.toString());
    } catch (JsonParseException e) {
      throw new QueryValidationException(name + " is not valid extended JSON", e);
    }
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    if (n == null || n.isNull()) return def;
    if (n.isNumber()) {
      if (!n.isIntegralNumber() || !n.canConvertToInt()) {
        throw new QueryValidationException("Expected an integer but got: " + n.asText());
      }
      return n.intValue();
    }
    try {
      return Integer.parseInt(n.asText().trim());
    } catch (NumberFormatException e) {
      throw new QueryValidationException("Expected an integer but got: " + n.asText(), e);
    }
  }
}

package io.intellixity.folio.cursor;

import org.bson.Document;
import org.bson.types.Binary;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

final class PaginationCursorTest {
  @Test
  void roundTripsBsonValues() {
    ObjectId oid = new ObjectId();
    UUID uuid = UUID.randomUUID();
    Date when = new Date(1_700_000_000_000L);

    assertEquals("abc", PaginationCursor.decode(PaginationCursor.encode("abc")));
    assertEquals(42, PaginationCursor.decode(PaginationCursor.encode(42)));
    assertEquals(42L, PaginationCursor.decode(PaginationCursor.encode(42L)));
    assertEquals(2.5d, PaginationCursor.decode(PaginationCursor.encode(2.5d)));
    assertEquals(true, PaginationCursor.decode(PaginationCursor.encode(true)));
    assertEquals(oid, PaginationCursor.decode(PaginationCursor.encode(oid)));
    assertEquals(uuid, PaginationCursor.decode(PaginationCursor.encode(uuid)));
    assertEquals(when, PaginationCursor.decode(PaginationCursor.encode(when)));
    assertEquals(new Decimal128(new BigDecimal("10.25")),
        PaginationCursor.decode(PaginationCursor.encode(new Decimal128(new BigDecimal("10.25")))));
  }

  @Test
  void roundTripsNestedStructures() {
    Document position = new Document("name", "Zoë").append("tags", List.of("a", "b")).append("n", 7L);
    assertEquals(position, PaginationCursor.decode(PaginationCursor.encode(position)));

    Binary bin = new Binary(new byte[] {1, 2, 3});
    Object decoded = PaginationCursor.decode(PaginationCursor.encode(bin));
    assertTrue(decoded instanceof Binary);
    assertArrayEquals(bin.getData(), ((Binary) decoded).getData());
  }

  @Test
  void cursorsAreUrlSafeAndDeterministic() {
    String c = PaginationCursor.encode("??>>~~ value with spaces");
    assertEquals(c, PaginationCursor.encode("??>>~~ value with spaces"));
    assertFalse(c.contains("+"));
    assertFalse(c.contains("/"));
    assertFalse(c.contains("="));
  }

  @Test
  void nullValueRoundTrips() {
    assertNull(PaginationCursor.decode(PaginationCursor.encode(null)));
  }

  @Test
  void rejectsMalformedCursors() {
    assertThrows(CursorDecodeException.class, () -> PaginationCursor.decode(null));
    assertThrows(CursorDecodeException.class, () -> PaginationCursor.decode("   "));
    assertThrows(CursorDecodeException.class, () -> PaginationCursor.decode("%%%not-base64%%%"));

    String notJson = Base64.getUrlEncoder().withoutPadding()
        .encodeToString("hello".getBytes(StandardCharsets.UTF_8));
    assertThrows(CursorDecodeException.class, () -> PaginationCursor.decode(notJson));

    String noValue = Base64.getUrlEncoder().withoutPadding()
        .encodeToString("{\"x\": 1}".getBytes(StandardCharsets.UTF_8));
    CursorDecodeException ex = assertThrows(CursorDecodeException.class, () -> PaginationCursor.decode(noValue));
    assertTrue(ex.getMessage().contains("position value"));
  }

  @Test
  void rejectsValuesWithoutCodec() {
    assertThrows(IllegalArgumentException.class, () -> PaginationCursor.encode(new Object()));
  }
}

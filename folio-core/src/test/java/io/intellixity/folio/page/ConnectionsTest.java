package io.intellixity.folio.page;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ConnectionsTest {
  @Test
  void emptyConnectionIsResolved() {
    Connection<KeysetPageInfo> c = Connections.empty();
    assertEquals(0L, c.totalCount().toCompletableFuture().join());
    assertTrue(c.edges().toCompletableFuture().join().isEmpty());
    assertFalse(c.pageInfo().hasNextPage().toCompletableFuture().join());
    assertFalse(c.pageInfo().hasPreviousPage().toCompletableFuture().join());
    assertEquals("", c.pageInfo().startCursor().toCompletableFuture().join());
    assertEquals("", c.pageInfo().endCursor().toCompletableFuture().join());
    assertEquals(0L, c.pageInfo().startingPosition().toCompletableFuture().join());
  }

  @Test
  void lazyEdgeCursorComputedOnce() {
    AtomicInteger calls = new AtomicInteger();
    Edge e = Edge.lazy(new Document("_id", 1), () -> "c" + calls.incrementAndGet());
    Edge reshaped = e.withNode(new Document("id", 1));

    assertEquals(0, calls.get());
    assertEquals("c1", reshaped.cursor());
    assertEquals("c1", e.cursor());
    assertEquals(1, calls.get());
    assertEquals(new Document("id", 1), reshaped.node());
  }
}

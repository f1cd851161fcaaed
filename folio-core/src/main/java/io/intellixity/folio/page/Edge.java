package io.intellixity.folio.page;

import org.bson.Document;

import java.util.Objects;
import java.util.function.Supplier;

/** One paginated node paired with the cursor that resumes pagination right after (or before) it. */
public final class Edge {
  private final Document node;
  private final Supplier<String> cursorSupplier;
  private String cursor;

  private Edge(Document node, Supplier<String> cursorSupplier, String cursor) {
    this.node = Objects.requireNonNull(node, "node");
    this.cursorSupplier = cursorSupplier;
    this.cursor = cursor;
  }

  public static Edge of(Document node, String cursor) {
    return new Edge(node, null, Objects.requireNonNull(cursor, "cursor"));
  }

  /** Cursor computed on first {@link #cursor()} call. */
  public static Edge lazy(Document node, Supplier<String> cursor) {
    return new Edge(node, Objects.requireNonNull(cursor, "cursor"), null);
  }

  public Document node() { return node; }

  public synchronized String cursor() {
    if (cursor == null) cursor = cursorSupplier.get();
    return cursor;
  }

  /** Same position, different node (formatters reshaping what callers see). */
  public Edge withNode(Document node) {
    if (cursorSupplier == null) return new Edge(node, null, cursor);
    return new Edge(node, this::cursor, null);
  }
}

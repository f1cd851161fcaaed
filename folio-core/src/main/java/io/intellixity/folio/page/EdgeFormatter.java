package io.intellixity.folio.page;

/** Hook applied to every edge before it is handed to the caller. */
@FunctionalInterface
public interface EdgeFormatter {
  Edge format(Edge edge);

  static EdgeFormatter identity() {
    return edge -> edge;
  }
}

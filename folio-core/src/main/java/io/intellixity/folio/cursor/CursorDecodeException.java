package io.intellixity.folio.cursor;

/**
 * Raised when a cursor string cannot be decoded back into a sort position.
 * <p>
 * Never interpreted as "no cursor": paginators let it propagate before any store access.
 */
public final class CursorDecodeException extends RuntimeException {
  public CursorDecodeException(String message) {
    super(message);
  }

  public CursorDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}

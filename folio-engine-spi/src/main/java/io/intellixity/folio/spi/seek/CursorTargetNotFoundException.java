package io.intellixity.folio.spi.seek;

/** The record a cursor points at no longer exists, so its sort value cannot be resolved. */
public class CursorTargetNotFoundException extends RuntimeException {
  public CursorTargetNotFoundException(String message) {
    super(message);
  }
}

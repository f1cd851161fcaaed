package io.intellixity.folio.query;

/**
 * Raised when a {@link PageQuery} is malformed (bad limit, bad offset, unsupported sort, ...).
 * <p>
 * Thrown by backend-agnostic validation before any store access.
 */
public final class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}

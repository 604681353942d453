package io.intellixity.tessel.persistence.query;

/**
 * Raised when caller input is malformed: a string used as a predicate, an unknown property, a bad sort or paging
 * value, a missing required field on create.
 * <p>
 * Surfaced immediately, never retried.
 */
public final class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}

package io.intellixity.tessel.persistence.metadata;

/**
 * Raised when model registration is inconsistent: a missing relation target, through model or counterpart,
 * a duplicate model, more than one primary key, or a populate request naming an unknown relation.
 * <p>
 * Indicates a schema defect; never retried.
 */
public final class ConfigurationException extends RuntimeException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}

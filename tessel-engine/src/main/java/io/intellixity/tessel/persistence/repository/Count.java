package io.intellixity.tessel.persistence.repository;

import io.intellixity.tessel.persistence.mapping.Coercions;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Result of a count. {@link #value()} is a {@link Long} when the count is a safe integer and the driver's
 * original text otherwise.
 */
public record Count(Object value) {
  public Count {
    Objects.requireNonNull(value, "value");
  }

  static Count of(Object raw) {
    if (raw == null) return new Count(0L);
    if (raw instanceof Long || raw instanceof Integer || raw instanceof Short) {
      long n = ((Number) raw).longValue();
      return Coercions.isSafeInteger(n) ? new Count(n) : new Count(Long.toString(n));
    }
    Long coerced = Coercions.toInteger(raw);
    return (coerced != null) ? new Count(coerced) : new Count(raw.toString());
  }

  public boolean isSafe() {
    return value instanceof Long;
  }

  /** Exact count; throws {@link ArithmeticException} beyond the long range. */
  public long longValue() {
    if (value instanceof Long l) return l;
    return new BigInteger(value.toString()).longValueExact();
  }
}

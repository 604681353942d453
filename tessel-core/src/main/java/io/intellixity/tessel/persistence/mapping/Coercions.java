package io.intellixity.tessel.persistence.mapping;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Lossless numeric coercion for values drivers return as text (bigint, numeric).
 * <p>
 * A conversion is accepted only when the parsed double is finite and its canonical string form equals the
 * original text exactly; anything else returns null and the caller keeps the raw value.
 */
public final class Coercions {
  /** 2^53 - 1. */
  public static final long MAX_SAFE_INTEGER = 9_007_199_254_740_991L;

  private Coercions() {}

  public static Double toFloat(Object raw) {
    String text = text(raw);
    if (text == null) return null;
    double d;
    try {
      d = Double.parseDouble(text);
    } catch (NumberFormatException e) {
      return null;
    }
    if (!Double.isFinite(d) || !canonical(d).equals(text)) return null;
    return d;
  }

  /** As {@link #toFloat}, then truncated toward zero; rejected unless the result is a safe integer. */
  public static Long toInteger(Object raw) {
    Double d = toFloat(raw);
    if (d == null) return null;
    double truncated = (d < 0) ? Math.ceil(d) : Math.floor(d);
    if (!isSafeInteger(truncated)) return null;
    return (long) truncated;
  }

  public static boolean isSafeInteger(double d) {
    return Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) <= MAX_SAFE_INTEGER;
  }

  /**
   * Shortest round-trip decimal form: plain notation for magnitudes in [1e-6, 1e21), exponent notation
   * ({@code 1e+21}, {@code 1.5e-7}) outside it.
   */
  static String canonical(double d) {
    if (d == 0) return "0";
    BigDecimal bd = BigDecimal.valueOf(d).stripTrailingZeros();
    double abs = Math.abs(d);
    if (abs >= 1e-6 && abs < 1e21) return bd.toPlainString();

    String digits = bd.unscaledValue().abs().toString();
    int exponent = digits.length() - 1 - bd.scale();
    StringBuilder sb = new StringBuilder();
    if (d < 0) sb.append('-');
    sb.append(digits.charAt(0));
    if (digits.length() > 1) sb.append('.').append(digits, 1, digits.length());
    sb.append('e').append(exponent >= 0 ? "+" : "-").append(Math.abs(exponent));
    return sb.toString();
  }

  private static String text(Object raw) {
    if (raw instanceof CharSequence cs) return cs.toString();
    if (raw instanceof BigDecimal bd) return bd.toPlainString();
    if (raw instanceof BigInteger bi) return bi.toString();
    return null;
  }
}

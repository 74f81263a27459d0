package ca.gc.cra.filedrop.validation;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Validation utilities for strings used by FILEDROP configuration and CLI layers.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI or config files.</li>
 *   <li>Normalize enumerated options such as {@code identitySource} and {@code metricsExporter}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Normalizes a value to lower case and checks it against a closed set of options.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param allowed permitted lower-case values
   * @return normalized value
   * @throws IllegalArgumentException if blank or not one of {@code allowed}
   */
  public static String requireOneOf(String name, String value, Set<String> allowed) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    if (!allowed.contains(normalized)) {
      throw new IllegalArgumentException(
          message(name, "must be one of " + allowed + " (was " + normalized + ")"));
    }
    return normalized;
  }

  /**
   * Checks that text fits a UTF-8 byte budget, matching the limits the wire protocol enforces.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text; must not be {@code null}
   * @param maxBytes maximum encoded length
   * @return the unchanged value
   * @throws IllegalArgumentException if the encoded value is longer than {@code maxBytes}
   */
  public static String requireMaxUtf8Bytes(String name, String value, int maxBytes) {
    Objects.requireNonNull(value, name == null ? "value" : name);
    int length = value.getBytes(StandardCharsets.UTF_8).length;
    if (length > maxBytes) {
      throw new IllegalArgumentException(
          message(name, "must be at most " + maxBytes + " UTF-8 bytes (was " + length + ")"));
    }
    return value;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}

package ca.gc.cra.filedrop.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Log hygiene for text that arrives from untrusted peers.
 * <p><strong>Why:</strong> Usernames, department names, and filenames come straight off the socket; passwords must
 * never reach a log line.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so truncating mid-codepoint never throws.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Makes peer-supplied text safe to log: control characters are escaped and the result is capped at
   * {@code maxBytes} UTF-8 bytes.
   *
   * @param value text to sanitize; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return printable, bounded text with a {@code "... (truncated, X of Y)"} suffix when shortened
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    String printable = escapeControls(value);
    byte[] bytes = printable.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return printable;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer kept = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return kept + "... (truncated, " + maxBytes + " of " + bytes.length + ")";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }

  /**
   * Returns the redaction placeholder used for passwords.
   *
   * @param value ignored value
   * @return {@code "[REDACTED]"}
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  private static String escapeControls(String value) {
    StringBuilder out = null;
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (Character.isISOControl(c)) {
        if (out == null) {
          out = new StringBuilder(value.length() + 8).append(value, 0, i);
        }
        out.append(String.format("\\u%04x", (int) c));
      } else if (out != null) {
        out.append(c);
      }
    }
    return out == null ? value : out.toString();
  }
}

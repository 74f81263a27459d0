package ca.gc.cra.filedrop.infrastructure.net;

import ca.gc.cra.filedrop.application.session.ProtocolException;
import ca.gc.cra.filedrop.domain.protocol.ProtocolLimits;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.protocol.StatusCode;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * <strong>What:</strong> Encodes and decodes FILEDROP frames on blocking streams.
 * <p><strong>Frames:</strong>
 * <ul>
 *   <li>Text field: 2-byte unsigned big-endian byte count, then that many UTF-8 bytes.</li>
 *   <li>Length field: 4-byte unsigned big-endian integer.</li>
 *   <li>Response: 1-byte status code, 2-byte unsigned length, UTF-8 message of at most
 *   {@value ProtocolLimits#MAX_MESSAGE_BYTES} bytes.</li>
 * </ul>
 * <p>Every read loops until the frame is complete, so delivery split into single bytes or coalesced with the
 * next frame decodes identically. Oversized prefixes are rejected before any buffer is allocated.</p>
 * <p><strong>Thread-safety:</strong> Stateless; callers own stream synchronization.</p>
 *
 * @since 0.1.0
 */
public final class WireCodec {
  private WireCodec() {}

  /**
   * Writes one length-prefixed text field.
   *
   * @param out destination stream
   * @param field field name used in diagnostics
   * @param value text to encode
   * @param maxBytes largest permitted encoded length
   * @throws ProtocolException if the encoded value exceeds {@code maxBytes}
   * @throws IOException on write failure
   */
  public static void writeField(OutputStream out, String field, String value, int maxBytes) throws IOException {
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length > maxBytes) {
      throw new ProtocolException(field + " exceeds " + maxBytes + " bytes (was " + bytes.length + ")");
    }
    writeUnsignedShort(out, bytes.length);
    out.write(bytes);
  }

  /**
   * Reads one length-prefixed text field.
   *
   * @param in source stream
   * @param field field name used in diagnostics
   * @param maxBytes largest permitted encoded length
   * @return decoded text
   * @throws ProtocolException if the prefix exceeds {@code maxBytes}, the bytes are not UTF-8, or the stream
   *     ends mid-field
   * @throws IOException on read failure
   */
  public static String readField(InputStream in, String field, int maxBytes) throws IOException {
    int length = readUnsignedShort(in, field);
    if (length > maxBytes) {
      throw new ProtocolException(field + " exceeds " + maxBytes + " bytes (declared " + length + ")");
    }
    byte[] bytes = new byte[length];
    readFully(in, bytes, field);
    return decodeUtf8(bytes, field);
  }

  /**
   * Writes a 4-byte unsigned big-endian integer.
   *
   * @param out destination stream
   * @param value value in {@code [0, 0xFFFFFFFF]}
   * @throws IOException on write failure
   */
  public static void writeUnsignedInt(OutputStream out, long value) throws IOException {
    if (value < 0 || value > 0xFFFF_FFFFL) {
      throw new IllegalArgumentException("value does not fit in 32 unsigned bits: " + value);
    }
    out.write((int) (value >>> 24) & 0xFF);
    out.write((int) (value >>> 16) & 0xFF);
    out.write((int) (value >>> 8) & 0xFF);
    out.write((int) value & 0xFF);
  }

  /**
   * Reads a 4-byte unsigned big-endian integer.
   *
   * @param in source stream
   * @param field field name used in diagnostics
   * @return value in {@code [0, 0xFFFFFFFF]}
   * @throws ProtocolException if the stream ends early
   * @throws IOException on read failure
   */
  public static long readUnsignedInt(InputStream in, String field) throws IOException {
    byte[] bytes = new byte[4];
    readFully(in, bytes, field);
    return ((bytes[0] & 0xFFL) << 24)
        | ((bytes[1] & 0xFFL) << 16)
        | ((bytes[2] & 0xFFL) << 8)
        | (bytes[3] & 0xFFL);
  }

  /**
   * Writes a response frame. Messages longer than the frame limit are cut at a character boundary.
   *
   * @param out destination stream
   * @param response frame to encode
   * @throws IOException on write failure
   */
  public static void writeResponse(OutputStream out, Response response) throws IOException {
    byte[] message = encodeBounded(response.message(), ProtocolLimits.MAX_MESSAGE_BYTES);
    out.write(response.status().wireValue());
    writeUnsignedShort(out, message.length);
    out.write(message);
  }

  /**
   * Reads a response frame.
   *
   * @param in source stream
   * @return decoded response, or empty when the peer closed before sending a status byte
   * @throws ProtocolException on unknown status codes, oversized messages, or truncation mid-frame
   * @throws IOException on read failure
   */
  public static Optional<Response> readResponse(InputStream in) throws IOException {
    int code = in.read();
    if (code < 0) {
      return Optional.empty();
    }
    StatusCode status;
    try {
      status = StatusCode.fromWire(code);
    } catch (IllegalArgumentException ex) {
      throw new ProtocolException("unknown status code " + code, ex);
    }
    String message = readField(in, "response message", ProtocolLimits.MAX_MESSAGE_BYTES);
    return Optional.of(new Response(status, message));
  }

  static void writeUnsignedShort(OutputStream out, int value) throws IOException {
    out.write((value >>> 8) & 0xFF);
    out.write(value & 0xFF);
  }

  static int readUnsignedShort(InputStream in, String field) throws IOException {
    byte[] bytes = new byte[2];
    readFully(in, bytes, field);
    return ((bytes[0] & 0xFF) << 8) | (bytes[1] & 0xFF);
  }

  static void readFully(InputStream in, byte[] buffer, String field) throws IOException {
    int offset = 0;
    while (offset < buffer.length) {
      int n = in.read(buffer, offset, buffer.length - offset);
      if (n < 0) {
        throw new ProtocolException(
            "connection closed while reading " + field + " (" + offset + " of " + buffer.length + " bytes)");
      }
      offset += n;
    }
  }

  private static String decodeUtf8(byte[] bytes, String field) throws ProtocolException {
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPORT)
        .onUnmappableCharacter(CodingErrorAction.REPORT);
    try {
      return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    } catch (CharacterCodingException ex) {
      throw new ProtocolException(field + " is not valid UTF-8", ex);
    }
  }

  private static byte[] encodeBounded(String text, int maxBytes) {
    byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return bytes;
    }
    int cut = maxBytes;
    // back up over UTF-8 continuation bytes
    while (cut > 0 && (bytes[cut] & 0xC0) == 0x80) {
      cut--;
    }
    byte[] bounded = new byte[cut];
    System.arraycopy(bytes, 0, bounded, 0, cut);
    return bounded;
  }
}

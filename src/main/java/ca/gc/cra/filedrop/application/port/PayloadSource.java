package ca.gc.cra.filedrop.application.port;

import java.io.IOException;

/**
 * Inbound payload bytes handed to a {@link TransferWriterPort}.
 *
 * <p>The writer calls {@link #onReady()} exactly once, after the destination has been opened and before the
 * first {@link #read(byte[], int, int)}. Sources backed by a connection use the hook to tell the peer it may
 * start streaming.</p>
 *
 * @since 0.1.0
 */
public interface PayloadSource {
  /**
   * Signals that the destination is open and bytes will now be consumed.
   *
   * @throws IOException if the signal cannot be delivered
   */
  default void onReady() throws IOException {}

  /**
   * Reads up to {@code length} bytes.
   *
   * @param buffer destination buffer
   * @param offset start offset in {@code buffer}
   * @param length maximum bytes to read
   * @return bytes read, or {@code -1} at end of stream
   * @throws IOException on read failure
   */
  int read(byte[] buffer, int offset, int length) throws IOException;
}

package ca.gc.cra.filedrop.application.session;

import ca.gc.cra.filedrop.application.port.PayloadSource;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import java.io.IOException;

/**
 * Server-side view of one connection, exposing protocol fields in the order they arrive.
 *
 * <p>Implementations own framing; {@link UploadSession} owns the state machine. Calls must follow protocol
 * order: username, password, transfer request, then the payload.</p>
 *
 * @since 0.1.0
 */
public interface SessionChannel {
  /**
   * Describes the remote peer for logging.
   *
   * @return printable peer address
   */
  String peer();

  /**
   * Reads the username field.
   *
   * @return username text, possibly empty
   * @throws ProtocolException on malformed, oversized, or truncated input
   * @throws IOException on transport failure
   */
  String readUsername() throws IOException;

  /**
   * Reads the password field. The value is accepted as-is and never verified.
   *
   * @return password text
   * @throws ProtocolException on malformed, oversized, or truncated input
   * @throws IOException on transport failure
   */
  String readPassword() throws IOException;

  /**
   * Reads department, filename, and declared length, in that order.
   *
   * @return transfer metadata
   * @throws ProtocolException on malformed, oversized, or truncated input
   * @throws IOException on transport failure
   */
  TransferRequest readTransferRequest() throws IOException;

  /**
   * Sends one status frame to the client.
   *
   * @param response status frame
   * @throws IOException on transport failure
   */
  void send(Response response) throws IOException;

  /**
   * Exposes the payload that follows the transfer request. {@link PayloadSource#onReady()} sends the READY frame.
   *
   * @param declaredLength payload length announced by the client
   * @return payload source bound to this connection
   */
  PayloadSource payload(long declaredLength);
}

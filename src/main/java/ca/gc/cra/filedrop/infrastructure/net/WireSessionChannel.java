package ca.gc.cra.filedrop.infrastructure.net;

import ca.gc.cra.filedrop.application.port.PayloadSource;
import ca.gc.cra.filedrop.application.session.SessionChannel;
import ca.gc.cra.filedrop.domain.protocol.ProtocolLimits;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link SessionChannel} over a pair of blocking streams using {@link WireCodec} framing.
 *
 * <p>Not thread-safe; one instance per connection.</p>
 *
 * @since 0.1.0
 */
public final class WireSessionChannel implements SessionChannel {
  private final InputStream in;
  private final OutputStream out;
  private final String peer;

  /**
   * Creates a channel over connection streams.
   *
   * @param in inbound bytes from the client
   * @param out outbound bytes to the client
   * @param peer printable peer address for logs
   */
  public WireSessionChannel(InputStream in, OutputStream out, String peer) {
    this.in = new BufferedInputStream(Objects.requireNonNull(in, "in"));
    this.out = new BufferedOutputStream(Objects.requireNonNull(out, "out"));
    this.peer = Objects.requireNonNull(peer, "peer");
  }

  @Override
  public String peer() {
    return peer;
  }

  @Override
  public String readUsername() throws IOException {
    return WireCodec.readField(in, "username", ProtocolLimits.MAX_USERNAME_BYTES);
  }

  @Override
  public String readPassword() throws IOException {
    return WireCodec.readField(in, "password", ProtocolLimits.MAX_PASSWORD_BYTES);
  }

  @Override
  public TransferRequest readTransferRequest() throws IOException {
    String department = WireCodec.readField(in, "department", ProtocolLimits.MAX_DEPARTMENT_BYTES);
    String filename = WireCodec.readField(in, "filename", ProtocolLimits.MAX_FILENAME_BYTES);
    long length = WireCodec.readUnsignedInt(in, "file length");
    return new TransferRequest(department, filename, length);
  }

  @Override
  public void send(Response response) throws IOException {
    WireCodec.writeResponse(out, response);
    out.flush();
  }

  @Override
  public PayloadSource payload(long declaredLength) {
    return new PayloadSource() {
      private long remaining = declaredLength;

      @Override
      public void onReady() throws IOException {
        send(Response.ready(declaredLength));
      }

      @Override
      public int read(byte[] buffer, int offset, int length) throws IOException {
        if (remaining <= 0) {
          return -1;
        }
        int n = in.read(buffer, offset, (int) Math.min(length, remaining));
        if (n > 0) {
          remaining -= n;
        }
        return n;
      }
    };
  }
}

package ca.gc.cra.filedrop.infrastructure.net;

import ca.gc.cra.filedrop.application.session.ProtocolException;
import ca.gc.cra.filedrop.domain.protocol.ProtocolLimits;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.protocol.StatusCode;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Client driver that uploads one local file to a FILEDROP server.
 * <p><strong>Sequence:</strong> connect, send credentials, await authentication, ask the {@link TransferPlanner}
 * what to send, send transfer metadata, await READY without a deadline, stream the file, await the final status.
 * No step is retried.</p>
 * <p><strong>Thread-safety:</strong> Immutable; each {@link #upload} call opens its own connection.</p>
 *
 * @since 0.1.0
 */
public final class UploadClient {
  private static final Logger log = LoggerFactory.getLogger(UploadClient.class);

  private final String host;
  private final int port;
  private final int connectTimeoutMillis;
  private final int readTimeoutMillis;
  private final int chunkBytes;

  /**
   * Creates a client.
   *
   * @param host server host
   * @param port server port
   * @param connectTimeoutMillis connect deadline; {@code 0} waits forever
   * @param readTimeoutMillis per-read deadline while awaiting responses other than READY; {@code 0} waits forever
   * @param chunkBytes payload bytes written per socket write
   */
  public UploadClient(String host, int port, int connectTimeoutMillis, int readTimeoutMillis, int chunkBytes) {
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
    this.connectTimeoutMillis = connectTimeoutMillis;
    this.readTimeoutMillis = readTimeoutMillis;
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be positive");
    }
    this.chunkBytes = chunkBytes;
  }

  /**
   * Uploads {@code file} under its own basename.
   *
   * @param username account name
   * @param password password; sent but not verified by the server
   * @param department department name sent verbatim
   * @param file local regular file
   * @param listener progress callbacks
   * @return terminal result
   * @throws IOException if the local file cannot be opened or sized
   * @throws IllegalArgumentException if the file is larger than the protocol allows
   */
  public UploadResult upload(
      String username, String password, String department, Path file, ProgressListener listener)
      throws IOException {
    Objects.requireNonNull(file, "file");
    Path fileName = file.getFileName();
    if (fileName == null) {
      throw new IllegalArgumentException("file has no name: " + file);
    }
    return upload(username, password, department, file, fileName.toString(), listener);
  }

  /**
   * Uploads {@code file} under {@code remoteName}.
   *
   * @param username account name
   * @param password password; sent but not verified by the server
   * @param department department name sent verbatim
   * @param file local regular file
   * @param remoteName name sent to the server; the server keeps only its final component
   * @param listener progress callbacks
   * @return terminal result
   * @throws IOException if the local file cannot be opened or sized
   * @throws IllegalArgumentException if the file is larger than the protocol allows
   */
  public UploadResult upload(
      String username,
      String password,
      String department,
      Path file,
      String remoteName,
      ProgressListener listener)
      throws IOException {
    TransferPlanner.Transfer transfer = new TransferPlanner.Transfer(department, file, remoteName);
    checkSize(Files.size(file));
    return upload(username, password, TransferPlanner.fixed(transfer), listener);
  }

  /**
   * Authenticates first, then asks {@code planner} what to send.
   *
   * <p>The planner is not consulted when the server rejects the credentials, so interactive callers can defer
   * file and department prompts until the account is known to be valid.</p>
   *
   * @param username account name
   * @param password password; sent but not verified by the server
   * @param planner supplies the transfer after a successful authentication
   * @param listener progress callbacks
   * @return terminal result; {@link UploadResult.Status#CANCELLED} when the planner returns empty
   * @throws IOException if the planned local file cannot be opened or sized
   * @throws IllegalArgumentException if the planned file is larger than the protocol allows
   */
  public UploadResult upload(
      String username, String password, TransferPlanner planner, ProgressListener listener)
      throws IOException {
    Objects.requireNonNull(planner, "planner");
    ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
    Socket socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(host, port), connectTimeoutMillis);
    } catch (IOException ex) {
      socket.close();
      log.debug("Connect to {}:{} failed", host, port, ex);
      return new UploadResult(UploadResult.Status.CONNECT_FAILURE,
          "Connection to " + host + ":" + port + " failed: " + ex.getMessage(), 0);
    }
    try (socket) {
      socket.setSoTimeout(readTimeoutMillis);
      log.debug("Connected to {}", socket.getRemoteSocketAddress());
      return converse(socket, username, password, planner, progress);
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
  }

  private UploadResult converse(
      Socket socket, String username, String password, TransferPlanner planner, ProgressListener progress) {
    long sent = 0;
    try {
      InputStream in = new BufferedInputStream(socket.getInputStream());
      OutputStream out = new BufferedOutputStream(socket.getOutputStream());

      WireCodec.writeField(out, "username", username, ProtocolLimits.MAX_USERNAME_BYTES);
      WireCodec.writeField(out, "password", password, ProtocolLimits.MAX_PASSWORD_BYTES);
      out.flush();
      Optional<Response> auth = await(in, progress);
      if (auth.isEmpty()) {
        return closedEarly(0);
      }
      if (auth.get().status() != StatusCode.OK) {
        return new UploadResult(UploadResult.Status.AUTH_FAILED, auth.get().message(), 0);
      }

      Optional<TransferPlanner.Transfer> planned = planner.afterAuthentication(auth.get());
      if (planned.isEmpty()) {
        return new UploadResult(UploadResult.Status.CANCELLED, "Upload cancelled before any request was sent", 0);
      }
      TransferPlanner.Transfer transfer = planned.get();
      long size = localSize(transfer.file());
      checkSize(size);

      try (InputStream source = openLocal(transfer.file())) {
        WireCodec.writeField(out, "department", transfer.department(), ProtocolLimits.MAX_DEPARTMENT_BYTES);
        WireCodec.writeField(out, "filename", transfer.remoteName(), ProtocolLimits.MAX_FILENAME_BYTES);
        WireCodec.writeUnsignedInt(out, size);
        out.flush();

        // READY arrives only once the server holds the write lock; another upload may hold it for minutes.
        socket.setSoTimeout(0);
        Optional<Response> ready = await(in, progress);
        socket.setSoTimeout(readTimeoutMillis);
        if (ready.isEmpty()) {
          return closedEarly(0);
        }
        if (ready.get().status() != StatusCode.READY) {
          return rejected(ready.get(), 0);
        }

        byte[] buffer = new byte[(int) Math.min(chunkBytes, Math.max(1L, size))];
        while (sent < size) {
          int n = source.read(buffer, 0, (int) Math.min(buffer.length, size - sent));
          if (n < 0) {
            return new UploadResult(UploadResult.Status.IO_FAILURE,
                "Local file shrank during upload after " + sent + " of " + size + " bytes", sent);
          }
          out.write(buffer, 0, n);
          sent += n;
          progress.onProgress(sent, size);
        }
        out.flush();
      }

      Optional<Response> done = await(in, progress);
      if (done.isEmpty()) {
        return closedEarly(sent);
      }
      if (done.get().status() != StatusCode.OK) {
        return rejected(done.get(), sent);
      }
      return new UploadResult(UploadResult.Status.SUCCESS, done.get().message(), sent);
    } catch (ProtocolException ex) {
      return new UploadResult(UploadResult.Status.PROTOCOL_FAILURE, ex.getMessage(), sent);
    } catch (IOException ex) {
      log.debug("Upload I/O failure after {} bytes", sent, ex);
      return new UploadResult(UploadResult.Status.IO_FAILURE, "I/O error: " + ex.getMessage(), sent);
    }
  }

  // Failures to open the planned file escape converse() unchecked so they are not reported as connection errors.
  private static long localSize(Path file) {
    try {
      return Files.size(file);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static InputStream openLocal(Path file) {
    try {
      return Files.newInputStream(file);
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }
  }

  private static void checkSize(long size) {
    if (size > TransferRequest.MAX_DECLARED_LENGTH) {
      throw new IllegalArgumentException(
          "file is too large: " + size + " bytes (max " + TransferRequest.MAX_DECLARED_LENGTH + ")");
    }
  }

  private static Optional<Response> await(InputStream in, ProgressListener progress) throws IOException {
    Optional<Response> response = WireCodec.readResponse(in);
    response.ifPresent(r -> {
      log.debug("Server responded {}: {}", r.status(), r.message());
      progress.onResponse(r);
    });
    return response;
  }

  private static UploadResult rejected(Response response, long sent) {
    UploadResult.Status status = switch (response.status()) {
      case AUTH_FAILED -> UploadResult.Status.AUTH_FAILED;
      case ACCESS_DENIED -> UploadResult.Status.ACCESS_DENIED;
      case PROTOCOL_ERROR -> UploadResult.Status.PROTOCOL_FAILURE;
      default -> UploadResult.Status.SERVER_ERROR;
    };
    return new UploadResult(status, response.message(), sent);
  }

  private static UploadResult closedEarly(long sent) {
    return new UploadResult(UploadResult.Status.PROTOCOL_FAILURE, "Server closed the connection", sent);
  }
}

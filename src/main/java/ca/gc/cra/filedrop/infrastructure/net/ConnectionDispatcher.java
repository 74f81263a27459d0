package ca.gc.cra.filedrop.infrastructure.net;

import ca.gc.cra.filedrop.application.session.UploadSession;
import ca.gc.cra.filedrop.domain.protocol.SessionOutcome;
import ca.gc.cra.filedrop.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Accepts TCP connections and runs one {@link UploadSession} per connection on its own
 * worker thread.
 * <p><strong>Role:</strong> Inbound network adapter; the accept loop never waits on workers.</p>
 * <p><strong>Thread-safety:</strong> {@link #serve()} runs on one thread; {@link #close()} may be called from
 * any thread and stops accepting. In-flight sessions run to completion.</p>
 * <p><strong>Observability:</strong> Logs connection open/close with the remote address under MDC key
 * {@code peer}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionDispatcher implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionDispatcher.class);
  private static final String MDC_PEER = "peer";

  private final ServerSocket serverSocket;
  private final UploadSession session;
  private final int readTimeoutMillis;
  private final ExecutorService workers;
  private volatile boolean closed;

  /**
   * Binds the listening socket.
   *
   * @param bindAddress local address; {@code null} binds all interfaces
   * @param port TCP port; {@code 0} picks an ephemeral port
   * @param backlog pending-connection queue length
   * @param readTimeoutMillis per-read deadline applied to accepted sockets; {@code 0} waits forever
   * @param session use case run for each connection
   * @throws IOException if the socket cannot be bound
   */
  public ConnectionDispatcher(
      InetAddress bindAddress, int port, int backlog, int readTimeoutMillis, UploadSession session)
      throws IOException {
    this.session = Objects.requireNonNull(session, "session");
    this.readTimeoutMillis = readTimeoutMillis;
    ServerSocket socket = new ServerSocket();
    try {
      socket.setReuseAddress(true);
      socket.bind(new InetSocketAddress(bindAddress, port), backlog);
    } catch (IOException ex) {
      socket.close();
      throw ex;
    }
    this.serverSocket = socket;
    this.workers = ExecutorFactories.newSessionExecutor("filedrop-session",
        (thread, ex) -> log.error("Session worker {} terminated unexpectedly", thread.getName(), ex));
  }

  /**
   * Returns the bound port, useful when constructed with port {@code 0}.
   *
   * @return local port
   */
  public int localPort() {
    return serverSocket.getLocalPort();
  }

  /**
   * Runs the accept loop until {@link #close()} is called.
   */
  public void serve() {
    log.info("FILEDROP server listening on {}", serverSocket.getLocalSocketAddress());
    while (!closed) {
      Socket client;
      try {
        client = serverSocket.accept();
      } catch (SocketException ex) {
        if (closed) {
          break;
        }
        log.error("Accept failed; continuing", ex);
        continue;
      } catch (IOException ex) {
        log.error("Accept failed; continuing", ex);
        continue;
      }
      try {
        workers.execute(() -> handle(client));
      } catch (RejectedExecutionException ex) {
        log.error("Could not start worker for {}; closing connection", client.getRemoteSocketAddress(), ex);
        closeQuietly(client);
      }
    }
    log.info("FILEDROP server stopped accepting connections");
  }

  private void handle(Socket client) {
    String peer = String.valueOf(client.getRemoteSocketAddress());
    String previousPeer = MDC.get(MDC_PEER);
    MDC.put(MDC_PEER, peer);
    try (client) {
      log.info("Connection opened from {}", peer);
      client.setSoTimeout(readTimeoutMillis);
      WireSessionChannel channel =
          new WireSessionChannel(client.getInputStream(), client.getOutputStream(), peer);
      SessionOutcome outcome = session.run(channel);
      log.info("Connection from {} closed ({})", peer, outcome);
    } catch (IOException | RuntimeException ex) {
      log.error("Session with {} failed", peer, ex);
    } finally {
      if (previousPeer == null) {
        MDC.remove(MDC_PEER);
      } else {
        MDC.put(MDC_PEER, previousPeer);
      }
    }
  }

  /**
   * Stops accepting connections. Sessions already running are left to finish.
   */
  @Override
  public void close() {
    closed = true;
    try {
      serverSocket.close();
    } catch (IOException ex) {
      log.debug("Error closing listening socket", ex);
    }
    workers.shutdown();
  }

  private static void closeQuietly(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Error closing rejected socket", ex);
    }
  }
}

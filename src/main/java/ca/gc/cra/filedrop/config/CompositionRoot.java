package ca.gc.cra.filedrop.config;

import ca.gc.cra.filedrop.application.identity.IdentityResolver;
import ca.gc.cra.filedrop.application.port.IdentityStorePort;
import ca.gc.cra.filedrop.application.port.MetricsPort;
import ca.gc.cra.filedrop.application.port.TransferWriterPort;
import ca.gc.cra.filedrop.application.session.UploadSession;
import ca.gc.cra.filedrop.infrastructure.identity.EtcFilesIdentityStoreAdapter;
import ca.gc.cra.filedrop.infrastructure.identity.YamlIdentityStoreAdapter;
import ca.gc.cra.filedrop.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.filedrop.infrastructure.net.ConnectionDispatcher;
import ca.gc.cra.filedrop.infrastructure.net.UploadClient;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentDirectories;
import ca.gc.cra.filedrop.infrastructure.persistence.DepartmentTransferWriter;
import java.io.IOException;
import java.net.InetAddress;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires the upload server from a {@link ServerConfig}.
 * <p><strong>Role:</strong> Composition root for the {@code server} command; the {@code upload} command uses
 * {@link #uploadClient(ClientConfig)}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup. The objects it builds are shared by
 * session workers and are themselves thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final ServerConfig config;
  private final MetricsPort metrics;

  /**
   * Creates a root that exports metrics as configured.
   *
   * @param config server configuration
   */
  public CompositionRoot(ServerConfig config) {
    this(config, null);
  }

  /**
   * Creates a root with an explicit metrics sink.
   *
   * @param config server configuration
   * @param metrics metrics sink; {@code null} builds the OpenTelemetry adapter from {@code config}
   */
  public CompositionRoot(ServerConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics != null ? metrics : new OpenTelemetryMetricsAdapter(config.metrics());
  }

  public ServerConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Builds the configured identity store.
   *
   * @return identity store adapter
   * @throws IOException if a YAML fixture cannot be read
   */
  public IdentityStorePort identityStore() throws IOException {
    return switch (config.identitySource()) {
      case ETC -> new EtcFilesIdentityStoreAdapter(config.passwdFile(), config.groupFile());
      case YAML -> YamlIdentityStoreAdapter.load(config.identityFile().orElseThrow());
    };
  }

  /**
   * Validates (and with {@code createRoots}, creates) the department directories.
   *
   * @return department directory mapping
   * @throws IllegalArgumentException if a directory is unusable
   */
  public DepartmentDirectories departmentDirectories() {
    return DepartmentDirectories.prepare(config.root(), config.createRoots());
  }

  /**
   * Builds the per-connection use case.
   *
   * @return upload session use case
   * @throws IOException if the identity store cannot be loaded
   */
  public UploadSession uploadSession() throws IOException {
    TransferWriterPort writer = new DepartmentTransferWriter(departmentDirectories(), config.chunkBytes());
    return new UploadSession(new IdentityResolver(identityStore()), writer, metrics);
  }

  /**
   * Builds and binds the connection dispatcher.
   *
   * @return bound dispatcher; call {@link ConnectionDispatcher#serve()} to accept connections
   * @throws IOException if the socket cannot be bound or the identity store cannot be loaded
   */
  public ConnectionDispatcher connectionDispatcher() throws IOException {
    UploadSession session = uploadSession();
    InetAddress bind = config.bindAddress().isPresent()
        ? InetAddress.getByName(config.bindAddress().get())
        : null;
    log.debug("Binding {}:{} (backlog={}, readTimeoutMillis={})",
        config.bindAddress().orElse("*"), config.port(), config.backlog(), config.readTimeoutMillis());
    return new ConnectionDispatcher(bind, config.port(), config.backlog(), config.readTimeoutMillis(), session);
  }

  /**
   * Builds an upload client.
   *
   * @param config client configuration
   * @return client bound to the configured server
   */
  public static UploadClient uploadClient(ClientConfig config) {
    return new UploadClient(
        config.server().host(),
        config.server().port(),
        config.connectTimeoutMillis(),
        config.readTimeoutMillis(),
        config.chunkBytes());
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }
}

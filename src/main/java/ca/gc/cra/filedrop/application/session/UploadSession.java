package ca.gc.cra.filedrop.application.session;

import ca.gc.cra.filedrop.application.identity.IdentityResolver;
import ca.gc.cra.filedrop.application.identity.Resolution;
import ca.gc.cra.filedrop.application.port.MetricsPort;
import ca.gc.cra.filedrop.application.port.TransferWriterPort;
import ca.gc.cra.filedrop.domain.identity.Identity;
import ca.gc.cra.filedrop.domain.protocol.Response;
import ca.gc.cra.filedrop.domain.protocol.SessionOutcome;
import ca.gc.cra.filedrop.domain.transfer.TransferReceipt;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import ca.gc.cra.filedrop.logging.Logs;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Drives one upload connection from credentials to the final status frame.
 * <p><strong>Why:</strong> Keeps the authenticate, authorize, store sequence independent of sockets and framing.</p>
 * <p><strong>Role:</strong> Application use case; one instance serves every connection.</p>
 * <p><strong>Thread-safety:</strong> Stateless per call; each session runs on its own worker thread and shares
 * only the injected writer, resolver, and metrics.</p>
 * <p><strong>Observability:</strong> Emits {@code session.*} and {@code transfer.*} metrics and sets MDC key
 * {@code user} once the username is known.</p>
 *
 * @since 0.1.0
 */
public final class UploadSession {
  private static final Logger log = LoggerFactory.getLogger(UploadSession.class);
  private static final String MDC_USER = "user";

  private final IdentityResolver resolver;
  private final TransferWriterPort writer;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param resolver identity resolver; must not be {@code null}
   * @param writer transfer writer; must not be {@code null}
   * @param metrics metrics sink; must not be {@code null}
   */
  public UploadSession(IdentityResolver resolver, TransferWriterPort writer, MetricsPort metrics) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the protocol over the supplied channel until a terminal state is reached.
   *
   * <p>The channel is not closed; the caller owns the connection.</p>
   *
   * @param channel connection-scoped channel
   * @return terminal outcome
   */
  public SessionOutcome run(SessionChannel channel) {
    Objects.requireNonNull(channel, "channel");
    metrics.increment("session.accepted");
    String previousUser = MDC.get(MDC_USER);
    try {
      return converse(channel);
    } finally {
      if (previousUser == null) {
        MDC.remove(MDC_USER);
      } else {
        MDC.put(MDC_USER, previousUser);
      }
    }
  }

  private SessionOutcome converse(SessionChannel channel) {
    String username;
    try {
      username = channel.readUsername();
      MDC.put(MDC_USER, Logs.truncate(username, 32));
      String password = channel.readPassword();
      log.debug("Credentials received from {} (user='{}', password={})",
          channel.peer(), Logs.truncate(username, 32), Logs.redact(password));
    } catch (IOException ex) {
      return protocolFailure(channel, "credentials", ex);
    }

    Identity identity;
    try {
      Resolution resolution = resolver.resolve(username);
      switch (resolution.status()) {
        case NOT_FOUND -> {
          return authFailure(channel, username, Response.userNotFound());
        }
        case NOT_AUTHORIZED -> {
          return authFailure(channel, username, Response.userNotInGroups());
        }
        default -> identity = resolution.identity().orElseThrow();
      }
    } catch (IOException ex) {
      log.warn("Identity lookup failed for '{}' from {}: {}",
          Logs.truncate(username, 32), channel.peer(), ex.getMessage());
      return authFailure(channel, username, Response.identityUnavailable());
    }

    metrics.increment("session.auth.success");
    String department = identity.department().displayName();
    log.info("User '{}' authenticated from {} (department={})", identity.username(), channel.peer(), department);
    if (!trySend(channel, Response.authenticated(department))) {
      return SessionOutcome.PROTOCOL_FAILURE;
    }

    TransferRequest request;
    try {
      request = channel.readTransferRequest();
    } catch (IOException ex) {
      return protocolFailure(channel, "transfer request", ex);
    }

    if (!identity.mayWriteTo(request.declaredDepartment())) {
      metrics.increment("session.access.denied");
      log.warn("User '{}' ({}) denied write to department '{}'",
          identity.username(), department, Logs.truncate(request.declaredDepartment(), 32));
      trySend(channel, Response.accessDenied(request.declaredDepartment()));
      return SessionOutcome.FORBIDDEN;
    }

    try {
      request.storedName();
    } catch (IllegalArgumentException ex) {
      metrics.increment("session.protocol.failure");
      log.warn("Rejected filename '{}' from '{}': {}",
          Logs.truncate(request.requestedFilename(), 64), identity.username(), ex.getMessage());
      trySend(channel, Response.invalidFilename());
      return SessionOutcome.PROTOCOL_FAILURE;
    }

    return store(channel, identity, request);
  }

  private SessionOutcome store(SessionChannel channel, Identity identity, TransferRequest request) {
    long started = System.nanoTime();
    TransferReceipt receipt;
    try {
      receipt = writer.write(identity, request, channel.payload(request.declaredLength()));
    } catch (DestinationUnavailableException ex) {
      metrics.increment("transfer.io.failure");
      log.warn("Cannot create '{}' for '{}': {}", request.storedName(), identity.username(), ex.getMessage());
      trySend(channel, Response.cannotCreate(ex.getMessage()));
      return SessionOutcome.IO_FAILURE;
    } catch (IncompleteTransferException ex) {
      metrics.increment("transfer.incomplete");
      log.warn("Incomplete upload of '{}' from '{}': received {} of {} bytes",
          request.storedName(), identity.username(), ex.bytesReceived(), ex.declaredLength());
      return SessionOutcome.INCOMPLETE;
    } catch (IOException ex) {
      metrics.increment("transfer.io.failure");
      log.warn("Write of '{}' for '{}' failed: {}", request.storedName(), identity.username(), ex.getMessage());
      trySend(channel, Response.writeFailed(String.valueOf(ex.getMessage())));
      return SessionOutcome.IO_FAILURE;
    }

    metrics.increment("transfer.completed");
    metrics.observe("transfer.bytes", receipt.bytesWritten());
    metrics.observe("transfer.latencyNanos", System.nanoTime() - started);
    log.info("Stored '{}' ({} bytes) in {} for '{}'",
        receipt.storedName(), receipt.bytesWritten(), receipt.department(), identity.username());
    if (!trySend(channel, Response.transferred(receipt.storedName(), receipt.department().displayName()))) {
      log.warn("File '{}' stored but the final response could not be delivered to {}",
          receipt.storedName(), channel.peer());
    }
    return SessionOutcome.SUCCESS;
  }

  private SessionOutcome authFailure(SessionChannel channel, String username, Response response) {
    metrics.increment("session.auth.failure");
    log.info("Authentication failed for '{}' from {}: {}",
        Logs.truncate(username, 32), channel.peer(), response.message());
    trySend(channel, response);
    return SessionOutcome.UNAUTHENTICATED;
  }

  private SessionOutcome protocolFailure(SessionChannel channel, String stage, IOException ex) {
    metrics.increment("session.protocol.failure");
    log.debug("Protocol failure reading {} from {}: {}", stage, channel.peer(), ex.getMessage());
    if (ex instanceof ProtocolException) {
      trySend(channel, Response.malformed(ex.getMessage()));
    }
    return SessionOutcome.PROTOCOL_FAILURE;
  }

  private boolean trySend(SessionChannel channel, Response response) {
    try {
      channel.send(response);
      return true;
    } catch (IOException ex) {
      log.debug("Could not send {} to {}: {}", response.status(), channel.peer(), ex.getMessage());
      return false;
    }
  }
}

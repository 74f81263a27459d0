package ca.gc.cra.filedrop.infrastructure.persistence;

import ca.gc.cra.filedrop.application.port.PayloadSource;
import ca.gc.cra.filedrop.application.port.TransferWriterPort;
import ca.gc.cra.filedrop.application.session.DestinationUnavailableException;
import ca.gc.cra.filedrop.application.session.IncompleteTransferException;
import ca.gc.cra.filedrop.domain.identity.Identity;
import ca.gc.cra.filedrop.domain.transfer.TransferReceipt;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import ca.gc.cra.filedrop.validation.Numbers;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stores uploads as {@code <department-root>/<basename>} with a sibling
 * {@code <basename>.owner} attribution file.
 * <p><strong>Role:</strong> Adapter implementing {@link TransferWriterPort}.</p>
 * <p><strong>Thread-safety:</strong> A single process-wide lock serializes create/truncate, copy, close, owner
 * change, and attribution, so concurrent uploads never interleave bytes in one file. The last writer to the
 * same name wins.</p>
 * <p><strong>Failure semantics:</strong> Owner change and attribution are advisory; failures are logged and
 * reported in the {@link TransferReceipt}. A short payload keeps the partial data file and skips both.</p>
 *
 * @since 0.1.0
 */
public final class DepartmentTransferWriter implements TransferWriterPort {
  private static final Logger log = LoggerFactory.getLogger(DepartmentTransferWriter.class);

  /** Default copy chunk size in bytes. */
  public static final int DEFAULT_CHUNK_BYTES = 8_192;
  static final String ATTRIBUTION_SUFFIX = ".owner";

  private final DepartmentDirectories directories;
  private final int chunkBytes;
  private final ReentrantLock writeLock = new ReentrantLock();

  /**
   * Creates a writer.
   *
   * @param directories department directory mapping
   * @param chunkBytes maximum bytes copied per read, in {@code [1, 1048576]}
   */
  public DepartmentTransferWriter(DepartmentDirectories directories, int chunkBytes) {
    this.directories = Objects.requireNonNull(directories, "directories");
    this.chunkBytes = (int) Numbers.requireRange("chunkBytes", chunkBytes, 1, 1_048_576);
  }

  @Override
  public TransferReceipt write(Identity uploader, TransferRequest request, PayloadSource source)
      throws IOException {
    Objects.requireNonNull(uploader, "uploader");
    Objects.requireNonNull(source, "source");
    String name = request.storedName();
    Path dir = directories.resolve(uploader.department());
    Path destination = dir.resolve(name).normalize();
    if (!dir.equals(destination.getParent())) {
      throw new IllegalArgumentException("destination escapes department root: " + destination);
    }

    writeLock.lock();
    try {
      OutputStream out = open(destination);
      long written;
      try (out) {
        try {
          source.onReady();
        } catch (IOException ex) {
          // The destination is already truncated; the peer is gone before any payload arrived.
          throw new IncompleteTransferException(0, request.declaredLength(), ex);
        }
        written = copy(source, out, request.declaredLength());
      }
      log.debug("Wrote {} bytes to {}", written, destination);
      boolean ownerApplied = applyOwner(destination, uploader);
      boolean attributed = writeAttribution(dir.resolve(name + ATTRIBUTION_SUFFIX), uploader);
      return new TransferReceipt(uploader.department(), name, destination, written, ownerApplied, attributed);
    } finally {
      writeLock.unlock();
    }
  }

  private static OutputStream open(Path destination) throws DestinationUnavailableException {
    try {
      return Files.newOutputStream(
          destination,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE);
    } catch (IOException ex) {
      throw new DestinationUnavailableException(describe(ex), ex);
    }
  }

  private long copy(PayloadSource source, OutputStream out, long declared) throws IOException {
    byte[] buffer = new byte[(int) Math.min(chunkBytes, Math.max(1L, declared))];
    long written = 0;
    while (written < declared) {
      int want = (int) Math.min(buffer.length, declared - written);
      int n;
      try {
        n = source.read(buffer, 0, want);
      } catch (IOException ex) {
        throw new IncompleteTransferException(written, declared, ex);
      }
      if (n < 0) {
        throw new IncompleteTransferException(written, declared, null);
      }
      out.write(buffer, 0, n);
      written += n;
    }
    return written;
  }

  private static boolean applyOwner(Path destination, Identity uploader) {
    try {
      Files.setAttribute(destination, "unix:uid", (int) uploader.uid());
      return true;
    } catch (IOException | UnsupportedOperationException | IllegalArgumentException ex) {
      log.warn("Could not set owner of {} to uid {}: {}", destination, uploader.uid(), ex.getMessage());
      return false;
    }
  }

  private static boolean writeAttribution(Path ownerFile, Identity uploader) {
    try {
      Files.write(ownerFile, uploader.username().getBytes(StandardCharsets.UTF_8));
      return true;
    } catch (IOException ex) {
      log.warn("Could not write attribution {}: {}", ownerFile, ex.getMessage());
      return false;
    }
  }

  static String describe(IOException ex) {
    if (ex instanceof AccessDeniedException) {
      return "Permission denied";
    }
    if (ex instanceof NoSuchFileException) {
      return "No such file or directory";
    }
    if (ex instanceof FileSystemException fs && fs.getReason() != null) {
      return fs.getReason();
    }
    return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
  }
}

package ca.gc.cra.filedrop.application.port;

import ca.gc.cra.filedrop.domain.identity.Identity;
import ca.gc.cra.filedrop.domain.transfer.TransferReceipt;
import ca.gc.cra.filedrop.domain.transfer.TransferRequest;
import java.io.IOException;

/**
 * <strong>What:</strong> Output port that stores an inbound payload in the uploader's department root.
 * <p><strong>Role:</strong> Sink side of the upload session.</p>
 * <p><strong>Thread-safety:</strong> Implementations serialize writes across all sessions; the critical section
 * covers create, copy, owner change, and attribution.</p>
 *
 * @since 0.1.0
 */
public interface TransferWriterPort {
  /**
   * Writes exactly {@link TransferRequest#declaredLength()} bytes from {@code source} and records the uploader.
   *
   * @param uploader authenticated identity; its department selects the root
   * @param request transfer metadata; the basename of the filename names the destination
   * @param source payload bytes
   * @return receipt describing the stored file
   * @throws ca.gc.cra.filedrop.application.session.DestinationUnavailableException if the destination cannot
   *     be opened; no bytes have been consumed
   * @throws ca.gc.cra.filedrop.application.session.IncompleteTransferException if the source ends early; the
   *     partial file is kept and no attribution is written
   * @throws IOException on any other write failure
   */
  TransferReceipt write(Identity uploader, TransferRequest request, PayloadSource source) throws IOException;
}

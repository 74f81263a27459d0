package ca.gc.cra.filedrop.infrastructure.net;

import ca.gc.cra.filedrop.domain.protocol.Response;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses what to upload once the server has accepted the credentials.
 *
 * <p>Called at most once per upload, on the uploading thread, while the connection stays open. Interactive
 * callers prompt for the file and department here so a rejected account is never asked for either.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TransferPlanner {

  /**
   * Returns the transfer to perform.
   *
   * @param authenticated the server's successful authentication response
   * @return transfer details, or empty to close the connection without sending a request
   * @throws IllegalArgumentException if the chosen local file or department is unusable
   */
  Optional<Transfer> afterAuthentication(Response authenticated);

  /**
   * Planner that always sends the same transfer.
   *
   * @param transfer fixed transfer
   * @return planner
   */
  static TransferPlanner fixed(Transfer transfer) {
    Objects.requireNonNull(transfer, "transfer");
    return authenticated -> Optional.of(transfer);
  }

  /**
   * One file destined for one department.
   *
   * @param department department name sent verbatim
   * @param file local regular file
   * @param remoteName name sent to the server; the server keeps only its final component
   */
  record Transfer(String department, Path file, String remoteName) {
    public Transfer {
      Objects.requireNonNull(department, "department");
      Objects.requireNonNull(file, "file");
      Objects.requireNonNull(remoteName, "remoteName");
    }

    /**
     * Transfer stored under the local file's own basename.
     *
     * @param department department name sent verbatim
     * @param file local regular file
     * @return transfer
     * @throws IllegalArgumentException if {@code file} has no name component
     */
    public static Transfer of(String department, Path file) {
      Path fileName = Objects.requireNonNull(file, "file").getFileName();
      if (fileName == null) {
        throw new IllegalArgumentException("file has no name: " + file);
      }
      return new Transfer(department, file, fileName.toString());
    }
  }
}

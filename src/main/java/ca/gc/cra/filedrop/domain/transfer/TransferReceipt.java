package ca.gc.cra.filedrop.domain.transfer;

import ca.gc.cra.filedrop.domain.identity.Department;
import java.nio.file.Path;

/**
 * Outcome of a completed write into a department root.
 *
 * @param department department that received the file
 * @param storedName basename of the stored file
 * @param destination absolute path of the stored file
 * @param bytesWritten payload bytes written; equals the declared length on success
 * @param ownerApplied whether the file owner was changed to the uploader's uid
 * @param attributionWritten whether the {@code .owner} record was written
 * @since 0.1.0
 */
public record TransferReceipt(
    Department department,
    String storedName,
    Path destination,
    long bytesWritten,
    boolean ownerApplied,
    boolean attributionWritten) {}

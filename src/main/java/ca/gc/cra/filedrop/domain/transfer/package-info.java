/**
 * Transfer model: what a client asks to store and what the writer reports back.
 * <p><strong>Security:</strong> {@link ca.gc.cra.filedrop.domain.transfer.TransferRequest#storedName()} is the
 * only sanctioned way to turn a client filename into a path component.</p>
 */
package ca.gc.cra.filedrop.domain.transfer;

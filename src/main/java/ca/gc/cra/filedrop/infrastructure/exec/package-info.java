/**
 * Executor factories for connection workers.
 * <p><strong>Concurrency:</strong> One worker thread per accepted connection; names carry no peer data.</p>
 */
package ca.gc.cra.filedrop.infrastructure.exec;

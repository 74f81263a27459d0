/**
 * TCP adapters: wire framing, the accept loop, and the upload client.
 * <p><strong>Concurrency:</strong> Server sessions run thread-per-connection; the client is single-threaded.</p>
 */
package ca.gc.cra.filedrop.infrastructure.net;

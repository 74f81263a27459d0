/**
 * <strong>Purpose:</strong> Ports defining the authenticate -> authorize -> store workflow contracts.
 * <p><strong>Role:</strong> Application layer; adapters under {@code infrastructure} implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Security:</strong> Port boundaries assume inputs already bounded by the wire codec.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.filedrop.application.port;

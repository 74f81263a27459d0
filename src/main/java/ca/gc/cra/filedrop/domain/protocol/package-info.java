/**
 * Shared client/server protocol vocabulary: status codes, response frames, field limits, and session outcomes.
 * <p>Frames are encoded by {@code ca.gc.cra.filedrop.infrastructure.net.WireCodec}.</p>
 */
package ca.gc.cra.filedrop.domain.protocol;

/**
 * Core domain model for FILEDROP department uploads.
 * <p><strong>Role:</strong> Domain layer types free of socket, filesystem, and logging dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across session workers.</p>
 */
package ca.gc.cra.filedrop.domain;

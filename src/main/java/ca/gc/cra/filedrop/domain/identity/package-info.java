/**
 * Identity model: departments, host accounts and groups, and the per-session authenticated identity.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across session workers.</p>
 * <p><strong>Security:</strong> Identities are established by account existence and group membership only;
 * passwords never reach this package.</p>
 */
package ca.gc.cra.filedrop.domain.identity;

/**
 * Authentication by host-account existence plus department group membership.
 * <p><strong>Security:</strong> Passwords are not consulted here; any caller who knows a valid username in one of
 * the department groups authenticates.</p>
 */
package ca.gc.cra.filedrop.application.identity;

/**
 * Per-connection upload state machine and the I/O exceptions it distinguishes.
 */
package ca.gc.cra.filedrop.application.session;

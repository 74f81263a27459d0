/**
 * Logging helpers: runtime verbosity control and redaction of peer-supplied text.
 */
package ca.gc.cra.filedrop.logging;

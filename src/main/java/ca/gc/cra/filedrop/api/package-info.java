/**
 * Command-line entry points: the {@code filedrop} dispatcher with its {@code server} and {@code upload}
 * commands, argument parsing, console output, and exit codes.
 */
package ca.gc.cra.filedrop.api;

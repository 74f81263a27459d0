/**
 * Filesystem adapters: department directory layout and the serialized transfer writer.
 */
package ca.gc.cra.filedrop.infrastructure.persistence;

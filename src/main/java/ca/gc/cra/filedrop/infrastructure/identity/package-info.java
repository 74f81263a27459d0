/**
 * Identity store adapters: host {@code passwd}/{@code group} files and YAML fixtures.
 */
package ca.gc.cra.filedrop.infrastructure.identity;

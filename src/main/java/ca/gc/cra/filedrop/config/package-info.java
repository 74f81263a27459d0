/**
 * <strong>Purpose:</strong> Configuration records, YAML loading, precedence merging, and the composition root.
 * <p><strong>Precedence:</strong> CLI arguments override YAML values, which override embedded defaults.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.filedrop.config;

/**
 * <strong>Purpose:</strong> Configuration loading, merging and dependency wiring for the level-3 pipeline.
 * <p><strong>Precedence:</strong> CLI {@code key=value} arguments, then the YAML file named by
 * {@code config=PATH}, then embedded defaults.</p>
 * <p><strong>Errors:</strong> Invalid values raise {@link IllegalArgumentException} naming the offending
 * key.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.config;

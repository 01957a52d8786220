/**
 * Command-line entry points for the AMI3 level-3 pipeline.
 *
 * <p>{@link ca.nrc.ami3.api.Main} dispatches to {@code run} and {@code inspect}. Commands take
 * {@code key=value} arguments merged with an optional YAML file and mode defaults, report progress through
 * SLF4J and return an {@link ca.nrc.ami3.api.ExitCode}.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.api;

/**
 * Run trace sinks: SLF4J-backed for the CLI, in-memory for tests and tooling.
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.trace;

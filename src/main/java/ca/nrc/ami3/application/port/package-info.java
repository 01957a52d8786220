/**
 * <strong>Purpose:</strong> Ports defining the load -> analyze -> aggregate -> normalize -> persist contracts.
 * <p><strong>Pipeline role:</strong> Application boundary; adapters under {@code ca.nrc.ami3.infrastructure}
 * implement these interfaces and tests substitute stubs.</p>
 * <p><strong>Errors:</strong> Ports raise checked subclasses of
 * {@link ca.nrc.ami3.application.port.PipelineException}.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.application.port;

/**
 * <strong>Purpose:</strong> Runtime logging controls for the CLI.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; run events themselves flow through
 * {@link ca.nrc.ami3.application.port.RunTrace}.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.logging;

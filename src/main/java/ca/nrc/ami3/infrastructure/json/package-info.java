/**
 * jackson-core streaming helpers shared by the association source, product reader and fringe stages.
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.json;

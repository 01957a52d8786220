/**
 * Persistence adapters writing and reading fringe products as JSON files.
 * <p><strong>Role:</strong> Sink-side implementation of {@link ca.nrc.ami3.application.port.ProductPersister}
 * plus the reader the averaging stage and metadata blender use to load persisted artifacts.</p>
 * <p><strong>Concurrency:</strong> Writes are atomic per artifact; distinct artifacts may be written
 * concurrently.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.persistence;

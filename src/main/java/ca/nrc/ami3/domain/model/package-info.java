/**
 * <strong>Purpose:</strong> Product model shared by every stage: observables, metadata, artifact handles.
 * <p><strong>Pipeline role:</strong> Domain layer; adapters serialize these types, the controller routes them.</p>
 * <p><strong>Concurrency:</strong> {@link ca.nrc.ami3.domain.model.DataProduct} and
 * {@link ca.nrc.ami3.domain.model.ProductMeta} are mutable and thread-confined; the remaining types are
 * immutable.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.domain.model;

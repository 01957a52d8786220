/**
 * <strong>Purpose:</strong> Association model: associations, their products and role-tagged members.
 * <p><strong>Pipeline role:</strong> Domain layer input to the level-3 controller.</p>
 * <p><strong>Concurrency:</strong> All types are immutable records or enums.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.domain.asn;

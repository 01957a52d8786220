/**
 * Association table adapters.
 * <p><strong>Role:</strong> Implement {@link ca.nrc.ami3.application.port.AssociationSource} for JSON
 * association files and single-exposure inputs.</p>
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.asn;

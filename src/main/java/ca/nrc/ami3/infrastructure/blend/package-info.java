/**
 * Metadata blending for averaged and normalized products.
 *
 * @since 0.1.0
 */
package ca.nrc.ami3.infrastructure.blend;

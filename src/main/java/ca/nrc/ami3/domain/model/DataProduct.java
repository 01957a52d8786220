package ca.nrc.ami3.domain.model;

import java.util.Objects;

/**
 * <strong>What:</strong> Result produced by a pipeline stage: fringe observables plus metadata.
 * <p><strong>Why:</strong> Single model for per-exposure fits, averages and normalized products so every stage
 * and port speaks one type.</p>
 * <p><strong>Role:</strong> Domain entity passed between stages, the metadata blender and the persister.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose mutable {@link ProductMeta} for provenance stamping and blending.</li>
 *   <li>Release its payload on {@link #close()}; later payload access fails fast.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the stage call that owns it.</p>
 *
 * @since 0.1.0
 */
public final class DataProduct implements AutoCloseable {
  private final ProductKind kind;
  private final ProductMeta meta;
  private FringeObservables observables;

  /**
   * Creates a product.
   *
   * @param kind product kind; must not be {@code null}
   * @param meta metadata block; must not be {@code null}
   * @param observables payload; must not be {@code null}
   */
  public DataProduct(ProductKind kind, ProductMeta meta, FringeObservables observables) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.meta = Objects.requireNonNull(meta, "meta");
    this.observables = Objects.requireNonNull(observables, "observables");
  }

  public ProductKind kind() {
    return kind;
  }

  public ProductMeta meta() {
    return meta;
  }

  /**
   * Returns the payload.
   *
   * @return fringe observables
   * @throws IllegalStateException if the product has been closed
   */
  public FringeObservables observables() {
    FringeObservables current = observables;
    if (current == null) {
      throw new IllegalStateException("Product " + identity() + " has been closed");
    }
    return current;
  }

  /**
   * Identity used when this in-memory product feeds metadata blending.
   *
   * @return persisted file name when saved, otherwise {@code <kind>[asnId]}
   */
  public String identity() {
    return meta.fileName().orElseGet(() -> {
      String asnId = meta.asn().asnId();
      return asnId.isEmpty() ? kind.wireName() : kind.wireName() + "[" + asnId + "]";
    });
  }

  public boolean closed() {
    return observables == null;
  }

  /**
   * Releases the payload. Idempotent.
   */
  @Override
  public void close() {
    observables = null;
  }
}

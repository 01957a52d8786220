package ca.nrc.ami3.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Mutable metadata block of a {@link DataProduct}.
 * <p><strong>Why:</strong> The pipeline stamps association provenance and the blender records contributing
 * inputs in place before a product is persisted.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a product is owned by one stage call at a time.</p>
 *
 * @since 0.1.0
 */
public final class ProductMeta {
  private AsnProvenance asn = AsnProvenance.NONE;
  private final Map<String, String> attributes = new LinkedHashMap<>();
  private final List<String> provenanceInputs = new ArrayList<>();
  private String fileName;

  /**
   * Creates empty metadata.
   */
  public ProductMeta() {}

  /**
   * Creates metadata seeded with attributes, preserving their order.
   *
   * @param attributes initial attributes; must not be {@code null}
   */
  public ProductMeta(Map<String, String> attributes) {
    Objects.requireNonNull(attributes, "attributes").forEach(this::putAttribute);
  }

  public AsnProvenance asn() {
    return asn;
  }

  /**
   * Replaces the association provenance.
   *
   * @param asn provenance to record; must not be {@code null}
   */
  public void asn(AsnProvenance asn) {
    this.asn = Objects.requireNonNull(asn, "asn");
  }

  /**
   * Returns a read-only view of the attributes in insertion order.
   *
   * @return attribute view
   */
  public Map<String, String> attributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public Optional<String> attribute(String key) {
    return Optional.ofNullable(attributes.get(key));
  }

  /**
   * Sets an attribute; a {@code null} value removes the key.
   *
   * @param key attribute name; must not be {@code null}
   * @param value attribute value
   */
  public void putAttribute(String key, String value) {
    Objects.requireNonNull(key, "key");
    if (value == null) {
      attributes.remove(key);
    } else {
      attributes.put(key, value);
    }
  }

  /**
   * Returns the identities of the inputs recorded by metadata blending, in blend order.
   *
   * @return read-only list of input identities
   */
  public List<String> provenanceInputs() {
    return Collections.unmodifiableList(provenanceInputs);
  }

  /**
   * Appends an input identity.
   *
   * @param identity identity of a contributing input; must not be {@code null}
   */
  public void addProvenanceInput(String identity) {
    provenanceInputs.add(Objects.requireNonNull(identity, "identity"));
  }

  public Optional<String> fileName() {
    return Optional.ofNullable(fileName);
  }

  public void fileName(String fileName) {
    this.fileName = fileName;
  }
}

package ca.nrc.ami3.infrastructure.persistence;

/**
 * Field names of the persisted product document.
 *
 * <pre>{@code
 * {"kind": "fringe-average",
 *  "asn": {"asn_id": "...", "pool_name": "...", "table_name": "..."},
 *  "attributes": {"key": "value"},
 *  "provenance": ["a_ami.json", "b_ami.json"],
 *  "observables": {"holes": 7, "amplitudes": [...], "phases": [...], "closure_phases": [...],
 *                  "amplitude_errors": [...], "phase_errors": [...], "closure_phase_errors": [...]}}
 * }</pre>
 */
final class ProductJson {
  static final String KIND = "kind";
  static final String ASN = "asn";
  static final String ASN_ID = "asn_id";
  static final String POOL_NAME = "pool_name";
  static final String TABLE_NAME = "table_name";
  static final String ATTRIBUTES = "attributes";
  static final String PROVENANCE = "provenance";
  static final String OBSERVABLES = "observables";
  static final String HOLES = "holes";
  static final String AMPLITUDES = "amplitudes";
  static final String PHASES = "phases";
  static final String CLOSURE_PHASES = "closure_phases";
  static final String AMPLITUDE_ERRORS = "amplitude_errors";
  static final String PHASE_ERRORS = "phase_errors";
  static final String CLOSURE_PHASE_ERRORS = "closure_phase_errors";

  private ProductJson() {}
}

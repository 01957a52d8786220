package ca.nrc.ami3.domain.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Interferometric observables measured for one mask configuration.
 * <p><strong>Why:</strong> Common payload of per-exposure fits, role averages and normalized products.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold one fringe amplitude and phase per baseline and one closure phase per hole triangle.</li>
 *   <li>Optionally hold matching standard-error arrays (empty when not estimated).</li>
 *   <li>Enforce that every array matches the shape implied by the hole count.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on the way in and out.</p>
 *
 * @implNote Phases are expressed in degrees.
 * @since 0.1.0
 */
public final class FringeObservables {
  private static final double[] NONE = new double[0];

  private final int holes;
  private final double[] amplitudes;
  private final double[] phases;
  private final double[] closurePhases;
  private final double[] amplitudeErrors;
  private final double[] phaseErrors;
  private final double[] closurePhaseErrors;

  /**
   * Creates observables without error estimates.
   *
   * @param holes number of mask holes; at least 3
   * @param amplitudes fringe amplitudes, one per baseline
   * @param phases fringe phases in degrees, one per baseline
   * @param closurePhases closure phases in degrees, one per hole triangle
   * @throws IllegalArgumentException if an array does not match the baseline or triangle count
   */
  public FringeObservables(int holes, double[] amplitudes, double[] phases, double[] closurePhases) {
    this(holes, amplitudes, phases, closurePhases, NONE, NONE, NONE);
  }

  /**
   * Creates observables with error estimates.
   *
   * @param holes number of mask holes; at least 3
   * @param amplitudes fringe amplitudes, one per baseline
   * @param phases fringe phases in degrees, one per baseline
   * @param closurePhases closure phases in degrees, one per hole triangle
   * @param amplitudeErrors amplitude standard errors; empty or one per baseline
   * @param phaseErrors phase standard errors; empty or one per baseline
   * @param closurePhaseErrors closure phase standard errors; empty or one per triangle
   * @throws IllegalArgumentException if an array does not match the baseline or triangle count
   */
  public FringeObservables(
      int holes,
      double[] amplitudes,
      double[] phases,
      double[] closurePhases,
      double[] amplitudeErrors,
      double[] phaseErrors,
      double[] closurePhaseErrors) {
    if (holes < 3) {
      throw new IllegalArgumentException("holes must be at least 3 (was " + holes + ")");
    }
    this.holes = holes;
    int baselines = baselineCount(holes);
    int triangles = triangleCount(holes);
    this.amplitudes = requireLength("amplitudes", amplitudes, baselines, false);
    this.phases = requireLength("phases", phases, baselines, false);
    this.closurePhases = requireLength("closurePhases", closurePhases, triangles, false);
    this.amplitudeErrors = requireLength("amplitudeErrors", amplitudeErrors, baselines, true);
    this.phaseErrors = requireLength("phaseErrors", phaseErrors, baselines, true);
    this.closurePhaseErrors = requireLength("closurePhaseErrors", closurePhaseErrors, triangles, true);
  }

  /**
   * Number of baselines formed by {@code holes} holes.
   *
   * @param holes hole count
   * @return {@code holes * (holes - 1) / 2}
   */
  public static int baselineCount(int holes) {
    return holes * (holes - 1) / 2;
  }

  /**
   * Number of closing triangles formed by {@code holes} holes.
   *
   * @param holes hole count
   * @return {@code C(holes, 3)}
   */
  public static int triangleCount(int holes) {
    return holes * (holes - 1) * (holes - 2) / 6;
  }

  public int holes() {
    return holes;
  }

  public double[] amplitudes() {
    return amplitudes.clone();
  }

  public double[] phases() {
    return phases.clone();
  }

  public double[] closurePhases() {
    return closurePhases.clone();
  }

  public double[] amplitudeErrors() {
    return amplitudeErrors.clone();
  }

  public double[] phaseErrors() {
    return phaseErrors.clone();
  }

  public double[] closurePhaseErrors() {
    return closurePhaseErrors.clone();
  }

  /**
   * Indicates whether standard errors accompany the observables.
   *
   * @return {@code true} when error arrays are populated
   */
  public boolean hasErrors() {
    return amplitudeErrors.length > 0;
  }

  /**
   * Checks whether two observable sets describe the same mask geometry.
   *
   * @param other observables to compare with
   * @return {@code true} when the hole counts match
   */
  public boolean sameShape(FringeObservables other) {
    return other != null && other.holes == holes;
  }

  private static double[] requireLength(String name, double[] values, int expected, boolean optional) {
    Objects.requireNonNull(values, name);
    if (optional && values.length == 0) {
      return NONE;
    }
    if (values.length != expected) {
      throw new IllegalArgumentException(
          name + " must have " + expected + " entries (was " + values.length + ")");
    }
    return values.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FringeObservables other)) {
      return false;
    }
    return holes == other.holes
        && Arrays.equals(amplitudes, other.amplitudes)
        && Arrays.equals(phases, other.phases)
        && Arrays.equals(closurePhases, other.closurePhases)
        && Arrays.equals(amplitudeErrors, other.amplitudeErrors)
        && Arrays.equals(phaseErrors, other.phaseErrors)
        && Arrays.equals(closurePhaseErrors, other.closurePhaseErrors);
  }

  @Override
  public int hashCode() {
    int result = Integer.hashCode(holes);
    result = 31 * result + Arrays.hashCode(amplitudes);
    result = 31 * result + Arrays.hashCode(phases);
    result = 31 * result + Arrays.hashCode(closurePhases);
    return result;
  }

  @Override
  public String toString() {
    return "FringeObservables{holes=" + holes
        + ", baselines=" + amplitudes.length
        + ", triangles=" + closurePhases.length
        + ", errors=" + hasErrors() + '}';
  }
}

package ca.nrc.ami3.infrastructure.stage;

import ca.nrc.ami3.domain.model.FringeObservables;

/**
 * Baseline and triangle indexing for a non-redundant mask.
 *
 * <p>Baselines {@code (i, j)} with {@code i < j} are ordered lexicographically, as are triangles
 * {@code (i, j, k)} with {@code i < j < k}.</p>
 */
final class MaskGeometry {
  private MaskGeometry() {}

  /**
   * Index of baseline {@code (i, j)}.
   *
   * @param holes hole count
   * @param i first hole, {@code 0 <= i < j}
   * @param j second hole, {@code j < holes}
   * @return position in the baseline ordering
   */
  static int baselineIndex(int holes, int i, int j) {
    if (i < 0 || j <= i || j >= holes) {
      throw new IllegalArgumentException("invalid baseline (" + i + ", " + j + ") for " + holes + " holes");
    }
    // baselines starting before hole i, then offset within row i
    return i * (2 * holes - i - 1) / 2 + (j - i - 1);
  }

  /**
   * Enumerates hole triangles.
   *
   * @param holes hole count
   * @return {@code [i, j, k]} triples in lexicographic order
   */
  static int[][] triangles(int holes) {
    int[][] out = new int[FringeObservables.triangleCount(holes)][];
    int n = 0;
    for (int i = 0; i < holes; i++) {
      for (int j = i + 1; j < holes; j++) {
        for (int k = j + 1; k < holes; k++) {
          out[n++] = new int[] {i, j, k};
        }
      }
    }
    return out;
  }

  /**
   * Closure phases of every triangle: {@code phi(i,j) + phi(j,k) - phi(i,k)}, wrapped.
   *
   * @param holes hole count
   * @param phases baseline phases in degrees
   * @return closure phases in degrees
   */
  static double[] closurePhases(int holes, double[] phases) {
    int[][] triangles = triangles(holes);
    double[] out = new double[triangles.length];
    for (int t = 0; t < triangles.length; t++) {
      int i = triangles[t][0];
      int j = triangles[t][1];
      int k = triangles[t][2];
      out[t] = Angles.wrapDegrees(
          phases[baselineIndex(holes, i, j)] + phases[baselineIndex(holes, j, k)] - phases[baselineIndex(holes, i, k)]);
    }
    return out;
  }
}

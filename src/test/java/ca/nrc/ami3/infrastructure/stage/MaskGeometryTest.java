package ca.nrc.ami3.infrastructure.stage;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class MaskGeometryTest {

  @Test
  void baselinesAreIndexedRowMajor() {
    assertEquals(0, MaskGeometry.baselineIndex(4, 0, 1));
    assertEquals(2, MaskGeometry.baselineIndex(4, 0, 3));
    assertEquals(3, MaskGeometry.baselineIndex(4, 1, 2));
    assertEquals(5, MaskGeometry.baselineIndex(4, 2, 3));
    assertEquals(20, MaskGeometry.baselineIndex(7, 5, 6));
  }

  @Test
  void trianglesEnumerateHoleTriples() {
    int[][] triangles = MaskGeometry.triangles(4);

    assertEquals(4, triangles.length);
    assertArrayEquals(new int[] {0, 1, 2}, triangles[0]);
    assertArrayEquals(new int[] {1, 2, 3}, triangles[3]);
    assertEquals(35, MaskGeometry.triangles(7).length);
  }

  @Test
  void closurePhaseCancelsHoleDependentErrors() {
    // phase_ij = p_j - p_i for per-hole pistons p = {5, -12, 40, 7}
    double[] pistons = {5.0, -12.0, 40.0, 7.0};
    double[] phases = new double[6];
    for (int i = 0; i < 4; i++) {
      for (int j = i + 1; j < 4; j++) {
        phases[MaskGeometry.baselineIndex(4, i, j)] = pistons[j] - pistons[i];
      }
    }

    assertArrayEquals(new double[4], MaskGeometry.closurePhases(4, phases), 1e-9);
  }

  @Test
  void rejectsInvalidBaseline() {
    assertThrows(IllegalArgumentException.class, () -> MaskGeometry.baselineIndex(3, 1, 1));
    assertThrows(IllegalArgumentException.class, () -> MaskGeometry.baselineIndex(3, 0, 3));
  }
}

package ca.nrc.ami3.domain.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FringeObservablesTest {

  @Test
  void baselineAndTriangleCountsFollowHoleCount() {
    assertEquals(3, FringeObservables.baselineCount(3));
    assertEquals(1, FringeObservables.triangleCount(3));
    assertEquals(21, FringeObservables.baselineCount(7));
    assertEquals(35, FringeObservables.triangleCount(7));
  }

  @Test
  void rejectsFewerThanThreeHoles() {
    assertThrows(IllegalArgumentException.class,
        () -> new FringeObservables(2, new double[1], new double[1], new double[0]));
  }

  @Test
  void rejectsArraysOfTheWrongLength() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> new FringeObservables(3, new double[2], new double[3], new double[1]));
    assertEquals("amplitudes must have 3 entries (was 2)", ex.getMessage());
  }

  @Test
  void errorsAreOptionalButMustMatchWhenPresent() {
    FringeObservables plain = new FringeObservables(3, new double[3], new double[3], new double[1]);
    assertFalse(plain.hasErrors());
    assertEquals(0, plain.phaseErrors().length);

    assertThrows(IllegalArgumentException.class, () -> new FringeObservables(
        3, new double[3], new double[3], new double[1], new double[2], new double[0], new double[0]));
  }

  @Test
  void accessorsReturnDefensiveCopies() {
    double[] amplitudes = {1.0, 1.0, 1.0};
    FringeObservables observables = new FringeObservables(3, amplitudes, new double[3], new double[1]);
    amplitudes[0] = 5.0;
    observables.amplitudes()[1] = 5.0;

    assertEquals(1.0, observables.amplitudes()[0]);
    assertEquals(1.0, observables.amplitudes()[1]);
  }

  @Test
  void equalityComparesValues() {
    FringeObservables a = new FringeObservables(3, new double[] {1, 2, 3}, new double[3], new double[1]);
    FringeObservables b = new FringeObservables(3, new double[] {1, 2, 3}, new double[3], new double[1]);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertTrue(a.sameShape(b));
  }
}

package ca.nrc.ami3.infrastructure.stage;

/**
 * Degree arithmetic for phases.
 */
final class Angles {
  private Angles() {}

  /**
   * Wraps an angle into {@code (-180, 180]}.
   *
   * @param degrees angle in degrees
   * @return equivalent angle in {@code (-180, 180]}
   */
  static double wrapDegrees(double degrees) {
    double wrapped = degrees % 360.0;
    if (wrapped <= -180.0) {
      wrapped += 360.0;
    } else if (wrapped > 180.0) {
      wrapped -= 360.0;
    }
    return wrapped == -0.0 ? 0.0 : wrapped;
  }

  /**
   * Circular mean of angles.
   *
   * @param degrees angles in degrees; must not be empty
   * @return mean direction in {@code (-180, 180]}
   */
  static double circularMean(double[] degrees) {
    double sin = 0.0;
    double cos = 0.0;
    for (double value : degrees) {
      double radians = Math.toRadians(value);
      sin += Math.sin(radians);
      cos += Math.cos(radians);
    }
    return wrapDegrees(Math.toDegrees(Math.atan2(sin, cos)));
  }
}

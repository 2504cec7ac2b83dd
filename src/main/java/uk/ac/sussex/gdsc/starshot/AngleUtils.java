/*-
 * #%L
 * Genome Damage and Stability Centre Star Shot Analysis
 *
 * Software for radiotherapy star shot image analysis
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.starshot;

/**
 * Utilities for angles in radians.
 */
final class AngleUtils {
  private static final double TWO_PI = 2 * Math.PI;

  /** No public constructor. */
  private AngleUtils() {}

  /**
   * Normalise the angle to the interval {@code [0, 2 pi)}.
   *
   * @param angle the angle
   * @return the normalised angle
   */
  static double normalise(double angle) {
    double a = angle % TWO_PI;
    if (a < 0) {
      a += TWO_PI;
    }
    // Rounding of a small negative angle
    return a == TWO_PI ? 0 : a;
  }

  /**
   * Get the signed difference {@code a2 - a1} wrapped to {@code [-pi, pi)}.
   *
   * @param a1 the first angle
   * @param a2 the second angle
   * @return the difference
   */
  static double difference(double a1, double a2) {
    return normalise(a2 - a1 + Math.PI) - Math.PI;
  }

  /**
   * Get the absolute angular distance between two angles. The result is in {@code [0, pi]}.
   *
   * @param a1 the first angle
   * @param a2 the second angle
   * @return the distance
   */
  static double distance(double a1, double a2) {
    return Math.abs(difference(a1, a2));
  }
}

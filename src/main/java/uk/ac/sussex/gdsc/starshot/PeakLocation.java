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
 * The location of an intensity peak where a spoke crosses a sampling circle.
 */
public final class PeakLocation {
  private final ImagePoint point;
  private final double radius;
  private final double angle;
  private final double value;

  /**
   * Create a new instance.
   *
   * @param point the image point
   * @param radius the radius of the sampling circle
   * @param angle the angle on the sampling circle (radians)
   * @param value the peak intensity
   */
  public PeakLocation(ImagePoint point, double radius, double angle, double value) {
    this.point = point;
    this.radius = radius;
    this.angle = angle;
    this.value = value;
  }

  /**
   * Gets the image point.
   *
   * @return the point
   */
  public ImagePoint getPoint() {
    return point;
  }

  /**
   * Gets the radius of the sampling circle.
   *
   * @return the radius
   */
  public double getRadius() {
    return radius;
  }

  /**
   * Gets the angle on the sampling circle in {@code [0, 2 pi)}.
   *
   * @return the angle (radians)
   */
  public double getAngle() {
    return angle;
  }

  /**
   * Gets the peak intensity.
   *
   * @return the value
   */
  public double getValue() {
    return value;
  }

  @Override
  public String toString() {
    return "PeakLocation[" + point + ", r=" + radius + ", angle=" + Math.toDegrees(angle) + "]";
  }
}

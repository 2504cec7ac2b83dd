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
 * Intensity samples taken at evenly spaced angles along a circle.
 *
 * <p>Sample {@code i} of {@code n} is at angle {@code 2 pi i / n} measured from the +x axis towards
 * +y. As the image y axis points down this is clockwise on screen.
 */
public final class CircleProfile {
  private static final double TWO_PI = 2 * Math.PI;

  private final ImagePoint centre;
  private final double radius;
  private final double[] values;

  /**
   * Create a new instance.
   *
   * @param centre the centre
   * @param radius the radius
   * @param values the values (not copied)
   */
  CircleProfile(ImagePoint centre, double radius, double[] values) {
    this.centre = centre;
    this.radius = radius;
    this.values = values;
  }

  /**
   * Gets the centre.
   *
   * @return the centre
   */
  public ImagePoint getCentre() {
    return centre;
  }

  /**
   * Gets the radius.
   *
   * @return the radius
   */
  public double getRadius() {
    return radius;
  }

  /**
   * Gets the number of samples.
   *
   * @return the size
   */
  public int size() {
    return values.length;
  }

  /**
   * Gets the sample value.
   *
   * @param index the index
   * @return the value
   */
  public double getValue(int index) {
    return values[index];
  }

  /**
   * Gets a copy of the values.
   *
   * @return the values
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * Gets the angle for the (fractional) sample position. The result is in {@code [0, 2 pi)}.
   *
   * @param position the position
   * @return the angle (radians)
   */
  public double getAngle(double position) {
    final double angle = TWO_PI * position / values.length;
    return AngleUtils.normalise(angle);
  }

  /**
   * Gets the image point for the (fractional) sample position.
   *
   * @param position the position
   * @return the point
   */
  public ImagePoint getPoint(double position) {
    final double angle = getAngle(position);
    return new ImagePoint(centre.getX() + radius * Math.cos(angle),
        centre.getY() + radius * Math.sin(angle));
  }

  /**
   * Convert an angular distance to the equivalent number of samples.
   *
   * @param angle the angle (radians)
   * @return the samples
   */
  public double toSamples(double angle) {
    return angle * values.length / TWO_PI;
  }
}

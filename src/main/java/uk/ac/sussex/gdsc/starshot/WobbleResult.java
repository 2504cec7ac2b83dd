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
 * The smallest circle that touches all the spoke lines.
 */
public final class WobbleResult {
  private final ImagePoint centre;
  private final double radius;
  private final int iterations;

  /**
   * Create a new instance.
   *
   * @param centre the centre
   * @param radius the radius (pixels)
   * @param iterations the number of solver iterations
   */
  WobbleResult(ImagePoint centre, double radius, int iterations) {
    this.centre = centre;
    this.radius = radius;
    this.iterations = iterations;
  }

  /**
   * Gets the centre. This is the isocentre estimate.
   *
   * @return the centre
   */
  public ImagePoint getCentre() {
    return centre;
  }

  /**
   * Gets the radius in pixels. This is the maximum distance from the centre to any line.
   *
   * @return the radius
   */
  public double getRadius() {
    return radius;
  }

  /**
   * Gets the number of solver iterations.
   *
   * @return the iterations
   */
  public int getIterations() {
    return iterations;
  }

  @Override
  public String toString() {
    return "Wobble[centre=" + centre + ", radius=" + radius + "]";
  }
}

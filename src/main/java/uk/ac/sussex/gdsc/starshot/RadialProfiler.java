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

import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Extracts intensity profiles along circles around a centre point.
 *
 * <p>Sampling uses bilinear interpolation. A circle must lie fully inside the pixel centres of the
 * image; the radius is rejected rather than clipped so the caller can choose a smaller radius.
 */
public class RadialProfiler {
  /** The minimum number of samples on a circle. */
  static final int MIN_SAMPLES = 64;

  private final double samplingFactor;

  /**
   * Create a new instance.
   *
   * @param samplingFactor the number of samples per pixel of circumference
   */
  public RadialProfiler(double samplingFactor) {
    ValidationUtils.checkStrictlyPositive(samplingFactor, "samplingFactor");
    this.samplingFactor = samplingFactor;
  }

  /**
   * Gets the maximum radius of a circle around the centre that lies inside the image. This is the
   * distance to the nearest edge pixel centre. The result is negative if the centre is outside the
   * image.
   *
   * @param image the image
   * @param centre the centre
   * @return the maximum radius
   */
  public static double getMaximumRadius(StarshotImage image, ImagePoint centre) {
    final double x = centre.getX();
    final double y = centre.getY();
    return Math.min(Math.min(x, image.getWidth() - 1 - x), Math.min(y, image.getHeight() - 1 - y));
  }

  /**
   * Gets the number of samples for the circle radius.
   *
   * @param radius the radius
   * @return the number of samples
   */
  int getSamples(double radius) {
    return Math.max(MIN_SAMPLES, (int) Math.ceil(2 * Math.PI * radius * samplingFactor));
  }

  /**
   * Extract the profile for a circle.
   *
   * @param image the image
   * @param centre the centre
   * @param radius the radius
   * @return the profile
   * @throws BoundsException if the circle is not inside the image
   */
  public CircleProfile profile(StarshotImage image, ImagePoint centre, double radius) {
    checkRadius(image, centre, radius);
    final int n = getSamples(radius);
    final double[] values = new double[n];
    final double cx = centre.getX();
    final double cy = centre.getY();
    final double step = 2 * Math.PI / n;
    for (int i = 0; i < n; i++) {
      final double angle = i * step;
      values[i] =
          image.getInterpolatedValue(cx + radius * Math.cos(angle), cy + radius * Math.sin(angle));
    }
    return new CircleProfile(centre, radius, values);
  }

  /**
   * Extract the profiles for each circle. The profiles are returned in the order of the radii.
   *
   * @param image the image
   * @param centre the centre
   * @param radii the radii
   * @return the profiles
   * @throws BoundsException if any circle is not inside the image
   */
  public CircleProfile[] profiles(StarshotImage image, ImagePoint centre, double... radii) {
    // Validate all before sampling
    for (final double radius : radii) {
      checkRadius(image, centre, radius);
    }
    final CircleProfile[] profiles = new CircleProfile[radii.length];
    for (int i = 0; i < radii.length; i++) {
      profiles[i] = profile(image, centre, radii[i]);
    }
    return profiles;
  }

  private static void checkRadius(StarshotImage image, ImagePoint centre, double radius) {
    ValidationUtils.checkNotNull(image, "image");
    ValidationUtils.checkNotNull(centre, "centre");
    if (!(radius > 0 && radius < Double.POSITIVE_INFINITY)) {
      throw new BoundsException("Sampling radius must be strictly positive: " + radius);
    }
    if (!image.contains(centre.getX(), centre.getY())) {
      throw new BoundsException("Sampling centre is outside the image: " + centre);
    }
    final double max = getMaximumRadius(image, centre);
    if (radius > max) {
      throw new BoundsException(String.format(
          "Sampling radius %s exceeds the image bounds around %s (maximum %s)", radius, centre,
          max));
    }
  }
}

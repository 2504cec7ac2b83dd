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

import java.util.Arrays;
import uk.ac.sussex.gdsc.core.utils.MathUtils;

/**
 * Estimates the mechanical point of a star shot from the image intensities.
 *
 * <p>All the spokes overlap at the centre of the star so it is the brightest region of the image.
 * The estimate is the centroid of the brightest fraction of pixels, weighted by their height above
 * the fraction threshold. If the brightest pixels are saturated at a single value the unweighted
 * centroid is used.
 */
final class MechanicalPointEstimator {
  /** No public constructor. */
  private MechanicalPointEstimator() {}

  /**
   * Estimate the mechanical point.
   *
   * @param image the image (spokes are bright)
   * @param fraction the fraction of the brightest pixels to use
   * @return the point
   */
  static ImagePoint estimate(StarshotImage image, double fraction) {
    final float[] pixels = image.getPixels();
    final float[] sorted = pixels.clone();
    Arrays.sort(sorted);
    final int index = MathUtils.clip(0, sorted.length - 1, (int) ((1 - fraction) * sorted.length));
    final float threshold = sorted[index];

    final int width = image.getWidth();
    double sum = 0;
    double sx = 0;
    double sy = 0;
    for (int i = 0; i < pixels.length; i++) {
      final double w = pixels[i] - threshold;
      if (w > 0) {
        sum += w;
        sx += w * (i % width);
        sy += w * (i / width);
      }
    }
    if (sum == 0) {
      for (int i = 0; i < pixels.length; i++) {
        if (pixels[i] >= threshold) {
          sum++;
          sx += i % width;
          sy += i / width;
        }
      }
    }
    if (sum == 0) {
      // Non-finite data
      return new ImagePoint((width - 1) * 0.5, (image.getHeight() - 1) * 0.5);
    }
    return new ImagePoint(sx / sum, sy / sum);
  }
}

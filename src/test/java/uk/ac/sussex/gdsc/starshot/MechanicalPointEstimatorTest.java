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

import ij.process.FloatProcessor;
import java.util.Arrays;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class MechanicalPointEstimatorTest {
  @Test
  void testGaussianSpot() {
    final int width = 64;
    final int height = 48;
    final FloatProcessor fp = new FloatProcessor(width, height);
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        final double dx = x - 30.5;
        final double dy = y - 20.25;
        fp.setf(x, y, (float) (10 + 100 * Math.exp(-(dx * dx + dy * dy) / 18)));
      }
    }
    final ImagePoint p = MechanicalPointEstimator.estimate(new StarshotImage(fp, 1), 0.01);
    Assertions.assertEquals(30.5, p.getX(), 0.25);
    Assertions.assertEquals(20.25, p.getY(), 0.25);
  }

  @Test
  void testSaturatedRegionUsesUnweightedCentroid() {
    final FloatProcessor fp = new FloatProcessor(64, 48);
    for (int y = 5; y < 10; y++) {
      for (int x = 10; x < 20; x++) {
        fp.setf(x, y, 255);
      }
    }
    final ImagePoint p = MechanicalPointEstimator.estimate(new StarshotImage(fp, 1), 0.01);
    Assertions.assertEquals(14.5, p.getX(), 1e-10);
    Assertions.assertEquals(7, p.getY(), 1e-10);
  }

  @Test
  void testFlatImageUsesGeometricCentre() {
    final StarshotImage image = new StarshotImage(new FloatProcessor(64, 48), 1);
    final ImagePoint p = MechanicalPointEstimator.estimate(image, 0.01);
    Assertions.assertEquals(31.5, p.getX(), 1e-10);
    Assertions.assertEquals(23.5, p.getY(), 1e-10);

    final float[] nan = new float[64 * 48];
    Arrays.fill(nan, Float.NaN);
    final ImagePoint p2 = MechanicalPointEstimator
        .estimate(new StarshotImage(new FloatProcessor(64, 48, nan), 1), 0.01);
    Assertions.assertEquals(new ImagePoint(31.5, 23.5), p2);
  }

  @Test
  void testStarshot() {
    final StarshotImageFactory factory = new StarshotImageFactory();
    final ImagePoint p = MechanicalPointEstimator.estimate(factory.createImage(), 0.01);
    Assertions.assertEquals(0, p.distance(factory.getCentre()), 2);
  }
}

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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class PeakDetectorTest {
  @Test
  void testConstructorThrows() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new PeakDetector(-0.1, 1, true));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new PeakDetector(1, 1, true));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new PeakDetector(0.1, -1, true));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new PeakDetector(0.1, Double.NaN, true));
  }

  @Test
  void testFlatOrShortProfileHasNoPeaks() {
    final PeakDetector pd = new PeakDetector(0.1, 0, true);
    Assertions.assertEquals(0, pd.findPeaks(new double[10], true).length);
    Assertions.assertEquals(0, pd.findPeaks(new double[] {1, 3}, true).length);
  }

  @Test
  void testCyclicGaussianPeaks() {
    final int n = 360;
    final double[] values = new double[n];
    addGaussian(values, 50.25, 5, 10);
    addGaussian(values, 170.6, 5, 9);
    addGaussian(values, 300, 5, 10);
    // Wraps the end of the profile
    addGaussian(values, 357.6, 5, 8);
    for (final boolean fwhm : new boolean[] {true, false}) {
      final ProfilePeak[] peaks = new PeakDetector(0.15, 2, fwhm).findPeaks(values, true);
      Assertions.assertEquals(4, peaks.length);
      final double delta = fwhm ? 0.05 : 0.1;
      Assertions.assertEquals(50.25, peaks[0].getPosition(), delta);
      Assertions.assertEquals(170.6, peaks[1].getPosition(), delta);
      Assertions.assertEquals(300, peaks[2].getPosition(), delta);
      Assertions.assertEquals(357.6, peaks[3].getPosition(), delta);
      Assertions.assertEquals(358, peaks[3].getIndex());
      // Background is zero
      Assertions.assertEquals(peaks[0].getValue(), peaks[0].getProminence(), 1e-3);
    }
  }

  @Test
  void testLinearProfileIgnoresEnds() {
    final double[] values = {5, 4, 3, 2, 3, 4, 6};
    Assertions.assertEquals(0, new PeakDetector(0.1, 0, true).findPeaks(values, false).length);
    final ProfilePeak[] peaks = new PeakDetector(0.1, 0, true).findPeaks(values, true);
    Assertions.assertEquals(1, peaks.length);
    Assertions.assertEquals(6, peaks[0].getIndex());
    // The highest peak of a cyclic profile uses the profile minimum
    Assertions.assertEquals(4, peaks[0].getProminence());
  }

  @Test
  void testProminenceThreshold() {
    final double[] values = new double[200];
    addGaussian(values, 50, 3, 10);
    addGaussian(values, 100, 3, 1);
    addGaussian(values, 150, 3, 10);
    Assertions.assertEquals(2, new PeakDetector(0.15, 0, true).findPeaks(values, false).length);
    Assertions.assertEquals(3, new PeakDetector(0.05, 0, true).findPeaks(values, false).length);
  }

  @Test
  void testShoulderHasLowProminence() {
    // A small bump on the flank of a large peak
    final double[] values = new double[200];
    addGaussian(values, 100, 10, 10);
    values[110] += 1;
    final ProfilePeak[] peaks = new PeakDetector(0.2, 0, true).findPeaks(values, false);
    Assertions.assertEquals(1, peaks.length);
    Assertions.assertEquals(100, peaks[0].getIndex());
  }

  @Test
  void testMinimumSeparation() {
    final double[] values = new double[200];
    values[100] = 10;
    values[103] = 8;
    ProfilePeak[] peaks = new PeakDetector(0.1, 2, true).findPeaks(values, false);
    Assertions.assertEquals(2, peaks.length);
    peaks = new PeakDetector(0.1, 3, true).findPeaks(values, false);
    Assertions.assertEquals(1, peaks.length);
    Assertions.assertEquals(100, peaks[0].getIndex());
    Assertions.assertEquals(100, peaks[0].getPosition(), 1e-10);
  }

  @Test
  void testMinimumSeparationIsCyclic() {
    final double[] values = new double[100];
    values[1] = 8;
    values[98] = 10;
    Assertions.assertEquals(1, new PeakDetector(0.1, 3, false).findPeaks(values, true).length);
    Assertions.assertEquals(2, new PeakDetector(0.1, 3, false).findPeaks(values, false).length);
  }

  @Test
  void testPlateauIsOnePeak() {
    final double[] values = {0, 0, 5, 5, 5, 0, 0};
    final ProfilePeak[] peaks = new PeakDetector(0.1, 0, true).findPeaks(values, false);
    Assertions.assertEquals(1, peaks.length);
    Assertions.assertEquals(2, peaks[0].getIndex());
    Assertions.assertEquals(3, peaks[0].getPosition(), 1e-10);
  }

  @Test
  void testGetParabolicCentre() {
    Assertions.assertEquals(5 + 1.0 / 6, PeakDetector.getParabolicCentre(
        new double[] {0, 0, 0, 0, 1, 3, 2, 0}, 5, false), 1e-12);
    // Symmetric
    Assertions.assertEquals(1, PeakDetector.getParabolicCentre(new double[] {1, 2, 1}, 1, false));
    // Wrap
    Assertions.assertEquals(7 + 0.25, PeakDetector.getParabolicCentre(
        new double[] {2, 0, 0, 0, 0, 0, 0, 3}, 7, true), 1e-12);
    Assertions.assertEquals(0, PeakDetector.getParabolicCentre(new double[] {3, 2, 1}, 0, false));
  }

  @Test
  void testGetFwhmCentre() {
    final double[] values = {0, 0, 2, 4, 8, 4, 0, 0};
    final ProfilePeak peak = new ProfilePeak(4, 4, 8, 8);
    // Half = 4. Left crossing 3, right crossing 5.
    Assertions.assertEquals(4, PeakDetector.getFwhmCentre(values, peak, false), 1e-12);
    final double[] skew = {0, 0, 0, 8, 8, 0, 0, 0};
    Assertions.assertEquals(3.5,
        PeakDetector.getFwhmCentre(skew, new ProfilePeak(3, 3, 8, 8), false), 1e-12);
    // Crossing is not found before the end of a linear profile
    final double[] edge = {8, 7, 0};
    Assertions.assertTrue(
        Double.isNaN(PeakDetector.getFwhmCentre(edge, new ProfilePeak(0, 0, 8, 8), false)));
  }

  private static void addGaussian(double[] values, double centre, double sd, double amplitude) {
    final int n = values.length;
    for (int i = 0; i < n; i++) {
      double d = Math.abs(i - centre);
      d = Math.min(d, n - d);
      values[i] += amplitude * Math.exp(-0.5 * d * d / (sd * sd));
    }
  }
}

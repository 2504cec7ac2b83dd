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
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class SpokeLocatorTest {
  private static StarshotImageFactory factory;
  private static StarshotImage image;

  @BeforeAll
  static void beforeAll() {
    factory = new StarshotImageFactory();
    image = factory.createImage();
  }

  @Test
  void testGetRadii() {
    Assertions.assertArrayEquals(new double[] {30, 20, 10}, SpokeLocator.getRadii(10, 30, 3),
        1e-12);
    Assertions.assertArrayEquals(new double[] {30}, SpokeLocator.getRadii(10, 30, 1));
  }

  @Test
  void testLocateAtStarCentre() {
    final ImagePoint centre = factory.getCentre();
    final SpokeDetection detection = new SpokeLocator(new StarshotSettings()).locate(image, centre);
    Assertions.assertEquals(centre, detection.getCentre());
    Assertions.assertEquals(StarshotImageFactory.SPOKES, detection.getSpokeCount());

    final double[] radii = detection.getRadii();
    Assertions.assertEquals(5, radii.length);
    final double maxRadius = RadialProfiler.getMaximumRadius(image, centre);
    Assertions.assertEquals(0.9 * maxRadius, radii[0], 1e-10);
    Assertions.assertEquals(0.5 * maxRadius, radii[4], 1e-10);

    final List<List<PeakLocation>> clusters = detection.getClusters();
    Assertions.assertEquals(2 * StarshotImageFactory.SPOKES, clusters.size());
    for (final List<PeakLocation> cluster : clusters) {
      Assertions.assertEquals(radii.length, cluster.size());
    }

    final List<PeakLocation> peaks = detection.getPeakLocations();
    Assertions.assertEquals(2 * StarshotImageFactory.SPOKES, peaks.size());
    for (int i = 1; i < peaks.size(); i++) {
      Assertions.assertTrue(peaks.get(i - 1).getAngle() < peaks.get(i).getAngle());
    }

    final Line[] expected = factory.getLines();
    for (final Line line : detection.getLines()) {
      Assertions.assertEquals(factory.getOffset(), line.distance(centre), 0.1);
      double min = Double.POSITIVE_INFINITY;
      for (final Line e : expected) {
        min = Math.min(min, line.angleTo(e));
      }
      Assertions.assertEquals(0, Math.toDegrees(min), 0.05);
    }
  }

  @Test
  void testLocateWithOffsetCentre() {
    final SpokeDetection detection =
        new SpokeLocator(new StarshotSettings()).locate(image, new ImagePoint(490, 385));
    Assertions.assertEquals(StarshotImageFactory.SPOKES, detection.getSpokeCount());
    for (final Line line : detection.getLines()) {
      Assertions.assertEquals(factory.getOffset(), line.distance(factory.getCentre()), 0.1);
    }
  }

  @Test
  void testLocateTracksDriftingSpokeEnds() {
    // 100 pixels from the star centre. Spoke ends move over 5 degrees between circles.
    final ImagePoint centre = new ImagePoint(420, 410);
    final SpokeDetection detection =
        new SpokeLocator(new StarshotSettings()).locate(image, centre);
    Assertions.assertEquals(StarshotImageFactory.SPOKES, detection.getSpokeCount());
    for (final Line line : detection.getLines()) {
      Assertions.assertEquals(factory.getOffset(), line.distance(factory.getCentre()), 0.2);
    }
    // The first step has no drift estimate
    final SpokeLocator strict =
        new SpokeLocator(new StarshotSettings().setAngularClusterTolerance(1));
    final DetectionException ex =
        Assertions.assertThrows(DetectionException.class, () -> strict.locate(image, centre));
    Assertions.assertTrue(ex.getMessage().contains("predicted angle"), ex::getMessage);
  }

  @Test
  void testLocateWithExpectedSpokeCount() {
    final SpokeDetection detection = new SpokeLocator(new StarshotSettings()
        .setExpectedSpokeCount(StarshotImageFactory.SPOKES)).locate(image, factory.getCentre());
    Assertions.assertEquals(StarshotImageFactory.SPOKES, detection.getLines().size());
  }

  @Test
  void testLocateSixSpokes() {
    final StarshotImageFactory factory6 = new StarshotImageFactory().setSpokes(6);
    final SpokeLocator locator = new SpokeLocator(new StarshotSettings());
    final SpokeDetection detection = locator.locate(factory6.createImage(), factory6.getCentre());
    Assertions.assertEquals(6, detection.getSpokeCount());
    Assertions.assertEquals(12, detection.getPeakLocations().size());
  }

  @Test
  void testWrongSpokeCountThrows() {
    final SpokeLocator locator = new SpokeLocator(new StarshotSettings().setExpectedSpokeCount(8));
    final ImagePoint centre = factory.getCentre();
    final DetectionException ex =
        Assertions.assertThrows(DetectionException.class, () -> locator.locate(image, centre));
    Assertions.assertTrue(ex.getMessage().contains("unexpected peak count"), ex::getMessage);
  }

  @Test
  void testFlatImageThrows() {
    final StarshotImage flat = new StarshotImage(new FloatProcessor(200, 100), 1);
    final SpokeLocator locator = new SpokeLocator(new StarshotSettings());
    final ImagePoint centre = new ImagePoint(100, 50);
    Assertions.assertThrows(DetectionException.class, () -> locator.locate(flat, centre));
  }

  @Test
  void testClusterToleranceThrows() {
    // Spoke ends drift in angle between circles when the centre is offset
    final SpokeLocator locator =
        new SpokeLocator(new StarshotSettings().setAngularClusterTolerance(0.01));
    final ImagePoint centre = new ImagePoint(490, 385);
    Assertions.assertThrows(DetectionException.class, () -> locator.locate(image, centre));
  }

  @Test
  void testCentreOutsideImageThrows() {
    final SpokeLocator locator = new SpokeLocator(new StarshotSettings());
    Assertions.assertThrows(BoundsException.class,
        () -> locator.locate(image, new ImagePoint(-10, 50)));
    Assertions.assertThrows(BoundsException.class,
        () -> locator.locate(image, new ImagePoint(500, 800)));
    // Inside but too close to the edge to sample
    Assertions.assertThrows(BoundsException.class,
        () -> locator.locate(image, new ImagePoint(0.5, 400)));
  }

  @Test
  void testInvalidSettingsThrows() {
    final StarshotSettings settings = new StarshotSettings().setRadiusCount(0);
    Assertions.assertThrows(ConfigurationException.class, () -> new SpokeLocator(settings));
  }
}

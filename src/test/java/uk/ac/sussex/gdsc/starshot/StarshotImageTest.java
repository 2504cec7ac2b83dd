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

import ij.ImagePlus;
import ij.measure.Calibration;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

@SuppressWarnings({"javadoc"})
class StarshotImageTest {
  @Test
  void testConstructorThrows() {
    final FloatProcessor fp = new FloatProcessor(5, 4);
    Assertions.assertThrows(ConfigurationException.class, () -> new StarshotImage(fp, 0));
    Assertions.assertThrows(ConfigurationException.class, () -> new StarshotImage(fp, -1));
    Assertions.assertThrows(ConfigurationException.class,
        () -> new StarshotImage(fp, Double.POSITIVE_INFINITY));
    Assertions.assertThrows(NullPointerException.class, () -> new StarshotImage(null, 1));
  }

  @Test
  void testImageIsCopied() {
    final ByteProcessor bp = new ByteProcessor(5, 4);
    bp.set(2, 1, 200);
    final StarshotImage image = new StarshotImage(bp, 0.25);
    bp.set(2, 1, 7);
    Assertions.assertEquals(5, image.getWidth());
    Assertions.assertEquals(4, image.getHeight());
    Assertions.assertEquals(0.25, image.getPixelSize());
    Assertions.assertEquals(200, image.getValue(2, 1));
    image.getPixels()[2 + 5] = 99;
    Assertions.assertEquals(200, image.getValue(2, 1));
  }

  @Test
  void testContains() {
    final StarshotImage image = new StarshotImage(new FloatProcessor(5, 4), 1);
    Assertions.assertTrue(image.contains(0, 0));
    Assertions.assertTrue(image.contains(4, 3));
    Assertions.assertTrue(image.contains(2.5, 1.5));
    Assertions.assertFalse(image.contains(-0.1, 1));
    Assertions.assertFalse(image.contains(4.1, 1));
    Assertions.assertFalse(image.contains(1, 3.5));
    Assertions.assertFalse(image.contains(Double.NaN, 1));
  }

  @Test
  void testGetPixelSize() {
    final Calibration cal = new Calibration();
    Assertions.assertThrows(ConfigurationException.class, () -> StarshotImage.getPixelSize(cal));
    cal.pixelWidth = cal.pixelHeight = 0.5;
    cal.setUnit("mm");
    Assertions.assertEquals(0.5, StarshotImage.getPixelSize(cal));
    cal.setUnit("cm");
    Assertions.assertEquals(5, StarshotImage.getPixelSize(cal));
    cal.setUnit("micron");
    Assertions.assertEquals(5e-4, StarshotImage.getPixelSize(cal), 1e-15);
    cal.setUnit("inch");
    Assertions.assertEquals(12.7, StarshotImage.getPixelSize(cal), 1e-12);
    cal.setUnit("furlong");
    Assertions.assertThrows(ConfigurationException.class, () -> StarshotImage.getPixelSize(cal));
    cal.setUnit("mm");
    cal.pixelHeight = 0.6;
    Assertions.assertThrows(ConfigurationException.class, () -> StarshotImage.getPixelSize(cal));
  }

  @Test
  void testFromImagePlus() {
    final ImagePlus imp = new ImagePlus("test", new FloatProcessor(5, 4));
    Assertions.assertThrows(ConfigurationException.class, () -> StarshotImage.fromImagePlus(imp));
    Assertions.assertEquals(0.3, StarshotImage.fromImagePlus(imp, 0.3).getPixelSize());
    final Calibration cal = imp.getCalibration();
    cal.pixelWidth = cal.pixelHeight = 0.2;
    cal.setUnit("mm");
    Assertions.assertEquals(0.2, StarshotImage.fromImagePlus(imp).getPixelSize());
  }

  @Test
  void testInvert() {
    final FloatProcessor fp = new FloatProcessor(3, 1, new float[] {10, 30, 20});
    final StarshotImage image = new StarshotImage(fp, 1).invert();
    Assertions.assertEquals(30, image.getValue(0, 0));
    Assertions.assertEquals(10, image.getValue(1, 0));
    Assertions.assertEquals(20, image.getValue(2, 0));
    Assertions.assertEquals(1, image.getPixelSize());
  }

  @Test
  void testIsInverted() {
    final StarshotImageFactory factory = new StarshotImageFactory().setSize(200, 160)
        .setCentre(100, 80).setSpokes(3);
    final StarshotImage image = factory.createImage();
    Assertions.assertFalse(image.isInverted());
    Assertions.assertTrue(image.invert().isInverted());
    Assertions.assertTrue(factory.setInverted(true).createImage().isInverted());
  }

  @Test
  void testIsInvertedWithSpokeThroughCorner() {
    // The 40 degree spoke crosses the top-left corner
    final StarshotImageFactory factory = new StarshotImageFactory().setStartAngle(0);
    Assertions.assertFalse(factory.createImage().isInverted());
    Assertions.assertTrue(factory.setInverted(true).createImage().isInverted());
  }

  @Test
  void testIsInvertedWithFlatImage() {
    final FloatProcessor fp = new FloatProcessor(4, 3);
    fp.add(7);
    Assertions.assertFalse(new StarshotImage(fp, 1).isInverted());
  }

  @Test
  void testBlur() {
    final FloatProcessor fp = new FloatProcessor(50, 40);
    // Checkerboard
    for (int y = 0; y < 40; y++) {
      for (int x = 0; x < 50; x++) {
        fp.setf(x, y, ((x + y) & 1) * 100);
      }
    }
    final StarshotImage image = new StarshotImage(fp, 0.5);
    Assertions.assertSame(image, image.blur(0));
    final StarshotImage blurred = image.blur(2);
    Assertions.assertNotSame(image, blurred);
    Assertions.assertEquals(0.5, blurred.getPixelSize());
    Assertions.assertEquals(100, image.getValue(25, 20));
    Assertions.assertEquals(50, blurred.getValue(25, 20), 1);
    Assertions.assertEquals(50, blurred.getValue(24, 20), 1);
  }
}

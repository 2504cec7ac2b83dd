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
import ij.plugin.filter.GaussianBlur;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.util.Arrays;
import java.util.Locale;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * A read-only star shot image. Stores the pixel intensities and the physical size of a pixel in
 * millimetres.
 *
 * <p>The pixel data is copied on construction so the instance is safe to share between analyses.
 */
public final class StarshotImage {
  private final FloatProcessor fp;
  private final double pixelSize;

  /**
   * Create a new instance. The processor is converted to 32-bit float and copied.
   *
   * @param ip the image processor
   * @param pixelSize the pixel size (mm per pixel)
   * @throws ConfigurationException if the pixel size is not strictly positive and finite
   */
  public StarshotImage(ImageProcessor ip, double pixelSize) {
    ValidationUtils.checkNotNull(ip, "image processor");
    if (!(pixelSize > 0 && pixelSize < Double.POSITIVE_INFINITY)) {
      throw new ConfigurationException("Pixel size must be strictly positive: " + pixelSize);
    }
    ValidationUtils.checkArgument(ip.getWidth() > 0 && ip.getHeight() > 0, "Empty image: %s", ip);
    this.fp = (FloatProcessor) ip.convertToFloatProcessor().duplicate();
    this.pixelSize = pixelSize;
  }

  /**
   * Create from the ImageJ image using the spatial calibration of the image.
   *
   * <p>The calibration must use square pixels in a recognised length unit (m, cm, mm, micron or
   * inch).
   *
   * @param imp the image
   * @return the star shot image
   * @throws ConfigurationException if the image is not calibrated in a length unit
   */
  public static StarshotImage fromImagePlus(ImagePlus imp) {
    ValidationUtils.checkNotNull(imp, "image");
    return new StarshotImage(imp.getProcessor(), getPixelSize(imp.getCalibration()));
  }

  /**
   * Create from the ImageJ image using an explicit pixel size.
   *
   * @param imp the image
   * @param pixelSize the pixel size (mm per pixel)
   * @return the star shot image
   */
  public static StarshotImage fromImagePlus(ImagePlus imp, double pixelSize) {
    ValidationUtils.checkNotNull(imp, "image");
    return new StarshotImage(imp.getProcessor(), pixelSize);
  }

  /**
   * Gets the pixel size in millimetres from the calibration.
   *
   * @param cal the calibration
   * @return the pixel size (mm)
   * @throws ConfigurationException if the calibration is not a square pixel length unit
   */
  static double getPixelSize(Calibration cal) {
    if (cal == null || !cal.scaled()) {
      throw new ConfigurationException("Image has no spatial calibration");
    }
    if (cal.pixelWidth != cal.pixelHeight) {
      throw new ConfigurationException(
          "Image pixels are not square: " + cal.pixelWidth + " x " + cal.pixelHeight);
    }
    final String unit = cal.getUnit().toLowerCase(Locale.ROOT);
    final double factor;
    switch (unit) {
      case "mm":
      case "millimeter":
      case "millimetre":
        factor = 1;
        break;
      case "cm":
        factor = 10;
        break;
      case "m":
      case "meter":
      case "metre":
        factor = 1000;
        break;
      case "micron":
      case "um":
      case "µm":
        factor = 1e-3;
        break;
      case "inch":
      case "in":
        factor = 25.4;
        break;
      default:
        throw new ConfigurationException("Unsupported calibration unit: " + cal.getUnit());
    }
    return cal.pixelWidth * factor;
  }

  /**
   * Gets the width.
   *
   * @return the width
   */
  public int getWidth() {
    return fp.getWidth();
  }

  /**
   * Gets the height.
   *
   * @return the height
   */
  public int getHeight() {
    return fp.getHeight();
  }

  /**
   * Gets the pixel size (mm per pixel).
   *
   * @return the pixel size
   */
  public double getPixelSize() {
    return pixelSize;
  }

  /**
   * Gets the pixel value.
   *
   * @param x the x
   * @param y the y
   * @return the value
   */
  public float getValue(int x, int y) {
    return fp.getf(x, y);
  }

  /**
   * Gets the value at the coordinates using bilinear interpolation.
   *
   * @param x the x
   * @param y the y
   * @return the value
   */
  public double getInterpolatedValue(double x, double y) {
    return fp.getInterpolatedValue(x, y);
  }

  /**
   * Checks if the coordinates are within the pixel centres of the image, i.e. inside
   * {@code [0, width-1] x [0, height-1]}.
   *
   * @param x the x
   * @param y the y
   * @return true if inside
   */
  public boolean contains(double x, double y) {
    return x >= 0 && y >= 0 && x <= getWidth() - 1 && y <= getHeight() - 1;
  }

  /**
   * Gets a copy of the pixels.
   *
   * @return the pixels
   */
  public float[] getPixels() {
    return ((float[]) fp.getPixels()).clone();
  }

  /**
   * Create an inverted copy of the image. Each value v is mapped to {@code min + max - v} so the
   * intensity range is unchanged.
   *
   * @return the inverted image
   */
  public StarshotImage invert() {
    final float[] pixels = getPixels();
    float min = Float.POSITIVE_INFINITY;
    float max = Float.NEGATIVE_INFINITY;
    for (final float v : pixels) {
      if (min > v) {
        min = v;
      }
      if (max < v) {
        max = v;
      }
    }
    final float sum = min + max;
    for (int i = 0; i < pixels.length; i++) {
      pixels[i] = sum - pixels[i];
    }
    return new StarshotImage(new FloatProcessor(getWidth(), getHeight(), pixels), pixelSize);
  }

  /**
   * Create a copy of the image smoothed with a Gaussian blur. Returns this instance if
   * {@code sigma <= 0}.
   *
   * @param sigma the blur standard deviation (pixels)
   * @return the blurred image
   */
  public StarshotImage blur(double sigma) {
    if (!(sigma > 0)) {
      return this;
    }
    final FloatProcessor ip = (FloatProcessor) fp.duplicate();
    new GaussianBlur().blurGaussian(ip, sigma, sigma, 0.0002);
    return new StarshotImage(ip, pixelSize);
  }

  /**
   * Checks if the image appears inverted, i.e. the spokes are dark on a bright background.
   *
   * <p>The spokes cover a minority of the image so the median is a background level. Bright
   * spokes skew the mean above the median; dark spokes skew it below. The test does not depend on
   * the orientation of the spokes.
   *
   * @return true if inverted
   */
  public boolean isInverted() {
    final float[] pixels = getPixels();
    double total = 0;
    int count = 0;
    for (final float v : pixels) {
      if (Float.isFinite(v)) {
        pixels[count++] = v;
        total += v;
      }
    }
    if (count == 0) {
      return false;
    }
    Arrays.sort(pixels, 0, count);
    final int middle = count / 2;
    final double median =
        (count & 1) == 1 ? pixels[middle] : 0.5 * ((double) pixels[middle - 1] + pixels[middle]);
    return total / count < median;
  }
}

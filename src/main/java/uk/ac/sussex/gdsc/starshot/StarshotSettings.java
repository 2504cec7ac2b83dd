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

import uk.ac.sussex.gdsc.core.utils.SimpleArrayUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Provides the settings for the {@link Starshot} analysis.
 *
 * <p>Angles are specified in degrees. Radius fractions are relative to the distance from the
 * mechanical point to the nearest image edge.
 */
public class StarshotSettings {
  /** The default wobble tolerance in mm. */
  public static final double DEFAULT_WOBBLE_TOLERANCE = 1.0;

  /** The expected spoke count. Zero to detect the count from the image. */
  private int expectedSpokeCount;

  /** The inner radius fraction. */
  private double innerRadiusFraction = 0.5;

  /** The outer radius fraction. */
  private double outerRadiusFraction = 0.9;

  /** The Gaussian blur standard deviation in pixels. Zero to disable. */
  private double gaussianBlur = 2;

  /** The number of sampling radii. */
  private int radiusCount = 5;

  /** The samples per pixel of circumference. */
  private double angularSamplingFactor = 4;

  /** The peak prominence threshold as a fraction of the profile range. */
  private double peakProminenceThreshold = 0.15;

  /** The minimum peak separation in degrees. */
  private double minimumPeakSeparation = 2;

  /** The angular cluster tolerance in degrees. */
  private double angularClusterTolerance = 5;

  /** The wobble tolerance in mm. */
  private double wobbleTolerance = DEFAULT_WOBBLE_TOLERANCE;

  /** The max solver iterations. */
  private int maxSolverIterations = 1000;

  /** The distance in pixels for a mechanical point override to be far away. */
  private double farAwayDistance = 50;

  /** Set to true to use the centre of the full width at half maximum for each peak. */
  private boolean useFwhmCentre = true;

  /** Set to true to repeat the spoke detection around the first wobble centre. */
  private boolean refineSamplingCentre = true;

  /** The invert mode. */
  private InvertMode invertMode = InvertMode.AUTO;

  /** The fraction of the brightest pixels used to estimate the mechanical point. */
  private double autoCentreFraction = 0.01;

  /**
   * Define how to handle star shots with dark spokes on a bright background.
   */
  public enum InvertMode {
    /** Invert the image if the median is brighter than the image mean. */
    AUTO("Auto"),
    /** Never invert the image. */
    NEVER("Never"),
    /** Always invert the image. */
    ALWAYS("Always");

    /** The values. */
    private static final InvertMode[] values;

    /** The descriptions. */
    private static final String[] descriptions;

    static {
      values = values();
      descriptions = new String[values.length];
      for (int i = 0; i < values.length; i++) {
        descriptions[i] = values[i].getDescription();
      }
    }

    /** The description. */
    private final String description;

    InvertMode(String description) {
      this.description = description;
    }

    /**
     * Gets the description.
     *
     * @return the description
     */
    public String getDescription() {
      return description;
    }

    @Override
    public String toString() {
      return getDescription();
    }

    /**
     * Gets the descriptions for all of the values.
     *
     * @return the descriptions
     */
    public static String[] getDescriptions() {
      return descriptions.clone();
    }

    /**
     * Create from the enum {@link #ordinal()}.
     *
     * @param ordinal the ordinal
     * @param defaultValue the default value (must not be null)
     * @return the invert mode
     * @throws NullPointerException if the default value is null
     */
    public static InvertMode fromOrdinal(int ordinal, InvertMode defaultValue) {
      return SimpleArrayUtils.getIndex(ordinal, values,
          ValidationUtils.checkNotNull(defaultValue, "Default value is null"));
    }
  }

  /**
   * Create a new instance with the default settings.
   */
  public StarshotSettings() {
    // Do nothing
  }

  /**
   * Copy constructor.
   *
   * @param source the source
   */
  protected StarshotSettings(StarshotSettings source) {
    expectedSpokeCount = source.expectedSpokeCount;
    innerRadiusFraction = source.innerRadiusFraction;
    outerRadiusFraction = source.outerRadiusFraction;
    radiusCount = source.radiusCount;
    gaussianBlur = source.gaussianBlur;
    angularSamplingFactor = source.angularSamplingFactor;
    peakProminenceThreshold = source.peakProminenceThreshold;
    minimumPeakSeparation = source.minimumPeakSeparation;
    angularClusterTolerance = source.angularClusterTolerance;
    wobbleTolerance = source.wobbleTolerance;
    maxSolverIterations = source.maxSolverIterations;
    farAwayDistance = source.farAwayDistance;
    useFwhmCentre = source.useFwhmCentre;
    refineSamplingCentre = source.refineSamplingCentre;
    invertMode = source.invertMode;
    autoCentreFraction = source.autoCentreFraction;
  }

  /**
   * Copy the settings.
   *
   * @return the copy
   */
  public StarshotSettings copy() {
    return new StarshotSettings(this);
  }

  /**
   * Validate the settings.
   *
   * @return this instance
   * @throws ConfigurationException if any setting is invalid
   */
  public StarshotSettings validate() {
    if (expectedSpokeCount < 0 || expectedSpokeCount == 1) {
      throw new ConfigurationException(
          "Expected spoke count must be zero (auto) or at least 2: " + expectedSpokeCount);
    }
    checkFraction(innerRadiusFraction, "Inner radius fraction");
    checkFraction(outerRadiusFraction, "Outer radius fraction");
    if (radiusCount < 1) {
      throw new ConfigurationException("Radius count must be at least 1: " + radiusCount);
    }
    if (radiusCount > 1 && innerRadiusFraction >= outerRadiusFraction) {
      throw new ConfigurationException(String.format(
          "Inner radius fraction (%s) must be less than the outer radius fraction (%s)",
          innerRadiusFraction, outerRadiusFraction));
    }
    if (!(gaussianBlur >= 0 && gaussianBlur < Double.POSITIVE_INFINITY)) {
      throw new ConfigurationException("Gaussian blur must be positive: " + gaussianBlur);
    }
    if (!(angularSamplingFactor >= 1 && angularSamplingFactor < Double.POSITIVE_INFINITY)) {
      throw new ConfigurationException(
          "Angular sampling factor must be at least 1: " + angularSamplingFactor);
    }
    if (!(peakProminenceThreshold >= 0 && peakProminenceThreshold < 1)) {
      throw new ConfigurationException(
          "Peak prominence threshold must be in [0, 1): " + peakProminenceThreshold);
    }
    if (!(minimumPeakSeparation >= 0 && minimumPeakSeparation < 180)) {
      throw new ConfigurationException(
          "Minimum peak separation must be in [0, 180) degrees: " + minimumPeakSeparation);
    }
    if (!(angularClusterTolerance > 0 && angularClusterTolerance < 180)) {
      throw new ConfigurationException(
          "Angular cluster tolerance must be in (0, 180) degrees: " + angularClusterTolerance);
    }
    checkPositive(wobbleTolerance, "Wobble tolerance");
    if (maxSolverIterations < 1) {
      throw new ConfigurationException(
          "Max solver iterations must be at least 1: " + maxSolverIterations);
    }
    if (!(farAwayDistance >= 0 && farAwayDistance < Double.POSITIVE_INFINITY)) {
      throw new ConfigurationException("Far away distance must be positive: " + farAwayDistance);
    }
    if (invertMode == null) {
      throw new ConfigurationException("Invert mode is null");
    }
    checkFraction(autoCentreFraction, "Auto centre fraction");
    return this;
  }

  private static void checkFraction(double value, String name) {
    if (!(value > 0 && value <= 1)) {
      throw new ConfigurationException(name + " must be in (0, 1]: " + value);
    }
  }

  private static void checkPositive(double value, String name) {
    if (!(value > 0 && value < Double.POSITIVE_INFINITY)) {
      throw new ConfigurationException(name + " must be strictly positive: " + value);
    }
  }

  /**
   * Gets the expected spoke count. Zero indicates the count is detected from the image.
   *
   * @return the expected spoke count
   */
  public int getExpectedSpokeCount() {
    return expectedSpokeCount;
  }

  /**
   * Sets the expected spoke count. Use zero to detect the count from the image.
   *
   * @param expectedSpokeCount the new expected spoke count
   * @return this instance
   */
  public StarshotSettings setExpectedSpokeCount(int expectedSpokeCount) {
    this.expectedSpokeCount = expectedSpokeCount;
    return this;
  }

  /**
   * Gets the inner radius fraction.
   *
   * @return the inner radius fraction
   */
  public double getInnerRadiusFraction() {
    return innerRadiusFraction;
  }

  /**
   * Sets the inner radius fraction.
   *
   * @param innerRadiusFraction the new inner radius fraction
   * @return this instance
   */
  public StarshotSettings setInnerRadiusFraction(double innerRadiusFraction) {
    this.innerRadiusFraction = innerRadiusFraction;
    return this;
  }

  /**
   * Gets the outer radius fraction.
   *
   * @return the outer radius fraction
   */
  public double getOuterRadiusFraction() {
    return outerRadiusFraction;
  }

  /**
   * Sets the outer radius fraction.
   *
   * @param outerRadiusFraction the new outer radius fraction
   * @return this instance
   */
  public StarshotSettings setOuterRadiusFraction(double outerRadiusFraction) {
    this.outerRadiusFraction = outerRadiusFraction;
    return this;
  }

  /**
   * Gets the number of sampling radii.
   *
   * @return the radius count
   */
  public int getRadiusCount() {
    return radiusCount;
  }

  /**
   * Sets the number of sampling radii.
   *
   * @param radiusCount the new radius count
   * @return this instance
   */
  public StarshotSettings setRadiusCount(int radiusCount) {
    this.radiusCount = radiusCount;
    return this;
  }

  /**
   * Gets the Gaussian blur standard deviation (pixels) applied to the image before the spokes are
   * located. Zero disables the blur.
   *
   * @return the Gaussian blur
   */
  public double getGaussianBlur() {
    return gaussianBlur;
  }

  /**
   * Sets the Gaussian blur standard deviation (pixels).
   *
   * @param gaussianBlur the new Gaussian blur
   * @return this instance
   */
  public StarshotSettings setGaussianBlur(double gaussianBlur) {
    this.gaussianBlur = gaussianBlur;
    return this;
  }

  /**
   * Gets the number of samples per pixel of circumference.
   *
   * @return the angular sampling factor
   */
  public double getAngularSamplingFactor() {
    return angularSamplingFactor;
  }

  /**
   * Sets the number of samples per pixel of circumference.
   *
   * @param angularSamplingFactor the new angular sampling factor
   * @return this instance
   */
  public StarshotSettings setAngularSamplingFactor(double angularSamplingFactor) {
    this.angularSamplingFactor = angularSamplingFactor;
    return this;
  }

  /**
   * Gets the peak prominence threshold as a fraction of the profile range.
   *
   * @return the peak prominence threshold
   */
  public double getPeakProminenceThreshold() {
    return peakProminenceThreshold;
  }

  /**
   * Sets the peak prominence threshold as a fraction of the profile range.
   *
   * @param peakProminenceThreshold the new peak prominence threshold
   * @return this instance
   */
  public StarshotSettings setPeakProminenceThreshold(double peakProminenceThreshold) {
    this.peakProminenceThreshold = peakProminenceThreshold;
    return this;
  }

  /**
   * Gets the minimum peak separation (degrees).
   *
   * @return the minimum peak separation
   */
  public double getMinimumPeakSeparation() {
    return minimumPeakSeparation;
  }

  /**
   * Sets the minimum peak separation (degrees).
   *
   * @param minimumPeakSeparation the new minimum peak separation
   * @return this instance
   */
  public StarshotSettings setMinimumPeakSeparation(double minimumPeakSeparation) {
    this.minimumPeakSeparation = minimumPeakSeparation;
    return this;
  }

  /**
   * Gets the angular cluster tolerance (degrees). This is the maximum distance of a spoke end on a
   * sampling circle from the angle predicted by the previous circles.
   *
   * @return the angular cluster tolerance
   */
  public double getAngularClusterTolerance() {
    return angularClusterTolerance;
  }

  /**
   * Sets the angular cluster tolerance (degrees).
   *
   * @param angularClusterTolerance the new angular cluster tolerance
   * @return this instance
   */
  public StarshotSettings setAngularClusterTolerance(double angularClusterTolerance) {
    this.angularClusterTolerance = angularClusterTolerance;
    return this;
  }

  /**
   * Gets the wobble tolerance (mm). The wobble passes if the wobble radius is within the tolerance.
   *
   * @return the wobble tolerance
   */
  public double getWobbleTolerance() {
    return wobbleTolerance;
  }

  /**
   * Sets the wobble tolerance (mm).
   *
   * @param wobbleTolerance the new wobble tolerance
   * @return this instance
   */
  public StarshotSettings setWobbleTolerance(double wobbleTolerance) {
    this.wobbleTolerance = wobbleTolerance;
    return this;
  }

  /**
   * Gets the max solver iterations.
   *
   * @return the max solver iterations
   */
  public int getMaxSolverIterations() {
    return maxSolverIterations;
  }

  /**
   * Sets the max solver iterations.
   *
   * @param maxSolverIterations the new max solver iterations
   * @return this instance
   */
  public StarshotSettings setMaxSolverIterations(int maxSolverIterations) {
    this.maxSolverIterations = maxSolverIterations;
    return this;
  }

  /**
   * Gets the distance (pixels) beyond which a mechanical point override generates a warning.
   *
   * @return the far away distance
   */
  public double getFarAwayDistance() {
    return farAwayDistance;
  }

  /**
   * Sets the distance (pixels) beyond which a mechanical point override generates a warning.
   *
   * @param farAwayDistance the new far away distance
   * @return this instance
   */
  public StarshotSettings setFarAwayDistance(double farAwayDistance) {
    this.farAwayDistance = farAwayDistance;
    return this;
  }

  /**
   * Checks if the peak centre uses the full width at half maximum.
   *
   * @return true if using the FWHM centre
   */
  public boolean isUseFwhmCentre() {
    return useFwhmCentre;
  }

  /**
   * Set to true to use the centre of the full width at half maximum for each peak.
   *
   * @param useFwhmCentre the new use FWHM centre
   * @return this instance
   */
  public StarshotSettings setUseFwhmCentre(boolean useFwhmCentre) {
    this.useFwhmCentre = useFwhmCentre;
    return this;
  }

  /**
   * Checks if the spokes are located a second time using the first wobble centre as the sampling
   * centre. The sampling annulus is then centred on the star so the result does not depend on the
   * mechanical point.
   *
   * @return true if refining the sampling centre
   */
  public boolean isRefineSamplingCentre() {
    return refineSamplingCentre;
  }

  /**
   * Set to true to locate the spokes a second time around the first wobble centre.
   *
   * @param refineSamplingCentre the new refine sampling centre
   * @return this instance
   */
  public StarshotSettings setRefineSamplingCentre(boolean refineSamplingCentre) {
    this.refineSamplingCentre = refineSamplingCentre;
    return this;
  }

  /**
   * Gets the invert mode.
   *
   * @return the invert mode
   */
  public InvertMode getInvertMode() {
    return invertMode;
  }

  /**
   * Sets the invert mode.
   *
   * @param invertMode the new invert mode
   * @return this instance
   */
  public StarshotSettings setInvertMode(InvertMode invertMode) {
    this.invertMode = invertMode;
    return this;
  }

  /**
   * Gets the fraction of the brightest pixels used to estimate the mechanical point.
   *
   * @return the auto centre fraction
   */
  public double getAutoCentreFraction() {
    return autoCentreFraction;
  }

  /**
   * Sets the fraction of the brightest pixels used to estimate the mechanical point.
   *
   * @param autoCentreFraction the new auto centre fraction
   * @return this instance
   */
  public StarshotSettings setAutoCentreFraction(double autoCentreFraction) {
    this.autoCentreFraction = autoCentreFraction;
    return this;
  }
}

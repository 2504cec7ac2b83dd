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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Analyses a star shot image to measure the mechanical isocentre accuracy (wobble) of a
 * radiotherapy treatment unit.
 *
 * <p>The analyzer has the states {@link StarshotState#UNLOADED UNLOADED},
 * {@link StarshotState#LOADED LOADED} and {@link StarshotState#ANALYZED ANALYZED}. Loading an image
 * resets the mechanical point. {@link #analyze()} estimates the mechanical point if it is not set,
 * locates the spokes around it and computes the wobble circle.
 *
 * <p>This class is not thread-safe. Independent instances may share a {@link StarshotImage}.
 */
public class Starshot {
  private final StarshotSettings settings;

  private StarshotState state = StarshotState.UNLOADED;
  private StarshotImage image;
  /** The smoothed image with bright spokes. Created on the first analysis. */
  private StarshotImage analysisImage;
  private MechanicalPoint mechanicalPoint = MechanicalPoint.unset();
  private SpokeDetection detection;
  private WobbleResult wobble;
  private final List<String> warnings = new ArrayList<>();
  private Logger logger = Logger.getLogger(Starshot.class.getName());

  /**
   * Create a new instance with the default settings.
   */
  public Starshot() {
    this(new StarshotSettings());
  }

  /**
   * Create a new instance.
   *
   * @param settings the settings
   * @throws ConfigurationException if the settings are invalid
   */
  public Starshot(StarshotSettings settings) {
    this.settings = ValidationUtils.checkNotNull(settings, "settings").copy().validate();
  }

  /**
   * Load the image. Any previous mechanical point and result is discarded.
   *
   * @param image the image
   */
  public void loadImage(StarshotImage image) {
    this.image = ValidationUtils.checkNotNull(image, "image");
    analysisImage = null;
    mechanicalPoint = MechanicalPoint.unset();
    warnings.clear();
    clearResult();
    state = StarshotState.LOADED;
  }

  /**
   * Load the ImageJ image using its spatial calibration.
   *
   * @param imp the image
   * @throws ConfigurationException if the image is not calibrated in a length unit
   * @see StarshotImage#fromImagePlus(ImagePlus)
   */
  public void loadImage(ImagePlus imp) {
    loadImage(StarshotImage.fromImagePlus(imp));
  }

  /**
   * Sets the mechanical point and warns if it is far from the previous point.
   *
   * @param point the point
   * @see #setMechanicalPoint(ImagePoint, boolean)
   */
  public void setMechanicalPoint(ImagePoint point) {
    setMechanicalPoint(point, true);
  }

  /**
   * Sets the mechanical point used to seed the radial sampling. Any previous result is discarded.
   *
   * <p>If {@code warnIfFarAway} is true and the point is further than the configured distance from
   * the current mechanical point (or the automatic estimate if none is set) a warning is logged and
   * added to the {@link #getWarnings() warnings}. The point is set regardless.
   *
   * @param point the point
   * @param warnIfFarAway set to true to warn if the point is far away
   * @throws IllegalStateException if no image is loaded
   */
  public void setMechanicalPoint(ImagePoint point, boolean warnIfFarAway) {
    checkLoaded();
    final MechanicalPoint newPoint = MechanicalPoint.user(point);
    if (warnIfFarAway) {
      final ImagePoint reference =
          mechanicalPoint.isSet() ? mechanicalPoint.getPoint() : estimateMechanicalPoint();
      final double distance = reference.distance(point);
      if (distance > settings.getFarAwayDistance()) {
        warn(String.format("Mechanical point %s is %s pixels from the %s point %s", point,
            MathUtils.rounded(distance),
            mechanicalPoint.isSet() ? "previous" : "estimated", reference));
      }
    }
    mechanicalPoint = newPoint;
    clearResult();
    state = StarshotState.LOADED;
  }

  /**
   * Analyse the image.
   *
   * <p>If the mechanical point is not set it is estimated from the image and recorded. The spokes
   * are located around the mechanical point and the wobble circle is computed from the spoke
   * lines. If {@link StarshotSettings#isRefineSamplingCentre()} is set the spokes are located again
   * around the wobble centre and the circle recomputed. Errors are not recovered; on failure the
   * analyzer remains in the loaded state.
   *
   * @throws IllegalStateException if no image is loaded
   * @throws DetectionException if the spokes cannot be detected
   * @throws GeometryException if the spoke lines have no well defined wobble circle
   * @throws BoundsException if the sampling circles do not fit in the image
   */
  public void analyze() {
    checkLoaded();
    clearResult();
    state = StarshotState.LOADED;

    final StarshotImage data = getAnalysisImage();
    if (!mechanicalPoint.isSet()) {
      mechanicalPoint = MechanicalPoint.auto(estimateMechanicalPoint());
      log(() -> "Estimated mechanical point " + mechanicalPoint.getPoint());
    }

    final SpokeLocator locator = new SpokeLocator(settings);
    locator.setLogger(logger);
    final WobbleSolver solver = new WobbleSolver(settings);
    SpokeDetection spokes = locator.locate(data, mechanicalPoint.getPoint());
    WobbleResult result = solve(solver, spokes);
    if (settings.isRefineSamplingCentre()) {
      final ImagePoint centre = result.getCentre();
      log(() -> "Refining the sampling centre to " + centre);
      spokes = locator.locate(data, centre);
      result = solve(solver, spokes);
    }

    detection = spokes;
    wobble = result;
    state = StarshotState.ANALYZED;
  }

  private WobbleResult solve(WobbleSolver solver, SpokeDetection spokes) {
    log(() -> "Fitted " + TextUtils.pleural(spokes.getSpokeCount(), "spoke line"));
    final WobbleResult result = solver.solve(spokes.getLines());
    log(() -> String.format("Wobble centre %s, radius %s px (%s)", result.getCentre(),
        MathUtils.rounded(result.getRadius()),
        TextUtils.pleural(result.getIterations(), "iteration")));
    return result;
  }

  private void clearResult() {
    detection = null;
    wobble = null;
  }

  private void checkLoaded() {
    if (state == StarshotState.UNLOADED) {
      throw new IllegalStateException("No image is loaded");
    }
  }

  private void checkAnalyzed() {
    if (state != StarshotState.ANALYZED) {
      throw new IllegalStateException("The image has not been analysed");
    }
  }

  /**
   * Gets the image with bright spokes, inverting the loaded image if required. The image is
   * smoothed with the configured Gaussian blur.
   *
   * @return the analysis image
   */
  private StarshotImage getAnalysisImage() {
    StarshotImage data = analysisImage;
    if (data == null) {
      data = image;
      final boolean invert;
      switch (settings.getInvertMode()) {
        case ALWAYS:
          invert = true;
          break;
        case NEVER:
          invert = false;
          break;
        default:
          invert = image.isInverted();
          break;
      }
      if (invert) {
        log(() -> "Inverting image");
        data = image.invert();
      }
      if (settings.getGaussianBlur() > 0) {
        log(() -> "Gaussian blur " + MathUtils.rounded(settings.getGaussianBlur()) + " px");
        data = data.blur(settings.getGaussianBlur());
      }
      analysisImage = data;
    }
    return data;
  }

  private ImagePoint estimateMechanicalPoint() {
    return MechanicalPointEstimator.estimate(getAnalysisImage(), settings.getAutoCentreFraction());
  }

  private void warn(String message) {
    warnings.add(message);
    if (logger != null) {
      logger.warning(message);
    }
  }

  private void log(Supplier<String> message) {
    if (logger != null) {
      logger.log(Level.FINE, message);
    }
  }

  /**
   * Gets the state.
   *
   * @return the state
   */
  public StarshotState getState() {
    return state;
  }

  /**
   * Gets a copy of the settings.
   *
   * @return the settings
   */
  public StarshotSettings getSettings() {
    return settings.copy();
  }

  /**
   * Gets the loaded image.
   *
   * @return the image (or null)
   */
  public StarshotImage getImage() {
    return image;
  }

  /**
   * Gets the mechanical point.
   *
   * @return the mechanical point
   */
  public MechanicalPoint getMechanicalPoint() {
    return mechanicalPoint;
  }

  /**
   * Gets the warnings raised since the image was loaded.
   *
   * @return the warnings
   */
  public List<String> getWarnings() {
    return Collections.unmodifiableList(new ArrayList<>(warnings));
  }

  /**
   * Gets the logger.
   *
   * @return the logger
   */
  public Logger getLogger() {
    return logger;
  }

  /**
   * Set the logger. If this is null then no messages are logged; warnings are still recorded.
   *
   * @param logger the logger to set
   */
  public void setLogger(Logger logger) {
    this.logger = logger;
  }

  /**
   * Gets the wobble result.
   *
   * @return the wobble result
   * @throws IllegalStateException if the image has not been analysed
   */
  public WobbleResult getWobbleResult() {
    checkAnalyzed();
    return wobble;
  }

  /**
   * Gets the spoke detection.
   *
   * @return the spoke detection
   * @throws IllegalStateException if the image has not been analysed
   */
  public SpokeDetection getSpokeDetection() {
    checkAnalyzed();
    return detection;
  }

  /**
   * Gets the wobble centre in pixel coordinates.
   *
   * @return the wobble centre
   * @throws IllegalStateException if the image has not been analysed
   */
  public ImagePoint getWobbleCentre() {
    return getWobbleResult().getCentre();
  }

  /**
   * Gets the wobble radius in mm.
   *
   * @return the wobble radius
   * @throws IllegalStateException if the image has not been analysed
   */
  public double getWobbleRadius() {
    return getWobbleResult().getRadius() * image.getPixelSize();
  }

  /**
   * Gets the wobble radius in pixels.
   *
   * @return the wobble radius
   * @throws IllegalStateException if the image has not been analysed
   */
  public double getWobbleRadiusPixels() {
    return getWobbleResult().getRadius();
  }

  /**
   * Gets the wobble diameter in mm.
   *
   * @return the wobble diameter
   * @throws IllegalStateException if the image has not been analysed
   */
  public double getWobbleDiameter() {
    return 2 * getWobbleRadius();
  }

  /**
   * Checks if the wobble radius is within the tolerance.
   *
   * @return true if passed
   * @throws IllegalStateException if the image has not been analysed
   */
  public boolean isWobblePassed() {
    return getWobbleRadius() <= settings.getWobbleTolerance();
  }

  /**
   * Gets the peak locations. There is one location for each end of each spoke.
   *
   * @return the peak locations
   * @throws IllegalStateException if the image has not been analysed
   * @see SpokeDetection#getPeakLocations()
   */
  public List<PeakLocation> getPeakLocations() {
    return getSpokeDetection().getPeakLocations();
  }

  /**
   * Gets the fitted spoke lines.
   *
   * @return the lines
   * @throws IllegalStateException if the image has not been analysed
   */
  public List<Line> getLines() {
    return getSpokeDetection().getLines();
  }

  /**
   * Gets a plain text summary of the result.
   *
   * @return the results string
   * @throws IllegalStateException if the image has not been analysed
   */
  public String getResultsString() {
    checkAnalyzed();
    final String newLine = System.lineSeparator();
    final ImagePoint centre = getWobbleCentre();
    final StringBuilder sb = new StringBuilder(256);
    sb.append("Result: ").append(isWobblePassed() ? "PASS" : "FAIL").append(newLine);
    sb.append("Tolerance: ").append(MathUtils.rounded(settings.getWobbleTolerance())).append(" mm")
        .append(newLine);
    sb.append("Wobble diameter: ").append(MathUtils.rounded(getWobbleDiameter(), 4))
        .append(" mm").append(newLine);
    sb.append("Wobble radius: ").append(MathUtils.rounded(getWobbleRadius(), 4)).append(" mm")
        .append(newLine);
    sb.append("Wobble centre (x, y): ").append(MathUtils.rounded(centre.getX(), 5)).append(", ")
        .append(MathUtils.rounded(centre.getY(), 5)).append(" px").append(newLine);
    sb.append("Spokes: ").append(detection.getSpokeCount()).append(newLine);
    final ImagePoint mech = mechanicalPoint.getPoint();
    sb.append("Mechanical point (x, y): ").append(MathUtils.rounded(mech.getX(), 5)).append(", ")
        .append(MathUtils.rounded(mech.getY(), 5)).append(" px [")
        .append(mechanicalPoint.getSource() == MechanicalPoint.Source.USER ? "user" : "auto")
        .append(']').append(newLine);
    return sb.toString();
  }
}

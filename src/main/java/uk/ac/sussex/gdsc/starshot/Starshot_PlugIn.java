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

import ij.IJ;
import ij.ImagePlus;
import ij.WindowManager;
import ij.gui.GenericDialog;
import ij.gui.OvalRoi;
import ij.gui.Overlay;
import ij.gui.PointRoi;
import ij.gui.Roi;
import ij.plugin.PlugIn;
import ij.process.FloatPolygon;
import java.awt.Color;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.starshot.StarshotSettings.InvertMode;

/**
 * Measure the mechanical isocentre wobble of a radiotherapy star shot image.
 *
 * <p>A single point ROI on the image can be used as the mechanical point.
 */
public class Starshot_PlugIn implements PlugIn {
  private static final String TITLE = "Star Shot";

  /** The current settings for the plugin instance. */
  private Settings settings;

  /**
   * Contains the settings that are the re-usable state of the plugin.
   */
  private static class Settings {
    /** The last settings used by the plugin. This should be updated after plugin execution. */
    private static final AtomicReference<Settings> lastSettings =
        new AtomicReference<>(new Settings());

    /** The pixel size in mm. Zero to use the image calibration. */
    double pixelSize;
    int spokeCount;
    double tolerance = StarshotSettings.DEFAULT_WOBBLE_TOLERANCE;
    int invertMode;
    double gaussianBlur = 2;
    boolean usePointRoi = true;
    boolean showOverlay = true;

    /**
     * Default constructor.
     */
    Settings() {
      // Do nothing
    }

    /**
     * Copy constructor.
     *
     * @param source the source
     */
    private Settings(Settings source) {
      pixelSize = source.pixelSize;
      spokeCount = source.spokeCount;
      tolerance = source.tolerance;
      invertMode = source.invertMode;
      gaussianBlur = source.gaussianBlur;
      usePointRoi = source.usePointRoi;
      showOverlay = source.showOverlay;
    }

    Settings copy() {
      return new Settings(this);
    }

    static Settings load() {
      return lastSettings.get().copy();
    }

    void save() {
      lastSettings.set(this);
    }
  }

  /** {@inheritDoc} */
  @Override
  public void run(String arg) {
    final ImagePlus imp = WindowManager.getCurrentImage();
    if (imp == null) {
      IJ.noImage();
      return;
    }

    if (!showDialog()) {
      return;
    }

    final ImagePoint point = settings.usePointRoi ? getPoint(imp.getRoi()) : null;
    final Starshot starshot;
    try {
      starshot = analyse(imp, settings.pixelSize, createSettings(settings), point);
    } catch (final StarshotException ex) {
      IJ.error(TITLE, ex.getMessage());
      return;
    }

    for (final String warning : starshot.getWarnings()) {
      IJ.log(TITLE + " warning: " + warning);
    }
    IJ.log(TITLE + ": " + imp.getTitle());
    IJ.log(starshot.getResultsString());
    if (settings.showOverlay) {
      imp.setOverlay(createOverlay(starshot));
    }
    IJ.showStatus(TITLE + " wobble diameter = " + MathUtils.rounded(starshot.getWobbleDiameter())
        + " mm");
  }

  private boolean showDialog() {
    settings = Settings.load();

    final GenericDialog gd = new GenericDialog(TITLE);
    gd.addMessage("Measure the mechanical isocentre wobble of a star shot image.\n"
        + "Use a pixel size of zero to use the image calibration.");
    gd.addNumericField("Pixel_size", settings.pixelSize, 4, 8, "mm");
    gd.addNumericField("Spoke_count", settings.spokeCount, 0, 6, "(0 = auto)");
    gd.addNumericField("Tolerance", settings.tolerance, 3, 6, "mm");
    gd.addChoice("Invert", InvertMode.getDescriptions(),
        InvertMode.getDescriptions()[settings.invertMode]);
    gd.addNumericField("Gaussian_blur", settings.gaussianBlur, 2, 6, "px");
    gd.addCheckbox("Use_point_ROI", settings.usePointRoi);
    gd.addCheckbox("Show_overlay", settings.showOverlay);

    gd.showDialog();
    if (gd.wasCanceled()) {
      return false;
    }

    settings.pixelSize = gd.getNextNumber();
    settings.spokeCount = (int) gd.getNextNumber();
    settings.tolerance = gd.getNextNumber();
    settings.invertMode = gd.getNextChoiceIndex();
    settings.gaussianBlur = gd.getNextNumber();
    settings.usePointRoi = gd.getNextBoolean();
    settings.showOverlay = gd.getNextBoolean();
    settings.save();

    if (gd.invalidNumber()) {
      IJ.error(TITLE, "Invalid number in the input fields");
      return false;
    }
    return true;
  }

  private static StarshotSettings createSettings(Settings settings) {
    return new StarshotSettings().setExpectedSpokeCount(settings.spokeCount)
        .setWobbleTolerance(settings.tolerance)
        .setInvertMode(InvertMode.fromOrdinal(settings.invertMode, InvertMode.AUTO))
        .setGaussianBlur(settings.gaussianBlur);
  }

  /**
   * Gets the first point of a point ROI.
   *
   * @param roi the roi
   * @return the point (or null)
   */
  static ImagePoint getPoint(Roi roi) {
    if (roi instanceof PointRoi) {
      final FloatPolygon poly = roi.getFloatPolygon();
      if (poly.npoints > 0) {
        return new ImagePoint(poly.xpoints[0], poly.ypoints[0]);
      }
    }
    return null;
  }

  /**
   * Analyse the image.
   *
   * @param imp the image
   * @param pixelSize the pixel size in mm; zero to use the image calibration
   * @param settings the settings
   * @param point the mechanical point (can be null)
   * @return the analysed star shot
   * @throws StarshotException if the analysis fails
   */
  static Starshot analyse(ImagePlus imp, double pixelSize, StarshotSettings settings,
      ImagePoint point) {
    final Starshot starshot = new Starshot(settings);
    if (pixelSize == 0) {
      starshot.loadImage(imp);
    } else {
      starshot.loadImage(StarshotImage.fromImagePlus(imp, pixelSize));
    }
    if (point != null) {
      starshot.setMechanicalPoint(point);
    }
    starshot.analyze();
    return starshot;
  }

  /**
   * Creates an overlay with the spoke lines, the spoke peaks and the wobble circle.
   *
   * @param starshot the analysed star shot
   * @return the overlay
   */
  static Overlay createOverlay(Starshot starshot) {
    final Overlay overlay = new Overlay();
    final StarshotImage image = starshot.getImage();
    // Long enough to cross the image
    final double length = (double) image.getWidth() + image.getHeight();
    for (final Line line : starshot.getLines()) {
      final ImagePoint anchor = line.getAnchor();
      final double dx = line.getDirectionX() * length;
      final double dy = line.getDirectionY() * length;
      final Roi roi = new ij.gui.Line(anchor.getX() - dx, anchor.getY() - dy, anchor.getX() + dx,
          anchor.getY() + dy);
      roi.setStrokeColor(Color.CYAN);
      overlay.add(roi);
    }

    final List<PeakLocation> peaks = starshot.getPeakLocations();
    final float[] x = new float[peaks.size()];
    final float[] y = new float[x.length];
    for (int i = 0; i < x.length; i++) {
      final ImagePoint p = peaks.get(i).getPoint();
      x[i] = (float) p.getX();
      y[i] = (float) p.getY();
    }
    final PointRoi points = new PointRoi(x, y, x.length);
    points.setStrokeColor(Color.YELLOW);
    overlay.add(points);

    final ImagePoint centre = starshot.getWobbleCentre();
    // Draw at least a few pixels so the circle is visible
    final double r = Math.max(2, starshot.getWobbleRadiusPixels());
    final Roi circle = new OvalRoi(centre.getX() - r, centre.getY() - r, 2 * r, 2 * r);
    circle.setStrokeColor(starshot.isWobblePassed() ? Color.GREEN : Color.RED);
    overlay.add(circle);
    return overlay;
  }
}

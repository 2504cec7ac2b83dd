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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.TextUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Locates the spokes of a star shot and fits a line to each spoke.
 *
 * <p>The image is sampled on circles around the mechanical point at radii spread across an annulus
 * that excludes the dense central region where the spokes overlap. Each circle crosses every spoke
 * twice so must yield two peaks per spoke. Peaks are tracked from the outermost circle inwards into
 * spoke-end clusters by angle, allowing for the drift in angle of a spoke end that does not point
 * at the sampling centre. The two ends of a spoke are opposite in the angular order, i.e. end
 * {@code k} and {@code k + spokeCount}. The points of both ends are fitted with a line.
 */
public class SpokeLocator {
  private final StarshotSettings settings;
  private Logger logger;

  /**
   * Create a new instance.
   *
   * @param settings the settings
   * @throws ConfigurationException if the settings are invalid
   */
  public SpokeLocator(StarshotSettings settings) {
    this.settings = ValidationUtils.checkNotNull(settings, "settings").copy().validate();
  }

  /**
   * Set the logger used for progress messages.
   *
   * @param logger the logger (can be null)
   */
  public void setLogger(Logger logger) {
    this.logger = logger;
  }

  /**
   * Locate the spokes.
   *
   * @param image the image (spokes are bright)
   * @param centre the sampling centre
   * @return the spoke detection
   * @throws BoundsException if the centre is outside the image or the sampling annulus is empty
   * @throws DetectionException if the peaks do not match the expected spoke count or cannot be
   *         assigned to spokes
   */
  public SpokeDetection locate(StarshotImage image, ImagePoint centre) {
    ValidationUtils.checkNotNull(image, "image");
    ValidationUtils.checkNotNull(centre, "centre");
    final double maxRadius = RadialProfiler.getMaximumRadius(image, centre);
    if (!(maxRadius > 0)) {
      throw new BoundsException("Sampling centre is not inside the image: " + centre);
    }
    final double[] radii = getRadii(maxRadius * settings.getInnerRadiusFraction(),
        maxRadius * settings.getOuterRadiusFraction(), settings.getRadiusCount());
    if (!(radii[radii.length - 1] >= 1)) {
      throw new BoundsException("Sampling centre is too close to the image edge: " + centre
          + " (maximum radius " + maxRadius + ")");
    }
    log(() -> String.format("Sampling %s around %s, radii: %s",
        TextUtils.pleural(radii.length, "circle"), centre, formatRadii(radii)));

    final RadialProfiler profiler = new RadialProfiler(settings.getAngularSamplingFactor());
    final CircleProfile[] profiles = profiler.profiles(image, centre, radii);

    // Peaks for each circle, outermost first, in order of angle
    final PeakLocation[][] circlePeaks = new PeakLocation[profiles.length][];
    for (int i = 0; i < profiles.length; i++) {
      circlePeaks[i] = findPeaks(profiles[i]);
    }

    final int spokeCount = getSpokeCount(circlePeaks[0].length);
    final int ends = 2 * spokeCount;
    for (int i = 0; i < profiles.length; i++) {
      if (circlePeaks[i].length != ends) {
        throw new DetectionException(String.format(
            "unexpected peak count: found %d at radius %s, expected %d for %s",
            circlePeaks[i].length, MathUtils.rounded(radii[i]), ends,
            TextUtils.pleural(spokeCount, "spoke")));
      }
    }
    log(() -> String.format("Found %s at each radius", TextUtils.pleural(ends, "peak")));

    final List<LocalList<PeakLocation>> clusters = cluster(circlePeaks, radii);

    final List<Line> lines = new ArrayList<>(spokeCount);
    for (int k = 0; k < spokeCount; k++) {
      final LocalList<PeakLocation> end1 = clusters.get(k);
      final LocalList<PeakLocation> end2 = clusters.get(k + spokeCount);
      final List<ImagePoint> points = new ArrayList<>(end1.size() + end2.size());
      addPoints(end1, points);
      addPoints(end2, points);
      lines.add(Line.fit(points));
    }

    final List<List<PeakLocation>> clusterLists = new ArrayList<>(ends);
    final List<PeakLocation> peakLocations = new ArrayList<>(ends);
    for (final LocalList<PeakLocation> cluster : clusters) {
      final List<PeakLocation> list = new ArrayList<>(cluster.size());
      for (int i = 0; i < cluster.size(); i++) {
        list.add(cluster.get(i));
      }
      clusterLists.add(Collections.unmodifiableList(list));
      peakLocations.add(summarise(centre, list));
    }

    return new SpokeDetection(centre, radii, Collections.unmodifiableList(clusterLists),
        Collections.unmodifiableList(peakLocations), Collections.unmodifiableList(lines));
  }

  /**
   * Gets the sampling radii evenly spaced between the inner and outer radius, outermost first.
   * A single radius uses the outer radius.
   *
   * @param inner the inner radius
   * @param outer the outer radius
   * @param count the count
   * @return the radii
   */
  static double[] getRadii(double inner, double outer, int count) {
    if (count == 1) {
      return new double[] {outer};
    }
    final double[] radii = new double[count];
    final double step = (outer - inner) / (count - 1);
    for (int i = 0; i < count; i++) {
      radii[i] = outer - i * step;
    }
    return radii;
  }

  /**
   * Find the peaks on the circle profile.
   *
   * @param profile the profile
   * @return the peak locations in order of angle
   */
  private PeakLocation[] findPeaks(CircleProfile profile) {
    final double separation =
        profile.toSamples(Math.toRadians(settings.getMinimumPeakSeparation()));
    final PeakDetector detector = new PeakDetector(settings.getPeakProminenceThreshold(),
        separation, settings.isUseFwhmCentre());
    final ProfilePeak[] peaks = detector.findPeaks(profile);
    final PeakLocation[] locations = new PeakLocation[peaks.length];
    for (int i = 0; i < peaks.length; i++) {
      final double position = peaks[i].getPosition();
      locations[i] = new PeakLocation(profile.getPoint(position), profile.getRadius(),
          profile.getAngle(position), peaks[i].getValue());
    }
    // The refined position may move a peak across the zero angle
    Arrays.sort(locations, (l1, l2) -> Double.compare(l1.getAngle(), l2.getAngle()));
    return locations;
  }

  /**
   * Gets the spoke count. If the expected count is zero then the count is derived from the peaks
   * of the outermost circle.
   *
   * @param outerPeaks the number of peaks on the outermost circle
   * @return the spoke count
   * @throws DetectionException if the count cannot be derived
   */
  private int getSpokeCount(int outerPeaks) {
    final int expected = settings.getExpectedSpokeCount();
    if (expected != 0) {
      return expected;
    }
    if (outerPeaks < 4 || outerPeaks % 2 != 0) {
      throw new DetectionException(
          "unexpected peak count: found " + outerPeaks + " at the outer radius, "
              + "require an even count of at least 4 to detect the spoke count");
    }
    final int count = outerPeaks / 2;
    log(() -> "Detected " + TextUtils.pleural(count, "spoke"));
    return count;
  }

  /**
   * Assign the peaks of each circle to the spoke ends defined by the outermost circle.
   *
   * <p>The angle of each spoke end on the next circle is predicted by linear extrapolation in
   * radius from the previous two circles. The second circle has no drift estimate and uses the
   * angle of the first.
   *
   * <p>Each circle is matched to the predicted angles using the cyclic shift of the angular order
   * that minimises the total change in angle. Every matched peak must be within the angular
   * tolerance of its predicted angle.
   *
   * @param circlePeaks the peaks of each circle (outermost first)
   * @param radii the radius of each circle
   * @return the clusters
   * @throws DetectionException if a peak is not within tolerance of its spoke end
   */
  private List<LocalList<PeakLocation>> cluster(PeakLocation[][] circlePeaks, double[] radii) {
    final PeakLocation[] outer = circlePeaks[0];
    final int ends = outer.length;
    final List<LocalList<PeakLocation>> clusters = new ArrayList<>(ends);
    final double[] current = new double[ends];
    final double[] previous = new double[ends];
    final double[] predicted = new double[ends];
    for (int k = 0; k < ends; k++) {
      final LocalList<PeakLocation> cluster = new LocalList<>(circlePeaks.length);
      cluster.add(outer[k]);
      clusters.add(cluster);
      current[k] = outer[k].getAngle();
    }

    final double tolerance = Math.toRadians(settings.getAngularClusterTolerance());
    for (int c = 1; c < circlePeaks.length; c++) {
      final double scale = c == 1 ? 0 : (radii[c] - radii[c - 1]) / (radii[c - 1] - radii[c - 2]);
      for (int k = 0; k < ends; k++) {
        predicted[k] = AngleUtils
            .normalise(current[k] + scale * AngleUtils.difference(previous[k], current[k]));
      }
      final PeakLocation[] peaks = circlePeaks[c];
      final int shift = getBestShift(predicted, peaks);
      for (int k = 0; k < ends; k++) {
        final PeakLocation peak = peaks[(k + shift) % ends];
        final double distance = AngleUtils.distance(predicted[k], peak.getAngle());
        if (distance > tolerance) {
          throw new DetectionException(String.format(
              "Peak at radius %s, angle %s is %s degrees from the predicted angle of spoke end %d"
                  + " (tolerance %s)",
              MathUtils.rounded(peak.getRadius()),
              MathUtils.rounded(Math.toDegrees(peak.getAngle())),
              MathUtils.rounded(Math.toDegrees(distance)), k,
              MathUtils.rounded(settings.getAngularClusterTolerance())));
        }
        clusters.get(k).add(peak);
        previous[k] = current[k];
        current[k] = peak.getAngle();
      }
    }
    return clusters;
  }

  /**
   * Gets the cyclic shift {@code s} such that assigning {@code peaks[(k + s) % n]} to end
   * {@code k} minimises the total angular distance.
   *
   * @param angles the current angle of each spoke end
   * @param peaks the peaks
   * @return the shift
   */
  private static int getBestShift(double[] angles, PeakLocation[] peaks) {
    final int n = angles.length;
    int best = 0;
    double min = Double.POSITIVE_INFINITY;
    for (int s = 0; s < n; s++) {
      double sum = 0;
      for (int k = 0; k < n && sum < min; k++) {
        sum += AngleUtils.distance(angles[k], peaks[(k + s) % n].getAngle());
      }
      if (sum < min) {
        min = sum;
        best = s;
      }
    }
    return best;
  }

  private static void addPoints(LocalList<PeakLocation> cluster, List<ImagePoint> points) {
    for (int i = 0; i < cluster.size(); i++) {
      points.add(cluster.get(i).getPoint());
    }
  }

  /**
   * Create a summary location for the peaks of a spoke end using the centroid.
   *
   * @param centre the sampling centre
   * @param peaks the peaks
   * @return the peak location
   */
  private static PeakLocation summarise(ImagePoint centre, List<PeakLocation> peaks) {
    double sx = 0;
    double sy = 0;
    double sr = 0;
    double sv = 0;
    for (final PeakLocation peak : peaks) {
      sx += peak.getPoint().getX();
      sy += peak.getPoint().getY();
      sr += peak.getRadius();
      sv += peak.getValue();
    }
    final int n = peaks.size();
    final ImagePoint point = new ImagePoint(sx / n, sy / n);
    final double angle = AngleUtils
        .normalise(Math.atan2(point.getY() - centre.getY(), point.getX() - centre.getX()));
    return new PeakLocation(point, sr / n, angle, sv / n);
  }

  private static String formatRadii(double[] radii) {
    final StringBuilder sb = new StringBuilder();
    for (final double r : radii) {
      if (sb.length() != 0) {
        sb.append(", ");
      }
      sb.append(MathUtils.rounded(r));
    }
    return sb.toString();
  }

  private void log(Supplier<String> message) {
    if (logger != null) {
      logger.log(Level.FINE, message);
    }
  }
}

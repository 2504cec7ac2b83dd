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

import java.util.List;

/**
 * The result of locating the spokes of a star shot.
 */
public final class SpokeDetection {
  private final ImagePoint centre;
  private final double[] radii;
  private final List<List<PeakLocation>> clusters;
  private final List<PeakLocation> peakLocations;
  private final List<Line> lines;

  /**
   * Create a new instance.
   *
   * @param centre the sampling centre
   * @param radii the sampling radii
   * @param clusters the peaks for each spoke end (unmodifiable)
   * @param peakLocations the summary location of each spoke end (unmodifiable)
   * @param lines the spoke lines (unmodifiable)
   */
  SpokeDetection(ImagePoint centre, double[] radii, List<List<PeakLocation>> clusters,
      List<PeakLocation> peakLocations, List<Line> lines) {
    this.centre = centre;
    this.radii = radii;
    this.clusters = clusters;
    this.peakLocations = peakLocations;
    this.lines = lines;
  }

  /**
   * Gets the sampling centre.
   *
   * @return the centre
   */
  public ImagePoint getCentre() {
    return centre;
  }

  /**
   * Gets the sampling radii, outermost first.
   *
   * @return the radii
   */
  public double[] getRadii() {
    return radii.clone();
  }

  /**
   * Gets the number of spokes.
   *
   * @return the spoke count
   */
  public int getSpokeCount() {
    return lines.size();
  }

  /**
   * Gets the peaks assigned to each spoke end. Spoke end {@code k} and {@code k + spokeCount} are
   * the two ends of spoke {@code k}.
   *
   * @return the clusters
   */
  public List<List<PeakLocation>> getClusters() {
    return clusters;
  }

  /**
   * Gets the location of each spoke end. This is the centroid of the peaks assigned to the end,
   * ordered by angle. There are two locations per spoke.
   *
   * @return the peak locations
   */
  public List<PeakLocation> getPeakLocations() {
    return peakLocations;
  }

  /**
   * Gets the fitted spoke lines.
   *
   * @return the lines
   */
  public List<Line> getLines() {
    return lines;
  }
}

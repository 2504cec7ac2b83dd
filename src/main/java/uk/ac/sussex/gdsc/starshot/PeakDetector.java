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

import java.util.Arrays;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.MathUtils;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Finds local maxima in a 1D profile filtered by prominence and separation.
 *
 * <p>The prominence of a peak is its height above the higher of the two lowest points found when
 * moving from the peak in each direction until a higher sample (or the end of the profile) is
 * reached. A cyclic profile wraps at the ends; the highest peak of a cyclic profile has the profile
 * minimum as its reference.
 *
 * <p>Peaks closer than the minimum separation are resolved in favour of the higher peak.
 */
public class PeakDetector {
  private final double prominenceThreshold;
  private final double minimumSeparation;
  private final boolean fwhmCentre;

  /**
   * Create a new instance.
   *
   * @param prominenceThreshold the prominence threshold as a fraction of the profile range
   *        ({@code max - min})
   * @param minimumSeparation the minimum separation between peaks (in samples)
   * @param fwhmCentre set to true to refine the peak centre to the midpoint of the full width at
   *        half maximum; otherwise use parabolic interpolation of the maximum
   */
  public PeakDetector(double prominenceThreshold, double minimumSeparation, boolean fwhmCentre) {
    ValidationUtils.checkArgument(prominenceThreshold >= 0 && prominenceThreshold < 1,
        "Prominence threshold must be in [0, 1): %s", prominenceThreshold);
    ValidationUtils.checkArgument(minimumSeparation >= 0 && Double.isFinite(minimumSeparation),
        "Minimum separation must be positive: %s", minimumSeparation);
    this.prominenceThreshold = prominenceThreshold;
    this.minimumSeparation = minimumSeparation;
    this.fwhmCentre = fwhmCentre;
  }

  /**
   * Find the peaks in the profile.
   *
   * @param profile the profile
   * @return the peaks (in order of position)
   */
  public ProfilePeak[] findPeaks(CircleProfile profile) {
    return findPeaks(profile.getValues(), true);
  }

  /**
   * Find the peaks in the values.
   *
   * <p>For a linear (non-cyclic) profile the end samples cannot be peaks.
   *
   * @param values the values
   * @param cyclic true if the values wrap at the ends
   * @return the peaks (in order of position)
   */
  public ProfilePeak[] findPeaks(double[] values, boolean cyclic) {
    final int n = values.length;
    if (n < 3) {
      return new ProfilePeak[0];
    }
    final double[] limits = MathUtils.limits(values);
    final double range = limits[1] - limits[0];
    if (!(range > 0)) {
      // Flat (or non-finite) profile
      return new ProfilePeak[0];
    }
    final double minProminence = prominenceThreshold * range;

    final LocalList<ProfilePeak> candidates = new LocalList<>();
    final int start = cyclic ? 0 : 1;
    final int end = cyclic ? n : n - 1;
    for (int i = start; i < end; i++) {
      final double v = values[i];
      if (v > values[previous(i, n)] && v >= values[next(i, n)]) {
        final double reference = getReference(values, i, cyclic);
        final double prominence = v - reference;
        if (prominence > minProminence && prominence > 0) {
          candidates.add(new ProfilePeak(i, i, v, prominence));
        }
      }
    }

    // Resolve close peaks, highest first
    final ProfilePeak[] sorted = new ProfilePeak[candidates.size()];
    for (int i = 0; i < sorted.length; i++) {
      sorted[i] = candidates.get(i);
    }
    Arrays.sort(sorted, (p1, p2) -> {
      final int result = Double.compare(p2.getValue(), p1.getValue());
      return result != 0 ? result : Integer.compare(p1.getIndex(), p2.getIndex());
    });
    final LocalList<ProfilePeak> peaks = new LocalList<>(sorted.length);
    for (final ProfilePeak candidate : sorted) {
      if (isSeparated(candidate, peaks, n, cyclic)) {
        peaks.add(candidate);
      }
    }

    final ProfilePeak[] result = new ProfilePeak[peaks.size()];
    for (int i = 0; i < result.length; i++) {
      final ProfilePeak peak = peaks.get(i);
      result[i] = new ProfilePeak(peak.getIndex(), refine(values, peak, cyclic), peak.getValue(),
          peak.getProminence());
    }
    Arrays.sort(result, (p1, p2) -> Integer.compare(p1.getIndex(), p2.getIndex()));
    return result;
  }

  private static int previous(int index, int n) {
    return index == 0 ? n - 1 : index - 1;
  }

  private static int next(int index, int n) {
    return index == n - 1 ? 0 : index + 1;
  }

  /**
   * Gets the reference level for the prominence of the peak at the index. This is the higher of
   * the minimum values on each side of the peak up to the next higher sample.
   *
   * @param values the values
   * @param index the index
   * @param cyclic true if the values wrap at the ends
   * @return the reference level
   */
  private static double getReference(double[] values, int index, boolean cyclic) {
    final int n = values.length;
    final double height = values[index];

    double leftMin = height;
    for (int j = index - 1, steps = 1; steps < n; j--, steps++) {
      if (j < 0) {
        if (!cyclic) {
          break;
        }
        j += n;
      }
      final double v = values[j];
      if (v > height) {
        break;
      }
      if (leftMin > v) {
        leftMin = v;
      }
    }

    double rightMin = height;
    for (int j = index + 1, steps = 1; steps < n; j++, steps++) {
      if (j == n) {
        if (!cyclic) {
          break;
        }
        j = 0;
      }
      final double v = values[j];
      if (v > height) {
        break;
      }
      if (rightMin > v) {
        rightMin = v;
      }
    }
    return Math.max(leftMin, rightMin);
  }

  private boolean isSeparated(ProfilePeak candidate, LocalList<ProfilePeak> peaks, int n,
      boolean cyclic) {
    for (int i = 0; i < peaks.size(); i++) {
      int distance = Math.abs(peaks.get(i).getIndex() - candidate.getIndex());
      if (cyclic) {
        distance = Math.min(distance, n - distance);
      }
      if (distance <= minimumSeparation) {
        return false;
      }
    }
    return true;
  }

  /**
   * Refine the position of the peak.
   *
   * @param values the values
   * @param peak the peak
   * @param cyclic true if the values wrap at the ends
   * @return the position
   */
  private double refine(double[] values, ProfilePeak peak, boolean cyclic) {
    if (fwhmCentre) {
      final double centre = getFwhmCentre(values, peak, cyclic);
      if (!Double.isNaN(centre)) {
        return centre;
      }
    }
    return getParabolicCentre(values, peak.getIndex(), cyclic);
  }

  /**
   * Gets the midpoint of the two positions where the profile crosses half the peak prominence.
   * Positions are found by linear interpolation between samples.
   *
   * @param values the values
   * @param peak the peak
   * @param cyclic true if the values wrap at the ends
   * @return the centre (or NaN if a crossing is not found)
   */
  static double getFwhmCentre(double[] values, ProfilePeak peak, boolean cyclic) {
    final int n = values.length;
    final int index = peak.getIndex();
    final double half = peak.getValue() - peak.getProminence() / 2;

    // Walk using unwrapped indices
    int lower = index;
    while (values[wrap(lower, n)] >= half) {
      lower--;
      if (index - lower >= n || (!cyclic && lower < 0)) {
        return Double.NaN;
      }
    }
    int upper = index;
    while (values[wrap(upper, n)] >= half) {
      upper++;
      if (upper - index >= n || (!cyclic && upper >= n)) {
        return Double.NaN;
      }
    }

    final double below1 = values[wrap(lower, n)];
    final double above1 = values[wrap(lower + 1, n)];
    final double left = lower + (half - below1) / (above1 - below1);
    final double above2 = values[wrap(upper - 1, n)];
    final double below2 = values[wrap(upper, n)];
    final double right = upper - 1 + (above2 - half) / (above2 - below2);
    final double centre = (left + right) / 2;
    return cyclic ? normalise(centre, n) : centre;
  }

  /**
   * Gets the position of the maximum of a parabola through the peak sample and its neighbours.
   *
   * @param values the values
   * @param index the index of the peak sample
   * @param cyclic true if the values wrap at the ends
   * @return the centre
   */
  static double getParabolicCentre(double[] values, int index, boolean cyclic) {
    final int n = values.length;
    if (!cyclic && (index == 0 || index == n - 1)) {
      return index;
    }
    final double a = values[wrap(index - 1, n)];
    final double b = values[index];
    final double c = values[wrap(index + 1, n)];
    final double denom = a - 2 * b + c;
    if (!(denom < 0)) {
      return index;
    }
    final double offset = MathUtils.clip(-0.5, 0.5, 0.5 * (a - c) / denom);
    final double centre = index + offset;
    return cyclic ? normalise(centre, n) : centre;
  }

  private static int wrap(int index, int n) {
    final int i = index % n;
    return i < 0 ? i + n : i;
  }

  private static double normalise(double position, int n) {
    double p = position % n;
    if (p < 0) {
      p += n;
    }
    return p == n ? 0 : p;
  }
}

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

/**
 * A local maximum in a 1D profile.
 */
public final class ProfilePeak {
  /** The index of the maximum sample. */
  private final int index;
  /** The refined (sub-sample) position. */
  private final double position;
  /** The value of the maximum sample. */
  private final double value;
  /** The height of the peak above the higher of its two bounding minima. */
  private final double prominence;

  /**
   * Create a new instance.
   *
   * @param index the index
   * @param position the position
   * @param value the value
   * @param prominence the prominence
   */
  ProfilePeak(int index, double position, double value, double prominence) {
    this.index = index;
    this.position = position;
    this.value = value;
    this.prominence = prominence;
  }

  /**
   * Gets the index of the maximum sample.
   *
   * @return the index
   */
  public int getIndex() {
    return index;
  }

  /**
   * Gets the refined position of the peak centre.
   *
   * @return the position
   */
  public double getPosition() {
    return position;
  }

  /**
   * Gets the value of the maximum sample.
   *
   * @return the value
   */
  public double getValue() {
    return value;
  }

  /**
   * Gets the prominence.
   *
   * @return the prominence
   */
  public double getProminence() {
    return prominence;
  }

  @Override
  public String toString() {
    return "Peak[" + position + " = " + value + ", prominence=" + prominence + "]";
  }
}

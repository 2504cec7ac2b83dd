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
 * Stores an immutable 2D point in image pixel coordinates.
 *
 * <p>The x coordinate is the image column and the y coordinate is the image row. Pixel (i, j) is
 * centred on the coordinate (i, j).
 */
public final class ImagePoint {
  private final double x;
  private final double y;

  /**
   * Create a new instance.
   *
   * @param x the x coordinate (column)
   * @param y the y coordinate (row)
   */
  public ImagePoint(double x, double y) {
    this.x = x;
    this.y = y;
  }

  /**
   * Gets the x coordinate.
   *
   * @return the x
   */
  public double getX() {
    return x;
  }

  /**
   * Gets the y coordinate.
   *
   * @return the y
   */
  public double getY() {
    return y;
  }

  /**
   * Gets the row. This is the y coordinate.
   *
   * @return the row
   */
  public double getRow() {
    return y;
  }

  /**
   * Gets the column. This is the x coordinate.
   *
   * @return the column
   */
  public double getColumn() {
    return x;
  }

  /**
   * Get the Euclidean distance to the other point.
   *
   * @param other the other point
   * @return the distance
   */
  public double distance(ImagePoint other) {
    return distance(other.x, other.y);
  }

  /**
   * Get the Euclidean distance to the coordinates.
   *
   * @param x the x
   * @param y the y
   * @return the distance
   */
  public double distance(double x, double y) {
    return Math.hypot(this.x - x, this.y - y);
  }

  /**
   * Checks if the coordinates are finite.
   *
   * @return true if finite
   */
  public boolean isFinite() {
    return Double.isFinite(x) && Double.isFinite(y);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ImagePoint)) {
      return false;
    }
    final ImagePoint other = (ImagePoint) obj;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(x) + Double.hashCode(y);
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}

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
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealVector;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * An immutable infinite 2D line defined by an anchor point and a unit direction.
 */
public final class Line {
  /** Threshold for the cross product of two directions to be considered parallel. */
  private static final double PARALLEL_THRESHOLD = 1e-12;

  private final ImagePoint anchor;
  private final double dx;
  private final double dy;

  /**
   * Create a new instance.
   *
   * @param anchor a point on the line
   * @param dx the x component of the direction
   * @param dy the y component of the direction
   * @throws GeometryException if the direction has zero length
   */
  public Line(ImagePoint anchor, double dx, double dy) {
    ValidationUtils.checkNotNull(anchor, "anchor");
    final double length = Math.hypot(dx, dy);
    if (!(length > 0 && length < Double.POSITIVE_INFINITY)) {
      throw new GeometryException("Invalid line direction: " + dx + ", " + dy);
    }
    this.anchor = anchor;
    this.dx = dx / length;
    this.dy = dy / length;
  }

  /**
   * Create a line through two points.
   *
   * @param p1 the first point
   * @param p2 the second point
   * @return the line
   * @throws GeometryException if the points are the same
   */
  public static Line throughPoints(ImagePoint p1, ImagePoint p2) {
    return new Line(p1, p2.getX() - p1.getX(), p2.getY() - p1.getY());
  }

  /**
   * Create a line through the point with the given angle. The angle is measured from the +x axis
   * towards +y.
   *
   * @param anchor the anchor
   * @param angle the angle (radians)
   * @return the line
   */
  public static Line fromAngle(ImagePoint anchor, double angle) {
    return new Line(anchor, Math.cos(angle), Math.sin(angle));
  }

  /**
   * Fit a line to the points by total least squares. This minimises the sum of the squared
   * perpendicular distances of the points to the line and is independent of the line orientation.
   *
   * <p>The line passes through the centroid of the points in the direction of the principal axis
   * of the scatter matrix.
   *
   * @param points the points
   * @return the line
   * @throws GeometryException if there are fewer than two distinct points
   */
  public static Line fit(List<ImagePoint> points) {
    ValidationUtils.checkNotNull(points, "points");
    if (points.size() < 2) {
      throw new GeometryException("Line fit requires at least 2 points: " + points.size());
    }
    double sx = 0;
    double sy = 0;
    for (final ImagePoint p : points) {
      sx += p.getX();
      sy += p.getY();
    }
    final int n = points.size();
    final double mx = sx / n;
    final double my = sy / n;

    // Central moments
    double sxx = 0;
    double sxy = 0;
    double syy = 0;
    for (final ImagePoint p : points) {
      final double x = p.getX() - mx;
      final double y = p.getY() - my;
      sxx += x * x;
      sxy += x * y;
      syy += y * y;
    }
    if (sxx + syy == 0) {
      throw new GeometryException("Line fit requires at least 2 distinct points");
    }

    final EigenDecomposition decomposition =
        new EigenDecomposition(new Array2DRowRealMatrix(new double[][] {{sxx, sxy}, {sxy, syy}}));
    final double[] eigenvalues = decomposition.getRealEigenvalues();
    final int major = eigenvalues[0] >= eigenvalues[1] ? 0 : 1;
    final RealVector direction = decomposition.getEigenvector(major);
    return new Line(new ImagePoint(mx, my), direction.getEntry(0), direction.getEntry(1));
  }

  /**
   * Gets the anchor point.
   *
   * @return the anchor
   */
  public ImagePoint getAnchor() {
    return anchor;
  }

  /**
   * Gets the x component of the unit direction.
   *
   * @return the direction x
   */
  public double getDirectionX() {
    return dx;
  }

  /**
   * Gets the y component of the unit direction.
   *
   * @return the direction y
   */
  public double getDirectionY() {
    return dy;
  }

  /**
   * Gets the orientation of the line in {@code [0, pi)}.
   *
   * @return the angle (radians)
   */
  public double getAngle() {
    final double angle = Math.atan2(dy, dx);
    if (angle < 0) {
      return angle + Math.PI;
    }
    return angle == Math.PI ? 0 : angle;
  }

  /**
   * Gets the perpendicular distance from the point to the line.
   *
   * @param point the point
   * @return the distance
   */
  public double distance(ImagePoint point) {
    return distance(point.getX(), point.getY());
  }

  /**
   * Gets the perpendicular distance from the coordinates to the line.
   *
   * @param x the x
   * @param y the y
   * @return the distance
   */
  public double distance(double x, double y) {
    return Math.abs(signedDistance(x, y));
  }

  /**
   * Gets the signed perpendicular distance from the coordinates to the line. The sign indicates
   * the side of the line.
   *
   * @param x the x
   * @param y the y
   * @return the signed distance
   */
  public double signedDistance(double x, double y) {
    return (x - anchor.getX()) * dy - (y - anchor.getY()) * dx;
  }

  /**
   * Gets the smallest angle between this line and the other line in {@code [0, pi/2]}.
   *
   * @param other the other line
   * @return the angle (radians)
   */
  public double angleTo(Line other) {
    final double cross = Math.abs(dx * other.dy - dy * other.dx);
    final double dot = Math.abs(dx * other.dx + dy * other.dy);
    return Math.atan2(cross, dot);
  }

  /**
   * Gets the intersection with the other line.
   *
   * @param other the other line
   * @return the intersection (or null if the lines are parallel)
   */
  public ImagePoint intersection(Line other) {
    final double cross = dx * other.dy - dy * other.dx;
    if (Math.abs(cross) < PARALLEL_THRESHOLD) {
      return null;
    }
    final double ex = other.anchor.getX() - anchor.getX();
    final double ey = other.anchor.getY() - anchor.getY();
    final double t = (ex * other.dy - ey * other.dx) / cross;
    return new ImagePoint(anchor.getX() + t * dx, anchor.getY() + t * dy);
  }

  @Override
  public String toString() {
    return "Line[" + anchor + ", direction=(" + dx + ", " + dy + ")]";
  }
}

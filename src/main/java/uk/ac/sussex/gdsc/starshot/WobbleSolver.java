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
import java.util.List;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Computes the wobble circle: the smallest circle that touches every line.
 *
 * <p>The circle centre minimises the maximum perpendicular distance to the lines and the radius is
 * that distance. This is solved as the linear program: minimise {@code r} subject to
 * {@code -r <= s_k(x, y) <= r} for the signed distance {@code s_k} to each line. At the optimum the
 * circle is typically tangent to three lines on different sides of the centre.
 *
 * <p>Coordinates are taken relative to the centroid of the pairwise line intersections. The simplex
 * search is capped at a maximum number of iterations.
 *
 * <p>This class is immutable and thread-safe.
 */
public class WobbleSolver {
  /** The minimum angle between two lines for the intersection to be used as a reference. */
  private static final double MIN_INTERSECTION_ANGLE = Math.toRadians(1);

  private final int maxIterations;

  /**
   * Create a new instance.
   *
   * @param maxIterations the maximum number of simplex iterations
   */
  public WobbleSolver(int maxIterations) {
    ValidationUtils.checkArgument(maxIterations > 0, "Max iterations must be strictly positive: %d",
        maxIterations);
    this.maxIterations = maxIterations;
  }

  /**
   * Create a new instance using the solver settings.
   *
   * @param settings the settings
   */
  public WobbleSolver(StarshotSettings settings) {
    this(settings.getMaxSolverIterations());
  }

  /**
   * Compute the wobble circle for the lines.
   *
   * @param lines the lines
   * @return the result
   * @throws GeometryException if there are fewer than 2 lines, all lines are parallel or the
   *         solution is not found within the iteration limit
   */
  public WobbleResult solve(List<Line> lines) {
    ValidationUtils.checkNotNull(lines, "lines");
    if (lines.size() < 2) {
      throw new GeometryException("Wobble circle requires at least 2 lines: " + lines.size());
    }
    final Line[] data = lines.toArray(new Line[0]);

    final List<ImagePoint> intersections = getIntersections(data);
    if (intersections.isEmpty()) {
      throw new GeometryException("Wobble circle is undefined for parallel lines");
    }
    double sx = 0;
    double sy = 0;
    for (final ImagePoint p : intersections) {
      sx += p.getX();
      sy += p.getY();
    }
    final double ox = sx / intersections.size();
    final double oy = sy / intersections.size();

    // Variables (x, y, r) relative to the origin.
    // Signed distance: s = dy * x - dx * y + c
    final List<LinearConstraint> constraints = new ArrayList<>(2 * data.length);
    for (final Line line : data) {
      final double dx = line.getDirectionX();
      final double dy = line.getDirectionY();
      final double c = line.signedDistance(ox, oy);
      // s <= r
      constraints.add(new LinearConstraint(new double[] {dy, -dx, -1}, Relationship.LEQ, -c));
      // -s <= r
      constraints.add(new LinearConstraint(new double[] {-dy, dx, -1}, Relationship.LEQ, c));
    }

    final SimplexSolver solver = new SimplexSolver();
    final PointValuePair optimum;
    try {
      optimum = solver.optimize(new MaxIter(maxIterations),
          new LinearObjectiveFunction(new double[] {0, 0, 1}, 0),
          new LinearConstraintSet(constraints), GoalType.MINIMIZE, new NonNegativeConstraint(false),
          PivotSelectionRule.BLAND);
    } catch (final MathIllegalStateException ex) {
      throw new GeometryException("Wobble circle search failed: " + ex.getMessage(), ex);
    }

    final double[] point = optimum.getPoint();
    final ImagePoint centre = new ImagePoint(ox + point[0], oy + point[1]);
    // Evaluate directly to remove round-off in the radius variable
    final double radius = getMaximumDistance(data, centre.getX(), centre.getY());
    checkCentre(centre, radius, intersections);
    return new WobbleResult(centre, radius, solver.getIterations());
  }

  /**
   * Gets the intersections of all pairs of lines that are not near parallel.
   *
   * @param lines the lines
   * @return the intersections
   */
  private static List<ImagePoint> getIntersections(Line[] lines) {
    final List<ImagePoint> list = new ArrayList<>();
    for (int i = 0; i < lines.length; i++) {
      for (int j = i + 1; j < lines.length; j++) {
        if (lines[i].angleTo(lines[j]) > MIN_INTERSECTION_ANGLE) {
          final ImagePoint p = lines[i].intersection(lines[j]);
          if (p != null) {
            list.add(p);
          }
        }
      }
    }
    return list;
  }

  /**
   * Gets the maximum perpendicular distance from the coordinates to any line.
   *
   * @param lines the lines
   * @param x the x
   * @param y the y
   * @return the maximum distance
   */
  static double getMaximumDistance(Line[] lines, double x, double y) {
    double max = 0;
    for (final Line line : lines) {
      final double d = line.distance(x, y);
      if (max < d) {
        max = d;
      }
    }
    return max;
  }

  /**
   * Check the centre is within the bounding region of the line intersections. The region is
   * extended by its own size and the radius to allow for lines that cross at shallow angles. A
   * centre outside this region indicates a failed search.
   *
   * @param centre the centre
   * @param radius the radius
   * @param intersections the intersections
   * @throws GeometryException if the centre is outside the region
   */
  private static void checkCentre(ImagePoint centre, double radius,
      List<ImagePoint> intersections) {
    double minx = Double.POSITIVE_INFINITY;
    double maxx = Double.NEGATIVE_INFINITY;
    double miny = Double.POSITIVE_INFINITY;
    double maxy = Double.NEGATIVE_INFINITY;
    for (final ImagePoint p : intersections) {
      minx = Math.min(minx, p.getX());
      maxx = Math.max(maxx, p.getX());
      miny = Math.min(miny, p.getY());
      maxy = Math.max(maxy, p.getY());
    }
    final double margin = radius + Math.max(1, Math.max(maxx - minx, maxy - miny));
    final double x = centre.getX();
    final double y = centre.getY();
    if (!(radius >= 0) || x < minx - margin || x > maxx + margin || y < miny - margin
        || y > maxy + margin) {
      throw new GeometryException(
          "Wobble centre " + centre + " is outside the region of the line intersections");
    }
  }
}

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

import java.util.Objects;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * The approximate rotation centre used to seed the radial sampling of a star shot.
 *
 * <p>The point is either unset, set by the user, or estimated automatically from the image.
 */
public final class MechanicalPoint {
  /** The unset instance. */
  private static final MechanicalPoint UNSET = new MechanicalPoint(Source.UNSET, null);

  private final Source source;
  private final ImagePoint point;

  /**
   * The source of the mechanical point.
   */
  public enum Source {
    /** No point has been set. */
    UNSET,
    /** The point was supplied by the user. */
    USER,
    /** The point was estimated from the image. */
    AUTO;
  }

  private MechanicalPoint(Source source, ImagePoint point) {
    this.source = source;
    this.point = point;
  }

  /**
   * Get the unset mechanical point.
   *
   * @return the mechanical point
   */
  public static MechanicalPoint unset() {
    return UNSET;
  }

  /**
   * Create a mechanical point supplied by the user.
   *
   * @param point the point
   * @return the mechanical point
   */
  public static MechanicalPoint user(ImagePoint point) {
    return new MechanicalPoint(Source.USER, checkPoint(point));
  }

  /**
   * Create a mechanical point estimated from the image.
   *
   * @param point the point
   * @return the mechanical point
   */
  public static MechanicalPoint auto(ImagePoint point) {
    return new MechanicalPoint(Source.AUTO, checkPoint(point));
  }

  private static ImagePoint checkPoint(ImagePoint point) {
    ValidationUtils.checkNotNull(point, "point");
    ValidationUtils.checkArgument(point.isFinite(), "Point is not finite: %s", point);
    return point;
  }

  /**
   * Checks if the point is set.
   *
   * @return true if set
   */
  public boolean isSet() {
    return source != Source.UNSET;
  }

  /**
   * Gets the source.
   *
   * @return the source
   */
  public Source getSource() {
    return source;
  }

  /**
   * Gets the point.
   *
   * @return the point
   * @throws IllegalStateException if the point is not set
   */
  public ImagePoint getPoint() {
    if (point == null) {
      throw new IllegalStateException("Mechanical point is not set");
    }
    return point;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MechanicalPoint)) {
      return false;
    }
    final MechanicalPoint other = (MechanicalPoint) obj;
    return source == other.source && Objects.equals(point, other.point);
  }

  @Override
  public int hashCode() {
    return 31 * source.hashCode() + Objects.hashCode(point);
  }

  @Override
  public String toString() {
    return isSet() ? point + " [" + source + "]" : source.toString();
  }
}

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
 * Thrown when a sampling circle does not lie fully inside the image.
 */
public class BoundsException extends StarshotException {
  private static final long serialVersionUID = 20220913003L;

  /**
   * Create a new instance.
   *
   * @param message the message
   */
  public BoundsException(String message) {
    super(message);
  }

  /**
   * Create a new instance.
   *
   * @param message the message
   * @param cause the cause
   */
  public BoundsException(String message, Throwable cause) {
    super(message, cause);
  }
}

//******************************************************************************
//
// Title:       Powder Phase X.
// Description: Powder Phase X - Multi-phase powder diffraction analysis.
// Copyright:   Copyright (c) Powder Phase X developers 2025-2026.
//
// This file is part of Powder Phase X.
//
// Powder Phase X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Powder Phase X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Powder Phase X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
//******************************************************************************
package ppx.powder;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.max;

import java.util.Arrays;
import javax.annotation.Nullable;

/**
 * A measured powder diffraction pattern: intensities (and optional uncertainties) on a strictly
 * increasing 2-theta grid in degrees.
 *
 * <p>Arrays are copied on the way in and on the way out, so a pattern never changes after
 * construction.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ExperimentalPattern {

  private final double[] twoTheta;
  private final double[] intensity;
  @Nullable
  private final double[] uncertainty;

  /**
   * Constructor for an ExperimentalPattern without uncertainties.
   *
   * @param twoTheta the 2-theta grid (degrees).
   * @param intensity the observed intensities.
   * @throws InvalidPatternException if the data are malformed.
   */
  public ExperimentalPattern(double[] twoTheta, double[] intensity) {
    this(twoTheta, intensity, null);
  }

  /**
   * Constructor for an ExperimentalPattern.
   *
   * @param twoTheta the 2-theta grid (degrees).
   * @param intensity the observed intensities.
   * @param uncertainty the standard uncertainty of each intensity, or null.
   * @throws InvalidPatternException if the data are malformed.
   */
  public ExperimentalPattern(double[] twoTheta, double[] intensity,
      @Nullable double[] uncertainty) {
    if (twoTheta == null || intensity == null || twoTheta.length == 0) {
      throw new InvalidPatternException(" The experimental pattern is empty.");
    }
    if (twoTheta.length != intensity.length) {
      throw new InvalidPatternException(
          format(" The 2-theta grid (%d) and intensity (%d) lengths differ.", twoTheta.length,
              intensity.length));
    }
    if (uncertainty != null && uncertainty.length != intensity.length) {
      throw new InvalidPatternException(
          format(" The uncertainty (%d) and intensity (%d) lengths differ.", uncertainty.length,
              intensity.length));
    }
    for (int i = 0; i < twoTheta.length; i++) {
      if (!Double.isFinite(twoTheta[i]) || !Double.isFinite(intensity[i])) {
        throw new InvalidPatternException(format(" Point %d is not finite.", i));
      }
      if (i > 0 && twoTheta[i] <= twoTheta[i - 1]) {
        throw new InvalidPatternException(
            format(" The 2-theta grid is not strictly increasing at point %d (%.5f <= %.5f).", i,
                twoTheta[i], twoTheta[i - 1]));
      }
      if (uncertainty != null && !(uncertainty[i] >= 0.0)) {
        throw new InvalidPatternException(
            format(" The uncertainty of point %d is negative (%g).", i, uncertainty[i]));
      }
    }
    this.twoTheta = twoTheta.clone();
    this.intensity = intensity.clone();
    this.uncertainty = (uncertainty == null) ? null : uncertainty.clone();
  }

  /**
   * Number of points in the pattern.
   *
   * @return the number of points.
   */
  public int size() {
    return twoTheta.length;
  }

  /**
   * A copy of the 2-theta grid.
   *
   * @return the 2-theta values (degrees).
   */
  public double[] getTwoTheta() {
    return twoTheta.clone();
  }

  /**
   * A copy of the observed intensities.
   *
   * @return the intensities.
   */
  public double[] getIntensity() {
    return intensity.clone();
  }

  /**
   * A copy of the uncertainties.
   *
   * @return the uncertainties, or null if none were measured.
   */
  @Nullable
  public double[] getUncertainty() {
    return (uncertainty == null) ? null : uncertainty.clone();
  }

  /**
   * Whether uncertainties were supplied.
   *
   * @return true if the pattern carries uncertainties.
   */
  public boolean hasUncertainty() {
    return uncertainty != null;
  }

  /**
   * Maximum observed intensity.
   *
   * @return the maximum intensity.
   */
  public double getMaxIntensity() {
    double m = intensity[0];
    for (double v : intensity) {
      m = max(m, v);
    }
    return m;
  }

  /**
   * Return the part of this pattern inside a 2-theta window.
   *
   * @param min lower 2-theta limit (inclusive).
   * @param max upper 2-theta limit (inclusive).
   * @return the restricted pattern.
   * @throws InvalidPatternException if no points fall inside the window.
   */
  public ExperimentalPattern restrict(double min, double max) {
    int first = 0;
    while (first < twoTheta.length && twoTheta[first] < min) {
      first++;
    }
    int last = twoTheta.length;
    while (last > first && twoTheta[last - 1] > max) {
      last--;
    }
    if (last <= first) {
      throw new InvalidPatternException(
          format(" No points lie in the 2-theta window [%.3f, %.3f].", min, max));
    }
    double[] u = (uncertainty == null) ? null : Arrays.copyOfRange(uncertainty, first, last);
    return new ExperimentalPattern(Arrays.copyOfRange(twoTheta, first, last),
        Arrays.copyOfRange(intensity, first, last), u);
  }

  /**
   * Return this pattern scaled so that its maximum intensity equals the target. Uncertainties are
   * scaled by the same factor. A pattern whose maximum is not positive is returned unchanged.
   *
   * @param target the new maximum intensity.
   * @return the normalized pattern.
   */
  public ExperimentalPattern normalized(double target) {
    double m = getMaxIntensity();
    if (m <= 0.0) {
      return this;
    }
    double factor = target / m;
    double[] scaled = new double[intensity.length];
    double[] u = (uncertainty == null) ? null : new double[intensity.length];
    for (int i = 0; i < intensity.length; i++) {
      scaled[i] = intensity[i] * factor;
      if (u != null) {
        u[i] = uncertainty[i] * factor;
      }
    }
    return new ExperimentalPattern(twoTheta, scaled, u);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Pattern of %d points from %.3f to %.3f degrees 2-theta", twoTheta.length,
        twoTheta[0], twoTheta[twoTheta.length - 1]);
  }
}

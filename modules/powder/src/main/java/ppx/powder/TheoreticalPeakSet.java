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

import javax.annotation.Nullable;
import ppx.crystal.HKL;

/**
 * Peak positions (degrees 2-theta) and relative intensities calculated for one reference phase,
 * with optional Miller indices. A peak set may be empty.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class TheoreticalPeakSet {

  private static final TheoreticalPeakSet EMPTY =
      new TheoreticalPeakSet(new double[0], new double[0], null);

  private final double[] twoTheta;
  private final double[] intensity;
  @Nullable
  private final HKL[] hkl;

  /**
   * Constructor for a TheoreticalPeakSet.
   *
   * @param twoTheta peak positions (degrees).
   * @param intensity peak intensities.
   * @param hkl Miller index of each peak, or null.
   * @throws InvalidPatternException if the arrays differ in length or hold non-finite values.
   */
  public TheoreticalPeakSet(double[] twoTheta, double[] intensity, @Nullable HKL[] hkl) {
    if (twoTheta.length != intensity.length || (hkl != null && hkl.length != twoTheta.length)) {
      throw new InvalidPatternException(
          format(" Peak arrays differ in length (%d positions, %d intensities).", twoTheta.length,
              intensity.length));
    }
    for (int i = 0; i < twoTheta.length; i++) {
      if (!Double.isFinite(twoTheta[i]) || !Double.isFinite(intensity[i])) {
        throw new InvalidPatternException(format(" Peak %d is not finite.", i));
      }
    }
    this.twoTheta = twoTheta.clone();
    this.intensity = intensity.clone();
    this.hkl = (hkl == null) ? null : hkl.clone();
  }

  /**
   * Constructor for a TheoreticalPeakSet without Miller indices.
   *
   * @param twoTheta peak positions (degrees).
   * @param intensity peak intensities.
   */
  public TheoreticalPeakSet(double[] twoTheta, double[] intensity) {
    this(twoTheta, intensity, null);
  }

  /**
   * The empty peak set.
   *
   * @return a peak set with no peaks.
   */
  public static TheoreticalPeakSet empty() {
    return EMPTY;
  }

  /**
   * Number of peaks.
   *
   * @return the number of peaks.
   */
  public int size() {
    return twoTheta.length;
  }

  /**
   * Whether the set has no peaks.
   *
   * @return true if empty.
   */
  public boolean isEmpty() {
    return twoTheta.length == 0;
  }

  /**
   * Position of peak i.
   *
   * @param i peak index.
   * @return 2-theta (degrees).
   */
  public double getTwoTheta(int i) {
    return twoTheta[i];
  }

  /**
   * Intensity of peak i.
   *
   * @param i peak index.
   * @return the intensity.
   */
  public double getIntensity(int i) {
    return intensity[i];
  }

  /**
   * Miller index of peak i.
   *
   * @param i peak index.
   * @return the Miller index, or null if unknown.
   */
  @Nullable
  public HKL getHKL(int i) {
    return (hkl == null) ? null : hkl[i];
  }

  /**
   * A copy of the peak positions.
   *
   * @return peak positions (degrees).
   */
  public double[] getTwoTheta() {
    return twoTheta.clone();
  }

  /**
   * A copy of the peak intensities.
   *
   * @return peak intensities.
   */
  public double[] getIntensity() {
    return intensity.clone();
  }

  /**
   * Maximum peak intensity (0 for an empty set).
   *
   * @return the maximum intensity.
   */
  public double getMaxIntensity() {
    double m = 0.0;
    for (double v : intensity) {
      m = max(m, v);
    }
    return m;
  }

  /**
   * A new peak set with every position moved by a zero-point shift.
   *
   * @param zeroShift the shift (degrees).
   * @return the shifted peak set.
   */
  public TheoreticalPeakSet shifted(double zeroShift) {
    double[] positions = new double[twoTheta.length];
    for (int i = 0; i < positions.length; i++) {
      positions[i] = twoTheta[i] + zeroShift;
    }
    return new TheoreticalPeakSet(positions, intensity, hkl);
  }
}

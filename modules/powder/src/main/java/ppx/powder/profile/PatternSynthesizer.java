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
package ppx.powder.profile;

import static org.apache.commons.math3.util.FastMath.max;
import static ppx.powder.profile.PeakProfile.CUTOFF;

import java.util.Arrays;
import ppx.powder.TheoreticalPeakSet;

/**
 * Builds a calculated pattern on a 2-theta grid from a peak set.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PatternSynthesizer {

  private PatternSynthesizer() {
  }

  /**
   * Synthesize a pattern: each peak is moved by the zero shift, given a Caglioti width and a
   * pseudo-Voigt shape, and accumulated into a zero initialized array. Only grid points within
   * the profile cutoff of each peak are visited.
   *
   * @param grid increasing 2-theta grid (degrees).
   * @param peaks the peak set.
   * @param width Caglioti width parameters.
   * @param scaleFactor multiplier applied to every peak intensity.
   * @param zeroShift zero-point shift added to every peak position (degrees).
   * @param eta Lorentzian mixing fraction.
   * @return the calculated intensities, one per grid point.
   */
  public static double[] synthesize(double[] grid, TheoreticalPeakSet peaks,
      CagliotiParameters width, double scaleFactor, double zeroShift, double eta) {
    double[] curve = new double[grid.length];
    accumulate(grid, peaks, width, scaleFactor, zeroShift, eta, curve);
    return curve;
  }

  /**
   * Add the synthesized pattern of a peak set to an existing curve.
   *
   * @param grid increasing 2-theta grid (degrees).
   * @param peaks the peak set.
   * @param width Caglioti width parameters.
   * @param scaleFactor multiplier applied to every peak intensity.
   * @param zeroShift zero-point shift added to every peak position (degrees).
   * @param eta Lorentzian mixing fraction.
   * @param curve the curve to add to (same length as the grid).
   */
  public static void accumulate(double[] grid, TheoreticalPeakSet peaks,
      CagliotiParameters width, double scaleFactor, double zeroShift, double eta,
      double[] curve) {
    int nPoints = grid.length;
    if (nPoints == 0) {
      return;
    }
    int nPeaks = peaks.size();
    for (int p = 0; p < nPeaks; p++) {
      double height = peaks.getIntensity(p) * scaleFactor;
      if (height <= 0.0) {
        continue;
      }
      double center = peaks.getTwoTheta(p) + zeroShift;
      double fwhm = width.fwhm(center);
      double reach = CUTOFF * fwhm;
      if (center + reach < grid[0] || center - reach > grid[nPoints - 1]) {
        continue;
      }
      int start = insertionPoint(grid, center - reach);
      for (int i = max(0, start); i < nPoints && grid[i] <= center + reach; i++) {
        curve[i] += PeakProfile.profileValue(grid[i], center, fwhm, height, eta);
      }
    }
  }

  /**
   * Index of the first grid point not below the value.
   */
  private static int insertionPoint(double[] grid, double value) {
    int index = Arrays.binarySearch(grid, value);
    return (index >= 0) ? index : -(index + 1);
  }
}

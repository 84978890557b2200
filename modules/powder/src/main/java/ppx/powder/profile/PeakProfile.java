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

import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.exp;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.tan;
import static org.apache.commons.math3.util.FastMath.toRadians;
import static ppx.utilities.Constants.FWHM_TO_SIGMA;

/**
 * Pseudo-Voigt peak shape with a Caglioti width model.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class PeakProfile {

  /** Profiles are truncated beyond this many FWHM from the peak center. */
  public static final double CUTOFF = 5.0;

  /** Lower limit of the squared FWHM (degrees^2). */
  public static final double MIN_FWHM_SQUARED = 0.001;

  private PeakProfile() {
  }

  /**
   * Caglioti peak width: FWHM^2 = U tan^2(theta) + V tan(theta) + W, with theta half of 2-theta in
   * radians. The squared width is floored at {@link #MIN_FWHM_SQUARED}, so the result is positive
   * for any coefficients.
   *
   * @param twoTheta 2-theta (degrees).
   * @param u The U coefficient.
   * @param v The V coefficient.
   * @param w The W coefficient.
   * @return the FWHM (degrees).
   */
  public static double peakWidth(double twoTheta, double u, double v, double w) {
    double tanTheta = tan(toRadians(0.5 * twoTheta));
    double fwhm2 = u * tanTheta * tanTheta + v * tanTheta + w;
    // NaN (e.g. at 180 degrees) also falls back to the floor.
    if (!(fwhm2 >= MIN_FWHM_SQUARED)) {
      fwhm2 = MIN_FWHM_SQUARED;
    }
    return sqrt(fwhm2);
  }

  /**
   * Pseudo-Voigt profile value: intensity * [(1 - eta) G + eta L], where G is a unit height
   * Gaussian with sigma = fwhm / (2 sqrt(2 ln 2)) and L a unit height Lorentzian with half width
   * fwhm / 2.
   *
   * @param x evaluation point (degrees).
   * @param center peak center (degrees).
   * @param fwhm full width at half maximum (degrees).
   * @param intensity peak height.
   * @param eta Lorentzian mixing fraction in [0, 1].
   * @return the profile value; 0 for a non-positive width or intensity, or beyond the cutoff.
   */
  public static double profileValue(double x, double center, double fwhm, double intensity,
      double eta) {
    if (fwhm <= 0.0 || intensity <= 0.0) {
      return 0.0;
    }
    double dx = x - center;
    if (abs(dx) > CUTOFF * fwhm) {
      return 0.0;
    }
    double sigma = fwhm / FWHM_TO_SIGMA;
    double gaussian = exp(-0.5 * dx * dx / (sigma * sigma));
    double gamma = 0.5 * fwhm;
    double lorentzian = 1.0 / (1.0 + (dx * dx) / (gamma * gamma));
    double mix = max(0.0, min(1.0, eta));
    return intensity * ((1.0 - mix) * gaussian + mix * lorentzian);
  }
}

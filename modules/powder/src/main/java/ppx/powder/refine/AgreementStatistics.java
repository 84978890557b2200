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
package ppx.powder.refine;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.sqrt;

/**
 * Crystallographic agreement between observed and calculated profiles. Rp, Rwp and Rexp are in
 * percent; degenerate denominators give positive infinity.
 *
 * @param rp Profile R-factor.
 * @param rwp Weighted profile R-factor.
 * @param rexp Expected R-factor.
 * @param gof Goodness of fit (Rwp / Rexp).
 * @param chiSquared Reduced chi-squared.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record AgreementStatistics(double rp, double rwp, double rexp, double gof,
                                  double chiSquared) {

  /**
   * Compute agreement statistics.
   *
   * @param observed observed intensities.
   * @param calculated calculated intensities.
   * @param sigma intensity uncertainties (positive).
   * @param nParameters number of refined parameters.
   * @return the statistics.
   */
  public static AgreementStatistics compute(double[] observed, double[] calculated, double[] sigma,
      int nParameters) {
    int n = observed.length;
    double sumObs = 0.0;
    double sumAbs = 0.0;
    double weightedResidual = 0.0;
    double weightedObs = 0.0;
    for (int i = 0; i < n; i++) {
      double o = observed[i];
      double d = o - calculated[i];
      sumObs += o;
      sumAbs += abs(d);
      double r = d / sigma[i];
      weightedResidual += r * r;
      double wo = o / sigma[i];
      weightedObs += wo * wo;
    }
    double inf = Double.POSITIVE_INFINITY;
    int dof = n - nParameters;
    double rp = (sumObs > 0.0) ? sumAbs / sumObs : inf;
    double rwp = (weightedObs > 0.0) ? sqrt(weightedResidual / weightedObs) : inf;
    double rexp = (weightedObs > 0.0 && dof > 0) ? sqrt(dof / weightedObs) : inf;
    double gof = (rexp > 0.0 && Double.isFinite(rexp)) ? rwp / rexp : inf;
    double chi2 = (dof > 0) ? weightedResidual / dof : inf;
    return new AgreementStatistics(100.0 * rp, 100.0 * rwp, 100.0 * rexp, gof, chi2);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Rp %8.3f%%  Rwp %8.3f%%  Rexp %8.3f%%  GoF %8.3f  Chi2 %10.4f", rp, rwp, rexp,
        gof, chiSquared);
  }
}

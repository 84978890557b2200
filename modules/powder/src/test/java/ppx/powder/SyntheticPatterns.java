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

import ppx.powder.decompose.DecompositionOptions;
import ppx.powder.profile.CagliotiParameters;
import ppx.powder.profile.PatternSynthesizer;

/**
 * Builds synthetic phases and patterns for tests.
 *
 * @author Michael J. Schnieders
 */
public final class SyntheticPatterns {

  private SyntheticPatterns() {
  }

  /**
   * A uniform 2-theta grid.
   *
   * @param min first point.
   * @param max last point.
   * @param step spacing.
   * @return the grid.
   */
  public static double[] grid(double min, double max, double step) {
    int n = (int) Math.round((max - min) / step) + 1;
    double[] grid = new double[n];
    for (int i = 0; i < n; i++) {
      grid[i] = min + i * step;
    }
    return grid;
  }

  public static CandidatePhase phase(String id, String name, double[] twoTheta,
      double[] intensity) {
    return new CandidatePhase(id, name, "", null, null,
        new TheoreticalPeakSet(twoTheta, intensity));
  }

  /**
   * Sum of the phases at unit scale, using the decomposition profile defaults.
   *
   * @param grid the 2-theta grid.
   * @param phases the phases.
   * @return the pattern.
   */
  public static ExperimentalPattern pattern(double[] grid, CandidatePhase... phases) {
    DecompositionOptions options = DecompositionOptions.defaults();
    return pattern(grid, options.profile(), options.eta(), 1.0, phases);
  }

  public static ExperimentalPattern pattern(double[] grid, CagliotiParameters width, double eta,
      double scale, CandidatePhase... phases) {
    double[] intensity = new double[grid.length];
    for (CandidatePhase phase : phases) {
      PatternSynthesizer.accumulate(grid, phase.peaks(), width, scale, 0.0, eta, intensity);
    }
    return new ExperimentalPattern(grid, intensity);
  }

  public static double sum(double[] values) {
    double s = 0.0;
    for (double v : values) {
      s += v;
    }
    return s;
  }

  public static double max(double[] values) {
    double m = Double.NEGATIVE_INFINITY;
    for (double v : values) {
      m = Math.max(m, v);
    }
    return m;
  }
}

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
package ppx.powder.match;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * Scores how well a synthesized candidate pattern explains a residue signal.
 *
 * <p>Both curves are normalized by their own maxima. A scale for the candidate is fit by bounded
 * least squares over the significant residue points, and the score is the absolute Pearson
 * correlation between the residue and the scaled candidate over points significant in both.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ResidueMatcher {

  private static final Logger logger = Logger.getLogger(ResidueMatcher.class.getName());

  /** Start value of the scale fit. */
  private static final double START_SCALE = 1.0;

  private final MatchOptions options;

  /**
   * Constructor for a ResidueMatcher.
   *
   * @param options the matcher settings.
   */
  public ResidueMatcher(MatchOptions options) {
    this.options = options;
  }

  /**
   * Score a candidate pattern against a residue. Neither array is modified.
   *
   * @param residue the residue signal.
   * @param candidate the synthesized candidate pattern on the same grid.
   * @return the score; {@link MatchScore#NONE} when either curve has no positive maximum.
   */
  public MatchScore score(double[] residue, double[] candidate) {
    if (residue.length != candidate.length) {
      throw new IllegalArgumentException(
          format(" Residue (%d) and candidate (%d) lengths differ.", residue.length,
              candidate.length));
    }
    double residueMax = maximum(residue);
    double candidateMax = maximum(candidate);
    if (residueMax <= 0.0 || candidateMax <= 0.0) {
      return MatchScore.NONE;
    }

    int n = residue.length;
    double[] r = new double[n];
    double[] c = new double[n];
    for (int i = 0; i < n; i++) {
      r[i] = residue[i] / residueMax;
      c[i] = candidate[i] / candidateMax;
    }

    double threshold = options.thresholdFraction();
    double scale = fitScale(r, c, threshold);

    // Correlate over points that are significant in both curves.
    int count = 0;
    for (int i = 0; i < n; i++) {
      if (r[i] > threshold && c[i] > threshold) {
        count++;
      }
    }
    if (count < max(2, options.minPoints())) {
      return new MatchScore(0.0, scale);
    }
    double[] x = new double[count];
    double[] y = new double[count];
    int j = 0;
    for (int i = 0; i < n; i++) {
      if (r[i] > threshold && c[i] > threshold) {
        x[j] = r[i];
        y[j] = scale * c[i];
        j++;
      }
    }
    double correlation = new PearsonsCorrelation().correlation(x, y);
    if (Double.isNaN(correlation)) {
      correlation = 0.0;
    }
    correlation = min(1.0, abs(correlation));
    if (logger.isLoggable(Level.FINEST)) {
      logger.finest(format(" Correlation %8.5f over %d points at scale %8.5f.", correlation, count,
          scale));
    }
    return new MatchScore(correlation, scale);
  }

  /**
   * Bounded least squares fit of the normalized candidate to the normalized residue over the
   * points where the residue is significant.
   */
  private double fitScale(double[] r, double[] c, double threshold) {
    int count = 0;
    for (double v : r) {
      if (v > threshold) {
        count++;
      }
    }
    if (count < options.minPoints()) {
      return START_SCALE;
    }
    double[] rm = new double[count];
    double[] cm = new double[count];
    int j = 0;
    for (int i = 0; i < r.length; i++) {
      if (r[i] > threshold) {
        rm[j] = r[i];
        cm[j] = c[i];
        j++;
      }
    }
    double lo = options.scaleMin();
    double hi = options.scaleMax();
    BrentOptimizer optimizer = new BrentOptimizer(1.0e-10, 1.0e-14);
    UnivariatePointValuePair optimum = optimizer.optimize(new MaxEval(500),
        new UnivariateObjectiveFunction(s -> {
          double sum = 0.0;
          for (int k = 0; k < rm.length; k++) {
            double d = rm[k] - s * cm[k];
            sum += d * d;
          }
          return sum;
        }), GoalType.MINIMIZE, new SearchInterval(lo, hi, max(lo, min(hi, START_SCALE))));
    return optimum.getPoint();
  }

  private static double maximum(double[] values) {
    double m = 0.0;
    for (double v : values) {
      if (v > m) {
        m = v;
      }
    }
    return m;
  }
}

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
package ppx.numerics.optimization;

import static java.lang.Double.isFinite;
import static java.lang.System.arraycopy;
import static org.apache.commons.math3.util.FastMath.acos;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toDegrees;
import static ppx.numerics.optimization.LBFGS.STEPMAX;
import static ppx.numerics.optimization.LBFGS.STEPMIN;
import static ppx.numerics.optimization.LBFGS.v1DotV2;

import ppx.numerics.OptimizationInterface;

/**
 * Line search for {@link LBFGS} on small, smooth problems whose gradients come from finite
 * differences.
 *
 * <p>A trial step along the search direction p is accepted once it satisfies the sufficient
 * decrease condition
 *
 * <pre>
 *     f(x + a p) &lt;= f(x) + C1 a g.p
 * </pre>
 *
 * <p>and either the slope has dropped to <code>CAPPA |g.p|</code> or has changed sign. Steps that
 * raise the function are shortened by safeguarded cubic interpolation; steps that decrease it while
 * the slope stays steep are lengthened. The best acceptable point is kept, so the search never
 * returns a point above the starting value.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LineSearch {

  /** Sufficient decrease constant. */
  static final double C1 = 1.0e-4;
  /** Slope reduction that ends the search. */
  static final double CAPPA = 0.9;
  /** Largest angle (degrees) between the direction and the negative gradient. */
  static final double ANGLEMAX = 89.999;
  /** Function evaluations allowed per search. */
  static final int MAX_EVALUATIONS = 20;

  private final int n;
  private final double[] x0;
  private final double[] g0;
  private final double[] bestG;

  /**
   * LineSearch constructor.
   *
   * @param n Number of variables.
   */
  LineSearch(int n) {
    this.n = n;
    x0 = new double[n];
    g0 = new double[n];
    bestG = new double[n];
  }

  /**
   * Search along a direction. On return <code>x</code> and <code>g</code> hold the accepted point
   * and its gradient, or the starting point when no decrease was found.
   *
   * @param x Current variables; updated in place.
   * @param f Function value at <code>x</code>.
   * @param g Gradient at <code>x</code>; updated in place.
   * @param p Search direction.
   * @param fMove Function decrease of the previous iteration, used for the first trial step.
   * @param optimizationSystem Supplies function values and gradients.
   * @return the outcome of the search.
   */
  public Step search(double[] x, double f, double[] g, double[] p, double fMove,
      OptimizationInterface optimizationSystem) {
    double gNorm = sqrt(v1DotV2(n, g, 0, 1, g, 0, 1));
    double pNorm = sqrt(v1DotV2(n, p, 0, 1, p, 0, 1));
    double slope0 = v1DotV2(n, p, 0, 1, g, 0, 1);
    if (gNorm == 0.0 || pNorm == 0.0 || !isFinite(slope0)) {
      return new Step(f, 0, 90.0, LineSearchResult.WideAngle);
    }
    double angle = toDegrees(acos(min(1.0, max(-1.0, -slope0 / (gNorm * pNorm)))));
    if (slope0 >= 0.0 || angle > ANGLEMAX) {
      return new Step(f, 0, angle, LineSearchResult.WideAngle);
    }

    arraycopy(x, 0, x0, 0, n);
    arraycopy(g, 0, g0, 0, n);

    // Start from the step that would repeat the last decrease, capped in length.
    double maxStep = STEPMAX / pNorm;
    double minStep = STEPMIN / pNorm;
    double step = min(1.0, maxStep);
    if (fMove > 0.0) {
      step = min(step, 2.0 * fMove / -slope0);
    }
    step = max(step, minStep);

    double bestStep = 0.0;
    double bestF = f;
    double lowStep = 0.0;
    double lowF = f;
    double lowSlope = slope0;
    boolean nonFinite = false;
    int evaluations = 0;

    while (evaluations < MAX_EVALUATIONS) {
      move(x, step, p);
      evaluations++;
      double fStep = optimizationSystem.energyAndGradient(x, g);
      double slope = v1DotV2(n, p, 0, 1, g, 0, 1);

      if (!isFinite(fStep) || !isFinite(slope)) {
        nonFinite = true;
        step = lowStep + 0.1 * (step - lowStep);
      } else if (fStep > f + C1 * step * slope0 || fStep >= lowF) {
        // Too long: interpolate between the last good point and this one.
        step = interpolate(lowStep, lowF, lowSlope, step, fStep, slope);
      } else {
        if (fStep < bestF) {
          bestStep = step;
          bestF = fStep;
          arraycopy(g, 0, bestG, 0, n);
        }
        if (slope >= CAPPA * slope0 || step >= maxStep) {
          break;
        }
        // Still descending steeply: extend the step.
        lowStep = step;
        lowF = fStep;
        lowSlope = slope;
        step = min(4.0 * step, maxStep);
        continue;
      }
      if (step - lowStep < minStep) {
        break;
      }
    }

    if (bestStep == 0.0) {
      arraycopy(x0, 0, x, 0, n);
      arraycopy(g0, 0, g, 0, n);
      LineSearchResult result =
          nonFinite ? LineSearchResult.NonFinite : LineSearchResult.NoDecrease;
      return new Step(f, evaluations, angle, result);
    }
    move(x, bestStep, p);
    arraycopy(bestG, 0, g, 0, n);
    return new Step(bestF, evaluations, angle, LineSearchResult.Success);
  }

  /** Set x = x0 + step p. */
  private void move(double[] x, double step, double[] p) {
    for (int i = 0; i < n; i++) {
      x[i] = x0[i] + step * p[i];
    }
  }

  /**
   * Minimizer of the cubic through (a, fa, da) and (b, fb, db), kept within 10% to 50% of the
   * bracket measured from a. Falls back to bisection when the cubic has no real minimizer.
   */
  static double interpolate(double a, double fa, double da, double b, double fb, double db) {
    double width = b - a;
    double lo = a + 0.1 * width;
    double hi = a + 0.5 * width;
    double d1 = da + db - 3.0 * (fa - fb) / (a - b);
    double disc = d1 * d1 - da * db;
    if (disc < 0.0) {
      return hi;
    }
    double d2 = sqrt(disc);
    double t = b - width * (db + d2 - d1) / (db - da + 2.0 * d2);
    if (!isFinite(t)) {
      return hi;
    }
    return min(hi, max(lo, t));
  }

  /**
   * Outcome of one line search.
   *
   * @param value Function value at the returned point.
   * @param evaluations Number of function evaluations used.
   * @param angle Angle (degrees) between the direction and the negative gradient.
   * @param result Search status.
   */
  public record Step(double value, int evaluations, double angle, LineSearchResult result) {

  }

  /** Line search status. */
  public enum LineSearchResult {
    /** An acceptable point was found. */
    Success,
    /** The direction does not descend. */
    WideAngle,
    /** No point below the start was found. */
    NoDecrease,
    /** Only non-finite values were found along the direction. */
    NonFinite
  }
}

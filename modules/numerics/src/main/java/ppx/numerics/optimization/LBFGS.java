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
import static java.lang.String.format;
import static java.lang.System.arraycopy;
import static java.util.Arrays.fill;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.logging.Level;
import java.util.logging.Logger;
import ppx.numerics.OptimizationInterface;
import ppx.numerics.optimization.LineSearch.LineSearchResult;

/**
 * This class implements the limited-memory Broyden-Fletcher-Goldfarb-Shanno (L-BFGS) algorithm for
 * multidimensional unconstrained optimization problems. Bounded problems are handled by the caller
 * through a change of variables (see {@link BoxConstraints}).
 *
 * @author Michael J. Schnieders<br> Derived from:
 *     <br>
 *     Robert Dodier's Java translation of original FORTRAN code by Jorge Nocedal.
 *     <br>
 *     J. Nocedal, "Updating Quasi-Newton Matrices with Limited Storage", Mathematics of
 *     Computation, 35, 773-782 (1980)
 *     <br>
 *     D. C. Lui and J. Nocedal, "On the Limited Memory BFGS Method for Large Scale Optimization",
 *     Mathematical Programming, 45, 503-528 (1989)
 *     <br>
 *     J. Nocedal and S. J. Wright, "Numerical Optimization", Springer-Verlag, New York, 1999,
 *     Section 9.1
 * @since 1.0
 */
public class LBFGS {

  /** Status returned when the convergence criteria are satisfied. */
  public static final int CONVERGED = 0;
  /** Status returned when the iteration limit is reached or a listener stops the optimization. */
  public static final int TERMINATED = 1;
  /** Status returned when the optimization failed. */
  public static final int FAILED = -1;

  private static final Logger logger = Logger.getLogger(LBFGS.class.getName());

  /** This specifies the lower bound for the step in the line search. */
  static final double STEPMIN = 1.0e-16;
  /** This specifies the upper bound for the step in the line search. */
  static final double STEPMAX = 5.0;
  /** Curvature pairs with y.s below this value are not stored. */
  private static final double MIN_CURVATURE = 1.0e-20;

  /** Make the constructor private so that the L-BFGS cannot be instantiated. */
  private LBFGS() {
  }

  /**
   * This method solves the unconstrained minimization problem
   *
   * <pre>
   *     min f(x),    x = (x1,x2,...,x_n),
   * </pre>
   *
   * using the limited-memory BFGS method.
   *
   * <p>The steplength is determined at each iteration by {@link LineSearch}. When a quasi-Newton
   * direction gives no decrease the stored corrections are discarded and the search is repeated
   * along the steepest descent direction; when that also fails the current point is returned as
   * converged.
   *
   * @param n The number of variables in the minimization problem. Restriction: <code>n &gt;
   *     0</code>.
   * @param mSave The number of corrections used in the BFGS update. <code>3 &lt;= mSave &lt;=
   *     7</code> is recommended.
   * @param x On initial entry this must be set to the initial estimate of the solution vector. On
   *     exit it contains the values of the variables at the best point found.
   * @param f The value of the function <code>f</code> at the point <code>x</code>.
   * @param g The components of the gradient <code>g</code> at the point <code>x</code>.
   * @param eps The optimization terminates when <code>G RMS &lt; eps</code>.
   * @param fTol The optimization also terminates when the relative change in the function value
   *     over one iteration is smaller than <code>fTol</code>. A value of zero disables this test.
   * @param maxIterations Maximum number of optimization steps.
   * @param optimizationSystem Implements the {@link OptimizationInterface} to supply function
   *     values and gradients.
   * @param listener Implements the {@link OptimizationListener} interface and will be notified
   *     after each successful step. May be null.
   * @return status code ({@link #CONVERGED}, {@link #TERMINATED} or {@link #FAILED}).
   */
  public static int minimize(final int n, int mSave, final double[] x, double f, double[] g,
      final double eps, final double fTol, final int maxIterations,
      OptimizationInterface optimizationSystem, OptimizationListener listener) {

    assert (n > 0);
    assert (mSave > 0);
    assert (x != null && x.length >= n);
    assert (g != null && g.length >= n);

    if (mSave > n) {
      logger.fine(format(" Resetting the number of saved L-BFGS vectors to %d.", n));
      mSave = n;
    }

    if (!isFinite(f)) {
      logger.warning(format(" The initial function value is %s.", f));
      return FAILED;
    }

    int iterations = 0;
    int evaluations = 1;

    double rms = sqrt(n);
    double[] scaling = optimizationSystem.getScaling();
    if (scaling == null) {
      scaling = new double[n];
      fill(scaling, 1.0);
    }

    double grms = 0.0;
    double gnorm = 0.0;
    for (int i = 0; i < n; i++) {
      double gi = g[i];
      if (!isFinite(gi)) {
        logger.warning(format(" The gradient of variable %d is %8.3f.", i, gi));
        return FAILED;
      }
      double gis = gi * scaling[i];
      gnorm += gi * gi;
      grms += gis * gis;
    }
    gnorm = sqrt(gnorm);
    grms = sqrt(grms) / rms;

    // Notify the listener of initial conditions.
    if (listener != null) {
      if (!listener.optimizationUpdate(iterations, evaluations, grms, 0.0, f, 0.0, 0.0, null)) {
        return TERMINATED;
      }
    } else {
      log(iterations, evaluations, grms, 0.0, f, 0.0, 0.0, null);
    }

    // The convergence criteria may already be satisfied.
    if (grms <= eps) {
      return CONVERGED;
    }

    final double[][] s = new double[mSave][n];
    final double[][] y = new double[mSave][n];
    final double[] prevX = new double[n];
    final double[] prevG = new double[n];
    final double[] r = new double[n];
    final double[] p = new double[n];
    final double[] q = new double[n];
    final double[] alpha = new double[mSave];
    final double[] rho = new double[mSave];
    double gamma = 1.0;

    final LineSearch lineSearch = new LineSearch(n);
    double df = 0.5 * STEPMAX * gnorm;
    int m = -1;
    int stored = 0;

    while (true) {
      iterations++;
      if (iterations > maxIterations) {
        logger.fine(format(" Maximum number of iterations reached: %d.", maxIterations));
        return TERMINATED;
      }

      int muse = min(stored, mSave);
      m++;
      if (m > mSave - 1) {
        m = 0;
      }

      // Two-loop recursion with a diagonal initial Hessian estimate.
      arraycopy(g, 0, q, 0, n);
      int k = m;
      for (int j = 0; j < muse; j++) {
        k--;
        if (k < 0) {
          k = mSave - 1;
        }
        alpha[k] = v1DotV2(n, s[k], 0, 1, q, 0, 1);
        alpha[k] *= rho[k];
        aV1PlusV2(n, -alpha[k], y[k], 0, 1, q, 0, 1);
      }
      for (int i = 0; i < n; i++) {
        r[i] = gamma * q[i];
      }
      for (int j = 0; j < muse; j++) {
        double beta = v1DotV2(n, r, 0, 1, y[k], 0, 1);
        beta *= rho[k];
        aV1PlusV2(n, alpha[k] - beta, s[k], 0, 1, r, 0, 1);
        k++;
        if (k > mSave - 1) {
          k = 0;
        }
      }

      // Set the search direction.
      for (int i = 0; i < n; i++) {
        p[i] = -r[i];
      }
      arraycopy(x, 0, prevX, 0, n);
      arraycopy(g, 0, prevG, 0, n);

      // Perform the line search along the new search direction.
      double prevF = f;
      LineSearch.Step step = lineSearch.search(x, f, g, p, df, optimizationSystem);
      evaluations += step.evaluations();
      LineSearchResult info = step.result();

      if (info == LineSearchResult.NonFinite) {
        logger.warning(" The function became non-finite along every trial step.");
        return FAILED;
      }
      if (info != LineSearchResult.Success) {
        if (muse == 0) {
          logger.fine(format(" No decrease along the steepest descent direction (%s).", info));
          return CONVERGED;
        }
        // Discard the corrections and retry along the negative gradient.
        logger.fine(format(" Line search %s; restarting from steepest descent.", info));
        stored = 0;
        m = -1;
        gamma = 1.0;
        iterations--;
        continue;
      }
      f = step.value();

      // Update the curvature pairs.
      for (int i = 0; i < n; i++) {
        s[m][i] = x[i] - prevX[i];
        y[m][i] = g[i] - prevG[i];
      }
      double ys = v1DotV2(n, y[m], 0, 1, s[m], 0, 1);
      double yy = v1DotV2(n, y[m], 0, 1, y[m], 0, 1);
      if (ys > MIN_CURVATURE && yy > 0.0) {
        gamma = abs(ys / yy);
        rho[m] = 1.0 / ys;
      } else {
        rho[m] = 0.0;
      }
      stored++;

      // Get the sizes of the moves made during this iteration.
      df = prevF - f;
      double xrms = 0.0;
      grms = 0.0;
      for (int i = 0; i < n; i++) {
        double dx = (x[i] - prevX[i]) / scaling[i];
        xrms += dx * dx;
        double gx = g[i] * scaling[i];
        grms += gx * gx;
      }
      xrms = sqrt(xrms) / rms;
      grms = sqrt(grms) / rms;

      if (listener != null) {
        if (!listener.optimizationUpdate(iterations, evaluations, grms, xrms, f, df,
            step.angle(), info)) {
          return TERMINATED;
        }
      } else {
        log(iterations, evaluations, grms, xrms, f, df, step.angle(), info);
      }

      // Terminate upon satisfying a convergence criterion.
      if (grms <= eps) {
        return CONVERGED;
      } else if (fTol > 0.0 && abs(df) <= fTol * max(max(abs(f), abs(prevF)), 1.0)) {
        return CONVERGED;
      }
    }
  }

  /**
   * Print status messages for <code>LBFGS</code> if there is no listener.
   *
   * @param iter Number of iterations so far.
   * @param nfun Number of function evaluations so far.
   * @param grms Gradient RMS at current solution.
   * @param xrms Coordinate change RMS at current solution.
   * @param f Function value at current solution.
   * @param df Change in the function value compared to the previous solution.
   * @param angle Current angle between gradient and search direction.
   * @param info Result of the line search.
   */
  private static void log(int iter, int nfun, double grms, double xrms, double f, double df,
      double angle, LineSearchResult info) {
    if (!logger.isLoggable(Level.FINE)) {
      return;
    }
    if (iter == 0) {
      logger.fine("\n Limited Memory BFGS Quasi-Newton Optimization: \n");
      logger.fine(" QN Iter    F Value      G RMS     F Move    X Move    Angle  FG Call  Comment\n");
    }
    if (info == null) {
      logger.fine(format("%6d%13.4f%11.4f%11.4f%10.4f%9.2f%7d", iter, f, grms, df, xrms, angle,
          nfun));
    } else {
      logger.fine(format("%6d%13.4f%11.4f%11.4f%10.4f%9.2f%7d   %8s", iter, f, grms, df, xrms,
          angle, nfun, info));
    }
  }

  /**
   * Compute the sum of a vector times a scalar plus another vector.
   *
   * @param n The number of points.
   * @param a The scalar.
   * @param v1 The X array.
   * @param v1Start The first point in the X array.
   * @param v1Step The X array increment.
   * @param v2 The Y array.
   * @param v2Start The first point in the Y array.
   * @param v2Step The Y array increment.
   */
  static void aV1PlusV2(final int n, final double a, final double[] v1, final int v1Start,
      final int v1Step, final double[] v2, final int v2Start, final int v2Step) {
    // If the scalar is zero, then the v2 array is unchanged.
    if (n <= 0 || a == 0) {
      return;
    }
    int stop = v1Start + v1Step * n;
    for (int i = v1Start, j = v2Start; i != stop; i += v1Step, j += v2Step) {
      v2[j] += a * v1[i];
    }
  }

  /**
   * Compute the dot product of two vectors.
   *
   * @param n Number of entries to include.
   * @param v1 The X array.
   * @param v1Start The first point in the X array.
   * @param v1Step The X array increment.
   * @param v2 The Y array.
   * @param v2Start The first point in the Y array.
   * @param v2Step The Y increment.
   * @return dot product
   */
  static double v1DotV2(final int n, final double[] v1, final int v1Start, final int v1Step,
      final double[] v2, final int v2Start, final int v2Step) {
    if (n <= 0) {
      return 0;
    }
    double sum = 0.0;
    int stop = v1Start + v1Step * n;
    for (int i = v1Start, j = v2Start; i != stop; i += v1Step, j += v2Step) {
      sum += v1[i] * v2[j];
    }
    return sum;
  }
}

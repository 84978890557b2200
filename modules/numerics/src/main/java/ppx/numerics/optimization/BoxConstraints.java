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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.asin;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sin;

/**
 * Maps box-constrained parameters onto unbounded internal variables so that an unconstrained
 * optimizer such as {@link LBFGS} can be used.
 *
 * <p>Each bounded parameter x in [lo, hi] is represented by an internal variable u with
 *
 * <pre>
 *     x = lo + (hi - lo) * (sin(u) + 1) / 2
 * </pre>
 *
 * <p>so any value of u lands inside the box.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BoxConstraints {

  /** Keeps the inverse transform away from the flat points of the sine. */
  private static final double EDGE = 1.0 - 1.0e-8;

  private final double[] lower;
  private final double[] upper;

  /**
   * Constructor for BoxConstraints.
   *
   * @param lower Lower bound of each parameter.
   * @param upper Upper bound of each parameter.
   */
  public BoxConstraints(double[] lower, double[] upper) {
    if (lower.length != upper.length) {
      throw new IllegalArgumentException(
          format(" Bound arrays differ in length (%d vs %d).", lower.length, upper.length));
    }
    for (int i = 0; i < lower.length; i++) {
      if (!(upper[i] > lower[i])) {
        throw new IllegalArgumentException(
            format(" Upper bound %d (%g) must exceed lower bound (%g).", i, upper[i], lower[i]));
      }
    }
    this.lower = lower.clone();
    this.upper = upper.clone();
  }

  /**
   * Number of bounded parameters.
   *
   * @return the number of parameters.
   */
  public int size() {
    return lower.length;
  }

  /**
   * Lower bound of a parameter.
   *
   * @param i parameter index.
   * @return the lower bound.
   */
  public double getLower(int i) {
    return lower[i];
  }

  /**
   * Upper bound of a parameter.
   *
   * @param i parameter index.
   * @return the upper bound.
   */
  public double getUpper(int i) {
    return upper[i];
  }

  /**
   * Clamp a parameter value into its box.
   *
   * @param i parameter index.
   * @param x parameter value.
   * @return the clamped value.
   */
  public double clamp(int i, double x) {
    return min(upper[i], max(lower[i], x));
  }

  /**
   * Convert external (bounded) parameters to internal (unbounded) variables. Values outside the box
   * are clamped first.
   *
   * @param external bounded parameter values.
   * @param internal output internal variables.
   * @return the internal variables.
   */
  public double[] toInternal(double[] external, double[] internal) {
    int n = lower.length;
    if (internal == null || internal.length < n) {
      internal = new double[n];
    }
    for (int i = 0; i < n; i++) {
      double t = 2.0 * (clamp(i, external[i]) - lower[i]) / (upper[i] - lower[i]) - 1.0;
      t = min(EDGE, max(-EDGE, t));
      internal[i] = asin(t);
    }
    return internal;
  }

  /**
   * Convert internal (unbounded) variables to external (bounded) parameters.
   *
   * @param internal internal variables.
   * @param external output bounded parameter values.
   * @return the bounded parameter values.
   */
  public double[] toExternal(double[] internal, double[] external) {
    int n = lower.length;
    if (external == null || external.length < n) {
      external = new double[n];
    }
    for (int i = 0; i < n; i++) {
      double x = lower[i] + (upper[i] - lower[i]) * (sin(internal[i]) + 1.0) * 0.5;
      external[i] = clamp(i, x);
    }
    return external;
  }
}

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
import static java.lang.System.arraycopy;

import java.util.List;
import java.util.logging.Logger;
import ppx.numerics.OptimizationInterface;
import ppx.numerics.optimization.BoxConstraints;
import ppx.powder.TheoreticalPeakSet;
import ppx.powder.profile.PatternSynthesizer;

/**
 * Weighted least squares objective of one phase with every other phase held fixed:
 * sum(((obs - (phase + others)) / sigma)^2).
 *
 * <p>The optimizer works on unbounded internal variables that {@link BoxConstraints} maps onto the
 * bounded phase parameters. Gradients are central finite differences in the internal variables.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LeBailPhaseEnergy implements OptimizationInterface {

  private static final Logger logger = Logger.getLogger(LeBailPhaseEnergy.class.getName());

  private final double[] grid;
  private final double[] observed;
  private final double[] sigma;
  private final double[] others;
  private final TheoreticalPeakSet peaks;
  private final RefinementParameters parameters;
  private final List<RefinementVariable> variables;
  private final BoxConstraints box;
  private final double step;
  private final int n;
  private final double[] external;

  /**
   * Constructor for LeBailPhaseEnergy.
   *
   * @param grid 2-theta grid.
   * @param observed observed intensities.
   * @param sigma intensity uncertainties.
   * @param others calculated pattern of every other phase.
   * @param peaks this phase's peak set at its original positions.
   * @param parameters starting parameters; a private copy is refined.
   * @param variables the free variables, in optimization order.
   * @param box bounds of the free variables.
   * @param step finite difference step in the internal variables.
   */
  public LeBailPhaseEnergy(double[] grid, double[] observed, double[] sigma, double[] others,
      TheoreticalPeakSet peaks, RefinementParameters parameters,
      List<RefinementVariable> variables, BoxConstraints box, double step) {
    if (variables.size() != box.size()) {
      throw new IllegalArgumentException(
          format(" %d variables but %d bounds.", variables.size(), box.size()));
    }
    this.grid = grid;
    this.observed = observed;
    this.sigma = sigma;
    this.others = others;
    this.peaks = peaks;
    this.parameters = parameters.copy();
    this.variables = List.copyOf(variables);
    this.box = box;
    this.step = step;
    n = variables.size();
    external = new double[n];
  }

  /**
   * Weighted sum of squared residuals for a set of parameters.
   *
   * @param params the phase parameters.
   * @return the objective value.
   */
  public double objective(RefinementParameters params) {
    double[] calc = PatternSynthesizer.synthesize(grid, peaks, params.getCaglioti(),
        params.getScaleFactor(), params.getZeroShift(), params.getEta());
    double sum = 0.0;
    for (int i = 0; i < grid.length; i++) {
      double r = (observed[i] - calc[i] - others[i]) / sigma[i];
      sum += r * r;
    }
    return sum;
  }

  /** {@inheritDoc} */
  @Override
  public double energy(double[] x) {
    setInternal(x);
    return objective(parameters);
  }

  /** {@inheritDoc} */
  @Override
  public double energyAndGradient(double[] x, double[] g) {
    double[] trial = x.clone();
    for (int i = 0; i < n; i++) {
      double xi = x[i];
      trial[i] = xi + step;
      double ePlus = energy(trial);
      trial[i] = xi - step;
      double eMinus = energy(trial);
      trial[i] = xi;
      g[i] = (ePlus - eMinus) / (2.0 * step);
    }
    double e = energy(x);
    if (!Double.isFinite(e)) {
      logger.fine(format(" Non-finite Le Bail objective: %s", e));
    }
    return e;
  }

  /**
   * Internal variables of the current parameters.
   *
   * @param x Supplied array.
   * @return the internal variables.
   */
  @Override
  public double[] getCoordinates(double[] x) {
    for (int i = 0; i < n; i++) {
      external[i] = parameters.get(variables.get(i));
    }
    double[] internal = box.toInternal(external, null);
    if (x == null || x.length < n) {
      x = new double[n];
    }
    arraycopy(internal, 0, x, 0, n);
    return x;
  }

  /** {@inheritDoc} */
  @Override
  public int getNumberOfVariables() {
    return n;
  }

  /**
   * The internal variables are of similar magnitude, so no scaling is applied.
   *
   * @return null.
   */
  @Override
  public double[] getScaling() {
    return null;
  }

  /**
   * Parameters corresponding to a set of internal variables.
   *
   * @param x internal variables.
   * @return a copy of the phase parameters.
   */
  public RefinementParameters getParameters(double[] x) {
    setInternal(x);
    return parameters.copy();
  }

  private void setInternal(double[] x) {
    box.toExternal(x, external);
    for (int i = 0; i < n; i++) {
      parameters.set(variables.get(i), external[i]);
    }
  }
}

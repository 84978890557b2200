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
import static ppx.utilities.Constants.NS2SEC;

import java.util.logging.Level;
import java.util.logging.Logger;
import ppx.numerics.optimization.LBFGS;
import ppx.numerics.optimization.LineSearch.LineSearchResult;
import ppx.numerics.optimization.OptimizationListener;

/**
 * Minimizes a {@link LeBailPhaseEnergy} with L-BFGS and logs the progress.
 *
 * @author Timothy D. Fenn
 * @since 1.0
 */
public class LeBailPhaseMinimize implements OptimizationListener {

  private static final Logger logger = Logger.getLogger(LeBailPhaseMinimize.class.getName());

  private final LeBailPhaseEnergy phaseEnergy;
  private final RefinementOptions options;
  private final String name;
  private final int n;
  private final double[] x;
  private final double[] grad;
  private long time;
  private double grms;
  private int nSteps;
  private int status;
  private double finalEnergy;

  /**
   * Constructor for LeBailPhaseMinimize.
   *
   * @param phaseEnergy the objective of one phase.
   * @param options refinement settings (L-BFGS controls).
   * @param name phase name used in log messages.
   */
  public LeBailPhaseMinimize(LeBailPhaseEnergy phaseEnergy, RefinementOptions options,
      String name) {
    this.phaseEnergy = phaseEnergy;
    this.options = options;
    this.name = name;
    n = phaseEnergy.getNumberOfVariables();
    x = phaseEnergy.getCoordinates(null);
    grad = new double[n];
  }

  /**
   * Run the minimization.
   *
   * @return the refined parameters at the final point.
   */
  public RefinementParameters minimize() {
    long mtime = -System.nanoTime();
    time = -System.nanoTime();
    double initialEnergy = phaseEnergy.energyAndGradient(x, grad);
    status = LBFGS.minimize(n, options.getCorrections(), x, initialEnergy, grad,
        options.getGradientTolerance(), options.getFunctionTolerance(),
        options.getMaxIterations(), phaseEnergy, this);

    // Evaluate at the returned point so the reported value matches the parameters.
    finalEnergy = phaseEnergy.energy(x);
    RefinementParameters refined = phaseEnergy.getParameters(x);

    if (logger.isLoggable(Level.FINE)) {
      switch (status) {
        case LBFGS.CONVERGED:
          logger.fine(format(" %s: convergence criteria achieved (G RMS %10.5f).", name, grms));
          break;
        case LBFGS.TERMINATED:
          logger.fine(format(" %s: optimization terminated at step %d.", name, nSteps));
          break;
        default:
          logger.fine(format(" %s: optimization failed.", name));
      }
      mtime += System.nanoTime();
      logger.fine(format(" Optimization time: %8.3f (sec)", mtime * NS2SEC));
    }
    return refined;
  }

  /**
   * L-BFGS status of the last minimization.
   *
   * @return {@link LBFGS#CONVERGED}, {@link LBFGS#TERMINATED} or {@link LBFGS#FAILED}.
   */
  public int getStatus() {
    return status;
  }

  /**
   * Objective at the end of the last minimization.
   *
   * @return the final objective.
   */
  public double getFinalEnergy() {
    return finalEnergy;
  }

  /** {@inheritDoc} */
  @Override
  public boolean optimizationUpdate(int iter, int nfun, double grms, double xrms, double f,
      double df, double angle, LineSearchResult info) {
    long currentTime = System.nanoTime();
    double seconds = (currentTime + time) * NS2SEC;
    time = -currentTime;
    this.grms = grms;
    this.nSteps = iter;

    if (!logger.isLoggable(Level.FINE)) {
      return true;
    }
    if (iter == 0) {
      logger.fine(format("\n Limited Memory BFGS Quasi-Newton Optimization of %s\n", name));
      logger.fine(" Cycle       Energy      G RMS    Delta E   Delta X    Angle  Evals     Time");
    }
    if (info == null) {
      logger.fine(format("%6d %12.5f %10.6f", iter, f, grms));
    } else if (info == LineSearchResult.Success) {
      logger.fine(format("%6d %12.5f %10.6f %10.6f %9.5f %8.2f %6d %8.3f", iter, f, grms, df,
          xrms, angle, nfun, seconds));
    } else {
      logger.fine(format("%6d %12.5f %10.6f %10.6f %9.5f %8.2f %6d %8s", iter, f, grms, df, xrms,
          angle, nfun, info));
    }
    return true;
  }
}

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

import ppx.numerics.optimization.LineSearch.LineSearchResult;

/**
 * The OptimizationListener interface is used by the L-BFGS optimizer to update its listener.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface OptimizationListener {

  /**
   * After a successful step is taken, this method is called by the optimizer to allow the
   * implementing class to be notified. It can be used to log status messages or gracefully
   * terminate the optimizer.
   *
   * @param iter Number of iterations.
   * @param nfun Number of function evaluations.
   * @param grms RMS gradient at current solution.
   * @param xrms RMS coordinate change at current solution.
   * @param f Function value at current solution.
   * @param df Change in the function value compared to the previous solution.
   * @param angle Current angle between gradient and search direction.
   * @param info Result of the line search (null at iteration == 0).
   * @return A return value of false will terminate the optimization.
   */
  boolean optimizationUpdate(int iter, int nfun, double grms, double xrms, double f, double df,
      double angle, LineSearchResult info);
}

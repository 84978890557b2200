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
package ppx.numerics;

/**
 * The OptimizationInterface defines the methods required by the L-BFGS optimizer.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface OptimizationInterface {

  /**
   * This method is called repeatedly to compute the function value.
   *
   * @param x Input parameters.
   * @return Function value at <code>x</code>.
   */
  double energy(double[] x);

  /**
   * This method is called repeatedly by the optimizer to compute the function value and its
   * gradient.
   *
   * @param x Input parameters.
   * @param g Output gradients with respect to each parameter.
   * @return Function value at <code>x</code>.
   */
  double energyAndGradient(double[] x, double[] g);

  /**
   * Load the current value of the parameters. If the supplied array is null or not large enough, a
   * new one should be created. The filled array is returned.
   *
   * @param parameters Supplied array.
   * @return The array filled with parameter values.
   */
  double[] getCoordinates(double[] parameters);

  /**
   * Get the number of variables being operated on.
   *
   * @return Number of variables.
   */
  int getNumberOfVariables();

  /**
   * Get the problem scaling.
   *
   * @return The scaling value used for each variable, or null for unit scaling.
   */
  double[] getScaling();
}

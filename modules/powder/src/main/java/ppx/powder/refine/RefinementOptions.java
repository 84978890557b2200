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

import java.util.EnumMap;
import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;

/**
 * Settings of a {@link LeBailRefinement}: parameter bounds, the optional staged schedule,
 * normalization and 2-theta window, and the per-phase L-BFGS controls.
 *
 * <p>Bounds are read from keys of the form <code>lebail-[variable]-min</code> and
 * <code>lebail-[variable]-max</code>, e.g. <code>lebail-scale-max</code>.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class RefinementOptions {

  private final Map<RefinementVariable, double[]> bounds;
  private final double cellFraction;
  private final boolean staged;
  private final boolean normalize;
  private final double twoThetaMin;
  private final double twoThetaMax;
  private final double gradientTolerance;
  private final double functionTolerance;
  private final int maxIterations;
  private final int corrections;
  private final double finiteDifferenceStep;

  private RefinementOptions(CompositeConfiguration properties) {
    bounds = new EnumMap<>(RefinementVariable.class);
    for (RefinementVariable variable : RefinementVariable.values()) {
      if (variable.isCell()) {
        continue;
      }
      String key = "lebail-" + variable.getKey();
      double min = properties.getDouble(key + "-min", variable.getDefaultMin());
      double max = properties.getDouble(key + "-max", variable.getDefaultMax());
      if (!(max > min)) {
        throw new IllegalArgumentException(
            format(" Invalid bounds for %s: [%g, %g].", variable, min, max));
      }
      bounds.put(variable, new double[] {min, max});
    }
    if (bounds.get(RefinementVariable.SCALE)[0] <= 0.0) {
      throw new IllegalArgumentException(" The lower scale bound must be positive.");
    }
    cellFraction = properties.getDouble("lebail-cell-fraction", 0.05);
    if (!(cellFraction > 0.0 && cellFraction < 1.0)) {
      throw new IllegalArgumentException(
          format(" The cell length fraction must lie in (0, 1) (%g).", cellFraction));
    }
    staged = properties.getBoolean("lebail-staged", false);
    normalize = properties.getBoolean("lebail-normalize", false);
    twoThetaMin = properties.getDouble("lebail-two-theta-min", Double.NEGATIVE_INFINITY);
    twoThetaMax = properties.getDouble("lebail-two-theta-max", Double.POSITIVE_INFINITY);
    gradientTolerance = properties.getDouble("lebail-gradient-tolerance", 1.0e-5);
    functionTolerance = properties.getDouble("lebail-function-tolerance", 1.0e-6);
    maxIterations = properties.getInt("lebail-max-iterations", 50);
    corrections = properties.getInt("lebail-corrections", 5);
    finiteDifferenceStep = properties.getDouble("lebail-finite-difference-step", 1.0e-5);
    if (maxIterations < 1 || corrections < 1 || !(finiteDifferenceStep > 0.0)) {
      throw new IllegalArgumentException(" Invalid L-BFGS settings for the Le Bail refinement.");
    }
  }

  /**
   * Default refinement settings.
   *
   * @return the defaults.
   */
  public static RefinementOptions defaults() {
    return new RefinementOptions(new CompositeConfiguration());
  }

  /**
   * Read refinement settings, falling back to the defaults for missing keys.
   *
   * @param properties the configuration.
   * @return the settings.
   */
  public static RefinementOptions fromProperties(CompositeConfiguration properties) {
    return new RefinementOptions(properties);
  }

  /**
   * Lower bound of a variable. Cell lengths are bounded by {@link #getCellFraction()}.
   *
   * @param variable a variable other than a cell length.
   * @return the lower bound.
   */
  public double getMin(RefinementVariable variable) {
    return bounds.get(variable)[0];
  }

  /**
   * Upper bound of a variable. Cell lengths are bounded by {@link #getCellFraction()}.
   *
   * @param variable a variable other than a cell length.
   * @return the upper bound.
   */
  public double getMax(RefinementVariable variable) {
    return bounds.get(variable)[1];
  }

  /**
   * Allowed relative change of each lattice length from its value at the start of a refinement.
   *
   * @return the fraction (0.05 by default).
   */
  public double getCellFraction() {
    return cellFraction;
  }

  public boolean isStaged() {
    return staged;
  }

  public boolean isNormalize() {
    return normalize;
  }

  /**
   * Whether a finite 2-theta window was configured.
   *
   * @return true if the pattern should be restricted.
   */
  public boolean hasTwoThetaWindow() {
    return Double.isFinite(twoThetaMin) || Double.isFinite(twoThetaMax);
  }

  public double getTwoThetaMin() {
    return twoThetaMin;
  }

  public double getTwoThetaMax() {
    return twoThetaMax;
  }

  public double getGradientTolerance() {
    return gradientTolerance;
  }

  public double getFunctionTolerance() {
    return functionTolerance;
  }

  public int getMaxIterations() {
    return maxIterations;
  }

  public int getCorrections() {
    return corrections;
  }

  public double getFiniteDifferenceStep() {
    return finiteDifferenceStep;
  }
}

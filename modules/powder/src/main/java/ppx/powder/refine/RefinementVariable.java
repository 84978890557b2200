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

/**
 * Per-phase quantities a Le Bail refinement can vary, with their default bounds.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public enum RefinementVariable {
  SCALE("scale", 0.01, 10.0),
  U("u", 0.0, 1.0),
  V("v", -0.1, 0.1),
  W("w", 0.001, 1.0),
  ETA("eta", 0.0, 1.0),
  ZERO_SHIFT("zero-shift", -0.5, 0.5),
  /** Cell lengths are bounded relative to their value at the start of a refinement. */
  CELL_A("cell-a", Double.NaN, Double.NaN),
  CELL_B("cell-b", Double.NaN, Double.NaN),
  CELL_C("cell-c", Double.NaN, Double.NaN);

  private final String key;
  private final double defaultMin;
  private final double defaultMax;

  RefinementVariable(String key, double defaultMin, double defaultMax) {
    this.key = key;
    this.defaultMin = defaultMin;
    this.defaultMax = defaultMax;
  }

  /**
   * Configuration key fragment, e.g. "lebail-" + key + "-min".
   *
   * @return the key.
   */
  public String getKey() {
    return key;
  }

  /**
   * Default lower bound (NaN for cell lengths).
   *
   * @return the lower bound.
   */
  public double getDefaultMin() {
    return defaultMin;
  }

  /**
   * Default upper bound (NaN for cell lengths).
   *
   * @return the upper bound.
   */
  public double getDefaultMax() {
    return defaultMax;
  }

  /**
   * True for U, V, W and eta.
   *
   * @return whether this is a peak profile variable.
   */
  public boolean isProfile() {
    return this == U || this == V || this == W || this == ETA;
  }

  /**
   * True for the three lattice lengths.
   *
   * @return whether this is a cell variable.
   */
  public boolean isCell() {
    return this == CELL_A || this == CELL_B || this == CELL_C;
  }

  /**
   * Lattice length index (0, 1, 2) of a cell variable.
   *
   * @return the index, or -1 for other variables.
   */
  public int cellIndex() {
    switch (this) {
      case CELL_A:
        return 0;
      case CELL_B:
        return 1;
      case CELL_C:
        return 2;
      default:
        return -1;
    }
  }
}

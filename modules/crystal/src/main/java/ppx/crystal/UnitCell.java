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
package ppx.crystal;

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static org.apache.commons.math3.util.FastMath.toRadians;

/**
 * The UnitCell record holds the lattice lengths (Angstroms) and angles (degrees) of a crystal.
 *
 * @param a The a-axis length.
 * @param b The b-axis length.
 * @param c The c-axis length.
 * @param alpha The alpha angle.
 * @param beta The beta angle.
 * @param gamma The gamma angle.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record UnitCell(double a, double b, double c, double alpha, double beta, double gamma) {

  /**
   * Canonical constructor that checks the lattice is physical.
   */
  public UnitCell {
    if (!(a > 0.0 && b > 0.0 && c > 0.0)) {
      throw new IllegalArgumentException(
          format(" Lattice lengths must be positive (%g, %g, %g).", a, b, c));
    }
    if (!(alpha > 0.0 && alpha < 180.0 && beta > 0.0 && beta < 180.0
        && gamma > 0.0 && gamma < 180.0)) {
      throw new IllegalArgumentException(
          format(" Lattice angles must lie in (0, 180) degrees (%g, %g, %g).", alpha, beta, gamma));
    }
  }

  /**
   * A cubic cell.
   *
   * @param a the lattice length.
   * @return a cubic UnitCell.
   */
  public static UnitCell cubic(double a) {
    return new UnitCell(a, a, a, 90.0, 90.0, 90.0);
  }

  /**
   * Lattice lengths as a new array {a, b, c}.
   *
   * @return the lattice lengths.
   */
  public double[] lengths() {
    return new double[] {a, b, c};
  }

  /**
   * Return a copy of this cell with new lattice lengths and the same angles.
   *
   * @param lengths the new lattice lengths {a, b, c}.
   * @return a new UnitCell.
   */
  public UnitCell withLengths(double[] lengths) {
    return new UnitCell(lengths[0], lengths[1], lengths[2], alpha, beta, gamma);
  }

  /**
   * Unit cell volume.
   *
   * @return the volume in cubic Angstroms.
   */
  public double volume() {
    double cosA = cos(toRadians(alpha));
    double cosB = cos(toRadians(beta));
    double cosG = cos(toRadians(gamma));
    double v = 1.0 - cosA * cosA - cosB * cosB - cosG * cosG + 2.0 * cosA * cosB * cosG;
    return a * b * c * sqrt(v);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("a=%.4f b=%.4f c=%.4f alpha=%.2f beta=%.2f gamma=%.2f", a, b, c, alpha, beta,
        gamma);
  }
}

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

import javax.annotation.Nullable;
import ppx.powder.profile.CagliotiParameters;

/**
 * Refinable parameters of one phase: scale, Caglioti widths, Lorentzian fraction, zero-point shift
 * and lattice lengths, with flags selecting which groups are refined.
 *
 * <p>Instances are mutable working state of a refinement; snapshots are taken with {@link
 * #copy()}.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RefinementParameters {

  /** Initial U of a refinement. */
  public static final double DEFAULT_U = 0.01;
  /** Initial V of a refinement. */
  public static final double DEFAULT_V = -0.001;
  /** Initial W of a refinement. */
  public static final double DEFAULT_W = 0.01;
  /** Initial Lorentzian fraction of a refinement. */
  public static final double DEFAULT_ETA = 0.5;

  private double scaleFactor;
  private double u;
  private double v;
  private double w;
  private double eta;
  private double zeroShift;
  @Nullable
  private double[] cellLengths;
  private boolean refineScale;
  private boolean refineProfile;
  private boolean refineCell;

  /**
   * Constructor for RefinementParameters.
   *
   * @param scaleFactor scale factor (positive).
   * @param u Caglioti U.
   * @param v Caglioti V.
   * @param w Caglioti W.
   * @param eta Lorentzian fraction in [0, 1].
   * @param zeroShift zero-point shift (degrees).
   * @param cellLengths lattice lengths {a, b, c}, or null when unknown.
   * @param refineScale refine the scale factor.
   * @param refineProfile refine U, V, W and eta.
   * @param refineCell refine the lattice lengths.
   */
  public RefinementParameters(double scaleFactor, double u, double v, double w, double eta,
      double zeroShift, @Nullable double[] cellLengths, boolean refineScale,
      boolean refineProfile, boolean refineCell) {
    if (!(scaleFactor > 0.0)) {
      throw new IllegalArgumentException(
          format(" The scale factor must be positive (%g).", scaleFactor));
    }
    if (!(eta >= 0.0 && eta <= 1.0)) {
      throw new IllegalArgumentException(format(" Eta must lie in [0, 1] (%g).", eta));
    }
    if (cellLengths != null && cellLengths.length != 3) {
      throw new IllegalArgumentException(" Three lattice lengths are required.");
    }
    this.scaleFactor = scaleFactor;
    this.u = u;
    this.v = v;
    this.w = w;
    this.eta = eta;
    this.zeroShift = zeroShift;
    this.cellLengths = (cellLengths == null) ? null : cellLengths.clone();
    this.refineScale = refineScale;
    this.refineProfile = refineProfile;
    this.refineCell = refineCell;
  }

  /**
   * Default starting parameters: U = 0.01, V = -0.001, W = 0.01, eta = 0.5, no zero shift and
   * every group refined.
   *
   * @param scaleFactor starting scale factor.
   * @param cellLengths lattice lengths {a, b, c}, or null.
   * @return new parameters.
   */
  public static RefinementParameters defaults(double scaleFactor, @Nullable double[] cellLengths) {
    return new RefinementParameters(scaleFactor, DEFAULT_U, DEFAULT_V, DEFAULT_W, DEFAULT_ETA, 0.0,
        cellLengths, true, true, true);
  }

  /**
   * A deep copy of these parameters.
   *
   * @return the copy.
   */
  public RefinementParameters copy() {
    return new RefinementParameters(scaleFactor, u, v, w, eta, zeroShift, cellLengths, refineScale,
        refineProfile, refineCell);
  }

  /**
   * Value of one refinable variable.
   *
   * @param variable the variable.
   * @return its value (NaN for a cell length when no cell is known).
   */
  public double get(RefinementVariable variable) {
    switch (variable) {
      case SCALE:
        return scaleFactor;
      case U:
        return u;
      case V:
        return v;
      case W:
        return w;
      case ETA:
        return eta;
      case ZERO_SHIFT:
        return zeroShift;
      default:
        return (cellLengths == null) ? Double.NaN : cellLengths[variable.cellIndex()];
    }
  }

  /**
   * Set one refinable variable.
   *
   * @param variable the variable.
   * @param value the new value.
   */
  public void set(RefinementVariable variable, double value) {
    switch (variable) {
      case SCALE:
        scaleFactor = value;
        break;
      case U:
        u = value;
        break;
      case V:
        v = value;
        break;
      case W:
        w = value;
        break;
      case ETA:
        eta = value;
        break;
      case ZERO_SHIFT:
        zeroShift = value;
        break;
      default:
        if (cellLengths != null) {
          cellLengths[variable.cellIndex()] = value;
        }
    }
  }

  /**
   * Caglioti width parameters.
   *
   * @return U, V and W.
   */
  public CagliotiParameters getCaglioti() {
    return new CagliotiParameters(u, v, w);
  }

  public double getScaleFactor() {
    return scaleFactor;
  }

  public double getU() {
    return u;
  }

  public double getV() {
    return v;
  }

  public double getW() {
    return w;
  }

  public double getEta() {
    return eta;
  }

  public double getZeroShift() {
    return zeroShift;
  }

  /**
   * A copy of the lattice lengths.
   *
   * @return {a, b, c}, or null when no cell is known.
   */
  @Nullable
  public double[] getCellLengths() {
    return (cellLengths == null) ? null : cellLengths.clone();
  }

  /**
   * Set the lattice lengths.
   *
   * @param cellLengths {a, b, c}, or null when no cell is known.
   */
  public void setCellLengths(@Nullable double[] cellLengths) {
    if (cellLengths != null && cellLengths.length != 3) {
      throw new IllegalArgumentException(" Three lattice lengths are required.");
    }
    this.cellLengths = (cellLengths == null) ? null : cellLengths.clone();
  }

  public boolean isRefineScale() {
    return refineScale;
  }

  public void setRefineScale(boolean refineScale) {
    this.refineScale = refineScale;
  }

  public boolean isRefineProfile() {
    return refineProfile;
  }

  public void setRefineProfile(boolean refineProfile) {
    this.refineProfile = refineProfile;
  }

  public boolean isRefineCell() {
    return refineCell;
  }

  public void setRefineCell(boolean refineCell) {
    this.refineCell = refineCell;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Scale %8.4f U %9.6f V %9.6f W %9.6f Eta %6.3f Zero %7.4f", scaleFactor, u, v,
        w, eta, zeroShift);
  }
}

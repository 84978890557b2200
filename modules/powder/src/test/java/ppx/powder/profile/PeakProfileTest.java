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
package ppx.powder.profile;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import ppx.utilities.PPXTest;

/**
 * Test the Caglioti width and the pseudo-Voigt profile.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class PeakProfileTest extends PPXTest {

  private final String info;
  private final double u;
  private final double v;
  private final double w;

  public PeakProfileTest(String info, double u, double v, double w) {
    this.info = info;
    this.u = u;
    this.v = v;
    this.w = w;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"All zero", 0.0, 0.0, 0.0},
        {"Decomposition default", 0.0, 0.0, 0.01},
        {"Refinement default", 0.01, -0.001, 0.01},
        {"Negative", -1.0, -0.1, -0.5},
        {"Broad", 1.0, 0.1, 1.0}
    });
  }

  @Test
  public void testPeakWidthPositive() {
    for (double twoTheta = 1.0; twoTheta <= 180.0; twoTheta += 1.0) {
      double fwhm = PeakProfile.peakWidth(twoTheta, u, v, w);
      assertTrue(info + " at " + twoTheta, Double.isFinite(fwhm));
      assertTrue(info + " at " + twoTheta, fwhm >= Math.sqrt(PeakProfile.MIN_FWHM_SQUARED));
    }
  }

  @Test
  public void testHalfMaximum() {
    double fwhm = PeakProfile.peakWidth(30.0, u, v, w);
    for (double eta : new double[] {0.0, 0.3, 1.0}) {
      assertEquals(info, 50.0, PeakProfile.profileValue(30.0, 30.0, fwhm, 50.0, eta), 1.0e-10);
      assertEquals(info, 25.0,
          PeakProfile.profileValue(30.0 + 0.5 * fwhm, 30.0, fwhm, 50.0, eta), 1.0e-8);
      assertEquals(info, 25.0,
          PeakProfile.profileValue(30.0 - 0.5 * fwhm, 30.0, fwhm, 50.0, eta), 1.0e-8);
    }
  }

  @Test
  public void testCutoff() {
    double fwhm = PeakProfile.peakWidth(30.0, u, v, w);
    double beyond = 30.0 + 1.01 * PeakProfile.CUTOFF * fwhm;
    assertEquals(info, 0.0, PeakProfile.profileValue(beyond, 30.0, fwhm, 100.0, 1.0), 0.0);
    assertEquals(info, 0.0, PeakProfile.profileValue(30.0, 30.0, fwhm, 0.0, 0.5), 0.0);
  }

  @Test
  public void testEtaLimitedToUnitRange() {
    double fwhm = PeakProfile.peakWidth(30.0, u, v, w);
    double x = 30.0 + 1.5 * fwhm;
    assertEquals(info, PeakProfile.profileValue(x, 30.0, fwhm, 100.0, 1.0),
        PeakProfile.profileValue(x, 30.0, fwhm, 100.0, 2.5), 0.0);
    assertEquals(info, PeakProfile.profileValue(x, 30.0, fwhm, 100.0, 0.0),
        PeakProfile.profileValue(x, 30.0, fwhm, 100.0, -0.5), 0.0);
  }
}

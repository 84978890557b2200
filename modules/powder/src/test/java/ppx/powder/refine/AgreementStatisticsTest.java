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

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import ppx.utilities.PPXTest;

/**
 * Test the profile agreement statistics.
 *
 * @author Michael J. Schnieders
 */
public class AgreementStatisticsTest extends PPXTest {

  @Test
  public void testKnownValues() {
    AgreementStatistics s = AgreementStatistics.compute(new double[] {10.0, 20.0},
        new double[] {8.0, 22.0}, new double[] {1.0, 1.0}, 0);
    assertEquals(100.0 * 4.0 / 30.0, s.rp(), 1.0e-10);
    assertEquals(100.0 * Math.sqrt(8.0 / 500.0), s.rwp(), 1.0e-10);
    assertEquals(100.0 * Math.sqrt(2.0 / 500.0), s.rexp(), 1.0e-10);
    assertEquals(2.0, s.gof(), 1.0e-10);
    assertEquals(4.0, s.chiSquared(), 1.0e-10);
  }

  @Test
  public void testPerfectFit() {
    double[] obs = {5.0, 9.0, 4.0};
    AgreementStatistics s = AgreementStatistics.compute(obs, obs, new double[] {2.0, 3.0, 2.0}, 1);
    assertEquals(0.0, s.rp(), 0.0);
    assertEquals(0.0, s.rwp(), 0.0);
    assertEquals(0.0, s.gof(), 0.0);
    assertEquals(0.0, s.chiSquared(), 0.0);
  }

  @Test
  public void testDegenerateDenominators() {
    AgreementStatistics s = AgreementStatistics.compute(new double[] {1.0, 2.0},
        new double[] {1.5, 2.5}, new double[] {1.0, 1.0}, 2);
    assertEquals(Double.POSITIVE_INFINITY, s.rexp(), 0.0);
    assertEquals(Double.POSITIVE_INFINITY, s.gof(), 0.0);
    assertEquals(Double.POSITIVE_INFINITY, s.chiSquared(), 0.0);

    AgreementStatistics zero = AgreementStatistics.compute(new double[] {0.0, 0.0},
        new double[] {1.0, 1.0}, new double[] {1.0, 1.0}, 0);
    assertEquals(Double.POSITIVE_INFINITY, zero.rp(), 0.0);
    assertEquals(Double.POSITIVE_INFINITY, zero.rwp(), 0.0);
  }
}

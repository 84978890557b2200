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
package ppx.powder;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;
import ppx.utilities.PPXTest;

/**
 * Test validation and derived views of a measured pattern.
 *
 * @author Michael J. Schnieders
 */
public class ExperimentalPatternTest extends PPXTest {

  private final double[] twoTheta = {10.0, 11.0, 12.0, 13.0};
  private final double[] intensity = {1.0, 4.0, 2.0, 8.0};

  @Test
  public void testDefensiveCopies() {
    double[] t = twoTheta.clone();
    ExperimentalPattern pattern = new ExperimentalPattern(t, intensity);
    t[0] = 99.0;
    assertEquals(10.0, pattern.getTwoTheta()[0], 0.0);
    pattern.getIntensity()[0] = -5.0;
    assertEquals(1.0, pattern.getIntensity()[0], 0.0);
    assertNull(pattern.getUncertainty());
  }

  @Test
  public void testRestrict() {
    ExperimentalPattern pattern =
        new ExperimentalPattern(twoTheta, intensity, new double[] {1.0, 2.0, 3.0, 4.0});
    ExperimentalPattern window = pattern.restrict(10.5, 12.0);
    assertArrayEquals(new double[] {11.0, 12.0}, window.getTwoTheta(), 0.0);
    assertArrayEquals(new double[] {2.0, 3.0}, window.getUncertainty(), 0.0);
  }

  @Test
  public void testNormalized() {
    ExperimentalPattern pattern =
        new ExperimentalPattern(twoTheta, intensity, new double[] {1.0, 2.0, 3.0, 4.0});
    ExperimentalPattern normalized = pattern.normalized(100.0);
    assertEquals(100.0, normalized.getMaxIntensity(), 1.0e-12);
    assertEquals(50.0, normalized.getUncertainty()[3], 1.0e-12);
  }

  @Test(expected = InvalidPatternException.class)
  public void testEmptyWindow() {
    new ExperimentalPattern(twoTheta, intensity).restrict(20.0, 30.0);
  }

  @Test(expected = InvalidPatternException.class)
  public void testEmpty() {
    new ExperimentalPattern(new double[0], new double[0]);
  }

  @Test(expected = InvalidPatternException.class)
  public void testMismatchedLengths() {
    new ExperimentalPattern(twoTheta, new double[] {1.0, 2.0});
  }

  @Test(expected = InvalidPatternException.class)
  public void testNegativeUncertainty() {
    new ExperimentalPattern(twoTheta, intensity, new double[] {1.0, -1.0, 1.0, 1.0});
  }

  @Test(expected = InvalidPatternException.class)
  public void testDecreasingGrid() {
    new ExperimentalPattern(new double[] {10.0, 9.0}, new double[] {1.0, 1.0});
  }
}

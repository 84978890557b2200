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
package ppx.powder.match;

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import ppx.powder.SyntheticPatterns;
import ppx.powder.TheoreticalPeakSet;
import ppx.powder.profile.CagliotiParameters;
import ppx.powder.profile.PatternSynthesizer;
import ppx.utilities.PPXTest;

/**
 * Test scoring of a candidate pattern against a residue.
 *
 * @author Michael J. Schnieders
 */
public class ResidueMatcherTest extends PPXTest {

  private static final CagliotiParameters WIDTH = new CagliotiParameters(0.0, 0.0, 0.01);
  private final double[] grid = SyntheticPatterns.grid(10.0, 50.0, 0.02);
  private final ResidueMatcher matcher = new ResidueMatcher(MatchOptions.defaults());

  private double[] curve(double[] positions, double[] intensities) {
    return PatternSynthesizer.synthesize(grid, new TheoreticalPeakSet(positions, intensities),
        WIDTH, 1.0, 0.0, 0.3);
  }

  @Test
  public void testIdenticalCurves() {
    double[] c = curve(new double[] {20.0, 30.0, 40.0}, new double[] {100.0, 50.0, 80.0});
    MatchScore score = matcher.score(c, c);
    assertEquals(1.0, score.correlation(), 1.0e-9);
    assertEquals(1.0, score.optimalScaling(), 1.0e-4);
  }

  @Test
  public void testScaledCopy() {
    double[] c = curve(new double[] {20.0, 30.0}, new double[] {100.0, 50.0});
    double[] r = new double[c.length];
    for (int i = 0; i < c.length; i++) {
      r[i] = 3.0 * c[i];
    }
    MatchScore score = matcher.score(r, c);
    assertEquals(1.0, score.correlation(), 1.0e-9);
  }

  @Test
  public void testDisjointCurves() {
    double[] r = curve(new double[] {20.0}, new double[] {100.0});
    double[] c = curve(new double[] {30.0}, new double[] {100.0});
    assertEquals(0.0, matcher.score(r, c).correlation(), 0.0);
  }

  @Test
  public void testZeroResidue() {
    double[] c = curve(new double[] {20.0}, new double[] {100.0});
    MatchScore score = matcher.score(new double[grid.length], c);
    assertEquals(MatchScore.NONE, score);
  }

  @Test
  public void testDeterministic() {
    double[] r = curve(new double[] {20.0, 30.0, 40.0}, new double[] {100.0, 50.0, 80.0});
    double[] c = curve(new double[] {20.05, 30.0, 41.0}, new double[] {60.0, 50.0, 80.0});
    MatchScore first = matcher.score(r, c);
    MatchScore second = matcher.score(r, c);
    assertEquals(first.correlation(), second.correlation(), 0.0);
    assertEquals(first.optimalScaling(), second.optimalScaling(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLengthMismatch() {
    matcher.score(new double[3], new double[4]);
  }
}

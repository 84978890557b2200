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
package ppx.powder.parsers;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import org.junit.Test;
import ppx.powder.ExperimentalPattern;
import ppx.powder.InvalidPatternException;
import ppx.utilities.PPXTest;

/**
 * Test reading two and three column pattern files.
 *
 * @author Michael J. Schnieders
 */
public class XYFilterTest extends PPXTest {

  private static ExperimentalPattern read(String text) throws IOException {
    return new XYFilter().readPattern(new StringReader(text), "test.xy");
  }

  @Test
  public void testTwoColumns() throws IOException {
    ExperimentalPattern pattern = read("# 2theta intensity\n"
        + "10.0 5.0\n"
        + "\n"
        + "! comment\n"
        + "10.02,7.5\n"
        + "  10.04\t 6.25  \n");
    assertEquals(3, pattern.size());
    assertArrayEquals(new double[] {10.0, 10.02, 10.04}, pattern.getTwoTheta(), 0.0);
    assertArrayEquals(new double[] {5.0, 7.5, 6.25}, pattern.getIntensity(), 0.0);
    assertFalse(pattern.hasUncertainty());
  }

  @Test
  public void testUncertainty() throws IOException {
    ExperimentalPattern pattern = read("10.0 5.0 1.0\n10.1 9.0 3.0\n");
    assertTrue(pattern.hasUncertainty());
    assertArrayEquals(new double[] {1.0, 3.0}, pattern.getUncertainty(), 0.0);

    ExperimentalPattern partial = read("10.0 5.0 1.0\n10.1 9.0\n");
    assertFalse(partial.hasUncertainty());
  }

  @Test(expected = InvalidPatternException.class)
  public void testNonIncreasing() throws IOException {
    read("10.0 5.0\n10.0 6.0\n");
  }

  @Test(expected = InvalidPatternException.class)
  public void testNotNumeric() throws IOException {
    read("10.0 five\n");
  }

  @Test(expected = InvalidPatternException.class)
  public void testEmpty() throws IOException {
    read("# header only\n\n");
  }

  @Test
  public void testReadFile() throws IOException {
    File file = writeTestFile("pattern.xy", "20.0 1.0\n20.5 2.0\n21.0 3.0\n");
    ExperimentalPattern pattern = new XYFilter().readFile(file);
    assertEquals(3, pattern.size());
    assertEquals(3.0, pattern.getMaxIntensity(), 0.0);
  }
}

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
package ppx.numerics.optimization;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import ppx.utilities.PPXTest;

/**
 * Test the sine transform used for box-constrained optimization.
 *
 * @author Michael J. Schnieders
 */
public class BoxConstraintsTest extends PPXTest {

  private final BoxConstraints box =
      new BoxConstraints(new double[] {0.01, -0.5, 0.0}, new double[] {10.0, 0.5, 1.0});

  /** Every internal value maps inside the box. */
  @Test
  public void testExternalInsideBox() {
    double[] external = new double[3];
    for (double u = -20.0; u <= 20.0; u += 0.37) {
      box.toExternal(new double[] {u, -u, 3.0 * u}, external);
      for (int i = 0; i < 3; i++) {
        assertTrue(external[i] >= box.getLower(i));
        assertTrue(external[i] <= box.getUpper(i));
      }
    }
  }

  /** Interior values survive the transform; values outside the box are clamped to it. */
  @Test
  public void testInternalExternal() {
    double[] internal = box.toInternal(new double[] {1.0, 0.1, 0.5}, null);
    double[] external = box.toExternal(internal, null);
    assertEquals(1.0, external[0], 1.0e-10);
    assertEquals(0.1, external[1], 1.0e-10);
    assertEquals(0.5, external[2], 1.0e-10);

    internal = box.toInternal(new double[] {100.0, -3.0, 0.5}, null);
    external = box.toExternal(internal, null);
    assertEquals(10.0, external[0], 1.0e-6);
    assertEquals(-0.5, external[1], 1.0e-6);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyBox() {
    new BoxConstraints(new double[] {1.0}, new double[] {1.0});
  }
}

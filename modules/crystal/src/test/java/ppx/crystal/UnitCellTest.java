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

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Collection;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;
import ppx.utilities.PPXTest;

/**
 * Test unit cell volumes for several lattice systems.
 *
 * @author Michael J. Schnieders
 */
@RunWith(Parameterized.class)
public class UnitCellTest extends PPXTest {

  private final String info;
  private final UnitCell unitCell;
  private final double volume;

  public UnitCellTest(String info, UnitCell unitCell, double volume) {
    this.info = info;
    this.unitCell = unitCell;
    this.volume = volume;
  }

  @Parameters
  public static Collection<Object[]> data() {
    return Arrays.asList(new Object[][] {
        {"Cubic NaCl", UnitCell.cubic(5.64), 5.64 * 5.64 * 5.64},
        {"Orthorhombic", new UnitCell(4.0, 5.0, 6.0, 90.0, 90.0, 90.0), 120.0},
        // Hexagonal: a^2 c sqrt(3) / 2.
        {"Hexagonal quartz", new UnitCell(4.913, 4.913, 5.405, 90.0, 90.0, 120.0),
            4.913 * 4.913 * 5.405 * Math.sqrt(3.0) / 2.0},
        // Monoclinic: a b c sin(beta).
        {"Monoclinic", new UnitCell(5.0, 6.0, 7.0, 90.0, 100.0, 90.0),
            210.0 * Math.sin(Math.toRadians(100.0))}
    });
  }

  @Test
  public void testVolume() {
    assertEquals(info, volume, unitCell.volume(), 1.0e-8);
  }

  @Test
  public void testWithLengths() {
    UnitCell scaled = unitCell.withLengths(new double[] {1.0, 2.0, 3.0});
    assertEquals(info, 2.0, scaled.b(), 0.0);
    assertEquals(info, unitCell.gamma(), scaled.gamma(), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLength() {
    new UnitCell(-1.0, 1.0, 1.0, 90.0, 90.0, 90.0);
  }
}

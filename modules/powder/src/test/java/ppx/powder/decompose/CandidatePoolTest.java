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
package ppx.powder.decompose;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static ppx.powder.SyntheticPatterns.phase;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import ppx.powder.CandidatePhase;
import ppx.utilities.PPXTest;

/**
 * Test removal of accepted phases from a session's candidate pool.
 *
 * @author Michael J. Schnieders
 */
public class CandidatePoolTest extends PPXTest {

  private final CandidatePhase quartz =
      phase("0000789", "Quartz", new double[] {26.6}, new double[] {100.0});
  private final CandidatePhase quartzAgain =
      phase("0000789", "Quartz low", new double[] {20.9}, new double[] {35.0});
  private final CandidatePhase halite =
      phase("0001234", "Halite", new double[] {31.7}, new double[] {100.0});

  @Test
  public void testRemoveByIdRemovesEveryEntry() {
    List<CandidatePhase> ranked = Arrays.asList(quartz, halite, quartzAgain);
    CandidatePool pool = new CandidatePool(ranked);
    assertEquals(2, pool.removeById("0000789"));
    assertEquals(1, pool.size());
    assertEquals("Halite", pool.getCandidates().get(0).name());
    assertEquals(3, ranked.size());
  }

  @Test
  public void testRemoveUnknownId() {
    CandidatePool pool = new CandidatePool(Arrays.asList(quartz, halite));
    assertEquals(0, pool.removeById("9999999"));
    assertEquals(2, pool.size());
    assertEquals(1, pool.removeById("0001234"));
    assertEquals(1, pool.removeById("0000789"));
    assertTrue(pool.isEmpty());
  }
}

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
import static ppx.powder.SyntheticPatterns.grid;
import static ppx.powder.SyntheticPatterns.pattern;
import static ppx.powder.SyntheticPatterns.phase;
import static ppx.powder.SyntheticPatterns.sum;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import ppx.powder.CandidatePhase;
import ppx.powder.ExperimentalPattern;
import ppx.powder.TheoreticalPeakSet;
import ppx.utilities.PPXTest;

/**
 * Test greedy phase identification on synthetic patterns.
 *
 * @author Michael J. Schnieders
 */
public class SequentialDecompositionTest extends PPXTest {

  private final double[] grid = grid(10.0, 50.0, 0.02);

  private final CandidatePhase phaseA =
      phase("A", "Alpha", new double[] {20.0, 30.0}, new double[] {100.0, 60.0});
  private final CandidatePhase phaseB =
      phase("B", "Beta", new double[] {25.0, 35.0}, new double[] {80.0, 40.0});
  private final CandidatePhase decoy =
      phase("D", "Decoy", new double[] {44.0, 47.0}, new double[] {100.0, 100.0});

  private static DecompositionResult run(ExperimentalPattern pattern,
      List<CandidatePhase> candidates, int maxPhases) {
    SequentialDecomposition decomposition =
        new SequentialDecomposition(pattern, candidates, DecompositionOptions.defaults());
    return decomposition.run(maxPhases, 0.01);
  }

  @Test
  public void testDuplicateIdIdentifiedOnce() {
    CandidatePhase secondEntry =
        phase("A", "Alpha (second entry)", new double[] {25.0, 35.0}, new double[] {80.0, 40.0});
    ExperimentalPattern pattern = pattern(grid, phaseA, phaseB);
    DecompositionResult result = run(pattern, Arrays.asList(phaseA, secondEntry), 5);
    assertEquals(1, result.size());
    assertEquals("A", result.phases().get(0).phase().id());
  }

  @Test
  public void testSinglePhase() {
    ExperimentalPattern pattern = pattern(grid, phaseA);
    DecompositionResult result = run(pattern, Arrays.asList(decoy, phaseA), 5);
    assertEquals(1, result.size());
    IdentifiedPhase identified = result.phases().get(0);
    assertEquals("A", identified.phase().id());
    assertEquals(1, identified.iteration());
    assertEquals(1.0, identified.optimizedScaling(), 0.05);
    assertTrue(result.residueFraction() < 0.01);
    assertEquals(2, result.residueHistory().size());
  }

  @Test
  public void testTwoPhases() {
    ExperimentalPattern pattern = pattern(grid, phaseA, phaseB);
    DecompositionResult result = run(pattern, Arrays.asList(phaseA, phaseB, decoy), 2);
    assertEquals(2, result.size());
    Set<String> ids = new HashSet<>();
    double contribution = 0.0;
    for (IdentifiedPhase identified : result.phases()) {
      ids.add(identified.phase().id());
      contribution += identified.totalContribution();
    }
    assertEquals(new HashSet<>(Arrays.asList("A", "B")), ids);
    assertTrue(contribution >= 0.95 * sum(pattern.getIntensity()));
  }

  @Test
  public void testAllZeroPattern() {
    ExperimentalPattern pattern = new ExperimentalPattern(grid, new double[grid.length]);
    DecompositionResult result = run(pattern, Arrays.asList(phaseA, phaseB), 5);
    assertEquals(0, result.size());
    assertEquals(0.0, result.residueFraction(), 0.0);
    assertEquals(1, result.residueHistory().size());
  }

  @Test
  public void testResidueNonNegativeAndNonIncreasing() {
    // Scaled and slightly shifted so that subtraction is imperfect.
    CandidatePhase shifted =
        phase("A2", "Alpha shifted", new double[] {20.03, 30.03}, new double[] {100.0, 60.0});
    ExperimentalPattern pattern = pattern(grid, shifted, phaseB);
    DecompositionResult result = run(pattern, Arrays.asList(phaseA, phaseB, decoy), 3);
    assertTrue(result.size() >= 1);
    double previous = Double.POSITIVE_INFINITY;
    for (double[] residue : result.residueHistory()) {
      for (double value : residue) {
        assertTrue(value >= 0.0);
      }
      double total = sum(residue);
      assertTrue(total <= previous);
      previous = total;
    }
  }

  @Test
  public void testNoCandidateAboveFloor() {
    ExperimentalPattern pattern = pattern(grid, phaseA);
    DecompositionResult result = run(pattern, Arrays.asList(decoy), 5);
    assertEquals(0, result.size());
    assertEquals(1.0, result.residueFraction(), 1.0e-12);
  }

  @Test
  public void testEmptyCandidateSkipped() {
    CandidatePhase empty = new CandidatePhase("E", "Empty", "", null, null,
        TheoreticalPeakSet.empty());
    ExperimentalPattern pattern = pattern(grid, phaseA);
    DecompositionResult result = run(pattern, Arrays.asList(empty, phaseA), 5);
    assertEquals(1, result.size());
    assertEquals("A", result.phases().get(0).phase().id());
  }

  @Test
  public void testPhaseLimit() {
    ExperimentalPattern pattern = pattern(grid, phaseA, phaseB);
    assertEquals(0, run(pattern, Arrays.asList(phaseA, phaseB), 0).size());
    assertEquals(1, run(pattern, Arrays.asList(phaseA, phaseB), 1).size());
  }

  @Test
  public void testSessionState() {
    List<CandidatePhase> candidates = new ArrayList<>(Arrays.asList(phaseA, phaseB));
    SequentialDecomposition decomposition = new SequentialDecomposition(
        pattern(grid, phaseA, phaseB), candidates, DecompositionOptions.defaults());
    List<IdentifiedPhase> accepted = new ArrayList<>();
    decomposition.setListener((phase, residue) -> accepted.add(phase));
    assertEquals(DecompositionState.IDLE, decomposition.getState());
    DecompositionResult result = decomposition.run(5, 0.01);
    assertEquals(DecompositionState.DONE, decomposition.getState());
    assertEquals(result.size(), accepted.size());
    // The caller's list is not consumed.
    assertEquals(2, candidates.size());
    try {
      decomposition.run(5, 0.01);
      throw new AssertionError(" A second run should fail.");
    } catch (IllegalStateException e) {
      // Expected.
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeThreshold() {
    new SequentialDecomposition(pattern(grid, phaseA), Arrays.asList(phaseA),
        DecompositionOptions.defaults()).run(1, -0.5);
  }
}

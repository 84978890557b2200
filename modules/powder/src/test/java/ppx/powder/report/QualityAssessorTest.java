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
package ppx.powder.report;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;
import ppx.powder.CandidatePhase;
import ppx.powder.SyntheticPatterns;
import ppx.powder.decompose.IdentifiedPhase;
import ppx.utilities.PPXTest;

/**
 * Test phase fractions and quality labels.
 *
 * @author Michael J. Schnieders
 */
public class QualityAssessorTest extends PPXTest {

  static IdentifiedPhase identified(String name, double... contribution) {
    CandidatePhase phase = SyntheticPatterns.phase(name.toLowerCase(), name,
        new double[] {20.0}, new double[] {1.0});
    return new IdentifiedPhase(phase, 0.9, 1.0, 1.0, 1, new double[contribution.length],
        contribution);
  }

  @Test
  public void testEmpty() {
    assertTrue(QualityAssessor.phaseFractions(Collections.emptyList()).isEmpty());
  }

  @Test
  public void testSinglePhase() {
    Map<String, Double> fractions =
        QualityAssessor.phaseFractions(Collections.singletonList(identified("Quartz", 2.0, 3.0)));
    assertEquals(1, fractions.size());
    assertEquals(1.0, fractions.get("Quartz"), 0.0);
  }

  @Test
  public void testOrderIndependent() {
    IdentifiedPhase quartz = identified("Quartz", 3.0, 1.0);
    IdentifiedPhase calcite = identified("Calcite", 1.0, 1.0, 4.0);
    Map<String, Double> forward = QualityAssessor.phaseFractions(Arrays.asList(quartz, calcite));
    Map<String, Double> reverse = QualityAssessor.phaseFractions(Arrays.asList(calcite, quartz));
    assertEquals(0.4, forward.get("Quartz"), 1.0e-12);
    assertEquals(0.6, forward.get("Calcite"), 1.0e-12);
    assertEquals(forward.get("Quartz"), reverse.get("Quartz"), 1.0e-12);
    assertEquals(forward.get("Calcite"), reverse.get("Calcite"), 1.0e-12);
    // Iteration follows the record order.
    assertEquals("Calcite", reverse.keySet().iterator().next());
  }

  @Test
  public void testZeroTotal() {
    List<IdentifiedPhase> records = Arrays.asList(identified("A", 0.0), identified("B", 0.0));
    Map<String, Double> fractions = QualityAssessor.phaseFractions(records);
    assertEquals(0.0, fractions.get("A"), 0.0);
    assertEquals(0.0, fractions.get("B"), 0.0);
  }

  @Test
  public void testResidueLabels() {
    assertEquals(QualityLabel.EXCELLENT, QualityLabel.forResidue(0.0));
    assertEquals(QualityLabel.GOOD, QualityLabel.forResidue(0.05));
    assertEquals(QualityLabel.FAIR, QualityLabel.forResidue(0.29));
    assertEquals(QualityLabel.POOR, QualityLabel.forResidue(0.30));
  }

  @Test
  public void testRwpLabels() {
    assertEquals(QualityLabel.EXCELLENT, QualityLabel.forRwp(4.99));
    assertEquals(QualityLabel.VERY_GOOD, QualityLabel.forRwp(5.0));
    assertEquals(QualityLabel.GOOD, QualityLabel.forRwp(14.0));
    assertEquals(QualityLabel.ACCEPTABLE, QualityLabel.forRwp(24.9));
    assertEquals(QualityLabel.POOR, QualityLabel.forRwp(Double.POSITIVE_INFINITY));
    assertEquals("Very Good", QualityLabel.VERY_GOOD.toString());
  }
}

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
package ppx.ui.commands;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import org.junit.Before;
import org.junit.Test;
import ppx.powder.TheoreticalPeakSet;
import ppx.powder.decompose.DecompositionOptions;
import ppx.powder.profile.PatternSynthesizer;
import ppx.utilities.PPXTest;

/**
 * Test the Analyze command on a synthetic halite pattern.
 *
 * @author Michael J. Schnieders
 */
public class AnalyzeTest extends PPXTest {

  private static final String DIF = ""
      + "      Halite\n"
      + "      _database_code_amcsd 0001234\n"
      + "      CELL PARAMETERS:    5.6400   5.6400   5.6400  90.000  90.000  90.000\n"
      + "      SPACE GROUP: Fm-3m\n"
      + "               2-THETA      INTENSITY    D-SPACING   H   K   L   Multiplicity\n"
      + "                 27.37         12.79       3.2557   1   1   1      8\n"
      + "                 31.70        100.00       2.8195   2   0   0      6\n"
      + "                 45.45         59.37       1.9937   2   2   0     12\n"
      + "==============================================================================\n"
      + "      Sylvite\n"
      + "      _database_code_amcsd 0001235\n"
      + "      SPACE GROUP: Fm-3m\n"
      + "               2-THETA      INTENSITY    D-SPACING   H   K   L   Multiplicity\n"
      + "                 28.35        100.00       3.1455   2   0   0      6\n"
      + "                 40.51         64.00       2.2242   2   2   0     12\n"
      + "_END_\n";

  private String patternFile;
  private String phaseFile;

  @Before
  public void writeInputs() throws IOException {
    int n = 1501;
    double[] grid = new double[n];
    for (int i = 0; i < n; i++) {
      grid[i] = 20.0 + i * 0.02;
    }
    TheoreticalPeakSet halite = new TheoreticalPeakSet(new double[] {27.37, 31.70, 45.45},
        new double[] {12.79, 100.00, 59.37});
    DecompositionOptions options = DecompositionOptions.defaults();
    double[] intensity = PatternSynthesizer.synthesize(grid, halite, options.profile(), 1.0, 0.0,
        options.eta());
    StringBuilder sb = new StringBuilder("# synthetic halite\n");
    for (int i = 0; i < n; i++) {
      sb.append(grid[i]).append(' ').append(intensity[i]).append('\n');
    }
    patternFile = writeTestFile("halite.xy", sb.toString()).getPath();
    phaseFile = writeTestFile("phases.dif", DIF).getPath();
  }

  @Test
  public void testAnalyze() {
    Analyze analyze = new Analyze(new String[] {"--maxCycles", "2", patternFile, phaseFile});
    analyze.run();
    assertNotNull(analyze.getDecompositionResult());
    assertEquals(1, analyze.getDecompositionResult().size());
    assertEquals("Halite", analyze.getDecompositionResult().phases().get(0).phase().name());
    assertNotNull(analyze.getRefinementResult());
    assertTrue(analyze.getRefinementResult().success());
    String report = analyze.getReport();
    assertTrue(report.contains("Phases Identified: 1"));
    assertTrue(report.contains("Space group: Fm-3m"));
  }

  @Test
  public void testNoRefine() {
    Analyze analyze = new Analyze(new String[] {"--noRefine", patternFile, phaseFile});
    analyze.run();
    assertEquals(1, analyze.getDecompositionResult().size());
    assertNull(analyze.getRefinementResult());
    assertFalse(analyze.getReport().contains("Le Bail"));
  }

  @Test
  public void testProperties() throws IOException {
    // A score floor above one rejects every candidate.
    File properties = writeTestFile("analysis.properties", "decompose-score-floor = 1.5\n");
    Analyze analyze = new Analyze(new String[] {"--properties", properties.getPath(),
        patternFile, phaseFile});
    analyze.run();
    assertEquals(0, analyze.getDecompositionResult().size());
    assertNull(analyze.getRefinementResult());
  }

  @Test
  public void testMissingFile() {
    Analyze analyze = new Analyze(new String[] {patternFile + ".missing", phaseFile});
    analyze.run();
    assertNull(analyze.getDecompositionResult());
    assertNull(analyze.getReport());
  }

  @Test
  public void testHelp() {
    Analyze analyze = new Analyze(new String[] {"-h"});
    analyze.run();
    assertNull(analyze.getDecompositionResult());
  }
}

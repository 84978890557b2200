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

import static java.lang.String.format;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import ppx.crystal.UnitCell;
import ppx.powder.decompose.DecompositionResult;
import ppx.powder.decompose.IdentifiedPhase;
import ppx.powder.refine.AgreementStatistics;
import ppx.powder.refine.RefinedPhase;
import ppx.powder.refine.RefinementParameters;
import ppx.powder.refine.RefinementResult;

/**
 * Plain-text summary of a decomposition and an optional Le Bail refinement. The text depends only
 * on the values in the results, so equal results give equal reports.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class AnalysisReport {

  private AnalysisReport() {
  }

  /**
   * Build the report.
   *
   * @param decomposition the decomposition result.
   * @param refinement the refinement result, or null when no refinement was run.
   * @return the report text.
   */
  public static String build(DecompositionResult decomposition,
      @Nullable RefinementResult refinement) {
    StringBuilder sb = new StringBuilder();
    appendDecomposition(sb, decomposition);
    if (refinement != null) {
      sb.append("\n");
      appendRefinement(sb, refinement);
    }
    return sb.toString();
  }

  private static void appendDecomposition(StringBuilder sb, DecompositionResult result) {
    sb.append("=== Multi-Phase Analysis Report ===\n\n");
    sb.append(format("Phases Identified: %d\n", result.size()));
    sb.append(format("Final Residue: %.1f%% of original intensity\n\n",
        100.0 * result.residueFraction()));

    List<IdentifiedPhase> phases = result.phases();
    Map<String, Double> fractions = QualityAssessor.phaseFractions(phases);
    for (int i = 0; i < phases.size(); i++) {
      IdentifiedPhase phase = phases.get(i);
      String name = phase.phase().name();
      sb.append(format("Phase %d: %s\n", i + 1, name));
      sb.append(format("  - Match Score: %.3f\n", phase.matchScore()));
      sb.append(format("  - Optimized Scaling: %.3f\n", phase.optimizedScaling()));
      sb.append(format("  - Estimated Fraction: %.1f%%\n\n", 100.0 * fractions.get(name)));
    }

    QualityLabel quality = QualityLabel.forResidue(result.residueFraction());
    sb.append(format("Analysis Quality: %s - %s\n", quality, quality.residueDescription()));
  }

  private static void appendRefinement(StringBuilder sb, RefinementResult result) {
    sb.append("=== Le Bail Refinement Report ===\n\n");
    if (!result.success()) {
      sb.append(format("Refinement failed: %s\n", result.errorMessage()));
      return;
    }
    sb.append(format("Refinement completed after %d iterations (%s)\n\n", result.cycles(),
        result.converged() ? "converged" : "not converged"));

    AgreementStatistics stats = result.statistics();
    if (stats != null) {
      sb.append("Final R-factors:\n");
      sb.append(format("  Rp   = %.3f%%\n", stats.rp()));
      sb.append(format("  Rwp  = %.3f%%\n", stats.rwp()));
      sb.append(format("  Rexp = %.3f%%\n", stats.rexp()));
      sb.append(format("  GoF  = %.3f\n", stats.gof()));
      sb.append(format("  Chi2 = %.4f\n\n", stats.chiSquared()));
    }

    List<RefinedPhase> phases = result.refinedPhases();
    for (int i = 0; i < phases.size(); i++) {
      RefinedPhase phase = phases.get(i);
      RefinementParameters params = phase.parameters();
      sb.append(format("Phase %d: %s\n", i + 1, phase.phase().name()));
      sb.append(format("  Scale factor: %.4f\n", params.getScaleFactor()));
      sb.append("  Profile parameters:\n");
      sb.append(format("    U   = %.6f\n", params.getU()));
      sb.append(format("    V   = %.6f\n", params.getV()));
      sb.append(format("    W   = %.6f\n", params.getW()));
      sb.append(format("    eta = %.3f\n", params.getEta()));
      sb.append(format("  Zero shift: %.4f deg\n", params.getZeroShift()));
      UnitCell cell = phase.refinedCell();
      if (cell != null) {
        sb.append("  Unit cell:\n");
        sb.append(format("    a = %.4f A, b = %.4f A, c = %.4f A\n", cell.a(), cell.b(),
            cell.c()));
        sb.append(format("    alpha = %.3f, beta = %.3f, gamma = %.3f deg\n", cell.alpha(),
            cell.beta(), cell.gamma()));
      }
      String spaceGroup = phase.phase().spaceGroup();
      if (spaceGroup != null) {
        sb.append(format("  Space group: %s\n", spaceGroup));
      }
      sb.append("\n");
    }

    if (stats != null) {
      sb.append(format("Refinement Quality: %s\n", QualityLabel.forRwp(stats.rwp())));
    }
  }
}

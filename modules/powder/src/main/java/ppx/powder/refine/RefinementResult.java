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
package ppx.powder.refine;

import java.util.Collections;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Outcome of a Le Bail refinement.
 *
 * @param success False when the refinement could not run.
 * @param converged True when the change in Rwp fell below the threshold.
 * @param statistics Final agreement statistics, or null on failure.
 * @param history Per-cycle history.
 * @param refinedPhases Refined phases in input order.
 * @param contributions Per-phase share of the final calculated pattern.
 * @param twoTheta 2-theta grid that was refined (after any window).
 * @param calculated Final calculated pattern on that grid.
 * @param errorMessage Reason for failure, or null.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record RefinementResult(boolean success, boolean converged,
                               @Nullable AgreementStatistics statistics,
                               List<RefinementCycle> history, List<RefinedPhase> refinedPhases,
                               List<PhaseContribution> contributions, double[] twoTheta,
                               double[] calculated, @Nullable String errorMessage) {

  /**
   * Canonical constructor.
   */
  public RefinementResult {
    history = List.copyOf(history);
    refinedPhases = List.copyOf(refinedPhases);
    contributions = List.copyOf(contributions);
  }

  /**
   * A failed refinement.
   *
   * @param message the reason.
   * @return the result.
   */
  public static RefinementResult failure(String message) {
    return new RefinementResult(false, false, null, Collections.emptyList(),
        Collections.emptyList(), Collections.emptyList(), new double[0], new double[0], message);
  }

  /**
   * Number of completed cycles.
   *
   * @return the history length.
   */
  public int cycles() {
    return history.size();
  }
}

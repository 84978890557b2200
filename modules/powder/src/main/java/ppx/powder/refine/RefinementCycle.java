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

import java.util.List;

/**
 * One entry of the refinement history.
 *
 * @param cycle 1-based cycle number.
 * @param stage 0 for an unstaged refinement, otherwise 1 (profile frozen) or 2.
 * @param parameters Snapshot of each phase's parameters after the cycle.
 * @param statistics Agreement statistics after the cycle.
 * @param calculated Combined calculated pattern after the cycle.
 * @param warnings Soft failures recorded during the cycle.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record RefinementCycle(int cycle, int stage, List<RefinementParameters> parameters,
                              AgreementStatistics statistics, double[] calculated,
                              List<String> warnings) {

  /**
   * Canonical constructor.
   */
  public RefinementCycle {
    parameters = List.copyOf(parameters);
    warnings = List.copyOf(warnings);
  }
}

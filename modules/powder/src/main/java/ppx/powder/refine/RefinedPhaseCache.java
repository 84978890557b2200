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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import ppx.powder.CandidatePhase;

/**
 * Refined phases of earlier analyses, keyed by candidate id.
 *
 * <p>The cache is owned by its caller and is never shared implicitly between sessions. It is used
 * to move candidates that refined well to the front of the next search.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class RefinedPhaseCache {

  private final Map<String, RefinedPhase> refined = new LinkedHashMap<>();

  /**
   * Store a refined phase, replacing any earlier entry with the same id.
   *
   * @param phase the refined phase.
   */
  public void put(RefinedPhase phase) {
    refined.put(phase.phase().id(), phase);
  }

  /**
   * Store every refined phase of a successful refinement.
   *
   * @param result the refinement result.
   */
  public void putAll(RefinementResult result) {
    if (!result.success()) {
      return;
    }
    for (RefinedPhase phase : result.refinedPhases()) {
      put(phase);
    }
  }

  /**
   * Look up a refined phase.
   *
   * @param id candidate id.
   * @return the refined phase, or null if none is stored.
   */
  @Nullable
  public RefinedPhase get(String id) {
    return refined.get(id);
  }

  public boolean contains(String id) {
    return refined.containsKey(id);
  }

  public int size() {
    return refined.size();
  }

  public void clear() {
    refined.clear();
  }

  /**
   * Reorder a candidate list: cached candidates first by descending search priority, then the rest
   * in their original order. The input list is not modified.
   *
   * @param candidates ranked candidates.
   * @return a new list.
   */
  public List<CandidatePhase> reorder(List<CandidatePhase> candidates) {
    List<CandidatePhase> known = new ArrayList<>();
    List<CandidatePhase> unknown = new ArrayList<>();
    for (CandidatePhase candidate : candidates) {
      if (refined.containsKey(candidate.id())) {
        known.add(candidate);
      } else {
        unknown.add(candidate);
      }
    }
    // List.sort is stable, so equal priorities keep their input order.
    known.sort(Comparator.comparingDouble(
        (CandidatePhase c) -> refined.get(c.id()).searchPriority()).reversed());
    known.addAll(unknown);
    return known;
  }
}

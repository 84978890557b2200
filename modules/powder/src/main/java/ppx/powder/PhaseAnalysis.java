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
package ppx.powder;

import static java.lang.String.format;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.configuration2.CompositeConfiguration;
import ppx.crystal.UnitCell;
import ppx.powder.decompose.DecompositionOptions;
import ppx.powder.decompose.DecompositionResult;
import ppx.powder.decompose.IdentifiedPhase;
import ppx.powder.decompose.SequentialDecomposition;
import ppx.powder.refine.LeBailRefinement;
import ppx.powder.refine.RefinementOptions;
import ppx.powder.refine.RefinementParameters;
import ppx.powder.refine.RefinementPhase;
import ppx.powder.refine.RefinementResult;
import ppx.powder.report.AnalysisReport;

/**
 * Entry point for multi-phase identification and refinement of a powder pattern.
 *
 * <p>An instance holds only the options read from its configuration. Every call creates and owns
 * its own session state, so one instance can serve concurrent callers.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PhaseAnalysis {

  private static final Logger logger = Logger.getLogger(PhaseAnalysis.class.getName());

  /** Default maximum number of Le Bail cycles. */
  public static final int DEFAULT_MAX_CYCLES = 20;
  /** Default Rwp convergence threshold. */
  public static final double DEFAULT_CONVERGENCE = 1.0e-5;

  private final DecompositionOptions decompositionOptions;
  private final RefinementOptions refinementOptions;

  /** Constructor using default options. */
  public PhaseAnalysis() {
    this(new CompositeConfiguration());
  }

  /**
   * Constructor for PhaseAnalysis.
   *
   * @param properties configuration for the decomposition and the refinement.
   */
  public PhaseAnalysis(CompositeConfiguration properties) {
    decompositionOptions = DecompositionOptions.fromProperties(properties);
    refinementOptions = RefinementOptions.fromProperties(properties);
  }

  public DecompositionOptions getDecompositionOptions() {
    return decompositionOptions;
  }

  public RefinementOptions getRefinementOptions() {
    return refinementOptions;
  }

  /**
   * Identify the phases in a pattern by sequential decomposition.
   *
   * @param pattern the measured pattern.
   * @param candidates ranked candidate phases (not modified).
   * @param maxPhases maximum number of phases to identify.
   * @param residueThreshold stop once the residue maximum falls below this fraction of the
   *     original maximum.
   * @return the decomposition result.
   */
  public DecompositionResult runSequentialDecomposition(ExperimentalPattern pattern,
      List<CandidatePhase> candidates, int maxPhases, double residueThreshold) {
    SequentialDecomposition decomposition =
        new SequentialDecomposition(pattern, candidates, decompositionOptions);
    return decomposition.run(maxPhases, residueThreshold);
  }

  /**
   * Le Bail refinement of phases with given starting parameters. Invalid input gives an
   * unsuccessful result carrying the error message instead of an exception.
   *
   * @param pattern the measured pattern.
   * @param phases phases and their starting parameters.
   * @param maxCycles maximum number of refinement cycles.
   * @param convergenceThreshold Rwp convergence threshold.
   * @return the refinement result.
   */
  public RefinementResult runLeBailRefinement(@Nullable ExperimentalPattern pattern,
      @Nullable List<RefinementPhase> phases, int maxCycles, double convergenceThreshold) {
    try {
      LeBailRefinement refinement = new LeBailRefinement(refinementOptions);
      return refinement.refine(pattern, phases, maxCycles, convergenceThreshold);
    } catch (InvalidPatternException e) {
      logger.log(Level.WARNING, format(" Le Bail refinement was not run:%s", e.getMessage()));
      return RefinementResult.failure(e.getMessage().trim());
    }
  }

  /**
   * Refine candidate phases without known scale factors. Each phase starts from the default
   * profile with a scale estimated from the pattern.
   *
   * @param pattern the measured pattern.
   * @param candidates the phases to refine.
   * @param maxCycles maximum number of refinement cycles.
   * @param convergenceThreshold Rwp convergence threshold.
   * @return the refinement result.
   */
  public RefinementResult refineCandidates(ExperimentalPattern pattern,
      List<CandidatePhase> candidates, int maxCycles, double convergenceThreshold) {
    List<RefinementPhase> phases = new ArrayList<>(candidates.size());
    for (CandidatePhase candidate : candidates) {
      double scale = LeBailRefinement.estimateInitialScale(pattern, candidate.peaks(),
          refinementOptions);
      logger.fine(format(" Estimated starting scale of %s: %10.4f", candidate.name(), scale));
      phases.add(new RefinementPhase(candidate, startingParameters(candidate, scale)));
    }
    return runLeBailRefinement(pattern, phases, maxCycles, convergenceThreshold);
  }

  /**
   * Refine the phases found by a decomposition, each starting from the default profile with its
   * optimized subtraction scale.
   *
   * @param pattern the measured pattern.
   * @param decomposition the decomposition result.
   * @param maxCycles maximum number of refinement cycles.
   * @param convergenceThreshold Rwp convergence threshold.
   * @return the refinement result.
   */
  public RefinementResult refineIdentifiedPhases(ExperimentalPattern pattern,
      DecompositionResult decomposition, int maxCycles, double convergenceThreshold) {
    List<RefinementPhase> phases = new ArrayList<>(decomposition.size());
    for (IdentifiedPhase identified : decomposition.phases()) {
      CandidatePhase candidate = identified.phase();
      phases.add(new RefinementPhase(candidate,
          startingParameters(candidate, identified.optimizedScaling())));
    }
    return runLeBailRefinement(pattern, phases, maxCycles, convergenceThreshold);
  }

  /**
   * Build the text report.
   *
   * @param decomposition the decomposition result.
   * @param refinement the refinement result, or null.
   * @return the report.
   */
  public String buildReport(DecompositionResult decomposition,
      @Nullable RefinementResult refinement) {
    return AnalysisReport.build(decomposition, refinement);
  }

  private static RefinementParameters startingParameters(CandidatePhase candidate, double scale) {
    UnitCell cell = candidate.unitCell();
    return RefinementParameters.defaults(scale, (cell == null) ? null : cell.lengths());
  }
}

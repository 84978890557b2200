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

import static java.lang.String.format;
import static org.apache.commons.lang3.StringUtils.abbreviate;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static ppx.utilities.Constants.NS2SEC;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import ppx.powder.CandidatePhase;
import ppx.powder.ExperimentalPattern;
import ppx.powder.match.MatchScore;
import ppx.powder.match.ResidueMatcher;
import ppx.powder.profile.PatternSynthesizer;

/**
 * Greedy identification of the phases in a measured pattern.
 *
 * <p>Starting from the measured intensities, the candidate that best matches the residue is
 * selected, scaled with an objective that penalizes over-subtraction, and removed from the residue.
 * This repeats until the residue is small, the phase limit is reached, the pool is exhausted or no
 * candidate scores above the floor.
 *
 * <p>Each instance is one session: it owns its residue and candidate pool and can be run once.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class SequentialDecomposition {

  private static final Logger logger = Logger.getLogger(SequentialDecomposition.class.getName());

  private final double[] grid;
  private final double[] residue;
  private final double originalMax;
  private final CandidatePool pool;
  private final DecompositionOptions options;
  private final ResidueMatcher matcher;
  private DecompositionState state = DecompositionState.IDLE;
  @Nullable
  private DecompositionListener listener;

  /**
   * Constructor for a SequentialDecomposition session.
   *
   * @param pattern the measured pattern.
   * @param candidates ranked candidate phases; the list is copied into a private pool.
   * @param options decomposition settings.
   */
  public SequentialDecomposition(ExperimentalPattern pattern, List<CandidatePhase> candidates,
      DecompositionOptions options) {
    this.grid = pattern.getTwoTheta();
    this.options = options;
    this.matcher = new ResidueMatcher(options.match());
    this.pool = new CandidatePool(candidates);

    // Negative intensities carry no phase signal.
    double[] intensity = pattern.getIntensity();
    residue = new double[intensity.length];
    double m = 0.0;
    for (int i = 0; i < intensity.length; i++) {
      residue[i] = max(intensity[i], 0.0);
      m = max(m, residue[i]);
    }
    originalMax = m;
  }

  /**
   * Set a listener notified after each accepted phase.
   *
   * @param listener the listener, or null to remove it.
   */
  public void setListener(@Nullable DecompositionListener listener) {
    this.listener = listener;
  }

  /**
   * Current state of the session.
   *
   * @return the state.
   */
  public DecompositionState getState() {
    return state;
  }

  /**
   * Run the decomposition.
   *
   * @param maxPhases maximum number of phases to identify.
   * @param residueThreshold stop once the residue maximum falls below this fraction of the
   *     original maximum.
   * @return the identified phases and residue history.
   * @throws IllegalStateException if the session has already been run.
   */
  public DecompositionResult run(int maxPhases, double residueThreshold) {
    if (maxPhases < 0) {
      throw new IllegalArgumentException(format(" The phase limit is negative (%d).", maxPhases));
    }
    if (!(residueThreshold >= 0.0)) {
      throw new IllegalArgumentException(
          format(" The residue threshold must not be negative (%g).", residueThreshold));
    }
    if (state != DecompositionState.IDLE) {
      throw new IllegalStateException(" A decomposition session can only be run once.");
    }

    long time = -System.nanoTime();
    List<IdentifiedPhase> records = new ArrayList<>();
    List<double[]> history = new ArrayList<>();
    history.add(residue.clone());

    logger.info(format("\n Sequential Decomposition of %d Points against %d Candidates\n",
        grid.length, pool.size()));
    logger.info("  Iter  Phase                          Score     Scale   Residue");

    while (true) {
      state = DecompositionState.SELECTING;
      Selection selection = select(records.size(), maxPhases, residueThreshold);
      if (selection == null) {
        break;
      }
      state = DecompositionState.SUBTRACTING;
      IdentifiedPhase record = subtract(selection, records.size() + 1);
      records.add(record);
      history.add(residue.clone());
      logger.info(format("  %4d  %-28s %8.4f %9.4f %8.2f%%", record.iteration(),
          abbreviate(record.phase().name(), 28), record.matchScore(), record.optimizedScaling(),
          100.0 * residueFraction()));
      notifyListener(record);
    }
    state = DecompositionState.DONE;

    time += System.nanoTime();
    double fraction = residueFraction();
    logger.info(format("\n Identified %d phase(s); final residue %6.2f%% of the original maximum"
        + " (%6.3f sec).", records.size(), 100.0 * fraction, time * NS2SEC));
    return new DecompositionResult(records, history, residue.clone(), fraction);
  }

  /**
   * Choose the best remaining candidate, or return null when the session should stop.
   */
  @Nullable
  private Selection select(int found, int maxPhases, double residueThreshold) {
    double currentMax = maximum(residue);
    if (originalMax <= 0.0 || currentMax < residueThreshold * originalMax) {
      logger.fine(" The residue is below the threshold.");
      return null;
    }
    if (found >= maxPhases) {
      logger.fine(format(" The phase limit (%d) was reached.", maxPhases));
      return null;
    }
    if (pool.isEmpty()) {
      logger.fine(" The candidate pool is empty.");
      return null;
    }

    Selection best = null;
    List<CandidatePhase> candidates = pool.getCandidates();
    for (CandidatePhase candidate : candidates) {
      if (candidate.peaks().isEmpty()) {
        logger.finer(format(" Skipping %s: no calculated peaks.", candidate.name()));
        continue;
      }
      double[] pattern = PatternSynthesizer.synthesize(grid, candidate.peaks(), options.profile(),
          1.0, 0.0, options.eta());
      if (maximum(pattern) <= 0.0) {
        logger.finer(format(" Skipping %s: no calculated intensity on the grid.",
            candidate.name()));
        continue;
      }
      MatchScore score = matcher.score(residue, pattern);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(format(" %-28s score %8.5f scale %8.5f", abbreviate(candidate.name(), 28),
            score.correlation(), score.optimalScaling()));
      }
      // Strict comparison keeps the first of equal scores.
      if (best == null || score.correlation() > best.score().correlation()) {
        best = new Selection(candidate, pattern, score);
      }
    }

    if (best == null || best.score().correlation() <= options.scoreFloor()) {
      logger.fine(format(" No candidate scores above %5.3f.", options.scoreFloor()));
      return null;
    }
    return best;
  }

  /**
   * Fit the subtraction scale, remove the phase from the residue and the pool.
   */
  private IdentifiedPhase subtract(Selection selection, int iteration) {
    double[] pattern = selection.pattern();
    double weight = options.penaltyWeight();
    double lo = options.scaleMin();
    double hi = options.scaleMax();
    double start = min(hi, max(lo, selection.score().optimalScaling()));

    BrentOptimizer optimizer = new BrentOptimizer(1.0e-10, 1.0e-14);
    double scale = optimizer.optimize(new MaxEval(500),
        new UnivariateObjectiveFunction(s -> {
          double sum = 0.0;
          for (int i = 0; i < residue.length; i++) {
            double d = residue[i] - s * pattern[i];
            sum += (d > 0.0) ? d * d : weight * d * d;
          }
          return sum;
        }), GoalType.MINIMIZE, new SearchInterval(lo, hi, start)).getPoint();

    double[] before = residue.clone();
    double[] contribution = new double[residue.length];
    for (int i = 0; i < residue.length; i++) {
      residue[i] = max(residue[i] - scale * pattern[i], 0.0);
      contribution[i] = before[i] - residue[i];
    }
    int removed = pool.removeById(selection.phase().id());
    if (removed > 1) {
      logger.fine(format(" Removed %d candidates with id %s.", removed, selection.phase().id()));
    }

    return new IdentifiedPhase(selection.phase(), selection.score().correlation(), scale,
        selection.score().optimalScaling(), iteration, before, contribution);
  }

  private void notifyListener(IdentifiedPhase record) {
    if (listener == null) {
      return;
    }
    try {
      listener.phaseAccepted(record, residue.clone());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, " Decomposition listener failed.", e);
    }
  }

  private double residueFraction() {
    if (originalMax <= 0.0) {
      return 0.0;
    }
    return maximum(residue) / originalMax;
  }

  private static double maximum(double[] values) {
    double m = 0.0;
    for (double v : values) {
      m = max(m, v);
    }
    return m;
  }

  /**
   * A scored candidate and its synthesized pattern.
   */
  private record Selection(CandidatePhase phase, double[] pattern, MatchScore score) {

  }
}

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

import static java.lang.String.format;
import static org.apache.commons.lang3.StringUtils.abbreviate;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;
import static org.apache.commons.math3.util.FastMath.min;
import static org.apache.commons.math3.util.FastMath.sqrt;
import static ppx.utilities.Constants.NORMALIZED_MAXIMUM;
import static ppx.utilities.Constants.NS2SEC;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import ppx.crystal.UnitCell;
import ppx.numerics.optimization.BoxConstraints;
import ppx.numerics.optimization.LBFGS;
import ppx.powder.CandidatePhase;
import ppx.powder.ExperimentalPattern;
import ppx.powder.InvalidPatternException;
import ppx.powder.TheoreticalPeakSet;
import ppx.powder.profile.PatternSynthesizer;

/**
 * Cyclic Le Bail refinement of several phases against one measured pattern.
 *
 * <p>Each cycle refines the phases one at a time (coordinate descent): the calculated pattern of
 * every other phase is held fixed while the free parameters of the current phase are fit by
 * bounded L-BFGS. After each cycle the combined agreement statistics are appended to the history;
 * the refinement stops when the change in Rwp falls below the threshold or the cycle limit is
 * reached. A phase whose sub-optimization fails keeps its previous parameters and the failure is
 * recorded as a warning of that cycle.
 *
 * <p>Lattice lengths are refined within their bounds, but peak positions only follow the zero
 * shift; positions are not recomputed from the cell.
 *
 * @author Timothy D. Fenn
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class LeBailRefinement {

  private static final Logger logger = Logger.getLogger(LeBailRefinement.class.getName());

  /** A scale dropping below this fraction of its cycle start value is reported. */
  private static final double SCALE_COLLAPSE = 0.2;

  /** Fraction of a range by which an out-of-range starting value is placed inside its bounds. */
  private static final double BOUND_MARGIN = 0.01;

  private final RefinementOptions options;
  @Nullable
  private RefinementListener listener;

  /**
   * Constructor for LeBailRefinement.
   *
   * @param options refinement settings.
   */
  public LeBailRefinement(RefinementOptions options) {
    this.options = options;
  }

  /**
   * Set a listener notified after every cycle. Listener exceptions are logged and ignored.
   *
   * @param listener the listener, or null to remove it.
   */
  public void setListener(@Nullable RefinementListener listener) {
    this.listener = listener;
  }

  /**
   * Refine phases against a pattern.
   *
   * @param pattern the measured pattern.
   * @param phases the phases and their starting parameters.
   * @param maxCycles maximum number of cycles (0 only evaluates the starting model).
   * @param convergenceThreshold converge when |Rwp(cycle) - Rwp(cycle - 1)| is below this value.
   * @return the refinement result.
   * @throws InvalidPatternException if the pattern or phase list is unusable.
   */
  public RefinementResult refine(ExperimentalPattern pattern, List<RefinementPhase> phases,
      int maxCycles, double convergenceThreshold) {
    if (pattern == null) {
      throw new InvalidPatternException(" No experimental pattern was supplied.");
    }
    if (phases == null || phases.isEmpty()) {
      throw new InvalidPatternException(" At least one phase is required for refinement.");
    }
    if (maxCycles < 0) {
      throw new IllegalArgumentException(format(" The cycle limit is negative (%d).", maxCycles));
    }
    if (!(convergenceThreshold >= 0.0)) {
      throw new IllegalArgumentException(
          format(" The convergence threshold must not be negative (%g).", convergenceThreshold));
    }

    if (options.hasTwoThetaWindow()) {
      pattern = pattern.restrict(options.getTwoThetaMin(), options.getTwoThetaMax());
    }
    if (options.isNormalize()) {
      pattern = pattern.normalized(NORMALIZED_MAXIMUM);
    }

    long time = -System.nanoTime();
    Session session = new Session(pattern, phases, options);
    int nPhases = session.size();

    int stageOneCycles = 0;
    if (options.isStaged()) {
      stageOneCycles = min(maxCycles, max(3, maxCycles / 3));
    }
    boolean[] profileFlags = new boolean[nPhases];
    for (int p = 0; p < nPhases; p++) {
      profileFlags[p] = session.parameters[p].isRefineProfile();
    }

    logger.info(format("\n Le Bail Refinement of %d Phase(s) against %d Points\n", nPhases,
        session.grid.length));
    logger.info(" Cycle Stage        Rp       Rwp      Rexp       GoF        Chi2  Warnings");

    List<RefinementCycle> history = new ArrayList<>();
    double previousRwp = Double.POSITIVE_INFINITY;
    boolean converged = false;
    for (int cycle = 0; cycle < maxCycles; cycle++) {
      boolean stageOne = cycle < stageOneCycles;
      int stage = options.isStaged() ? (stageOne ? 1 : 2) : 0;
      for (int p = 0; p < nPhases; p++) {
        // Stage one holds the profile fixed; stage two restores each phase's own setting.
        session.parameters[p].setRefineProfile(!stageOne && profileFlags[p]);
      }

      List<String> warnings = new ArrayList<>();
      for (int p = 0; p < nPhases; p++) {
        refinePhase(session, p, warnings);
      }

      double[] calculated = session.totalPattern();
      AgreementStatistics statistics = session.statistics(calculated);
      List<RefinementParameters> snapshot = new ArrayList<>(nPhases);
      for (RefinementParameters params : session.parameters) {
        snapshot.add(params.copy());
      }
      RefinementCycle entry = new RefinementCycle(cycle + 1, stage, snapshot, statistics,
          calculated, warnings);
      history.add(entry);
      logger.info(format(" %5d %5d %9.3f %9.3f %9.3f %9.3f %11.4f  %d", cycle + 1, stage,
          statistics.rp(), statistics.rwp(), statistics.rexp(), statistics.gof(),
          statistics.chiSquared(), warnings.size()));
      notifyListener(entry, session);

      if (stageOne) {
        continue;
      }
      double change = abs(previousRwp - statistics.rwp());
      if (change < convergenceThreshold) {
        converged = true;
        logger.info(format("\n Converged after %d cycle(s) (delta Rwp %10.6f).", cycle + 1,
            change));
        break;
      }
      previousRwp = statistics.rwp();
    }
    for (int p = 0; p < nPhases; p++) {
      session.parameters[p].setRefineProfile(profileFlags[p]);
    }

    double[] calculated;
    AgreementStatistics statistics;
    if (history.isEmpty()) {
      calculated = session.totalPattern();
      statistics = session.statistics(calculated);
    } else {
      RefinementCycle last = history.get(history.size() - 1);
      calculated = last.calculated();
      statistics = last.statistics();
    }

    List<RefinedPhase> refined = new ArrayList<>(nPhases);
    List<PhaseContribution> contributions = new ArrayList<>(nPhases);
    double totalIntensity = sum(calculated);
    for (int p = 0; p < nPhases; p++) {
      RefinementParameters params = session.parameters[p];
      CandidatePhase phase = session.phases.get(p);
      double priority = searchPriority(params.getScaleFactor(), statistics);
      UnitCell cell = phase.unitCell();
      double[] lengths = params.getCellLengths();
      if (cell != null && lengths != null) {
        cell = cell.withLengths(lengths);
      }
      refined.add(new RefinedPhase(phase, params, priority,
          phase.peaks().shifted(params.getZeroShift()), cell));

      double[] alone = session.phasePattern(p);
      double percent = (totalIntensity > 0.0) ? 100.0 * sum(alone) / totalIntensity : 0.0;
      contributions.add(new PhaseContribution(phase.name(), percent, session.weightedR(alone)));
    }

    time += System.nanoTime();
    logger.info(format("\n Final%s", statistics));
    if (logger.isLoggable(Level.INFO)) {
      for (int p = 0; p < nPhases; p++) {
        PhaseContribution c = contributions.get(p);
        logger.info(format("  %-28s scale %9.4f  contribution %6.1f%%  Rwp %8.2f%%",
            abbreviate(c.name(), 28), session.parameters[p].getScaleFactor(), c.percent(),
            c.rwp()));
      }
      logger.info(format(" Refinement time: %8.3f (sec)", time * NS2SEC));
    }
    return new RefinementResult(true, converged, statistics, history, refined, contributions,
        session.grid.clone(), calculated, null);
  }

  /**
   * Search priority of a refined phase: scale * (100 / max(Rwp, 1)) * (1 / max(GoF, 1)).
   *
   * @param scaleFactor the refined scale factor.
   * @param statistics final agreement statistics.
   * @return the priority (higher is better).
   */
  public static double searchPriority(double scaleFactor, AgreementStatistics statistics) {
    return scaleFactor * (100.0 / max(statistics.rwp(), 1.0)) * (1.0 / max(statistics.gof(), 1.0));
  }

  /**
   * Starting scale of a phase when none is supplied: 0.8 times the largest observed intensity over
   * the largest calculated peak intensity, both taken in the 2-theta range shared by the pattern
   * and the peak set, limited to the default scale bounds. Returns 1 when the ranges do not overlap
   * or either maximum is not positive.
   *
   * @param pattern the measured pattern.
   * @param peaks the phase's peak set.
   * @return the starting scale factor.
   */
  public static double estimateInitialScale(ExperimentalPattern pattern, TheoreticalPeakSet peaks) {
    return estimateInitialScale(pattern, peaks, RefinementOptions.defaults());
  }

  /**
   * Starting scale of a phase, limited to the scale bounds of the refinement settings.
   *
   * @param pattern the measured pattern.
   * @param peaks the phase's peak set.
   * @param options refinement settings supplying the scale bounds.
   * @return the starting scale factor.
   */
  public static double estimateInitialScale(ExperimentalPattern pattern, TheoreticalPeakSet peaks,
      RefinementOptions options) {
    double scale = unboundedInitialScale(pattern, peaks);
    return min(max(scale, options.getMin(RefinementVariable.SCALE)),
        options.getMax(RefinementVariable.SCALE));
  }

  private static double unboundedInitialScale(ExperimentalPattern pattern,
      TheoreticalPeakSet peaks) {
    if (peaks.isEmpty()) {
      return 1.0;
    }
    double[] twoTheta = pattern.getTwoTheta();
    double[] intensity = pattern.getIntensity();
    double peakMin = Double.POSITIVE_INFINITY;
    double peakMax = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < peaks.size(); i++) {
      peakMin = min(peakMin, peaks.getTwoTheta(i));
      peakMax = max(peakMax, peaks.getTwoTheta(i));
    }
    double low = max(twoTheta[0], peakMin);
    double high = min(twoTheta[twoTheta.length - 1], peakMax);
    if (low >= high) {
      return 1.0;
    }
    double observedMax = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < twoTheta.length; i++) {
      if (twoTheta[i] >= low && twoTheta[i] <= high) {
        observedMax = max(observedMax, intensity[i]);
      }
    }
    double calculatedMax = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < peaks.size(); i++) {
      double t = peaks.getTwoTheta(i);
      if (t >= low && t <= high) {
        calculatedMax = max(calculatedMax, peaks.getIntensity(i));
      }
    }
    if (!(observedMax > 0.0) || !(calculatedMax > 0.0)) {
      return 1.0;
    }
    return 0.8 * observedMax / calculatedMax;
  }

  /**
   * Refine one phase with every other phase fixed. On failure the previous parameters are kept.
   */
  private void refinePhase(Session session, int index, List<String> warnings) {
    RefinementParameters current = session.parameters[index];
    String name = session.phases.get(index).name();
    List<RefinementVariable> variables = session.freeVariables(index);

    double[] lower = new double[variables.size()];
    double[] upper = new double[variables.size()];
    for (int i = 0; i < variables.size(); i++) {
      RefinementVariable variable = variables.get(i);
      if (variable.isCell()) {
        double start = session.startCells[index][variable.cellIndex()];
        lower[i] = start * (1.0 - options.getCellFraction());
        upper[i] = start * (1.0 + options.getCellFraction());
      } else {
        lower[i] = options.getMin(variable);
        upper[i] = options.getMax(variable);
      }
    }

    try {
      LeBailPhaseEnergy energy = new LeBailPhaseEnergy(session.grid, session.observed,
          session.sigma, session.otherPhases(index), session.phases.get(index).peaks(), current,
          variables, new BoxConstraints(lower, upper), options.getFiniteDifferenceStep());
      double before = energy.objective(current);
      LeBailPhaseMinimize minimize = new LeBailPhaseMinimize(energy, options, name);
      RefinementParameters result = minimize.minimize();
      double after = minimize.getFinalEnergy();

      if (minimize.getStatus() == LBFGS.FAILED) {
        recordWarning(warnings, name, "the optimizer failed; parameters were kept");
        return;
      }
      if (!Double.isFinite(after)) {
        recordWarning(warnings, name, "the objective is not finite; parameters were kept");
        return;
      }
      if (Double.isFinite(before) && after > before) {
        recordWarning(warnings, name, format(
            "the objective increased (%.4g to %.4g); parameters were kept", before, after));
        return;
      }
      if (current.isRefineScale()
          && result.getScaleFactor() < SCALE_COLLAPSE * current.getScaleFactor()) {
        recordWarning(warnings, name, format("the scale collapsed from %.3f to %.3f",
            current.getScaleFactor(), result.getScaleFactor()));
      }
      session.parameters[index] = result;
    } catch (RuntimeException e) {
      logger.log(Level.FINE, " Le Bail sub-optimization exception.", e);
      recordWarning(warnings, name,
          format("the optimization raised %s; parameters were kept", e));
    }
  }

  /**
   * Move free starting values that lie on or outside their bounds just inside the box, where the
   * sine mapping of the optimizer still has a usable slope.
   */
  private static void clampToBounds(RefinementParameters params, String name,
      RefinementOptions options) {
    for (RefinementVariable variable : RefinementVariable.values()) {
      if (variable.isCell()
          || (variable == RefinementVariable.SCALE && !params.isRefineScale())
          || (variable.isProfile() && !params.isRefineProfile())) {
        continue;
      }
      double value = params.get(variable);
      double low = options.getMin(variable);
      double high = options.getMax(variable);
      if (value > low && value < high) {
        continue;
      }
      double margin = BOUND_MARGIN * (high - low);
      double clamped = min(max(value, low + margin), high - margin);
      if (value < low || value > high) {
        logger.warning(format(" %s: starting %s of %.4g lies outside [%.4g, %.4g]; using %.4g.",
            name, variable, value, low, high, clamped));
      } else {
        logger.fine(format(" %s: starting %s moved from its bound to %.4g.", name, variable,
            clamped));
      }
      params.set(variable, clamped);
    }
  }

  private static void recordWarning(List<String> warnings, String name, String message) {
    String warning = format("%s: %s", name, message);
    logger.warning(" " + warning);
    warnings.add(warning);
  }

  private void notifyListener(RefinementCycle entry, Session session) {
    if (listener == null) {
      return;
    }
    try {
      listener.cycleCompleted(entry, session.grid.clone(), session.observed.clone());
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, " Refinement listener failed.", e);
    }
  }

  private static double sum(double[] values) {
    double s = 0.0;
    for (double v : values) {
      s += v;
    }
    return s;
  }

  /**
   * Working state owned by one call to {@link #refine}.
   */
  private static final class Session {

    final double[] grid;
    final double[] observed;
    final double[] sigma;
    final List<CandidatePhase> phases;
    final RefinementParameters[] parameters;
    final double[][] startCells;

    Session(ExperimentalPattern pattern, List<RefinementPhase> refinementPhases,
        RefinementOptions options) {
      grid = pattern.getTwoTheta();
      observed = pattern.getIntensity();
      double[] uncertainty = pattern.getUncertainty();
      sigma = new double[observed.length];
      for (int i = 0; i < observed.length; i++) {
        double fallback = sqrt(max(observed[i], 1.0));
        sigma[i] = (uncertainty != null && uncertainty[i] > 0.0) ? uncertainty[i] : fallback;
      }

      int n = refinementPhases.size();
      phases = new ArrayList<>(n);
      parameters = new RefinementParameters[n];
      startCells = new double[n][];
      for (int p = 0; p < n; p++) {
        RefinementPhase refinementPhase = refinementPhases.get(p);
        CandidatePhase phase = refinementPhase.phase();
        RefinementParameters params = refinementPhase.initial();
        if (params.getCellLengths() == null && phase.unitCell() != null) {
          params.setCellLengths(phase.unitCell().lengths());
        }
        clampToBounds(params, phase.name(), options);
        phases.add(phase);
        parameters[p] = params;
        startCells[p] = params.getCellLengths();
      }
    }

    int size() {
      return parameters.length;
    }

    /**
     * Free variables of a phase in optimization order: scale, profile, zero shift, cell.
     */
    List<RefinementVariable> freeVariables(int index) {
      RefinementParameters params = parameters[index];
      List<RefinementVariable> variables = new ArrayList<>();
      if (params.isRefineScale()) {
        variables.add(RefinementVariable.SCALE);
      }
      if (params.isRefineProfile()) {
        variables.add(RefinementVariable.U);
        variables.add(RefinementVariable.V);
        variables.add(RefinementVariable.W);
        variables.add(RefinementVariable.ETA);
      }
      variables.add(RefinementVariable.ZERO_SHIFT);
      if (params.isRefineCell() && startCells[index] != null) {
        variables.add(RefinementVariable.CELL_A);
        variables.add(RefinementVariable.CELL_B);
        variables.add(RefinementVariable.CELL_C);
      }
      return variables;
    }

    double[] phasePattern(int index) {
      RefinementParameters params = parameters[index];
      return PatternSynthesizer.synthesize(grid, phases.get(index).peaks(), params.getCaglioti(),
          params.getScaleFactor(), params.getZeroShift(), params.getEta());
    }

    double[] otherPhases(int index) {
      double[] others = new double[grid.length];
      for (int p = 0; p < parameters.length; p++) {
        if (p == index) {
          continue;
        }
        RefinementParameters params = parameters[p];
        PatternSynthesizer.accumulate(grid, phases.get(p).peaks(), params.getCaglioti(),
            params.getScaleFactor(), params.getZeroShift(), params.getEta(), others);
      }
      return others;
    }

    double[] totalPattern() {
      return otherPhases(-1);
    }

    AgreementStatistics statistics(double[] calculated) {
      int nParameters = 0;
      for (int p = 0; p < parameters.length; p++) {
        nParameters += freeVariables(p).size();
      }
      return AgreementStatistics.compute(observed, calculated, sigma, nParameters);
    }

    /**
     * Weighted profile R-factor (percent) of a single calculated pattern.
     */
    double weightedR(double[] calculated) {
      double num = 0.0;
      double den = 0.0;
      for (int i = 0; i < observed.length; i++) {
        double r = (observed[i] - calculated[i]) / sigma[i];
        num += r * r;
        double o = observed[i] / sigma[i];
        den += o * o;
      }
      return (den > 0.0) ? 100.0 * sqrt(num / den) : Double.POSITIVE_INFINITY;
    }
  }
}

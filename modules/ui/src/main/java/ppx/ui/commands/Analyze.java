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

import static java.lang.String.format;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import ppx.powder.CandidatePhase;
import ppx.powder.ExperimentalPattern;
import ppx.powder.InvalidPatternException;
import ppx.powder.PhaseAnalysis;
import ppx.powder.decompose.DecompositionResult;
import ppx.powder.parsers.DIFFilter;
import ppx.powder.parsers.XYFilter;
import ppx.powder.refine.RefinementResult;
import ppx.utilities.Keyword;
import ppx.utilities.PPXCommand;

/**
 * The Analyze command identifies the phases of a powder pattern and refines them.
 *
 * <br>
 * Usage:
 * <br>
 * ppx Analyze [options] &lt;pattern.xy&gt; &lt;phases.dif&gt;
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
@Command(description = " Identify and refine the phases of a powder diffraction pattern.",
    name = "Analyze")
public class Analyze extends PPXCommand {

  /** --maxPhases Maximum number of phases to identify. */
  @Option(names = {"--maxPhases"}, paramLabel = "5", defaultValue = "5",
      description = "Maximum number of phases to identify.")
  private int maxPhases = 5;

  /** --residueThreshold Stop when the residue maximum falls below this fraction. */
  @Option(names = {"--residueThreshold"}, paramLabel = "0.01", defaultValue = "0.01",
      description = "Stop when the residue maximum falls below this fraction of the original.")
  private double residueThreshold = 0.01;

  /** --maxCycles Maximum number of Le Bail cycles. */
  @Option(names = {"--maxCycles"}, paramLabel = "20", defaultValue = "20",
      description = "Maximum number of Le Bail refinement cycles.")
  private int maxCycles = PhaseAnalysis.DEFAULT_MAX_CYCLES;

  /** --convergence Rwp change that ends the refinement. */
  @Option(names = {"--convergence"}, paramLabel = "1.0e-5", defaultValue = "1.0e-5",
      description = "Converge when the change in Rwp between cycles is below this value.")
  private double convergence = PhaseAnalysis.DEFAULT_CONVERGENCE;

  /** --noRefine Skip the Le Bail refinement. */
  @Option(names = {"--noRefine"}, defaultValue = "false",
      description = "Only run the sequential decomposition.")
  private boolean noRefine = false;

  /** --properties A property file with analysis settings. */
  @Option(names = {"--properties"}, paramLabel = "file",
      description = "Property file with decomposition and refinement settings.")
  private String propertyFile = null;

  /** The pattern file and the candidate phase file. */
  @Parameters(arity = "2", paramLabel = "files",
      description = "An XY pattern file followed by a DIF file of candidate phases.")
  private List<String> filenames = null;

  private DecompositionResult decompositionResult;
  private RefinementResult refinementResult;
  private String report;

  /**
   * Analyze constructor.
   *
   * @param args the command line arguments.
   */
  public Analyze(String[] args) {
    super(args);
  }

  /** {@inheritDoc} */
  @Override
  public Analyze run() {
    if (!init()) {
      return this;
    }

    File patternFile = new File(filenames.get(0));
    File phaseFile = new File(filenames.get(1));
    ExperimentalPattern pattern;
    List<CandidatePhase> candidates;
    CompositeConfiguration properties;
    try {
      properties = Keyword.loadProperties(propertyFile == null ? null : new File(propertyFile));
      pattern = new XYFilter().readFile(patternFile);
      candidates = new DIFFilter().readFile(phaseFile);
    } catch (IOException | ConfigurationException | InvalidPatternException e) {
      logger.log(Level.WARNING, format(" Analysis of %s was not run.", patternFile.getName()), e);
      return this;
    }

    if (candidates.isEmpty()) {
      logger.info(format(" No candidate phases were read from %s.", phaseFile.getName()));
    }

    PhaseAnalysis analysis = new PhaseAnalysis(properties);
    decompositionResult = analysis.runSequentialDecomposition(pattern, candidates, maxPhases,
        residueThreshold);

    if (!noRefine && decompositionResult.size() > 0) {
      refinementResult = analysis.refineIdentifiedPhases(pattern, decompositionResult, maxCycles,
          convergence);
    }

    report = analysis.buildReport(decompositionResult, refinementResult);
    logger.info(format("\n Analysis of %s\n\n%s", FilenameUtils.getName(patternFile.getPath()),
        report));
    return this;
  }

  /**
   * The decomposition result, or null if the analysis did not run.
   *
   * @return the decomposition result.
   */
  public DecompositionResult getDecompositionResult() {
    return decompositionResult;
  }

  /**
   * The refinement result, or null if no refinement was run.
   *
   * @return the refinement result.
   */
  public RefinementResult getRefinementResult() {
    return refinementResult;
  }

  public String getReport() {
    return report;
  }
}

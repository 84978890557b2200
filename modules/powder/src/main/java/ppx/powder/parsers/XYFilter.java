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
package ppx.powder.parsers;

import static java.lang.String.format;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.util.logging.Logger;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.util.ResizableDoubleArray;
import ppx.powder.ExperimentalPattern;
import ppx.powder.InvalidPatternException;

/**
 * Reads a measured pattern from two or three column text: 2-theta, intensity and an optional
 * standard uncertainty, separated by white space or commas. Blank lines and lines starting with
 * '#' or '!' are skipped. Uncertainties are kept only when every point has one.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class XYFilter {

  private static final Logger logger = Logger.getLogger(XYFilter.class.getName());

  /**
   * Read a pattern file.
   *
   * @param file the XY file.
   * @return the pattern.
   * @throws IOException if the file cannot be read.
   * @throws InvalidPatternException if the contents are not a valid pattern.
   */
  public ExperimentalPattern readFile(File file) throws IOException {
    try (BufferedReader br = new BufferedReader(new FileReader(file))) {
      ExperimentalPattern pattern = readPattern(br, file.getName());
      logger.info(format("\n Opening %s\n %s", file.getName(), pattern));
      return pattern;
    }
  }

  /**
   * Read a pattern from a reader.
   *
   * @param reader the source.
   * @param source a name for error messages.
   * @return the pattern.
   * @throws IOException if the reader fails.
   * @throws InvalidPatternException if the contents are not a valid pattern.
   */
  public ExperimentalPattern readPattern(Reader reader, String source) throws IOException {
    BufferedReader br = (reader instanceof BufferedReader) ? (BufferedReader) reader
        : new BufferedReader(reader);
    ResizableDoubleArray twoTheta = new ResizableDoubleArray();
    ResizableDoubleArray intensity = new ResizableDoubleArray();
    ResizableDoubleArray sigma = new ResizableDoubleArray();
    boolean allSigma = true;

    String line;
    int lineNumber = 0;
    while ((line = br.readLine()) != null) {
      lineNumber++;
      String str = line.trim();
      if (str.isEmpty() || str.startsWith("#") || str.startsWith("!")) {
        continue;
      }
      String[] tokens = StringUtils.split(str, " \t,");
      if (tokens.length < 2) {
        throw new InvalidPatternException(
            format(" %s line %d has fewer than two columns: %s", source, lineNumber, str));
      }
      try {
        twoTheta.addElement(Double.parseDouble(tokens[0]));
        intensity.addElement(Double.parseDouble(tokens[1]));
        if (tokens.length > 2) {
          sigma.addElement(Double.parseDouble(tokens[2]));
        } else {
          allSigma = false;
        }
      } catch (NumberFormatException e) {
        throw new InvalidPatternException(
            format(" %s line %d is not numeric: %s", source, lineNumber, str), e);
      }
    }

    if (twoTheta.getNumElements() == 0) {
      throw new InvalidPatternException(format(" %s contains no data points.", source));
    }
    if (!allSigma && sigma.getNumElements() > 0) {
      logger.fine(format(" %s: uncertainties are incomplete and were ignored.", source));
    }
    double[] uncertainty = allSigma ? sigma.getElements() : null;
    return new ExperimentalPattern(twoTheta.getElements(), intensity.getElements(), uncertainty);
  }
}

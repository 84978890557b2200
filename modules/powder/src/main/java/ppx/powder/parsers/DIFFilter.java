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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.annotation.Nullable;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import ppx.crystal.HKL;
import ppx.crystal.UnitCell;
import ppx.powder.CandidatePhase;
import ppx.powder.TheoreticalPeakSet;

/**
 * Reads calculated peak lists in the American Mineralogist Crystal Structure Database DIF format.
 *
 * <p>A file holds one or more entries separated by "_END_" or a run of at least 50 '='
 * characters. Each entry gives the phase name on its first non-empty line (or in a
 * _chemical_name_mineral tag), the catalog code in a _database_code_amcsd tag, optionally the
 * lattice after "CELL PARAMETERS:" and the space group after "SPACE GROUP:", and then a peak table
 * below a "2-THETA" header with rows of 2-theta, intensity, d-spacing, h, k and l. Entries without a
 * code or without peaks are skipped.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DIFFilter {

  private static final Logger logger = Logger.getLogger(DIFFilter.class.getName());

  private static final Pattern SECTION_BREAK = Pattern.compile("_END_|={50,}");
  private static final Pattern AMCSD_CODE = Pattern.compile("_database_code_amcsd\\s+(\\d+)");
  private static final Pattern MINERAL_NAME =
      Pattern.compile("_chemical_name_mineral\\s+[\"']?([^\"'\\n]+)[\"']?");
  private static final Pattern SPACE_GROUP = Pattern.compile("SPACE GROUP:[ \\t]+(\\S+)");
  private static final Pattern CELL = Pattern.compile("CELL PARAMETERS:\\s+([\\d.]+)\\s+([\\d.]+)"
      + "\\s+([\\d.]+)\\s+([\\d.]+)\\s+([\\d.]+)\\s+([\\d.]+)");
  private static final Pattern PEAK = Pattern.compile(
      "^\\s*([\\d.]+)\\s+([\\d.]+)\\s+([\\d.]+)\\s+(-?\\d+)\\s+(-?\\d+)\\s+(-?\\d+)");

  /**
   * Read every usable entry of a DIF file.
   *
   * @param file the DIF file.
   * @return the candidate phases in file order.
   * @throws IOException if the file cannot be read.
   */
  public List<CandidatePhase> readFile(File file) throws IOException {
    String content = FileUtils.readFileToString(file, StandardCharsets.ISO_8859_1);
    List<CandidatePhase> phases = readPhases(content);
    logger.info(format("\n Opening %s\n Read %d phase(s).", file.getName(), phases.size()));
    return phases;
  }

  /**
   * Parse DIF text.
   *
   * @param content the file contents.
   * @return the candidate phases in order of appearance.
   */
  public List<CandidatePhase> readPhases(String content) {
    List<CandidatePhase> phases = new ArrayList<>();
    int skipped = 0;
    for (String section : SECTION_BREAK.split(content)) {
      if (StringUtils.isBlank(section)) {
        continue;
      }
      CandidatePhase phase = parseSection(section);
      if (phase == null) {
        skipped++;
      } else {
        phases.add(phase);
      }
    }
    if (skipped > 0) {
      logger.fine(format(" Skipped %d DIF section(s) without a code or peaks.", skipped));
    }
    return phases;
  }

  @Nullable
  private CandidatePhase parseSection(String section) {
    Matcher code = AMCSD_CODE.matcher(section);
    if (!code.find()) {
      return null;
    }
    String id = StringUtils.leftPad(code.group(1), 7, '0');

    String name = null;
    Matcher tag = MINERAL_NAME.matcher(section);
    if (tag.find()) {
      name = tag.group(1).trim();
    }
    String[] lines = section.split("\\r?\\n");
    if (StringUtils.isEmpty(name)) {
      for (String line : lines) {
        String str = line.trim();
        if (!str.isEmpty() && !str.startsWith("=")) {
          name = str;
          break;
        }
      }
    }
    if (StringUtils.isEmpty(name)) {
      return null;
    }

    int header = section.indexOf("2-THETA");
    if (header < 0) {
      return null;
    }
    List<double[]> rows = new ArrayList<>();
    List<HKL> indices = new ArrayList<>();
    for (String line : section.substring(header).split("\\r?\\n")) {
      Matcher m = PEAK.matcher(line);
      if (!m.find()) {
        continue;
      }
      try {
        rows.add(new double[] {Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2))});
        indices.add(new HKL(Integer.parseInt(m.group(4)), Integer.parseInt(m.group(5)),
            Integer.parseInt(m.group(6))));
      } catch (NumberFormatException e) {
        logger.fine(format(" Ignoring DIF peak row of %s: %s", id, line.trim()));
      }
    }
    if (rows.isEmpty()) {
      return null;
    }
    double[] twoTheta = new double[rows.size()];
    double[] intensity = new double[rows.size()];
    for (int i = 0; i < rows.size(); i++) {
      twoTheta[i] = rows.get(i)[0];
      intensity[i] = rows.get(i)[1];
    }
    TheoreticalPeakSet peaks =
        new TheoreticalPeakSet(twoTheta, intensity, indices.toArray(new HKL[0]));

    String spaceGroup = null;
    Matcher sg = SPACE_GROUP.matcher(section);
    if (sg.find()) {
      spaceGroup = sg.group(1);
    }
    return new CandidatePhase(id, name, "", spaceGroup, parseCell(section, id), peaks);
  }

  @Nullable
  private static UnitCell parseCell(String section, String id) {
    Matcher m = CELL.matcher(section);
    if (!m.find()) {
      return null;
    }
    try {
      return new UnitCell(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)),
          Double.parseDouble(m.group(3)), Double.parseDouble(m.group(4)),
          Double.parseDouble(m.group(5)), Double.parseDouble(m.group(6)));
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException.
      logger.log(Level.WARNING, format(" Ignoring the unit cell of DIF entry %s.", id), e);
      return null;
    }
  }
}

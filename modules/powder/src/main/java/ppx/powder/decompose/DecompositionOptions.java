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

import org.apache.commons.configuration2.CompositeConfiguration;
import ppx.powder.match.MatchOptions;
import ppx.powder.profile.CagliotiParameters;

/**
 * Settings of a {@link SequentialDecomposition}.
 *
 * @param scoreFloor A candidate must score above this value to be accepted.
 * @param penaltyWeight Weight of over-subtraction in the subtraction objective.
 * @param scaleMin Lower bound of the subtraction scale.
 * @param scaleMax Upper bound of the subtraction scale.
 * @param profile Caglioti widths used to synthesize candidate patterns.
 * @param eta Lorentzian fraction used to synthesize candidate patterns.
 * @param match Settings of the residue matcher.
 * @author Michael J. Schnieders
 * @since 1.0
 */
public record DecompositionOptions(double scoreFloor, double penaltyWeight, double scaleMin,
                                   double scaleMax, CagliotiParameters profile, double eta,
                                   MatchOptions match) {

  /**
   * Canonical constructor.
   */
  public DecompositionOptions {
    if (!(scaleMax > scaleMin) || scaleMin <= 0.0) {
      throw new IllegalArgumentException(
          String.format(" Invalid subtraction scale bounds [%g, %g].", scaleMin, scaleMax));
    }
    if (penaltyWeight < 0.0) {
      throw new IllegalArgumentException(" The over-subtraction penalty must not be negative.");
    }
  }

  /**
   * Default decomposition settings: a 0.1 degree FWHM (W = 0.01) pseudo-Voigt with 30% Lorentzian
   * character, a score floor of 0.1, a penalty weight of 10 and subtraction scales in [0.01, 5].
   *
   * @return the defaults.
   */
  public static DecompositionOptions defaults() {
    return new DecompositionOptions(0.1, 10.0, 0.01, 5.0, new CagliotiParameters(0.0, 0.0, 0.01),
        0.3, MatchOptions.defaults());
  }

  /**
   * Read decomposition settings, falling back to the defaults for missing keys.
   *
   * @param properties the configuration.
   * @return the settings.
   */
  public static DecompositionOptions fromProperties(CompositeConfiguration properties) {
    DecompositionOptions d = defaults();
    CagliotiParameters p = d.profile();
    return new DecompositionOptions(
        properties.getDouble("decompose-score-floor", d.scoreFloor()),
        properties.getDouble("decompose-penalty-weight", d.penaltyWeight()),
        properties.getDouble("decompose-scale-min", d.scaleMin()),
        properties.getDouble("decompose-scale-max", d.scaleMax()),
        new CagliotiParameters(
            properties.getDouble("decompose-u", p.u()),
            properties.getDouble("decompose-v", p.v()),
            properties.getDouble("decompose-w", p.w())),
        properties.getDouble("decompose-eta", d.eta()),
        MatchOptions.fromProperties(properties));
  }
}

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
package ppx.utilities;

import static org.junit.Assert.assertEquals;

import java.io.File;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.junit.Test;

/**
 * Test the layered property loading.
 *
 * @author Michael J. Schnieders
 */
public class KeywordTest extends PPXTest {

  @Test
  public void testPropertyFile() throws Exception {
    File file = writeTestFile("test.properties",
        "decompose-score-floor = 0.2\nlebail-staged = true\n");
    CompositeConfiguration properties = Keyword.loadProperties(file);
    assertEquals(0.2, properties.getDouble("decompose-score-floor", 0.1), 0.0);
    assertEquals(true, properties.getBoolean("lebail-staged", false));
    assertEquals(7, properties.getInt("lebail-max-iterations", 7));
  }

  @Test
  public void testSystemPropertyTakesPrecedence() throws Exception {
    File file = writeTestFile("test.properties", "decompose-score-floor = 0.2\n");
    System.setProperty("decompose-score-floor", "0.3");
    CompositeConfiguration properties = Keyword.loadProperties(file);
    assertEquals(0.3, properties.getDouble("decompose-score-floor", 0.1), 0.0);
  }

  @Test
  public void testNoFile() throws Exception {
    CompositeConfiguration properties = Keyword.loadProperties(null);
    assertEquals(0.1, properties.getDouble("decompose-score-floor-unset", 0.1), 0.0);
  }
}

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

import static java.lang.String.format;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;

/**
 * Base class of the PPX unit tests.
 *
 * <p>The "ppx" logger runs at the level named by the ppx.test.log property (WARNING by default)
 * while a test class executes, and the ppx.log property seen by code under test is set to match.
 * System properties are restored after every test, and input files written through {@link
 * #writeTestFile(String, String)} are removed with their directory.
 *
 * @author Michael J. Schnieders
 */
public abstract class PPXTest {

  /** Logger shared by the tests. */
  protected static final Logger logger = Logger.getLogger(PPXTest.class.getName());

  private static final Level runLevel = parseLevel("ppx.log", Level.INFO);
  private static final Level testLevel = parseLevel("ppx.test.log", Level.WARNING);

  private Properties savedProperties;
  private Path testDirectory;

  static {
    System.setProperty("ppx.log", testLevel.toString());
  }

  private static Level parseLevel(String key, Level fallback) {
    String value = System.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      return Level.parse(value.toUpperCase());
    } catch (IllegalArgumentException e) {
      logger.warning(format(" Ignoring %s=%s (%s).", key, value, e.getMessage()));
      return fallback;
    }
  }

  @BeforeClass
  public static void quietLogging() {
    Logger.getLogger("ppx").setLevel(testLevel);
    logger.setLevel(testLevel);
  }

  @AfterClass
  public static void restoreLogging() {
    Logger.getLogger("ppx").setLevel(runLevel);
    logger.setLevel(runLevel);
  }

  @Before
  public void saveProperties() {
    savedProperties = new Properties();
    Properties current = System.getProperties();
    for (String key : current.stringPropertyNames()) {
      savedProperties.setProperty(key, current.getProperty(key));
    }
  }

  @After
  public void cleanUp() {
    System.setProperties(savedProperties);
    if (testDirectory != null) {
      try {
        FileUtils.deleteDirectory(testDirectory.toFile());
      } catch (IOException e) {
        fail(format(" Could not delete %s: %s", testDirectory, e));
      }
      testDirectory = null;
    }
  }

  /**
   * Write a UTF-8 text file into a directory private to the current test.
   *
   * @param name file name.
   * @param contents file contents.
   * @return the file.
   * @throws IOException if the file cannot be written.
   */
  protected File writeTestFile(String name, String contents) throws IOException {
    if (testDirectory == null) {
      testDirectory = Files.createTempDirectory("PPXTest");
    }
    File file = testDirectory.resolve(name).toFile();
    FileUtils.writeStringToFile(file, contents, StandardCharsets.UTF_8);
    return file;
  }
}

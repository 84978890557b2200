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

import java.io.File;
import java.util.Arrays;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * Loads the layered PPX configuration.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Keyword {

  private static final Logger logger = Logger.getLogger(Keyword.class.getName());

  private Keyword() {
  }

  /**
   * Load properties in order of precedence:
   *
   * <p>1.) JVM system properties (-Dkey=value).
   *
   * <p>2.) The supplied property file, if any.
   *
   * <p>3.) User specific properties (~/.ppx/ppx.properties).
   *
   * <p>4.) System wide properties (file named by the PPX_PROPERTIES environment variable).
   *
   * <p>Keys missing from every layer fall back to the defaults of the code that reads them.
   *
   * @param propertyFile a property file from the command line, or null.
   * @return the composite configuration.
   * @throws ConfigurationException if the supplied property file cannot be read.
   */
  public static CompositeConfiguration loadProperties(@Nullable File propertyFile)
      throws ConfigurationException {
    CompositeConfiguration properties = new CompositeConfiguration();

    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    if (propertyFile != null) {
      PropertiesConfiguration fileConfiguration = read(propertyFile);
      fileConfiguration.setHeader("Command line properties (" + propertyFile.getPath() + ").");
      properties.addConfiguration(fileConfiguration);
    }

    File userPropFile = new File(System.getProperty("user.home") + File.separator
        + ".ppx" + File.separator + "ppx.properties");
    addOptional(properties, userPropFile, "PPX user property file");

    String filename = System.getenv("PPX_PROPERTIES");
    if (filename != null) {
      addOptional(properties, new File(filename), "Environment variable PPX_PROPERTIES");
    }

    if (logger.isLoggable(Level.FINE)) {
      Iterator<String> i = properties.getKeys();
      StringBuilder sb = new StringBuilder();
      sb.append(format("\n %-30s %s\n", "Property", "Value"));
      while (i.hasNext()) {
        String s = i.next();
        sb.append(format(" %-30s %s\n", s, Arrays.toString(properties.getList(s).toArray())));
      }
      logger.fine(sb.toString());
    }
    return properties;
  }

  private static void addOptional(CompositeConfiguration properties, File file, String header) {
    if (!file.exists() || !file.canRead()) {
      return;
    }
    try {
      PropertiesConfiguration configuration = read(file);
      configuration.setHeader(header + " (" + file.getPath() + ").");
      properties.addConfiguration(configuration);
    } catch (ConfigurationException e) {
      logger.log(Level.INFO, " Error loading {0}.", file.getPath());
    }
  }

  private static PropertiesConfiguration read(File file) throws ConfigurationException {
    FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
        new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
            .configure(new Parameters().properties().setFile(file).setIncludesAllowed(false));
    return builder.getConfiguration();
  }
}

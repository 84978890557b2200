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

import picocli.CommandLine;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

import java.awt.GraphicsEnvironment;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

import static java.lang.String.format;
import static picocli.CommandLine.usage;

/**
 * Base PPX Command class.
 *
 * @author Michael J. Schnieders
 */
public abstract class PPXCommand {

  /**
   * The logger for this class.
   */
  public static final Logger logger = Logger.getLogger(PPXCommand.class.getName());

  /**
   * Unix shells are able to evaluate PicoCLI ANSI color codes. In a headless environment, color will
   * be ON for command line help.
   */
  public final Ansi color;

  /**
   * The array of args passed into the Command.
   */
  public String[] args;

  /**
   * Parse Result.
   */
  public ParseResult parseResult = null;

  /**
   * -V or --version Prints the PPX version and exits.
   */
  @Option(
      names = {"-V", "--version"},
      versionHelp = true,
      defaultValue = "false",
      description = "Print the Powder Phase X version and exit.")
  public boolean version;

  /**
   * -h or --help Prints a help message.
   */
  @Option(
      names = {"-h", "--help"},
      usageHelp = true,
      defaultValue = "false",
      description = "Print command help and exit.")
  public boolean help;

  /**
   * Create a PPX Command using the supplied command line arguments.
   *
   * @param args The command line arguments.
   */
  public PPXCommand(String[] args) {
    this.args = (args == null) ? new String[0] : args;
    if (GraphicsEnvironment.isHeadless()) {
      color = Ansi.ON;
    } else {
      color = Ansi.OFF;
    }
  }

  /**
   * Use the System ClassLoader to find the requested Command.
   *
   * @param name Name of the Command to load (e.g., Analyze).
   * @return The Command, if found, or null.
   */
  public static Class<? extends PPXCommand> getCommand(String name) {
    ClassLoader loader = PPXCommand.class.getClassLoader();
    Class<?> command;
    try {
      // First try to load the class directly.
      command = loader.loadClass(name);
    } catch (ClassNotFoundException e) {
      // Next, try to load a Command from the UI commands package.
      String pathName = "ppx.ui.commands." + name;
      try {
        command = loader.loadClass(pathName);
      } catch (ClassNotFoundException e2) {
        logger.warning(format(" %s was not found.", name));
        return null;
      }
    }
    if (!PPXCommand.class.isAssignableFrom(command)) {
      logger.warning(format(" %s is not a PPX command.", name));
      return null;
    }
    return command.asSubclass(PPXCommand.class);
  }

  /**
   * Default help information.
   *
   * @return String describing how to use this command.
   */
  public String helpString() {
    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    try (PrintStream printStream = new PrintStream(baos, true, StandardCharsets.UTF_8)) {
      usage(this, printStream, color);
    }
    return " " + baos.toString(StandardCharsets.UTF_8);
  }

  /**
   * Initialize this Command based on the specified command line arguments.
   *
   * @return boolean Returns true if the command should continue and false to exit.
   */
  public boolean init() {
    CommandLine commandLine = new CommandLine(this);
    try {
      parseResult = commandLine.parseArgs(args);
    } catch (CommandLine.UnmatchedArgumentException uae) {
      logger.warning(
          " The usual source of this exception is when long-form arguments (such as --maxPhases) are only preceded by one dash (such as -maxPhases, which is an error).");
      throw uae;
    }

    // Print help info exit.
    if (help) {
      logger.info(helpString());
      return false;
    }

    return !version;
  }

  /**
   * Execute this Command.
   *
   * @return The current PPXCommand.
   */
  public PPXCommand run() {
    logger.info(helpString());
    return this;
  }
}

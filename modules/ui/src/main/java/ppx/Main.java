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
package ppx;

import static java.lang.String.format;

import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import ppx.ui.LogFormatter;
import ppx.utilities.PPXCommand;

/**
 * Command line entry point of Powder Phase X.
 *
 * <p>usage: ppx [-D&lt;property=value&gt;] &lt;command&gt; [-options] &lt;arguments&gt;
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class Main {

  private static final Logger logger = Logger.getLogger(Main.class.getName());

  private static final String BORDER =
      " ______________________________________________________________________________";
  private static final String TITLE = "        POWDER PHASE X";

  private Main() {
  }

  /**
   * Run a Powder Phase X command.
   *
   * @param args the command name followed by its arguments.
   */
  public static void main(String[] args) {
    try {
      PPXCommand command = runCommand(args);
      if (command == null) {
        System.exit(1);
      }
    } catch (Throwable t) {
      int statusCode = 1;
      logger.log(Level.SEVERE, " Uncaught exception: exiting with status code " + statusCode, t);
      System.exit(statusCode);
    }
  }

  /**
   * Process -D properties, start logging and run the named command.
   *
   * @param args the command name followed by its arguments.
   * @return the command after it ran, or null if no command could be run.
   */
  public static PPXCommand runCommand(String[] args) {
    args = processProperties(args);
    startLogging();
    header(args);

    if (args.length < 1) {
      logger.info(" usage: ppx [-D<property=value>] <command> [-options] <arguments>");
      logger.info("  where commands include:\n   Analyze");
      logger.info(" For help on a specific command use:  ppx <command> -h\n");
      return null;
    }

    Class<? extends PPXCommand> commandClass = PPXCommand.getCommand(args[0]);
    if (commandClass == null) {
      return null;
    }
    String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);
    PPXCommand command;
    try {
      command = commandClass.getConstructor(String[].class).newInstance((Object) commandArgs);
    } catch (NoSuchMethodException | InstantiationException | IllegalAccessException
        | InvocationTargetException e) {
      logger.log(Level.WARNING, format(" %s could not be created.", args[0]), e);
      return null;
    }
    return command.run();
  }

  private static void header(String[] args) {
    StringBuilder sb = new StringBuilder();
    sb.append(BORDER).append("\n");
    sb.append(TITLE).append("\n");
    sb.append(BORDER);
    sb.append("\n ").append(new Date());
    if (args != null && args.length > 0) {
      sb.append("\n\n Command line arguments:\n ");
      sb.append(Arrays.toString(args));
      sb.append("\n");
    }
    logger.info(sb.toString());
  }

  /**
   * Set each -Dkey=value argument as a system property and return the remaining arguments.
   */
  private static String[] processProperties(String[] args) {
    List<String> newArgs = new ArrayList<>();
    for (String arg : args) {
      arg = arg.trim();
      if (arg.startsWith("-D")) {
        arg = arg.substring(2);
        int equalsPosition = arg.indexOf('=');
        if (equalsPosition >= 0) {
          System.setProperty(arg.substring(0, equalsPosition), arg.substring(equalsPosition + 1));
        } else if (arg.length() > 0) {
          System.setProperty(arg, "");
        }
      } else {
        newArgs.add(arg);
      }
    }
    return newArgs.toArray(new String[0]);
  }

  /** Route the "ppx" loggers to the console at the level of the ppx.log property. */
  private static void startLogging() {
    Logger defaultLogger = LogManager.getLogManager().getLogger("");
    for (Handler h : defaultLogger.getHandlers()) {
      defaultLogger.removeHandler(h);
    }

    Logger ppxLogger = Logger.getLogger("ppx");
    for (Handler handler : ppxLogger.getHandlers()) {
      ppxLogger.removeHandler(handler);
    }

    String logLevel = System.getProperty("ppx.log", "info");
    Level level;
    try {
      level = Level.parse(logLevel.toUpperCase());
    } catch (IllegalArgumentException e) {
      level = Level.INFO;
    }

    ConsoleHandler handler = new ConsoleHandler();
    handler.setFormatter(new LogFormatter(level.intValue() < Level.INFO.intValue()));
    handler.setLevel(level);
    ppxLogger.addHandler(handler);
    ppxLogger.setLevel(level);
    ppxLogger.setUseParentHandlers(false);
  }
}

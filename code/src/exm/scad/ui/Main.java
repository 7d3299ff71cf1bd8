/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.scad.ui;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.scad.common.Logging;
import exm.scad.common.Settings;
import exm.scad.common.exceptions.InvalidOptionException;
import exm.scad.common.exceptions.ScadFatal;

/**
 * Command line interface to the OpenSCAD front end.  Flags override the
 * matching Java properties; see Settings.java for those.
 */
public class Main {
  private static final String STRICT_FLAG = "s";
  private static final String PRINT_FLAG = "p";
  private static final String DUMP_FLAG = "d";
  private static final String CHECK_SPANS_FLAG = "c";
  private static final String OUTPUT_FLAG = "o";

  public static void main(String[] args) {
    Args scadArgs = processArgs(args);

    try {
      Settings.initScadProperties();
      recordArgValues(scadArgs);
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      ScadFrontend frontend = new ScadFrontend(logger);
      String output = frontend.process(scadArgs.inputFilename,
                                       scadArgs.dump);
      writeOutput(output, scadArgs.outputFilename);
    } catch (ScadFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(STRICT_FLAG, "strict", false,
                   "Reject empty bindings, bad matrices and " +
                   "repeated named arguments");
    opts.addOption(PRINT_FLAG, "print", false, "Print the parsed program");
    opts.addOption(DUMP_FLAG, "dump", false,
                   "Print modules, functions, special variables and scopes");
    opts.addOption(CHECK_SPANS_FLAG, "check-spans", false,
                   "Check that every node lies inside its parent");
    opts.addOption(OUTPUT_FLAG, "output", true,
                   "Write output here instead of standard output");
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    return new Args(remainingArgs[0], cmd.getOptionValue(OUTPUT_FLAG),
                    cmd.hasOption(STRICT_FLAG), cmd.hasOption(PRINT_FLAG),
                    cmd.hasOption(DUMP_FLAG),
                    cmd.hasOption(CHECK_SPANS_FLAG));
  }

  /**
   * Flags win over properties, but only when given
   */
  private static void recordArgValues(Args args) {
    if (args.strict) {
      Settings.set(Settings.STRICT, "true");
    }
    if (args.print) {
      Settings.set(Settings.PRINT, "true");
    }
    if (args.checkSpans) {
      Settings.set(Settings.CHECK_SPANS, "true");
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void writeOutput(String output, String outputFilename) {
    if (outputFilename == null) {
      System.out.print(output);
      System.out.flush();
      return;
    }
    try {
      FileUtils.writeStringToFile(new File(outputFilename), output,
                                  StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error writing " + outputFilename + ": " +
                         e.getMessage());
      throw new ScadFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("scad-ast [options] <input.scad>", opts, false);
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final boolean strict;
    public final boolean print;
    public final boolean dump;
    public final boolean checkSpans;

    public Args(String inputFilename, String outputFilename, boolean strict,
                boolean print, boolean dump, boolean checkSpans) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.strict = strict;
      this.print = print;
      this.dump = dump;
      this.checkSpans = checkSpans;
    }
  }
}

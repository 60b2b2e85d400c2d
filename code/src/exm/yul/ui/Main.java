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
package exm.yul.ui;

import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.yul.common.Logging;
import exm.yul.common.Settings;
import exm.yul.common.exceptions.InvalidOptionException;
import exm.yul.common.exceptions.YulFatal;

/**
 * Command line interface to the optimiser.  Some options are passed
 * indirectly through Java properties.  See Settings.java for handling
 * of these options.
 */
public class Main {
  private static final String DIALECT_FLAG = "d";
  private static final String SEQUENCE_FLAG = "s";
  private static final String RESERVED_FLAG = "r";
  private static final String NO_STACK_OPT_FLAG = "n";
  private static final String RUNS_FLAG = "runs";
  private static final String TRACE_FLAG = "t";

  public static void main(String[] args) {
    Args yoptArgs = processArgs(args);

    try {
      Settings.initYoptProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    // Command line overrides system properties
    if (yoptArgs.trace && Settings.get(Settings.OPT_DEBUG).equals("none")) {
      Settings.set(Settings.OPT_DEBUG, "print-step");
    }
    if (yoptArgs.runs != null) {
      Settings.set(Settings.EVM_RUNS, yoptArgs.runs);
      try {
        Settings.validateProperties();
      } catch (InvalidOptionException ex) {
        System.err.println(ex.getMessage());
        System.exit(ExitCode.ERROR_COMMAND.code());
      }
    }

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
    }
    logger.debug("Reserved identifiers: " +
                 StringUtils.join(yoptArgs.reserved, ", "));

    File inputFile = new File(yoptArgs.inputFilename);
    if (!inputFile.isFile() || !inputFile.canRead()) {
      System.out.println("Input file \"" + inputFile + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }

    PrintStream output = openOutput(yoptArgs.outputFilename);
    PrintStream traceOutput = yoptArgs.trace ? System.err : null;
    try {
      YoptCompiler yopt = new YoptCompiler(logger);
      yopt.optimise(inputFile, yoptArgs.dialect, yoptArgs.sequence,
                    yoptArgs.reserved, yoptArgs.optimizeStackAllocation,
                    output, traceOutput);
      if (output != System.out) {
        output.close();
      }
    } catch (YulFatal ex) {
      cleanupOutput(yoptArgs);
      System.exit(ex.exitCode);
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    opts.addOption(new Option(DIALECT_FLAG, "dialect", true,
                        "Target dialect: evm (default), wasm or plain"));
    opts.addOption(new Option(SEQUENCE_FLAG, "sequence", true,
                        "Custom optimisation step sequence"));
    Option reserved = new Option(RESERVED_FLAG, "reserved", true,
                        "Identifier that must be kept (may be repeated)");
    opts.addOption(reserved);
    opts.addOption(NO_STACK_OPT_FLAG, "no-stack-opt", false,
                        "Don't optimise stack allocation in functions");
    Option runs = new Option(null, RUNS_FLAG, true,
                        "Expected number of runs for the EVM gas meter");
    opts.addOption(runs);
    opts.addOption(TRACE_FLAG, "trace-steps", false,
                        "Print step trace to stderr, see yopt.opt.debug");
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

    Set<String> reserved;
    if (cmd.hasOption(RESERVED_FLAG)) {
      reserved = new HashSet<String>(
                  Arrays.asList(cmd.getOptionValues(RESERVED_FLAG)));
    } else {
      reserved = Collections.emptySet();
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1 || remainingArgs.length > 2) {
      System.out.println("Expected input file and optional output file, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    String input = remainingArgs[0];
    String output = null;
    if (remainingArgs.length == 2) {
      output = remainingArgs[1];
    }
    Args result = new Args(input, output,
            cmd.getOptionValue(DIALECT_FLAG, "evm"),
            cmd.getOptionValue(SEQUENCE_FLAG), reserved,
            !cmd.hasOption(NO_STACK_OPT_FLAG),
            cmd.getOptionValue(RUNS_FLAG), cmd.hasOption(TRACE_FLAG));
    recordArgValues(result);
    return result;
  }

  /**
   * Store in properties for later logging
   */
  private static void recordArgValues(Args args) {
    Settings.set(Settings.INPUT_FILENAME, args.inputFilename);
    if (args.outputFilename != null) {
      Settings.set(Settings.OUTPUT_FILENAME, args.outputFilename);
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("yopt", opts, true);
    System.out.println("requires arguments: <input> [<output>]");
  }

  private static PrintStream openOutput(String outputFilename) {
    if (outputFilename == null) {
      return System.out;
    }
    try {
      FileOutputStream stream = new FileOutputStream(outputFilename);
      return new PrintStream(new BufferedOutputStream(stream));
    } catch (FileNotFoundException e) {
      System.err.println("Unexpected error opening " + outputFilename +
                         " for output: " + e.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
      return null;
    }
  }

  /**
   * Don't leave partial output behind on failure
   */
  private static void cleanupOutput(Args args) {
    if (args.outputFilename != null) {
      File outFile = new File(args.outputFilename);
      if (outFile.exists()) {
        outFile.delete();
      }
    }
  }

  private static class Args {
    public final String inputFilename;
    public final String outputFilename;
    public final String dialect;
    public final String sequence;
    public final Set<String> reserved;
    public final boolean optimizeStackAllocation;
    public final String runs;
    public final boolean trace;

    public Args(String inputFilename, String outputFilename, String dialect,
                String sequence, Set<String> reserved,
                boolean optimizeStackAllocation, String runs, boolean trace) {
      this.inputFilename = inputFilename;
      this.outputFilename = outputFilename;
      this.dialect = dialect;
      this.sequence = sequence;
      this.reserved = reserved;
      this.optimizeStackAllocation = optimizeStackAllocation;
      this.runs = runs;
      this.trace = trace;
    }
  }
}

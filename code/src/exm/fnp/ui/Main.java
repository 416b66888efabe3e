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
package exm.fnp.ui;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.io.IOUtils;
import org.apache.log4j.Logger;

import exm.fnp.common.Logging;
import exm.fnp.common.Settings;
import exm.fnp.common.exceptions.FnFatal;
import exm.fnp.common.exceptions.FnRuntimeError;
import exm.fnp.common.exceptions.InvalidOptionException;
import exm.fnp.frontend.SourceParser;
import exm.fnp.frontend.SourceParser.Rule;
import exm.fnp.tree.AstNode;
import exm.fnp.tree.Json;

/**
 * Command line interface: parse code given as argument or on standard
 * input and print the AST as JSON.  Further options are passed through
 * Java properties, see Settings.java.
 */
public class Main {
  private static final String RULE_FLAG = "r";
  private static final String PRETTY_FLAG = "p";
  private static final String HELP_FLAG = "h";

  public static void main(String[] args) {
    try {
      Settings.initFnpProperties();
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

    int exitCode;
    try {
      exitCode = run(args, System.in, System.out, System.err);
    } catch (FnRuntimeError e) {
      reportInternalError(logger, e);
      exitCode = ExitCode.ERROR_INTERNAL.code();
    }
    System.exit(exitCode);
  }

  /**
   * Run the tool with the given streams
   * @return exit code
   */
  public static int run(String[] args, InputStream in, PrintStream out,
                        PrintStream err) {
    try {
      Args parsedArgs = processArgs(args, out, err);
      if (parsedArgs == null) {
        return ExitCode.SUCCESS.code();
      }
      String code = parsedArgs.code;
      if (code == null) {
        code = readInput(in, err);
      }

      Optional<AstNode> ast = SourceParser.parse(code, parsedArgs.rule);
      if (!ast.isPresent()) {
        err.println("Could not parse input as " + parsedArgs.rule.ruleName());
        return ExitCode.ERROR_USER.code();
      }
      out.println(Json.toJsonString(ast.get(), parsedArgs.pretty));
      return ExitCode.SUCCESS.code();
    } catch (FnFatal ex) {
      return ex.exitCode;
    }
  }

  private static Options initOptions() {
    Options opts = new Options();

    Option rule = new Option(RULE_FLAG, "rule", true,
                "Grammar rule to parse: program (default), expr, " +
                "type_instance, block, assignment, type_def, type_alias");
    opts.addOption(rule);

    opts.addOption(PRETTY_FLAG, "pretty", false, "Pretty-print JSON output");
    opts.addOption(HELP_FLAG, "help", false, "Print this message");
    return opts;
  }

  /**
   * @return parsed arguments, or null if help was requested
   */
  private static Args processArgs(String[] args, PrintStream out,
                                  PrintStream err) {
    Options opts = initOptions();

    CommandLine cmd;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      err.println(ex.getMessage());
      usage(opts, err);
      throw new FnFatal(ExitCode.ERROR_COMMAND.code());
    }

    if (cmd.hasOption(HELP_FLAG)) {
      usage(opts, out);
      return null;
    }

    Rule rule = Rule.PROGRAM;
    if (cmd.hasOption(RULE_FLAG)) {
      String ruleName = cmd.getOptionValue(RULE_FLAG);
      rule = Rule.fromName(ruleName);
      if (rule == null) {
        err.println("Unknown rule: " + ruleName);
        usage(opts, err);
        throw new FnFatal(ExitCode.ERROR_COMMAND.code());
      }
    }

    boolean pretty;
    try {
      pretty = cmd.hasOption(PRETTY_FLAG) ||
               Settings.getBoolean(Settings.JSON_PRETTY);
    } catch (InvalidOptionException e) {
      err.println(e.getMessage());
      throw new FnFatal(ExitCode.ERROR_COMMAND.code());
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length > 1) {
      err.println("Expected at most one code argument, but got "
              + remainingArgs.length + " arguments");
      usage(opts, err);
      throw new FnFatal(ExitCode.ERROR_COMMAND.code());
    }
    String code = remainingArgs.length == 1 ? remainingArgs[0] : null;
    return new Args(code, rule, pretty);
  }

  private static String readInput(InputStream in, PrintStream err) {
    try {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      err.println("Error reading input: " + e.getMessage());
      throw new FnFatal(ExitCode.ERROR_IO.code());
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts, PrintStream stream) {
    HelpFormatter fmt = new HelpFormatter();
    PrintWriter writer = new PrintWriter(stream);
    fmt.printHelp(writer, HelpFormatter.DEFAULT_WIDTH, "fnp [options] [code]",
                  null, opts, HelpFormatter.DEFAULT_LEFT_PAD,
                  HelpFormatter.DEFAULT_DESC_PAD,
                  "Reads code from standard input if not given as argument");
    writer.flush();
  }

  static void reportInternalError(Logger logger, Throwable e) {
    logger.error("fnp internal error: please report this", e);
    System.err.println("fnp internal error: " + e.getMessage());
  }

  private static class Args {
    public final String code;
    public final Rule rule;
    public final boolean pretty;

    public Args(String code, Rule rule, boolean pretty) {
      this.code = code;
      this.rule = rule;
      this.pretty = pretty;
    }
  }
}

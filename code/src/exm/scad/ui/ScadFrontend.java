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

import org.antlr.v4.runtime.RecognitionException;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Logger;

import exm.scad.ast.Ast;
import exm.scad.ast.AstPrinter;
import exm.scad.common.Settings;
import exm.scad.common.exceptions.InvalidOptionException;
import exm.scad.common.exceptions.ParseException;
import exm.scad.common.exceptions.ScadFatal;
import exm.scad.common.exceptions.UnsupportedNodeException;
import exm.scad.frontend.ScadParser;
import exm.scad.frontend.SpanChecker;

/**
 * Runs the front end over one file for the command line, turning every
 * failure into a ScadFatal with the matching exit code.
 */
public class ScadFrontend {

  private final Logger logger;

  public ScadFrontend(Logger logger) {
    this.logger = logger;
  }

  /**
   * @param dump append the context listing to the output
   * @return text to write to standard output
   */
  public String process(String inputFile, boolean dump) {
    String source = readInput(inputFile);
    try {
      logger.debug("scad-ast starting: " + inputFile);
      boolean strict = Settings.getBoolean(Settings.STRICT);
      Ast ast = strict ? ScadParser.parseStrict(source)
                       : ScadParser.parse(source);

      if (Settings.getBoolean(Settings.CHECK_SPANS)) {
        SpanChecker.check(ast);
      }

      StringBuilder out = new StringBuilder();
      if (Settings.getBoolean(Settings.PRINT)) {
        out.append(AstPrinter.print(ast));
      }
      if (dump) {
        out.append(ContextDump.dump(ast.getContext()));
      }
      logger.debug("scad-ast done: " + inputFile);
      return out.toString();
    }
    catch (UnsupportedNodeException e) {
      // The grammar produced something the converter does not handle
      reportInternalError(e);
      throw new ScadFatal(ExitCode.ERROR_INTERNAL.code());
    }
    catch (ParseException e) {
      System.err.println("scad error:");
      System.err.println(inputFile + ":" + e.getMessage());
      if (logger.isDebugEnabled())
        logger.debug("parse failed", e);
      throw new ScadFatal(ExitCode.ERROR_USER.code());
    }
    catch (InvalidOptionException e) {
      System.err.println("Error in settings: " + e.getMessage());
      throw new ScadFatal(ExitCode.ERROR_COMMAND.code());
    }
    catch (RecognitionException e) {
      reportInternalError(e);
      throw new ScadFatal(ExitCode.ERROR_PARSER.code());
    }
    catch (ScadFatal e) {
      throw e;
    }
    catch (Throwable e) {
      reportInternalError(e);
      throw new ScadFatal(ExitCode.ERROR_INTERNAL.code());
    }
  }

  private String readInput(String inputFile) {
    File input = new File(inputFile);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      throw new ScadFatal(ExitCode.ERROR_IO.code());
    }
    try {
      return FileUtils.readFileToString(input, StandardCharsets.UTF_8);
    } catch (IOException e) {
      System.err.println("Error reading " + inputFile + ": " +
                         e.getMessage());
      throw new ScadFatal(ExitCode.ERROR_IO.code());
    }
  }

  public static void reportInternalError(Throwable e) {
    System.err.println("SCAD FRONT END INTERNAL ERROR");
    System.err.println("Please report this");
    e.printStackTrace();
  }
}

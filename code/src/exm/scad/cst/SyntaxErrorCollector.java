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
package exm.scad.cst;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.apache.log4j.Logger;

import exm.scad.common.Logging;

/**
 * Records lexer and parser diagnostics instead of printing them.
 *
 * The parse tree itself carries error and missing markers; these reports
 * back them up with ANTLR's messages and cover the rare case where
 * recovery leaves no marker behind.
 */
public class SyntaxErrorCollector extends BaseErrorListener {

  private static final Logger logger = Logging.getScadLogger();

  public static class Report {
    /** one-based, as reported by ANTLR */
    public final int line;
    /** zero-based code point column */
    public final int charPositionInLine;
    public final String message;

    public Report(int line, int charPositionInLine, String message) {
      this.line = line;
      this.charPositionInLine = charPositionInLine;
      this.message = message;
    }

    @Override
    public String toString() {
      return line + ":" + (charPositionInLine + 1) + " " + message;
    }
  }

  private final List<Report> reports = new ArrayList<Report>();

  @Override
  public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                          int line, int charPositionInLine, String msg,
                          RecognitionException e) {
    Report report = new Report(line, charPositionInLine, msg);
    logger.debug("syntax error: " + report);
    reports.add(report);
  }

  public List<Report> getReports() {
    return Collections.unmodifiableList(reports);
  }
}

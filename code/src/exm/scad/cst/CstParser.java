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

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CodePointCharStream;
import org.antlr.v4.runtime.CommonTokenStream;
import org.apache.log4j.Logger;

import exm.scad.ast.antlr.OpenScadLexer;
import exm.scad.ast.antlr.OpenScadParser;
import exm.scad.common.Logging;

/**
 * Runs the generated ANTLR lexer and parser over a source string.
 *
 * Parsing never throws on bad input: the parser recovers and leaves
 * error and missing markers in the tree for the converter to find.
 */
public class CstParser {

  private static final Logger logger = Logging.getScadLogger();

  public static CstTree parse(String sourceText) {
    SourceText source = new SourceText(sourceText);
    SyntaxErrorCollector errors = new SyntaxErrorCollector();

    CodePointCharStream input = CharStreams.fromString(sourceText);
    OpenScadLexer lexer = new OpenScadLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errors);

    CommonTokenStream tokens = new CommonTokenStream(lexer);
    OpenScadParser parser = new OpenScadParser(tokens);
    parser.removeErrorListeners();
    parser.addErrorListener(errors);

    OpenScadParser.Source_fileContext program = parser.source_file();

    if (logger.isTraceEnabled()) {
      logger.trace("CST: " + program.toStringTree(parser));
    }
    CstNode root = new AntlrCstNode(program, parser.getVocabulary(), source);
    return new CstTree(root, source, errors.getReports());
  }
}

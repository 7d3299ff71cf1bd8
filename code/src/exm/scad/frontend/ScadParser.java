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
package exm.scad.frontend;

import org.apache.log4j.Logger;

import exm.scad.ast.Ast;
import exm.scad.common.Logging;
import exm.scad.common.exceptions.ParseException;
import exm.scad.cst.CstParser;
import exm.scad.cst.CstTree;

/**
 * Entry points of the front end: source text in, AST and context out.
 *
 * Both calls are pure functions of their input and may run concurrently.
 */
public class ScadParser {

  private static final Logger logger = Logging.getScadLogger();

  /**
   * Parse and convert source text.
   * @throws exm.scad.common.exceptions.SyntaxException at the first error in the parse tree
   * @throws exm.scad.common.exceptions.UnsupportedNodeException if the tree holds a node kind with
   *         no AST counterpart
   */
  public static Ast parse(String source) throws ParseException {
    CstTree tree = CstParser.parse(source);
    Ast ast = new CstConverter(tree).convert();
    if (logger.isDebugEnabled()) {
      logger.debug("converted " + ast.getItems().size() + " items, " +
                   ast.getContext().scopeCount() + " scopes");
    }
    return ast;
  }

  /**
   * As parse, then reject the first construct that breaks a strict rule
   * @throws exm.scad.common.exceptions.SemanticException for the first violation in source order
   */
  public static Ast parseStrict(String source) throws ParseException {
    Ast ast = parse(source);
    StrictValidator.validate(ast);
    return ast;
  }
}

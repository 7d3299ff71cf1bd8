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

import java.util.List;

import exm.scad.ast.Span;

/**
 * Read-only view of a concrete syntax tree node.
 *
 * Every node carries a kind tag.  Rule nodes are tagged with the grammar
 * rule or alternative label (for example "transform_chain" or
 * "binary_expression"), named tokens with their lowercase token name
 * ("identifier", "number") and anonymous tokens with their literal text
 * ("(", "module").  Rule nodes and named tokens are named; punctuation and
 * keywords are not.
 */
public interface CstNode {

  String kind();

  boolean isNamed();

  /**
   * @return true for a single token, false for a rule node
   */
  boolean isToken();

  /**
   * @return true if the parser flagged this node as erroneous: an
   *         unexpected token, or a rule that failed to match
   */
  boolean isError();

  /**
   * @return true if the node stands for a token the parser expected but
   *         did not find.  Missing nodes are zero width.
   */
  boolean isMissing();

  Span span();

  /**
   * @return the source slice covered by this node
   */
  String text();

  List<CstNode> children();

  List<CstNode> namedChildren();
}

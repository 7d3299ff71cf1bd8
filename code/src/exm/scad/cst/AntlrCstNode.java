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

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import exm.scad.ast.Span;
import exm.scad.common.exceptions.ScadRuntimeError;

/**
 * CstNode backed by an ANTLR parse tree node.
 */
public class AntlrCstNode implements CstNode {

  private static final String CONTEXT_SUFFIX = "Context";
  private static final String ERROR_KIND = "ERROR";
  private static final String EOF_KIND = "EOF";

  private final ParseTree tree;
  private final Vocabulary vocabulary;
  private final SourceText source;

  /** Lazily computed */
  private Span span = null;
  private List<CstNode> children = null;
  private List<CstNode> namedChildren = null;

  public AntlrCstNode(ParseTree tree, Vocabulary vocabulary,
                      SourceText source) {
    this.tree = tree;
    this.vocabulary = vocabulary;
    this.source = source;
  }

  @Override
  public String kind() {
    if (tree instanceof ErrorNode) {
      if (isMissing()) {
        return tokenKind(((ErrorNode) tree).getSymbol().getType());
      }
      return ERROR_KIND;
    } else if (tree instanceof TerminalNode) {
      return tokenKind(((TerminalNode) tree).getSymbol().getType());
    } else if (tree instanceof ParserRuleContext) {
      return ruleKind((ParserRuleContext) tree);
    } else {
      throw new ScadRuntimeError("Unexpected parse tree node: " +
                                 tree.getClass().getName());
    }
  }

  /**
   * Generated context classes are named after the rule or the alternative
   * label, e.g. Binary_expressionContext for binary_expression
   */
  static String ruleKind(ParserRuleContext ctx) {
    String name = ctx.getClass().getSimpleName();
    if (name.endsWith(CONTEXT_SUFFIX)) {
      name = name.substring(0, name.length() - CONTEXT_SUFFIX.length());
    }
    if (name.isEmpty()) {
      throw new ScadRuntimeError("Unnamed rule context " +
                                 ctx.getClass().getName());
    }
    return Character.toLowerCase(name.charAt(0)) + name.substring(1);
  }

  private String tokenKind(int type) {
    if (type == Token.EOF) {
      return EOF_KIND;
    }
    String symbolic = vocabulary.getSymbolicName(type);
    if (symbolic != null) {
      return symbolic.toLowerCase();
    }
    String literal = vocabulary.getLiteralName(type);
    if (literal != null && literal.length() >= 2 && literal.startsWith("'")) {
      return literal.substring(1, literal.length() - 1);
    }
    return vocabulary.getDisplayName(type);
  }

  @Override
  public boolean isNamed() {
    if (tree instanceof ErrorNode) {
      return true;
    } else if (tree instanceof TerminalNode) {
      int type = ((TerminalNode) tree).getSymbol().getType();
      return type != Token.EOF && vocabulary.getSymbolicName(type) != null;
    } else {
      return true;
    }
  }

  @Override
  public boolean isToken() {
    return tree instanceof TerminalNode;
  }

  @Override
  public boolean isError() {
    if (tree instanceof ErrorNode) {
      return !isMissing();
    } else if (tree instanceof ParserRuleContext) {
      return ((ParserRuleContext) tree).exception != null;
    }
    return false;
  }

  @Override
  public boolean isMissing() {
    return tree instanceof ErrorNode &&
           ((ErrorNode) tree).getSymbol().getTokenIndex() == -1;
  }

  @Override
  public Span span() {
    if (span == null) {
      span = computeSpan();
    }
    return span;
  }

  private Span computeSpan() {
    if (tree instanceof TerminalNode) {
      Token tok = ((TerminalNode) tree).getSymbol();
      if (isMissing()) {
        // Conjured tokens have no extent, only the position they were
        // expected at
        return source.point(source.offsetOf(tok.getLine(),
                                            tok.getCharPositionInLine()));
      } else if (tok.getType() == Token.EOF) {
        return source.point(source.size());
      }
      return source.span(tok.getStartIndex(), tok.getStopIndex() + 1);
    } else {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      Token start = ctx.getStart();
      Token stop = ctx.getStop();
      int startCp = start.getType() == Token.EOF ? source.size()
                                                 : start.getStartIndex();
      int endCp;
      if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
        // Rule matched nothing
        endCp = startCp;
      } else if (stop.getType() == Token.EOF) {
        endCp = source.size();
      } else {
        endCp = stop.getStopIndex() + 1;
      }
      return source.span(startCp, endCp);
    }
  }

  @Override
  public String text() {
    return span().getText();
  }

  @Override
  public List<CstNode> children() {
    if (children == null) {
      List<CstNode> result = new ArrayList<CstNode>(tree.getChildCount());
      for (int i = 0; i < tree.getChildCount(); i++) {
        result.add(new AntlrCstNode(tree.getChild(i), vocabulary, source));
      }
      children = Collections.unmodifiableList(result);
    }
    return children;
  }

  @Override
  public List<CstNode> namedChildren() {
    if (namedChildren == null) {
      List<CstNode> result = new ArrayList<CstNode>();
      for (CstNode child: children()) {
        if (child.isNamed()) {
          result.add(child);
        }
      }
      namedChildren = Collections.unmodifiableList(result);
    }
    return namedChildren;
  }

  @Override
  public String toString() {
    return kind() + "@" + span();
  }
}

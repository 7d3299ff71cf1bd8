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
import exm.scad.cst.SyntaxErrorCollector.Report;

/**
 * Result of the concrete parse: root node, source positions and any
 * diagnostics the lexer or parser reported.
 */
public class CstTree {
  private final CstNode root;
  private final SourceText source;
  private final List<Report> reports;

  public CstTree(CstNode root, SourceText source, List<Report> reports) {
    this.root = root;
    this.source = source;
    this.reports = reports;
  }

  public CstNode getRoot() {
    return root;
  }

  public SourceText getSource() {
    return source;
  }

  public List<Report> getReports() {
    return reports;
  }

  /**
   * Pre-order, leftmost-first search for an error or missing node
   * @return the first one found, or null if the tree is clean
   */
  public CstNode findFirstError() {
    return findFirstError(root);
  }

  private static CstNode findFirstError(CstNode node) {
    if (node.isError() || node.isMissing()) {
      return node;
    }
    for (CstNode child: node.children()) {
      CstNode found = findFirstError(child);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  /**
   * @return location of a diagnostic as a zero-width span
   */
  public Span reportSpan(Report report) {
    return source.point(source.offsetOf(report.line,
                                        report.charPositionInLine));
  }

  /**
   * Describe the problem at an error node, preferring the parser's own
   * message when one was reported inside the node
   */
  public String describeError(CstNode node) {
    Span nodeSpan = node.span();
    for (Report report: reports) {
      int at = reportSpan(report).getStartByte();
      if (at >= nodeSpan.getStartByte() && at <= nodeSpan.getEndByte()) {
        return report.message;
      }
    }
    if (node.isMissing()) {
      return "missing '" + node.kind() + "'";
    } else if (node.isToken()) {
      return "unexpected '" + node.text() + "'";
    } else {
      return "invalid " + node.kind();
    }
  }
}

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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import exm.scad.ast.Arg;
import exm.scad.ast.Ast;
import exm.scad.ast.AstVisitor;
import exm.scad.ast.Binding;
import exm.scad.ast.Expr;
import exm.scad.ast.Item;
import exm.scad.ast.Node;
import exm.scad.ast.Param;
import exm.scad.ast.Span;
import exm.scad.ast.Stmt;
import exm.scad.common.exceptions.ScadRuntimeError;

/**
 * Verifies that every node's span lies within its parent's span.
 * A failure is a converter bug, so it raises ScadRuntimeError.
 */
public class SpanChecker extends AstVisitor {

  private final Deque<Node> parents = new ArrayDeque<Node>();

  public static void check(Ast ast) {
    SpanChecker checker = new SpanChecker();
    checker.parents.push(ast);
    checker.walk(ast);
    checker.parents.pop();
  }

  @Override
  public void visitItem(Item item) {
    enter(item);
    walkItem(item);
    parents.pop();
  }

  @Override
  public void visitStmt(Stmt stmt) {
    enter(stmt);
    walkStmt(stmt);
    parents.pop();
  }

  @Override
  public void visitExpr(Expr expr) {
    enter(expr);
    walkExpr(expr);
    parents.pop();
  }

  @Override
  protected void walkArgs(List<Arg> args) {
    for (Arg arg: args) {
      enter(arg);
      visitExpr(arg.getValue());
      parents.pop();
    }
  }

  @Override
  protected void walkBindings(List<Binding> bindings) {
    for (Binding binding: bindings) {
      enter(binding);
      checkWithin(binding.getName(), binding);
      visitExpr(binding.getValue());
      parents.pop();
    }
  }

  @Override
  protected void walkParams(List<Param> params) {
    for (Param param: params) {
      enter(param);
      checkWithin(param.getName(), param);
      if (param.hasDefault()) {
        visitExpr(param.getDefaultValue());
      }
      parents.pop();
    }
  }

  private void enter(Node node) {
    checkWithin(node, parents.peek());
    parents.push(node);
  }

  private static void checkWithin(Node child, Node parent) {
    Span outer = parent.getSpan();
    Span inner = child.getSpan();
    if (!outer.contains(inner)) {
      throw new ScadRuntimeError("span " + inner + " of " +
            child.getClass().getSimpleName() + " is not within span " +
            outer + " of " + parent.getClass().getSimpleName());
    }
  }
}

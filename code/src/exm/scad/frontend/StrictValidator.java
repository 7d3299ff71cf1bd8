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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.scad.ast.Arg;
import exm.scad.ast.Ast;
import exm.scad.ast.AstVisitor;
import exm.scad.ast.Expr;
import exm.scad.ast.Expr.AssertExpr;
import exm.scad.ast.Expr.Call;
import exm.scad.ast.Expr.EchoExpr;
import exm.scad.ast.Expr.ExprKind;
import exm.scad.ast.Expr.LetExpr;
import exm.scad.ast.Expr.ListComp;
import exm.scad.ast.Expr.ListExpr;
import exm.scad.ast.Item;
import exm.scad.ast.Span;
import exm.scad.ast.Stmt;
import exm.scad.ast.Stmt.AssertStmt;
import exm.scad.ast.Stmt.BindingBlock;
import exm.scad.ast.Stmt.TransformChain;
import exm.scad.common.exceptions.SemanticErrorKind;
import exm.scad.common.exceptions.SemanticException;

/**
 * Strict-mode checks over a converted tree.
 *
 * Nodes are checked in pre-order as the default walk reaches them.  The
 * first violation is kept and the walk stops descending, so the reported
 * error is always the earliest one in source order.
 */
public class StrictValidator extends AstVisitor {

  public static final String MULTMATRIX = "multmatrix";
  /** Name of the matrix parameter of multmatrix */
  public static final String MATRIX_PARAM = "m";

  /** A transform matrix has 3 or 4 rows of exactly 4 columns */
  private static final int MATRIX_MIN_ROWS = 3;
  private static final int MATRIX_MAX_ROWS = 4;
  private static final int MATRIX_COLS = 4;

  private SemanticException violation = null;

  public static void validate(Ast ast) throws SemanticException {
    StrictValidator validator = new StrictValidator();
    validator.walk(ast);
    if (validator.violation != null) {
      throw validator.violation;
    }
  }

  @Override
  public void visitItem(Item item) {
    if (violation == null) {
      walkItem(item);
    }
  }

  @Override
  public void visitStmt(Stmt stmt) {
    if (violation != null) {
      return;
    }
    checkStmt(stmt);
    if (violation == null) {
      walkStmt(stmt);
    }
  }

  @Override
  public void visitExpr(Expr expr) {
    if (violation != null) {
      return;
    }
    checkExpr(expr);
    if (violation == null) {
      walkExpr(expr);
    }
  }

  private void checkStmt(Stmt stmt) {
    switch (stmt.kind()) {
      case TRANSFORM_CHAIN: {
        TransformChain chain = (TransformChain) stmt;
        checkDuplicateArgs(chain.getArgs());
        if (violation == null &&
            chain.getName().getId().equals(MULTMATRIX)) {
          checkMatrix(chain.getArgs(), stmt.getSpan());
        }
        break;
      }
      case FOR:
      case INTERSECTION_FOR:
      case LET:
      case ASSIGN: {
        BindingBlock block = (BindingBlock) stmt;
        checkBindings(block.getBindings().size(), block.keyword(),
                      stmt.getSpan());
        break;
      }
      case ASSERT:
        checkDuplicateArgs(((AssertStmt) stmt).getArgs());
        break;
      default:
        break;
    }
  }

  private void checkExpr(Expr expr) {
    switch (expr.kind()) {
      case CALL:
        checkDuplicateArgs(((Call) expr).getArgs());
        break;
      case ECHO:
        checkDuplicateArgs(((EchoExpr) expr).getArgs());
        break;
      case ASSERT:
        checkDuplicateArgs(((AssertExpr) expr).getArgs());
        break;
      case LET:
        checkBindings(((LetExpr) expr).getBindings().size(), "let",
                      expr.getSpan());
        break;
      case LIST_COMP: {
        // The C-style form may leave its init empty
        ListComp comp = (ListComp) expr;
        if (!comp.isCStyle()) {
          checkBindings(comp.getBinds().size(), "for", expr.getSpan());
        }
        break;
      }
      default:
        break;
    }
  }

  private void checkBindings(int count, String construct, Span span) {
    if (count == 0) {
      fail(SemanticErrorKind.EMPTY_BINDING, span,
           construct + " has no bindings");
    }
  }

  private void checkDuplicateArgs(List<Arg> args) {
    Set<String> seen = new HashSet<String>();
    for (Arg arg: args) {
      if (arg.isNamed() && !seen.add(arg.getName().getId())) {
        fail(SemanticErrorKind.DUPLICATE_NAMED_ARG, arg.getSpan(),
             "argument '" + arg.getName().getId() +
             "' is given more than once");
        return;
      }
    }
  }

  /**
   * Check the matrix of a multmatrix call when its shape is evident from
   * the source.  Computed rows or generator elements make the shape
   * unknown, and those parts are accepted.  A call without any matrix
   * argument is reported at the call.
   */
  private void checkMatrix(List<Arg> args, Span callSpan) {
    Expr matrix = matrixArg(args);
    if (matrix == null) {
      fail(SemanticErrorKind.INVALID_MATRIX_SHAPE, callSpan,
           "multmatrix requires a matrix argument");
      return;
    }
    if (!isLiteralList(matrix)) {
      return;
    }
    List<Expr> rows = ((ListExpr) matrix).getElements();
    if (rows.size() < MATRIX_MIN_ROWS || rows.size() > MATRIX_MAX_ROWS) {
      fail(SemanticErrorKind.INVALID_MATRIX_SHAPE, matrix.getSpan(),
           "multmatrix expects 3 or 4 rows of 4 columns, but got " +
           rows.size() + " rows");
      return;
    }
    for (int i = 0; i < rows.size(); i++) {
      Expr row = rows.get(i);
      if (!isLiteralList(row)) {
        continue;
      }
      int cols = ((ListExpr) row).getElements().size();
      if (cols != MATRIX_COLS) {
        fail(SemanticErrorKind.INVALID_MATRIX_SHAPE, row.getSpan(),
             "multmatrix row " + i + " has " + cols +
             " columns, expected " + MATRIX_COLS);
        return;
      }
    }
  }

  /**
   * @return first positional argument, else the m= argument, else null
   */
  private static Expr matrixArg(List<Arg> args) {
    Expr named = null;
    for (Arg arg: args) {
      if (!arg.isNamed()) {
        return arg.getValue();
      } else if (named == null &&
                 arg.getName().getId().equals(MATRIX_PARAM)) {
        named = arg.getValue();
      }
    }
    return named;
  }

  /**
   * @return true if expr is a list literal whose length is known
   */
  private static boolean isLiteralList(Expr expr) {
    if (expr.kind() != ExprKind.LIST) {
      return false;
    }
    for (Expr element: ((ListExpr) expr).getElements()) {
      switch (element.kind()) {
        case EACH:
        case LIST_COMP:
        case LIST_COMP_IF:
          return false;
        default:
          break;
      }
    }
    return true;
  }

  private void fail(SemanticErrorKind kind, Span span, String details) {
    if (violation == null) {
      violation = new SemanticException(kind, span, details);
    }
  }
}

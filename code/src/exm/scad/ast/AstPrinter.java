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
package exm.scad.ast;

import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.scad.ast.Expr.AssertExpr;
import exm.scad.ast.Expr.Binary;
import exm.scad.ast.Expr.Call;
import exm.scad.ast.Expr.DotIndex;
import exm.scad.ast.Expr.Each;
import exm.scad.ast.Expr.EchoExpr;
import exm.scad.ast.Expr.ExprKind;
import exm.scad.ast.Expr.FunctionLit;
import exm.scad.ast.Expr.Ident;
import exm.scad.ast.Expr.Index;
import exm.scad.ast.Expr.LetExpr;
import exm.scad.ast.Expr.ListComp;
import exm.scad.ast.Expr.ListCompIf;
import exm.scad.ast.Expr.ListExpr;
import exm.scad.ast.Expr.Literal;
import exm.scad.ast.Expr.Paren;
import exm.scad.ast.Expr.Range;
import exm.scad.ast.Expr.SpecialIdent;
import exm.scad.ast.Expr.Ternary;
import exm.scad.ast.Expr.Unary;
import exm.scad.ast.Item.FunctionDef;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.ast.Item.Statement;
import exm.scad.ast.Item.VarDecl;
import exm.scad.ast.Stmt.AssertStmt;
import exm.scad.ast.Stmt.BindingBlock;
import exm.scad.ast.Stmt.FileRef;
import exm.scad.ast.Stmt.IfBlock;
import exm.scad.ast.Stmt.Modifier;
import exm.scad.ast.Stmt.StmtKind;
import exm.scad.ast.Stmt.TransformChain;
import exm.scad.ast.Stmt.UnionBlock;
import exm.scad.common.exceptions.ScadRuntimeError;

/**
 * Renders an AST back to OpenSCAD source.
 *
 * Parsing the output of {@link #print(Ast)} yields a structurally equal
 * tree.  Layout and comments of the input text are not preserved.
 * Parenthesized expressions are kept in the tree, so no grouping
 * parentheses are ever added here.
 */
public class AstPrinter extends AstVisitor {

  private static final String INDENT = "  ";

  private static final String[] ESCAPE_FROM =
                          new String[] {"\\", "\"", "\n", "\t", "\r"};
  private static final String[] ESCAPE_TO =
                          new String[] {"\\\\", "\\\"", "\\n", "\\t", "\\r"};

  /** Numbers below this magnitude with no fraction print as integers */
  private static final double MAX_INTEGRAL = 1e15;

  private final StringBuilder sb = new StringBuilder();
  private int depth = 0;

  public static String print(Ast ast) {
    AstPrinter printer = new AstPrinter();
    printer.walk(ast);
    return printer.sb.toString();
  }

  /**
   * @return the item followed by a newline
   */
  public static String printItem(Item item) {
    AstPrinter printer = new AstPrinter();
    printer.visitItem(item);
    return printer.sb.toString();
  }

  public static String printStmt(Stmt stmt) {
    AstPrinter printer = new AstPrinter();
    printer.visitStmt(stmt);
    return printer.sb.toString();
  }

  public static String printExpr(Expr expr) {
    AstPrinter printer = new AstPrinter();
    printer.visitExpr(expr);
    return printer.sb.toString();
  }

  @Override
  public void visitItem(Item item) {
    indent();
    switch (item.kind()) {
      case MODULE_DEF: {
        ModuleDef def = (ModuleDef) item;
        sb.append("module ").append(def.getName().getId());
        params(def.getParams());
        sb.append(' ');
        block(def.getBody());
        break;
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef) item;
        sb.append("function ").append(def.getName().getId());
        params(def.getParams());
        sb.append(" = ");
        visitExpr(def.getBody());
        sb.append(';');
        break;
      }
      case VAR_DECL: {
        VarDecl decl = (VarDecl) item;
        sb.append(decl.getName().getId()).append(" = ");
        visitExpr(decl.getValue());
        sb.append(';');
        break;
      }
      case STATEMENT:
        visitStmt(((Statement) item).getStmt());
        break;
      default:
        throw new ScadRuntimeError("Unexpected item kind " + item.kind());
    }
    sb.append('\n');
  }

  @Override
  public void visitStmt(Stmt stmt) {
    switch (stmt.kind()) {
      case TRANSFORM_CHAIN: {
        TransformChain chain = (TransformChain) stmt;
        for (Modifier m: chain.getModifiers()) {
          sb.append(m.symbol());
        }
        sb.append(chain.getName().getId());
        args(chain.getArgs());
        tail(chain.getTail());
        break;
      }
      case UNION_BLOCK:
        block(((UnionBlock) stmt).getItems());
        break;
      case FOR:
      case INTERSECTION_FOR:
      case LET:
      case ASSIGN: {
        BindingBlock block = (BindingBlock) stmt;
        sb.append(block.keyword()).append(" (");
        bindings(block.getBindings());
        sb.append(')');
        tail(block.getBody());
        break;
      }
      case IF: {
        IfBlock ifBlock = (IfBlock) stmt;
        sb.append("if (");
        visitExpr(ifBlock.getCond());
        sb.append(')');
        tail(ifBlock.getThenBranch());
        if (ifBlock.hasElse()) {
          sb.append(" else");
          tail(ifBlock.getElseBranch());
        }
        break;
      }
      case ASSERT: {
        AssertStmt assertStmt = (AssertStmt) stmt;
        sb.append("assert");
        args(assertStmt.getArgs());
        tail(assertStmt.getBody());
        break;
      }
      case INCLUDE:
      case USE: {
        FileRef ref = (FileRef) stmt;
        sb.append(ref.keyword()).append(" <").append(ref.getPath())
          .append('>');
        break;
      }
      case EMPTY:
        sb.append(';');
        break;
      default:
        throw new ScadRuntimeError("Unexpected statement kind " + stmt.kind());
    }
  }

  @Override
  public void visitExpr(Expr expr) {
    switch (expr.kind()) {
      case LITERAL:
        literal((Literal) expr);
        break;
      case IDENT:
        sb.append(((Ident) expr).getName().getId());
        break;
      case SPECIAL_IDENT:
        sb.append(((SpecialIdent) expr).getName().getId());
        break;
      case CALL: {
        Call call = (Call) expr;
        visitExpr(call.getCallee());
        args(call.getArgs());
        break;
      }
      case INDEX: {
        Index index = (Index) expr;
        visitExpr(index.getBase());
        sb.append('[');
        visitExpr(index.getIndex());
        sb.append(']');
        break;
      }
      case DOT_INDEX: {
        DotIndex dot = (DotIndex) expr;
        visitExpr(dot.getBase());
        if (dot.getBase().kind() == ExprKind.LITERAL &&
            ((Literal) dot.getBase()).isNumber()) {
          // 1.x would lex as the number 1. followed by x
          sb.append(' ');
        }
        sb.append('.').append(dot.getField().getId());
        break;
      }
      case UNARY: {
        Unary unary = (Unary) expr;
        sb.append(unary.getOp().symbol());
        visitExpr(unary.getOperand());
        break;
      }
      case BINARY: {
        Binary binary = (Binary) expr;
        visitExpr(binary.getLeft());
        sb.append(' ').append(binary.getOp().symbol()).append(' ');
        visitExpr(binary.getRight());
        break;
      }
      case TERNARY: {
        Ternary ternary = (Ternary) expr;
        visitExpr(ternary.getCond());
        sb.append(" ? ");
        visitExpr(ternary.getThen());
        sb.append(" : ");
        visitExpr(ternary.getElse());
        break;
      }
      case PAREN:
        sb.append('(');
        visitExpr(((Paren) expr).getInner());
        sb.append(')');
        break;
      case LET: {
        LetExpr let = (LetExpr) expr;
        sb.append("let (");
        bindings(let.getBindings());
        sb.append(") ");
        visitExpr(let.getBody());
        break;
      }
      case ASSERT: {
        AssertExpr assertExpr = (AssertExpr) expr;
        sb.append("assert");
        args(assertExpr.getArgs());
        optionalBody(assertExpr.getBody());
        break;
      }
      case ECHO: {
        EchoExpr echo = (EchoExpr) expr;
        sb.append("echo");
        args(echo.getArgs());
        optionalBody(echo.getBody());
        break;
      }
      case LIST: {
        sb.append('[');
        boolean first = true;
        for (Expr element: ((ListExpr) expr).getElements()) {
          if (!first) {
            sb.append(", ");
          }
          first = false;
          visitExpr(element);
        }
        sb.append(']');
        break;
      }
      case RANGE: {
        Range range = (Range) expr;
        sb.append('[');
        visitExpr(range.getStart());
        sb.append(" : ");
        if (range.getStep() != null) {
          visitExpr(range.getStep());
          sb.append(" : ");
        }
        visitExpr(range.getEnd());
        sb.append(']');
        break;
      }
      case FUNCTION_LIT: {
        FunctionLit fn = (FunctionLit) expr;
        sb.append("function ");
        params(fn.getParams());
        sb.append(' ');
        visitExpr(fn.getBody());
        break;
      }
      case EACH:
        sb.append("each ");
        visitExpr(((Each) expr).getExpr());
        break;
      case LIST_COMP:
        listComp((ListComp) expr);
        break;
      case LIST_COMP_IF: {
        ListCompIf compIf = (ListCompIf) expr;
        sb.append("if (");
        visitExpr(compIf.getCond());
        sb.append(") ");
        visitExpr(compIf.getThen());
        if (compIf.getElse() != null) {
          sb.append(" else ");
          visitExpr(compIf.getElse());
        }
        break;
      }
      default:
        throw new ScadRuntimeError("Unexpected expression kind " + expr.kind());
    }
  }

  private void listComp(ListComp comp) {
    sb.append("for (");
    bindings(comp.getBinds());
    if (comp.isCStyle()) {
      Expr cond = null;
      List<Binding> updates = null;
      for (CompClause clause: comp.getClauses()) {
        if (clause instanceof CompClause.Condition) {
          cond = ((CompClause.Condition) clause).getCond();
        } else {
          updates = ((CompClause.Update) clause).getBindings();
        }
      }
      if (cond == null) {
        throw new ScadRuntimeError("C-style comprehension without condition");
      }
      sb.append("; ");
      visitExpr(cond);
      sb.append(';');
      if (updates != null && !updates.isEmpty()) {
        sb.append(' ');
        bindings(updates);
      }
    }
    sb.append(") ");
    visitExpr(comp.getBody());
  }

  private void literal(Literal lit) {
    switch (lit.getLiteralKind()) {
      case NUMBER:
        sb.append(formatNumber(lit.getNumber()));
        break;
      case STRING:
        sb.append('"').append(escape(lit.getString())).append('"');
        break;
      case BOOL:
        sb.append(lit.getBool() ? "true" : "false");
        break;
      case UNDEF:
        sb.append("undef");
        break;
      default:
        throw new ScadRuntimeError("Unknown literal kind " +
                                   lit.getLiteralKind());
    }
  }

  /**
   * Format so that the lexer reads back exactly the same double
   */
  static String formatNumber(double value) {
    if (Double.isInfinite(value)) {
      // Overflows to infinity when read back
      return value > 0 ? "1e1000" : "-1e1000";
    }
    if (value == Math.rint(value) && Math.abs(value) < MAX_INTEGRAL) {
      return Long.toString((long) value);
    }
    return Double.toString(value);
  }

  static String escape(String s) {
    return StringUtils.replaceEach(s, ESCAPE_FROM, ESCAPE_TO);
  }

  /**
   * Body of a statement construct: attached directly when it is a lone
   * semicolon, otherwise after a space
   */
  private void tail(Stmt body) {
    if (body.kind() != StmtKind.EMPTY) {
      sb.append(' ');
    }
    visitStmt(body);
  }

  private void optionalBody(Expr body) {
    if (body != null) {
      sb.append(' ');
      visitExpr(body);
    }
  }

  private void block(List<Item> items) {
    if (items.isEmpty()) {
      sb.append("{}");
      return;
    }
    sb.append("{\n");
    depth++;
    for (Item item: items) {
      visitItem(item);
    }
    depth--;
    indent();
    sb.append('}');
  }

  private void args(List<Arg> args) {
    sb.append('(');
    boolean first = true;
    for (Arg arg: args) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      if (arg.isNamed()) {
        sb.append(arg.getName().getId()).append(" = ");
      }
      visitExpr(arg.getValue());
    }
    sb.append(')');
  }

  private void params(List<Param> params) {
    sb.append('(');
    boolean first = true;
    for (Param param: params) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(param.getName().getId());
      if (param.hasDefault()) {
        sb.append(" = ");
        visitExpr(param.getDefaultValue());
      }
    }
    sb.append(')');
  }

  private void bindings(List<Binding> bindings) {
    boolean first = true;
    for (Binding binding: bindings) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(binding.getName().getId()).append(" = ");
      visitExpr(binding.getValue());
    }
  }

  private void indent() {
    sb.append(StringUtils.repeat(INDENT, depth));
  }
}

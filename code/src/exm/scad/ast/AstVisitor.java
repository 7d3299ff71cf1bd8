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

import exm.scad.ast.Expr.AssertExpr;
import exm.scad.ast.Expr.Binary;
import exm.scad.ast.Expr.Call;
import exm.scad.ast.Expr.DotIndex;
import exm.scad.ast.Expr.Each;
import exm.scad.ast.Expr.EchoExpr;
import exm.scad.ast.Expr.FunctionLit;
import exm.scad.ast.Expr.Index;
import exm.scad.ast.Expr.LetExpr;
import exm.scad.ast.Expr.ListComp;
import exm.scad.ast.Expr.ListCompIf;
import exm.scad.ast.Expr.ListExpr;
import exm.scad.ast.Expr.Paren;
import exm.scad.ast.Expr.Range;
import exm.scad.ast.Expr.Ternary;
import exm.scad.ast.Expr.Unary;
import exm.scad.ast.Item.FunctionDef;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.ast.Item.Statement;
import exm.scad.ast.Item.VarDecl;
import exm.scad.ast.Stmt.AssertStmt;
import exm.scad.ast.Stmt.BindingBlock;
import exm.scad.ast.Stmt.IfBlock;
import exm.scad.ast.Stmt.TransformChain;
import exm.scad.ast.Stmt.UnionBlock;
import exm.scad.common.exceptions.ScadRuntimeError;

/**
 * Read-only traversal over the AST.
 *
 * Each visit hook defaults to the matching walk method, which visits
 * every child left to right, depth first, in source order.  Subclasses
 * override the hooks they care about and call super (or the walk method)
 * to keep descending.
 */
public abstract class AstVisitor {

  /**
   * Visit all top-level items in order
   */
  public void walk(Ast ast) {
    for (Item item: ast.getItems()) {
      visitItem(item);
    }
  }

  public void visitItem(Item item) {
    walkItem(item);
  }

  public void visitStmt(Stmt stmt) {
    walkStmt(stmt);
  }

  public void visitExpr(Expr expr) {
    walkExpr(expr);
  }

  protected void walkItem(Item item) {
    switch (item.kind()) {
      case MODULE_DEF: {
        ModuleDef def = (ModuleDef) item;
        walkParams(def.getParams());
        for (Item child: def.getBody()) {
          visitItem(child);
        }
        break;
      }
      case FUNCTION_DEF: {
        FunctionDef def = (FunctionDef) item;
        walkParams(def.getParams());
        visitExpr(def.getBody());
        break;
      }
      case VAR_DECL:
        visitExpr(((VarDecl) item).getValue());
        break;
      case STATEMENT:
        visitStmt(((Statement) item).getStmt());
        break;
      default:
        throw new ScadRuntimeError("Unexpected item kind " + item.kind());
    }
  }

  protected void walkStmt(Stmt stmt) {
    switch (stmt.kind()) {
      case TRANSFORM_CHAIN: {
        TransformChain chain = (TransformChain) stmt;
        walkArgs(chain.getArgs());
        visitStmt(chain.getTail());
        break;
      }
      case UNION_BLOCK:
        for (Item item: ((UnionBlock) stmt).getItems()) {
          visitItem(item);
        }
        break;
      case FOR:
      case INTERSECTION_FOR:
      case LET:
      case ASSIGN: {
        BindingBlock block = (BindingBlock) stmt;
        walkBindings(block.getBindings());
        visitStmt(block.getBody());
        break;
      }
      case IF: {
        IfBlock ifBlock = (IfBlock) stmt;
        visitExpr(ifBlock.getCond());
        visitStmt(ifBlock.getThenBranch());
        if (ifBlock.hasElse()) {
          visitStmt(ifBlock.getElseBranch());
        }
        break;
      }
      case ASSERT: {
        AssertStmt assertStmt = (AssertStmt) stmt;
        walkArgs(assertStmt.getArgs());
        visitStmt(assertStmt.getBody());
        break;
      }
      case INCLUDE:
      case USE:
      case EMPTY:
        // Leaves
        break;
      default:
        throw new ScadRuntimeError("Unexpected statement kind " + stmt.kind());
    }
  }

  protected void walkExpr(Expr expr) {
    switch (expr.kind()) {
      case LITERAL:
      case IDENT:
      case SPECIAL_IDENT:
        // Leaves
        break;
      case CALL: {
        Call call = (Call) expr;
        visitExpr(call.getCallee());
        walkArgs(call.getArgs());
        break;
      }
      case INDEX: {
        Index index = (Index) expr;
        visitExpr(index.getBase());
        visitExpr(index.getIndex());
        break;
      }
      case DOT_INDEX:
        visitExpr(((DotIndex) expr).getBase());
        break;
      case UNARY:
        visitExpr(((Unary) expr).getOperand());
        break;
      case BINARY: {
        Binary binary = (Binary) expr;
        visitExpr(binary.getLeft());
        visitExpr(binary.getRight());
        break;
      }
      case TERNARY: {
        Ternary ternary = (Ternary) expr;
        visitExpr(ternary.getCond());
        visitExpr(ternary.getThen());
        visitExpr(ternary.getElse());
        break;
      }
      case PAREN:
        visitExpr(((Paren) expr).getInner());
        break;
      case LET: {
        LetExpr let = (LetExpr) expr;
        walkBindings(let.getBindings());
        visitExpr(let.getBody());
        break;
      }
      case ASSERT: {
        AssertExpr assertExpr = (AssertExpr) expr;
        walkArgs(assertExpr.getArgs());
        visitOptional(assertExpr.getBody());
        break;
      }
      case ECHO: {
        EchoExpr echo = (EchoExpr) expr;
        walkArgs(echo.getArgs());
        visitOptional(echo.getBody());
        break;
      }
      case LIST:
        for (Expr element: ((ListExpr) expr).getElements()) {
          visitExpr(element);
        }
        break;
      case RANGE: {
        Range range = (Range) expr;
        visitExpr(range.getStart());
        visitOptional(range.getStep());
        visitExpr(range.getEnd());
        break;
      }
      case FUNCTION_LIT: {
        FunctionLit fn = (FunctionLit) expr;
        walkParams(fn.getParams());
        visitExpr(fn.getBody());
        break;
      }
      case EACH:
        visitExpr(((Each) expr).getExpr());
        break;
      case LIST_COMP: {
        ListComp comp = (ListComp) expr;
        walkBindings(comp.getBinds());
        for (CompClause clause: comp.getClauses()) {
          if (clause instanceof CompClause.Condition) {
            visitExpr(((CompClause.Condition) clause).getCond());
          } else {
            walkBindings(((CompClause.Update) clause).getBindings());
          }
        }
        visitExpr(comp.getBody());
        break;
      }
      case LIST_COMP_IF: {
        ListCompIf compIf = (ListCompIf) expr;
        visitExpr(compIf.getCond());
        visitExpr(compIf.getThen());
        visitOptional(compIf.getElse());
        break;
      }
      default:
        throw new ScadRuntimeError("Unexpected expression kind " + expr.kind());
    }
  }

  protected void walkArgs(List<Arg> args) {
    for (Arg arg: args) {
      visitExpr(arg.getValue());
    }
  }

  protected void walkBindings(List<Binding> bindings) {
    for (Binding binding: bindings) {
      visitExpr(binding.getValue());
    }
  }

  protected void walkParams(List<Param> params) {
    for (Param param: params) {
      if (param.hasDefault()) {
        visitExpr(param.getDefaultValue());
      }
    }
  }

  private void visitOptional(Expr expr) {
    if (expr != null) {
      visitExpr(expr);
    }
  }
}

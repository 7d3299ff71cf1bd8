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
import java.util.Objects;

import com.google.common.collect.ImmutableList;

import exm.scad.ast.Operators.BinaryOp;
import exm.scad.ast.Operators.UnaryOp;
import exm.scad.common.exceptions.ScadRuntimeError;

/**
 * Expression nodes.  Each concrete class is tagged with an ExprKind so
 * that walkers can switch over kinds.
 */
public abstract class Expr extends Node {

  public static enum ExprKind {
    LITERAL, IDENT, SPECIAL_IDENT,
    CALL, INDEX, DOT_INDEX,
    UNARY, BINARY, TERNARY, PAREN,
    LET, ASSERT, ECHO,
    LIST, RANGE, FUNCTION_LIT,
    EACH, LIST_COMP, LIST_COMP_IF,
  }

  protected Expr(Span span) {
    super(span);
  }

  public abstract ExprKind kind();

  @Override
  public String toString() {
    return AstPrinter.printExpr(this);
  }

  public static class Literal extends Expr {
    public static enum LiteralKind {
      NUMBER, STRING, BOOL, UNDEF,
    }

    private final LiteralKind literalKind;
    private final double number;
    private final String string;
    private final boolean bool;

    private Literal(LiteralKind literalKind, double number, String string,
                    boolean bool, Span span) {
      super(span);
      this.literalKind = literalKind;
      this.number = number;
      this.string = string;
      this.bool = bool;
    }

    public static Literal number(double value, Span span) {
      return new Literal(LiteralKind.NUMBER, value, null, false, span);
    }

    public static Literal string(String value, Span span) {
      assert(value != null);
      return new Literal(LiteralKind.STRING, 0, value, false, span);
    }

    public static Literal bool(boolean value, Span span) {
      return new Literal(LiteralKind.BOOL, 0, null, value, span);
    }

    public static Literal undef(Span span) {
      return new Literal(LiteralKind.UNDEF, 0, null, false, span);
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LITERAL;
    }

    public LiteralKind getLiteralKind() {
      return literalKind;
    }

    public boolean isNumber() {
      return literalKind == LiteralKind.NUMBER;
    }

    public double getNumber() {
      if (literalKind == LiteralKind.NUMBER) {
        return number;
      } else {
        throw new ScadRuntimeError("getNumber for non-number literal");
      }
    }

    public String getString() {
      if (literalKind == LiteralKind.STRING) {
        return string;
      } else {
        throw new ScadRuntimeError("getString for non-string literal");
      }
    }

    public boolean getBool() {
      if (literalKind == LiteralKind.BOOL) {
        return bool;
      } else {
        throw new ScadRuntimeError("getBool for non-bool literal");
      }
    }

    @Override
    public int hashCode() {
      return Objects.hash(literalKind, number, string, bool);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof Literal))
        return false;
      Literal other = (Literal) obj;
      if (literalKind != other.literalKind)
        return false;
      switch (literalKind) {
        case NUMBER:
          return Double.compare(number, other.number) == 0;
        case STRING:
          return string.equals(other.string);
        case BOOL:
          return bool == other.bool;
        case UNDEF:
          return true;
        default:
          throw new ScadRuntimeError("Unknown literal kind " + literalKind);
      }
    }
  }

  /**
   * Plain identifier reference
   */
  public static class Ident extends Expr {
    private final Name name;

    public Ident(Name name) {
      super(name.getSpan());
      this.name = name;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.IDENT;
    }

    public Name getName() {
      return name;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), name);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Ident && name.equals(((Ident)obj).name);
    }
  }

  /**
   * Reference to a $-prefixed special variable
   */
  public static class SpecialIdent extends Expr {
    private final Name name;

    public SpecialIdent(Name name) {
      super(name.getSpan());
      assert(name.isSpecial());
      this.name = name;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.SPECIAL_IDENT;
    }

    public Name getName() {
      return name;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), name);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof SpecialIdent &&
             name.equals(((SpecialIdent)obj).name);
    }
  }

  public static class Call extends Expr {
    private final Expr callee;
    private final List<Arg> args;

    public Call(Expr callee, List<Arg> args, Span span) {
      super(span);
      this.callee = callee;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public ExprKind kind() {
      return ExprKind.CALL;
    }

    public Expr getCallee() {
      return callee;
    }

    public List<Arg> getArgs() {
      return args;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), callee, args);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Call))
        return false;
      Call other = (Call) obj;
      return callee.equals(other.callee) && args.equals(other.args);
    }
  }

  public static class Index extends Expr {
    private final Expr base;
    private final Expr index;

    public Index(Expr base, Expr index, Span span) {
      super(span);
      this.base = base;
      this.index = index;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.INDEX;
    }

    public Expr getBase() {
      return base;
    }

    public Expr getIndex() {
      return index;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), base, index);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Index))
        return false;
      Index other = (Index) obj;
      return base.equals(other.base) && index.equals(other.index);
    }
  }

  /**
   * Member access such as v.x
   */
  public static class DotIndex extends Expr {
    private final Expr base;
    private final Name field;

    public DotIndex(Expr base, Name field, Span span) {
      super(span);
      this.base = base;
      this.field = field;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.DOT_INDEX;
    }

    public Expr getBase() {
      return base;
    }

    public Name getField() {
      return field;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), base, field);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof DotIndex))
        return false;
      DotIndex other = (DotIndex) obj;
      return base.equals(other.base) && field.equals(other.field);
    }
  }

  public static class Unary extends Expr {
    private final UnaryOp op;
    private final Expr operand;

    public Unary(UnaryOp op, Expr operand, Span span) {
      super(span);
      this.op = op;
      this.operand = operand;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.UNARY;
    }

    public UnaryOp getOp() {
      return op;
    }

    public Expr getOperand() {
      return operand;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), op, operand);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Unary))
        return false;
      Unary other = (Unary) obj;
      return op == other.op && operand.equals(other.operand);
    }
  }

  public static class Binary extends Expr {
    private final BinaryOp op;
    private final Expr left;
    private final Expr right;

    public Binary(BinaryOp op, Expr left, Expr right, Span span) {
      super(span);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.BINARY;
    }

    public BinaryOp getOp() {
      return op;
    }

    public Expr getLeft() {
      return left;
    }

    public Expr getRight() {
      return right;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), op, left, right);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Binary))
        return false;
      Binary other = (Binary) obj;
      return op == other.op && left.equals(other.left) &&
             right.equals(other.right);
    }
  }

  public static class Ternary extends Expr {
    private final Expr cond;
    private final Expr thenExpr;
    private final Expr elseExpr;

    public Ternary(Expr cond, Expr thenExpr, Expr elseExpr, Span span) {
      super(span);
      this.cond = cond;
      this.thenExpr = thenExpr;
      this.elseExpr = elseExpr;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.TERNARY;
    }

    public Expr getCond() {
      return cond;
    }

    public Expr getThen() {
      return thenExpr;
    }

    public Expr getElse() {
      return elseExpr;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), cond, thenExpr, elseExpr);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Ternary))
        return false;
      Ternary other = (Ternary) obj;
      return cond.equals(other.cond) && thenExpr.equals(other.thenExpr) &&
             elseExpr.equals(other.elseExpr);
    }
  }

  /**
   * Parenthesized expression.  Kept in the tree so that printing
   * reproduces the grouping the author wrote.
   */
  public static class Paren extends Expr {
    private final Expr inner;

    public Paren(Expr inner, Span span) {
      super(span);
      this.inner = inner;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.PAREN;
    }

    public Expr getInner() {
      return inner;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), inner);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Paren && inner.equals(((Paren)obj).inner);
    }
  }

  /**
   * let (bindings) body.  Also used for let elements inside list
   * comprehensions.
   */
  public static class LetExpr extends Expr {
    private final List<Binding> bindings;
    private final Expr body;

    public LetExpr(List<Binding> bindings, Expr body, Span span) {
      super(span);
      this.bindings = ImmutableList.copyOf(bindings);
      this.body = body;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LET;
    }

    public List<Binding> getBindings() {
      return bindings;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), bindings, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof LetExpr))
        return false;
      LetExpr other = (LetExpr) obj;
      return bindings.equals(other.bindings) && body.equals(other.body);
    }
  }

  /**
   * assert(args) [body].  As with the statement form, the arguments are
   * kept as written alongside the resolved condition and message.
   */
  public static class AssertExpr extends Expr {
    private final List<Arg> args;
    private final Expr cond;
    private final Expr message;
    private final Expr body;

    /**
     * @param message may be null
     * @param body may be null
     */
    public AssertExpr(List<Arg> args, Expr cond, Expr message, Expr body,
                      Span span) {
      super(span);
      this.args = ImmutableList.copyOf(args);
      this.cond = cond;
      this.message = message;
      this.body = body;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ASSERT;
    }

    public List<Arg> getArgs() {
      return args;
    }

    public Expr getCond() {
      return cond;
    }

    public Expr getMessage() {
      return message;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), args, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof AssertExpr))
        return false;
      AssertExpr other = (AssertExpr) obj;
      return args.equals(other.args) && Objects.equals(body, other.body);
    }
  }

  public static class EchoExpr extends Expr {
    private final List<Arg> args;
    private final Expr body;

    /**
     * @param body may be null
     */
    public EchoExpr(List<Arg> args, Expr body, Span span) {
      super(span);
      this.args = ImmutableList.copyOf(args);
      this.body = body;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.ECHO;
    }

    public List<Arg> getArgs() {
      return args;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), args, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof EchoExpr))
        return false;
      EchoExpr other = (EchoExpr) obj;
      return args.equals(other.args) && Objects.equals(body, other.body);
    }
  }

  /**
   * [a, b, c].  Elements may be list comprehension elements.
   */
  public static class ListExpr extends Expr {
    private final List<Expr> elements;

    public ListExpr(List<Expr> elements, Span span) {
      super(span);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LIST;
    }

    public List<Expr> getElements() {
      return elements;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), elements);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ListExpr &&
             elements.equals(((ListExpr)obj).elements);
    }
  }

  /**
   * [start : end] or [start : step : end]
   */
  public static class Range extends Expr {
    private final Expr start;
    private final Expr step;
    private final Expr end;

    /**
     * @param step may be null
     */
    public Range(Expr start, Expr step, Expr end, Span span) {
      super(span);
      this.start = start;
      this.step = step;
      this.end = end;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.RANGE;
    }

    public Expr getStart() {
      return start;
    }

    public Expr getStep() {
      return step;
    }

    public Expr getEnd() {
      return end;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), start, step, end);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof Range))
        return false;
      Range other = (Range) obj;
      return start.equals(other.start) && Objects.equals(step, other.step) &&
             end.equals(other.end);
    }
  }

  /**
   * function (params) body
   */
  public static class FunctionLit extends Expr {
    private final List<Param> params;
    private final Expr body;

    public FunctionLit(List<Param> params, Expr body, Span span) {
      super(span);
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.FUNCTION_LIT;
    }

    public List<Param> getParams() {
      return params;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), params, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FunctionLit))
        return false;
      FunctionLit other = (FunctionLit) obj;
      return params.equals(other.params) && body.equals(other.body);
    }
  }

  public static class Each extends Expr {
    private final Expr expr;

    public Each(Expr expr, Span span) {
      super(span);
      this.expr = expr;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.EACH;
    }

    public Expr getExpr() {
      return expr;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), expr);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Each && expr.equals(((Each)obj).expr);
    }
  }

  /**
   * for generator inside a list: for (binds) body, or the C-style
   * for (binds; condition; updates) body, in which case the clauses hold
   * the condition followed by the updates.
   */
  public static class ListComp extends Expr {
    private final List<Binding> binds;
    private final List<CompClause> clauses;
    private final Expr body;

    public ListComp(List<Binding> binds, List<CompClause> clauses, Expr body,
                    Span span) {
      super(span);
      this.binds = ImmutableList.copyOf(binds);
      this.clauses = ImmutableList.copyOf(clauses);
      this.body = body;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LIST_COMP;
    }

    public List<Binding> getBinds() {
      return binds;
    }

    public List<CompClause> getClauses() {
      return clauses;
    }

    public boolean isCStyle() {
      return !clauses.isEmpty();
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), binds, clauses, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ListComp))
        return false;
      ListComp other = (ListComp) obj;
      return binds.equals(other.binds) && clauses.equals(other.clauses) &&
             body.equals(other.body);
    }
  }

  /**
   * if (cond) then [else other] inside a list comprehension.  Without an
   * else branch, elements failing the condition are dropped.
   */
  public static class ListCompIf extends Expr {
    private final Expr cond;
    private final Expr thenExpr;
    private final Expr elseExpr;

    /**
     * @param elseExpr may be null
     */
    public ListCompIf(Expr cond, Expr thenExpr, Expr elseExpr, Span span) {
      super(span);
      this.cond = cond;
      this.thenExpr = thenExpr;
      this.elseExpr = elseExpr;
    }

    @Override
    public ExprKind kind() {
      return ExprKind.LIST_COMP_IF;
    }

    public Expr getCond() {
      return cond;
    }

    public Expr getThen() {
      return thenExpr;
    }

    public Expr getElse() {
      return elseExpr;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), cond, thenExpr, elseExpr);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ListCompIf))
        return false;
      ListCompIf other = (ListCompIf) obj;
      return cond.equals(other.cond) && thenExpr.equals(other.thenExpr) &&
             Objects.equals(elseExpr, other.elseExpr);
    }
  }
}

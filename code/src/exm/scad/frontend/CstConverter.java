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

import java.util.ArrayList;
import java.util.List;

import exm.scad.ast.Arg;
import exm.scad.ast.Ast;
import exm.scad.ast.Binding;
import exm.scad.ast.CompClause;
import exm.scad.ast.Expr;
import exm.scad.ast.Expr.AssertExpr;
import exm.scad.ast.Expr.Binary;
import exm.scad.ast.Expr.Call;
import exm.scad.ast.Expr.DotIndex;
import exm.scad.ast.Expr.Each;
import exm.scad.ast.Expr.EchoExpr;
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
import exm.scad.ast.Item;
import exm.scad.ast.Item.FunctionDef;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.ast.Item.Statement;
import exm.scad.ast.Item.VarDecl;
import exm.scad.ast.Name;
import exm.scad.ast.Operators;
import exm.scad.ast.Operators.BinaryOp;
import exm.scad.ast.Operators.UnaryOp;
import exm.scad.ast.Param;
import exm.scad.ast.Span;
import exm.scad.ast.Stmt;
import exm.scad.ast.Stmt.AssertStmt;
import exm.scad.ast.Stmt.AssignBlock;
import exm.scad.ast.Stmt.Empty;
import exm.scad.ast.Stmt.ForBlock;
import exm.scad.ast.Stmt.IfBlock;
import exm.scad.ast.Stmt.Include;
import exm.scad.ast.Stmt.IntersectionForBlock;
import exm.scad.ast.Stmt.LetBlock;
import exm.scad.ast.Stmt.Modifier;
import exm.scad.ast.Stmt.TransformChain;
import exm.scad.ast.Stmt.UnionBlock;
import exm.scad.ast.Stmt.Use;
import exm.scad.common.exceptions.ParseException;
import exm.scad.common.exceptions.ScadRuntimeError;
import exm.scad.common.exceptions.SyntaxException;
import exm.scad.common.exceptions.UnsupportedNodeException;
import exm.scad.cst.CstNode;
import exm.scad.cst.CstTree;
import exm.scad.cst.SyntaxErrorCollector.Report;
import exm.scad.frontend.Declaration.DeclKind;
import exm.scad.frontend.Scope.ScopeKind;

/**
 * Converts a concrete parse tree into the AST, top down and in source
 * order, recording declarations in a fresh Context as it goes.
 *
 * Each CST kind maps to exactly one construction below.  A kind with no
 * mapping is reported as an UnsupportedNodeException.  One converter
 * instance handles one tree.
 */
class CstConverter {

  /* Parameter names of assert() */
  private static final String ASSERT_CONDITION = "condition";
  private static final String ASSERT_MESSAGE = "message";

  private final CstTree tree;
  private final Context context;

  /** Scope receiving new declarations */
  private Scope scope;

  /** Nesting depth, for trace output */
  private int depth = 0;

  CstConverter(CstTree tree) {
    this.tree = tree;
    this.context = new Context(wholeSource());
    this.scope = context.getRootScope();
  }

  private Span wholeSource() {
    return tree.getSource().span(0, tree.getSource().size());
  }

  Ast convert() throws ParseException {
    checkSyntax();

    CstNode root = tree.getRoot();
    checkKind(root, "source_file");
    List<Item> items = new ArrayList<Item>();
    for (CstNode child: root.namedChildren()) {
      items.add(item(child));
    }
    return new Ast(items, wholeSource(), context);
  }

  /**
   * Fail on the first error or missing node, searching depth first and
   * leftmost first
   */
  private void checkSyntax() throws SyntaxException {
    CstNode error = tree.findFirstError();
    if (error != null) {
      throw new SyntaxException(tree.describeError(error), error.span());
    }
    if (!tree.getReports().isEmpty()) {
      Report first = tree.getReports().get(0);
      throw new SyntaxException(first.message, tree.reportSpan(first));
    }
  }

  /* ---------------------------------------------------------------- */
  /* Items                                                              */
  /* ---------------------------------------------------------------- */

  private Item item(CstNode node) throws ParseException {
    checkKind(node, "item");
    CstNode inner = onlyNamedChild(node);
    LogHelper.traceNode(depth, inner);
    switch (inner.kind()) {
      case "var_declaration":
        return varDeclaration(inner);
      case "module_item":
        return moduleItem(inner);
      case "function_item":
        return functionItem(inner);
      case "statement":
        return new Statement(statement(inner));
      default:
        throw unsupported(inner);
    }
  }

  private VarDecl varDeclaration(CstNode node) throws ParseException {
    Binding b = binding(namedChild(node, 0));
    declareBinding(b, DeclKind.VARIABLE);
    return new VarDecl(b.getName(), b.getValue(), node.span());
  }

  private ModuleDef moduleItem(CstNode node) throws ParseException {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 3, 3);
    Name name = name(named.get(0));

    Scope outer = enterScope(ScopeKind.MODULE, node);
    List<Param> params = parameters(named.get(1));
    List<Item> body = new ArrayList<Item>();
    CstNode stmt = onlyNamedChild(named.get(2));
    if (stmt.kind().equals("union_block")) {
      // Braces of a module body do not open a second scope
      body.addAll(items(stmt));
    } else {
      body.add(new Statement(statement(named.get(2))));
    }
    exitScope(outer);

    ModuleDef def = new ModuleDef(name, params, body, node.span());
    context.defineModule(def);
    declare(name, DeclKind.MODULE);
    LogHelper.trace(depth, "module " + name.getId());
    return def;
  }

  private FunctionDef functionItem(CstNode node) throws ParseException {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 3, 3);
    Name name = name(named.get(0));

    Scope outer = enterScope(ScopeKind.FUNCTION, node);
    List<Param> params = parameters(named.get(1));
    Expr body = expr(named.get(2));
    exitScope(outer);

    FunctionDef def = new FunctionDef(name, params, body, node.span());
    context.defineFunction(def);
    declare(name, DeclKind.FUNCTION);
    LogHelper.trace(depth, "function " + name.getId());
    return def;
  }

  private List<Param> parameters(CstNode node) throws ParseException {
    checkKind(node, "parameters");
    List<Param> result = new ArrayList<Param>();
    for (CstNode p: node.namedChildren()) {
      checkKind(p, "parameter");
      List<CstNode> named = p.namedChildren();
      checkCount(p, named, 1, 2);
      Expr defaultValue = named.size() == 2 ? expr(named.get(1)) : null;
      Name name = name(named.get(0));
      declare(name, DeclKind.PARAMETER);
      result.add(new Param(name, defaultValue, p.span()));
    }
    return result;
  }

  private List<Item> items(CstNode unionBlock) throws ParseException {
    List<Item> result = new ArrayList<Item>();
    for (CstNode child: unionBlock.namedChildren()) {
      result.add(item(child));
    }
    return result;
  }

  /* ---------------------------------------------------------------- */
  /* Statements                                                         */
  /* ---------------------------------------------------------------- */

  private Stmt statement(CstNode node) throws ParseException {
    checkKind(node, "statement");
    CstNode inner = onlyNamedChild(node);
    depth += 2;
    LogHelper.traceNode(depth, inner);
    Stmt result;
    switch (inner.kind()) {
      case "empty_statement":
        result = new Empty(inner.span());
        break;
      case "union_block":
        result = unionBlock(inner);
        break;
      case "transform_chain":
        result = transformChain(inner);
        break;
      case "for_block":
        result = bindingBlock(inner, ScopeKind.FOR);
        break;
      case "intersection_for_block":
        result = bindingBlock(inner, ScopeKind.INTERSECTION_FOR);
        break;
      case "let_block":
        result = bindingBlock(inner, ScopeKind.LET);
        break;
      case "assign_block":
        result = bindingBlock(inner, ScopeKind.ASSIGN);
        break;
      case "if_block":
        result = ifBlock(inner);
        break;
      case "assert_statement":
        result = assertStatement(inner);
        break;
      case "include_statement":
        result = new Include(filePath(onlyNamedChild(inner)), inner.span());
        break;
      case "use_statement":
        result = new Use(filePath(onlyNamedChild(inner)), inner.span());
        break;
      default:
        throw unsupported(inner);
    }
    depth -= 2;
    return result;
  }

  private UnionBlock unionBlock(CstNode node) throws ParseException {
    Scope outer = enterScope(ScopeKind.BLOCK, node);
    List<Item> items = items(node);
    exitScope(outer);
    return new UnionBlock(items, node.span());
  }

  private TransformChain transformChain(CstNode node) throws ParseException {
    List<Modifier> modifiers = new ArrayList<Modifier>();
    CstNode call = null;
    CstNode tail = null;
    for (CstNode child: node.namedChildren()) {
      if (child.kind().equals("modifier")) {
        Modifier m = Modifier.fromSymbol(child.text());
        if (m == null) {
          throw unsupported(child);
        }
        modifiers.add(m);
      } else if (call == null) {
        checkKind(child, "module_call");
        call = child;
      } else {
        tail = child;
      }
    }
    if (call == null || tail == null) {
      throw new ScadRuntimeError("Malformed transform_chain at " +
                                 node.span());
    }

    List<CstNode> callParts = call.namedChildren();
    checkCount(call, callParts, 2, 2);
    CstNode moduleName = callParts.get(0);
    checkKind(moduleName, "module_name");
    Name name = new Name(moduleName.text(), moduleName.span());
    List<Arg> args = arguments(callParts.get(1));
    return new TransformChain(modifiers, name, args, statement(tail),
                              node.span());
  }

  private Stmt bindingBlock(CstNode node, ScopeKind kind)
                                            throws ParseException {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 1, 2);
    CstNode assignments = named.size() == 2 ? named.get(0) : null;
    CstNode body = named.get(named.size() - 1);

    Scope outer = enterScope(kind, node);
    DeclKind declKind = (kind == ScopeKind.FOR ||
                         kind == ScopeKind.INTERSECTION_FOR) ?
                            DeclKind.LOOP_VARIABLE : DeclKind.VARIABLE;
    List<Binding> bindings = bindings(assignments, declKind);
    Stmt bodyStmt = statement(body);
    exitScope(outer);

    switch (kind) {
      case FOR:
        return new ForBlock(bindings, bodyStmt, node.span());
      case INTERSECTION_FOR:
        return new IntersectionForBlock(bindings, bodyStmt, node.span());
      case LET:
        return new LetBlock(bindings, bodyStmt, node.span());
      case ASSIGN:
        return new AssignBlock(bindings, bodyStmt, node.span());
      default:
        throw new ScadRuntimeError("Not a binding block scope: " + kind);
    }
  }

  private IfBlock ifBlock(CstNode node) throws ParseException {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 2, 3);
    Expr cond = expr(named.get(0));
    Stmt thenBranch = statement(named.get(1));
    Stmt elseBranch = named.size() == 3 ? statement(named.get(2)) : null;
    return new IfBlock(cond, thenBranch, elseBranch, node.span());
  }

  private AssertStmt assertStatement(CstNode node) throws ParseException {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 2, 2);
    List<Arg> args = arguments(named.get(0));
    Expr[] condMsg = assertArgs(args, node);
    Stmt body = statement(named.get(1));
    return new AssertStmt(args, condMsg[0], condMsg[1], body, node.span());
  }

  /**
   * Resolve assert(condition, message) arguments by position or name.
   * A repeated name keeps its last value.
   * @return array holding condition and message, message possibly null
   */
  private Expr[] assertArgs(List<Arg> args, CstNode node)
                                              throws SyntaxException {
    Expr cond = null;
    Expr message = null;
    int position = 0;
    for (Arg arg: args) {
      if (arg.isNamed()) {
        String argName = arg.getName().getId();
        if (argName.equals(ASSERT_CONDITION)) {
          cond = arg.getValue();
        } else if (argName.equals(ASSERT_MESSAGE)) {
          message = arg.getValue();
        } else {
          throw new SyntaxException("assert() has no parameter named '" +
                                    argName + "'", arg.getSpan());
        }
      } else {
        if (position == 0) {
          cond = arg.getValue();
        } else if (position == 1) {
          message = arg.getValue();
        } else {
          throw new SyntaxException("assert() takes at most 2 arguments",
                                    arg.getSpan());
        }
        position++;
      }
    }
    if (cond == null) {
      throw new SyntaxException("assert() requires a condition",
                                node.span());
    }
    return new Expr[] {cond, message};
  }

  /**
   * @param token include or use token, e.g. include &lt;lib/gears.scad&gt;
   */
  private static String filePath(CstNode token) {
    String text = token.text();
    int open = text.indexOf('<');
    int close = text.lastIndexOf('>');
    if (open < 0 || close < open) {
      throw new ScadRuntimeError("Malformed file reference: " + text);
    }
    return text.substring(open + 1, close);
  }

  /* ---------------------------------------------------------------- */
  /* Arguments and bindings                                             */
  /* ---------------------------------------------------------------- */

  private List<Arg> arguments(CstNode node) throws ParseException {
    checkKind(node, "arguments");
    List<Arg> result = new ArrayList<Arg>();
    for (CstNode argument: node.namedChildren()) {
      checkKind(argument, "argument");
      CstNode inner = onlyNamedChild(argument);
      if (inner.kind().equals("named_argument")) {
        List<CstNode> named = inner.namedChildren();
        checkCount(inner, named, 2, 2);
        Name name = name(named.get(0));
        Expr value = expr(named.get(1));
        result.add(Arg.named(name, value, inner.span()));
      } else {
        result.add(Arg.positional(expr(inner)));
      }
    }
    return result;
  }

  /**
   * Convert one assignment.  The value is converted before anything is
   * declared, so it sees the enclosing bindings.
   */
  private Binding binding(CstNode node) throws ParseException {
    checkKind(node, "assignment");
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 2, 2);
    Expr value = expr(named.get(1));
    Name name = name(named.get(0));
    return new Binding(name, value, node.span());
  }

  /**
   * Convert and declare an assignments list in order.
   * @param node assignments node, or null when the list was empty
   */
  private List<Binding> bindings(CstNode node, DeclKind kind)
                                                  throws ParseException {
    List<Binding> result = new ArrayList<Binding>();
    if (node == null) {
      return result;
    }
    checkKind(node, "assignments");
    for (CstNode assignment: node.namedChildren()) {
      Binding b = binding(assignment);
      declareBinding(b, kind);
      result.add(b);
    }
    return result;
  }

  /**
   * Convert rebindings without declaring anything new
   */
  private List<Binding> updates(CstNode node) throws ParseException {
    List<Binding> result = new ArrayList<Binding>();
    if (node == null) {
      return result;
    }
    checkKind(node, "assignments");
    for (CstNode assignment: node.namedChildren()) {
      result.add(binding(assignment));
    }
    return result;
  }

  /* ---------------------------------------------------------------- */
  /* Expressions                                                        */
  /* ---------------------------------------------------------------- */

  private Expr expr(CstNode node) throws ParseException {
    List<CstNode> named = node.namedChildren();
    switch (node.kind()) {
      case "call_expression":
        checkCount(node, named, 2, 2);
        return new Call(expr(named.get(0)), arguments(named.get(1)),
                        node.span());
      case "index_expression":
        checkCount(node, named, 2, 2);
        return new Index(expr(named.get(0)), expr(named.get(1)),
                         node.span());
      case "dot_index_expression":
        checkCount(node, named, 2, 2);
        return new DotIndex(expr(named.get(0)), name(named.get(1)),
                            node.span());
      case "binary_expression":
        return binary(node, named);
      case "unary_expression":
        return unary(node, named);
      case "ternary_expression":
        checkCount(node, named, 3, 3);
        return new Ternary(expr(named.get(0)), expr(named.get(1)),
                           expr(named.get(2)), node.span());
      case "let_expression":
        return let(node, named);
      case "function_literal":
        return functionLiteral(node, named);
      case "assert_expression":
        return assertExpression(node, named);
      case "echo_expression": {
        checkCount(node, named, 1, 2);
        List<Arg> args = arguments(named.get(0));
        Expr body = named.size() == 2 ? expr(named.get(1)) : null;
        return new EchoExpr(args, body, node.span());
      }
      case "parenthesized_expression":
        checkCount(node, named, 1, 1);
        return new Paren(expr(named.get(0)), node.span());
      case "list": {
        List<Expr> elements = new ArrayList<Expr>();
        for (CstNode element: named) {
          elements.add(listElement(element));
        }
        return new ListExpr(elements, node.span());
      }
      case "range":
        checkCount(node, named, 2, 3);
        if (named.size() == 2) {
          return new Range(expr(named.get(0)), null, expr(named.get(1)),
                           node.span());
        } else {
          return new Range(expr(named.get(0)), expr(named.get(1)),
                           expr(named.get(2)), node.span());
        }
      case "identifier":
        return new Ident(new Name(node.text(), node.span()));
      case "special_variable":
        return new SpecialIdent(new Name(node.text(), node.span()));
      case "number":
        return number(node);
      case "string":
        return Literal.string(unescape(stripQuotes(node.text())),
                              node.span());
      case "boolean":
        return Literal.bool(node.text().equals("true"), node.span());
      case "undef":
        return Literal.undef(node.span());
      default:
        throw unsupported(node);
    }
  }

  private Expr binary(CstNode node, List<CstNode> named)
                                              throws ParseException {
    checkCount(node, named, 2, 2);
    String symbol = node.children().get(1).text();
    BinaryOp op = Operators.binaryOp(symbol);
    if (op == null) {
      throw new UnsupportedNodeException("binary operator " + symbol,
                                         node.children().get(1).span());
    }
    return new Binary(op, expr(named.get(0)), expr(named.get(1)),
                      node.span());
  }

  private Expr unary(CstNode node, List<CstNode> named)
                                              throws ParseException {
    checkCount(node, named, 1, 1);
    String symbol = node.children().get(0).text();
    UnaryOp op = Operators.unaryOp(symbol);
    if (op == null) {
      throw new UnsupportedNodeException("unary operator " + symbol,
                                         node.children().get(0).span());
    }
    return new Unary(op, expr(named.get(0)), node.span());
  }

  private Expr let(CstNode node, List<CstNode> named)
                                              throws ParseException {
    checkCount(node, named, 1, 2);
    CstNode assignments = named.size() == 2 ? named.get(0) : null;
    Scope outer = enterScope(ScopeKind.LET, node);
    List<Binding> bindings = bindings(assignments, DeclKind.VARIABLE);
    CstNode bodyNode = named.get(named.size() - 1);
    Expr body = bodyNode.kind().equals("list_element") ?
                  listElement(bodyNode) : expr(bodyNode);
    exitScope(outer);
    return new LetExpr(bindings, body, node.span());
  }

  private Expr functionLiteral(CstNode node, List<CstNode> named)
                                              throws ParseException {
    checkCount(node, named, 2, 2);
    Scope outer = enterScope(ScopeKind.FUNCTION, node);
    List<Param> params = parameters(named.get(0));
    Expr body = expr(named.get(1));
    exitScope(outer);
    return new FunctionLit(params, body, node.span());
  }

  private Expr assertExpression(CstNode node, List<CstNode> named)
                                              throws ParseException {
    checkCount(node, named, 1, 2);
    List<Arg> args = arguments(named.get(0));
    Expr[] condMsg = assertArgs(args, node);
    Expr body = named.size() == 2 ? expr(named.get(1)) : null;
    return new AssertExpr(args, condMsg[0], condMsg[1], body, node.span());
  }

  private Expr number(CstNode node) throws SyntaxException {
    try {
      return Literal.number(Double.parseDouble(node.text()), node.span());
    } catch (NumberFormatException e) {
      throw new SyntaxException("invalid number '" + node.text() + "'",
                                node.span());
    }
  }

  /* ---------------------------------------------------------------- */
  /* List comprehension elements                                        */
  /* ---------------------------------------------------------------- */

  private Expr listElement(CstNode node) throws ParseException {
    checkKind(node, "list_element");
    CstNode inner = onlyNamedChild(node);
    List<CstNode> named = inner.namedChildren();
    switch (inner.kind()) {
      case "for_comprehension":
        return forComprehension(inner, named);
      case "if_comprehension": {
        checkCount(inner, named, 2, 3);
        Expr cond = expr(named.get(0));
        Expr thenExpr = listElement(named.get(1));
        Expr elseExpr = named.size() == 3 ? listElement(named.get(2)) : null;
        return new ListCompIf(cond, thenExpr, elseExpr, inner.span());
      }
      case "let_comprehension":
        return let(inner, named);
      case "each":
        checkCount(inner, named, 1, 1);
        return new Each(listElement(named.get(0)), inner.span());
      default:
        return expr(inner);
    }
  }

  private Expr forComprehension(CstNode node, List<CstNode> named)
                                              throws ParseException {
    Scope outer = enterScope(ScopeKind.COMPREHENSION, node);
    List<Binding> binds;
    List<CompClause> clauses = new ArrayList<CompClause>();
    if (!named.isEmpty() && named.get(0).kind().equals("loop_init")) {
      // for (init; condition; update) element
      checkCount(node, named, 4, 4);
      binds = bindings(optionalChild(named.get(0)), DeclKind.LOOP_VARIABLE);
      clauses.add(new CompClause.Condition(expr(named.get(1))));
      CstNode update = named.get(2);
      checkKind(update, "loop_update");
      clauses.add(new CompClause.Update(updates(optionalChild(update)),
                                        update.span()));
    } else {
      checkCount(node, named, 1, 2);
      CstNode assignments = named.size() == 2 ? named.get(0) : null;
      binds = bindings(assignments, DeclKind.LOOP_VARIABLE);
    }
    Expr body = listElement(named.get(named.size() - 1));
    exitScope(outer);
    return new ListComp(binds, clauses, body, node.span());
  }

  /* ---------------------------------------------------------------- */
  /* Scopes and declarations                                            */
  /* ---------------------------------------------------------------- */

  /**
   * @return the scope to restore with exitScope
   */
  private Scope enterScope(ScopeKind kind, CstNode node) {
    Scope outer = scope;
    scope = context.pushScope(kind, outer, node.span());
    LogHelper.trace(depth, "enter scope " + scope.getId() + " " + kind);
    return outer;
  }

  private void exitScope(Scope outer) {
    LogHelper.trace(depth, "exit scope " + scope.getId());
    scope = outer;
  }

  private void declare(Name name, DeclKind kind) {
    scope.declare(new Declaration(name, kind, scope.getId()));
  }

  private void declareBinding(Binding b, DeclKind kind) {
    declare(b.getName(), kind);
    if (b.getName().isSpecial()) {
      context.getSpecials().assign(b.getName(), b.getValue(), b.getSpan(),
                                   scope.getId());
    }
  }

  /* ---------------------------------------------------------------- */
  /* Helpers                                                            */
  /* ---------------------------------------------------------------- */

  private static Name name(CstNode token) {
    return new Name(token.text(), token.span());
  }

  private static CstNode namedChild(CstNode node, int i) {
    List<CstNode> named = node.namedChildren();
    if (i >= named.size()) {
      throw new ScadRuntimeError(node.kind() + " at " + node.span() +
                                 " has no child " + i);
    }
    return named.get(i);
  }

  private static CstNode onlyNamedChild(CstNode node) {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 1, 1);
    return named.get(0);
  }

  /**
   * @return the single named child of a possibly empty wrapper, or null
   */
  private static CstNode optionalChild(CstNode node) {
    List<CstNode> named = node.namedChildren();
    checkCount(node, named, 0, 1);
    return named.isEmpty() ? null : named.get(0);
  }

  private static void checkCount(CstNode node, List<CstNode> named,
                                 int min, int max) {
    if (named.size() < min || named.size() > max) {
      throw new ScadRuntimeError(node.kind() + " at " + node.span() +
          ": expected " + min + ".." + max + " named children, but got " +
          named.size());
    }
  }

  private static void checkKind(CstNode node, String kind)
                                    throws UnsupportedNodeException {
    if (!node.kind().equals(kind)) {
      throw new UnsupportedNodeException(node.kind(), node.span());
    }
  }

  private static UnsupportedNodeException unsupported(CstNode node) {
    return new UnsupportedNodeException(node.kind(), node.span());
  }

  private static String stripQuotes(String text) {
    if (text.length() < 2 || text.charAt(0) != '"' ||
        text.charAt(text.length() - 1) != '"') {
      throw new ScadRuntimeError("Not a string literal: " + text);
    }
    return text.substring(1, text.length() - 1);
  }

  /**
   * Replace escape sequences in the body of a string literal.  An escape
   * that is not recognized is kept as written, backslash included.
   */
  static String unescape(String raw) {
    StringBuilder sb = new StringBuilder(raw.length());
    int i = 0;
    while (i < raw.length()) {
      char c = raw.charAt(i);
      if (c != '\\' || i + 1 >= raw.length()) {
        sb.append(c);
        i++;
        continue;
      }
      char next = raw.charAt(i + 1);
      switch (next) {
        case 'n':
          sb.append('\n');
          i += 2;
          break;
        case 't':
          sb.append('\t');
          i += 2;
          break;
        case 'r':
          sb.append('\r');
          i += 2;
          break;
        case '\\':
        case '"':
        case '\'':
          sb.append(next);
          i += 2;
          break;
        case 'x':
          i = hexEscape(raw, i, 2, 0x7F, sb);
          break;
        case 'u':
          i = hexEscape(raw, i, 4, Character.MAX_CODE_POINT, sb);
          break;
        case 'U':
          i = hexEscape(raw, i, 6, Character.MAX_CODE_POINT, sb);
          break;
        default:
          sb.append(c);
          i++;
          break;
      }
    }
    return sb.toString();
  }

  /**
   * Decode a fixed-width hex escape (x, u or U form) starting at the
   * backslash.
   * @return index just past what was consumed
   */
  private static int hexEscape(String raw, int start, int digits, int max,
                               StringBuilder sb) {
    int from = start + 2;
    int to = from + digits;
    if (to <= raw.length()) {
      String hex = raw.substring(from, to);
      if (isHex(hex)) {
        int cp = Integer.parseInt(hex, 16);
        if (cp > 0 && cp <= max &&
            !(cp >= Character.MIN_SURROGATE && cp <= Character.MAX_SURROGATE)) {
          sb.appendCodePoint(cp);
          return to;
        }
      }
    }
    // Not a valid escape: keep the backslash and carry on after it
    sb.append('\\');
    return start + 1;
  }

  private static boolean isHex(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (Character.digit(s.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.scad.ast.Arg;
import exm.scad.ast.Ast;
import exm.scad.ast.Expr;
import exm.scad.ast.Expr.Binary;
import exm.scad.ast.Expr.ExprKind;
import exm.scad.ast.Expr.ListComp;
import exm.scad.ast.Expr.ListExpr;
import exm.scad.ast.Expr.Literal;
import exm.scad.ast.Item;
import exm.scad.ast.Item.ItemKind;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.ast.Item.Statement;
import exm.scad.ast.Item.VarDecl;
import exm.scad.ast.Operators.BinaryOp;
import exm.scad.ast.Stmt;
import exm.scad.ast.Stmt.AssertStmt;
import exm.scad.ast.Stmt.Empty;
import exm.scad.ast.Stmt.IfBlock;
import exm.scad.ast.Stmt.Include;
import exm.scad.ast.Stmt.LetBlock;
import exm.scad.ast.Stmt.Modifier;
import exm.scad.ast.Stmt.StmtKind;
import exm.scad.ast.Stmt.TransformChain;
import exm.scad.ast.Stmt.UnionBlock;
import exm.scad.common.exceptions.ParseException;
import exm.scad.common.exceptions.SyntaxException;

public class ScadParserTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static Stmt onlyStmt(Ast ast) {
    assertEquals(1, ast.getItems().size());
    Item item = ast.getItems().get(0);
    assertEquals(ItemKind.STATEMENT, item.kind());
    return ((Statement) item).getStmt();
  }

  private static double number(Expr expr) {
    assertEquals(ExprKind.LITERAL, expr.kind());
    return ((Literal) expr).getNumber();
  }

  @Test
  public void testPrimitiveCall() throws ParseException {
    Ast ast = ScadParser.parse("cube(10);");
    TransformChain chain = (TransformChain) onlyStmt(ast);
    assertEquals("cube", chain.getName().getId());
    assertTrue(chain.getModifiers().isEmpty());
    assertEquals(1, chain.getArgs().size());

    Arg arg = chain.getArgs().get(0);
    assertFalse("Argument should be positional", arg.isNamed());
    assertEquals(10.0, number(arg.getValue()), 0.0);
    assertEquals(StmtKind.EMPTY, chain.getTail().kind());
    assertFalse(chain.hasChildren());
  }

  @Test
  public void testUnionBlockTail() throws ParseException {
    Ast ast = ScadParser.parse("union() { cube(10); sphere(5); }");
    TransformChain union = (TransformChain) onlyStmt(ast);
    assertEquals("union", union.getName().getId());
    assertTrue(union.getArgs().isEmpty());

    assertEquals(StmtKind.UNION_BLOCK, union.getTail().kind());
    UnionBlock block = (UnionBlock) union.getTail();
    assertEquals(2, block.getItems().size());
    TransformChain cube = (TransformChain)
                  ((Statement) block.getItems().get(0)).getStmt();
    TransformChain sphere = (TransformChain)
                  ((Statement) block.getItems().get(1)).getStmt();
    assertEquals("cube", cube.getName().getId());
    assertEquals("sphere", sphere.getName().getId());
    assertEquals(5.0, number(sphere.getArgs().get(0).getValue()), 0.0);
  }

  @Test
  public void testStatementTail() throws ParseException {
    Ast ast = ScadParser.parse("translate([1,2,3]) cube(1);");
    TransformChain translate = (TransformChain) onlyStmt(ast);
    assertEquals("translate", translate.getName().getId());

    Expr vector = translate.getArgs().get(0).getValue();
    assertEquals(ExprKind.LIST, vector.kind());
    assertEquals(3, ((ListExpr) vector).getElements().size());

    assertEquals(StmtKind.TRANSFORM_CHAIN, translate.getTail().kind());
    TransformChain cube = (TransformChain) translate.getTail();
    assertEquals("cube", cube.getName().getId());
    assertEquals(StmtKind.EMPTY, cube.getTail().kind());
  }

  @Test
  public void testEmptyLetParses() throws ParseException {
    Ast ast = ScadParser.parse("let () cube(1);");
    LetBlock let = (LetBlock) onlyStmt(ast);
    assertTrue(let.getBindings().isEmpty());
    assertEquals(StmtKind.TRANSFORM_CHAIN, let.getBody().kind());
  }

  @Test
  public void testUnclosedCallSpan() throws ParseException {
    try {
      ScadParser.parse("cube(");
      fail("Expected syntax error");
    } catch (SyntaxException e) {
      // Reported on the argument list that was left open
      assertEquals(4, e.getSpan().getStartByte());
      assertEquals(5, e.getSpan().getEndByte());
      assertEquals(0, e.getSpan().getStartRow());
      assertEquals(4, e.getSpan().getStartCol());
    }
  }

  @Test
  public void testUnclosedList() throws ParseException {
    exception.expect(SyntaxException.class);
    ScadParser.parse("x = [1,2,3;");
  }

  @Test
  public void testNumberAfterDot() throws ParseException {
    exception.expect(SyntaxException.class);
    ScadParser.parse("echo(object.1);");
  }

  @Test
  public void testStrayCharacter() throws ParseException {
    exception.expect(SyntaxException.class);
    ScadParser.parse("cube(1); @");
  }

  @Test
  public void testSyntaxErrorOnSecondLine() throws ParseException {
    try {
      ScadParser.parse("cube(1);\nsphere(2;\n");
      fail("Expected syntax error");
    } catch (SyntaxException e) {
      assertEquals(1, e.getSpan().getStartRow());
    }
  }

  @Test
  public void testEmptySource() throws ParseException {
    Ast ast = ScadParser.parse("");
    assertTrue(ast.getItems().isEmpty());
    assertEquals(0, ast.getSpan().getEndByte());
    assertEquals(1, ast.getContext().scopeCount());
  }

  @Test
  public void testCommentsIgnored() throws ParseException {
    Ast ast = ScadParser.parse("// lead\ncube(1); /* trailing\n block */");
    assertEquals(1, ast.getItems().size());
  }

  @Test
  public void testModifiers() throws ParseException {
    TransformChain chain = (TransformChain)
                            onlyStmt(ScadParser.parse("!#cube(1);"));
    assertEquals(Arrays.asList(Modifier.ROOT, Modifier.DEBUG),
                 chain.getModifiers());
  }

  @Test
  public void testNamedArguments() throws ParseException {
    TransformChain chain = (TransformChain)
        onlyStmt(ScadParser.parse("cylinder(h = 10, r1 = 2, $fn = 8);"));
    assertEquals(3, chain.getArgs().size());
    for (Arg arg: chain.getArgs()) {
      assertTrue(arg.isNamed());
    }
    assertEquals("$fn", chain.getArgs().get(2).getName().getId());
    assertTrue(chain.getArgs().get(2).getName().isSpecial());
  }

  @Test
  public void testOperatorPrecedence() throws ParseException {
    Ast ast = ScadParser.parse("x = 1 + 2 * 3;");
    VarDecl decl = (VarDecl) ast.getItems().get(0);
    Binary sum = (Binary) decl.getValue();
    assertEquals(BinaryOp.PLUS, sum.getOp());
    assertEquals(BinaryOp.MULT, ((Binary) sum.getRight()).getOp());
  }

  @Test
  public void testIfElse() throws ParseException {
    IfBlock ifBlock = (IfBlock)
        onlyStmt(ScadParser.parse("if (a > 1) cube(1); else sphere(1);"));
    assertTrue(ifBlock.hasElse());
    assertEquals(StmtKind.TRANSFORM_CHAIN, ifBlock.getElseBranch().kind());
  }

  @Test
  public void testIncludePath() throws ParseException {
    Include include = (Include)
        onlyStmt(ScadParser.parse("include <lib/gears.scad>"));
    assertEquals("lib/gears.scad", include.getPath());
  }

  @Test
  public void testStringEscapes() throws ParseException {
    VarDecl decl = (VarDecl)
        ScadParser.parse("s = \"a\\tb\\\"c\";").getItems().get(0);
    assertEquals("a\tb\"c", ((Literal) decl.getValue()).getString());
  }

  @Test
  public void testModuleBodyFlattened() throws ParseException {
    Ast ast = ScadParser.parse("module m(s = 1) { cube(s); sphere(s); }");
    ModuleDef def = (ModuleDef) ast.getItems().get(0);
    assertEquals(2, def.getBody().size());
    assertEquals(1, def.getParams().size());
    assertTrue(def.getParams().get(0).hasDefault());
  }

  @Test
  public void testCStyleComprehension() throws ParseException {
    VarDecl decl = (VarDecl) ScadParser.parse(
            "v = [for (i = 0; i < 3; i = i + 1) i];").getItems().get(0);
    ListComp comp = (ListComp)
                ((ListExpr) decl.getValue()).getElements().get(0);
    assertTrue(comp.isCStyle());
    assertEquals(1, comp.getBinds().size());
    assertEquals(2, comp.getClauses().size());
  }

  @Test
  public void testAssertPositional() throws ParseException {
    AssertStmt a = (AssertStmt)
        onlyStmt(ScadParser.parse("assert(x > 0, \"positive\");"));
    assertEquals(ExprKind.BINARY, a.getCond().kind());
    assertEquals("positive", ((Literal) a.getMessage()).getString());
    assertTrue(a.getBody() instanceof Empty);
  }

  @Test
  public void testAssertNamed() throws ParseException {
    AssertStmt a = (AssertStmt) onlyStmt(ScadParser.parse(
                     "assert(message = \"m\", condition = true) cube(1);"));
    assertTrue(((Literal) a.getCond()).getBool());
    assertEquals("m", ((Literal) a.getMessage()).getString());
    assertEquals(StmtKind.TRANSFORM_CHAIN, a.getBody().kind());
  }

  @Test
  public void testAssertWithoutMessage() throws ParseException {
    AssertStmt a = (AssertStmt) onlyStmt(ScadParser.parse("assert(true);"));
    assertNull(a.getMessage());
  }

  @Test
  public void testAssertUnknownParameter() throws ParseException {
    exception.expect(SyntaxException.class);
    ScadParser.parse("assert(true, level = 2);");
  }

  @Test
  public void testAssertTooManyArguments() throws ParseException {
    exception.expect(SyntaxException.class);
    ScadParser.parse("assert(true, \"m\", 3);");
  }

  @Test
  public void testAssertNoCondition() throws ParseException {
    exception.expect(SyntaxException.class);
    ScadParser.parse("assert();");
  }

  @Test
  public void testParseIsDeterministic() throws ParseException {
    String source = "module m() { cube(1); }\nm();\n";
    assertEquals(ScadParser.parse(source), ScadParser.parse(source));
  }
}

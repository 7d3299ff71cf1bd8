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

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import exm.scad.common.exceptions.ParseException;
import exm.scad.frontend.ScadParser;

public class AstPrinterTest {

  /**
   * Programs that exercise every statement and expression form
   */
  private static final String[] PROGRAMS = {
    "cube(10);",
    "union() { cube(10); sphere(5); }",
    "translate([1,2,3]) cube(1);",
    "let () cube(1);",
    "multmatrix([[1,0],[0,1]]) cube(1);",
    "!#%*cube(1);",
    "module m() ;",
    "module m() {}",
    "module m(a, b = 2) cube(a + b);",
    "module outer() { module inner() { children(); } inner() sphere(1); }",
    "function f(x) = x > 0 ? f(x - 1) : 0;",
    "$fn = 12; r = 3; sphere(r, $fa = 6);",
    "for (i = [0 : 2 : 10], j = [1, 2]) translate([i, j, 0]) cube(1);",
    "intersection_for (a = [0, 90]) rotate(a) cube(2, center = true);",
    "if (a) cube(1); else if (b) sphere(1); else { cylinder(); }",
    "if (a) if (b) cube(1); else sphere(1);",
    "assign (x = 1, y = 2) cube([x, y, 1]);",
    "assert(x > 0);",
    "assert(condition = x, message = \"m\") cube(1);",
    "include <lib/a.scad>\nuse <b.scad>",
    "v = [for (i = [0 : 3]) if (i % 2 == 0) i * i else -i];",
    "v = [for (i = 0; i < 4; ) i];",
    "v = [for (i = 0, j = 0; i < 4; i = i + 1, j = j - 1) [i, j]];",
    "v = [let (a = 1) each [a, a], 3];",
    "x = let (a = 1, b = a) a * b;",
    "x = assert(y) echo(\"y\", y) y;",
    "x = echo(1);",
    "f = function (a, b = 2) a + b; y = f(1);",
    "x = -(1 + 2) * !true / +3 % 4 ^ 2 ^ 3;",
    "x = a < b && b <= c || c > d && d >= e || a == b && a != c;",
    "x = v[0][1].x + 1 .y + [1, 2].z;",
    "x = \"tab\\tquote\\\"slash\\\\nl\\n\";",
    "x = [1.5, 0.25, 1e-7, 1e300, 123456789012, 0.1, undef, false];",
    "x = [];",
    "x = [1 : 5];",
    ";",
    "{ }",
    "{ a = 1; { b = 2; } }",
    "echo(\"hello\");",
  };

  private static void assertRoundTrip(String source) throws ParseException {
    Ast first = ScadParser.parse(source);
    String printed = AstPrinter.print(first);
    Ast second = ScadParser.parse(printed);
    assertEquals("Round trip of:\n" + source + "\nprinted as:\n" + printed,
                 first, second);
    // Printing is a fixed point after one pass
    assertEquals(printed, AstPrinter.print(second));
  }

  @Test
  public void testRoundTrip() throws ParseException {
    for (String program: PROGRAMS) {
      assertRoundTrip(program);
    }
  }

  @Test
  public void testSimpleLayout() throws ParseException {
    assertEquals("cube(10);\n",
                 AstPrinter.print(ScadParser.parse("cube( 10 ) ;")));
    assertEquals("translate([1, 2, 3]) cube(1);\n",
                 AstPrinter.print(ScadParser.parse("translate([1,2,3])cube(1);")));
    assertEquals("x = a ? b : c;\n",
                 AstPrinter.print(ScadParser.parse("x=a?b:c;")));
  }

  @Test
  public void testBlockLayout() throws ParseException {
    String expected = "module m(s = 1) {\n" +
                      "  union() {\n" +
                      "    cube(s);\n" +
                      "    sphere(s);\n" +
                      "  }\n" +
                      "}\n";
    String source = "module m(s=1){union(){cube(s);sphere(s);}}";
    assertEquals(expected, AstPrinter.print(ScadParser.parse(source)));
  }

  @Test
  public void testComprehensionLayout() throws ParseException {
    assertEquals("v = [for (i = 0; i < 4;) i];\n",
        AstPrinter.print(ScadParser.parse("v=[for(i=0;i<4;)i];")));
    assertEquals("v = [for (i = 0; i < 4; i = i + 1) i];\n",
        AstPrinter.print(ScadParser.parse("v=[for(i=0;i<4;i=i+1)i];")));
  }

  @Test
  public void testFormatNumber() {
    assertEquals("10", AstPrinter.formatNumber(10.0));
    assertEquals("-3", AstPrinter.formatNumber(-3.0));
    assertEquals("0.5", AstPrinter.formatNumber(0.5));
    assertEquals("1.0E15", AstPrinter.formatNumber(1e15));
    assertEquals("1.0E-7", AstPrinter.formatNumber(1e-7));
    assertEquals("1e1000", AstPrinter.formatNumber(Double.POSITIVE_INFINITY));
  }

  @Test
  public void testEscape() {
    assertEquals("a\\\"b\\\\c\\n", AstPrinter.escape("a\"b\\c\n"));
  }

  @Test
  public void testNodeToString() throws ParseException {
    Ast ast = ScadParser.parse("x = 1 + 2; cube(x);");
    assertEquals("x = 1 + 2;", ast.getItems().get(0).toString());
    Item.VarDecl decl = (Item.VarDecl) ast.getItems().get(0);
    assertEquals("1 + 2", decl.getValue().toString());
    Item.Statement stmt = (Item.Statement) ast.getItems().get(1);
    assertEquals("cube(x);", stmt.getStmt().toString());
  }
}

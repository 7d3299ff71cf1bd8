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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.fail;

import org.junit.Test;

import exm.scad.ast.Ast;
import exm.scad.ast.Span;
import exm.scad.common.exceptions.ParseException;
import exm.scad.common.exceptions.SemanticErrorKind;
import exm.scad.common.exceptions.SemanticException;
import exm.scad.common.exceptions.SyntaxException;

public class StrictValidatorTest {

  /**
   * Run strict parsing, expecting a semantic error
   */
  private static SemanticException violation(String source)
                                                throws ParseException {
    try {
      ScadParser.parseStrict(source);
    } catch (SemanticException e) {
      return e;
    }
    fail("Expected a semantic error for: " + source);
    return null;
  }

  private static void assertKind(SemanticErrorKind expected, String source)
                                                throws ParseException {
    assertEquals(source, expected, violation(source).getKind());
  }

  private static void assertValid(String source) throws ParseException {
    assertNotNull(ScadParser.parseStrict(source));
  }

  @Test
  public void testEmptyLetBlock() throws ParseException {
    SemanticException e = violation("let () cube(1);");
    assertEquals(SemanticErrorKind.EMPTY_BINDING, e.getKind());
    assertEquals(0, e.getSpan().getStartByte());
    assertEquals("let () cube(1);".length(), e.getSpan().getEndByte());
  }

  @Test
  public void testEmptyBindingConstructs() throws ParseException {
    assertKind(SemanticErrorKind.EMPTY_BINDING, "for () cube(1);");
    assertKind(SemanticErrorKind.EMPTY_BINDING,
               "intersection_for () cube(1);");
    assertKind(SemanticErrorKind.EMPTY_BINDING, "assign () cube(1);");
    assertKind(SemanticErrorKind.EMPTY_BINDING, "x = let () 1;");
    assertKind(SemanticErrorKind.EMPTY_BINDING, "v = [for () 1];");
  }

  @Test
  public void testCStyleEmptyInitAccepted() throws ParseException {
    assertValid("v = [for (; false; ) 1];");
    assertValid("v = [for (; i < 3; ) i];");
    assertValid("v = [for (i = 0; i < 3; i = i + 1) i];");
  }

  @Test
  public void testNonEmptyBindingsAccepted() throws ParseException {
    assertValid("let (a = 1) cube(a);");
    assertValid("for (i = [0 : 3]) translate([i, 0, 0]) cube(1);");
    assertValid("v = [for (i = [0 : 3]) if (i % 2 == 0) i];");
  }

  @Test
  public void testValidateConvertedTree() throws ParseException {
    Ast ast = ScadParser.parse("let () cube(1);");
    try {
      StrictValidator.validate(ast);
      fail("Expected a semantic error");
    } catch (SemanticException e) {
      assertEquals(SemanticErrorKind.EMPTY_BINDING, e.getKind());
    }
    StrictValidator.validate(ScadParser.parse("let (a = 1) cube(a);"));
  }

  @Test
  public void testMatrixMissing() throws ParseException {
    String source = "multmatrix() cube(1);";
    SemanticException e = violation(source);
    assertEquals(SemanticErrorKind.INVALID_MATRIX_SHAPE, e.getKind());
    assertEquals(0, e.getSpan().getStartByte());
    assertKind(SemanticErrorKind.INVALID_MATRIX_SHAPE,
               "multmatrix(v = [[1,0,0,0],[0,1,0,0],[0,0,1,0]]) cube(1);");
    assertKind(SemanticErrorKind.INVALID_MATRIX_SHAPE,
               "translate([1, 0, 0]) multmatrix();");
  }

  @Test
  public void testMatrixTooFewRows() throws ParseException {
    String source = "multmatrix([[1,0],[0,1]]) cube(1);";
    SemanticException e = violation(source);
    assertEquals(SemanticErrorKind.INVALID_MATRIX_SHAPE, e.getKind());
    Span span = e.getSpan();
    assertEquals(source.indexOf("[["), span.getStartByte());
    assertEquals(source.indexOf("]]") + 2, span.getEndByte());
  }

  @Test
  public void testMatrixShortRow() throws ParseException {
    String source = "multmatrix([[1,0,0,0],[0,1,0],[0,0,1,0]]) cube(1);";
    SemanticException e = violation(source);
    assertEquals(SemanticErrorKind.INVALID_MATRIX_SHAPE, e.getKind());
    assertEquals(source.indexOf("[0,1,0]"), e.getSpan().getStartByte());
  }

  @Test
  public void testMatrixFiveRows() throws ParseException {
    assertKind(SemanticErrorKind.INVALID_MATRIX_SHAPE,
        "multmatrix([[1,0,0,0],[0,1,0,0],[0,0,1,0],[0,0,0,1],[0,0,0,1]])" +
        " cube(1);");
  }

  @Test
  public void testMatrixNamedArgument() throws ParseException {
    assertKind(SemanticErrorKind.INVALID_MATRIX_SHAPE,
               "multmatrix(m = [[1,0,0]]) cube(1);");
  }

  @Test
  public void testValidMatrices() throws ParseException {
    assertValid("multmatrix([[1,0,0,0],[0,1,0,0],[0,0,1,0],[0,0,0,1]])" +
                " cube(1);");
    assertValid("multmatrix([[1,0,0,10],[0,1,0,20],[0,0,1,30]]) cube(1);");
  }

  @Test
  public void testComputedMatrixAccepted() throws ParseException {
    assertValid("multmatrix(rot) cube(1);");
    assertValid("multmatrix([r0, r1, r2]) cube(1);");
    assertValid("multmatrix([for (i = [0 : 3]) [0, 0, 0, 1]]) cube(1);");
  }

  @Test
  public void testOtherModulesNotShapeChecked() throws ParseException {
    assertValid("translate([[1,0],[0,1]]) cube(1);");
  }

  @Test
  public void testDuplicateNamedArgs() throws ParseException {
    String source = "cylinder(h = 1, r = 2, h = 3);";
    SemanticException e = violation(source);
    assertEquals(SemanticErrorKind.DUPLICATE_NAMED_ARG, e.getKind());
    assertEquals(source.lastIndexOf("h = 3"), e.getSpan().getStartByte());
  }

  @Test
  public void testDuplicateNamedArgsInExpressions() throws ParseException {
    assertKind(SemanticErrorKind.DUPLICATE_NAMED_ARG, "x = f(a = 1, a = 2);");
    assertKind(SemanticErrorKind.DUPLICATE_NAMED_ARG,
               "x = echo(v = 1, v = 2) 3;");
    assertKind(SemanticErrorKind.DUPLICATE_NAMED_ARG,
               "assert(condition = true, condition = false);");
    assertKind(SemanticErrorKind.DUPLICATE_NAMED_ARG,
               "x = assert(condition = true, condition = true) 1;");
  }

  @Test
  public void testSameNameInDifferentCalls() throws ParseException {
    assertValid("cube(size = 1); sphere(r = 1, $fn = 8); cube(size = 2);");
  }

  @Test
  public void testFirstViolationWins() throws ParseException {
    assertKind(SemanticErrorKind.EMPTY_BINDING,
               "let () cube(1);\nmultmatrix([[1]]) cube(1);");
    assertKind(SemanticErrorKind.INVALID_MATRIX_SHAPE,
               "multmatrix([[1]]) cube(1);\nlet () cube(1);");
  }

  @Test
  public void testOuterBeforeInner() throws ParseException {
    // The call's own arguments are checked before anything inside it
    assertKind(SemanticErrorKind.DUPLICATE_NAMED_ARG,
               "translate(v = [1,2,3], v = [0,0,0]) let () cube(1);");
    assertKind(SemanticErrorKind.EMPTY_BINDING,
               "let () translate(v = 1, v = 2) cube(1);");
  }

  @Test
  public void testSyntaxBeforeSemantics() throws ParseException {
    try {
      ScadParser.parseStrict("let () cube(");
      fail("Expected syntax error");
    } catch (SemanticException e) {
      fail("Syntax errors should be reported before strict checks");
    } catch (SyntaxException e) {
      // expected
    }
  }
}

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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.scad.ast.Expr.ExprKind;
import exm.scad.ast.Expr.Ident;
import exm.scad.common.exceptions.ParseException;
import exm.scad.frontend.ScadParser;

public class AstVisitorTest {

  /**
   * Records identifiers in the order they are reached
   */
  private static class IdentCollector extends AstVisitor {
    final List<String> names = new ArrayList<String>();

    @Override
    public void visitExpr(Expr expr) {
      if (expr.kind() == ExprKind.IDENT) {
        names.add(((Ident) expr).getName().getId());
      }
      super.visitExpr(expr);
    }
  }

  private static List<String> identsOf(String source) throws ParseException {
    IdentCollector collector = new IdentCollector();
    collector.walk(ScadParser.parse(source));
    return collector.names;
  }

  @Test
  public void testSourceOrder() throws ParseException {
    assertEquals(Arrays.asList("a", "b", "c", "d", "e", "f"),
        identsOf("x = a + b * c;\ntranslate(d) rotate(e) cube(f);"));
  }

  @Test
  public void testDefinitionsVisited() throws ParseException {
    assertEquals(Arrays.asList("a", "b", "c", "d", "e"),
        identsOf("module m(p = a) { cube(b); }\n" +
                 "function f(q = c) = d;\n" +
                 "g = function (r = e) 1;"));
  }

  @Test
  public void testComprehensionOrder() throws ParseException {
    // Bindings, then condition and updates, then the element
    assertEquals(Arrays.asList("a", "b", "c", "d", "e"),
        identsOf("v = [for (i = a; b; i = c) if (d) e];"));
  }

  @Test
  public void testOptionalChildren() throws ParseException {
    assertEquals(Arrays.asList("a", "b", "c", "d", "e", "f", "g"),
        identsOf("x = [a : b];\ny = [c : d : e];\n" +
                 "if (f) cube(1); else cube(g);\nz = echo(1);"));
  }

  @Test
  public void testAssertArgsInOrder() throws ParseException {
    assertEquals(Arrays.asList("m", "c", "b"),
        identsOf("assert(message = m, condition = c) cube(b);"));
  }

  @Test
  public void testSkippingSubtree() throws ParseException {
    // Overriding a hook without calling super prunes the walk
    final List<String> seen = new ArrayList<String>();
    AstVisitor visitor = new AstVisitor() {
      @Override
      public void visitStmt(Stmt stmt) {
        if (stmt.kind() == Stmt.StmtKind.UNION_BLOCK) {
          return;
        }
        super.visitStmt(stmt);
      }

      @Override
      public void visitExpr(Expr expr) {
        seen.add(expr.toString());
        super.visitExpr(expr);
      }
    };
    visitor.walk(ScadParser.parse("union(a) { cube(b); }\nsphere(c);"));
    assertEquals(Arrays.asList("a", "c"), seen);
  }
}

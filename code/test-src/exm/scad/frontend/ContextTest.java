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
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.scad.ast.Ast;
import exm.scad.ast.Expr.Literal;
import exm.scad.ast.Item;
import exm.scad.ast.Item.FunctionDef;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.common.exceptions.ParseException;
import exm.scad.common.exceptions.ScadRuntimeError;
import exm.scad.frontend.Declaration.DeclKind;
import exm.scad.frontend.Scope.ScopeKind;

public class ContextTest {

  @Test
  public void testModuleRegistrySpan() throws ParseException {
    Ast ast = ScadParser.parse("module box(s) { cube(s); }\nbox(2);");
    Context context = ast.getContext();
    ModuleDef def = (ModuleDef) ast.getItems().get(0);

    ModuleDef registered = context.getModule("box");
    assertNotNull(registered);
    assertEquals(def.getSpan(), registered.getSpan());
    assertEquals(0, registered.getSpan().getStartByte());
    assertEquals("module box(s) { cube(s); }".length(),
                 registered.getSpan().getEndByte());
  }

  @Test
  public void testFunctionRegistrySpan() throws ParseException {
    Ast ast = ScadParser.parse("x = 1;\nfunction sq(v) = v * v;");
    FunctionDef def = (FunctionDef) ast.getItems().get(1);
    FunctionDef registered = ast.getContext().getFunction("sq");
    assertEquals(def.getSpan(), registered.getSpan());
    assertEquals(1, registered.getSpan().getStartRow());
  }

  @Test
  public void testLastDefinitionWins() throws ParseException {
    String source = "module m() cube(1);\n" +
                    "function f() = 1;\n" +
                    "module m() sphere(1);\n" +
                    "function f() = 2;\n";
    Ast ast = ScadParser.parse(source);
    Context context = ast.getContext();

    assertEquals(1, context.getModules().size());
    assertEquals(1, context.getFunctions().size());
    assertEquals(ast.getItems().get(2).getSpan(),
                 context.getModule("m").getSpan());
    assertEquals(ast.getItems().get(3).getSpan(),
                 context.getFunction("f").getSpan());
    assertEquals(2.0, ((Literal) context.getFunction("f").getBody())
                                                    .getNumber(), 0.0);
  }

  @Test
  public void testEveryDefinitionRegistered() throws ParseException {
    String source = "module a() {}\nmodule b() { module inner() {} }\n" +
                    "function c() = 1;\nfunction d(x) = c() + x;\n";
    Ast ast = ScadParser.parse(source);
    Context context = ast.getContext();
    assertEquals(Arrays.asList("a", "inner", "b"),
                 new ArrayList<String>(context.getModules().keySet()));
    assertEquals(Arrays.asList("c", "d"),
                 new ArrayList<String>(context.getFunctions().keySet()));
    for (Item item: ast.getItems()) {
      if (item instanceof ModuleDef) {
        String name = ((ModuleDef) item).getName().getId();
        assertEquals(item.getSpan(), context.getModule(name).getSpan());
      }
    }
  }

  @Test
  public void testSpecialVariables() throws ParseException {
    Ast ast = ScadParser.parse("$fn = 32;\na = 1;");
    SpecialVariables specials = ast.getContext().getSpecials();
    assertEquals(1, specials.size());
    assertTrue(specials.contains("$fn"));
    assertFalse(specials.contains("a"));

    SpecialVariables.Entry entry = specials.get("$fn");
    assertEquals(32.0, ((Literal) entry.getValue()).getNumber(), 0.0);
    assertEquals(Context.ROOT_SCOPE_ID, entry.getScopeId());
    assertEquals(0, entry.getSpan().getStartByte());
  }

  @Test
  public void testSpecialReassignedKeepsLast() throws ParseException {
    Ast ast = ScadParser.parse("$fn = 8;\n$fa = 12;\n$fn = 64;");
    SpecialVariables specials = ast.getContext().getSpecials();
    assertEquals(2, specials.size());
    assertEquals(64.0,
          ((Literal) specials.get("$fn").getValue()).getNumber(), 0.0);
    assertEquals(Arrays.asList("$fa", "$fn"),
                 new ArrayList<String>(specials.getEntries().keySet()));
  }

  @Test
  public void testNestedSpecialRecorded() throws ParseException {
    Ast ast = ScadParser.parse("let ($fn = 16) sphere(1);");
    SpecialVariables.Entry entry =
                          ast.getContext().getSpecials().get("$fn");
    assertNotNull(entry);
    Scope scope = ast.getContext().getScope(entry.getScopeId());
    assertEquals(ScopeKind.LET, scope.getKind());
  }

  @Test
  public void testKnownSpecials() {
    assertTrue(SpecialVariables.isKnown("$fn"));
    assertTrue(SpecialVariables.isKnown("$children"));
    assertFalse(SpecialVariables.isKnown("$made_up"));
  }

  @Test
  public void testScopeTree() throws ParseException {
    Ast ast = ScadParser.parse(
        "module m(a) { b = a; for (i = [0 : 2]) { c = i; } }");
    Context context = ast.getContext();
    Scope root = context.getRootScope();
    assertTrue(root.isRoot());
    assertEquals(DeclKind.MODULE, root.lookup("m").getKind());

    List<Scope> scopes = context.getScopes();
    assertEquals(4, scopes.size());
    Scope module = scopes.get(1);
    Scope loop = scopes.get(2);
    Scope block = scopes.get(3);
    assertEquals(ScopeKind.MODULE, module.getKind());
    assertEquals(ScopeKind.FOR, loop.getKind());
    assertEquals(ScopeKind.BLOCK, block.getKind());
    assertSame(root, module.getParent());
    assertSame(module, loop.getParent());
    assertSame(loop, block.getParent());

    assertEquals(DeclKind.PARAMETER, module.lookupLocal("a").getKind());
    assertEquals(DeclKind.VARIABLE, module.lookupLocal("b").getKind());
    assertEquals(DeclKind.LOOP_VARIABLE, loop.lookupLocal("i").getKind());
    assertEquals(2, block.depthOf("a"));
    assertEquals(-1, block.depthOf("zzz"));
    assertNull(root.lookup("a"));
  }

  @Test
  public void testShadowing() throws ParseException {
    Ast ast = ScadParser.parse("x = 1; let (x = 2) cube(x);");
    Context context = ast.getContext();
    Scope let = context.getScope(1);
    Declaration inner = let.lookup("x");
    Declaration outer = context.getRootScope().lookup("x");
    assertEquals(1, inner.getScopeId());
    assertEquals(Context.ROOT_SCOPE_ID, outer.getScopeId());
    assertEquals(0, let.depthOf("x"));
    assertSame(inner, context.lookup(1, "x"));
  }

  @Test
  public void testScopeSpans() throws ParseException {
    String source = "cube(1);\nif (true) { let (a = 1) sphere(a); }";
    Ast ast = ScadParser.parse(source);
    Context context = ast.getContext();
    assertEquals(ast.getSpan(), context.getRootScope().getSpan());
    for (Scope scope: context.getScopes()) {
      if (!scope.isRoot()) {
        assertTrue(scope.getParent().getSpan().contains(scope.getSpan()));
      }
    }
  }

  @Test(expected=ScadRuntimeError.class)
  public void testBadScopeId() throws ParseException {
    ScadParser.parse("cube(1);").getContext().getScope(7);
  }

  @Test
  public void testComprehensionScope() throws ParseException {
    Ast ast = ScadParser.parse("v = [for (i = [0 : 3]) i * 2];");
    Context context = ast.getContext();
    assertEquals(2, context.scopeCount());
    Scope comp = context.getScope(1);
    assertEquals(ScopeKind.COMPREHENSION, comp.getKind());
    assertEquals(DeclKind.LOOP_VARIABLE, comp.lookupLocal("i").getKind());
    assertEquals(DeclKind.VARIABLE,
                 context.getRootScope().lookupLocal("v").getKind());
  }
}

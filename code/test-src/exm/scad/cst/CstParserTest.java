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
package exm.scad.cst;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class CstParserTest {

  private static CstNode only(List<CstNode> nodes) {
    assertEquals(1, nodes.size());
    return nodes.get(0);
  }

  @Test
  public void testKinds() {
    CstTree tree = CstParser.parse("cube(10);");
    assertNull(tree.findFirstError());
    assertTrue(tree.getReports().isEmpty());

    CstNode root = tree.getRoot();
    assertEquals("source_file", root.kind());
    CstNode item = only(root.namedChildren());
    assertEquals("item", item.kind());
    CstNode stmt = only(item.namedChildren());
    assertEquals("statement", stmt.kind());
    CstNode chain = only(stmt.namedChildren());
    assertEquals("transform_chain", chain.kind());

    List<CstNode> parts = chain.namedChildren();
    assertEquals(2, parts.size());
    assertEquals("module_call", parts.get(0).kind());
    assertEquals("statement", parts.get(1).kind());

    CstNode args = parts.get(0).namedChildren().get(1);
    assertEquals("arguments", args.kind());
    CstNode number = only(only(args.namedChildren()).namedChildren());
    assertEquals("number", number.kind());
    assertEquals("10", number.text());
  }

  @Test
  public void testAnonymousTokens() {
    CstTree tree = CstParser.parse("x = 1;");
    CstNode decl = only(only(tree.getRoot().namedChildren()).namedChildren());
    assertEquals("var_declaration", decl.kind());
    List<CstNode> children = decl.children();
    assertEquals(2, children.size());
    CstNode semi = children.get(1);
    assertEquals(";", semi.kind());
    assertTrue(semi.isToken());
    assertFalse(semi.isNamed());

    CstNode assignment = children.get(0);
    CstNode name = assignment.children().get(0);
    assertEquals("identifier", name.kind());
    assertTrue(name.isNamed());
    assertEquals("=", assignment.children().get(1).kind());
  }

  @Test
  public void testEofNotNamed() {
    CstNode root = CstParser.parse("").getRoot();
    assertTrue(root.namedChildren().isEmpty());
    assertEquals(1, root.children().size());
    assertEquals("EOF", root.children().get(0).kind());
  }

  @Test
  public void testSpans() {
    CstTree tree = CstParser.parse("a = 1;\n  b = 22;");
    List<CstNode> items = tree.getRoot().namedChildren();
    assertEquals(2, items.size());
    assertEquals(0, items.get(0).span().getStartByte());
    assertEquals(6, items.get(0).span().getEndByte());
    assertEquals(9, items.get(1).span().getStartByte());
    assertEquals(16, items.get(1).span().getEndByte());
    assertEquals("b = 22;", items.get(1).text());
  }

  @Test
  public void testOpenCall() {
    CstTree tree = CstParser.parse("cube(");
    CstNode error = tree.findFirstError();
    assertNotNull(error);
    assertEquals("arguments", error.kind());
    assertEquals(4, error.span().getStartByte());
    assertEquals(5, error.span().getEndByte());
    assertFalse(tree.getReports().isEmpty());
  }

  @Test
  public void testErrorToken() {
    CstTree tree = CstParser.parse("cube(1) @;");
    assertNotNull(tree.findFirstError());
    assertFalse(tree.getReports().isEmpty());
  }

  @Test
  public void testIncludeToken() {
    CstTree tree = CstParser.parse("include <a b/c.scad>");
    CstNode stmt = only(only(tree.getRoot().namedChildren()).namedChildren());
    CstNode include = only(stmt.namedChildren());
    assertEquals("include_statement", include.kind());
    CstNode token = only(include.namedChildren());
    assertEquals("include", token.kind());
    assertEquals("include <a b/c.scad>", token.text());
  }

  @Test
  public void testLabelledExpressions() {
    CstTree tree = CstParser.parse("x = -a + b[0];");
    CstNode assignment = only(only(only(tree.getRoot().namedChildren())
                                       .namedChildren()).namedChildren());
    CstNode value = assignment.namedChildren().get(1);
    assertEquals("binary_expression", value.kind());
    assertEquals("unary_expression", value.namedChildren().get(0).kind());
    assertEquals("index_expression", value.namedChildren().get(1).kind());
  }
}

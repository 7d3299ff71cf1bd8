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

import org.junit.Test;

import exm.scad.ast.Span;

public class SourceTextTest {

  @Test
  public void testAscii() {
    SourceText text = new SourceText("ab\ncd");
    assertEquals(5, text.size());
    assertEquals(5, text.byteLength());
    assertEquals(2, text.lineCount());
    assertEquals(1, text.row(3));
    assertEquals(0, text.col(3));
    assertEquals(1, text.col(4));
    assertEquals("cd", text.slice(3, 5));
  }

  @Test
  public void testMultiByte() {
    // é is two bytes, the emoji is four bytes and two chars
    String emoji = new String(Character.toChars(0x1F600));
    SourceText text = new SourceText("é" + emoji + "x\ny");
    assertEquals(5, text.size());
    assertEquals(2 + 4 + 1 + 1 + 1, text.byteLength());
    assertEquals(2, text.byteOffset(1));
    assertEquals(6, text.byteOffset(2));
    assertEquals(6, text.col(2));
    assertEquals("x", text.slice(2, 3));
    assertEquals(emoji, text.slice(1, 2));
  }

  @Test
  public void testSpan() {
    SourceText text = new SourceText("cube(1);\nsphere(é);");
    Span span = text.span(9, 19);
    assertEquals(9, span.getStartByte());
    assertEquals(20, span.getEndByte());
    assertEquals(1, span.getStartRow());
    assertEquals(0, span.getStartCol());
    assertEquals(1, span.getEndRow());
    assertEquals(11, span.getEndCol());
    assertEquals("sphere(é);", span.getText());
    assertEquals("2:1-2:12", span.toString());
  }

  @Test
  public void testClamping() {
    SourceText text = new SourceText("abc");
    Span span = text.span(2, 99);
    assertEquals(2, span.getStartByte());
    assertEquals(3, span.getEndByte());
    assertEquals(0, text.point(-4).getStartByte());
  }

  @Test
  public void testLexerPositions() {
    SourceText text = new SourceText("a\nbé c");
    // Line 2, fourth code point
    assertEquals(5, text.offsetOf(2, 3));
    assertEquals(5, text.byteOffset(4));
    assertEquals(4, text.col(5));
  }

  @Test
  public void testEmpty() {
    SourceText text = new SourceText("");
    assertEquals(0, text.size());
    assertEquals(1, text.lineCount());
    assertEquals(0, text.point(0).getEndByte());
  }
}

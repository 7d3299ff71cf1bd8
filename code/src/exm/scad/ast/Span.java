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

import exm.scad.common.exceptions.ScadRuntimeError;

/**
 * Range of source text covered by a node.
 *
 * Byte offsets index the UTF-8 encoding of the source.  Rows and columns
 * are zero-based, and columns count bytes from the start of the row.
 * The end is exclusive.  The text slice is optional and does not take part
 * in equality.
 */
public class Span {
  private final int startByte;
  private final int endByte;
  private final int startRow;
  private final int startCol;
  private final int endRow;
  private final int endCol;
  private final String text;

  public Span(int startByte, int endByte, int startRow, int startCol,
              int endRow, int endCol, String text) {
    if (startByte > endByte) {
      throw new ScadRuntimeError("Span ends before it starts: "
                                + startByte + " > " + endByte);
    }
    this.startByte = startByte;
    this.endByte = endByte;
    this.startRow = startRow;
    this.startCol = startCol;
    this.endRow = endRow;
    this.endCol = endCol;
    this.text = text;
  }

  public Span(int startByte, int endByte, int startRow, int startCol,
              int endRow, int endCol) {
    this(startByte, endByte, startRow, startCol, endRow, endCol, null);
  }

  /**
   * @return zero-width span at the given position
   */
  public static Span at(int byteOffset, int row, int col) {
    return new Span(byteOffset, byteOffset, row, col, row, col, "");
  }

  /**
   * @return zero-width span at the start of this one
   */
  public Span startPoint() {
    return at(startByte, startRow, startCol);
  }

  /**
   * @return zero-width span at the end of this one
   */
  public Span endPoint() {
    return at(endByte, endRow, endCol);
  }

  public int getStartByte() {
    return startByte;
  }

  public int getEndByte() {
    return endByte;
  }

  public int getStartRow() {
    return startRow;
  }

  public int getStartCol() {
    return startCol;
  }

  public int getEndRow() {
    return endRow;
  }

  public int getEndCol() {
    return endCol;
  }

  /**
   * @return source text covered, or null if not recorded
   */
  public String getText() {
    return text;
  }

  public int length() {
    return endByte - startByte;
  }

  public boolean isEmpty() {
    return startByte == endByte;
  }

  public boolean contains(Span other) {
    return startByte <= other.startByte && other.endByte <= endByte;
  }

  public boolean contains(int byteOffset) {
    return startByte <= byteOffset && byteOffset < endByte;
  }

  /**
   * Smallest span covering both.  The text slice is dropped.
   */
  public Span merge(Span other) {
    Span first = startByte <= other.startByte ? this : other;
    Span last = endByte >= other.endByte ? this : other;
    return new Span(first.startByte, last.endByte, first.startRow,
                    first.startCol, last.endRow, last.endCol);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + startByte;
    result = prime * result + endByte;
    result = prime * result + startRow;
    result = prime * result + startCol;
    result = prime * result + endRow;
    result = prime * result + endCol;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Span))
      return false;
    Span other = (Span) obj;
    return startByte == other.startByte && endByte == other.endByte &&
           startRow == other.startRow && startCol == other.startCol &&
           endRow == other.endRow && endCol == other.endCol;
  }

  /**
   * One-based row:col range, as editors show it
   */
  @Override
  public String toString() {
    return (startRow + 1) + ":" + (startCol + 1) + "-" +
           (endRow + 1) + ":" + (endCol + 1);
  }
}

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

import java.util.ArrayList;
import java.util.List;

import exm.scad.ast.Span;

/**
 * Position bookkeeping for one source string.
 *
 * The ANTLR character stream indexes code points, while spans are
 * expressed in UTF-8 bytes with byte columns.  This class maps between
 * the two.
 */
public class SourceText {
  private final String text;

  /** code point index -> UTF-8 byte offset, one extra entry for the end */
  private final int[] byteOffsets;

  /** code point index -> UTF-16 char index, one extra entry for the end */
  private final int[] charOffsets;

  /** code point index at which each line starts */
  private final int[] lineStarts;

  public SourceText(String text) {
    this.text = text;
    int cpCount = text.codePointCount(0, text.length());
    byteOffsets = new int[cpCount + 1];
    charOffsets = new int[cpCount + 1];
    List<Integer> starts = new ArrayList<Integer>();
    starts.add(0);

    int bytePos = 0;
    int charPos = 0;
    for (int cp = 0; cp < cpCount; cp++) {
      byteOffsets[cp] = bytePos;
      charOffsets[cp] = charPos;
      int c = text.codePointAt(charPos);
      bytePos += utf8Length(c);
      charPos += Character.charCount(c);
      if (c == '\n') {
        starts.add(cp + 1);
      }
    }
    byteOffsets[cpCount] = bytePos;
    charOffsets[cpCount] = charPos;

    lineStarts = new int[starts.size()];
    for (int i = 0; i < lineStarts.length; i++) {
      lineStarts[i] = starts.get(i);
    }
  }

  private static int utf8Length(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    } else if (codePoint < 0x800) {
      return 2;
    } else if (codePoint < 0x10000) {
      return 3;
    } else {
      return 4;
    }
  }

  public String getText() {
    return text;
  }

  /**
   * @return number of code points
   */
  public int size() {
    return byteOffsets.length - 1;
  }

  public int byteLength() {
    return byteOffsets[size()];
  }

  public int lineCount() {
    return lineStarts.length;
  }

  private int clamp(int cp) {
    if (cp < 0) {
      return 0;
    } else if (cp > size()) {
      return size();
    }
    return cp;
  }

  public int byteOffset(int cp) {
    return byteOffsets[clamp(cp)];
  }

  /**
   * @return zero-based row containing code point cp
   */
  public int row(int cp) {
    cp = clamp(cp);
    int lo = 0;
    int hi = lineStarts.length - 1;
    while (lo < hi) {
      int mid = (lo + hi + 1) >>> 1;
      if (lineStarts[mid] <= cp) {
        lo = mid;
      } else {
        hi = mid - 1;
      }
    }
    return lo;
  }

  /**
   * @return zero-based byte column of code point cp within its row
   */
  public int col(int cp) {
    cp = clamp(cp);
    return byteOffsets[cp] - byteOffsets[lineStarts[row(cp)]];
  }

  /**
   * Convert a lexer position to a code point index
   * @param line one-based line, as reported by ANTLR
   * @param charPositionInLine zero-based code point column
   */
  public int offsetOf(int line, int charPositionInLine) {
    int lineIx = Math.max(0, Math.min(line - 1, lineStarts.length - 1));
    return clamp(lineStarts[lineIx] + Math.max(0, charPositionInLine));
  }

  public String slice(int startCp, int endCp) {
    return text.substring(charOffsets[clamp(startCp)],
                          charOffsets[clamp(endCp)]);
  }

  /**
   * @param startCp inclusive code point index
   * @param endCp exclusive code point index, not before startCp
   */
  public Span span(int startCp, int endCp) {
    startCp = clamp(startCp);
    endCp = Math.max(startCp, clamp(endCp));
    return new Span(byteOffsets[startCp], byteOffsets[endCp],
                    row(startCp), col(startCp), row(endCp), col(endCp),
                    slice(startCp, endCp));
  }

  public Span point(int cp) {
    return span(cp, cp);
  }
}

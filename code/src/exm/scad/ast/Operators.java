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

import java.util.HashMap;
import java.util.Map;

/**
 * Operators of the expression language, with their source spelling.
 */
public class Operators {

  public static enum BinaryOp {
    OR("||"), AND("&&"),
    EQ("=="), NEQ("!="),
    LT("<"), LTE("<="), GT(">"), GTE(">="),
    PLUS("+"), MINUS("-"),
    MULT("*"), DIV("/"), MOD("%"),
    POW("^");

    private final String symbol;

    private BinaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  public static enum UnaryOp {
    NOT("!"), NEGATE("-"), PLUS("+");

    private final String symbol;

    private UnaryOp(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }
  }

  /** Map of source spelling -> operator */
  private static final Map<String, BinaryOp> binaryOps =
                                  new HashMap<String, BinaryOp>();
  private static final Map<String, UnaryOp> unaryOps =
                                  new HashMap<String, UnaryOp>();

  static {
    for (BinaryOp op: BinaryOp.values()) {
      binaryOps.put(op.symbol(), op);
    }
    for (UnaryOp op: UnaryOp.values()) {
      unaryOps.put(op.symbol(), op);
    }
  }

  /**
   * @param symbol
   * @return the operator, or null if the symbol is not a binary operator
   */
  public static BinaryOp binaryOp(String symbol) {
    return binaryOps.get(symbol);
  }

  /**
   * @param symbol
   * @return the operator, or null if the symbol is not a unary operator
   */
  public static UnaryOp unaryOp(String symbol) {
    return unaryOps.get(symbol);
  }
}

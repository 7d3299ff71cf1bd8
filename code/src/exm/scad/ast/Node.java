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
 * Common base of all AST nodes.
 *
 * Nodes are immutable.  equals() and hashCode() are structural: they
 * compare node kinds and children, never spans, so two trees parsed from
 * differently formatted text compare equal when they mean the same thing.
 */
public abstract class Node {
  private final Span span;

  protected Node(Span span) {
    if (span == null) {
      throw new ScadRuntimeError("AST node created without span: "
                                 + getClass().getSimpleName());
    }
    this.span = span;
  }

  public Span getSpan() {
    return span;
  }
}

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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Loop clause of a C-style list comprehension generator
 */
public abstract class CompClause extends Node {

  protected CompClause(Span span) {
    super(span);
  }

  /**
   * Loop continues while this holds
   */
  public static class Condition extends CompClause {
    private final Expr cond;

    public Condition(Expr cond) {
      super(cond.getSpan());
      this.cond = cond;
    }

    public Expr getCond() {
      return cond;
    }

    @Override
    public int hashCode() {
      return cond.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Condition && cond.equals(((Condition)obj).cond);
    }

    @Override
    public String toString() {
      return cond.toString();
    }
  }

  /**
   * Rebindings applied after each iteration
   */
  public static class Update extends CompClause {
    private final List<Binding> bindings;

    public Update(List<Binding> bindings, Span span) {
      super(span);
      this.bindings = ImmutableList.copyOf(bindings);
    }

    public List<Binding> getBindings() {
      return bindings;
    }

    @Override
    public int hashCode() {
      return bindings.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Update && bindings.equals(((Update)obj).bindings);
    }

    @Override
    public String toString() {
      return bindings.toString();
    }
  }
}

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
 * Actual argument of a call: either positional or name = value.
 */
public class Arg extends Node {
  public static enum ArgKind {
    POSITIONAL,
    NAMED,
  }

  private final ArgKind kind;
  /** Null for positional arguments */
  private final Name name;
  private final Expr value;

  private Arg(ArgKind kind, Name name, Expr value, Span span) {
    super(span);
    this.kind = kind;
    this.name = name;
    this.value = value;
  }

  public static Arg positional(Expr value) {
    return new Arg(ArgKind.POSITIONAL, null, value, value.getSpan());
  }

  public static Arg named(Name name, Expr value, Span span) {
    assert(name != null);
    return new Arg(ArgKind.NAMED, name, value, span);
  }

  public ArgKind getKind() {
    return kind;
  }

  public boolean isNamed() {
    return kind == ArgKind.NAMED;
  }

  public Name getName() {
    if (kind == ArgKind.NAMED) {
      return name;
    } else {
      throw new ScadRuntimeError("getName for positional argument");
    }
  }

  public Expr getValue() {
    return value;
  }

  @Override
  public int hashCode() {
    int result = kind.hashCode();
    result = 31 * result + (name == null ? 0 : name.hashCode());
    result = 31 * result + value.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Arg))
      return false;
    Arg other = (Arg) obj;
    if (kind != other.kind)
      return false;
    if (kind == ArgKind.NAMED && !name.equals(other.name))
      return false;
    return value.equals(other.value);
  }

  @Override
  public String toString() {
    return isNamed() ? name + " = " + value : value.toString();
  }
}

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

/**
 * name = value, as written in let, assign and for headers
 */
public class Binding extends Node {
  private final Name name;
  private final Expr value;

  public Binding(Name name, Expr value, Span span) {
    super(span);
    this.name = name;
    this.value = value;
  }

  public Name getName() {
    return name;
  }

  public Expr getValue() {
    return value;
  }

  @Override
  public int hashCode() {
    return 31 * name.hashCode() + value.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Binding))
      return false;
    Binding other = (Binding) obj;
    return name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public String toString() {
    return name + " = " + value;
  }
}

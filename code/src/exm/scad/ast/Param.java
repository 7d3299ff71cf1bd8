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

import java.util.Objects;

/**
 * Formal parameter of a module, function or function literal
 */
public class Param extends Node {
  private final Name name;
  private final Expr defaultValue;

  public Param(Name name, Expr defaultValue, Span span) {
    super(span);
    this.name = name;
    this.defaultValue = defaultValue;
  }

  public Name getName() {
    return name;
  }

  /**
   * @return default value expression, or null if none
   */
  public Expr getDefaultValue() {
    return defaultValue;
  }

  public boolean hasDefault() {
    return defaultValue != null;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, defaultValue);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Param))
      return false;
    Param other = (Param) obj;
    return name.equals(other.name) &&
           Objects.equals(defaultValue, other.defaultValue);
  }

  @Override
  public String toString() {
    return hasDefault() ? name + " = " + defaultValue : name.toString();
  }
}

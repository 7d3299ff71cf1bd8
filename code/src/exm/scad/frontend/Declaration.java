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
package exm.scad.frontend;

import exm.scad.ast.Name;
import exm.scad.ast.Span;

/**
 * A name bound in some scope
 */
public class Declaration {

  public static enum DeclKind {
    VARIABLE, PARAMETER, LOOP_VARIABLE, MODULE, FUNCTION,
  }

  private final Name name;
  private final DeclKind kind;
  private final int scopeId;

  public Declaration(Name name, DeclKind kind, int scopeId) {
    this.name = name;
    this.kind = kind;
    this.scopeId = scopeId;
  }

  public Name getName() {
    return name;
  }

  public String getId() {
    return name.getId();
  }

  public DeclKind getKind() {
    return kind;
  }

  public int getScopeId() {
    return scopeId;
  }

  /**
   * @return span of the declared name
   */
  public Span getSpan() {
    return name.getSpan();
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase() + " " + name.getId() + "@" +
           getSpan();
  }
}

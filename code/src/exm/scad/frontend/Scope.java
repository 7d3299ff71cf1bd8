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

import java.util.Map;

import exm.scad.ast.Span;
import exm.scad.common.util.HierarchicalMap;

/**
 * A lexical scope.  Lookups fall through to the enclosing scope, so a
 * declaration here shadows one of the same name further out.
 */
public class Scope {

  public static enum ScopeKind {
    ROOT, MODULE, FUNCTION, BLOCK, LET, ASSIGN, FOR, INTERSECTION_FOR,
    COMPREHENSION,
  }

  private final int id;
  private final ScopeKind kind;
  private final Scope parent;
  private final Span span;
  private final HierarchicalMap<String, Declaration> declarations;

  Scope(int id, ScopeKind kind, Scope parent, Span span) {
    this.id = id;
    this.kind = kind;
    this.parent = parent;
    this.span = span;
    if (parent == null) {
      this.declarations = new HierarchicalMap<String, Declaration>();
    } else {
      this.declarations = parent.declarations.makeChildMap();
    }
  }

  public int getId() {
    return id;
  }

  public ScopeKind getKind() {
    return kind;
  }

  /**
   * @return enclosing scope, or null for the root
   */
  public Scope getParent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  public Span getSpan() {
    return span;
  }

  /**
   * @return innermost visible declaration of name, or null
   */
  public Declaration lookup(String name) {
    return declarations.get(name);
  }

  /**
   * @return declaration of name in this scope only, or null
   */
  public Declaration lookupLocal(String name) {
    return declarations.containsLocal(name) ? declarations.get(name) : null;
  }

  /**
   * @return number of scopes out from this one where name is declared,
   *         or -1 if it is not visible
   */
  public int depthOf(String name) {
    return declarations.getDepth(name);
  }

  /**
   * @return names declared directly in this scope, in declaration order
   */
  public Map<String, Declaration> getDeclarations() {
    return declarations.localEntries();
  }

  /**
   * Redeclaring a name in the same scope replaces the earlier declaration
   */
  void declare(Declaration decl) {
    declarations.put(decl.getId(), decl);
  }

  @Override
  public String toString() {
    return "scope " + id + " " + kind + (parent == null ? "" :
           " (parent " + parent.id + ")") + " " + getDeclarations().keySet();
  }
}

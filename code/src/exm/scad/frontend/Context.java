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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.scad.ast.Item.FunctionDef;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.ast.Span;
import exm.scad.common.exceptions.ScadRuntimeError;
import exm.scad.frontend.Scope.ScopeKind;

/**
 * Everything learned about a file while converting it: the scope tree,
 * special variable assignments and the module and function definitions.
 *
 * Filled in by the converter in source order; read-only afterwards.
 */
public class Context {

  public static final int ROOT_SCOPE_ID = 0;

  /** Indexed by scope id */
  private final List<Scope> scopes = new ArrayList<Scope>();

  private final SpecialVariables specials = new SpecialVariables();

  private final LinkedHashMap<String, ModuleDef> modules =
                                    new LinkedHashMap<String, ModuleDef>();

  private final LinkedHashMap<String, FunctionDef> functions =
                                    new LinkedHashMap<String, FunctionDef>();

  Context(Span rootSpan) {
    scopes.add(new Scope(ROOT_SCOPE_ID, ScopeKind.ROOT, null, rootSpan));
  }

  public Scope getRootScope() {
    return scopes.get(ROOT_SCOPE_ID);
  }

  public Scope getScope(int id) {
    if (id < 0 || id >= scopes.size()) {
      throw new ScadRuntimeError("No scope with id " + id);
    }
    return scopes.get(id);
  }

  /**
   * @return all scopes in creation order, so that index equals id
   */
  public List<Scope> getScopes() {
    return Collections.unmodifiableList(scopes);
  }

  public int scopeCount() {
    return scopes.size();
  }

  /**
   * Resolve name as seen from the given scope
   * @return the innermost declaration, or null if not visible
   */
  public Declaration lookup(int scopeId, String name) {
    return getScope(scopeId).lookup(name);
  }

  public SpecialVariables getSpecials() {
    return specials;
  }

  public Map<String, ModuleDef> getModules() {
    return Collections.unmodifiableMap(modules);
  }

  public ModuleDef getModule(String name) {
    return modules.get(name);
  }

  public Map<String, FunctionDef> getFunctions() {
    return Collections.unmodifiableMap(functions);
  }

  public FunctionDef getFunction(String name) {
    return functions.get(name);
  }

  Scope pushScope(ScopeKind kind, Scope parent, Span span) {
    Scope scope = new Scope(scopes.size(), kind, parent, span);
    scopes.add(scope);
    return scope;
  }

  /**
   * Later definitions of the same name replace earlier ones
   */
  void defineModule(ModuleDef def) {
    String name = def.getName().getId();
    modules.remove(name);
    modules.put(name, def);
  }

  void defineFunction(FunctionDef def) {
    String name = def.getName().getId();
    functions.remove(name);
    functions.put(name, def);
  }
}

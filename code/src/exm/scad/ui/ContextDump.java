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
package exm.scad.ui;

import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.scad.ast.Item.FunctionDef;
import exm.scad.ast.Item.ModuleDef;
import exm.scad.frontend.Context;
import exm.scad.frontend.Declaration;
import exm.scad.frontend.Scope;
import exm.scad.frontend.SpecialVariables;

/**
 * Human-readable listing of a Context: registries first, then the scope
 * tree with the names declared in each scope.
 */
public class ContextDump {

  private static final String INDENT = "  ";

  public static String dump(Context context) {
    StringBuilder sb = new StringBuilder();

    sb.append("modules:\n");
    for (Map.Entry<String, ModuleDef> e: context.getModules().entrySet()) {
      sb.append(INDENT).append(e.getKey()).append(" @ ")
        .append(e.getValue().getSpan()).append('\n');
    }

    sb.append("functions:\n");
    for (Map.Entry<String, FunctionDef> e:
                                    context.getFunctions().entrySet()) {
      sb.append(INDENT).append(e.getKey()).append(" @ ")
        .append(e.getValue().getSpan()).append('\n');
    }

    sb.append("special variables:\n");
    for (SpecialVariables.Entry e:
                        context.getSpecials().getEntries().values()) {
      sb.append(INDENT).append(e).append(" @ ").append(e.getSpan());
      if (!SpecialVariables.isKnown(e.getName().getId())) {
        sb.append(" (unknown)");
      }
      sb.append('\n');
    }

    ListMultimap<Integer, Scope> children = ArrayListMultimap.create();
    for (Scope scope: context.getScopes()) {
      if (!scope.isRoot()) {
        children.put(scope.getParent().getId(), scope);
      }
    }
    sb.append("scopes:\n");
    dumpScope(sb, context.getRootScope(), children, 1);
    return sb.toString();
  }

  private static void dumpScope(StringBuilder sb, Scope scope,
                    ListMultimap<Integer, Scope> children, int depth) {
    String indent = StringUtils.repeat(INDENT, depth);
    sb.append(indent).append(scope.getId()).append(' ')
      .append(scope.getKind()).append(" @ ").append(scope.getSpan())
      .append('\n');
    for (Declaration decl: scope.getDeclarations().values()) {
      sb.append(indent).append(INDENT).append("- ").append(decl)
        .append('\n');
    }
    for (Scope child: children.get(scope.getId())) {
      dumpScope(sb, child, children, depth + 1);
    }
  }
}

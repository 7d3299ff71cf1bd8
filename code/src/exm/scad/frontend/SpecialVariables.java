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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import com.google.common.collect.ImmutableSet;

import exm.scad.ast.Expr;
import exm.scad.ast.Name;
import exm.scad.ast.Span;
import exm.scad.common.Logging;

/**
 * Registry of assignments to $-prefixed special variables.  The most
 * recent assignment in source order wins.
 */
public class SpecialVariables {

  private static final Logger logger = Logging.getScadLogger();

  /** Special variables the language itself reads or sets */
  public static final Set<String> KNOWN = ImmutableSet.of(
      "$fn", "$fa", "$fs", "$t", "$preview", "$children",
      "$vpr", "$vpt", "$vpd", "$vpf");

  public static class Entry {
    private final Name name;
    private final Expr value;
    private final Span span;
    private final int scopeId;

    Entry(Name name, Expr value, Span span, int scopeId) {
      this.name = name;
      this.value = value;
      this.span = span;
      this.scopeId = scopeId;
    }

    public Name getName() {
      return name;
    }

    public Expr getValue() {
      return value;
    }

    /**
     * @return span of the whole assignment
     */
    public Span getSpan() {
      return span;
    }

    public int getScopeId() {
      return scopeId;
    }

    @Override
    public String toString() {
      return name.getId() + " = " + value + " (scope " + scopeId + ")";
    }
  }

  private final LinkedHashMap<String, Entry> entries =
                                      new LinkedHashMap<String, Entry>();

  public static boolean isKnown(String name) {
    return KNOWN.contains(name);
  }

  void assign(Name name, Expr value, Span span, int scopeId) {
    if (!isKnown(name.getId())) {
      logger.debug("assignment to unknown special variable " + name.getId()
                   + " at " + span);
    }
    // Remove first so iteration order follows the latest assignment
    entries.remove(name.getId());
    entries.put(name.getId(), new Entry(name, value, span, scopeId));
  }

  public Entry get(String name) {
    return entries.get(name);
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  public int size() {
    return entries.size();
  }

  public Map<String, Entry> getEntries() {
    return Collections.unmodifiableMap(entries);
  }
}

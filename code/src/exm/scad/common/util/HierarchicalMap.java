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
package exm.scad.common.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

/**
 * Lookup table for nested scopes.  A lookup that misses in this map
 * continues in the parent, so entries in a child shadow the same key in
 * any ancestor.  Writes only ever touch the local level.
 *
 * Local entries keep insertion order.
 */
public class HierarchicalMap<K, V> {
  private final LinkedHashMap<K, V> map;
  private final HierarchicalMap<K, V> parent;

  public HierarchicalMap() {
    this(null);
  }

  private HierarchicalMap(HierarchicalMap<K, V> parent) {
    this.map = new LinkedHashMap<K, V>();
    this.parent = parent;
  }

  public HierarchicalMap<K, V> makeChildMap() {
    return new HierarchicalMap<K, V>(this);
  }

  public HierarchicalMap<K, V> getParent() {
    return parent;
  }

  public boolean containsKey(K key) {
    return map.containsKey(key)
        || (parent != null && parent.containsKey(key));
  }

  public boolean containsLocal(K key) {
    return map.containsKey(key);
  }

  /**
   * @return value from the innermost level defining key, or null
   */
  public V get(K key) {
    if (map.containsKey(key)) {
      return map.get(key);
    } else if (parent != null) {
      return parent.get(key);
    } else {
      return null;
    }
  }

  /**
   * @param key
   * @return the number of levels above this one at which the key is
   *         defined, or -1 if it is not defined
   */
  public int getDepth(K key) {
    int depth = 0;
    HierarchicalMap<K, V> curr = this;
    while (curr != null) {
      if (curr.map.containsKey(key)) {
        return depth;
      }
      depth++;
      curr = curr.parent;
    }
    return -1;
  }

  /**
   * Bind at this level, replacing any earlier local binding
   * @return previous local value, or null
   */
  public V put(K key, V value) {
    return map.put(key, value);
  }

  /**
   * @return read-only view of the entries defined at this level
   */
  public Map<K, V> localEntries() {
    return Collections.unmodifiableMap(map);
  }

  public int localSize() {
    return map.size();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("{");
    boolean first = true;
    for (Entry<K, V> e: map.entrySet()) {
      if (first) {
        first = false;
      } else {
        sb.append(",");
      }
      sb.append(e.getKey());
      sb.append(":");
      sb.append(e.getValue());
    }
    sb.append("}");
    if (parent != null) {
      sb.append(" <- ");
      sb.append(parent.toString());
    }
    return sb.toString();
  }
}

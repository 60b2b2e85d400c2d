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
package exm.yul.common.util;

import java.util.HashMap;

/**
 * Map for nested scopes: lookups fall through to the parent map, while
 * puts only affect the innermost map.
 */
public class HierarchicalMap<K, V> {
  private final HashMap<K, V> map;
  private final HierarchicalMap<K, V> parent;

  public HierarchicalMap() {
    this(null);
  }

  private HierarchicalMap(HierarchicalMap<K, V> parent) {
    this.map = new HashMap<K, V>();
    this.parent = parent;
  }

  public HierarchicalMap<K, V> makeChildMap() {
    return new HierarchicalMap<K, V>(this);
  }

  public boolean containsKey(K key) {
    return map.containsKey(key)
        || (parent != null && parent.containsKey(key));
  }

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
   * @return the depth at which the key is defined, -1 if not defined
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

  public V put(K key, V value) {
    return map.put(key, value);
  }

  public boolean isEmpty() {
    return map.isEmpty() && (parent == null || parent.isEmpty());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("{");
    HierarchicalMap<K, V> curr = this;
    boolean first = true;
    while (curr != null) {
      for (K key: curr.map.keySet()) {
        if (first) {
          first = false;
        } else {
          sb.append(",");
        }
        sb.append(key);
        sb.append(":");
        sb.append(curr.map.get(key));
      }
      curr = curr.parent;
    }
    sb.append("}");
    return sb.toString();
  }
}

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

import java.util.Map;
import java.util.TreeMap;

/**
 * Maintain counts for objects.  Keys are kept sorted so that dumps are
 * stable between runs.
 *
 * @param <K> must be comparable
 */
public class Counters<K extends Comparable<K>> {
  private final TreeMap<K, Long> map = new TreeMap<K, Long>();

  public long increment(K key) {
    return add(key, 1);
  }

  public long add(K key, long incr) {
    Long count = map.get(key);
    if (count == null) {
      count = incr;
    } else {
      count += incr;
    }
    if (count == 0) {
      map.remove(key);
    } else {
      map.put(key, count);
    }

    return count;
  }

  public long getCount(K key) {
    Long res = map.get(key);
    return res == null ? 0 : res;
  }

  public void resetAll() {
    map.clear();
  }

  public Map<K, Long> getCountMap() {
    return map;
  }

  @Override
  public String toString() {
    return map.toString();
  }
}

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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class HierarchicalMapTest {

  @Test
  public void testLookupFallsThrough() {
    HierarchicalMap<String, Integer> root = new HierarchicalMap<String, Integer>();
    root.put("a", 1);
    HierarchicalMap<String, Integer> child = root.makeChildMap();
    child.put("b", 2);

    assertEquals(Integer.valueOf(1), child.get("a"));
    assertEquals(Integer.valueOf(2), child.get("b"));
    assertTrue(child.containsKey("a"));
    assertFalse("Parent doesn't see child entries", root.containsKey("b"));
    assertNull(root.get("b"));
  }

  @Test
  public void testShadowing() {
    HierarchicalMap<String, Integer> root = new HierarchicalMap<String, Integer>();
    root.put("a", 1);
    HierarchicalMap<String, Integer> child = root.makeChildMap();
    child.put("a", 2);
    assertEquals(Integer.valueOf(2), child.get("a"));
    assertEquals(Integer.valueOf(1), root.get("a"));
    assertEquals(0, child.getDepth("a"));
  }

  @Test
  public void testDepth() {
    HierarchicalMap<String, Integer> root = new HierarchicalMap<String, Integer>();
    root.put("a", 1);
    HierarchicalMap<String, Integer> grandchild =
                                root.makeChildMap().makeChildMap();
    assertEquals(2, grandchild.getDepth("a"));
    assertEquals(-1, grandchild.getDepth("z"));
    assertFalse(grandchild.isEmpty());
    assertTrue(new HierarchicalMap<String, Integer>().makeChildMap()
                                                      .isEmpty());
  }
}

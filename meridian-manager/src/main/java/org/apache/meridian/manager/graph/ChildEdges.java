/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.meridian.manager.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The CHILD relation, indexed from both ends. Not thread safe; guarded by
 * the owning store's lock.
 */
final class ChildEdges {
  private final Map<String, String> parentOf = new HashMap<>();
  private final Map<String, Set<String>> childrenOf = new HashMap<>();

  String parentOf(String childId) {
    return parentOf.get(childId);
  }

  List<String> childrenOf(String parentId) {
    Set<String> children = childrenOf.get(parentId);
    return children == null ? Collections.emptyList()
        : new ArrayList<>(children);
  }

  void link(String parentId, String childId) {
    parentOf.put(childId, parentId);
    childrenOf.computeIfAbsent(parentId, k -> new LinkedHashSet<>())
        .add(childId);
  }

  void unlink(String parentId, String childId) {
    parentOf.remove(childId, parentId);
    Set<String> children = childrenOf.get(parentId);
    if (children != null) {
      children.remove(childId);
      if (children.isEmpty()) {
        childrenOf.remove(parentId);
      }
    }
  }

  /**
   * Removes every edge touching {@code id}.
   *
   * @return the removed edges as {parent, child} pairs
   */
  List<String[]> detach(String id) {
    List<String[]> removed = new ArrayList<>();
    String parent = parentOf.get(id);
    if (parent != null) {
      removed.add(new String[] {parent, id});
    }
    for (String child : childrenOf(id)) {
      removed.add(new String[] {id, child});
    }
    for (String[] edge : removed) {
      unlink(edge[0], edge[1]);
    }
    return removed;
  }

  int size() {
    return parentOf.size();
  }
}

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

package org.apache.meridian.helpers;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot of a namespace subtree with quota state at every namespace.
 */
public final class NamespaceTree {
  private final NamespaceTreeNode root;

  public NamespaceTree(NamespaceTreeNode root) {
    this.root = Objects.requireNonNull(root, "root == null");
  }

  public NamespaceTreeNode getRoot() {
    return root;
  }

  public Optional<NamespaceTreeNode> find(String namespaceId) {
    NamespaceTreeNode[] found = new NamespaceTreeNode[1];
    root.forEachNode(node -> {
      if (found[0] == null && node.getNamespace().getId().equals(namespaceId)) {
        found[0] = node;
      }
    });
    return Optional.ofNullable(found[0]);
  }

  public int getNamespaceCount() {
    AtomicInteger count = new AtomicInteger();
    root.forEachNode(node -> count.incrementAndGet());
    return count.get();
  }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * One namespace of a {@link NamespaceTree} together with its direct apps
 * and child namespaces. Read side only; never persisted.
 */
public final class NamespaceTreeNode {
  private final NamespaceInfo namespace;
  private final List<AppInfo> apps;
  private final List<NamespaceTreeNode> children;

  public NamespaceTreeNode(NamespaceInfo namespace, List<AppInfo> apps,
      List<NamespaceTreeNode> children) {
    this.namespace = Objects.requireNonNull(namespace, "namespace == null");
    this.apps = Collections.unmodifiableList(new ArrayList<>(apps));
    this.children = Collections.unmodifiableList(new ArrayList<>(children));
  }

  public NamespaceInfo getNamespace() {
    return namespace;
  }

  public List<AppInfo> getApps() {
    return apps;
  }

  public List<NamespaceTreeNode> getChildren() {
    return children;
  }

  public boolean isLeaf() {
    return apps.isEmpty() && children.isEmpty();
  }

  /**
   * Visits this node and then every descendant, depth first.
   */
  public void forEachNode(Consumer<NamespaceTreeNode> visitor) {
    visitor.accept(this);
    for (NamespaceTreeNode child : children) {
      child.forEachNode(visitor);
    }
  }

  @Override
  public String toString() {
    return "NamespaceTreeNode{" + namespace.getId() + ", apps=" + apps.size()
        + ", children=" + children.size() + "}";
  }
}

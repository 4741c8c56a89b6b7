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

package org.apache.meridian.manager;

import java.io.IOException;
import org.apache.meridian.helpers.NamespaceInfo;
import org.apache.meridian.helpers.NamespaceTree;
import org.apache.meridian.util.Deadline;

/**
 * NamespaceManager handles all the namespace operations.
 */
public interface NamespaceManager {

  /**
   * Creates a namespace with its quotas and, unless it is a root, the edge
   * from its parent. Either all of it is stored or none of it.
   *
   * @param namespace the namespace; its totals go through admission
   * @param parentId parent namespace id, or null for a root
   * @param deadline bounds the whole operation
   */
  void addNamespace(NamespaceInfo namespace, String parentId,
      Deadline deadline) throws IOException;

  default void addNamespace(NamespaceInfo namespace, String parentId)
      throws IOException {
    addNamespace(namespace, parentId, Deadline.none());
  }

  /**
   * @return the namespace with its available capacity resolved
   */
  NamespaceInfo getNamespace(String namespaceId, Deadline deadline)
      throws IOException;

  default NamespaceInfo getNamespace(String namespaceId) throws IOException {
    return getNamespace(namespaceId, Deadline.none());
  }

  /**
   * Rebuilds the subtree rooted at {@code rootId} from one consistent read.
   */
  NamespaceTree getHierarchy(String rootId, Deadline deadline)
      throws IOException;

  default NamespaceTree getHierarchy(String rootId) throws IOException {
    return getHierarchy(rootId, Deadline.none());
  }

  /**
   * Deletes the namespace and its edges. Children are not checked here;
   * callers that must not orphan children check first.
   */
  void removeNamespace(String namespaceId, Deadline deadline)
      throws IOException;

  default void removeNamespace(String namespaceId) throws IOException {
    removeNamespace(namespaceId, Deadline.none());
  }
}

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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.apache.meridian.helpers.ResourceQuotas;

/**
 * Unit of work against an {@link EntityGraphStore}.
 * <p>
 * The CHILD relation is a single directed edge set; {@link #getParent} and
 * {@link #getDirectChildren} read it in either direction. Closing a
 * transaction that was not committed rolls it back.
 */
public interface EntityGraphTransaction extends Closeable {

  boolean isReadOnly();

  Optional<EntityRecord> getEntity(String id) throws IOException;

  default boolean exists(String id) throws IOException {
    return getEntity(id).isPresent();
  }

  /**
   * @return the records at the far end of every CHILD edge leaving
   * {@code id}, in no particular order; empty for a leaf
   */
  List<EntityRecord> getDirectChildren(String id) throws IOException;

  /**
   * @return the record at the near end of the CHILD edge entering
   * {@code id}, or empty if {@code id} has no parent
   */
  Optional<EntityRecord> getParent(String id) throws IOException;

  void createEntity(EntityRecord record) throws IOException;

  void createEdge(String parentId, String childId) throws IOException;

  /**
   * Replaces the stored quota totals of an entity.
   */
  void putQuotas(String id, ResourceQuotas quotas) throws IOException;

  /**
   * Deletes the entity and every edge touching it. Children are not
   * deleted; they lose their parent edge.
   */
  void deleteEntitySubgraph(String id) throws IOException;

  void commit() throws IOException;

  void rollback() throws IOException;

  /**
   * Rolls back unless the transaction was committed.
   */
  @Override
  void close() throws IOException;
}

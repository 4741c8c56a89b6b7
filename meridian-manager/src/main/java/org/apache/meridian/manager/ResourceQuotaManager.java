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
import java.util.Map;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.manager.graph.EntityGraphTransaction;
import org.apache.meridian.util.Deadline;

/**
 * Reads and admits resource quotas of namespaces and apps.
 * <p>
 * Available figures are always computed from the live graph.
 */
public interface ResourceQuotaManager {

  /**
   * Replaces the totals of the requested kinds after an admission check.
   * Kinds not in {@code requested} keep their current total.
   *
   * @param entityId namespace or app id
   * @param requested requested totals keyed by resource name
   * @param deadline bounds the whole operation
   * @throws IOException ENTITY_NOT_FOUND, UNSUPPORTED_RESOURCE_KIND,
   * INVALID_QUOTA, EXCEEDS_PARENT_CAPACITY, BELOW_CHILD_UTILIZATION, or a
   * store failure
   */
  void setResourceQuotas(String entityId, Map<String, Double> requested,
      Deadline deadline) throws IOException;

  default void setResourceQuotas(String entityId,
      Map<String, Double> requested) throws IOException {
    setResourceQuotas(entityId, requested, Deadline.none());
  }

  /**
   * Same as {@link #setResourceQuotas(String, Map, Deadline)} inside a
   * transaction owned by the caller, who commits or rolls it back. The
   * caller holds the entity lock.
   */
  void setResourceQuotasInTransaction(EntityGraphTransaction tx,
      String entityId, Map<String, Double> requested) throws IOException;

  /**
   * @return total minus the totals of the direct children, for every
   * supported kind
   * @throws IOException ENTITY_NOT_FOUND or a store failure
   */
  ResourceQuotas getAvailableResources(String entityId, Deadline deadline)
      throws IOException;

  default ResourceQuotas getAvailableResources(String entityId)
      throws IOException {
    return getAvailableResources(entityId, Deadline.none());
  }

  ResourceQuotas getAvailableResourcesInTransaction(
      EntityGraphTransaction tx, String entityId) throws IOException;
}

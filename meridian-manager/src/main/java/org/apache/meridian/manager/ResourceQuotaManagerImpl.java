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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.manager.graph.EntityGraphStore;
import org.apache.meridian.manager.graph.EntityGraphTransaction;
import org.apache.meridian.manager.graph.EntityRecord;
import org.apache.meridian.manager.lock.MeridianLock;
import org.apache.meridian.quota.QuotaArithmetic;
import org.apache.meridian.quota.QuotaViolation;
import org.apache.meridian.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resource quota manager backed by the entity graph.
 */
public class ResourceQuotaManagerImpl implements ResourceQuotaManager {
  private static final Logger LOG =
      LoggerFactory.getLogger(ResourceQuotaManagerImpl.class);

  private final EntityGraphStore store;
  private final MeridianLock lock;
  private final MeridianMetrics metrics;

  public ResourceQuotaManagerImpl(EntityGraphStore store, MeridianLock lock,
      MeridianMetrics metrics) {
    this.store = store;
    this.lock = lock;
    this.metrics = metrics;
  }

  @Override
  public void setResourceQuotas(String entityId,
      Map<String, Double> requested, Deadline deadline) throws IOException {
    Objects.requireNonNull(entityId, "entityId == null");
    Objects.requireNonNull(requested, "requested == null");
    List<String> lockIds =
        EntityLocks.entityAndParent(store, entityId, deadline);
    lock.acquireWriteLocks(lockIds, deadline);
    try (EntityGraphTransaction tx = store.beginTransaction(false, deadline)) {
      setResourceQuotasInTransaction(tx, entityId, requested);
      tx.commit();
      metrics.incNumQuotaUpdates();
      LOG.debug("Set quotas {} on {}", requested, entityId);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex,
          "Set resource quotas", entityId);
    } finally {
      lock.releaseWriteLocks(lockIds);
    }
  }

  @Override
  public void setResourceQuotasInTransaction(EntityGraphTransaction tx,
      String entityId, Map<String, Double> requested) throws IOException {
    EntityRecord entity = getExisting(tx, entityId);
    ResourceQuotas parentAvailable = null;
    Optional<EntityRecord> parent = lookupParent(tx, entityId);
    if (parent.isPresent()) {
      parentAvailable = computeAvailable(tx, parent.get());
    }
    ResourceQuotas selfUtilized = QuotaArithmetic.computeUtilized(
        entity.getQuotas(), computeAvailable(tx, entity));

    Optional<QuotaViolation> violation = QuotaArithmetic.validateAdmission(
        requested, entity.getQuotas(), parentAvailable, selfUtilized);
    if (violation.isPresent()) {
      metrics.incNumQuotaRejections();
      LOG.debug("Rejected quotas {} for {}: {}", requested, entityId,
          violation.get().getMessage());
      throw violation.get().toException();
    }
    ResourceQuotas update = ResourceQuotas.fromRequest(requested);
    tx.putQuotas(entityId, entity.getQuotas().overlay(update));
  }

  @Override
  public ResourceQuotas getAvailableResources(String entityId,
      Deadline deadline) throws IOException {
    Objects.requireNonNull(entityId, "entityId == null");
    try (EntityGraphTransaction tx = store.beginTransaction(true, deadline)) {
      ResourceQuotas available =
          getAvailableResourcesInTransaction(tx, entityId);
      tx.commit();
      return available;
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex,
          "Get available resources", entityId);
    }
  }

  @Override
  public ResourceQuotas getAvailableResourcesInTransaction(
      EntityGraphTransaction tx, String entityId) throws IOException {
    return computeAvailable(tx, getExisting(tx, entityId));
  }

  private static EntityRecord getExisting(EntityGraphTransaction tx,
      String entityId) throws IOException {
    Optional<EntityRecord> entity = tx.getEntity(entityId);
    if (!entity.isPresent()) {
      LOG.debug("entity:{} does not exist", entityId);
      throw new MeridianException("Entity " + entityId + " is not found",
          ResultCodes.ENTITY_NOT_FOUND);
    }
    return entity.get();
  }

  /**
   * Empty means the entity is a root. A failed lookup is never treated as
   * a root, since that would skip the parent capacity check.
   */
  private static Optional<EntityRecord> lookupParent(
      EntityGraphTransaction tx, String entityId) throws IOException {
    try {
      return tx.getParent(entityId);
    } catch (MeridianException e) {
      throw e;
    } catch (IOException e) {
      throw new MeridianException("Failed to look up the parent of "
          + entityId, e, ResultCodes.STORE_UNAVAILABLE);
    }
  }

  static ResourceQuotas computeAvailable(EntityGraphTransaction tx,
      EntityRecord entity) throws IOException {
    List<ResourceQuotas> childTotals = new ArrayList<>();
    for (EntityRecord child : tx.getDirectChildren(entity.getId())) {
      childTotals.add(child.getQuotas());
    }
    return QuotaArithmetic.computeAvailable(entity.getQuotas(), childTotals);
  }
}

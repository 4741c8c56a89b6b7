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

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.helpers.EntityType;
import org.apache.meridian.helpers.MeridianIds;
import org.apache.meridian.helpers.NamespaceInfo;
import org.apache.meridian.helpers.NamespaceTree;
import org.apache.meridian.helpers.NamespaceTreeNode;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.manager.graph.EntityGraphStore;
import org.apache.meridian.manager.graph.EntityGraphTransaction;
import org.apache.meridian.manager.graph.EntityRecord;
import org.apache.meridian.manager.lock.MeridianLock;
import org.apache.meridian.quota.QuotaArithmetic;
import org.apache.meridian.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Namespace manager backed by the entity graph.
 */
public class NamespaceManagerImpl implements NamespaceManager {
  private static final Logger LOG =
      LoggerFactory.getLogger(NamespaceManagerImpl.class);

  private final EntityGraphStore store;
  private final MeridianLock lock;
  private final ResourceQuotaManager quotaManager;
  private final EntityRecordCodec codec;
  private final MeridianMetrics metrics;

  public NamespaceManagerImpl(EntityGraphStore store, MeridianLock lock,
      ResourceQuotaManager quotaManager, EntityRecordCodec codec,
      MeridianMetrics metrics) {
    this.store = store;
    this.lock = lock;
    this.quotaManager = quotaManager;
    this.codec = codec;
    this.metrics = metrics;
  }

  @Override
  public void addNamespace(NamespaceInfo namespace, String parentId,
      Deadline deadline) throws IOException {
    Preconditions.checkNotNull(namespace);
    MeridianIds.checkSegment("org id", namespace.getOrgId());
    MeridianIds.checkSegment("namespace name", namespace.getName());
    String namespaceId = namespace.getId();

    List<String> lockIds = new ArrayList<>(2);
    lockIds.add(namespaceId);
    if (parentId != null) {
      lockIds.add(parentId);
    }
    lock.acquireWriteLocks(lockIds, deadline);
    try (EntityGraphTransaction tx = store.beginTransaction(false, deadline)) {
      if (tx.exists(namespaceId)) {
        LOG.debug("namespace:{} already exists", namespaceId);
        throw new MeridianException("Namespace " + namespaceId
            + " already exists", ResultCodes.ENTITY_ALREADY_EXISTS);
      }
      if (parentId != null) {
        checkParent(tx, parentId, namespace.getOrgId());
      }
      tx.createEntity(codec.toRecord(namespace));
      if (parentId != null) {
        tx.createEdge(parentId, namespaceId);
      }
      quotaManager.setResourceQuotasInTransaction(tx, namespaceId,
          namespace.getTotalQuotas().toKeyMap());
      tx.commit();
      metrics.incNumNamespaceAdds();
      LOG.debug("created namespace:{} under parent:{}", namespaceId,
          parentId);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "Namespace creation",
          namespaceId);
    } finally {
      lock.releaseWriteLocks(lockIds);
    }
  }

  private static void checkParent(EntityGraphTransaction tx, String parentId,
      String orgId) throws IOException {
    Optional<EntityRecord> parent = tx.getEntity(parentId);
    if (!parent.isPresent() || parent.get().getType() != EntityType.NAMESPACE) {
      LOG.debug("parent namespace:{} does not exist", parentId);
      throw new MeridianException("Parent namespace " + parentId
          + " is not found", ResultCodes.ENTITY_NOT_FOUND);
    }
    if (!MeridianIds.orgOf(parentId).equals(orgId)) {
      throw new MeridianException("Parent namespace " + parentId
          + " belongs to another org than " + orgId,
          ResultCodes.INVALID_REQUEST);
    }
  }

  @Override
  public NamespaceInfo getNamespace(String namespaceId, Deadline deadline)
      throws IOException {
    Objects.requireNonNull(namespaceId, "namespaceId == null");
    try (EntityGraphTransaction tx = store.beginTransaction(true, deadline)) {
      EntityRecord record = getExistingNamespace(tx, namespaceId);
      ResourceQuotas available =
          quotaManager.getAvailableResourcesInTransaction(tx, namespaceId);
      tx.commit();
      return codec.toNamespace(record, available);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "Get namespace",
          namespaceId);
    }
  }

  @Override
  public NamespaceTree getHierarchy(String rootId, Deadline deadline)
      throws IOException {
    Objects.requireNonNull(rootId, "rootId == null");
    try (EntityGraphTransaction tx = store.beginTransaction(true, deadline)) {
      EntityRecord root = getExistingNamespace(tx, rootId);
      NamespaceTreeNode rootNode = buildNode(tx, root);
      tx.commit();
      metrics.incNumHierarchyReads();
      return new NamespaceTree(rootNode);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "Get hierarchy",
          rootId);
    }
  }

  /**
   * Fetches the direct children of a namespace once, derives its available
   * capacity from them, and recurses into the child namespaces.
   */
  private NamespaceTreeNode buildNode(EntityGraphTransaction tx,
      EntityRecord namespace) throws IOException {
    List<EntityRecord> children = tx.getDirectChildren(namespace.getId());
    List<ResourceQuotas> childTotals = new ArrayList<>(children.size());
    List<AppInfo> apps = new ArrayList<>();
    List<NamespaceTreeNode> childNodes = new ArrayList<>();
    for (EntityRecord child : children) {
      childTotals.add(child.getQuotas());
      if (child.getType() == EntityType.APP) {
        apps.add(codec.toApp(child));
      } else {
        childNodes.add(buildNode(tx, child));
      }
    }
    ResourceQuotas available =
        QuotaArithmetic.computeAvailable(namespace.getQuotas(), childTotals);
    return new NamespaceTreeNode(codec.toNamespace(namespace, available),
        apps, childNodes);
  }

  @Override
  public void removeNamespace(String namespaceId, Deadline deadline)
      throws IOException {
    Objects.requireNonNull(namespaceId, "namespaceId == null");
    List<String> lockIds =
        EntityLocks.entityAndParent(store, namespaceId, deadline);
    lock.acquireWriteLocks(lockIds, deadline);
    try (EntityGraphTransaction tx = store.beginTransaction(false, deadline)) {
      getExistingNamespace(tx, namespaceId);
      tx.deleteEntitySubgraph(namespaceId);
      tx.commit();
      metrics.incNumNamespaceRemoves();
      LOG.debug("removed namespace:{}", namespaceId);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "Namespace removal",
          namespaceId);
    } finally {
      lock.releaseWriteLocks(lockIds);
    }
  }

  private static EntityRecord getExistingNamespace(EntityGraphTransaction tx,
      String namespaceId) throws IOException {
    Optional<EntityRecord> record = tx.getEntity(namespaceId);
    if (!record.isPresent() || record.get().getType() != EntityType.NAMESPACE) {
      LOG.debug("namespace:{} does not exist", namespaceId);
      throw new MeridianException("Namespace " + namespaceId
          + " is not found", ResultCodes.ENTITY_NOT_FOUND);
    }
    return record.get();
  }
}

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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.helpers.EntityType;
import org.apache.meridian.helpers.MeridianIds;
import org.apache.meridian.manager.graph.EntityGraphStore;
import org.apache.meridian.manager.graph.EntityGraphTransaction;
import org.apache.meridian.manager.graph.EntityRecord;
import org.apache.meridian.manager.lock.MeridianLock;
import org.apache.meridian.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * App manager backed by the entity graph.
 */
public class AppManagerImpl implements AppManager {
  private static final Logger LOG =
      LoggerFactory.getLogger(AppManagerImpl.class);

  private final EntityGraphStore store;
  private final MeridianLock lock;
  private final ResourceQuotaManager quotaManager;
  private final EntityRecordCodec codec;
  private final MeridianMetrics metrics;

  public AppManagerImpl(EntityGraphStore store, MeridianLock lock,
      ResourceQuotaManager quotaManager, EntityRecordCodec codec,
      MeridianMetrics metrics) {
    this.store = store;
    this.lock = lock;
    this.quotaManager = quotaManager;
    this.codec = codec;
    this.metrics = metrics;
  }

  @Override
  public void addApp(AppInfo app, Deadline deadline) throws IOException {
    Preconditions.checkNotNull(app);
    MeridianIds.checkSegment("org id", app.getOrgId());
    MeridianIds.checkSegment("namespace name", app.getNamespaceName());
    MeridianIds.checkSegment("app name", app.getName());
    String appId = app.getId();
    String namespaceId = app.getNamespaceId();

    List<String> lockIds = Arrays.asList(appId, namespaceId);
    lock.acquireWriteLocks(lockIds, deadline);
    try (EntityGraphTransaction tx = store.beginTransaction(false, deadline)) {
      if (tx.exists(appId)) {
        LOG.debug("app:{} already exists", appId);
        throw new MeridianException("App " + appId + " already exists",
            ResultCodes.ENTITY_ALREADY_EXISTS);
      }
      requireNamespace(tx, namespaceId);
      tx.createEntity(codec.toRecord(app));
      tx.createEdge(namespaceId, appId);
      quotaManager.setResourceQuotasInTransaction(tx, appId,
          app.getTotalQuotas().toKeyMap());
      tx.commit();
      metrics.incNumAppAdds();
      LOG.debug("created app:{}", appId);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "App creation", appId);
    } finally {
      lock.releaseWriteLocks(lockIds);
    }
  }

  @Override
  public AppInfo getApp(String appId, Deadline deadline) throws IOException {
    Objects.requireNonNull(appId, "appId == null");
    try (EntityGraphTransaction tx = store.beginTransaction(true, deadline)) {
      EntityRecord record = getExistingApp(tx, appId);
      tx.commit();
      return codec.toApp(record);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "Get app", appId);
    }
  }

  @Override
  public List<AppInfo> listApps(String namespaceId, Deadline deadline)
      throws IOException {
    Objects.requireNonNull(namespaceId, "namespaceId == null");
    try (EntityGraphTransaction tx = store.beginTransaction(true, deadline)) {
      requireNamespace(tx, namespaceId);
      List<AppInfo> apps = new ArrayList<>();
      for (EntityRecord child : tx.getDirectChildren(namespaceId)) {
        if (child.getType() == EntityType.APP) {
          apps.add(codec.toApp(child));
        }
      }
      tx.commit();
      return apps;
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "List apps",
          namespaceId);
    }
  }

  @Override
  public void removeApp(String appId, Deadline deadline) throws IOException {
    Objects.requireNonNull(appId, "appId == null");
    List<String> lockIds = EntityLocks.entityAndParent(store, appId, deadline);
    lock.acquireWriteLocks(lockIds, deadline);
    try (EntityGraphTransaction tx = store.beginTransaction(false, deadline)) {
      getExistingApp(tx, appId);
      tx.deleteEntitySubgraph(appId);
      tx.commit();
      metrics.incNumAppRemoves();
      LOG.debug("removed app:{}", appId);
    } catch (IOException ex) {
      throw StoreFailures.translate(LOG, metrics, ex, "App removal", appId);
    } finally {
      lock.releaseWriteLocks(lockIds);
    }
  }

  private static void requireNamespace(EntityGraphTransaction tx,
      String namespaceId) throws IOException {
    Optional<EntityRecord> record = tx.getEntity(namespaceId);
    if (!record.isPresent() || record.get().getType() != EntityType.NAMESPACE) {
      LOG.debug("namespace:{} does not exist", namespaceId);
      throw new MeridianException("Namespace " + namespaceId
          + " is not found", ResultCodes.ENTITY_NOT_FOUND);
    }
  }

  private static EntityRecord getExistingApp(EntityGraphTransaction tx,
      String appId) throws IOException {
    Optional<EntityRecord> record = tx.getEntity(appId);
    if (!record.isPresent() || record.get().getType() != EntityType.APP) {
      LOG.debug("app:{} does not exist", appId);
      throw new MeridianException("App " + appId + " is not found",
          ResultCodes.ENTITY_NOT_FOUND);
    }
    return record.get();
  }
}

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

import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_GRAPH_STORE_IMPL_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_MANAGER_LOCK_STRIPES_DEFAULT;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_MANAGER_LOCK_STRIPES_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_MANAGER_LOCK_TIMEOUT_DEFAULT;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_MANAGER_LOCK_TIMEOUT_KEY;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;
import org.apache.meridian.conf.MeridianConfiguration;
import org.apache.meridian.manager.graph.EntityGraphStore;
import org.apache.meridian.manager.graph.InMemoryEntityGraphStore;
import org.apache.meridian.manager.lock.MeridianLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the graph store and the managers built on it.
 * <p>
 * Nothing is shared between instances apart from the metrics source, so
 * only one manager may be running per JVM at a time.
 */
public class MeridianManager {
  private static final Logger LOG =
      LoggerFactory.getLogger(MeridianManager.class);

  private final MeridianConfiguration conf;
  private final EntityGraphStore store;
  private final MeridianLock lock;
  private final EntityRecordCodec codec;
  private final ResourceQuotaManager resourceQuotaManager;
  private final NamespaceManager namespaceManager;
  private final AppManager appManager;
  private MeridianMetrics metrics;
  private volatile boolean running;

  public MeridianManager(Configuration configuration) {
    this(MeridianConfiguration.of(configuration),
        createGraphStore(configuration));
  }

  @VisibleForTesting
  MeridianManager(MeridianConfiguration conf, EntityGraphStore store) {
    this.conf = conf;
    this.store = store;
    int stripes = conf.getInt(MERIDIAN_MANAGER_LOCK_STRIPES_KEY,
        MERIDIAN_MANAGER_LOCK_STRIPES_DEFAULT);
    long lockTimeoutMs = conf.getTimeDuration(
        MERIDIAN_MANAGER_LOCK_TIMEOUT_KEY,
        MERIDIAN_MANAGER_LOCK_TIMEOUT_DEFAULT, TimeUnit.MILLISECONDS);
    this.lock = new MeridianLock(stripes, lockTimeoutMs,
        TimeUnit.MILLISECONDS);
    this.metrics = MeridianMetrics.create();
    this.codec = new EntityRecordCodec();
    this.resourceQuotaManager =
        new ResourceQuotaManagerImpl(store, lock, metrics);
    this.namespaceManager = new NamespaceManagerImpl(store, lock,
        resourceQuotaManager, codec, metrics);
    this.appManager = new AppManagerImpl(store, lock, resourceQuotaManager,
        codec, metrics);
  }

  private static EntityGraphStore createGraphStore(Configuration conf) {
    Class<? extends EntityGraphStore> storeClass = conf.getClass(
        MERIDIAN_GRAPH_STORE_IMPL_KEY, InMemoryEntityGraphStore.class,
        EntityGraphStore.class);
    LOG.info("Using entity graph store {}", storeClass.getName());
    return ReflectionUtils.newInstance(storeClass, conf);
  }

  public void start() throws IOException {
    if (running) {
      return;
    }
    store.start();
    running = true;
    LOG.info("Meridian manager started");
  }

  /**
   * Closes the store and removes the metrics source. A stopped manager
   * cannot be restarted.
   */
  public void stop() {
    if (metrics == null) {
      return;
    }
    running = false;
    try {
      store.close();
    } catch (IOException e) {
      LOG.warn("Failed to close the entity graph store", e);
    }
    metrics.unRegister();
    metrics = null;
    LOG.info("Meridian manager stopped");
  }

  public boolean isRunning() {
    return running;
  }

  public MeridianConfiguration getConfiguration() {
    return conf;
  }

  public EntityGraphStore getGraphStore() {
    return store;
  }

  public MeridianLock getLock() {
    return lock;
  }

  public MeridianMetrics getMetrics() {
    return metrics;
  }

  public ResourceQuotaManager getResourceQuotaManager() {
    return resourceQuotaManager;
  }

  public NamespaceManager getNamespaceManager() {
    return namespaceManager;
  }

  public AppManager getAppManager() {
    return appManager;
  }
}

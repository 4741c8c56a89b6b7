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

import static org.apache.meridian.MeridianConsts.SHUTDOWN_HOOK_PRIORITY;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.apache.hadoop.util.ShutdownHookManager;
import org.apache.hadoop.util.StringUtils;
import org.apache.meridian.conf.MeridianConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: starts a {@link MeridianManager} from the site
 * configuration and stops it when the JVM shuts down.
 */
public class MeridianManagerStarter {
  private static final Logger LOG =
      LoggerFactory.getLogger(MeridianManagerStarter.class);

  private final MeridianConfiguration conf;
  private final CountDownLatch stopped = new CountDownLatch(1);
  private final Runnable shutdownHook = this::stop;
  private MeridianManager manager;

  public static void main(String[] args) throws Exception {
    StringUtils.startupShutdownMessage(MeridianManager.class, args, LOG);
    MeridianManagerStarter starter =
        new MeridianManagerStarter(new MeridianConfiguration());
    try {
      starter.start();
    } catch (IOException ex) {
      LOG.error("Meridian manager start failed with exception", ex);
      throw ex;
    }
    starter.join();
  }

  public MeridianManagerStarter(MeridianConfiguration conf) {
    this.conf = conf;
  }

  public synchronized void start() throws IOException {
    if (manager != null) {
      return;
    }
    MeridianManager created = new MeridianManager(conf);
    try {
      created.start();
    } catch (IOException ex) {
      created.stop();
      throw ex;
    }
    manager = created;
    ShutdownHookManager.get().addShutdownHook(shutdownHook,
        SHUTDOWN_HOOK_PRIORITY);
  }

  /**
   * @return false if the manager was never started or is already stopped
   */
  public synchronized boolean stop() {
    if (manager == null || !manager.isRunning()) {
      return false;
    }
    try {
      manager.stop();
    } catch (RuntimeException ex) {
      LOG.error("Error during stop Meridian manager.", ex);
    }
    ShutdownHookManager hooks = ShutdownHookManager.get();
    if (!hooks.isShutdownInProgress()) {
      hooks.removeShutdownHook(shutdownHook);
    }
    stopped.countDown();
    return true;
  }

  /**
   * Blocks until {@link #stop()} has run.
   */
  public void join() throws InterruptedException {
    stopped.await();
  }

  public boolean join(long timeout, TimeUnit unit)
      throws InterruptedException {
    return stopped.await(timeout, unit);
  }

  public synchronized MeridianManager getManager() {
    return manager;
  }

  @VisibleForTesting
  Runnable getShutdownHook() {
    return shutdownHook;
  }
}

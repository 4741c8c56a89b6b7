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

import com.google.common.annotations.VisibleForTesting;
import org.apache.hadoop.metrics2.MetricsSystem;
import org.apache.hadoop.metrics2.annotation.Metric;
import org.apache.hadoop.metrics2.annotation.Metrics;
import org.apache.hadoop.metrics2.lib.DefaultMetricsSystem;
import org.apache.hadoop.metrics2.lib.MutableCounterLong;

/**
 * This class is for maintaining Meridian manager statistics.
 */
@Metrics(about = "Meridian Manager Metrics", context = "meridian")
public class MeridianMetrics {
  private static final String SOURCE_NAME =
      MeridianMetrics.class.getSimpleName();

  // topology op metrics
  private @Metric MutableCounterLong numNamespaceAdds;
  private @Metric MutableCounterLong numNamespaceRemoves;
  private @Metric MutableCounterLong numAppAdds;
  private @Metric MutableCounterLong numAppRemoves;
  private @Metric MutableCounterLong numHierarchyReads;

  // quota op metrics
  private @Metric MutableCounterLong numQuotaUpdates;
  private @Metric MutableCounterLong numQuotaRejections;

  // failures
  private @Metric MutableCounterLong numStoreFailures;

  public MeridianMetrics() {
  }

  public static MeridianMetrics create() {
    MetricsSystem ms = DefaultMetricsSystem.instance();
    return ms.register(SOURCE_NAME,
        "Meridian Manager Metrics",
        new MeridianMetrics());
  }

  public void incNumNamespaceAdds() {
    numNamespaceAdds.incr();
  }

  public void incNumNamespaceRemoves() {
    numNamespaceRemoves.incr();
  }

  public void incNumAppAdds() {
    numAppAdds.incr();
  }

  public void incNumAppRemoves() {
    numAppRemoves.incr();
  }

  public void incNumHierarchyReads() {
    numHierarchyReads.incr();
  }

  public void incNumQuotaUpdates() {
    numQuotaUpdates.incr();
  }

  public void incNumQuotaRejections() {
    numQuotaRejections.incr();
  }

  public void incNumStoreFailures() {
    numStoreFailures.incr();
  }

  @VisibleForTesting
  public long getNumNamespaceAdds() {
    return numNamespaceAdds.value();
  }

  @VisibleForTesting
  public long getNumNamespaceRemoves() {
    return numNamespaceRemoves.value();
  }

  @VisibleForTesting
  public long getNumAppAdds() {
    return numAppAdds.value();
  }

  @VisibleForTesting
  public long getNumAppRemoves() {
    return numAppRemoves.value();
  }

  @VisibleForTesting
  public long getNumHierarchyReads() {
    return numHierarchyReads.value();
  }

  @VisibleForTesting
  public long getNumQuotaUpdates() {
    return numQuotaUpdates.value();
  }

  @VisibleForTesting
  public long getNumQuotaRejections() {
    return numQuotaRejections.value();
  }

  @VisibleForTesting
  public long getNumStoreFailures() {
    return numStoreFailures.value();
  }

  public void unRegister() {
    MetricsSystem ms = DefaultMetricsSystem.instance();
    ms.unregisterSource(SOURCE_NAME);
  }
}

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

package org.apache.meridian.manager.lock;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Striped;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-entity exclusive lock held by topology and quota mutations. Reads
 * take no entity lock; they rely on the store's transaction isolation.
 * <p>
 * Ids map onto a fixed set of reentrant stripes. Multiple ids are always
 * locked in stripe order, so two callers locking overlapping id sets cannot
 * deadlock. Every acquire must be paired with the matching release for the
 * same ids, in a finally block:
 * <pre>
 *   lock.acquireWriteLocks(ids, deadline);
 *   try {
 *     ...
 *   } finally {
 *     lock.releaseWriteLocks(ids);
 *   }
 * </pre>
 */
public class MeridianLock {
  private static final Logger LOG = LoggerFactory.getLogger(MeridianLock.class);

  private final Striped<Lock> stripes;
  private final long timeoutNanos;

  public MeridianLock(int stripeCount, long timeout, TimeUnit unit) {
    Preconditions.checkArgument(stripeCount > 0,
        "stripe count must be positive: %s", stripeCount);
    Preconditions.checkArgument(timeout > 0,
        "lock timeout must be positive: %s", timeout);
    this.stripes = Striped.lock(stripeCount);
    this.timeoutNanos = unit.toNanos(timeout);
  }

  public void acquireWriteLocks(Collection<String> ids, Deadline deadline)
      throws MeridianException {
    Preconditions.checkNotNull(deadline, "deadline == null");
    deadline.check("acquiring lock on " + ids);
    List<Lock> held = new ArrayList<>();
    try {
      for (Lock lock : stripes.bulkGet(ids)) {
        long wait = Math.min(timeoutNanos,
            deadline.remaining(TimeUnit.NANOSECONDS));
        if (!lock.tryLock(wait, TimeUnit.NANOSECONDS)) {
          throw lockFailure(ids, deadline);
        }
        held.add(lock);
      }
      LOG.trace("Acquired lock on {}", ids);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      unlockAll(held);
      throw new MeridianException("interrupted acquiring lock on " + ids, e,
          ResultCodes.CANCELLED);
    } catch (MeridianException e) {
      unlockAll(held);
      throw e;
    }
  }

  public void releaseWriteLocks(Collection<String> ids) {
    unlockAll(Lists.newArrayList(stripes.bulkGet(ids)));
  }

  private static MeridianException lockFailure(Collection<String> ids,
      Deadline deadline) {
    if (deadline.isExpired()) {
      return new MeridianException("deadline exceeded acquiring lock on "
          + ids, ResultCodes.DEADLINE_EXCEEDED);
    }
    return new MeridianException("timed out acquiring lock on " + ids,
        ResultCodes.TIMEOUT);
  }

  private static void unlockAll(List<Lock> locks) {
    for (int i = locks.size() - 1; i >= 0; i--) {
      locks.get(i).unlock();
    }
  }

  @VisibleForTesting
  int getStripeCount() {
    return stripes.size();
  }
}

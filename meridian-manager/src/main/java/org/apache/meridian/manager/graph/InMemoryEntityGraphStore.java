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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entity graph kept on the heap.
 * <p>
 * A write transaction holds the store's write lock from begin to
 * commit or rollback, applies its changes in place and records how to undo
 * them. A read transaction holds the read lock, so it sees no writes at all
 * while it is open. Locks belong to the thread that began the transaction.
 */
public class InMemoryEntityGraphStore implements EntityGraphStore {
  private static final Logger LOG =
      LoggerFactory.getLogger(InMemoryEntityGraphStore.class);

  private final ReentrantReadWriteLock storeLock =
      new ReentrantReadWriteLock(true);
  private final Map<String, EntityRecord> entities = new HashMap<>();
  private final ChildEdges edges = new ChildEdges();
  private final AtomicLong txIds = new AtomicLong();
  private volatile boolean started;
  private volatile boolean closed;

  @Override
  public void start() throws IOException {
    if (closed) {
      throw new MeridianException("graph store is closed",
          ResultCodes.STORE_UNAVAILABLE);
    }
    started = true;
    LOG.info("Started in-memory entity graph store");
  }

  @Override
  public EntityGraphTransaction beginTransaction(boolean readOnly,
      Deadline deadline) throws IOException {
    Preconditions.checkNotNull(deadline, "deadline == null");
    checkOpen();
    deadline.check("begin transaction");
    Lock lock = readOnly ? storeLock.readLock() : storeLock.writeLock();
    acquire(lock, deadline);
    long txId = txIds.incrementAndGet();
    LOG.trace("Began {} transaction {}", readOnly ? "read" : "write", txId);
    return new Transaction(txId, readOnly, deadline, lock);
  }

  private static void acquire(Lock lock, Deadline deadline)
      throws MeridianException {
    try {
      if (!deadline.isBounded()) {
        lock.lockInterruptibly();
        return;
      }
      if (!lock.tryLock(deadline.remaining(TimeUnit.NANOSECONDS),
          TimeUnit.NANOSECONDS)) {
        throw new MeridianException(
            "deadline exceeded waiting for the graph store",
            ResultCodes.DEADLINE_EXCEEDED);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MeridianException("interrupted waiting for the graph store",
          e, ResultCodes.CANCELLED);
    }
  }

  private void checkOpen() throws MeridianException {
    if (closed || !started) {
      throw new MeridianException("graph store is not running",
          ResultCodes.STORE_UNAVAILABLE);
    }
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    closed = true;
    LOG.info("Closed in-memory entity graph store");
  }

  @VisibleForTesting
  int getEntityCount() {
    storeLock.readLock().lock();
    try {
      return entities.size();
    } finally {
      storeLock.readLock().unlock();
    }
  }

  @VisibleForTesting
  int getEdgeCount() {
    storeLock.readLock().lock();
    try {
      return edges.size();
    } finally {
      storeLock.readLock().unlock();
    }
  }

  /**
   * Transaction bound to the thread that began it.
   */
  private final class Transaction implements EntityGraphTransaction {
    private final long txId;
    private final boolean readOnly;
    private final Deadline deadline;
    private final Lock lock;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private boolean finished;

    Transaction(long txId, boolean readOnly, Deadline deadline, Lock lock) {
      this.txId = txId;
      this.readOnly = readOnly;
      this.deadline = deadline;
      this.lock = lock;
    }

    @Override
    public boolean isReadOnly() {
      return readOnly;
    }

    private void checkUsable(String operation) throws IOException {
      if (finished) {
        throw new IllegalStateException("transaction " + txId
            + " already finished");
      }
      if (closed) {
        throw new MeridianException("graph store closed during "
            + operation, ResultCodes.STORE_UNAVAILABLE);
      }
      deadline.check(operation);
    }

    private void checkWritable(String operation) throws IOException {
      checkUsable(operation);
      if (readOnly) {
        throw new IllegalStateException(operation
            + " in read-only transaction " + txId);
      }
    }

    private EntityRecord require(String id) throws MeridianException {
      EntityRecord record = entities.get(id);
      if (record == null) {
        throw new MeridianException("entity " + id + " not found",
            ResultCodes.ENTITY_NOT_FOUND);
      }
      return record;
    }

    @Override
    public Optional<EntityRecord> getEntity(String id) throws IOException {
      checkUsable("getEntity");
      return Optional.ofNullable(entities.get(id));
    }

    @Override
    public List<EntityRecord> getDirectChildren(String id)
        throws IOException {
      checkUsable("getDirectChildren");
      List<EntityRecord> children = new ArrayList<>();
      for (String childId : edges.childrenOf(id)) {
        children.add(entities.get(childId));
      }
      return children;
    }

    @Override
    public Optional<EntityRecord> getParent(String id) throws IOException {
      checkUsable("getParent");
      String parentId = edges.parentOf(id);
      return parentId == null ? Optional.empty()
          : Optional.ofNullable(entities.get(parentId));
    }

    @Override
    public void createEntity(EntityRecord record) throws IOException {
      checkWritable("createEntity");
      String id = record.getId();
      if (entities.containsKey(id)) {
        throw new MeridianException("entity " + id + " already exists",
            ResultCodes.ENTITY_ALREADY_EXISTS);
      }
      entities.put(id, record);
      undoLog.push(() -> entities.remove(id));
    }

    @Override
    public void createEdge(String parentId, String childId)
        throws IOException {
      checkWritable("createEdge");
      EntityRecord parent = require(parentId);
      require(childId);
      if (!parent.getType().canHaveChildren()) {
        throw new MeridianException(parent.getType() + " " + parentId
            + " cannot have children", ResultCodes.INVALID_REQUEST);
      }
      String existing = edges.parentOf(childId);
      if (existing != null) {
        throw new MeridianException("entity " + childId
            + " already has parent " + existing, ResultCodes.INVALID_REQUEST);
      }
      edges.link(parentId, childId);
      undoLog.push(() -> edges.unlink(parentId, childId));
    }

    @Override
    public void putQuotas(String id, ResourceQuotas quotas)
        throws IOException {
      checkWritable("putQuotas");
      EntityRecord before = require(id);
      entities.put(id, before.withQuotas(quotas));
      undoLog.push(() -> entities.put(id, before));
    }

    @Override
    public void deleteEntitySubgraph(String id) throws IOException {
      checkWritable("deleteEntitySubgraph");
      EntityRecord before = require(id);
      List<String[]> removedEdges = edges.detach(id);
      entities.remove(id);
      undoLog.push(() -> {
        entities.put(id, before);
        for (String[] edge : removedEdges) {
          edges.link(edge[0], edge[1]);
        }
      });
    }

    @Override
    public void commit() throws IOException {
      if (finished) {
        throw new IllegalStateException("transaction " + txId
            + " already finished");
      }
      try {
        checkUsable("commit");
      } catch (IOException e) {
        rollback();
        throw e;
      }
      undoLog.clear();
      finish();
      LOG.trace("Committed transaction {}", txId);
    }

    @Override
    public void rollback() {
      if (finished) {
        return;
      }
      while (!undoLog.isEmpty()) {
        undoLog.pop().run();
      }
      finish();
      LOG.trace("Rolled back transaction {}", txId);
    }

    private void finish() {
      finished = true;
      lock.unlock();
    }

    @Override
    public void close() {
      rollback();
    }
  }
}

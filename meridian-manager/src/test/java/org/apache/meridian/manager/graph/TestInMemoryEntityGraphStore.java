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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.EntityType;
import org.apache.meridian.helpers.ResourceKind;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.util.Deadline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link InMemoryEntityGraphStore}.
 */
public class TestInMemoryEntityGraphStore {

  private InMemoryEntityGraphStore store;

  @BeforeEach
  public void setup() throws Exception {
    store = new InMemoryEntityGraphStore();
    store.start();
  }

  @AfterEach
  public void cleanup() {
    store.close();
  }

  private static EntityRecord record(String id, EntityType type) {
    return new EntityRecord(id, type, Collections.emptyMap(),
        ResourceQuotas.empty());
  }

  private EntityGraphTransaction write() throws Exception {
    return store.beginTransaction(false, Deadline.none());
  }

  private EntityGraphTransaction read() throws Exception {
    return store.beginTransaction(true, Deadline.none());
  }

  private void createTree() throws Exception {
    try (EntityGraphTransaction tx = write()) {
      tx.createEntity(record("acme/default", EntityType.NAMESPACE));
      tx.createEntity(record("acme/prod", EntityType.NAMESPACE));
      tx.createEntity(record("acme/prod/web", EntityType.APP));
      tx.createEdge("acme/default", "acme/prod");
      tx.createEdge("acme/prod", "acme/prod/web");
      tx.commit();
    }
  }

  @Test
  public void testChildRelationReadBothWays() throws Exception {
    createTree();

    try (EntityGraphTransaction tx = read()) {
      assertThat(tx.getDirectChildren("acme/default"))
          .extracting(EntityRecord::getId).containsExactly("acme/prod");
      assertEquals("acme/prod", tx.getParent("acme/prod/web").get().getId());
      assertFalse(tx.getParent("acme/default").isPresent());
      assertTrue(tx.getDirectChildren("acme/prod/web").isEmpty());
      tx.commit();
    }
    assertEquals(3, store.getEntityCount());
    assertEquals(2, store.getEdgeCount());
  }

  @Test
  public void testCloseWithoutCommitRollsBack() throws Exception {
    try (EntityGraphTransaction tx = write()) {
      tx.createEntity(record("acme/default", EntityType.NAMESPACE));
      tx.createEntity(record("acme/prod", EntityType.NAMESPACE));
      tx.createEdge("acme/default", "acme/prod");
    }
    assertEquals(0, store.getEntityCount());
    assertEquals(0, store.getEdgeCount());
  }

  @Test
  public void testRollbackRestoresQuotasAndDeletedEntities() throws Exception {
    createTree();
    ResourceQuotas mem = ResourceQuotas.newBuilder()
        .set(ResourceKind.MEM, 10).build();

    try (EntityGraphTransaction tx = write()) {
      tx.putQuotas("acme/prod", mem);
      assertEquals(mem, tx.getEntity("acme/prod").get().getQuotas());
      tx.deleteEntitySubgraph("acme/prod");
      assertFalse(tx.exists("acme/prod"));
      tx.rollback();
    }

    try (EntityGraphTransaction tx = read()) {
      EntityRecord prod = tx.getEntity("acme/prod").get();
      assertTrue(prod.getQuotas().isEmpty());
      assertEquals("acme/default", tx.getParent("acme/prod").get().getId());
      assertThat(tx.getDirectChildren("acme/prod"))
          .extracting(EntityRecord::getId).containsExactly("acme/prod/web");
    }
  }

  @Test
  public void testDeleteDetachesChildren() throws Exception {
    createTree();
    try (EntityGraphTransaction tx = write()) {
      tx.deleteEntitySubgraph("acme/prod");
      tx.commit();
    }
    try (EntityGraphTransaction tx = read()) {
      assertFalse(tx.exists("acme/prod"));
      assertTrue(tx.exists("acme/prod/web"));
      assertFalse(tx.getParent("acme/prod/web").isPresent());
      assertTrue(tx.getDirectChildren("acme/default").isEmpty());
    }
  }

  @Test
  public void testInvalidWrites() throws Exception {
    createTree();
    try (EntityGraphTransaction tx = write()) {
      MeridianException ex = assertThrows(MeridianException.class,
          () -> tx.createEntity(record("acme/prod", EntityType.NAMESPACE)));
      assertEquals(ResultCodes.ENTITY_ALREADY_EXISTS, ex.getResult());

      tx.createEntity(record("acme/dev", EntityType.NAMESPACE));
      ex = assertThrows(MeridianException.class,
          () -> tx.createEdge("acme/prod/web", "acme/dev"));
      assertEquals(ResultCodes.INVALID_REQUEST, ex.getResult());

      ex = assertThrows(MeridianException.class,
          () -> tx.createEdge("acme/dev", "acme/prod"));
      assertEquals(ResultCodes.INVALID_REQUEST, ex.getResult());

      ex = assertThrows(MeridianException.class,
          () -> tx.putQuotas("acme/missing", ResourceQuotas.empty()));
      assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
    }
  }

  @Test
  public void testReadOnlyTransactionRejectsWrites() throws Exception {
    try (EntityGraphTransaction tx = read()) {
      assertTrue(tx.isReadOnly());
      assertThrows(IllegalStateException.class,
          () -> tx.createEntity(record("acme/x", EntityType.NAMESPACE)));
    }
  }

  @Test
  public void testCancelledDeadlineCommitsNothing() throws Exception {
    Deadline deadline = Deadline.none();
    EntityGraphTransaction tx = store.beginTransaction(false, deadline);
    tx.createEntity(record("acme/default", EntityType.NAMESPACE));
    deadline.cancel();

    MeridianException ex =
        assertThrows(MeridianException.class, tx::commit);
    assertEquals(ResultCodes.CANCELLED, ex.getResult());
    tx.close();
    assertEquals(0, store.getEntityCount());
  }

  @Test
  public void testReaderWaitsForWriterUntilDeadline() throws Exception {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try (EntityGraphTransaction tx = write()) {
      tx.createEntity(record("acme/default", EntityType.NAMESPACE));
      Future<?> reader = executor.submit(() -> {
        store.beginTransaction(true,
            Deadline.after(100, TimeUnit.MILLISECONDS)).close();
        return null;
      });
      ExecutionException ex =
          assertThrows(ExecutionException.class, reader::get);
      assertThat(ex.getCause()).isInstanceOf(MeridianException.class);
      assertEquals(ResultCodes.DEADLINE_EXCEEDED,
          ((MeridianException) ex.getCause()).getResult());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  public void testStoreMustBeRunning() {
    InMemoryEntityGraphStore notStarted = new InMemoryEntityGraphStore();
    MeridianException ex = assertThrows(MeridianException.class,
        () -> notStarted.beginTransaction(true, Deadline.none()));
    assertEquals(ResultCodes.STORE_UNAVAILABLE, ex.getResult());
  }
}

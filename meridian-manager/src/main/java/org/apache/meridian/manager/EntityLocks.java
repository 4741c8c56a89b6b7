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
import java.util.Optional;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.manager.graph.EntityGraphStore;
import org.apache.meridian.manager.graph.EntityGraphTransaction;
import org.apache.meridian.manager.graph.EntityRecord;
import org.apache.meridian.util.Deadline;

/**
 * Works out which ids a mutation of an existing entity has to lock.
 */
public final class EntityLocks {

  private EntityLocks() {
  }

  /**
   * @return the entity id followed by its parent id, if it has a parent.
   * An absent entity yields just its own id; the mutation reports it.
   */
  public static List<String> entityAndParent(EntityGraphStore store,
      String entityId, Deadline deadline) throws IOException {
    List<String> ids = new ArrayList<>(2);
    ids.add(entityId);
    try (EntityGraphTransaction tx =
             store.beginTransaction(true, deadline)) {
      Optional<EntityRecord> parent = tx.getParent(entityId);
      parent.ifPresent(p -> ids.add(p.getId()));
      tx.commit();
    } catch (MeridianException e) {
      throw e;
    } catch (IOException e) {
      throw new MeridianException("failed to look up the parent of "
          + entityId, e, ResultCodes.STORE_UNAVAILABLE);
    }
    return ids;
  }
}

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

import java.io.Closeable;
import java.io.IOException;
import org.apache.meridian.util.Deadline;

/**
 * Persistent store of namespaces and apps connected by CHILD edges.
 * <p>
 * All access goes through transactions. Implementations must isolate a
 * write transaction from every other transaction touching the same
 * entities, and must give a read transaction one consistent view for its
 * whole duration.
 */
public interface EntityGraphStore extends Closeable {

  /**
   * Opens the store. Called once before the first transaction.
   */
  void start() throws IOException;

  /**
   * Begins a transaction. The transaction fails every later call, and is
   * never committed, once {@code deadline} expires or is cancelled.
   *
   * @param readOnly true if the transaction will not write
   * @param deadline caller deadline, also bounding the wait for the store
   */
  EntityGraphTransaction beginTransaction(boolean readOnly, Deadline deadline)
      throws IOException;

  boolean isClosed();
}

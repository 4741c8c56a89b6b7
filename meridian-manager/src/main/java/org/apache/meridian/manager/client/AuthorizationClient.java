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

package org.apache.meridian.manager.client;

import java.io.IOException;
import java.util.Objects;

/**
 * Client of the authorization service.
 */
public interface AuthorizationClient {

  /**
   * Records that permissions on {@code from} are inherited by {@code to}.
   */
  void createInheritanceRelation(Resource from, Resource to)
      throws IOException;

  /**
   * A resource as the authorization service names it.
   */
  final class Resource {
    private final String id;
    private final String kind;

    public Resource(String id, String kind) {
      this.id = Objects.requireNonNull(id, "id == null");
      this.kind = Objects.requireNonNull(kind, "kind == null");
    }

    public String getId() {
      return id;
    }

    public String getKind() {
      return kind;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Resource that = (Resource) o;
      return id.equals(that.id) && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
      return Objects.hash(id, kind);
    }

    @Override
    public String toString() {
      return kind + ":" + id;
    }
  }
}

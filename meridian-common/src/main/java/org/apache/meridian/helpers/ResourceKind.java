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

package org.apache.meridian.helpers;

import java.util.Optional;

/**
 * Resource kinds that can carry a quota. The set is closed.
 */
public enum ResourceKind {
  MEM("mem"),
  CPU("cpu"),
  DISK("disk");

  private final String key;

  ResourceKind(String key) {
    this.key = key;
  }

  /**
   * @return the name used for this kind in requests and stored properties.
   */
  public String getKey() {
    return key;
  }

  public static Optional<ResourceKind> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    for (ResourceKind kind : values()) {
      if (kind.key.equals(key)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  public static boolean isSupported(String key) {
    return fromKey(key).isPresent();
  }

  @Override
  public String toString() {
    return key;
  }
}

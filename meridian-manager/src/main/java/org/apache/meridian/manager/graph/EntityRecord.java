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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.meridian.helpers.EntityType;
import org.apache.meridian.helpers.ResourceQuotas;

/**
 * A node of the entity graph: id, type, flat string properties and the
 * entity's own quota totals.
 */
public final class EntityRecord {
  private final String id;
  private final EntityType type;
  private final Map<String, String> properties;
  private final ResourceQuotas quotas;

  public EntityRecord(String id, EntityType type,
      Map<String, String> properties, ResourceQuotas quotas) {
    this.id = Objects.requireNonNull(id, "id == null");
    this.type = Objects.requireNonNull(type, "type == null");
    this.properties = Collections.unmodifiableMap(
        new LinkedHashMap<>(properties));
    this.quotas = Objects.requireNonNull(quotas, "quotas == null");
  }

  public String getId() {
    return id;
  }

  public EntityType getType() {
    return type;
  }

  public Map<String, String> getProperties() {
    return properties;
  }

  public String getProperty(String key) {
    return properties.get(key);
  }

  public ResourceQuotas getQuotas() {
    return quotas;
  }

  public EntityRecord withQuotas(ResourceQuotas newQuotas) {
    return new EntityRecord(id, type, properties, newQuotas);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    EntityRecord that = (EntityRecord) o;
    return id.equals(that.id) && type == that.type
        && properties.equals(that.properties) && quotas.equals(that.quotas);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, type, properties, quotas);
  }

  @Override
  public String toString() {
    return type + "[" + id + ", quotas=" + quotas + "]";
  }
}

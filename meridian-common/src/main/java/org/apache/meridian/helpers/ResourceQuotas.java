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

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;

/**
 * Immutable mapping from {@link ResourceKind} to a quantity.
 * <p>
 * Kinds that are not present read as zero. Totals coming from requests are
 * validated by {@link #fromRequest(Map)}; derived figures such as available
 * capacity are built with {@link #newBuilder()} and may be negative.
 */
public final class ResourceQuotas {

  private static final ResourceQuotas EMPTY =
      new ResourceQuotas(new EnumMap<>(ResourceKind.class));

  private final Map<ResourceKind, Double> quotas;

  private ResourceQuotas(EnumMap<ResourceKind, Double> quotas) {
    this.quotas = Collections.unmodifiableMap(quotas);
  }

  public static ResourceQuotas empty() {
    return EMPTY;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Converts a request keyed by resource name.
   *
   * @throws MeridianException UNSUPPORTED_RESOURCE_KIND for a name outside
   * the supported set, INVALID_QUOTA for a negative or non-finite value.
   */
  public static ResourceQuotas fromRequest(Map<String, Double> request)
      throws MeridianException {
    if (request == null || request.isEmpty()) {
      return EMPTY;
    }
    Builder builder = newBuilder();
    for (Map.Entry<String, Double> entry : request.entrySet()) {
      ResourceKind kind = ResourceKind.fromKey(entry.getKey())
          .orElseThrow(() -> new MeridianException(
              "quotas for a resource with name " + entry.getKey()
                  + " are not supported",
              ResultCodes.UNSUPPORTED_RESOURCE_KIND));
      checkQuantity(kind, entry.getValue());
      builder.set(kind, entry.getValue());
    }
    return builder.build();
  }

  /**
   * Rejects quantities that can never be a quota total.
   */
  public static void checkQuantity(ResourceKind kind, Double quantity)
      throws MeridianException {
    if (quantity == null || quantity.isNaN() || quantity.isInfinite()
        || quantity < 0) {
      throw new MeridianException("invalid quota " + quantity
          + " for the resource " + kind
          + ": quotas must be finite and non-negative",
          ResultCodes.INVALID_QUOTA);
    }
  }

  public double get(ResourceKind kind) {
    Double value = quotas.get(kind);
    return value == null ? 0 : value;
  }

  public boolean contains(ResourceKind kind) {
    return quotas.containsKey(kind);
  }

  public Set<ResourceKind> kinds() {
    return quotas.keySet();
  }

  public boolean isEmpty() {
    return quotas.isEmpty();
  }

  public Map<ResourceKind, Double> asMap() {
    return quotas;
  }

  /**
   * @return quotas keyed by resource name, in {@link ResourceKind} order.
   */
  public Map<String, Double> toKeyMap() {
    Map<String, Double> keyed = new LinkedHashMap<>();
    quotas.forEach((kind, value) -> keyed.put(kind.getKey(), value));
    return keyed;
  }

  /**
   * @return a copy of this mapping where every kind present in
   * {@code update} takes the updated value and every other kind is kept.
   */
  public ResourceQuotas overlay(ResourceQuotas update) {
    Objects.requireNonNull(update, "update == null");
    if (update.isEmpty()) {
      return this;
    }
    return newBuilder().setAll(this).setAll(update).build();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return quotas.equals(((ResourceQuotas) o).quotas);
  }

  @Override
  public int hashCode() {
    return quotas.hashCode();
  }

  @Override
  public String toString() {
    return toKeyMap().toString();
  }

  /**
   * Builder for {@link ResourceQuotas}.
   */
  public static final class Builder {
    private final EnumMap<ResourceKind, Double> quotas =
        new EnumMap<>(ResourceKind.class);

    private Builder() {
    }

    public Builder set(ResourceKind kind, double quantity) {
      Objects.requireNonNull(kind, "kind == null");
      quotas.put(kind, quantity);
      return this;
    }

    public Builder setAll(ResourceQuotas other) {
      quotas.putAll(other.quotas);
      return this;
    }

    public ResourceQuotas build() {
      if (quotas.isEmpty()) {
        return EMPTY;
      }
      return new ResourceQuotas(new EnumMap<>(quotas));
    }
  }
}

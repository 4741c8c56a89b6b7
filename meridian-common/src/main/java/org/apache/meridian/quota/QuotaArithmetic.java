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

package org.apache.meridian.quota;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.meridian.helpers.ResourceKind;
import org.apache.meridian.helpers.ResourceQuotas;

/**
 * Quota arithmetic shared by the quota store and the topology service.
 * <p>
 * All functions are pure. For an entity E:
 * <ul>
 *   <li>available(E) = total(E) - sum of the totals of E's direct
 *   children;</li>
 *   <li>utilized(E) = total(E) - available(E).</li>
 * </ul>
 * A kind that E has no quota for counts as zero, so a negative available
 * figure means children hold quota their parent never had. That is reported
 * as is, not clamped.
 */
public final class QuotaArithmetic {

  private QuotaArithmetic() {
  }

  /**
   * Computes available capacity for every supported kind.
   */
  public static ResourceQuotas computeAvailable(ResourceQuotas total,
      Collection<ResourceQuotas> childTotals) {
    Objects.requireNonNull(total, "total == null");
    Objects.requireNonNull(childTotals, "childTotals == null");
    ResourceQuotas.Builder available = ResourceQuotas.newBuilder();
    for (ResourceKind kind : ResourceKind.values()) {
      double assigned = 0;
      for (ResourceQuotas child : childTotals) {
        assigned += child.get(kind);
      }
      available.set(kind, total.get(kind) - assigned);
    }
    return available.build();
  }

  /**
   * Computes the part of {@code total} already handed to children.
   */
  public static ResourceQuotas computeUtilized(ResourceQuotas total,
      ResourceQuotas available) {
    Objects.requireNonNull(total, "total == null");
    Objects.requireNonNull(available, "available == null");
    ResourceQuotas.Builder utilized = ResourceQuotas.newBuilder();
    for (ResourceKind kind : ResourceKind.values()) {
      if (total.contains(kind) || available.contains(kind)) {
        utilized.set(kind, total.get(kind) - available.get(kind));
      }
    }
    return utilized.build();
  }

  /**
   * Decides whether {@code requested} may replace the entity's current
   * totals.
   * <p>
   * Every key is first checked against the supported kinds and for a valid
   * quantity. Then, per requested kind, the value must fit in what the
   * parent has left plus what the entity already holds, and must not drop
   * below what the entity's children use. Kinds not in the request are not
   * checked. Bounds are compared exactly: a request that fits only up to
   * floating-point rounding, such as 0.2 against 0.3 - 0.1, is rejected.
   *
   * @param requested requested totals keyed by resource name
   * @param selfTotal the entity's current totals
   * @param parentAvailable the parent's available capacity, or null for a
   *                        root, which skips the parent check
   * @param selfUtilized the amount the entity has assigned to its children
   * @return the first violation found, or empty if the request is admitted
   */
  public static Optional<QuotaViolation> validateAdmission(
      Map<String, Double> requested, ResourceQuotas selfTotal,
      ResourceQuotas parentAvailable, ResourceQuotas selfUtilized) {
    Objects.requireNonNull(requested, "requested == null");
    Objects.requireNonNull(selfTotal, "selfTotal == null");
    Objects.requireNonNull(selfUtilized, "selfUtilized == null");

    // sorted so a request with several problems is always reported the
    // same way; a null key sorts first and is reported as unsupported
    Map<String, Double> sorted = new TreeMap<>(
        Comparator.nullsFirst(Comparator.<String>naturalOrder()));
    sorted.putAll(requested);
    for (Map.Entry<String, Double> entry : sorted.entrySet()) {
      if (!ResourceKind.isSupported(entry.getKey())) {
        return Optional.of(QuotaViolation.unsupportedResource(
            entry.getKey(), entry.getValue()));
      }
      Double value = entry.getValue();
      if (value == null || value.isNaN() || value.isInfinite() || value < 0) {
        return Optional.of(
            QuotaViolation.invalidQuantity(entry.getKey(), value));
      }
    }

    for (Map.Entry<String, Double> entry : sorted.entrySet()) {
      ResourceKind kind = ResourceKind.fromKey(entry.getKey()).get();
      double quota = entry.getValue();
      if (parentAvailable != null) {
        double usable = parentAvailable.get(kind) + selfTotal.get(kind);
        if (quota > usable) {
          return Optional.of(QuotaViolation.exceedsParentCapacity(
              kind.getKey(), quota, usable));
        }
      }
      double utilized = selfUtilized.get(kind);
      if (quota < utilized) {
        return Optional.of(QuotaViolation.belowChildUtilization(
            kind.getKey(), quota, utilized));
      }
    }
    return Optional.empty();
  }
}

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

import java.util.Objects;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;

/**
 * Reason a requested quota was not admitted.
 */
public final class QuotaViolation {

  private final ResultCodes reason;
  private final String resource;
  private final Double requested;
  private final double limit;

  private QuotaViolation(ResultCodes reason, String resource,
      Double requested, double limit) {
    this.reason = reason;
    this.resource = resource;
    this.requested = requested;
    this.limit = limit;
  }

  static QuotaViolation unsupportedResource(String resource,
      Double requested) {
    return new QuotaViolation(ResultCodes.UNSUPPORTED_RESOURCE_KIND,
        resource, requested, 0);
  }

  static QuotaViolation invalidQuantity(String resource, Double requested) {
    return new QuotaViolation(ResultCodes.INVALID_QUOTA, resource,
        requested, 0);
  }

  static QuotaViolation exceedsParentCapacity(String resource,
      double requested, double available) {
    return new QuotaViolation(ResultCodes.EXCEEDS_PARENT_CAPACITY, resource,
        requested, available);
  }

  static QuotaViolation belowChildUtilization(String resource,
      double requested, double utilized) {
    return new QuotaViolation(ResultCodes.BELOW_CHILD_UTILIZATION, resource,
        requested, utilized);
  }

  public ResultCodes getReason() {
    return reason;
  }

  public String getResource() {
    return resource;
  }

  public Double getRequested() {
    return requested;
  }

  /**
   * @return the bound that was violated: the capacity usable from the
   * parent, or the amount already assigned to children.
   */
  public double getLimit() {
    return limit;
  }

  public String getMessage() {
    switch (reason) {
    case UNSUPPORTED_RESOURCE_KIND:
      return "quotas for a resource with name " + resource
          + " are not supported";
    case INVALID_QUOTA:
      return "invalid quota " + requested + " for the resource " + resource
          + ": quotas must be finite and non-negative";
    case EXCEEDS_PARENT_CAPACITY:
      return "requested " + requested + " quota for the resource " + resource
          + ", but only " + limit + " available in parent";
    case BELOW_CHILD_UTILIZATION:
      return "requested " + requested + " quota for the resource " + resource
          + ", but " + limit + " already utilized by children";
    default:
      return reason + " for the resource " + resource;
    }
  }

  public MeridianException toException() {
    return new MeridianException(getMessage(), reason);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    QuotaViolation that = (QuotaViolation) o;
    return Double.compare(that.limit, limit) == 0
        && reason == that.reason
        && Objects.equals(resource, that.resource)
        && Objects.equals(requested, that.requested);
  }

  @Override
  public int hashCode() {
    return Objects.hash(reason, resource, requested, limit);
  }

  @Override
  public String toString() {
    return reason + ": " + getMessage();
  }
}

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

import static org.apache.meridian.MeridianConsts.SECCOMP_APP_WILDCARD;
import static org.apache.meridian.MeridianConsts.SECCOMP_PROFILE_NAME_SUFFIX;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.apache.meridian.quota.QuotaArithmetic;

/**
 * A namespace as stored by the topology service.
 * <p>
 * Instances are immutable. Namespaces returned by reads carry the available
 * capacity resolved at read time; namespaces built for a create request do
 * not, and report empty available and utilized figures.
 */
public final class NamespaceInfo {
  private final String orgId;
  private final String name;
  private final String profileVersion;
  private final Map<String, String> labels;
  private final ResourceQuotas totalQuotas;
  private final ResourceQuotas available;

  private NamespaceInfo(Builder b) {
    this.orgId = b.orgId;
    this.name = b.name;
    this.profileVersion = b.profileVersion == null ? "" : b.profileVersion;
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
    this.totalQuotas = b.totalQuotas;
    this.available = b.available;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .setOrgId(orgId)
        .setName(name)
        .setProfileVersion(profileVersion)
        .addAllLabels(labels)
        .setTotalQuotas(totalQuotas)
        .setAvailable(available);
  }

  public String getId() {
    return MeridianIds.namespaceId(orgId, name);
  }

  public String getOrgId() {
    return orgId;
  }

  public String getName() {
    return name;
  }

  public String getProfileVersion() {
    return profileVersion;
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public ResourceQuotas getTotalQuotas() {
    return totalQuotas;
  }

  public boolean isAvailableResolved() {
    return available != null;
  }

  public ResourceQuotas getAvailable() {
    return available == null ? ResourceQuotas.empty() : available;
  }

  public ResourceQuotas getUtilized() {
    if (available == null) {
      return ResourceQuotas.empty();
    }
    return QuotaArithmetic.computeUtilized(totalQuotas, available);
  }

  public SeccompProfileId getSeccompProfileId(String architecture) {
    return new SeccompProfileId(getId(), SECCOMP_APP_WILDCARD,
        getId() + SECCOMP_PROFILE_NAME_SUFFIX, profileVersion, architecture);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    NamespaceInfo that = (NamespaceInfo) o;
    return orgId.equals(that.orgId)
        && name.equals(that.name)
        && profileVersion.equals(that.profileVersion)
        && labels.equals(that.labels)
        && totalQuotas.equals(that.totalQuotas)
        && Objects.equals(available, that.available);
  }

  @Override
  public int hashCode() {
    return Objects.hash(orgId, name, profileVersion, labels, totalQuotas,
        available);
  }

  @Override
  public String toString() {
    return "NamespaceInfo{id=" + getId() + ", total=" + totalQuotas
        + ", available=" + available + "}";
  }

  /**
   * Builder for {@link NamespaceInfo}.
   */
  public static final class Builder {
    private String orgId;
    private String name;
    private String profileVersion;
    private final Map<String, String> labels = new LinkedHashMap<>();
    private ResourceQuotas totalQuotas = ResourceQuotas.empty();
    private ResourceQuotas available;

    private Builder() {
    }

    public Builder setOrgId(String orgId) {
      this.orgId = orgId;
      return this;
    }

    public Builder setName(String name) {
      this.name = name;
      return this;
    }

    public Builder setProfileVersion(String profileVersion) {
      this.profileVersion = profileVersion;
      return this;
    }

    public Builder addLabel(String key, String value) {
      labels.put(key, value);
      return this;
    }

    public Builder addAllLabels(Map<String, String> newLabels) {
      if (newLabels != null) {
        labels.putAll(newLabels);
      }
      return this;
    }

    public Builder setTotalQuotas(ResourceQuotas totalQuotas) {
      this.totalQuotas = Objects.requireNonNull(totalQuotas,
          "totalQuotas == null");
      return this;
    }

    public Builder setAvailable(ResourceQuotas available) {
      this.available = available;
      return this;
    }

    public NamespaceInfo build() {
      Preconditions.checkNotNull(orgId, "orgId == null");
      Preconditions.checkNotNull(name, "name == null");
      return new NamespaceInfo(this);
    }
  }
}

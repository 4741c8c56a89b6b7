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

package org.apache.meridian.manager.handler;

import com.google.common.base.Preconditions;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.meridian.helpers.SeccompProfileDefinition;

/**
 * Request to add a namespace. An empty parent name adds a root.
 */
public final class AddNamespaceRequest {
  private final String orgId;
  private final String name;
  private final String parentName;
  private final String profileVersion;
  private final Map<String, String> labels;
  private final Map<String, Double> quotas;
  private final String seccompStrategy;
  private final SeccompProfileDefinition seccompDefinition;

  private AddNamespaceRequest(Builder b) {
    this.orgId = b.orgId;
    this.name = b.name;
    this.parentName = b.parentName == null ? "" : b.parentName;
    this.profileVersion = b.profileVersion;
    this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(b.labels));
    this.quotas = Collections.unmodifiableMap(new LinkedHashMap<>(b.quotas));
    this.seccompStrategy = b.seccompStrategy;
    this.seccompDefinition = b.seccompDefinition;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public String getOrgId() {
    return orgId;
  }

  public String getName() {
    return name;
  }

  public String getParentName() {
    return parentName;
  }

  public boolean isRoot() {
    return parentName.isEmpty();
  }

  public String getProfileVersion() {
    return profileVersion;
  }

  public Map<String, String> getLabels() {
    return labels;
  }

  public Map<String, Double> getQuotas() {
    return quotas;
  }

  public String getSeccompStrategy() {
    return seccompStrategy;
  }

  public SeccompProfileDefinition getSeccompDefinition() {
    return seccompDefinition;
  }

  /**
   * Builder for {@link AddNamespaceRequest}.
   */
  public static final class Builder {
    private String orgId;
    private String name;
    private String parentName;
    private String profileVersion;
    private final Map<String, String> labels = new LinkedHashMap<>();
    private final Map<String, Double> quotas = new LinkedHashMap<>();
    private String seccompStrategy;
    private SeccompProfileDefinition seccompDefinition;

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

    public Builder setParentName(String parentName) {
      this.parentName = parentName;
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

    public Builder addQuota(String resource, double quota) {
      quotas.put(resource, quota);
      return this;
    }

    public Builder setQuotas(Map<String, Double> newQuotas) {
      quotas.clear();
      quotas.putAll(newQuotas);
      return this;
    }

    public Builder setSeccompStrategy(String seccompStrategy) {
      this.seccompStrategy = seccompStrategy;
      return this;
    }

    public Builder setSeccompDefinition(
        SeccompProfileDefinition seccompDefinition) {
      this.seccompDefinition = seccompDefinition;
      return this;
    }

    public AddNamespaceRequest build() {
      Preconditions.checkNotNull(orgId, "orgId == null");
      Preconditions.checkNotNull(name, "name == null");
      return new AddNamespaceRequest(this);
    }
  }
}

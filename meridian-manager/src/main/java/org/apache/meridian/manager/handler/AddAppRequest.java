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
 * Request to add an app to an existing namespace.
 */
public final class AddAppRequest {
  private final String orgId;
  private final String namespaceName;
  private final String name;
  private final String profileVersion;
  private final Map<String, Double> quotas;
  private final String seccompStrategy;
  private final SeccompProfileDefinition seccompDefinition;

  private AddAppRequest(Builder b) {
    this.orgId = b.orgId;
    this.namespaceName = b.namespaceName;
    this.name = b.name;
    this.profileVersion = b.profileVersion;
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

  public String getNamespaceName() {
    return namespaceName;
  }

  public String getName() {
    return name;
  }

  public String getProfileVersion() {
    return profileVersion;
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
   * Builder for {@link AddAppRequest}.
   */
  public static final class Builder {
    private String orgId;
    private String namespaceName;
    private String name;
    private String profileVersion;
    private final Map<String, Double> quotas = new LinkedHashMap<>();
    private String seccompStrategy;
    private SeccompProfileDefinition seccompDefinition;

    private Builder() {
    }

    public Builder setOrgId(String orgId) {
      this.orgId = orgId;
      return this;
    }

    public Builder setNamespaceName(String namespaceName) {
      this.namespaceName = namespaceName;
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

    public AddAppRequest build() {
      Preconditions.checkNotNull(orgId, "orgId == null");
      Preconditions.checkNotNull(namespaceName, "namespaceName == null");
      Preconditions.checkNotNull(name, "name == null");
      return new AddAppRequest(this);
    }
  }
}

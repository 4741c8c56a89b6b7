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

import static org.apache.meridian.MeridianConsts.SECCOMP_PROFILE_NAME_SUFFIX;

import com.google.common.base.Preconditions;
import java.util.Objects;

/**
 * An application attached to exactly one namespace. Apps are leaves.
 */
public final class AppInfo {
  private final String orgId;
  private final String namespaceName;
  private final String name;
  private final String profileVersion;
  private final ResourceQuotas totalQuotas;

  private AppInfo(Builder b) {
    this.orgId = b.orgId;
    this.namespaceName = b.namespaceName;
    this.name = b.name;
    this.profileVersion = b.profileVersion == null ? "" : b.profileVersion;
    this.totalQuotas = b.totalQuotas;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public String getId() {
    return MeridianIds.appId(orgId, namespaceName, name);
  }

  public String getNamespaceId() {
    return MeridianIds.namespaceId(orgId, namespaceName);
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

  public ResourceQuotas getTotalQuotas() {
    return totalQuotas;
  }

  public SeccompProfileId getSeccompProfileId(String architecture) {
    return new SeccompProfileId(getNamespaceId(), name,
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
    AppInfo that = (AppInfo) o;
    return orgId.equals(that.orgId)
        && namespaceName.equals(that.namespaceName)
        && name.equals(that.name)
        && profileVersion.equals(that.profileVersion)
        && totalQuotas.equals(that.totalQuotas);
  }

  @Override
  public int hashCode() {
    return Objects.hash(orgId, namespaceName, name, profileVersion,
        totalQuotas);
  }

  @Override
  public String toString() {
    return "AppInfo{id=" + getId() + ", total=" + totalQuotas + "}";
  }

  /**
   * Builder for {@link AppInfo}.
   */
  public static final class Builder {
    private String orgId;
    private String namespaceName;
    private String name;
    private String profileVersion;
    private ResourceQuotas totalQuotas = ResourceQuotas.empty();

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

    public Builder setTotalQuotas(ResourceQuotas totalQuotas) {
      this.totalQuotas = Objects.requireNonNull(totalQuotas,
          "totalQuotas == null");
      return this;
    }

    public AppInfo build() {
      Preconditions.checkNotNull(orgId, "orgId == null");
      Preconditions.checkNotNull(namespaceName, "namespaceName == null");
      Preconditions.checkNotNull(name, "name == null");
      return new AppInfo(this);
    }
  }
}

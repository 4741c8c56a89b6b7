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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload sent to a node when an app is added: where the app lives, its
 * seccomp profile as JSON, and its quotas.
 */
public final class ApplyAppConfigCommand {
  private final String orgId;
  private final String namespaceName;
  private final String appName;
  private final String seccompProfile;
  private final Map<String, Double> quotas;

  @JsonCreator
  public ApplyAppConfigCommand(
      @JsonProperty("orgId") String orgId,
      @JsonProperty("namespaceName") String namespaceName,
      @JsonProperty("appName") String appName,
      @JsonProperty("seccompProfile") String seccompProfile,
      @JsonProperty("quotas") Map<String, Double> quotas) {
    this.orgId = orgId;
    this.namespaceName = namespaceName;
    this.appName = appName;
    this.seccompProfile = seccompProfile;
    this.quotas = quotas == null ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(quotas));
  }

  @JsonProperty("orgId")
  public String getOrgId() {
    return orgId;
  }

  @JsonProperty("namespaceName")
  public String getNamespaceName() {
    return namespaceName;
  }

  @JsonProperty("appName")
  public String getAppName() {
    return appName;
  }

  /** Null when the profile could not be fetched. */
  @JsonProperty("seccompProfile")
  public String getSeccompProfile() {
    return seccompProfile;
  }

  @JsonProperty("quotas")
  public Map<String, Double> getQuotas() {
    return quotas;
  }
}

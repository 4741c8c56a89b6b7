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

import java.util.Objects;

/**
 * Identity of a seccomp profile held by the profile service.
 */
public final class SeccompProfileId {
  private final String namespace;
  private final String application;
  private final String name;
  private final String version;
  private final String architecture;

  public SeccompProfileId(String namespace, String application, String name,
      String version, String architecture) {
    this.namespace = Objects.requireNonNull(namespace, "namespace == null");
    this.application =
        Objects.requireNonNull(application, "application == null");
    this.name = Objects.requireNonNull(name, "name == null");
    this.version = version;
    this.architecture =
        Objects.requireNonNull(architecture, "architecture == null");
  }

  public String getNamespace() {
    return namespace;
  }

  public String getApplication() {
    return application;
  }

  public String getName() {
    return name;
  }

  public String getVersion() {
    return version;
  }

  public String getArchitecture() {
    return architecture;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SeccompProfileId that = (SeccompProfileId) o;
    return namespace.equals(that.namespace)
        && application.equals(that.application)
        && name.equals(that.name)
        && Objects.equals(version, that.version)
        && architecture.equals(that.architecture);
  }

  @Override
  public int hashCode() {
    return Objects.hash(namespace, application, name, version, architecture);
  }

  @Override
  public String toString() {
    return "SeccompProfileId{" + namespace + ", " + application + ", " + name
        + ", " + version + ", " + architecture + "}";
  }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Seccomp profile body: a default action plus ordered syscall rules.
 */
public final class SeccompProfileDefinition {
  private final String defaultAction;
  private final List<String> architectures;
  private final List<SyscallRule> syscalls;

  public SeccompProfileDefinition(String defaultAction,
      List<String> architectures, List<SyscallRule> syscalls) {
    this.defaultAction = defaultAction;
    this.architectures = architectures == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(architectures));
    this.syscalls = syscalls == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(syscalls));
  }

  public String getDefaultAction() {
    return defaultAction;
  }

  public List<String> getArchitectures() {
    return architectures;
  }

  public List<SyscallRule> getSyscalls() {
    return syscalls;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    SeccompProfileDefinition that = (SeccompProfileDefinition) o;
    return Objects.equals(defaultAction, that.defaultAction)
        && architectures.equals(that.architectures)
        && syscalls.equals(that.syscalls);
  }

  @Override
  public int hashCode() {
    return Objects.hash(defaultAction, architectures, syscalls);
  }

  /**
   * Action applied to a group of syscalls.
   */
  public static final class SyscallRule {
    private final List<String> names;
    private final String action;

    public SyscallRule(List<String> names, String action) {
      this.names = names == null ? Collections.emptyList()
          : Collections.unmodifiableList(new ArrayList<>(names));
      this.action = action;
    }

    public List<String> getNames() {
      return names;
    }

    public String getAction() {
      return action;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      SyscallRule that = (SyscallRule) o;
      return names.equals(that.names) && Objects.equals(action, that.action);
    }

    @Override
    public int hashCode() {
      return Objects.hash(names, action);
    }

    @Override
    public String toString() {
      return names + "=" + action;
    }
  }
}

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

package org.apache.meridian.manager.client;

import java.io.IOException;
import java.util.List;
import org.apache.meridian.helpers.SeccompProfileDefinition;
import org.apache.meridian.helpers.SeccompProfileDefinition.SyscallRule;
import org.apache.meridian.helpers.SeccompProfileId;

/**
 * Client of the service that stores seccomp profiles.
 */
public interface SeccompProfileClient {

  void defineProfile(SeccompProfileId profile,
      SeccompProfileDefinition definition) throws IOException;

  /**
   * Defines {@code profile} as {@code base} plus {@code syscalls}.
   */
  void extendProfile(SeccompProfileId base, SeccompProfileId profile,
      List<SyscallRule> syscalls) throws IOException;

  SeccompProfileDefinition getProfile(SeccompProfileId profile)
      throws IOException;
}

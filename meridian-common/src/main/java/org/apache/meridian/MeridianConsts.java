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

package org.apache.meridian;

/**
 * Set of constants used in Meridian.
 */
public final class MeridianConsts {

  public static final String ID_SEPARATOR = "/";

  public static final String DEFAULT_ROOT_NAMESPACE = "default";

  /** Application field of a seccomp profile that applies to a namespace. */
  public static final String SECCOMP_APP_WILDCARD = "*";

  public static final String SECCOMP_DEFAULT_ARCH = "x86";

  public static final String SECCOMP_PROFILE_NAME_SUFFIX = " profile";

  /** Resource kinds used when notifying the authorization service. */
  public static final String ORG_RESOURCE_KIND = "org";
  public static final String NAMESPACE_RESOURCE_KIND = "namespace";

  public static final int SHUTDOWN_HOOK_PRIORITY = 10;

  private MeridianConsts() {
  }
}

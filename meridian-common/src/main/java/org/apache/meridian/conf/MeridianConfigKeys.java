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

package org.apache.meridian.conf;

import org.apache.meridian.MeridianConsts;

/**
 * Meridian configuration keys and their defaults.
 */
public final class MeridianConfigKeys {

  // Implementation of the entity graph store. Must have a public no-arg
  // constructor; it is handed the configuration if it is Configurable.
  public static final String MERIDIAN_GRAPH_STORE_IMPL_KEY =
      "meridian.graph.store.impl";
  public static final String MERIDIAN_GRAPH_STORE_IMPL_DEFAULT =
      "org.apache.meridian.manager.graph.InMemoryEntityGraphStore";

  public static final String MERIDIAN_MANAGER_LOCK_STRIPES_KEY =
      "meridian.manager.lock.stripes";
  public static final int MERIDIAN_MANAGER_LOCK_STRIPES_DEFAULT = 256;

  // Longest wait for an entity lock. A caller deadline that ends sooner
  // wins.
  public static final String MERIDIAN_MANAGER_LOCK_TIMEOUT_KEY =
      "meridian.manager.lock.timeout";
  public static final String MERIDIAN_MANAGER_LOCK_TIMEOUT_DEFAULT = "30s";

  public static final String MERIDIAN_NAMESPACE_ROOT_NAME_KEY =
      "meridian.namespace.root.name";
  public static final String MERIDIAN_NAMESPACE_ROOT_NAME_DEFAULT =
      MeridianConsts.DEFAULT_ROOT_NAMESPACE;

  public static final String MERIDIAN_SECCOMP_DEFAULT_ARCH_KEY =
      "meridian.seccomp.default.architecture";
  public static final String MERIDIAN_SECCOMP_DEFAULT_ARCH_DEFAULT =
      MeridianConsts.SECCOMP_DEFAULT_ARCH;

  // Share of an org's nodes, in percent, that receive a new app config.
  public static final String MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_KEY =
      "meridian.dissemination.node.percentage";
  public static final int MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_DEFAULT = 50;

  private MeridianConfigKeys() {
  }
}

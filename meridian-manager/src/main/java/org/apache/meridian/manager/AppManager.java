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

package org.apache.meridian.manager;

import java.io.IOException;
import java.util.List;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.util.Deadline;

/**
 * AppManager handles the apps attached to namespaces.
 */
public interface AppManager {

  /**
   * Creates an app under its namespace, with its quotas, atomically.
   */
  void addApp(AppInfo app, Deadline deadline) throws IOException;

  default void addApp(AppInfo app) throws IOException {
    addApp(app, Deadline.none());
  }

  AppInfo getApp(String appId, Deadline deadline) throws IOException;

  default AppInfo getApp(String appId) throws IOException {
    return getApp(appId, Deadline.none());
  }

  /**
   * @return the apps directly attached to a namespace, in no particular
   * order
   */
  List<AppInfo> listApps(String namespaceId, Deadline deadline)
      throws IOException;

  default List<AppInfo> listApps(String namespaceId) throws IOException {
    return listApps(namespaceId, Deadline.none());
  }

  void removeApp(String appId, Deadline deadline) throws IOException;

  default void removeApp(String appId) throws IOException {
    removeApp(appId, Deadline.none());
  }
}

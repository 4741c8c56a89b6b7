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

import static org.apache.meridian.MeridianConsts.ID_SEPARATOR;

import org.apache.commons.lang3.StringUtils;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;

/**
 * Builds and checks hierarchical entity ids.
 * <p>
 * A namespace id is {@code org/namespace}, an app id is
 * {@code org/namespace/app}.
 */
public final class MeridianIds {

  private MeridianIds() {
  }

  public static String namespaceId(String orgId, String namespaceName) {
    return orgId + ID_SEPARATOR + namespaceName;
  }

  public static String appId(String orgId, String namespaceName,
      String appName) {
    return namespaceId(orgId, namespaceName) + ID_SEPARATOR + appName;
  }

  /**
   * @return the org an entity id belongs to.
   */
  public static String orgOf(String entityId) {
    return StringUtils.substringBefore(entityId, ID_SEPARATOR);
  }

  /**
   * Checks one segment of an id.
   *
   * @throws MeridianException INVALID_REQUEST if the segment is blank or
   * contains the id separator
   */
  public static void checkSegment(String what, String segment)
      throws MeridianException {
    if (StringUtils.isBlank(segment)) {
      throw new MeridianException(what + " must not be empty",
          ResultCodes.INVALID_REQUEST);
    }
    if (segment.contains(ID_SEPARATOR)) {
      throw new MeridianException(what + " " + segment
          + " must not contain '" + ID_SEPARATOR + "'",
          ResultCodes.INVALID_REQUEST);
    }
  }
}

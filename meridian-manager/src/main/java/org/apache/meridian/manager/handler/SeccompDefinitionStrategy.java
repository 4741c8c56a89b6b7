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

import java.util.Locale;
import org.apache.commons.lang3.StringUtils;

/**
 * How a new entity's seccomp profile is derived.
 */
public enum SeccompDefinitionStrategy {
  /** Submit the request's definition as is. */
  REDEFINE,
  /** Parent profile plus the request's syscall rules. */
  EXTEND,
  /** Copy of the parent's definition. */
  INHERIT;

  /**
   * Case-insensitive lookup. Blank and unknown names mean
   * {@link #INHERIT}.
   */
  public static SeccompDefinitionStrategy fromName(String name) {
    if (StringUtils.isBlank(name)) {
      return INHERIT;
    }
    switch (name.trim().toLowerCase(Locale.ROOT)) {
    case "redefine":
      return REDEFINE;
    case "extend":
      return EXTEND;
    default:
      return INHERIT;
    }
  }

  public boolean requiresParent() {
    return this != REDEFINE;
  }
}

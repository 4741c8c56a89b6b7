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

import java.util.Objects;
import org.apache.hadoop.conf.Configuration;

/**
 * Configuration for Meridian. Reads {@code meridian-default.xml} and then
 * {@code meridian-site.xml} from the classpath.
 */
public class MeridianConfiguration extends Configuration {

  static {
    activate();
  }

  public MeridianConfiguration() {
  }

  public MeridianConfiguration(Configuration conf) {
    super(conf);
  }

  public static MeridianConfiguration of(Configuration conf) {
    Objects.requireNonNull(conf, "conf == null");

    return conf instanceof MeridianConfiguration
        ? (MeridianConfiguration) conf
        : new MeridianConfiguration(conf);
  }

  /**
   * Registers the Meridian resources with every Hadoop configuration.
   */
  public static void activate() {
    Configuration.addDefaultResource("meridian-default.xml");
    Configuration.addDefaultResource("meridian-site.xml");
  }
}

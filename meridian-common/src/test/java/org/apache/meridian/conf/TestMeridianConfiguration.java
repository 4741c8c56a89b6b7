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

import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_GRAPH_STORE_IMPL_DEFAULT;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_GRAPH_STORE_IMPL_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_MANAGER_LOCK_TIMEOUT_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_NAMESPACE_ROOT_NAME_KEY;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.util.concurrent.TimeUnit;
import org.apache.hadoop.conf.Configuration;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link MeridianConfiguration}.
 */
public class TestMeridianConfiguration {

  @Test
  public void testDefaultsLoadedFromResource() {
    MeridianConfiguration conf = new MeridianConfiguration();

    assertEquals(MERIDIAN_GRAPH_STORE_IMPL_DEFAULT,
        conf.get(MERIDIAN_GRAPH_STORE_IMPL_KEY));
    assertEquals("default", conf.get(MERIDIAN_NAMESPACE_ROOT_NAME_KEY));
    assertEquals(50, conf.getInt(MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_KEY,
        -1));
    assertEquals(30000, conf.getTimeDuration(
        MERIDIAN_MANAGER_LOCK_TIMEOUT_KEY, 0, TimeUnit.MILLISECONDS));
  }

  @Test
  public void testOfKeepsOverrides() {
    Configuration plain = new Configuration(false);
    plain.set(MERIDIAN_NAMESPACE_ROOT_NAME_KEY, "root");

    MeridianConfiguration conf = MeridianConfiguration.of(plain);
    assertEquals("root", conf.get(MERIDIAN_NAMESPACE_ROOT_NAME_KEY));
    assertSame(conf, MeridianConfiguration.of(conf));
  }
}

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ResourceQuotas} and {@link ResourceKind}.
 */
public class TestResourceQuotas {

  @Test
  public void testFromRequest() throws Exception {
    ResourceQuotas quotas = ResourceQuotas.fromRequest(
        ImmutableMap.of("mem", 2.0, "cpu", 0.5));

    assertEquals(2.0, quotas.get(ResourceKind.MEM));
    assertEquals(0.5, quotas.get(ResourceKind.CPU));
    assertFalse(quotas.contains(ResourceKind.DISK));
    assertEquals(0, quotas.get(ResourceKind.DISK));
  }

  @Test
  public void testEmptyRequest() throws Exception {
    assertSame(ResourceQuotas.empty(),
        ResourceQuotas.fromRequest(Collections.emptyMap()));
    assertSame(ResourceQuotas.empty(), ResourceQuotas.fromRequest(null));
  }

  @Test
  public void testUnsupportedKind() {
    MeridianException ex = assertThrows(MeridianException.class,
        () -> ResourceQuotas.fromRequest(ImmutableMap.of("gpu", 1.0)));
    assertEquals(ResultCodes.UNSUPPORTED_RESOURCE_KIND, ex.getResult());
    assertThat(ex.getMessage())
        .isEqualTo("quotas for a resource with name gpu are not supported");
  }

  @Test
  public void testInvalidQuantity() {
    Map<String, Double> request = new HashMap<>();
    request.put("disk", null);
    MeridianException ex = assertThrows(MeridianException.class,
        () -> ResourceQuotas.fromRequest(request));
    assertEquals(ResultCodes.INVALID_QUOTA, ex.getResult());

    ex = assertThrows(MeridianException.class,
        () -> ResourceQuotas.fromRequest(ImmutableMap.of("mem", -0.1)));
    assertEquals(ResultCodes.INVALID_QUOTA, ex.getResult());
  }

  @Test
  public void testOverlayKeepsKindsNotUpdated() {
    ResourceQuotas current = ResourceQuotas.newBuilder()
        .set(ResourceKind.MEM, 4).set(ResourceKind.CPU, 2).build();
    ResourceQuotas update = ResourceQuotas.newBuilder()
        .set(ResourceKind.MEM, 8).build();

    ResourceQuotas merged = current.overlay(update);
    assertEquals(8, merged.get(ResourceKind.MEM));
    assertEquals(2, merged.get(ResourceKind.CPU));
    assertSame(current, current.overlay(ResourceQuotas.empty()));
  }

  @Test
  public void testKeyMapOrder() {
    ResourceQuotas quotas = ResourceQuotas.newBuilder()
        .set(ResourceKind.DISK, 1).set(ResourceKind.MEM, 2).build();
    assertThat(quotas.toKeyMap().keySet()).containsExactly("mem", "disk");
    assertEquals("{mem=2.0, disk=1.0}", quotas.toString());
  }

  @Test
  public void testResourceKindLookup() {
    assertTrue(ResourceKind.isSupported("cpu"));
    assertFalse(ResourceKind.isSupported("CPU"));
    assertFalse(ResourceKind.isSupported("gpu"));
    assertEquals(ResourceKind.DISK, ResourceKind.fromKey("disk").get());
    assertEquals("mem", ResourceKind.MEM.toString());
  }
}

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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.helpers.EntityType;
import org.apache.meridian.helpers.NamespaceInfo;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.manager.graph.EntityRecord;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link EntityRecordCodec}.
 */
public class TestEntityRecordCodec {

  private final EntityRecordCodec codec = new EntityRecordCodec();

  @Test
  public void testNamespaceLabelsStoredAsJson() throws Exception {
    NamespaceInfo ns = NamespaceInfo.newBuilder().setOrgId("acme")
        .setName("prod").setProfileVersion("v1")
        .addLabel("zone", "eu-1").addLabel("owner", "ops").build();

    EntityRecord record = codec.toRecord(ns);
    assertEquals("acme/prod", record.getId());
    assertEquals(EntityType.NAMESPACE, record.getType());
    assertEquals("{\"zone\":\"eu-1\",\"owner\":\"ops\"}",
        record.getProperty(EntityRecordCodec.LABELS));
    assertTrue(record.getQuotas().isEmpty());

    NamespaceInfo decoded = codec.toNamespace(record, ResourceQuotas.empty());
    assertThat(decoded.getLabels()).containsExactly(
        Map.entry("zone", "eu-1"), Map.entry("owner", "ops"));
    assertEquals("v1", decoded.getProfileVersion());
  }

  @Test
  public void testCorruptLabels() {
    Map<String, String> props = new HashMap<>();
    props.put(EntityRecordCodec.ORG_ID, "acme");
    props.put(EntityRecordCodec.NAME, "prod");
    props.put(EntityRecordCodec.LABELS, "{not json");
    EntityRecord record = new EntityRecord("acme/prod",
        EntityType.NAMESPACE, props, ResourceQuotas.empty());

    MeridianException ex = assertThrows(MeridianException.class,
        () -> codec.toNamespace(record, null));
    assertEquals(ResultCodes.INTERNAL_ERROR, ex.getResult());
  }

  @Test
  public void testAppRoundTripAndTypeCheck() throws Exception {
    AppInfo app = AppInfo.newBuilder().setOrgId("acme")
        .setNamespaceName("prod").setName("web").build();
    EntityRecord record = codec.toRecord(app);
    assertEquals(app, codec.toApp(record));

    MeridianException ex = assertThrows(MeridianException.class,
        () -> codec.toNamespace(record, null));
    assertEquals(ResultCodes.INTERNAL_ERROR, ex.getResult());
  }
}

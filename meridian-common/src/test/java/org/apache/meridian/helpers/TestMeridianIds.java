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

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link MeridianIds}.
 */
public class TestMeridianIds {

  @Test
  public void testIds() {
    assertEquals("acme/default", MeridianIds.namespaceId("acme", "default"));
    assertEquals("acme/prod/web", MeridianIds.appId("acme", "prod", "web"));
    assertEquals("acme", MeridianIds.orgOf("acme/prod/web"));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", " ", "a/b"})
  public void testBadSegments(String segment) {
    MeridianException ex = assertThrows(MeridianException.class,
        () -> MeridianIds.checkSegment("namespace name", segment));
    assertEquals(ResultCodes.INVALID_REQUEST, ex.getResult());
  }

  @Test
  public void testGoodSegment() {
    assertDoesNotThrow(() -> MeridianIds.checkSegment("app name", "web-1"));
  }
}

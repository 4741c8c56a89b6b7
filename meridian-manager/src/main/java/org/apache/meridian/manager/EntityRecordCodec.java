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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.helpers.EntityType;
import org.apache.meridian.helpers.NamespaceInfo;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.manager.graph.EntityRecord;

/**
 * Maps namespaces and apps to graph records and back. Labels are kept as a
 * single JSON object property.
 */
public final class EntityRecordCodec {
  static final String ORG_ID = "org_id";
  static final String NAME = "name";
  static final String NAMESPACE_NAME = "namespace_name";
  static final String PROFILE_VERSION = "profile_version";
  static final String LABELS = "labels";

  private static final TypeReference<LinkedHashMap<String, String>>
      LABELS_TYPE = new TypeReference<LinkedHashMap<String, String>>() { };

  private final ObjectMapper mapper;

  public EntityRecordCodec(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public EntityRecordCodec() {
    this(new ObjectMapper());
  }

  /**
   * @return a record for a new namespace. Quotas are left empty; they are
   * set through the quota store so they pass admission.
   */
  public EntityRecord toRecord(NamespaceInfo namespace)
      throws MeridianException {
    Map<String, String> props = new LinkedHashMap<>();
    props.put(ORG_ID, namespace.getOrgId());
    props.put(NAME, namespace.getName());
    props.put(PROFILE_VERSION, namespace.getProfileVersion());
    try {
      props.put(LABELS, mapper.writeValueAsString(namespace.getLabels()));
    } catch (JsonProcessingException e) {
      throw new MeridianException("cannot encode labels of namespace "
          + namespace.getId(), e, ResultCodes.INVALID_REQUEST);
    }
    return new EntityRecord(namespace.getId(), EntityType.NAMESPACE, props,
        ResourceQuotas.empty());
  }

  public EntityRecord toRecord(AppInfo app) {
    Map<String, String> props = new LinkedHashMap<>();
    props.put(ORG_ID, app.getOrgId());
    props.put(NAMESPACE_NAME, app.getNamespaceName());
    props.put(NAME, app.getName());
    props.put(PROFILE_VERSION, app.getProfileVersion());
    return new EntityRecord(app.getId(), EntityType.APP, props,
        ResourceQuotas.empty());
  }

  public NamespaceInfo toNamespace(EntityRecord record,
      ResourceQuotas available) throws MeridianException {
    checkType(record, EntityType.NAMESPACE);
    NamespaceInfo.Builder builder = NamespaceInfo.newBuilder()
        .setOrgId(record.getProperty(ORG_ID))
        .setName(record.getProperty(NAME))
        .setProfileVersion(record.getProperty(PROFILE_VERSION))
        .setTotalQuotas(record.getQuotas())
        .setAvailable(available);
    String labels = record.getProperty(LABELS);
    if (StringUtils.isNotEmpty(labels)) {
      try {
        builder.addAllLabels(mapper.readValue(labels, LABELS_TYPE));
      } catch (JsonProcessingException e) {
        throw new MeridianException("stored labels of namespace "
            + record.getId() + " are corrupt", e, ResultCodes.INTERNAL_ERROR);
      }
    }
    return builder.build();
  }

  public AppInfo toApp(EntityRecord record) throws MeridianException {
    checkType(record, EntityType.APP);
    return AppInfo.newBuilder()
        .setOrgId(record.getProperty(ORG_ID))
        .setNamespaceName(record.getProperty(NAMESPACE_NAME))
        .setName(record.getProperty(NAME))
        .setProfileVersion(record.getProperty(PROFILE_VERSION))
        .setTotalQuotas(record.getQuotas())
        .build();
  }

  private static void checkType(EntityRecord record, EntityType expected)
      throws MeridianException {
    if (record.getType() != expected) {
      throw new MeridianException("entity " + record.getId() + " is a "
          + record.getType() + ", not a " + expected,
          ResultCodes.INTERNAL_ERROR);
    }
  }
}

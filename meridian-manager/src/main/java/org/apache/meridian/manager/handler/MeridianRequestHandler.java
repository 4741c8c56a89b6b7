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

import static org.apache.meridian.MeridianConsts.NAMESPACE_RESOURCE_KIND;
import static org.apache.meridian.MeridianConsts.ORG_RESOURCE_KIND;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_DEFAULT;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_NAMESPACE_ROOT_NAME_DEFAULT;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_NAMESPACE_ROOT_NAME_KEY;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_SECCOMP_DEFAULT_ARCH_DEFAULT;
import static org.apache.meridian.conf.MeridianConfigKeys.MERIDIAN_SECCOMP_DEFAULT_ARCH_KEY;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.helpers.MeridianIds;
import org.apache.meridian.helpers.NamespaceInfo;
import org.apache.meridian.helpers.NamespaceTree;
import org.apache.meridian.helpers.ResourceQuotas;
import org.apache.meridian.helpers.SeccompProfileDefinition;
import org.apache.meridian.helpers.SeccompProfileDefinition.SyscallRule;
import org.apache.meridian.helpers.SeccompProfileId;
import org.apache.meridian.manager.AppManager;
import org.apache.meridian.manager.EntityLocks;
import org.apache.meridian.manager.MeridianManager;
import org.apache.meridian.manager.NamespaceManager;
import org.apache.meridian.manager.ResourceQuotaManager;
import org.apache.meridian.manager.client.AuthorizationClient;
import org.apache.meridian.manager.client.AuthorizationClient.Resource;
import org.apache.meridian.manager.client.ConfigDisseminationClient;
import org.apache.meridian.manager.client.NodeDirectoryClient;
import org.apache.meridian.manager.client.SeccompProfileClient;
import org.apache.meridian.manager.graph.EntityGraphStore;
import org.apache.meridian.manager.lock.MeridianLock;
import org.apache.meridian.util.Deadline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for tenant topology requests.
 * <p>
 * Applies the checks that belong at the service boundary (duplicates,
 * parent existence, empty subtree on removal), keeps the seccomp profile
 * service in step with new entities, pushes new app config to a sample of
 * the org's nodes and tells the authorization service about new
 * namespaces. Those collaborators are not transactional with the topology:
 * a failure after the topology commit leaves the entity in place.
 */
public class MeridianRequestHandler {
  private static final Logger LOG =
      LoggerFactory.getLogger(MeridianRequestHandler.class);

  private final NamespaceManager namespaceManager;
  private final AppManager appManager;
  private final ResourceQuotaManager resourceQuotaManager;
  private final EntityGraphStore store;
  private final MeridianLock lock;
  private final SeccompProfileClient seccompClient;
  private final NodeDirectoryClient nodeDirectory;
  private final ConfigDisseminationClient disseminationClient;
  private final AuthorizationClient authorizationClient;
  private final ObjectMapper mapper = new ObjectMapper();
  private final Random random;
  private final String rootNamespaceName;
  private final String architecture;
  private final int disseminationPercentage;

  public MeridianRequestHandler(MeridianManager manager,
      SeccompProfileClient seccompClient, NodeDirectoryClient nodeDirectory,
      ConfigDisseminationClient disseminationClient,
      AuthorizationClient authorizationClient) {
    this(manager, seccompClient, nodeDirectory, disseminationClient,
        authorizationClient, new Random());
  }

  @VisibleForTesting
  MeridianRequestHandler(MeridianManager manager,
      SeccompProfileClient seccompClient, NodeDirectoryClient nodeDirectory,
      ConfigDisseminationClient disseminationClient,
      AuthorizationClient authorizationClient, Random random) {
    this.namespaceManager = manager.getNamespaceManager();
    this.appManager = manager.getAppManager();
    this.resourceQuotaManager = manager.getResourceQuotaManager();
    this.store = manager.getGraphStore();
    this.lock = manager.getLock();
    this.seccompClient = seccompClient;
    this.nodeDirectory = nodeDirectory;
    this.disseminationClient = disseminationClient;
    this.authorizationClient = authorizationClient;
    this.random = random;
    this.rootNamespaceName = manager.getConfiguration().getTrimmed(
        MERIDIAN_NAMESPACE_ROOT_NAME_KEY,
        MERIDIAN_NAMESPACE_ROOT_NAME_DEFAULT);
    this.architecture = manager.getConfiguration().getTrimmed(
        MERIDIAN_SECCOMP_DEFAULT_ARCH_KEY,
        MERIDIAN_SECCOMP_DEFAULT_ARCH_DEFAULT);
    this.disseminationPercentage = manager.getConfiguration().getInt(
        MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_KEY,
        MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_DEFAULT);
    Preconditions.checkArgument(
        disseminationPercentage >= 0 && disseminationPercentage <= 100,
        "%s must be in [0, 100]: %s",
        MERIDIAN_DISSEMINATION_NODE_PERCENTAGE_KEY, disseminationPercentage);
  }

  public void addNamespace(AddNamespaceRequest req, Deadline deadline)
      throws IOException {
    MeridianIds.checkSegment("org id", req.getOrgId());
    MeridianIds.checkSegment("namespace name", req.getName());
    String namespaceId = MeridianIds.namespaceId(req.getOrgId(), req.getName());
    if (findNamespace(namespaceId, deadline).isPresent()) {
      throw new MeridianException("Namespace " + namespaceId
          + " already exists", ResultCodes.ENTITY_ALREADY_EXISTS);
    }
    NamespaceInfo parent = null;
    if (!req.isRoot()) {
      String parentId =
          MeridianIds.namespaceId(req.getOrgId(), req.getParentName());
      parent = findNamespace(parentId, deadline).orElseThrow(
          () -> new MeridianException("Parent namespace " + parentId
              + " is not found", ResultCodes.ENTITY_NOT_FOUND));
    }
    NamespaceInfo namespace = NamespaceInfo.newBuilder()
        .setOrgId(req.getOrgId())
        .setName(req.getName())
        .setProfileVersion(req.getProfileVersion())
        .addAllLabels(req.getLabels())
        .setTotalQuotas(ResourceQuotas.fromRequest(req.getQuotas()))
        .build();

    sendSeccompProfile(req.getSeccompStrategy(),
        namespace.getSeccompProfileId(architecture),
        req.getSeccompDefinition(), parent);
    namespaceManager.addNamespace(namespace,
        parent == null ? null : parent.getId(), deadline);

    Resource from = parent == null
        ? new Resource(req.getOrgId(), ORG_RESOURCE_KIND)
        : new Resource(parent.getId(), NAMESPACE_RESOURCE_KIND);
    notifyInheritance(from, new Resource(namespaceId, NAMESPACE_RESOURCE_KIND));
  }

  /**
   * Removes a namespace that has neither child namespaces nor apps. The
   * check and the removal run under the namespace's entity lock, so no
   * child can be added in between.
   */
  public void removeNamespace(String orgId, String name, Deadline deadline)
      throws IOException {
    String namespaceId = MeridianIds.namespaceId(orgId, name);
    List<String> lockIds =
        EntityLocks.entityAndParent(store, namespaceId, deadline);
    lock.acquireWriteLocks(lockIds, deadline);
    try {
      NamespaceTree tree = namespaceManager.getHierarchy(namespaceId, deadline);
      if (!tree.getRoot().isLeaf()) {
        throw new MeridianException("Namespace " + namespaceId
            + " must not have applications or child namespaces",
            ResultCodes.NON_EMPTY_SUBTREE);
      }
      namespaceManager.removeNamespace(namespaceId, deadline);
    } finally {
      lock.releaseWriteLocks(lockIds);
    }
  }

  public void addApp(AddAppRequest req, Deadline deadline)
      throws IOException {
    MeridianIds.checkSegment("org id", req.getOrgId());
    MeridianIds.checkSegment("namespace name", req.getNamespaceName());
    MeridianIds.checkSegment("app name", req.getName());
    String namespaceId =
        MeridianIds.namespaceId(req.getOrgId(), req.getNamespaceName());
    NamespaceInfo namespace = findNamespace(namespaceId, deadline)
        .orElseThrow(() -> new MeridianException("Namespace " + namespaceId
            + " is not found", ResultCodes.ENTITY_NOT_FOUND));
    AppInfo app = AppInfo.newBuilder()
        .setOrgId(req.getOrgId())
        .setNamespaceName(req.getNamespaceName())
        .setName(req.getName())
        .setProfileVersion(req.getProfileVersion())
        .setTotalQuotas(ResourceQuotas.fromRequest(req.getQuotas()))
        .build();

    SeccompProfileId profileId = app.getSeccompProfileId(architecture);
    sendSeccompProfile(req.getSeccompStrategy(), profileId,
        req.getSeccompDefinition(), namespace);
    appManager.addApp(app, deadline);
    disseminateAppConfig(app, profileId, req.getQuotas(), deadline);
  }

  public void removeApp(String orgId, String namespaceName, String name,
      Deadline deadline) throws IOException {
    appManager.removeApp(MeridianIds.appId(orgId, namespaceName, name),
        deadline);
  }

  public NamespaceInfo getNamespace(String orgId, String name,
      Deadline deadline) throws IOException {
    return namespaceManager.getNamespace(
        MeridianIds.namespaceId(orgId, name), deadline);
  }

  /**
   * @return the whole tree of an org, starting at its root namespace
   */
  public NamespaceTree getNamespaceHierarchy(String orgId, Deadline deadline)
      throws IOException {
    return namespaceManager.getHierarchy(
        MeridianIds.namespaceId(orgId, rootNamespaceName), deadline);
  }

  public void setNamespaceResources(String orgId, String name,
      Map<String, Double> quotas, Deadline deadline) throws IOException {
    resourceQuotaManager.setResourceQuotas(
        MeridianIds.namespaceId(orgId, name), quotas, deadline);
  }

  public void setAppResources(String orgId, String namespaceName,
      String name, Map<String, Double> quotas, Deadline deadline)
      throws IOException {
    resourceQuotaManager.setResourceQuotas(
        MeridianIds.appId(orgId, namespaceName, name), quotas, deadline);
  }

  /**
   * Looks a profile up for display. Failures are logged and reported as
   * absent.
   */
  public Optional<SeccompProfileDefinition> getSeccompProfile(
      SeccompProfileId profileId) {
    try {
      return Optional.ofNullable(seccompClient.getProfile(profileId));
    } catch (IOException e) {
      LOG.warn("Failed to fetch seccomp profile {}", profileId, e);
      return Optional.empty();
    }
  }

  public String getArchitecture() {
    return architecture;
  }

  private Optional<NamespaceInfo> findNamespace(String namespaceId,
      Deadline deadline) throws IOException {
    try {
      return Optional.of(namespaceManager.getNamespace(namespaceId, deadline));
    } catch (MeridianException e) {
      if (e.getResult() == ResultCodes.ENTITY_NOT_FOUND) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @VisibleForTesting
  void sendSeccompProfile(String strategyName, SeccompProfileId profileId,
      SeccompProfileDefinition definition, NamespaceInfo parent)
      throws MeridianException {
    SeccompDefinitionStrategy strategy =
        SeccompDefinitionStrategy.fromName(strategyName);
    if (strategy.requiresParent() && parent == null) {
      throw new MeridianException("cannot inherit or extend seccomp "
          + "profiles - there is no parent", ResultCodes.INVALID_REQUEST);
    }
    try {
      switch (strategy) {
      case REDEFINE:
        if (definition == null) {
          throw new MeridianException("strategy redefine needs a seccomp "
              + "profile definition", ResultCodes.INVALID_REQUEST);
        }
        seccompClient.defineProfile(profileId, new SeccompProfileDefinition(
            definition.getDefaultAction(),
            Collections.singletonList(profileId.getArchitecture()),
            definition.getSyscalls()));
        break;
      case EXTEND:
        List<SyscallRule> extra = definition == null
            ? Collections.emptyList() : definition.getSyscalls();
        seccompClient.extendProfile(parent.getSeccompProfileId(architecture),
            profileId, extra);
        break;
      default:
        SeccompProfileDefinition inherited = seccompClient.getProfile(
            parent.getSeccompProfileId(architecture));
        if (inherited == null) {
          throw new MeridianException("parent " + parent.getId()
              + " has no seccomp profile to inherit",
              ResultCodes.SECCOMP_PROFILE_FAILED);
        }
        seccompClient.defineProfile(profileId, inherited);
        break;
      }
    } catch (MeridianException e) {
      throw e;
    } catch (IOException e) {
      LOG.error("Seccomp profile {} failed for {}", strategy, profileId, e);
      throw new MeridianException("Seccomp profile " + strategy
          + " failed for " + profileId, e, ResultCodes.SECCOMP_PROFILE_FAILED);
    }
  }

  private void disseminateAppConfig(AppInfo app, SeccompProfileId profileId,
      Map<String, Double> quotas, Deadline deadline) throws IOException {
    List<String> nodes;
    try {
      nodes = nodeDirectory.listOrgOwnedNodes(app.getOrgId());
    } catch (IOException e) {
      LOG.error("Listing nodes of org {} failed", app.getOrgId(), e);
      throw new MeridianException("Listing nodes of org " + app.getOrgId()
          + " failed", e, ResultCodes.DISSEMINATION_FAILED);
    }
    List<String> targets =
        NodeSampler.sample(nodes, disseminationPercentage, random);

    byte[] payload;
    try {
      String profile = null;
      Optional<SeccompProfileDefinition> definition =
          getSeccompProfile(profileId);
      if (definition.isPresent()) {
        profile = mapper.writerWithDefaultPrettyPrinter()
            .writeValueAsString(definition.get());
      }
      payload = mapper.writeValueAsBytes(new ApplyAppConfigCommand(
          app.getOrgId(), app.getNamespaceName(), app.getName(), profile,
          quotas));
    } catch (JsonProcessingException e) {
      throw new MeridianException("Cannot encode config of app "
          + app.getId(), e, ResultCodes.INTERNAL_ERROR);
    }

    for (String node : targets) {
      deadline.check("disseminating config of " + app.getId());
      try {
        disseminationClient.disseminateAppConfig(node, payload);
      } catch (IOException e) {
        LOG.error("Disseminating config of app {} to node {} failed",
            app.getId(), node, e);
        throw new MeridianException("Disseminating config of app "
            + app.getId() + " to node " + node + " failed", e,
            ResultCodes.DISSEMINATION_FAILED);
      }
    }
    LOG.debug("Disseminated config of app {} to {} of {} nodes",
        app.getId(), targets.size(), nodes.size());
  }

  private void notifyInheritance(Resource from, Resource to) {
    try {
      authorizationClient.createInheritanceRelation(from, to);
    } catch (IOException e) {
      LOG.warn("Failed to create inheritance relation {} -> {}", from, to, e);
    }
  }
}

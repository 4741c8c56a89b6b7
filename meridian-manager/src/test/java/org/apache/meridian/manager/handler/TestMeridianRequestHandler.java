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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.apache.meridian.conf.MeridianConfiguration;
import org.apache.meridian.exceptions.MeridianException;
import org.apache.meridian.exceptions.MeridianException.ResultCodes;
import org.apache.meridian.helpers.AppInfo;
import org.apache.meridian.helpers.NamespaceInfo;
import org.apache.meridian.helpers.NamespaceTree;
import org.apache.meridian.helpers.ResourceKind;
import org.apache.meridian.helpers.SeccompProfileDefinition;
import org.apache.meridian.helpers.SeccompProfileDefinition.SyscallRule;
import org.apache.meridian.helpers.SeccompProfileId;
import org.apache.meridian.manager.AppManager;
import org.apache.meridian.manager.MeridianManager;
import org.apache.meridian.manager.client.AuthorizationClient;
import org.apache.meridian.manager.client.AuthorizationClient.Resource;
import org.apache.meridian.manager.client.ConfigDisseminationClient;
import org.apache.meridian.manager.client.NodeDirectoryClient;
import org.apache.meridian.manager.client.SeccompProfileClient;
import org.apache.meridian.util.Deadline;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests the boundary checks and collaborator calls of
 * {@link MeridianRequestHandler}.
 */
@ExtendWith(MockitoExtension.class)
public class TestMeridianRequestHandler {

  private static final SeccompProfileDefinition DEFINITION =
      new SeccompProfileDefinition("SCMP_ACT_ERRNO",
          Collections.singletonList("x86"),
          Collections.singletonList(new SyscallRule(
              Arrays.asList("read", "write"), "SCMP_ACT_ALLOW")));

  private static final SeccompProfileId ROOT_PROFILE = NamespaceInfo
      .newBuilder().setOrgId("acme").setName("default").build()
      .getSeccompProfileId("x86");
  private static final SeccompProfileId PROD_PROFILE = NamespaceInfo
      .newBuilder().setOrgId("acme").setName("prod").build()
      .getSeccompProfileId("x86");

  @Mock
  private SeccompProfileClient seccomp;
  @Mock
  private NodeDirectoryClient nodeDirectory;
  @Mock
  private ConfigDisseminationClient dissemination;
  @Mock
  private AuthorizationClient authorization;

  private MeridianManager manager;
  private MeridianRequestHandler handler;

  @BeforeEach
  public void setup() throws Exception {
    manager = new MeridianManager(new MeridianConfiguration());
    manager.start();
    handler = new MeridianRequestHandler(manager, seccomp, nodeDirectory,
        dissemination, authorization, new Random(42));
  }

  @AfterEach
  public void cleanup() {
    manager.stop();
  }

  private void addRoot() throws IOException {
    handler.addNamespace(AddNamespaceRequest.newBuilder()
        .setOrgId("acme")
        .setName("default")
        .addQuota("mem", 100)
        .setSeccompStrategy("redefine")
        .setSeccompDefinition(DEFINITION)
        .build(), Deadline.none());
  }

  private void addProd(String strategy) throws IOException {
    handler.addNamespace(AddNamespaceRequest.newBuilder()
        .setOrgId("acme")
        .setName("prod")
        .setParentName("default")
        .addQuota("mem", 40)
        .setSeccompStrategy(strategy)
        .setSeccompDefinition(DEFINITION)
        .build(), Deadline.none());
  }

  private static AddAppRequest.Builder web(String strategy) {
    return AddAppRequest.newBuilder()
        .setOrgId("acme")
        .setNamespaceName("default")
        .setName("web")
        .addQuota("mem", 10)
        .setSeccompStrategy(strategy)
        .setSeccompDefinition(DEFINITION);
  }

  private void assertNamespaceAbsent(String name) {
    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.getNamespace("acme", name, Deadline.none()));
    assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
  }

  @Test
  public void testAddRootRedefinesProfileAndLinksOrg() throws Exception {
    addRoot();

    ArgumentCaptor<SeccompProfileDefinition> submitted =
        ArgumentCaptor.forClass(SeccompProfileDefinition.class);
    verify(seccomp).defineProfile(eq(ROOT_PROFILE), submitted.capture());
    assertEquals("SCMP_ACT_ERRNO", submitted.getValue().getDefaultAction());
    assertThat(submitted.getValue().getArchitectures())
        .containsExactly("x86");
    assertEquals(DEFINITION.getSyscalls(), submitted.getValue().getSyscalls());

    verify(authorization).createInheritanceRelation(
        new Resource("acme", "org"), new Resource("acme/default", "namespace"));
    assertEquals(100, handler.getNamespace("acme", "default", Deadline.none())
        .getTotalQuotas().get(ResourceKind.MEM));
  }

  @Test
  public void testRootCannotInheritProfile() {
    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.addNamespace(AddNamespaceRequest.newBuilder()
            .setOrgId("acme").setName("default").build(), Deadline.none()));
    assertEquals(ResultCodes.INVALID_REQUEST, ex.getResult());
    verifyNoInteractions(seccomp, authorization);
    assertNamespaceAbsent("default");
  }

  @Test
  public void testChildInheritsParentProfile() throws Exception {
    addRoot();
    when(seccomp.getProfile(ROOT_PROFILE)).thenReturn(DEFINITION);

    addProd(null);

    verify(seccomp).defineProfile(PROD_PROFILE, DEFINITION);
    verify(authorization).createInheritanceRelation(
        new Resource("acme/default", "namespace"),
        new Resource("acme/prod", "namespace"));
    assertEquals(60, handler.getNamespace("acme", "default", Deadline.none())
        .getAvailable().get(ResourceKind.MEM));
  }

  @Test
  public void testChildExtendsParentProfile() throws Exception {
    addRoot();
    addProd("EXTEND");

    verify(seccomp).extendProfile(ROOT_PROFILE, PROD_PROFILE,
        DEFINITION.getSyscalls());
  }

  @Test
  public void testDuplicateAndMissingParent() throws Exception {
    addRoot();

    MeridianException ex = assertThrows(MeridianException.class,
        this::addRoot);
    assertEquals(ResultCodes.ENTITY_ALREADY_EXISTS, ex.getResult());

    ex = assertThrows(MeridianException.class,
        () -> handler.addNamespace(AddNamespaceRequest.newBuilder()
            .setOrgId("acme").setName("qa").setParentName("staging")
            .build(), Deadline.none()));
    assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
    verify(seccomp, times(1)).defineProfile(any(), any());
  }

  @Test
  public void testInvalidQuotaRejectedBeforeProfile() {
    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.addNamespace(AddNamespaceRequest.newBuilder()
            .setOrgId("acme").setName("default").addQuota("gpu", 1)
            .setSeccompStrategy("redefine").setSeccompDefinition(DEFINITION)
            .build(), Deadline.none()));
    assertEquals(ResultCodes.UNSUPPORTED_RESOURCE_KIND, ex.getResult());
    verifyNoInteractions(seccomp);
  }

  @Test
  public void testSeccompFailureCreatesNothing() throws Exception {
    doThrow(new IOException("profile service down"))
        .when(seccomp).defineProfile(any(), any());

    MeridianException ex = assertThrows(MeridianException.class,
        this::addRoot);
    assertEquals(ResultCodes.SECCOMP_PROFILE_FAILED, ex.getResult());
    assertNamespaceAbsent("default");
    verifyNoInteractions(authorization);
  }

  @Test
  public void testAuthorizationFailureIsOnlyLogged() throws Exception {
    doThrow(new IOException("authz down")).when(authorization)
        .createInheritanceRelation(any(), any());

    addRoot();

    assertEquals("default", handler.getNamespace("acme", "default",
        Deadline.none()).getName());
  }

  @Test
  public void testRemoveNamespaceRequiresEmptySubtree() throws Exception {
    addRoot();
    addProd("redefine");
    when(nodeDirectory.listOrgOwnedNodes("acme"))
        .thenReturn(Collections.emptyList());
    handler.addApp(web("redefine").setNamespaceName("prod").build(),
        Deadline.none());

    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.removeNamespace("acme", "default", Deadline.none()));
    assertEquals(ResultCodes.NON_EMPTY_SUBTREE, ex.getResult());
    ex = assertThrows(MeridianException.class,
        () -> handler.removeNamespace("acme", "prod", Deadline.none()));
    assertEquals(ResultCodes.NON_EMPTY_SUBTREE, ex.getResult());

    handler.removeApp("acme", "prod", "web", Deadline.none());
    handler.removeNamespace("acme", "prod", Deadline.none());
    handler.removeNamespace("acme", "default", Deadline.none());
    assertNamespaceAbsent("default");

    ex = assertThrows(MeridianException.class,
        () -> handler.removeNamespace("acme", "default", Deadline.none()));
    assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
  }

  @Test
  public void testAddAppDisseminatesToSampledNodes() throws Exception {
    addRoot();
    when(seccomp.getProfile(any())).thenReturn(DEFINITION);
    when(nodeDirectory.listOrgOwnedNodes("acme"))
        .thenReturn(Arrays.asList("n1", "n2", "n3", "n4"));

    handler.addApp(web(null).build(), Deadline.none());

    AppInfo app = manager.getAppManager().getApp("acme/default/web");
    verify(seccomp).defineProfile(app.getSeccompProfileId("x86"),
        DEFINITION);

    ArgumentCaptor<String> nodes = ArgumentCaptor.forClass(String.class);
    ArgumentCaptor<byte[]> payloads = ArgumentCaptor.forClass(byte[].class);
    verify(dissemination, times(2))
        .disseminateAppConfig(nodes.capture(), payloads.capture());
    assertEquals(2, new HashSet<>(nodes.getAllValues()).size());
    assertThat(nodes.getAllValues()).isSubsetOf("n1", "n2", "n3", "n4");

    ApplyAppConfigCommand command = new ObjectMapper().readValue(
        payloads.getValue(), ApplyAppConfigCommand.class);
    assertEquals("acme", command.getOrgId());
    assertEquals("default", command.getNamespaceName());
    assertEquals("web", command.getAppName());
    assertEquals(ImmutableMap.of("mem", 10.0), command.getQuotas());
    assertThat(command.getSeccompProfile()).contains("SCMP_ACT_ERRNO")
        .contains("SCMP_ACT_ALLOW");
  }

  @Test
  public void testDisseminationFailureSurfaces() throws Exception {
    addRoot();
    when(nodeDirectory.listOrgOwnedNodes("acme"))
        .thenReturn(Arrays.asList("n1", "n2"));
    doThrow(new IOException("queue full")).when(dissemination)
        .disseminateAppConfig(any(), any());

    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.addApp(web("redefine").build(), Deadline.none()));
    assertEquals(ResultCodes.DISSEMINATION_FAILED, ex.getResult());
    // the topology change is not undone
    assertEquals("web",
        manager.getAppManager().getApp("acme/default/web").getName());
  }

  @Test
  public void testAddAppToMissingNamespace() {
    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.addApp(web("redefine").setNamespaceName("nope")
            .build(), Deadline.none()));
    assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
    verifyNoInteractions(seccomp, nodeDirectory, dissemination);
  }

  @Test
  public void testHierarchyOfOrgStartsAtRoot() throws Exception {
    addRoot();
    addProd("redefine");

    NamespaceTree tree =
        handler.getNamespaceHierarchy("acme", Deadline.none());
    assertEquals("acme/default", tree.getRoot().getNamespace().getId());
    assertThat(tree.getRoot().getChildren()).hasSize(1);

    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.getNamespaceHierarchy("globex", Deadline.none()));
    assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
  }

  @Test
  public void testSetResources() throws Exception {
    addRoot();
    addProd("redefine");

    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.setNamespaceResources("acme", "prod",
            ImmutableMap.of("mem", 101.0), Deadline.none()));
    assertEquals(ResultCodes.EXCEEDS_PARENT_CAPACITY, ex.getResult());

    handler.setNamespaceResources("acme", "prod",
        ImmutableMap.of("mem", 100.0, "cpu", 0.0), Deadline.none());
    assertEquals(0, handler.getNamespace("acme", "default", Deadline.none())
        .getAvailable().get(ResourceKind.MEM));
  }

  @Test
  public void testProfileLookupFailureIsAbsent() throws Exception {
    when(seccomp.getProfile(ROOT_PROFILE))
        .thenThrow(new IOException("timeout"));
    assertFalse(handler.getSeccompProfile(ROOT_PROFILE).isPresent());
  }

  @Test
  public void testCancelledRequestCreatesNothing() throws Exception {
    addRoot();
    Deadline deadline = Deadline.none();
    deadline.cancel();

    MeridianException ex = assertThrows(MeridianException.class,
        () -> handler.setNamespaceResources("acme", "default",
            ImmutableMap.of("mem", 5.0), deadline));
    assertEquals(ResultCodes.CANCELLED, ex.getResult());
    assertEquals(100, handler.getNamespace("acme", "default", Deadline.none())
        .getTotalQuotas().get(ResourceKind.MEM));
  }

  /** A handler call whose outcome is recorded by result code. */
  private interface Call {
    void run() throws IOException;
  }

  private static Future<Optional<ResultCodes>> submitAfter(
      ExecutorService executor, CountDownLatch go, Call call) {
    return executor.submit(() -> {
      go.await();
      try {
        call.run();
        return Optional.empty();
      } catch (MeridianException e) {
        return Optional.of(e.getResult());
      }
    });
  }

  @Test
  public void testRemoveNamespaceRacingAddApp() throws Exception {
    addRoot();
    AppManager apps = manager.getAppManager();
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      for (int round = 0; round < 20; round++) {
        String name = "team" + round;
        String namespaceId = "acme/" + name;
        handler.addNamespace(AddNamespaceRequest.newBuilder()
            .setOrgId("acme").setName(name).setParentName("default")
            .setSeccompStrategy("redefine").setSeccompDefinition(DEFINITION)
            .build(), Deadline.none());

        CountDownLatch go = new CountDownLatch(1);
        Future<Optional<ResultCodes>> removal = submitAfter(executor, go,
            () -> handler.removeNamespace("acme", name, Deadline.none()));
        AddAppRequest app = AddAppRequest.newBuilder()
            .setOrgId("acme").setNamespaceName(name).setName("web")
            .setSeccompStrategy("redefine").setSeccompDefinition(DEFINITION)
            .build();
        Future<Optional<ResultCodes>> addition = submitAfter(executor, go,
            () -> handler.addApp(app, Deadline.none()));
        go.countDown();
        Optional<ResultCodes> removed = removal.get(30, TimeUnit.SECONDS);
        Optional<ResultCodes> added = addition.get(30, TimeUnit.SECONDS);

        if (removed.isPresent()) {
          // the app won: the namespace stays with its app
          assertEquals(Optional.of(ResultCodes.NON_EMPTY_SUBTREE), removed);
          assertEquals(Optional.empty(), added);
          assertThat(apps.listApps(namespaceId)).extracting(AppInfo::getName)
              .containsExactly("web");
        } else {
          // the removal won: no app was attached to a removed namespace
          assertEquals(Optional.of(ResultCodes.ENTITY_NOT_FOUND), added);
          assertNamespaceAbsent(name);
          MeridianException ex = assertThrows(MeridianException.class,
              () -> apps.getApp(namespaceId + "/web"));
          assertEquals(ResultCodes.ENTITY_NOT_FOUND, ex.getResult());
        }
      }
    } finally {
      executor.shutdownNow();
    }
  }
}

/*
 * Copyright © 2017 Google Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.enterprise.orgsource.metadata.retrieval;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.TargetWorkspace;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.batch.ChunkedExecutor;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliLocator;
import com.google.enterprise.orgsource.sdk.command.CommandExecutor;
import com.google.enterprise.orgsource.sdk.command.CommandResult;
import java.util.List;
import java.util.Map;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

/** Tests for {@link TargetDiscovery}. */
@RunWith(MockitoJUnitRunner.class)
public class TargetDiscoveryTest {
  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Mock private CommandExecutor mockExecutor;
  @Mock private CliLocator mockLocator;

  private ChunkedExecutor chunkedExecutor;
  private TargetDiscovery discovery;

  @Before
  public void setUp() throws Exception {
    chunkedExecutor = new ChunkedExecutor("test");
    HandlerContext context = new HandlerContext(mockExecutor, mockLocator,
        new TargetWorkspace(temporaryFolder.getRoot().toPath()), chunkedExecutor, "58.0", 0);
    discovery = new TargetDiscovery(context, 0);
    lenient().when(mockLocator.locate()).thenReturn("sf");
    lenient().when(mockExecutor.getDefaultTimeoutMillis()).thenReturn(30000L);
  }

  @After
  public void tearDown() {
    chunkedExecutor.close();
  }

  private static Map<String, Object> org(String username, String orgId, String alias) {
    ImmutableMap.Builder<String, Object> org = ImmutableMap.builder();
    if (username != null) {
      org.put("username", username);
    }
    if (orgId != null) {
      org.put("orgId", orgId);
    }
    if (alias != null) {
      org.put("alias", alias);
    }
    return org.build();
  }

  @Test
  public void parse_groupsInOrder_dedupedByUsername() {
    Map<String, Object> result = ImmutableMap.of(
        "scratchOrgs", ImmutableList.of(org("scratch@x.com", "00D000000000003", null)),
        "devHubs", ImmutableList.of(
            org("hub@x.com", "00D000000000002AAA", "hub"),
            org("admin@x.com", "00D000000000001AAA", "prod")),
        "nonScratchOrgs", ImmutableList.of(
            org("admin@x.com", "00D000000000001AAA", "prod"),
            org(null, "00D000000000009AAA", "orphan")));
    assertEquals(ImmutableList.of(
            new Target("00D000000000001AAA", "admin@x.com", "prod"),
            new Target("00D000000000002AAA", "hub@x.com", "hub"),
            new Target("00D000000000003", "scratch@x.com", null)),
        TargetDiscovery.parse(result));
  }

  @Test
  public void parse_invalidOrgId_keyedByUsername() {
    List<Target> targets = TargetDiscovery.parse(ImmutableMap.of(
        "other", ImmutableList.of(org("dev@x.com", "not-an-id", null))));
    assertEquals(ImmutableList.of(new Target("dev@x.com", "dev@x.com", null)), targets);
  }

  @Test
  public void parse_noGroups_empty() {
    assertTrue(TargetDiscovery.parse(ImmutableMap.of()).isEmpty());
  }

  @Test
  public void discover_runsOrgList() throws Exception {
    when(mockExecutor.execute(eq(CliCommands.orgList("sf")), isNull(), eq(30000L)))
        .thenReturn(new CommandResult(0, "{\"status\":0,\"result\":{\"sandboxes\":["
            + "{\"username\":\"qa@x.com.qa\",\"orgId\":\"00D000000000004AAA\","
            + "\"alias\":\"qa\"}]}}", ""));
    assertEquals(ImmutableList.of(new Target("00D000000000004AAA", "qa@x.com.qa", "qa")),
        discovery.discover());
  }

  @Test
  public void discover_commandFails_throwsException() throws Exception {
    when(mockExecutor.execute(eq(CliCommands.orgList("sf")), isNull(), anyLong()))
        .thenReturn(new CommandResult(1, "", "No authorization information found"));
    try {
      discovery.discover();
      fail("expected RetrievalException");
    } catch (RetrievalException e) {
      assertEquals(ErrorType.EXTERNAL_TOOL, e.getErrorType());
      assertEquals("Command failed with code 1: No authorization information found",
          e.getMessage());
    }
  }
}

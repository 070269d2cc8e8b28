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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Finds the orgs the command line tool is authorized against.
 *
 * <p>Orgs are read from every group of the {@code org list} result, scratch orgs last, and
 * reported once per username. An org whose id is not a valid Salesforce id is keyed by its
 * username instead.
 */
public class TargetDiscovery {
  private static final Logger logger = Logger.getLogger(TargetDiscovery.class.getName());

  @VisibleForTesting
  static final List<String> ORG_GROUPS =
      ImmutableList.of("nonScratchOrgs", "devHubs", "sandboxes", "other", "scratchOrgs");

  private final HandlerContext context;
  private final int retryCount;

  public TargetDiscovery(HandlerContext context, int retryCount) {
    this.context = checkNotNull(context, "context can not be null");
    this.retryCount = retryCount;
  }

  /**
   * Lists the authorized orgs.
   *
   * @throws RetrievalException if the tool is missing or the listing fails
   */
  public List<Target> discover() throws RetrievalException {
    String cli = context.getCliLocator().locate();
    CliResponse response = CliResponse.run(context.getCommandExecutor(),
        CliCommands.orgList(cli), null,
        context.getCommandExecutor().getDefaultTimeoutMillis(),
        context.retryPolicy(retryCount));
    List<Target> targets = parse(response.getResultObject());
    logger.log(Level.INFO, "Discovered {0} authorized orgs", targets.size());
    return targets;
  }

  @VisibleForTesting
  static List<Target> parse(Map<String, Object> result) {
    Map<String, Target> byUsername = new LinkedHashMap<>();
    for (String group : ORG_GROUPS) {
      for (Map<String, Object> org : CliResponse.getRecords(result, group)) {
        String username = CliResponse.getString(org, "username");
        if (Strings.isNullOrEmpty(username)) {
          logger.log(Level.FINE, "Skipping org without username in {0}", group);
          continue;
        }
        String orgId = CliResponse.getString(org, "orgId");
        byUsername.putIfAbsent(username, new Target(
            CliCommands.isSalesforceId(orgId) ? orgId : username,
            username,
            CliResponse.getString(org, "alias")));
      }
    }
    return ImmutableList.copyOf(byUsername.values());
  }
}

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
package com.google.enterprise.orgsource.metadata.handlers;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.enterprise.orgsource.metadata.AbstractMetadataHandler;
import com.google.enterprise.orgsource.metadata.BuiltinTypes;
import com.google.enterprise.orgsource.metadata.Content;
import com.google.enterprise.orgsource.metadata.HandlerConfig;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.Item;
import com.google.enterprise.orgsource.metadata.TextContent;
import com.google.enterprise.orgsource.metadata.TypeDefinition;
import com.google.enterprise.orgsource.metadata.analysis.ApexAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.ApexAnalysis.ClassMetrics;
import com.google.enterprise.orgsource.metadata.analysis.ApexAnalysis.TriggerUsage;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handler for Apex classes and Apex triggers. One instance serves both types.
 *
 * <p>Every artifact is listed twice: the source file (e.g. {@code Foo.cls}) whose body is read
 * through the tooling API, and its descriptor (e.g. {@code Foo.cls-meta.xml}) which is retrieved
 * into a local project.
 */
public class ApexHandler extends AbstractMetadataHandler {
  private static final Logger logger = Logger.getLogger(ApexHandler.class.getName());
  private static final String META_XML = "-meta.xml";
  /** Names per metrics query, keeping each query well below the tool's length limit. */
  @VisibleForTesting static final int NAMES_PER_QUERY = 50;

  public static final ImmutableList<String> TYPES =
      ImmutableList.of(BuiltinTypes.APEX_CLASS, BuiltinTypes.APEX_TRIGGER);

  /** Trigger usage flags and the event each stands for, in firing order. */
  private static final ImmutableMap<String, String> TRIGGER_EVENTS = ImmutableMap.of(
      "UsageBeforeInsert", "before insert",
      "UsageAfterInsert", "after insert",
      "UsageBeforeUpdate", "before update",
      "UsageAfterUpdate", "after update",
      "UsageBeforeDelete", "before delete",
      "UsageAfterDelete", "after delete",
      "UsageAfterUndelete", "after undelete");

  public ApexHandler(HandlerConfig config, HandlerContext context) {
    super(BuiltinTypes.get(BuiltinTypes.APEX_CLASS), config, context);
  }

  @Override
  public Set<String> getSupportedTypes() {
    return ImmutableSet.copyOf(TYPES);
  }

  /** Lists classes followed by triggers. */
  @Override
  public List<Item> listItems(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<Item> items = new ArrayList<>();
    for (String typeName : TYPES) {
      items.addAll(listItems(targetId, targetIdentifier, typeName));
    }
    return items;
  }

  @Override
  public List<Item> listItems(String targetId, String targetIdentifier, String typeName)
      throws RetrievalException {
    TypeDefinition kind = kindOf(typeName);
    List<Item> items = new ArrayList<>();
    for (String fullName : listNames(typeName, targetIdentifier)) {
      items.add(new Item.Builder(targetId, typeName, fullName)
          .setName(fullName + kind.getFileExtension())
          .build());
      items.add(new Item.Builder(targetId, typeName, fullName)
          .setName(fullName + kind.getFileExtension() + META_XML)
          .setMetaFile(true)
          .build());
    }
    return items;
  }

  private List<String> listNames(String typeName, String targetIdentifier)
      throws RetrievalException {
    List<String> names = new ArrayList<>();
    for (Map<String, Object> record : listMetadataRecords(typeName, targetIdentifier)) {
      String fullName = CliResponse.getString(record, "fullName");
      if (fullName != null) {
        names.add(fullName);
      }
    }
    return names;
  }

  @Override
  protected Content retrieveContent(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    String typeName = item.getTypeName();
    if (!supports(typeName)) {
      throw contentFailure("ApexHandler does not serve " + typeName);
    }
    if (item.isMetaFile()) {
      Path directory = retrieveMember(targetId, targetIdentifier, typeName, item.getFullName());
      return TextContent.of(
          readRetrievedFile(directory, descriptorPaths(typeName, item.getFullName())));
    }
    CliResponse response = runCli(CliCommands.toolingQuery(
        cli(), bodyQuery(typeName, item.getFullName()), targetIdentifier), null);
    List<Map<String, Object>> records = response.getRecords();
    if (records.isEmpty()) {
      throw contentFailure(
          String.format("No %s found with name: %s", typeName, item.getFullName()));
    }
    return TextContent.of(Strings.nullToEmpty(CliResponse.getString(records.get(0), "Body")));
  }

  @VisibleForTesting
  static String bodyQuery(String typeName, String fullName) {
    String fields = BuiltinTypes.APEX_TRIGGER.equals(typeName)
        ? "Id, Name, Body, ApiVersion, Status, IsValid, TableEnumOrId"
        : "Id, Name, Body, ApiVersion, Status, IsValid";
    return String.format("SELECT %s FROM %s WHERE Name = '%s'",
        fields, typeName, CliCommands.escapeSoqlLiteral(fullName));
  }

  private static List<String> descriptorPaths(String typeName, String fullName) {
    String fileName = fullName + kindOf(typeName).getFileExtension() + META_XML;
    return BuiltinTypes.APEX_TRIGGER.equals(typeName)
        ? ImmutableList.of("triggers/" + fileName)
        : ImmutableList.of("classes/" + fileName);
  }

  private static TypeDefinition kindOf(String typeName) {
    checkArgument(TYPES.contains(checkNotNull(typeName)),
        "ApexHandler serves only %s, not %s", TYPES, typeName);
    return BuiltinTypes.get(typeName);
  }

  /**
   * Collects class metrics and trigger usage of the target. A failing metrics query is logged
   * and its classes or triggers are left out.
   *
   * @throws RetrievalException if the classes or triggers cannot be listed
   */
  public ApexAnalysis analyze(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<String> classNames = listNames(BuiltinTypes.APEX_CLASS, targetIdentifier);
    List<String> triggerNames = listNames(BuiltinTypes.APEX_TRIGGER, targetIdentifier);
    List<ClassMetrics> classes = new ArrayList<>();
    for (Map<String, Object> record : queryByNames(targetIdentifier,
        "SELECT Name, LengthWithoutComments, NumLinesCovered, NumLinesUncovered FROM ApexClass",
        classNames)) {
      String name = CliResponse.getString(record, "Name");
      if (name != null) {
        classes.add(new ClassMetrics(name,
            CliResponse.getLong(record, "LengthWithoutComments", 0),
            CliResponse.getLong(record, "NumLinesCovered", 0),
            CliResponse.getLong(record, "NumLinesUncovered", 0)));
      }
    }
    List<TriggerUsage> triggers = new ArrayList<>();
    for (Map<String, Object> record : queryByNames(targetIdentifier,
        "SELECT Name, TableEnumOrId, " + Joiner.on(", ").join(TRIGGER_EVENTS.keySet())
            + " FROM ApexTrigger",
        triggerNames)) {
      String name = CliResponse.getString(record, "Name");
      if (name != null) {
        triggers.add(triggerUsage(name, record));
      }
    }
    logger.log(Level.FINE, "Analyzed {0} classes and {1} triggers of {2}",
        new Object[] {classes.size(), triggers.size(), targetId});
    return new ApexAnalysis(classes, triggers);
  }

  private static TriggerUsage triggerUsage(String name, Map<String, Object> record) {
    List<String> events = new ArrayList<>();
    for (Map.Entry<String, String> event : TRIGGER_EVENTS.entrySet()) {
      if (CliResponse.getBoolean(record, event.getKey())) {
        events.add(event.getValue());
      }
    }
    String objectName = CliResponse.getString(record, "TableEnumOrId");
    return new TriggerUsage(name,
        Strings.isNullOrEmpty(objectName) ? TriggerUsage.UNKNOWN_OBJECT : objectName, events);
  }

  /** Runs {@code select} restricted to {@code names}, {@value #NAMES_PER_QUERY} at a time. */
  private List<Map<String, Object>> queryByNames(
      String targetIdentifier, String select, List<String> names) {
    List<Map<String, Object>> records = new ArrayList<>();
    for (List<String> chunk : Lists.partition(names, NAMES_PER_QUERY)) {
      String query = select + " WHERE Name IN (" + Joiner.on(", ").join(Lists.transform(chunk,
          name -> "'" + CliCommands.escapeSoqlLiteral(name) + "'")) + ")";
      try {
        records.addAll(
            runCli(CliCommands.toolingQuery(cli(), query, targetIdentifier), null).getRecords());
      } catch (RetrievalException | IllegalArgumentException e) {
        logger.log(Level.WARNING, "Apex metrics query failed for " + chunk, e);
      }
    }
    return records;
  }
}

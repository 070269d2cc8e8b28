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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.enterprise.orgsource.metadata.AbstractMetadataHandler;
import com.google.enterprise.orgsource.metadata.BuiltinTypes;
import com.google.enterprise.orgsource.metadata.Content;
import com.google.enterprise.orgsource.metadata.HandlerConfig;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.Item;
import com.google.enterprise.orgsource.metadata.TextContent;
import com.google.enterprise.orgsource.metadata.TypeDefinition;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis.FieldDescription;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis.ObjectDescription;
import com.google.enterprise.orgsource.metadata.analysis.ObjectAnalysis.ValidationRuleDescription;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.command.CliCommands;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Handler for custom objects. The object descriptor is retrieved with its fields and validation
 * rules, which are declared as child types of the definition.
 */
public class CustomObjectHandler extends AbstractMetadataHandler {
  private static final Logger logger = Logger.getLogger(CustomObjectHandler.class.getName());

  public CustomObjectHandler(
      TypeDefinition definition, HandlerConfig config, HandlerContext context) {
    super(definition, config, context);
  }

  @Override
  public List<Item> listItems(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<Item> items = new ArrayList<>();
    for (Map<String, Object> record :
        listMetadataRecords(BuiltinTypes.CUSTOM_OBJECT, targetIdentifier)) {
      String fullName = CliResponse.getString(record, "fullName");
      if (fullName != null) {
        items.add(new Item.Builder(targetId, definition.getName(), fullName)
            .setName(fullName + definition.getFileExtension())
            .build());
      }
    }
    return sortedByName(items);
  }

  @Override
  protected Content retrieveContent(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    String name = item.getFullName();
    Path directory =
        retrieveMember(targetId, targetIdentifier, BuiltinTypes.CUSTOM_OBJECT, name);
    return TextContent.of(readRetrievedFile(directory, ImmutableList.of(
        "objects/" + name + "/" + name + definition.getFileExtension(),
        "objects/" + name + ".object")));
  }

  /**
   * Describes every custom object of the target: custom fields, validation rules and the
   * objects its fields reference. An object that cannot be described is kept without fields and
   * rules.
   *
   * @throws RetrievalException if the objects cannot be listed
   */
  public ObjectAnalysis analyze(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<String> names = listItems(targetId, targetIdentifier).stream()
        .map(Item::getFullName)
        .collect(Collectors.toList());
    ProcessingResult<ObjectDescription> described = context.getChunkedExecutor().process(
        names, config.getMaxConcurrency(), config.isParallel(),
        name -> describe(name, targetIdentifier));
    return new ObjectAnalysis(described.getSuccess().stream()
        .sorted(Comparator.comparing(ObjectDescription::getName))
        .collect(Collectors.toList()));
  }

  @VisibleForTesting
  ObjectDescription describe(String objectName, String targetIdentifier) {
    Map<String, Object> result;
    try {
      result = runCli(CliCommands.describeSObject(cli(), objectName, targetIdentifier), null)
          .getResultObject();
    } catch (RetrievalException | IllegalArgumentException e) {
      logger.log(Level.WARNING, "Failed to describe object " + objectName, e);
      return new ObjectDescription(objectName, objectName, ImmutableList.of(),
          ImmutableList.of());
    }
    List<FieldDescription> fields = new ArrayList<>();
    for (Map<String, Object> field : CliResponse.getRecords(result, "fields")) {
      String name = CliResponse.getString(field, "name");
      if (name == null || !CliResponse.getBoolean(field, "custom")) {
        continue;
      }
      fields.add(new FieldDescription(name,
          CliResponse.getString(field, "label"),
          CliResponse.getString(field, "type"),
          !CliResponse.getBoolean(field, "nillable")
              && !CliResponse.getBoolean(field, "defaultedOnCreate"),
          CliResponse.getBoolean(field, "unique"),
          CliResponse.getStrings(field, "referenceTo")));
    }
    return new ObjectDescription(objectName, CliResponse.getString(result, "label"), fields,
        validationRules(objectName, targetIdentifier));
  }

  private List<ValidationRuleDescription> validationRules(
      String objectName, String targetIdentifier) {
    String query = String.format("SELECT Id, ValidationName, Active, Description, ErrorMessage "
            + "FROM ValidationRule WHERE EntityDefinition.QualifiedApiName = '%s'",
        CliCommands.escapeSoqlLiteral(objectName));
    List<ValidationRuleDescription> rules = new ArrayList<>();
    try {
      for (Map<String, Object> record :
          runCli(CliCommands.toolingQuery(cli(), query, targetIdentifier), null).getRecords()) {
        String name = CliResponse.getString(record, "ValidationName");
        if (name != null) {
          rules.add(new ValidationRuleDescription(name,
              CliResponse.getBoolean(record, "Active"),
              CliResponse.getString(record, "ErrorMessage"),
              CliResponse.getString(record, "Description")));
        }
      }
    } catch (RetrievalException e) {
      logger.log(Level.WARNING, "Failed to query validation rules of " + objectName, e);
      return ImmutableList.of();
    }
    return rules;
  }
}

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
import com.google.common.collect.ImmutableMap;
import com.google.enterprise.orgsource.metadata.AbstractMetadataHandler;
import com.google.enterprise.orgsource.metadata.BuiltinTypes;
import com.google.enterprise.orgsource.metadata.Content;
import com.google.enterprise.orgsource.metadata.HandlerConfig;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.Item;
import com.google.enterprise.orgsource.metadata.TextContent;
import com.google.enterprise.orgsource.metadata.TypeDefinition;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Handler for single XML document types that can only be obtained by retrieving them into a
 * local project, such as permission sets, flows and layouts.
 */
public class GeneralMetadataHandler extends AbstractMetadataHandler {

  /** Project sub-directory of each type, where it differs from the lower-cased type name. */
  @VisibleForTesting
  static final ImmutableMap<String, String> DIRECTORIES =
      new ImmutableMap.Builder<String, String>()
          .put(BuiltinTypes.PERMISSION_SET, "permissionsets")
          .put(BuiltinTypes.PROFILE, "profiles")
          .put(BuiltinTypes.CUSTOM_LABELS, "labels")
          .put(BuiltinTypes.CUSTOM_METADATA, "customMetadata")
          .put(BuiltinTypes.FLOW, "flows")
          .put(BuiltinTypes.LAYOUT, "layouts")
          .put(BuiltinTypes.EMAIL_TEMPLATE, "email")
          .put(BuiltinTypes.STATIC_RESOURCE, "staticresources")
          .put(BuiltinTypes.CUSTOM_SETTING, "objects")
          .put(BuiltinTypes.REPORT, "reports")
          .put(BuiltinTypes.DASHBOARD, "dashboards")
          .build();

  /** Built-in types served by this handler. */
  public static final ImmutableList<String> TYPES = DIRECTORIES.keySet().asList();

  private static final String SOURCE_FORMAT_SUFFIX = "-meta.xml";

  public GeneralMetadataHandler(
      TypeDefinition definition, HandlerConfig config, HandlerContext context) {
    super(definition, config, context);
  }

  @Override
  public List<Item> listItems(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<Item> items = new ArrayList<>();
    for (Map<String, Object> record :
        listMetadataRecords(definition.getCliTypeName(), targetIdentifier)) {
      String fullName = CliResponse.getString(record, "fullName");
      if (fullName == null) {
        continue;
      }
      items.add(new Item.Builder(targetId, definition.getName(), fullName)
          .setName(fullName + definition.getFileExtension())
          .build());
    }
    return sortedByName(items);
  }

  @Override
  protected Content retrieveContent(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    Path directory = retrieveMember(
        targetId, targetIdentifier, definition.getCliTypeName(), item.getFullName());
    return TextContent.of(readRetrievedFile(directory, candidatePaths(item.getFullName())));
  }

  /**
   * Relative locations of a retrieved member, in source format first and in metadata format
   * ({@code .permissionset} instead of {@code .permissionset-meta.xml}) second.
   */
  @VisibleForTesting
  List<String> candidatePaths(String fullName) {
    String directory = DIRECTORIES.getOrDefault(
        definition.getName(), definition.getName().toLowerCase(Locale.ROOT));
    String extension = definition.getFileExtension();
    ImmutableList.Builder<String> paths = ImmutableList.builder();
    paths.add(directory + "/" + fullName + extension);
    if (extension.endsWith(SOURCE_FORMAT_SUFFIX)) {
      paths.add(directory + "/" + fullName
          + extension.substring(0, extension.length() - SOURCE_FORMAT_SUFFIX.length()));
    }
    return paths.build();
  }
}

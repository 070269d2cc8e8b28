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
import com.google.enterprise.orgsource.metadata.BundleContent;
import com.google.enterprise.orgsource.metadata.BundleContent.BundleKind;
import com.google.enterprise.orgsource.metadata.Content;
import com.google.enterprise.orgsource.metadata.HandlerConfig;
import com.google.enterprise.orgsource.metadata.HandlerContext;
import com.google.enterprise.orgsource.metadata.Item;
import com.google.enterprise.orgsource.metadata.ItemContent;
import com.google.enterprise.orgsource.metadata.TargetWorkspace;
import com.google.enterprise.orgsource.metadata.TypeDefinition;
import com.google.enterprise.orgsource.metadata.analysis.BundleStructure;
import com.google.enterprise.orgsource.metadata.analysis.LwcAnalysis;
import com.google.enterprise.orgsource.sdk.RetrievalException;
import com.google.enterprise.orgsource.sdk.RetrievalException.ErrorType;
import com.google.enterprise.orgsource.sdk.batch.ProcessingResult;
import com.google.enterprise.orgsource.sdk.command.CliResponse;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Handler for Lightning web component bundles. */
public class LwcHandler extends AbstractMetadataHandler {
  private static final Logger logger = Logger.getLogger(LwcHandler.class.getName());
  static final String ID_INFIX = "lwc";
  static final String DIRECTORY = "lwc";
  private static final String DESCRIPTOR_SUFFIX = ".js-meta.xml";
  private static final Pattern API_VERSION =
      Pattern.compile("<apiVersion>\\s*([^<\\s]+)\\s*</apiVersion>");
  private static final Pattern EXPOSED = Pattern.compile("<isExposed>\\s*true\\s*</isExposed>");

  public LwcHandler(TypeDefinition definition, HandlerConfig config, HandlerContext context) {
    super(definition, config, context);
  }

  @Override
  public List<Item> listItems(String targetId, String targetIdentifier)
      throws RetrievalException {
    List<Item> items = new ArrayList<>();
    for (Map<String, Object> record :
        listMetadataRecords(definition.getCliTypeName(), targetIdentifier)) {
      String fullName = CliResponse.getString(record, "fullName");
      if (fullName != null) {
        items.add(new Item.Builder(targetId, definition.getName(), fullName)
            .setIdInfix(ID_INFIX)
            .build());
      }
    }
    return sortedByName(items);
  }

  @Override
  protected Content retrieveContent(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    Path directory = retrieveMember(
        targetId, targetIdentifier, definition.getCliTypeName(), item.getFullName());
    Path bundleDirectory = TargetWorkspace
        .findRetrievedDirectory(directory, DIRECTORY + "/" + item.getFullName())
        .orElseThrow(() -> contentFailure(
            "Could not find retrieved LWC bundle " + item.getFullName()));
    try {
      return BundleContent.readFrom(
          bundleDirectory, mainFile(item), BundleKind.LWC, this::isBundleFile);
    } catch (IOException e) {
      throw new RetrievalException.Builder()
          .setErrorType(ErrorType.CONTENT)
          .setErrorMessage("Failed to read LWC bundle " + bundleDirectory + ": " + e.getMessage())
          .setCause(e)
          .build();
    }
  }

  @Override
  protected Content emptyContent(Item item) {
    return BundleContent.empty(mainFile(item), BundleKind.LWC);
  }

  /**
   * Fetches every bundle of the target and summarizes files, API versions and exposure. Bundles
   * that cannot be fetched are logged and left out.
   *
   * @throws RetrievalException if the bundles cannot be listed
   */
  public LwcAnalysis analyze(String targetId, String targetIdentifier)
      throws RetrievalException {
    ProcessingResult<ItemContent> fetched =
        fetchContentBatch(targetId, targetIdentifier, listItems(targetId, targetIdentifier));
    for (ProcessingResult.Failure failure : fetched.getFailures()) {
      logger.log(Level.WARNING, "Skipping LWC bundle {0}: {1}",
          new Object[] {((Item) failure.getInput()).getFullName(), failure.getError()});
    }
    List<LwcAnalysis.Component> components = new ArrayList<>();
    for (ItemContent content : fetched.getSuccess()) {
      components.add(component(content.getItem().getFullName(), content.getContent().asBundle()));
    }
    return new LwcAnalysis(components);
  }

  private LwcAnalysis.Component component(String name, BundleContent bundle) {
    String descriptor = bundle.getFiles().getOrDefault(name + DESCRIPTOR_SUFFIX, "");
    Matcher version = API_VERSION.matcher(descriptor);
    return new LwcAnalysis.Component(name, ImmutableList.copyOf(bundle.getFiles().keySet()),
        version.find() ? version.group(1) : context.getApiVersion(),
        EXPOSED.matcher(descriptor).find());
  }

  /**
   * Fetches {@code item} and tells which file is its template, script, style sheet, descriptor,
   * icon and test.
   *
   * @throws RetrievalException if the bundle cannot be fetched
   */
  public BundleStructure getBundleStructure(String targetId, String targetIdentifier, Item item)
      throws RetrievalException {
    return structureOf(item.getFullName(),
        retrieveContent(targetId, targetIdentifier, item).asBundle());
  }

  @VisibleForTesting
  static BundleStructure structureOf(String name, BundleContent bundle) {
    Map<String, String> roles = new LinkedHashMap<>();
    for (String file : bundle.getFiles().keySet()) {
      String role = roleOf(file);
      if (role != null) {
        roles.putIfAbsent(role, file);
      }
    }
    if (bundle.getFiles().containsKey(name + ".js")) {
      roles.put(BundleStructure.JS, name + ".js");
    }
    return new BundleStructure(name, roles);
  }

  private static String roleOf(String file) {
    if (file.endsWith(DESCRIPTOR_SUFFIX)) {
      return BundleStructure.XML;
    } else if (file.endsWith(".js")) {
      return file.toLowerCase(Locale.ROOT).contains("test")
          ? BundleStructure.TEST : BundleStructure.JS;
    } else if (file.endsWith(".html")) {
      return BundleStructure.HTML;
    } else if (file.endsWith(".css")) {
      return BundleStructure.CSS;
    } else if (file.endsWith(".svg")) {
      return BundleStructure.SVG;
    }
    return null;
  }

  private boolean isBundleFile(String fileName) {
    return definition.getFileExtensions().stream().anyMatch(fileName::endsWith);
  }

  private static String mainFile(Item item) {
    return item.getFullName() + ".js";
  }
}
